package com.termbridge.session.error;

public class SessionNotFoundException extends TerminalBridgeException {

    private final String sessionName;

    public SessionNotFoundException(String sessionName) {
        super(ErrorCode.SESSION_NOT_FOUND, "Session '" + sessionName + "' not found");
        this.sessionName = sessionName;
    }

    public String getSessionName() {
        return sessionName;
    }
}
