package com.termbridge.session.error;

public class SessionDisconnectedException extends TerminalBridgeException {

    public SessionDisconnectedException(String sessionName) {
        super(ErrorCode.SESSION_DISCONNECTED, "Session '" + sessionName + "' disconnected");
    }
}
