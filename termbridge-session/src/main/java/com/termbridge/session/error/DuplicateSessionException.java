package com.termbridge.session.error;

public class DuplicateSessionException extends TerminalBridgeException {

    public DuplicateSessionException(String sessionName) {
        super(ErrorCode.DUPLICATE_SESSION, "Session '" + sessionName + "' already exists");
    }
}
