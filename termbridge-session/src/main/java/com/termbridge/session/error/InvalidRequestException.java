package com.termbridge.session.error;

/**
 * Malformed argument to a session operation: a bad name, terminal size or
 * signal.
 */
public class InvalidRequestException extends TerminalBridgeException {

    public InvalidRequestException(ErrorCode code, String message) {
        super(code, message);
    }
}
