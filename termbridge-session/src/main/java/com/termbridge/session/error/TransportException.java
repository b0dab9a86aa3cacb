package com.termbridge.session.error;

/**
 * The remote channel failed while a command was running.
 */
public class TransportException extends TerminalBridgeException {

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_FAILURE, message, cause);
    }
}
