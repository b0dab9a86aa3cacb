package com.termbridge.session.error;

/**
 * Opening the remote shell failed. The code tells authentication, reachability
 * and timeout failures apart.
 */
public class ConnectionFailedException extends TerminalBridgeException {

    public ConnectionFailedException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
