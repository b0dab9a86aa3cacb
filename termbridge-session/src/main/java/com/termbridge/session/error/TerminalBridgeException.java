package com.termbridge.session.error;

import com.termbridge.common.infra.ErrorUtils;

/**
 * Base class of every failure the session engine reports to callers.
 */
public class TerminalBridgeException extends RuntimeException implements ErrorUtils.CodedError {

    private final ErrorCode code;

    public TerminalBridgeException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TerminalBridgeException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String errorCode() {
        return code.name();
    }
}
