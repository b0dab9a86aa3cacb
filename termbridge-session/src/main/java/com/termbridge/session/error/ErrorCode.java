package com.termbridge.session.error;

/**
 * Machine-readable failure codes surfaced to both protocol sides.
 */
public enum ErrorCode {
    INVALID_COMMAND,
    SESSION_TERMINATING_COMMAND,
    INVALID_COMMAND_ID,
    INVALID_SESSION_NAME,
    INVALID_CONNECTION_CONFIG,
    QUEUE_FULL,
    SESSION_NOT_FOUND,
    DUPLICATE_SESSION,
    SESSION_BUSY,
    BROWSER_COMMANDS_EXECUTED,
    SESSION_DISCONNECTED,
    TRANSPORT_FAILURE,
    COMMAND_CANCELLED,
    AUTHENTICATION_FAILED,
    HOST_UNREACHABLE,
    CONNECT_TIMEOUT,
    INVALID_TERMINAL_SIZE,
    UNSUPPORTED_SIGNAL
}
