package com.termbridge.session.remote;

import com.termbridge.session.error.ConnectionFailedException;
import com.termbridge.session.error.ErrorCode;

import java.net.SocketTimeoutException;
import java.util.Locale;

/**
 * Maps SSH client failures onto connect error codes.
 */
final class ConnectFailures {

    private ConnectFailures() {
    }

    static ConnectionFailedException classify(String target, Throwable error) {
        ErrorCode code = codeFor(error);
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        String message = switch (code) {
            case AUTHENTICATION_FAILED -> "Authentication failed for " + target + ": " + reason;
            case CONNECT_TIMEOUT -> "Timed out connecting to " + target + ": " + reason;
            default -> "Cannot reach " + target + ": " + reason;
        };
        return new ConnectionFailedException(code, message, error);
    }

    static ErrorCode codeFor(Throwable error) {
        String msg = error.getMessage() != null ? error.getMessage().toLowerCase(Locale.ROOT) : "";
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (msg.contains("auth fail") || msg.contains("auth cancel") || msg.contains("userauth")
                || msg.contains("invalid privatekey") || msg.contains("hostkey")) {
            return ErrorCode.AUTHENTICATION_FAILED;
        }
        if (root instanceof SocketTimeoutException || msg.contains("timeout") || msg.contains("timed out")
                || msg.contains("did not respond")) {
            return ErrorCode.CONNECT_TIMEOUT;
        }
        // UnknownHostException, ConnectException, NoRouteToHostException and anything unrecognized
        return ErrorCode.HOST_UNREACHABLE;
    }
}
