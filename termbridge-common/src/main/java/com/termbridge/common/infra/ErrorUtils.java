package com.termbridge.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Safe message and code extraction from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Human-readable message, never null.
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        Throwable cause = unwrap(err);
        String msg = cause.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return cause.getClass().getSimpleName();
    }

    /**
     * Structured error code of a {@link CodedError}, or null.
     */
    public static String errorCode(Throwable err) {
        if (err == null)
            return null;
        Throwable cause = unwrap(err);
        if (cause instanceof CodedError coded && coded.errorCode() != null) {
            return coded.errorCode();
        }
        return null;
    }

    /**
     * Strip the wrappers added by {@code CompletableFuture} and
     * {@code Future.get()}.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Exceptions that carry a machine-readable code.
     */
    public interface CodedError {
        String errorCode();
    }
}
