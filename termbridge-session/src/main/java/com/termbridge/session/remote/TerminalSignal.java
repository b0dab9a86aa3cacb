package com.termbridge.session.remote;

import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.error.InvalidRequestException;

import java.util.Locale;

/**
 * Signals deliverable to the foreground process, as the control character
 * the terminal line discipline maps to each.
 */
public enum TerminalSignal {
    SIGINT("\u0003"),
    SIGTERM("\u0004"),
    SIGQUIT("\u0004"),
    SIGTSTP("\u001a");

    private final String controlSequence;

    TerminalSignal(String controlSequence) {
        this.controlSequence = controlSequence;
    }

    public String controlSequence() {
        return controlSequence;
    }

    /**
     * Accepts "SIGINT", "sigint" and "INT".
     */
    public static TerminalSignal parse(String name) {
        if (name != null) {
            String upper = name.trim().toUpperCase(Locale.ROOT);
            if (!upper.startsWith("SIG")) {
                upper = "SIG" + upper;
            }
            for (TerminalSignal signal : values()) {
                if (signal.name().equals(upper)) {
                    return signal;
                }
            }
        }
        throw new InvalidRequestException(ErrorCode.UNSUPPORTED_SIGNAL, "Unsupported signal: " + name);
    }
}
