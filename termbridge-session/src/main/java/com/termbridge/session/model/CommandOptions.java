package com.termbridge.session.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-command options supplied at enqueue time.
 */
@Value
@Builder(toBuilder = true)
public class CommandOptions {

    @Builder.Default
    CommandSource source = CommandSource.CLAUDE;

    /**
     * Caller-supplied id. Required for {@link CommandSource#USER}; generated for
     * the other sources when absent.
     */
    String commandId;

    /** Recorded only; PTY mode is fixed per session at connect time. */
    boolean ptyRequested;

    /** How long the caller intends to wait. Never cancels the command. */
    Long timeoutMs;

    public static CommandOptions user(String commandId) {
        return builder().source(CommandSource.USER).commandId(commandId).build();
    }

    public static CommandOptions claude() {
        return builder().source(CommandSource.CLAUDE).build();
    }

    public static CommandOptions system() {
        return builder().source(CommandSource.SYSTEM).build();
    }
}
