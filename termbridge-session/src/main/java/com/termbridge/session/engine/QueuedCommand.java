package com.termbridge.session.engine;

import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.model.CommandResult;
import com.termbridge.session.model.CommandSource;

import java.util.concurrent.CompletableFuture;

/**
 * A command admitted to a session queue, with the future its caller holds.
 */
public record QueuedCommand(
        String commandId,
        String command,
        CommandOptions options,
        long enqueuedAt,
        CompletableFuture<CommandResult> completion) {

    public CommandSource source() {
        return options.getSource();
    }
}
