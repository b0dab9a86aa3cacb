package com.termbridge.session.engine;

import com.termbridge.session.model.CommandSource;

/**
 * Diagnostic view of a session queue.
 *
 * @param inFlightCommandId null when idle
 * @param queued            admitted commands not yet started
 */
public record QueueSnapshot(
        ExecutionState state,
        String inFlightCommandId,
        String inFlightCommand,
        CommandSource inFlightSource,
        int queued) {
}
