package com.termbridge.session.model;

/**
 * A human-issued command as reported to the agent side.
 */
public record BrowserCommandEntry(
        String command,
        String commandId,
        long timestamp,
        CommandSource source,
        CommandResult result) {
}
