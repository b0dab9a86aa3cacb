package com.termbridge.session.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One broadcast unit of session output. The content is already CRLF
 * normalized.
 *
 * @param commandId null for output not tied to a command
 */
public record TerminalOutputEntry(
        String sessionName,
        String output,
        String commandId,
        CommandSource source,
        @JsonProperty("user-initiated") boolean userInitiated,
        long timestamp) {

    public static TerminalOutputEntry of(String sessionName, String output, String commandId, CommandSource source) {
        return new TerminalOutputEntry(sessionName, output, commandId, source,
                source == CommandSource.USER, System.currentTimeMillis());
    }
}
