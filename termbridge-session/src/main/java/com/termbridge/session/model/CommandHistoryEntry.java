package com.termbridge.session.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Permanent record of a finished command.
 *
 * @param timestamp start time, epoch millis
 * @param duration  wall time in millis
 */
public record CommandHistoryEntry(
        String command,
        long timestamp,
        long duration,
        int exitCode,
        Status status,
        String sessionName,
        CommandSource source) {

    public enum Status {
        SUCCESS, FAILURE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }

        public static Status forExitCode(int exitCode) {
            return exitCode == 0 ? SUCCESS : FAILURE;
        }
    }
}
