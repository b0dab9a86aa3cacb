package com.termbridge.session.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who issued a command.
 */
public enum CommandSource {
    /** Human operator typing into the streamed terminal. */
    USER("user"),
    /** Automated agent calling through the control protocol. */
    CLAUDE("claude"),
    /** Internal housekeeping. */
    SYSTEM("system");

    private final String wireName;

    CommandSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static CommandSource fromWire(String value) {
        if (value != null) {
            for (CommandSource source : values()) {
                if (source.wireName.equalsIgnoreCase(value.trim())) {
                    return source;
                }
            }
        }
        throw new IllegalArgumentException("Invalid command source: " + value);
    }

    /**
     * Which protocol side this source belongs to.
     */
    public ProtocolSide side() {
        return switch (this) {
            case USER -> ProtocolSide.STREAMING;
            case CLAUDE -> ProtocolSide.CONTROL;
            case SYSTEM -> ProtocolSide.NONE;
        };
    }

    /**
     * Whether a prompt-plus-command line is synthesized ahead of the output.
     */
    public boolean echoesCommand() {
        return switch (this) {
            case USER, CLAUDE -> true;
            case SYSTEM -> false;
        };
    }

    /**
     * Whether commands from this source are reported to the agent through the
     * browser command buffer.
     */
    public boolean populatesBrowserBuffer() {
        return switch (this) {
            case USER -> true;
            case CLAUDE, SYSTEM -> false;
        };
    }

    public enum ProtocolSide {
        STREAMING, CONTROL, NONE
    }
}
