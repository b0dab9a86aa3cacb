package com.termbridge.session.engine;

import com.termbridge.session.error.CommandRejectedException;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.error.InvalidRequestException;
import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.model.CommandSource;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Admission checks on command text, command ids and session names.
 */
public final class CommandValidator {

    public static final int MAX_COMMAND_ID_LENGTH = 128;

    private static final Pattern COMMAND_ID = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile(";|&&|\\|\\||\\n");
    private static final Pattern TERMINATING = Pattern.compile("(?:exit|logout)(?:\\s+-?\\d+)?");

    private CommandValidator() {
    }

    public static void validateCommand(String command) {
        if (command == null || command.isBlank()) {
            throw new CommandRejectedException(ErrorCode.INVALID_COMMAND, "Command must not be empty");
        }
        if (isSessionTerminating(command)) {
            throw new CommandRejectedException(ErrorCode.SESSION_TERMINATING_COMMAND,
                    "Command would terminate the shared shell: " + command.trim());
        }
    }

    /**
     * True for {@code exit}/{@code logout} on their own or as one segment of
     * a command list.
     */
    static boolean isSessionTerminating(String command) {
        for (String segment : SEGMENT_SEPARATOR.split(command)) {
            if (TERMINATING.matcher(segment.trim()).matches()) {
                return true;
            }
        }
        return false;
    }

    public static void validateCommandId(String commandId) {
        if (commandId == null || commandId.isBlank()) {
            throw new CommandRejectedException(ErrorCode.INVALID_COMMAND_ID, "commandId must not be empty");
        }
        if (commandId.length() > MAX_COMMAND_ID_LENGTH) {
            throw new CommandRejectedException(ErrorCode.INVALID_COMMAND_ID,
                    "commandId longer than " + MAX_COMMAND_ID_LENGTH + " characters");
        }
        if (!COMMAND_ID.matcher(commandId).matches()) {
            throw new CommandRejectedException(ErrorCode.INVALID_COMMAND_ID,
                    "commandId may only contain letters, digits, '.', '_' and '-': " + commandId);
        }
    }

    /**
     * The caller's id, validated, or a generated one for agent and system
     * commands.
     */
    public static String resolveCommandId(CommandOptions options) {
        String commandId = options.getCommandId();
        if (commandId == null || commandId.isBlank()) {
            if (options.getSource() == CommandSource.USER) {
                throw new CommandRejectedException(ErrorCode.INVALID_COMMAND_ID,
                        "commandId is required for user commands");
            }
            return options.getSource().wireName() + "-" + UUID.randomUUID();
        }
        validateCommandId(commandId);
        return commandId;
    }

    public static void validateSessionName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException(ErrorCode.INVALID_SESSION_NAME, "Session name must not be empty");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || c == '@' || c == '/') {
                throw new InvalidRequestException(ErrorCode.INVALID_SESSION_NAME,
                        "Session name may not contain whitespace, '@' or '/': " + name);
            }
        }
    }
}
