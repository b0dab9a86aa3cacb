package com.termbridge.session.engine;

import com.termbridge.session.error.CommandRejectedException;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.error.InvalidRequestException;
import com.termbridge.session.model.CommandOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CommandValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {"exit", "  exit  ", "logout", "exit 1", "cd /tmp; exit", "make && logout"})
    void validateCommand_terminating_isRejected(String command) {
        CommandRejectedException ex = assertThrows(CommandRejectedException.class,
                () -> CommandValidator.validateCommand(command));
        assertEquals(ErrorCode.SESSION_TERMINATING_COMMAND, ex.getCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"echo exit", "exit_status", "echo 'a; exit now'", "git commit -m logout", "ls"})
    void validateCommand_ordinary_isAccepted(String command) {
        assertDoesNotThrow(() -> CommandValidator.validateCommand(command));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n"})
    void validateCommand_blank_isInvalid(String command) {
        CommandRejectedException ex = assertThrows(CommandRejectedException.class,
                () -> CommandValidator.validateCommand(command));
        assertEquals(ErrorCode.INVALID_COMMAND, ex.getCode());
    }

    @Test
    void validateCommand_null_isInvalid() {
        assertThrows(CommandRejectedException.class, () -> CommandValidator.validateCommand(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"cmd-1", "a.b_c-9", "X"})
    void validateCommandId_accepted(String id) {
        assertDoesNotThrow(() -> CommandValidator.validateCommandId(id));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "has space", "semi;colon", "slash/ed"})
    void validateCommandId_rejected(String id) {
        CommandRejectedException ex = assertThrows(CommandRejectedException.class,
                () -> CommandValidator.validateCommandId(id));
        assertEquals(ErrorCode.INVALID_COMMAND_ID, ex.getCode());
    }

    @Test
    void validateCommandId_tooLong_isRejected() {
        String id = "a".repeat(CommandValidator.MAX_COMMAND_ID_LENGTH + 1);
        assertThrows(CommandRejectedException.class, () -> CommandValidator.validateCommandId(id));
        assertDoesNotThrow(() -> CommandValidator.validateCommandId(id.substring(1)));
    }

    @Test
    void resolveCommandId_userWithoutId_isRejected() {
        assertThrows(CommandRejectedException.class,
                () -> CommandValidator.resolveCommandId(CommandOptions.user(null)));
    }

    @Test
    void resolveCommandId_generatedForAgentAndSystem() {
        assertTrue(CommandValidator.resolveCommandId(CommandOptions.claude()).startsWith("claude-"));
        assertTrue(CommandValidator.resolveCommandId(CommandOptions.system()).startsWith("system-"));
        assertEquals("given-1", CommandValidator.resolveCommandId(
                CommandOptions.claude().toBuilder().commandId("given-1").build()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "my box", "alice@host", "a/b"})
    void validateSessionName_rejected(String name) {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                () -> CommandValidator.validateSessionName(name));
        assertEquals(ErrorCode.INVALID_SESSION_NAME, ex.getCode());
    }
}
