package com.termbridge.session.remote;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShellTextTest {

    @Test
    void clean_stripsAnsiAndCarriageReturns() {
        assertEquals("red\nplain", ShellText.clean("\u001b[31mred\u001b[0m\r\nplain\r\n"));
    }

    @Test
    void clean_stripsOscTitleSequence() {
        assertEquals("ok", ShellText.clean("\u001b]0;user@host:~\u0007ok"));
    }

    @Test
    void clean_trimsOnlyTrailingNewlines() {
        assertEquals("  indented", ShellText.clean("  indented\n\n"));
        assertEquals("", ShellText.clean(""));
    }
}
