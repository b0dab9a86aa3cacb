package com.termbridge.session.broadcast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineEndingNormalizerTest {

    private LineEndingNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new LineEndingNormalizer();
    }

    @Test
    void normalize_convertsBareLf() {
        assertEquals("a\r\nb\r\n", normalizer.normalize("a\nb\n"));
    }

    @Test
    void normalize_keepsExistingCrlf() {
        assertEquals("a\r\nb\r\n", normalizer.normalize("a\r\nb\r\n"));
    }

    @Test
    void normalize_crlfSplitAcrossChunks_staysSingle() {
        String out = normalizer.normalize("line\r") + normalizer.normalize("\nnext");

        assertEquals("line\r\nnext", out);
    }

    @Test
    void normalize_loneCr_isPreserved() {
        assertEquals("10%\r20%", normalizer.normalize("10%\r20%"));
    }

    @Test
    void finish_addsLineBreakAfterUnterminatedOutput() {
        normalizer.normalize("no newline");

        assertEquals("\r\n", normalizer.finish());
        assertEquals("", normalizer.finish());
    }

    @Test
    void finish_nothingNeededWhenOutputEndsWithNewline() {
        normalizer.normalize("done\n");

        assertEquals("", normalizer.finish());
    }

    @Test
    void finish_noOutput_emitsNothing() {
        assertEquals("", normalizer.finish());
    }

    @Test
    void finish_heldCarriageReturn_becomesLineBreak() {
        assertEquals("x", normalizer.normalize("x\r"));

        assertEquals("\r\n", normalizer.finish());
    }
}
