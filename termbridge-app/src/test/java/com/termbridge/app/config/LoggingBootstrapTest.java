package com.termbridge.app.config;

import com.termbridge.common.logging.LogLevel;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LoggingBootstrapTest {

    @ParameterizedTest
    @CsvSource({
            "silent, OFF",
            "fatal, ERROR",
            "warning, WARN",
            "debug, DEBUG",
            "bogus, INFO"
    })
    void toSpringLevel_mapsConfiguredLevel(String configured, String expected) {
        assertEquals(expected, LoggingBootstrap.toSpringLevel(LogLevel.normalize(configured)).name());
    }
}
