package com.termbridge.app.config;

import com.termbridge.common.config.TermBridgeConfig;
import com.termbridge.common.logging.LogLevel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Applies {@code logging.level} from the termbridge config to the termbridge
 * logger trees.
 */
@Slf4j
@Component
@Order(0)
public class LoggingBootstrap {

    static final String[] LOGGER_ROOTS = { "termbridge", "com.termbridge" };

    private final TermBridgeConfig config;

    public LoggingBootstrap(TermBridgeConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        LogLevel level = LogLevel.normalize(config.getLogging().getLevel());
        org.springframework.boot.logging.LogLevel springLevel = toSpringLevel(level);
        LoggingSystem loggingSystem = LoggingSystem.get(getClass().getClassLoader());
        for (String root : LOGGER_ROOTS) {
            loggingSystem.setLogLevel(root, springLevel);
        }
        log.info("Log level set to {}", springLevel);
    }

    static org.springframework.boot.logging.LogLevel toSpringLevel(LogLevel level) {
        return org.springframework.boot.logging.LogLevel.valueOf(level.toSlf4jLevel());
    }
}
