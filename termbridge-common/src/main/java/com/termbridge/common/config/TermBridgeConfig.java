package com.termbridge.common.config;

import lombok.Data;

/**
 * Root configuration, read from {@code ~/.termbridge/termbridge.json}.
 */
@Data
public class TermBridgeConfig {

    /** Per-session engine and SSH transport settings. */
    private SessionConfig session;

    /** Streaming-channel endpoint settings. */
    private WebConfig web;

    /** Logging settings. */
    private LoggingConfig logging;

    @Data
    public static class SessionConfig {
        /** Admitted-but-not-started commands allowed per session. */
        private Integer maxQueueSize;
        /** Finished commands retained per session. */
        private Integer historyLimit;
        private Integer connectTimeoutMs;
        /** 0 disables SSH keep-alives. */
        private Integer keepAliveIntervalMs;
        /** "yes", "no" or "ask", passed through to the SSH client. */
        private String strictHostKeyChecking;
        private String knownHostsFile;
        /** Allocate a PTY for the shared shell channel. */
        private Boolean pty;
        private Integer terminalCols;
        private Integer terminalRows;
    }

    @Data
    public static class WebConfig {
        private String host;
        private Integer port;
        /** Path prefix of the per-session monitoring page, e.g. "/session/". */
        private String monitoringPath;
    }

    @Data
    public static class LoggingConfig {
        private String level;
        private Boolean redactSensitive;
    }
}
