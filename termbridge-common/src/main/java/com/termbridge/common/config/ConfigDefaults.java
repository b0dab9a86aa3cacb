package com.termbridge.common.config;

/**
 * Fills unset configuration values with their defaults.
 */
public final class ConfigDefaults {

    public static final int DEFAULT_MAX_QUEUE_SIZE = 100;
    public static final int DEFAULT_HISTORY_LIMIT = 100;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_KEEP_ALIVE_INTERVAL_MS = 15_000;
    public static final String DEFAULT_STRICT_HOST_KEY_CHECKING = "no";
    public static final int DEFAULT_TERMINAL_COLS = 80;
    public static final int DEFAULT_TERMINAL_ROWS = 24;

    public static final String DEFAULT_WEB_HOST = "localhost";
    public static final int DEFAULT_WEB_PORT = 8080;
    public static final String DEFAULT_MONITORING_PATH = "/session/";

    public static final String DEFAULT_LOG_LEVEL = "info";

    private ConfigDefaults() {
    }

    /**
     * Apply defaults in place and return the same instance.
     */
    public static TermBridgeConfig apply(TermBridgeConfig config) {
        if (config.getSession() == null) {
            config.setSession(new TermBridgeConfig.SessionConfig());
        }
        if (config.getWeb() == null) {
            config.setWeb(new TermBridgeConfig.WebConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new TermBridgeConfig.LoggingConfig());
        }

        var session = config.getSession();
        session.setMaxQueueSize(positiveOr(session.getMaxQueueSize(), DEFAULT_MAX_QUEUE_SIZE));
        session.setHistoryLimit(positiveOr(session.getHistoryLimit(), DEFAULT_HISTORY_LIMIT));
        session.setConnectTimeoutMs(positiveOr(session.getConnectTimeoutMs(), DEFAULT_CONNECT_TIMEOUT_MS));
        if (session.getKeepAliveIntervalMs() == null || session.getKeepAliveIntervalMs() < 0) {
            session.setKeepAliveIntervalMs(DEFAULT_KEEP_ALIVE_INTERVAL_MS);
        }
        if (isBlank(session.getStrictHostKeyChecking())) {
            session.setStrictHostKeyChecking(DEFAULT_STRICT_HOST_KEY_CHECKING);
        }
        if (session.getPty() == null) {
            session.setPty(false);
        }
        session.setTerminalCols(positiveOr(session.getTerminalCols(), DEFAULT_TERMINAL_COLS));
        session.setTerminalRows(positiveOr(session.getTerminalRows(), DEFAULT_TERMINAL_ROWS));

        var web = config.getWeb();
        if (isBlank(web.getHost())) {
            web.setHost(DEFAULT_WEB_HOST);
        }
        web.setPort(positiveOr(web.getPort(), DEFAULT_WEB_PORT));
        String path = isBlank(web.getMonitoringPath()) ? DEFAULT_MONITORING_PATH : web.getMonitoringPath().trim();
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        if (!path.endsWith("/")) {
            path = path + "/";
        }
        web.setMonitoringPath(path);

        var logging = config.getLogging();
        if (isBlank(logging.getLevel())) {
            logging.setLevel(DEFAULT_LOG_LEVEL);
        }
        if (logging.getRedactSensitive() == null) {
            logging.setRedactSensitive(true);
        }
        return config;
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
