package com.termbridge.session.remote;

import com.termbridge.common.config.ConfigDefaults;
import com.termbridge.common.config.TermBridgeConfig;

/**
 * SSH client settings shared by every connection.
 */
public record TransportSettings(
        int connectTimeoutMs,
        int keepAliveIntervalMs,
        String strictHostKeyChecking,
        String knownHostsFile,
        boolean pty,
        int terminalCols,
        int terminalRows) {

    public static TransportSettings defaults() {
        return new TransportSettings(
                ConfigDefaults.DEFAULT_CONNECT_TIMEOUT_MS,
                ConfigDefaults.DEFAULT_KEEP_ALIVE_INTERVAL_MS,
                ConfigDefaults.DEFAULT_STRICT_HOST_KEY_CHECKING,
                null,
                false,
                ConfigDefaults.DEFAULT_TERMINAL_COLS,
                ConfigDefaults.DEFAULT_TERMINAL_ROWS);
    }

    /**
     * Settings from an already defaulted config section.
     */
    public static TransportSettings from(TermBridgeConfig.SessionConfig session) {
        return new TransportSettings(
                session.getConnectTimeoutMs(),
                session.getKeepAliveIntervalMs(),
                session.getStrictHostKeyChecking(),
                session.getKnownHostsFile(),
                Boolean.TRUE.equals(session.getPty()),
                session.getTerminalCols(),
                session.getTerminalRows());
    }
}
