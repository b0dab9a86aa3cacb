package com.termbridge.session.engine;

import com.termbridge.common.config.ConfigDefaults;
import com.termbridge.common.config.TermBridgeConfig;

/**
 * Per-session bounds.
 */
public record SessionLimits(int maxQueueSize, int historyLimit) {

    public SessionLimits {
        if (maxQueueSize <= 0 || historyLimit <= 0) {
            throw new IllegalArgumentException("Session limits must be positive");
        }
    }

    public static SessionLimits defaults() {
        return new SessionLimits(ConfigDefaults.DEFAULT_MAX_QUEUE_SIZE, ConfigDefaults.DEFAULT_HISTORY_LIMIT);
    }

    public static SessionLimits from(TermBridgeConfig.SessionConfig session) {
        return new SessionLimits(session.getMaxQueueSize(), session.getHistoryLimit());
    }
}
