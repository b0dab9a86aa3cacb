package com.termbridge.session.model;

import java.time.Instant;

/**
 * Point-in-time view of a session's connection attributes.
 */
public record SessionInfo(
        String name,
        String host,
        String username,
        ConnectionStatus status,
        Instant lastActivity,
        String errorDetails,
        Instant errorTimestamp) {
}
