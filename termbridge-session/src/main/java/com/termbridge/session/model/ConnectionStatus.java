package com.termbridge.session.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionStatus {
    CONNECTED,
    RECONNECTING,
    DISCONNECTED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
