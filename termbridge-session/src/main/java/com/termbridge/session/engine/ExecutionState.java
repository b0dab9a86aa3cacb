package com.termbridge.session.engine;

public enum ExecutionState {
    IDLE,
    EXECUTING,
    /** Terminal; reached on disconnect. */
    CLOSED
}
