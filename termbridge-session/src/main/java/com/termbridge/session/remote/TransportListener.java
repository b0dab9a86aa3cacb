package com.termbridge.session.remote;

import com.termbridge.session.model.ConnectionStatus;

/**
 * Callbacks from a live remote shell.
 */
public interface TransportListener {

    TransportListener NOOP = new TransportListener() {
    };

    /**
     * The underlying connection changed state, e.g. the channel hit EOF.
     */
    default void onStatusChange(ConnectionStatus status, String detail) {
    }

    /**
     * Output that arrived while no command was running, such as a background
     * job writing to the terminal.
     */
    default void onUnsolicitedOutput(ShellStream stream, String chunk) {
    }
}
