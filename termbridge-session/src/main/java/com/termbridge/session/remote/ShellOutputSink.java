package com.termbridge.session.remote;

/**
 * Receives raw output chunks of a running command in arrival order.
 */
@FunctionalInterface
public interface ShellOutputSink {

    ShellOutputSink DISCARD = (stream, chunk) -> {
    };

    void onOutput(ShellStream stream, String chunk);
}
