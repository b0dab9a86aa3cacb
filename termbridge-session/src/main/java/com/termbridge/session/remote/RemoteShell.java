package com.termbridge.session.remote;

import java.io.IOException;

/**
 * One persistent interactive shell on a remote host. Commands run one at a
 * time in the same shell process, so working directory and environment
 * changes carry over to the next command.
 */
public interface RemoteShell extends AutoCloseable {

    /**
     * Run a command and block until the shell reports its exit status.
     * Output chunks are pushed to {@code sink} as they arrive.
     *
     * @throws IOException if the channel fails or closes before completion
     */
    ShellResult execute(String command, ShellOutputSink sink) throws IOException, InterruptedException;

    /**
     * Whether {@link #sendSignal} can reach the foreground process. Shells
     * without a PTY have no line discipline to turn control characters into
     * signals.
     */
    boolean supportsSignals();

    /**
     * Deliver a signal to whatever is running in the foreground.
     */
    void sendSignal(TerminalSignal signal) throws IOException;

    /**
     * Change the terminal dimensions. A no-op for shells without a PTY.
     */
    void resize(int cols, int rows) throws IOException;

    String homeDirectory();

    /** Working directory after the last completed command. */
    String workingDirectory();

    boolean isOpen();

    /**
     * Release the channel. A command still running fails with an
     * {@link IOException}.
     */
    @Override
    void close();
}
