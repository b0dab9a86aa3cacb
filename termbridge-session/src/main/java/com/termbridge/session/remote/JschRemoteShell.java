package com.termbridge.session.remote;

import com.jcraft.jsch.ChannelShell;
import com.jcraft.jsch.Session;
import com.termbridge.common.infra.ErrorUtils;
import com.termbridge.session.model.ConnectionStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Persistent shell over a JSch {@link ChannelShell}.
 *
 * <p>
 * Two pump threads read stdout and stderr. Command boundaries are found with
 * {@link CompletionMarker}s rather than prompt matching, so the shell runs with
 * empty prompts and, under a PTY, with echo and line editing off.
 */
@Slf4j
public class JschRemoteShell implements RemoteShell {

    static final String BOOTSTRAP = "stty -echo 2>/dev/null; set +o vi +o emacs 2>/dev/null; "
            + "PS1=''; PS2=''; PROMPT_COMMAND=''; cd \"$HOME\" 2>/dev/null";

    private final String label;
    private final Session session;
    private final ChannelShell channel;
    private final boolean pty;
    private final OutputStream stdin;
    private final InputStream stdout;
    private final InputStream stderr;
    private final TransportListener listener;

    private final Object writeLock = new Object();
    private final AtomicReference<PendingExecution> pending = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean eofReported = new AtomicBoolean();

    private volatile String homeDirectory;
    private volatile String workingDirectory;

    JschRemoteShell(String label, Session session, ChannelShell channel, boolean pty,
            OutputStream stdin, InputStream stdout, InputStream stderr, TransportListener listener) {
        this.label = label;
        this.session = session;
        this.channel = channel;
        this.pty = pty;
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
        this.listener = listener != null ? listener : TransportListener.NOOP;
    }

    void start() {
        startPump(ShellStream.STDOUT, stdout);
        startPump(ShellStream.STDERR, stderr);
    }

    /**
     * Quiet the shell and capture the home directory.
     */
    void bootstrap(long timeoutMs) throws IOException, InterruptedException {
        ShellResult result = execute(BOOTSTRAP, ShellOutputSink.DISCARD, timeoutMs);
        homeDirectory = result.workingDirectory();
        workingDirectory = result.workingDirectory();
        log.debug("Shell ready on {} (home={})", label, homeDirectory);
    }

    @Override
    public ShellResult execute(String command, ShellOutputSink sink) throws IOException, InterruptedException {
        return execute(command, sink, 0);
    }

    private ShellResult execute(String command, ShellOutputSink sink, long timeoutMs)
            throws IOException, InterruptedException {
        ensureOpen();
        String token = CompletionMarker.newToken();
        PendingExecution exec = new PendingExecution(token, sink);
        if (!pending.compareAndSet(null, exec)) {
            throw new IllegalStateException("A command is already running on " + label);
        }
        try {
            write(command.stripTrailing() + "\n" + CompletionMarker.trailer(token) + "\n");
            ShellResult result = timeoutMs > 0
                    ? exec.done.get(timeoutMs, TimeUnit.MILLISECONDS)
                    : exec.done.get();
            if (result.workingDirectory() != null) {
                workingDirectory = result.workingDirectory();
            }
            return result;
        } catch (TimeoutException e) {
            throw new IOException("Shell on " + label + " did not respond within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(ErrorUtils.formatErrorMessage(cause), cause);
        } finally {
            pending.compareAndSet(exec, null);
        }
    }

    @Override
    public boolean supportsSignals() {
        return pty;
    }

    @Override
    public void sendSignal(TerminalSignal signal) throws IOException {
        ensureOpen();
        if (!pty) {
            // without a line discipline the control character would become part of the next command
            throw new IOException("Signals need a PTY; session on " + label + " has none");
        }
        write(signal.controlSequence());
    }

    @Override
    public void resize(int cols, int rows) throws IOException {
        ensureOpen();
        if (pty) {
            channel.setPtySize(cols, rows, 0, 0);
        }
    }

    @Override
    public String homeDirectory() {
        return homeDirectory;
    }

    @Override
    public String workingDirectory() {
        return workingDirectory;
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isConnected() && !channel.isClosed();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        failPending(new IOException("Shell on " + label + " was closed"));
        channel.disconnect();
        session.disconnect();
        log.debug("Closed shell on {}", label);
    }

    // =========================================================================
    // I/O
    // =========================================================================

    private void write(String text) throws IOException {
        synchronized (writeLock) {
            stdin.write(text.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        }
    }

    private void ensureOpen() throws IOException {
        if (closed.get()) {
            throw new IOException("Shell on " + label + " is closed");
        }
        if (eofReported.get()) {
            throw new IOException("Shell on " + label + " lost its channel");
        }
    }

    private void startPump(ShellStream stream, InputStream in) {
        Thread t = new Thread(() -> pump(stream, in), "ssh-" + label + "-" + stream.name().toLowerCase());
        t.setDaemon(true);
        t.start();
    }

    private void pump(ShellStream stream, InputStream in) {
        char[] buf = new char[8192];
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                if (n > 0) {
                    onChunk(stream, new String(buf, 0, n));
                }
            }
            onEof("Remote shell on " + label + " closed the channel");
        } catch (IOException e) {
            onEof("Channel read failed on " + label + ": " + e.getMessage());
        }
    }

    private void onChunk(ShellStream stream, String chunk) {
        PendingExecution exec = pending.get();
        if (exec == null) {
            listener.onUnsolicitedOutput(stream, chunk);
            return;
        }
        exec.accept(stream, chunk);
    }

    private void onEof(String detail) {
        if (closed.get() || !eofReported.compareAndSet(false, true)) {
            return;
        }
        log.warn(detail);
        failPending(new IOException(detail));
        listener.onStatusChange(ConnectionStatus.ERROR, detail);
    }

    private void failPending(IOException error) {
        PendingExecution exec = pending.get();
        if (exec != null) {
            exec.done.completeExceptionally(error);
        }
    }

    /**
     * Output collected for the command currently running.
     */
    private final class PendingExecution {
        final MarkerScanner stdoutScanner;
        final MarkerScanner stderrScanner;
        final ShellOutputSink sink;
        final StringBuilder out = new StringBuilder();
        final StringBuilder err = new StringBuilder();
        final CompletableFuture<ShellResult> done = new CompletableFuture<>();

        PendingExecution(String token, ShellOutputSink sink) {
            this.stdoutScanner = new MarkerScanner(token, true);
            this.stderrScanner = new MarkerScanner(token, false);
            this.sink = sink;
        }

        synchronized void accept(ShellStream stream, String chunk) {
            boolean isStdout = stream == ShellStream.STDOUT;
            String text = (isStdout ? stdoutScanner : stderrScanner).feed(chunk);
            if (!text.isEmpty()) {
                (isStdout ? out : err).append(text);
                sink.onOutput(stream, text);
            }
            // a PTY merges stderr into stdout; the ext stream stays silent
            if (stdoutScanner.isComplete() && (pty || stderrScanner.isComplete())) {
                String pwd = stdoutScanner.workingDirectory();
                done.complete(new ShellResult(ShellText.clean(out), ShellText.clean(err),
                        stdoutScanner.exitCode(), pwd != null ? pwd : workingDirectory));
            }
        }
    }
}
