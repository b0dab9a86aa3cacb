package com.termbridge.session.engine;

import com.termbridge.common.infra.ErrorUtils;
import com.termbridge.common.logging.SubsystemLogger;
import com.termbridge.session.broadcast.LineEndingNormalizer;
import com.termbridge.session.broadcast.OutputBroadcaster;
import com.termbridge.session.broadcast.TranscriptFormatter;
import com.termbridge.session.error.CommandRejectedException;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.error.InvalidRequestException;
import com.termbridge.session.error.TransportException;
import com.termbridge.session.gate.BrowserCommandBuffer;
import com.termbridge.session.gate.CommandGate;
import com.termbridge.session.history.CommandHistory;
import com.termbridge.session.model.CommandHistoryEntry;
import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.model.CommandResult;
import com.termbridge.session.model.CommandSource;
import com.termbridge.session.model.ConnectionConfig;
import com.termbridge.session.model.ConnectionStatus;
import com.termbridge.session.model.SessionInfo;
import com.termbridge.session.model.TerminalOutputEntry;
import com.termbridge.session.remote.RemoteShell;
import com.termbridge.session.remote.ShellStream;
import com.termbridge.session.remote.TerminalSignal;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One named remote session: the shared shell plus its queue, browser command
 * buffer, history and output fan-out. Admission, gating and queue changes all
 * serialize on one lock.
 */
public class TerminalSession implements CommandGate.GateView {

    public static final int MIN_TERMINAL_SIZE = 1;
    public static final int MAX_TERMINAL_SIZE = 1000;

    private static final SubsystemLogger LOG = SubsystemLogger.create("session/engine");

    private final String name;
    private final ConnectionConfig config;
    private final RemoteShell shell;
    private final Object lock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CommandExecutor executor;
    private final BrowserCommandBuffer browserCommands;
    private final CommandHistory history;
    private final OutputBroadcaster broadcaster;
    private final SubsystemLogger log;

    private volatile ConnectionStatus status = ConnectionStatus.CONNECTED;
    private volatile Instant lastActivity = Instant.now();
    private volatile String errorDetails;
    private volatile Instant errorTimestamp;
    private volatile String workingDirectory;
    private volatile LineEndingNormalizer commandNormalizer = new LineEndingNormalizer();
    private final LineEndingNormalizer idleNormalizer = new LineEndingNormalizer();

    public TerminalSession(ConnectionConfig config, RemoteShell shell, SessionLimits limits) {
        this.name = config.getName();
        this.config = config;
        this.shell = shell;
        this.browserCommands = new BrowserCommandBuffer(lock);
        this.history = new CommandHistory(name, limits.historyLimit());
        this.broadcaster = new OutputBroadcaster(name);
        this.executor = new CommandExecutor(name, lock, shell, limits.maxQueueSize(), new Transcript());
        this.workingDirectory = shell.workingDirectory();
        this.log = LOG.forSession(name);
    }

    /**
     * Validate, gate and admit a command. Rejections are thrown here; the
     * returned future only ever fails with execution errors.
     */
    public CompletableFuture<CommandResult> enqueue(String command, CommandOptions options, CommandGate gate) {
        CommandValidator.validateCommand(command);
        String commandId = CommandValidator.resolveCommandId(options);
        CommandSource source = options.getSource();
        synchronized (lock) {
            if (source.populatesBrowserBuffer()
                    && (browserCommands.contains(commandId) || executor.isPending(commandId))) {
                throw new CommandRejectedException(ErrorCode.INVALID_COMMAND_ID,
                        "commandId already in use on session '" + name + "': " + commandId);
            }
            gate.check(this, source);
            QueuedCommand queued = new QueuedCommand(commandId, command, options, System.currentTimeMillis(),
                    new CompletableFuture<>());
            executor.admit(queued);
            if (source.populatesBrowserBuffer()) {
                browserCommands.append(command, commandId, source, queued.enqueuedAt());
            }
            touch();
            return queued.completion();
        }
    }

    /**
     * Cancel this source's queued commands and interrupt its in-flight one.
     *
     * @return number of commands affected
     */
    public int cancel(CommandSource source) {
        List<QueuedCommand> cancelled = executor.cancelQueued(command -> command.source() == source);
        for (QueuedCommand command : cancelled) {
            if (command.source().populatesBrowserBuffer()) {
                browserCommands.remove(command.commandId());
            }
        }
        int affected = cancelled.size();
        QueuedCommand running = executor.inFlight();
        if (running != null && running.source() == source) {
            if (shell.supportsSignals()) {
                sendSignal(TerminalSignal.SIGINT);
                affected++;
            } else {
                log.warn("Cannot interrupt " + running.commandId() + ": shell has no PTY");
            }
        }
        if (affected > 0) {
            log.info("Cancelled " + affected + " " + source.wireName() + " command(s)");
        }
        return affected;
    }

    public void sendSignal(TerminalSignal signal) {
        if (!shell.supportsSignals()) {
            throw new InvalidRequestException(ErrorCode.UNSUPPORTED_SIGNAL,
                    "Session '" + name + "' has no PTY; " + signal + " cannot be delivered");
        }
        try {
            shell.sendSignal(signal);
            touch();
        } catch (IOException e) {
            throw new TransportException("Failed to send " + signal + " to session '" + name + "': "
                    + ErrorUtils.formatErrorMessage(e), e);
        }
    }

    public void resize(int cols, int rows) {
        if (cols < MIN_TERMINAL_SIZE || cols > MAX_TERMINAL_SIZE
                || rows < MIN_TERMINAL_SIZE || rows > MAX_TERMINAL_SIZE) {
            throw new InvalidRequestException(ErrorCode.INVALID_TERMINAL_SIZE,
                    "Terminal size must be within " + MIN_TERMINAL_SIZE + ".." + MAX_TERMINAL_SIZE + ": "
                            + cols + "x" + rows);
        }
        try {
            shell.resize(cols, rows);
            touch();
        } catch (IOException e) {
            throw new TransportException("Failed to resize session '" + name + "': "
                    + ErrorUtils.formatErrorMessage(e), e);
        }
    }

    /**
     * Mark DISCONNECTED, reject every pending command, tell listeners the
     * connection closed and release the shell.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        status = ConnectionStatus.DISCONNECTED;
        executor.close();
        broadcaster.broadcast(TerminalOutputEntry.of(name, "Connection to " + config.getHost() + " closed\r\n",
                null, CommandSource.SYSTEM));
        shell.close();
        broadcaster.clear();
        history.clearListeners();
        browserCommands.clear();
        log.info("Session closed");
    }

    public void markStatus(ConnectionStatus newStatus, String detail) {
        if (closed.get()) {
            return;
        }
        status = newStatus;
        if (newStatus == ConnectionStatus.ERROR) {
            errorDetails = detail;
            errorTimestamp = Instant.now();
            log.warn("Transport error: " + detail);
        }
    }

    /**
     * Output the shell produced while no command was running.
     */
    public void onUnsolicitedOutput(ShellStream stream, String chunk) {
        String text;
        synchronized (idleNormalizer) {
            text = idleNormalizer.normalize(chunk);
        }
        if (!text.isEmpty()) {
            broadcaster.broadcast(TerminalOutputEntry.of(name, text, null, CommandSource.SYSTEM));
        }
    }

    public SessionInfo info() {
        return new SessionInfo(name, config.getHost(), config.getUsername(), status, lastActivity,
                errorDetails, errorTimestamp);
    }

    public QueueSnapshot snapshot() {
        return executor.snapshot();
    }

    private void touch() {
        lastActivity = Instant.now();
    }

    // =========================================================================
    // Gate view
    // =========================================================================

    @Override
    public String sessionName() {
        return name;
    }

    @Override
    public BrowserCommandBuffer browserCommands() {
        return browserCommands;
    }

    @Override
    public CommandSource inFlightSource() {
        QueuedCommand running = executor.inFlight();
        return running != null ? running.source() : null;
    }

    @Override
    public String inFlightCommand() {
        QueuedCommand running = executor.inFlight();
        return running != null ? running.command() : null;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getName() {
        return name;
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public CommandHistory getHistory() {
        return history;
    }

    public OutputBroadcaster getBroadcaster() {
        return broadcaster;
    }

    /**
     * Echo line, normalized output and bookkeeping for each command.
     */
    private final class Transcript implements CommandExecutor.Lifecycle {

        @Override
        public void onStart(QueuedCommand command) {
            String idleTail;
            synchronized (idleNormalizer) {
                idleTail = idleNormalizer.finish();
            }
            if (!idleTail.isEmpty()) {
                broadcaster.broadcast(TerminalOutputEntry.of(name, idleTail, null, CommandSource.SYSTEM));
            }
            commandNormalizer = new LineEndingNormalizer();
            if (command.source().echoesCommand()) {
                String prompt = TranscriptFormatter.prompt(config.getUsername(), config.getHost(),
                        workingDirectory, shell.homeDirectory());
                emit(command, TranscriptFormatter.echoLine(prompt, command.command()));
            }
            log.debug("Running " + command.commandId() + ": " + command.command());
        }

        @Override
        public void onOutput(QueuedCommand command, ShellStream stream, String chunk) {
            emit(command, commandNormalizer.normalize(chunk));
        }

        @Override
        public void onComplete(QueuedCommand command, CommandResult result, long startedAt, long durationMs) {
            emit(command, commandNormalizer.finish());
            workingDirectory = shell.workingDirectory();
            history.append(new CommandHistoryEntry(command.command(), startedAt, durationMs, result.exitCode(),
                    CommandHistoryEntry.Status.forExitCode(result.exitCode()), name, command.source()));
            if (command.source().populatesBrowserBuffer()) {
                browserCommands.recordResult(command.commandId(), result);
            }
            touch();
        }

        @Override
        public void onFailure(QueuedCommand command, Throwable error) {
            emit(command, commandNormalizer.finish());
            if (command.source().populatesBrowserBuffer()) {
                browserCommands.recordResult(command.commandId(),
                        new CommandResult("", ErrorUtils.formatErrorMessage(error), -1));
            }
        }

        private void emit(QueuedCommand command, String text) {
            if (!text.isEmpty()) {
                broadcaster.broadcast(TerminalOutputEntry.of(name, text, command.commandId(), command.source()));
            }
        }
    }
}
