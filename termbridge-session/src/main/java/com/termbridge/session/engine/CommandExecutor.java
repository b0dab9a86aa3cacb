package com.termbridge.session.engine;

import com.termbridge.common.infra.ErrorUtils;
import com.termbridge.common.logging.SubsystemLogger;
import com.termbridge.session.error.CommandCancelledException;
import com.termbridge.session.error.CommandRejectedException;
import com.termbridge.session.error.SessionDisconnectedException;
import com.termbridge.session.error.TransportException;
import com.termbridge.session.model.CommandResult;
import com.termbridge.session.remote.RemoteShell;
import com.termbridge.session.remote.ShellResult;
import com.termbridge.session.remote.ShellStream;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Predicate;

/**
 * FIFO command queue of one session with a single worker thread.
 *
 * <p>
 * At most one command is in flight. The next one starts only after the
 * previous command's completion has been fully processed, so history,
 * broadcast and future resolution all happen in admission order. Queue
 * mutation and state changes happen under the session lock handed in by the
 * owner.
 */
public class CommandExecutor {

    private static final SubsystemLogger LOG = SubsystemLogger.create("session/engine");

    /**
     * Hooks the owning session uses to broadcast and record a command.
     * Exceptions thrown here are logged and never reach the queue.
     */
    public interface Lifecycle {
        void onStart(QueuedCommand command);

        void onOutput(QueuedCommand command, ShellStream stream, String chunk);

        void onComplete(QueuedCommand command, CommandResult result, long startedAt, long durationMs);

        void onFailure(QueuedCommand command, Throwable error);
    }

    private final String sessionName;
    private final Object lock;
    private final RemoteShell shell;
    private final int maxQueueSize;
    private final Lifecycle lifecycle;
    private final ExecutorService worker;
    private final SubsystemLogger log;

    private final Deque<QueuedCommand> queue = new ArrayDeque<>();
    private QueuedCommand inFlight;
    private ExecutionState state = ExecutionState.IDLE;

    public CommandExecutor(String sessionName, Object lock, RemoteShell shell, int maxQueueSize, Lifecycle lifecycle) {
        this.sessionName = sessionName;
        this.lock = lock;
        this.shell = shell;
        this.maxQueueSize = maxQueueSize;
        this.lifecycle = lifecycle;
        this.log = LOG.forSession(sessionName);
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "termbridge-exec-" + sessionName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Append to the queue, starting it right away when the session is idle.
     *
     * @throws CommandRejectedException     QUEUE_FULL when the queue is at capacity
     * @throws SessionDisconnectedException once the session is closed
     */
    public void admit(QueuedCommand command) {
        synchronized (lock) {
            if (state == ExecutionState.CLOSED) {
                throw new SessionDisconnectedException(sessionName);
            }
            if (queue.size() >= maxQueueSize) {
                throw CommandRejectedException.queueFull(sessionName, maxQueueSize);
            }
            queue.addLast(command);
            log.debug("Admitted " + command.commandId(), Map.of("source", command.source().wireName(),
                    "queued", queue.size()));
            startNext();
        }
    }

    /**
     * Remove and reject queued commands matching {@code filter}, oldest first.
     * The in-flight command is never touched.
     */
    public List<QueuedCommand> cancelQueued(Predicate<QueuedCommand> filter) {
        List<QueuedCommand> cancelled = new ArrayList<>();
        synchronized (lock) {
            Iterator<QueuedCommand> it = queue.iterator();
            while (it.hasNext()) {
                QueuedCommand command = it.next();
                if (filter.test(command)) {
                    it.remove();
                    cancelled.add(command);
                }
            }
        }
        for (QueuedCommand command : cancelled) {
            command.completion().completeExceptionally(new CommandCancelledException(sessionName, command.commandId()));
        }
        return cancelled;
    }

    /**
     * Move to CLOSED and reject the in-flight command and every queued one.
     * Idempotent.
     */
    public List<QueuedCommand> close() {
        List<QueuedCommand> rejected = new ArrayList<>();
        synchronized (lock) {
            if (state == ExecutionState.CLOSED) {
                return rejected;
            }
            state = ExecutionState.CLOSED;
            if (inFlight != null) {
                rejected.add(inFlight);
            }
            rejected.addAll(queue);
            queue.clear();
        }
        for (QueuedCommand command : rejected) {
            command.completion().completeExceptionally(new SessionDisconnectedException(sessionName));
        }
        worker.shutdown();
        if (!rejected.isEmpty()) {
            log.info("Rejected " + rejected.size() + " pending command(s) on close");
        }
        return rejected;
    }

    /**
     * True while a command with this id is queued or running.
     */
    public boolean isPending(String commandId) {
        synchronized (lock) {
            if (inFlight != null && inFlight.commandId().equals(commandId)) {
                return true;
            }
            for (QueuedCommand command : queue) {
                if (command.commandId().equals(commandId)) {
                    return true;
                }
            }
            return false;
        }
    }

    public QueuedCommand inFlight() {
        synchronized (lock) {
            return inFlight;
        }
    }

    public ExecutionState state() {
        synchronized (lock) {
            return state;
        }
    }

    public int queuedCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public QueueSnapshot snapshot() {
        synchronized (lock) {
            return new QueueSnapshot(state,
                    inFlight != null ? inFlight.commandId() : null,
                    inFlight != null ? inFlight.command() : null,
                    inFlight != null ? inFlight.source() : null,
                    queue.size());
        }
    }

    // caller holds the lock
    private void startNext() {
        if (state != ExecutionState.IDLE || queue.isEmpty()) {
            return;
        }
        QueuedCommand next = queue.pollFirst();
        inFlight = next;
        state = ExecutionState.EXECUTING;
        worker.execute(() -> run(next));
    }

    private void run(QueuedCommand command) {
        long startedAt = System.currentTimeMillis();
        try {
            if (command.completion().isDone()) {
                return;
            }
            safely("start", () -> lifecycle.onStart(command));
            ShellResult shellResult = shell.execute(command.command(),
                    (stream, chunk) -> safely("output", () -> lifecycle.onOutput(command, stream, chunk)));
            CommandResult result = new CommandResult(shellResult.stdout(), shellResult.stderr(),
                    shellResult.exitCode());
            if (!command.completion().isDone()) {
                long duration = System.currentTimeMillis() - startedAt;
                safely("complete", () -> lifecycle.onComplete(command, result, startedAt, duration));
                command.completion().complete(result);
            }
        } catch (IOException e) {
            fail(command, new TransportException("Command '" + command.commandId() + "' failed on session '"
                    + sessionName + "': " + ErrorUtils.formatErrorMessage(e), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(command, new SessionDisconnectedException(sessionName));
        } catch (RuntimeException e) {
            fail(command, new TransportException("Command '" + command.commandId() + "' failed on session '"
                    + sessionName + "': " + ErrorUtils.formatErrorMessage(e), e));
        } finally {
            synchronized (lock) {
                if (inFlight == command) {
                    inFlight = null;
                    if (state == ExecutionState.EXECUTING) {
                        state = ExecutionState.IDLE;
                    }
                    startNext();
                }
            }
        }
    }

    private void fail(QueuedCommand command, RuntimeException error) {
        if (command.completion().isDone()) {
            return;
        }
        log.warn(error.getMessage());
        safely("failure", () -> lifecycle.onFailure(command, error));
        command.completion().completeExceptionally(error);
    }

    private void safely(String phase, Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Command " + phase + " hook failed: " + e.getMessage(), e);
        }
    }
}
