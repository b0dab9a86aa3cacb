package com.termbridge.session.engine;

import com.termbridge.session.broadcast.TerminalOutputListener;
import com.termbridge.session.gate.CommandGate;
import com.termbridge.session.model.BrowserCommandEntry;
import com.termbridge.session.model.CommandHistoryEntry;
import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.model.CommandResult;
import com.termbridge.session.model.CommandSource;
import com.termbridge.session.registry.SessionRegistry;
import com.termbridge.session.remote.TerminalSignal;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Name-addressed entry point shared by both protocol adapters.
 */
public class TerminalSessionManager {

    private final SessionRegistry registry;
    private final CommandGate gate;

    public TerminalSessionManager(SessionRegistry registry) {
        this(registry, new CommandGate());
    }

    public TerminalSessionManager(SessionRegistry registry, CommandGate gate) {
        this.registry = registry;
        this.gate = gate;
    }

    /**
     * Admit a command to the named session.
     *
     * @return future resolved with the result once the command ran; a
     *         non-zero exit code resolves normally
     */
    public CompletableFuture<CommandResult> enqueue(String sessionName, String command, CommandOptions options) {
        return registry.get(sessionName).enqueue(command, options, gate);
    }

    public int cancelCommands(String sessionName, CommandSource source) {
        return registry.get(sessionName).cancel(source);
    }

    public void sendTerminalSignal(String sessionName, String signal) {
        registry.get(sessionName).sendSignal(TerminalSignal.parse(signal));
    }

    public void resizeTerminal(String sessionName, int cols, int rows) {
        registry.get(sessionName).resize(cols, rows);
    }

    public List<CommandHistoryEntry> getCommandHistory(String sessionName) {
        return registry.get(sessionName).getHistory().snapshot();
    }

    public void addHistoryListener(String sessionName, Consumer<CommandHistoryEntry> listener) {
        registry.get(sessionName).getHistory().addListener(listener);
    }

    public void removeHistoryListener(String sessionName, Consumer<CommandHistoryEntry> listener) {
        registry.find(sessionName).ifPresent(session -> session.getHistory().removeListener(listener));
    }

    public void addOutputListener(String sessionName, TerminalOutputListener listener) {
        registry.get(sessionName).getBroadcaster().addListener(listener);
    }

    /**
     * No-op when the session is already gone.
     */
    public void removeOutputListener(String sessionName, TerminalOutputListener listener) {
        registry.find(sessionName).ifPresent(session -> session.getBroadcaster().removeListener(listener));
    }

    /**
     * Unreported human commands, without draining them.
     */
    public List<BrowserCommandEntry> getBrowserCommandBuffer(String sessionName) {
        return registry.get(sessionName).browserCommands().snapshot();
    }

    public QueueSnapshot snapshot(String sessionName) {
        return registry.get(sessionName).snapshot();
    }

    public SessionRegistry getRegistry() {
        return registry;
    }
}
