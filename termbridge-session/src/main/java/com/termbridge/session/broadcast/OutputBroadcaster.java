package com.termbridge.session.broadcast;

import com.termbridge.common.logging.SubsystemLogger;
import com.termbridge.session.model.TerminalOutputEntry;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans one session's output out to every registered listener.
 *
 * <p>
 * Delivery is synchronous and serialized, so each listener sees entries in
 * the order they were produced. A failing listener is logged and skipped; it
 * never affects the others or the command that produced the output.
 */
public class OutputBroadcaster {

    private static final SubsystemLogger LOG = SubsystemLogger.create("session/broadcast");

    private final String sessionName;
    private final SubsystemLogger log;
    private final Set<TerminalOutputListener> listeners = ConcurrentHashMap.newKeySet();

    public OutputBroadcaster(String sessionName) {
        this.sessionName = sessionName;
        this.log = LOG.forSession(sessionName);
    }

    public void addListener(TerminalOutputListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TerminalOutputListener listener) {
        listeners.remove(listener);
    }

    public synchronized void broadcast(TerminalOutputEntry entry) {
        if (entry.output() == null || entry.output().isEmpty()) {
            return;
        }
        for (TerminalOutputListener listener : listeners) {
            try {
                listener.onOutput(entry);
            } catch (RuntimeException e) {
                log.warn("Output listener failed for command " + entry.commandId() + ": " + e.getMessage());
            }
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }

    public String getSessionName() {
        return sessionName;
    }
}
