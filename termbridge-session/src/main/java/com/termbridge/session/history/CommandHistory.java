package com.termbridge.session.history;

import com.termbridge.common.logging.SubsystemLogger;
import com.termbridge.session.model.CommandHistoryEntry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Bounded per-session record of finished commands, oldest first. Appending
 * past the limit evicts the oldest entry.
 */
public class CommandHistory {

    private static final SubsystemLogger LOG = SubsystemLogger.create("session/history");

    private final int limit;
    private final Deque<CommandHistoryEntry> entries;
    private final Set<Consumer<CommandHistoryEntry>> listeners = ConcurrentHashMap.newKeySet();
    private final SubsystemLogger log;

    public CommandHistory(String sessionName, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive: " + limit);
        }
        this.limit = limit;
        this.entries = new ArrayDeque<>(limit);
        this.log = LOG.forSession(sessionName);
    }

    public void append(CommandHistoryEntry entry) {
        synchronized (entries) {
            if (entries.size() == limit) {
                entries.pollFirst();
            }
            entries.addLast(entry);
        }
        for (Consumer<CommandHistoryEntry> listener : listeners) {
            try {
                listener.accept(entry);
            } catch (RuntimeException e) {
                log.warn("History listener failed: " + e.getMessage());
            }
        }
    }

    public List<CommandHistoryEntry> snapshot() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getLimit() {
        return limit;
    }

    public void addListener(Consumer<CommandHistoryEntry> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<CommandHistoryEntry> listener) {
        listeners.remove(listener);
    }

    public void clearListeners() {
        listeners.clear();
    }
}
