package com.termbridge.session.gate;

import com.termbridge.session.model.BrowserCommandEntry;
import com.termbridge.session.model.CommandResult;
import com.termbridge.session.model.CommandSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-issued commands the agent has not been told about yet.
 *
 * <p>
 * Entries are appended when a user command is admitted and carry the pending
 * result until that command finishes. {@link #drain()} hands everything over
 * and empties the buffer in one step. All access goes through the owning
 * session's lock.
 */
public class BrowserCommandBuffer {

    private final Object lock;
    private final List<Slot> slots = new ArrayList<>();

    public BrowserCommandBuffer(Object lock) {
        this.lock = lock;
    }

    public void append(String command, String commandId, CommandSource source, long timestamp) {
        synchronized (lock) {
            slots.add(new Slot(command, commandId, source, timestamp));
        }
    }

    /**
     * Fill in the result of a still-buffered command. Does nothing once the
     * entry has been drained.
     */
    public void recordResult(String commandId, CommandResult result) {
        synchronized (lock) {
            for (Slot slot : slots) {
                if (slot.commandId.equals(commandId)) {
                    slot.result = result;
                    return;
                }
            }
        }
    }

    /**
     * Forget a command that never ran, e.g. one cancelled while queued.
     */
    public void remove(String commandId) {
        synchronized (lock) {
            slots.removeIf(slot -> slot.commandId.equals(commandId));
        }
    }

    public boolean contains(String commandId) {
        synchronized (lock) {
            for (Slot slot : slots) {
                if (slot.commandId.equals(commandId)) {
                    return true;
                }
            }
            return false;
        }
    }

    public List<BrowserCommandEntry> drain() {
        synchronized (lock) {
            List<BrowserCommandEntry> drained = toEntries();
            slots.clear();
            return drained;
        }
    }

    public List<BrowserCommandEntry> snapshot() {
        synchronized (lock) {
            return toEntries();
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return slots.isEmpty();
        }
    }

    public int size() {
        synchronized (lock) {
            return slots.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            slots.clear();
        }
    }

    private List<BrowserCommandEntry> toEntries() {
        List<BrowserCommandEntry> entries = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            entries.add(new BrowserCommandEntry(slot.command, slot.commandId, slot.timestamp, slot.source, slot.result));
        }
        return List.copyOf(entries);
    }

    private static final class Slot {
        final String command;
        final String commandId;
        final CommandSource source;
        final long timestamp;
        CommandResult result = CommandResult.PENDING;

        Slot(String command, String commandId, CommandSource source, long timestamp) {
            this.command = command;
            this.commandId = commandId;
            this.source = source;
            this.timestamp = timestamp;
        }
    }
}
