package com.termbridge.session.broadcast;

import com.termbridge.session.model.TerminalOutputEntry;

@FunctionalInterface
public interface TerminalOutputListener {

    void onOutput(TerminalOutputEntry entry);
}
