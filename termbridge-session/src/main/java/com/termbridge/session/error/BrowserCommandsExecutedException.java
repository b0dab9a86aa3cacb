package com.termbridge.session.error;

import com.termbridge.session.model.BrowserCommandEntry;

import java.util.List;

/**
 * Tells the agent that the human ran commands since its last look. Carries the
 * drained entries; the buffer is already empty when this is thrown.
 */
public class BrowserCommandsExecutedException extends TerminalBridgeException {

    private final String sessionName;
    private final List<BrowserCommandEntry> browserCommands;

    public BrowserCommandsExecutedException(String sessionName, List<BrowserCommandEntry> browserCommands) {
        super(ErrorCode.BROWSER_COMMANDS_EXECUTED, "User executed " + browserCommands.size()
                + " command(s) in session '" + sessionName + "' since the last agent command");
        this.sessionName = sessionName;
        this.browserCommands = List.copyOf(browserCommands);
    }

    public String getSessionName() {
        return sessionName;
    }

    public List<BrowserCommandEntry> getBrowserCommands() {
        return browserCommands;
    }
}
