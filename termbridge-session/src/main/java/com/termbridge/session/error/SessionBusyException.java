package com.termbridge.session.error;

import com.termbridge.session.model.CommandSource;

/**
 * Raised when the opposite protocol side already has a command in flight.
 */
public class SessionBusyException extends TerminalBridgeException {

    private final String sessionName;
    private final String currentCommand;
    private final CommandSource currentSource;

    public SessionBusyException(String sessionName, String currentCommand, CommandSource currentSource) {
        super(ErrorCode.SESSION_BUSY, "Session '" + sessionName + "' is busy executing a "
                + currentSource.wireName() + " command: " + currentCommand);
        this.sessionName = sessionName;
        this.currentCommand = currentCommand;
        this.currentSource = currentSource;
    }

    public String getSessionName() {
        return sessionName;
    }

    public String getCurrentCommand() {
        return currentCommand;
    }

    public CommandSource getCurrentSource() {
        return currentSource;
    }
}
