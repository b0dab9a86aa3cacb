package com.termbridge.session.error;

public class CommandCancelledException extends TerminalBridgeException {

    public CommandCancelledException(String sessionName, String commandId) {
        super(ErrorCode.COMMAND_CANCELLED,
                "Command '" + commandId + "' in session '" + sessionName + "' was cancelled before it started");
    }
}
