package com.termbridge.session.error;

/**
 * A command refused at admission: bad text, bad id, or a full queue.
 */
public class CommandRejectedException extends TerminalBridgeException {

    public CommandRejectedException(ErrorCode code, String message) {
        super(code, message);
    }

    public static CommandRejectedException queueFull(String sessionName, int maxQueueSize) {
        return new CommandRejectedException(ErrorCode.QUEUE_FULL,
                "Command queue for session '" + sessionName + "' is full (max " + maxQueueSize + ")");
    }
}
