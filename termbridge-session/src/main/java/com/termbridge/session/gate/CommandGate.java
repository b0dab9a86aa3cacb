package com.termbridge.session.gate;

import com.termbridge.session.error.BrowserCommandsExecutedException;
import com.termbridge.session.error.SessionBusyException;
import com.termbridge.session.model.CommandSource;
import com.termbridge.session.model.CommandSource.ProtocolSide;

/**
 * Admission policy between the streaming and control protocol sides.
 *
 * <p>
 * Must be called under the session lock, right before the command is
 * queued. Agent commands are first held back while the human has unreported
 * commands; then a command is refused while the other side has one in flight.
 * System commands are never gated and never block anyone.
 */
public final class CommandGate {

    /**
     * What the gate needs to know about a session.
     */
    public interface GateView {
        String sessionName();

        BrowserCommandBuffer browserCommands();

        /** Source of the command in flight, or null when idle. */
        CommandSource inFlightSource();

        String inFlightCommand();
    }

    public void check(GateView view, CommandSource requester) {
        if (requester == CommandSource.CLAUDE && !view.browserCommands().isEmpty()) {
            throw new BrowserCommandsExecutedException(view.sessionName(), view.browserCommands().drain());
        }
        CommandSource running = view.inFlightSource();
        if (running != null && collides(running, requester)) {
            throw new SessionBusyException(view.sessionName(), view.inFlightCommand(), running);
        }
    }

    /**
     * True when the two sources sit on opposite protocol sides.
     */
    public static boolean collides(CommandSource running, CommandSource requester) {
        ProtocolSide a = running.side();
        ProtocolSide b = requester.side();
        if (a == ProtocolSide.NONE || b == ProtocolSide.NONE) {
            return false;
        }
        return a != b;
    }
}
