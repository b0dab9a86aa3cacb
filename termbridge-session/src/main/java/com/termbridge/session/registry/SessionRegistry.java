package com.termbridge.session.registry;

import com.termbridge.common.infra.ErrorUtils;
import com.termbridge.common.logging.LogRedact;
import com.termbridge.common.logging.SubsystemLogger;
import com.termbridge.session.engine.CommandValidator;
import com.termbridge.session.engine.SessionLimits;
import com.termbridge.session.engine.TerminalSession;
import com.termbridge.session.error.DuplicateSessionException;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.error.InvalidRequestException;
import com.termbridge.session.error.SessionNotFoundException;
import com.termbridge.session.model.ConnectionConfig;
import com.termbridge.session.model.ConnectionStatus;
import com.termbridge.session.model.SessionInfo;
import com.termbridge.session.remote.RemoteConnector;
import com.termbridge.session.remote.RemoteShell;
import com.termbridge.session.remote.ShellStream;
import com.termbridge.session.remote.TransportListener;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named sessions and their lifecycle: connect, look up, record transport
 * status, disconnect.
 */
public class SessionRegistry {

    private static final SubsystemLogger log = SubsystemLogger.create("session/registry");

    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();
    private final Set<String> connecting = ConcurrentHashMap.newKeySet();
    private final RemoteConnector connector;
    private final SessionLimits limits;
    private final boolean redactLogs;

    public SessionRegistry(RemoteConnector connector, SessionLimits limits) {
        this(connector, limits, true);
    }

    public SessionRegistry(RemoteConnector connector, SessionLimits limits, boolean redactLogs) {
        this.connector = connector;
        this.limits = limits;
        this.redactLogs = redactLogs;
    }

    /**
     * Open the remote shell and register the session under its name.
     *
     * @throws DuplicateSessionException if the name is taken or being
     *                                   connected
     */
    public TerminalSession connect(ConnectionConfig config) {
        validate(config);
        String name = config.getName();
        if (!connecting.add(name)) {
            throw new DuplicateSessionException(name);
        }
        try {
            if (sessions.containsKey(name)) {
                throw new DuplicateSessionException(name);
            }
            log.debug("Connecting " + LogRedact.redact(config.toString(), redactLogs));
            RemoteShell shell = connector.connect(config, new SessionEvents(name));
            TerminalSession session = new TerminalSession(config, shell, limits);
            if (sessions.putIfAbsent(name, session) != null) {
                session.close();
                throw new DuplicateSessionException(name);
            }
            log.info("Session connected", Map.of("session", name, "host", config.getHost(),
                    "user", config.getUsername()));
            return session;
        } finally {
            connecting.remove(name);
        }
    }

    /**
     * Close and unregister a session. Every queued and in-flight command is
     * rejected with SESSION_DISCONNECTED.
     */
    public void disconnect(String name) {
        TerminalSession session = get(name);
        session.close();
        sessions.remove(name, session);
        log.info("Session disconnected", Map.of("session", name));
    }

    public TerminalSession get(String name) {
        TerminalSession session = sessions.get(name);
        if (session == null) {
            throw new SessionNotFoundException(name);
        }
        return session;
    }

    public Optional<TerminalSession> find(String name) {
        return Optional.ofNullable(name != null ? sessions.get(name) : null);
    }

    public boolean hasSession(String name) {
        return name != null && sessions.containsKey(name);
    }

    public List<SessionInfo> list() {
        return sessions.values().stream()
                .map(TerminalSession::info)
                .sorted(Comparator.comparing(SessionInfo::name))
                .toList();
    }

    public void markStatus(String name, ConnectionStatus status, String detail) {
        find(name).ifPresent(session -> session.markStatus(status, detail));
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Disconnect every session.
     */
    public void shutdown() {
        List<String> names = new ArrayList<>(sessions.keySet());
        for (String name : names) {
            try {
                disconnect(name);
            } catch (RuntimeException e) {
                log.warn("Failed to disconnect " + name + ": " + ErrorUtils.formatErrorMessage(e));
            }
        }
        if (!names.isEmpty()) {
            log.info("Registry shut down", Map.of("sessions", names.size()));
        }
    }

    private static void validate(ConnectionConfig config) {
        if (config == null) {
            throw new InvalidRequestException(ErrorCode.INVALID_CONNECTION_CONFIG, "Connection config is required");
        }
        CommandValidator.validateSessionName(config.getName());
        if (config.getHost() == null || config.getHost().isBlank()) {
            throw new InvalidRequestException(ErrorCode.INVALID_CONNECTION_CONFIG, "host is required");
        }
        if (config.getUsername() == null || config.getUsername().isBlank()) {
            throw new InvalidRequestException(ErrorCode.INVALID_CONNECTION_CONFIG, "username is required");
        }
        if (config.getPort() < 1 || config.getPort() > 65535) {
            throw new InvalidRequestException(ErrorCode.INVALID_CONNECTION_CONFIG,
                    "port out of range: " + config.getPort());
        }
        if (!config.hasPassword() && !config.hasPrivateKey()) {
            throw new InvalidRequestException(ErrorCode.INVALID_CONNECTION_CONFIG,
                    "Either password or privateKey is required");
        }
    }

    /**
     * Routes transport callbacks to the session by name. Events that arrive
     * before registration, i.e. during shell bootstrap, are dropped.
     */
    private final class SessionEvents implements TransportListener {
        private final String name;

        SessionEvents(String name) {
            this.name = name;
        }

        @Override
        public void onStatusChange(ConnectionStatus status, String detail) {
            markStatus(name, status, detail);
        }

        @Override
        public void onUnsolicitedOutput(ShellStream stream, String chunk) {
            find(name).ifPresent(session -> session.onUnsolicitedOutput(stream, chunk));
        }
    }
}
