package com.termbridge.session.remote;

import com.jcraft.jsch.ChannelShell;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.termbridge.session.error.ConnectionFailedException;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Opens SSH shells with JSch.
 */
@Slf4j
public class JschRemoteConnector implements RemoteConnector {

    private static final int SERVER_ALIVE_COUNT_MAX = 3;

    private final TransportSettings settings;

    public JschRemoteConnector(TransportSettings settings) {
        this.settings = settings;
    }

    @Override
    public RemoteShell connect(ConnectionConfig config, TransportListener listener) {
        String target = config.getUsername() + "@" + config.getHost() + ":" + config.getPort();
        log.info("Connecting session '{}' to {}", config.getName(), target);
        Session session = null;
        try {
            JSch jsch = new JSch();
            if (settings.knownHostsFile() != null && !settings.knownHostsFile().isBlank()) {
                jsch.setKnownHosts(expandHome(settings.knownHostsFile()));
            }
            if (config.hasPrivateKey()) {
                byte[] passphrase = config.getPassphrase() != null
                        ? config.getPassphrase().getBytes(StandardCharsets.UTF_8)
                        : null;
                jsch.addIdentity(config.getName(), config.getPrivateKey().getBytes(StandardCharsets.UTF_8),
                        null, passphrase);
            }
            session = jsch.getSession(config.getUsername(), config.getHost(), config.getPort());
            if (config.hasPassword()) {
                session.setPassword(config.getPassword());
            }
            session.setConfig("StrictHostKeyChecking", settings.strictHostKeyChecking());
            session.setConfig("PreferredAuthentications", "publickey,password");
            if (settings.keepAliveIntervalMs() > 0) {
                session.setServerAliveInterval(settings.keepAliveIntervalMs());
                session.setServerAliveCountMax(SERVER_ALIVE_COUNT_MAX);
            }
            session.connect(settings.connectTimeoutMs());

            ChannelShell channel = (ChannelShell) session.openChannel("shell");
            channel.setPty(settings.pty());
            if (settings.pty()) {
                channel.setPtyType("xterm-256color", settings.terminalCols(), settings.terminalRows(), 0, 0);
            }
            InputStream stdout = channel.getInputStream();
            InputStream stderr = channel.getExtInputStream();
            OutputStream stdin = channel.getOutputStream();
            channel.connect(settings.connectTimeoutMs());

            JschRemoteShell shell = new JschRemoteShell(config.getUsername() + "@" + config.getHost(),
                    session, channel, settings.pty(), stdin, stdout, stderr, listener);
            shell.start();
            try {
                shell.bootstrap(settings.connectTimeoutMs());
            } catch (IOException | InterruptedException e) {
                shell.close();
                throw e;
            }
            log.info("Session '{}' connected to {}", config.getName(), target);
            return shell;
        } catch (JSchException | IOException e) {
            disconnectQuietly(session);
            ConnectionFailedException failure = ConnectFailures.classify(target, e);
            log.warn("Connect failed for session '{}': {} ({})", config.getName(), failure.getMessage(),
                    failure.errorCode());
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disconnectQuietly(session);
            throw new ConnectionFailedException(ErrorCode.CONNECT_TIMEOUT,
                    "Interrupted while connecting to " + target, e);
        }
    }

    private static void disconnectQuietly(Session session) {
        if (session != null && session.isConnected()) {
            session.disconnect();
        }
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + path.substring(1)).toString();
        }
        return path;
    }
}
