package com.termbridge.gateway.control;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termbridge.common.config.ConfigDefaults;
import com.termbridge.common.config.TermBridgeConfig;
import com.termbridge.session.engine.SessionLimits;
import com.termbridge.session.engine.TerminalSessionManager;
import com.termbridge.session.error.ConnectionFailedException;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.registry.SessionRegistry;
import com.termbridge.session.support.FakeRemoteConnector;
import com.termbridge.session.support.FakeRemoteShell;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SshToolRegistrarTest {

    private static final String SESSION = "web1";
    private static final long WAIT_MS = 5_000;

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeRemoteConnector connector;
    private SessionRegistry registry;
    private TerminalSessionManager manager;
    private ControlToolRouter router;

    @BeforeEach
    void setUp() {
        connector = new FakeRemoteConnector();
        registry = new SessionRegistry(connector, SessionLimits.defaults());
        manager = new TerminalSessionManager(registry);
        router = new ControlToolRouter();
        TermBridgeConfig config = ConfigDefaults.apply(new TermBridgeConfig());
        config.getWeb().setPort(8081);
        new SshToolRegistrar(router, manager, config.getWeb()).registerTools();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private Map<String, Object> call(String tool, Map<String, Object> args) throws Exception {
        return callAsync(tool, args).get(WAIT_MS, TimeUnit.MILLISECONDS);
    }

    private CompletableFuture<Map<String, Object>> callAsync(String tool, Map<String, Object> args) {
        JsonNode node = mapper.valueToTree(args);
        return router.dispatch(tool, node);
    }

    private void connect() throws Exception {
        Map<String, Object> result = call("ssh_connect", Map.of("name", SESSION, "host", "web1.example.com",
                "username", "alice", "password", "s3cret"));
        assertEquals(true, result.get("success"), () -> "connect failed: " + result);
    }

    private FakeRemoteShell shell() {
        return connector.shell(SESSION);
    }

    private JsonNode json(Object value) {
        return mapper.valueToTree(value);
    }

    @Test
    void registerTools_registersAllSshTools() {
        assertEquals(java.util.Set.of("ssh_connect", "ssh_exec", "ssh_list_sessions", "ssh_disconnect",
                "ssh_get_monitoring_url", "ssh_cancel_command"), router.getRegisteredTools());
    }

    @Nested
    class Connect {

        @Test
        void connect_returnsConnectionInfo() throws Exception {
            Map<String, Object> result = call("ssh_connect", Map.of("name", SESSION, "host", "web1.example.com",
                    "port", 2222, "username", "alice", "password", "s3cret"));

            assertEquals(true, result.get("success"));
            JsonNode connection = json(result.get("connection"));
            assertEquals(SESSION, connection.get("name").asText());
            assertEquals("web1.example.com", connection.get("host").asText());
            assertEquals("alice", connection.get("username").asText());
            assertEquals("connected", connection.get("status").asText());
            assertTrue(connection.hasNonNull("lastActivity"));
            assertTrue(registry.hasSession(SESSION));
        }

        @Test
        void connect_duplicateName_fails() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_connect", Map.of("name", SESSION, "host", "other",
                    "username", "bob", "password", "x"));

            assertEquals(false, result.get("success"));
            assertEquals("DUPLICATE_SESSION", result.get("error"));
        }

        @Test
        void connect_withoutCredentials_fails() throws Exception {
            Map<String, Object> result = call("ssh_connect", Map.of("name", SESSION, "host", "web1.example.com",
                    "username", "alice"));

            assertEquals("INVALID_CONNECTION_CONFIG", result.get("error"));
            assertFalse(registry.hasSession(SESSION));
        }

        @Test
        void connect_authRejected_reportsClassifiedCode() throws Exception {
            connector.failNextConnect(new ConnectionFailedException(ErrorCode.AUTHENTICATION_FAILED,
                    "Auth fail", null));

            Map<String, Object> result = call("ssh_connect", Map.of("name", SESSION, "host", "web1.example.com",
                    "username", "alice", "password", "wrong"));

            assertEquals("AUTHENTICATION_FAILED", result.get("error"));
        }
    }

    @Nested
    class Exec {

        @Test
        void exec_returnsCommandResult() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_exec", Map.of("sessionName", SESSION, "command", "pwd"));

            assertEquals(true, result.get("success"));
            JsonNode commandResult = json(result.get("result"));
            assertEquals("/home/alice", commandResult.get("stdout").asText());
            assertEquals("", commandResult.get("stderr").asText());
            assertEquals(0, commandResult.get("exitCode").asInt());
            assertEquals(1, manager.getCommandHistory(SESSION).size());
        }

        @Test
        void exec_nonZeroExit_isSuccessfulCall() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_exec", Map.of("sessionName", SESSION, "command", "fail 3"));

            assertEquals(true, result.get("success"));
            assertEquals(3, json(result.get("result")).get("exitCode").asInt());
        }

        @Test
        void exec_unknownSession_fails() throws Exception {
            Map<String, Object> result = call("ssh_exec", Map.of("sessionName", "nope", "command", "ls"));

            assertEquals(false, result.get("success"));
            assertEquals("SESSION_NOT_FOUND", result.get("error"));
        }

        @Test
        void exec_afterUserCommand_returnsBrowserCommandsThenSucceeds() throws Exception {
            connect();
            manager.enqueue(SESSION, "ls", CommandOptions.user("b1")).get(WAIT_MS, TimeUnit.MILLISECONDS);

            Map<String, Object> first = call("ssh_exec", Map.of("sessionName", SESSION, "command", "whoami"));

            assertEquals(false, first.get("success"));
            assertEquals("BROWSER_COMMANDS_EXECUTED", first.get("error"));
            assertEquals(true, first.get("retryAllowed"));
            JsonNode commands = json(first.get("browserCommands"));
            assertEquals(1, commands.size());
            assertEquals("ls", commands.get(0).get("command").asText());
            assertEquals("b1", commands.get(0).get("commandId").asText());
            assertEquals("user", commands.get(0).get("source").asText());
            assertEquals("notes.txt\nsrc", commands.get(0).get("result").get("stdout").asText());

            Map<String, Object> second = call("ssh_exec", Map.of("sessionName", SESSION, "command", "whoami"));
            assertEquals(true, second.get("success"));
            assertEquals("alice", json(second.get("result")).get("stdout").asText());
            assertEquals(List.of("ls", "whoami"), shell().getExecuted());
        }

        @Test
        void exec_whileUserCommandRuns_isBusyAfterBufferDrained() throws Exception {
            connect();
            var user = manager.enqueue(SESSION, "block u1", CommandOptions.user("b1"));
            assertTrue(shell().awaitStarted("u1", WAIT_MS));

            Map<String, Object> drained = call("ssh_exec", Map.of("sessionName", SESSION, "command", "pwd"));
            assertEquals("BROWSER_COMMANDS_EXECUTED", drained.get("error"));

            Map<String, Object> busy = call("ssh_exec", Map.of("sessionName", SESSION, "command", "pwd"));
            assertEquals(false, busy.get("success"));
            assertEquals("SESSION_BUSY", busy.get("error"));
            assertEquals(true, busy.get("retryAllowed"));
            assertFalse(busy.containsKey("browserCommands"));

            shell().release("u1");
            user.get(WAIT_MS, TimeUnit.MILLISECONDS);
        }

        @Test
        void exec_timeout_stopsWaitingButCommandKeepsRunning() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_exec", Map.of("sessionName", SESSION, "command", "block t1",
                    "timeout", 100));

            assertEquals(false, result.get("success"));
            assertEquals("TIMEOUT", result.get("error"));
            assertEquals("block t1", manager.snapshot(SESSION).inFlightCommand());

            shell().release("t1");
            long deadline = System.currentTimeMillis() + WAIT_MS;
            while (manager.getCommandHistory(SESSION).isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, manager.getCommandHistory(SESSION).size());
            assertEquals(0, manager.getCommandHistory(SESSION).get(0).exitCode());
        }

        @Test
        void exec_sessionTerminatingCommand_isRejected() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_exec", Map.of("sessionName", SESSION, "command", "exit"));

            assertEquals("SESSION_TERMINATING_COMMAND", result.get("error"));
            assertTrue(shell().getExecuted().isEmpty());
        }
    }

    @Nested
    class Sessions {

        @Test
        void listSessions_returnsConnectedSessions() throws Exception {
            connect();
            registry.connect(FakeRemoteConnector.config("db1"));

            Map<String, Object> result = call("ssh_list_sessions", Map.of());

            JsonNode sessions = json(result.get("sessions"));
            assertEquals(2, sessions.size());
            assertEquals("db1", sessions.get(0).get("name").asText());
            assertEquals(SESSION, sessions.get(1).get("name").asText());
        }

        @Test
        void disconnect_removesSession() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_disconnect", Map.of("sessionName", SESSION));

            assertEquals(true, result.get("success"));
            assertFalse(registry.hasSession(SESSION));
        }

        @Test
        void disconnect_unknownSession_fails() throws Exception {
            Map<String, Object> result = call("ssh_disconnect", Map.of("sessionName", "nope"));

            assertEquals("SESSION_NOT_FOUND", result.get("error"));
        }

        @Test
        void monitoringUrl_isBuiltFromWebConfig() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_get_monitoring_url", Map.of("sessionName", SESSION));

            assertEquals("http://localhost:8081/session/web1", result.get("monitoringUrl"));
        }

        @Test
        void monitoringUrl_unknownSession_fails() throws Exception {
            Map<String, Object> result = call("ssh_get_monitoring_url", Map.of("sessionName", "nope"));

            assertEquals("SESSION_NOT_FOUND", result.get("error"));
        }
    }

    @Nested
    class Cancel {

        @Test
        void cancel_nothingRunning_reportsNoActiveCommand() throws Exception {
            connect();

            Map<String, Object> result = call("ssh_cancel_command", Map.of("sessionName", SESSION));

            assertEquals(false, result.get("success"));
            assertEquals("NO_ACTIVE_MCP_COMMAND", result.get("error"));
        }

        @Test
        void cancel_interruptsRunningAgentCommand() throws Exception {
            connect();
            CompletableFuture<Map<String, Object>> exec = callAsync("ssh_exec",
                    Map.of("sessionName", SESSION, "command", "block c1"));
            assertTrue(shell().awaitStarted("c1", WAIT_MS));

            Map<String, Object> result = call("ssh_cancel_command", Map.of("sessionName", SESSION));

            assertEquals(true, result.get("success"));
            assertEquals(1, result.get("cancelled"));
            Map<String, Object> execResult = exec.get(WAIT_MS, TimeUnit.MILLISECONDS);
            assertEquals(true, execResult.get("success"));
            assertEquals(130, json(execResult.get("result")).get("exitCode").asInt());
        }

        @Test
        void cancel_leavesUserCommandsAlone() throws Exception {
            connect();
            var user = manager.enqueue(SESSION, "block u2", CommandOptions.user("b2"));
            assertTrue(shell().awaitStarted("u2", WAIT_MS));

            Map<String, Object> result = call("ssh_cancel_command", Map.of("sessionName", SESSION));

            assertEquals("NO_ACTIVE_MCP_COMMAND", result.get("error"));
            assertTrue(shell().getSignals().isEmpty());
            shell().release("u2");
            user.get(WAIT_MS, TimeUnit.MILLISECONDS);
        }
    }
}
