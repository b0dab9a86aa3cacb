package com.termbridge.gateway.terminal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termbridge.gateway.support.FakeWebSocketSession;
import com.termbridge.session.engine.SessionLimits;
import com.termbridge.session.engine.TerminalSessionManager;
import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.registry.SessionRegistry;
import com.termbridge.session.remote.TerminalSignal;
import com.termbridge.session.support.FakeRemoteConnector;
import com.termbridge.session.support.FakeRemoteShell;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TerminalWebSocketHandlerTest {

    private static final String SESSION = "web1";
    private static final long WAIT_MS = 5_000;

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeRemoteConnector connector;
    private SessionRegistry registry;
    private TerminalSessionManager manager;
    private TerminalWebSocketHandler handler;
    private FakeWebSocketSession ws;

    @BeforeEach
    void setUp() {
        connector = new FakeRemoteConnector();
        registry = new SessionRegistry(connector, SessionLimits.defaults());
        manager = new TerminalSessionManager(registry);
        registry.connect(FakeRemoteConnector.config(SESSION));
        handler = new TerminalWebSocketHandler(mapper, manager);
        ws = open("c1", SESSION);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private FakeWebSocketSession open(String id, String sessionName) {
        FakeWebSocketSession session = new FakeWebSocketSession(id);
        session.getAttributes().put(TerminalWebSocketHandler.SESSION_NAME_ATTRIBUTE, sessionName);
        handler.afterConnectionEstablished(session);
        return session;
    }

    private void send(Object frame) throws Exception {
        handler.handleTextMessage(ws, new TextMessage(mapper.writeValueAsString(frame)));
    }

    private FakeRemoteShell shell() {
        return connector.shell(SESSION);
    }

    @Nested
    class Lifecycle {

        @Test
        void open_unknownSession_sendsErrorAndCloses() throws Exception {
            FakeWebSocketSession other = open("c2", "nope");

            JsonNode frame = other.nextFrame(WAIT_MS);
            assertEquals("error", frame.get("type").asText());
            assertEquals("SESSION_NOT_FOUND", frame.get("error").asText());
            assertFalse(other.isOpen());
            assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), other.getCloseStatus().getCode());
            assertEquals(1, handler.getClientCount());
        }

        @Test
        void open_registersOutputListener() {
            assertEquals(1, registry.get(SESSION).getBroadcaster().getListenerCount());
        }

        @Test
        void close_removesOutputListener() {
            handler.afterConnectionClosed(ws, CloseStatus.NORMAL);

            assertEquals(0, registry.get(SESSION).getBroadcaster().getListenerCount());
            assertEquals(0, handler.getClientCount());
        }

        @Test
        void disconnect_streamsClosedNotice() throws Exception {
            registry.disconnect(SESSION);

            JsonNode frame = ws.nextFrameOfType("terminal_output", WAIT_MS);
            assertEquals("Connection to web1.example.com closed\r\n", frame.get("data").asText());
            assertEquals("system", frame.get("source").asText());
            assertTrue(frame.get("commandId").isNull());
        }
    }

    @Nested
    class Input {

        @Test
        void terminalInput_streamsEchoOutputThenReady() throws Exception {
            send(Map.of("type", "terminal_input", "sessionName", SESSION, "command", "pwd", "commandId", "b1"));

            JsonNode echo = ws.nextFrame(WAIT_MS);
            assertEquals("terminal_output", echo.get("type").asText());
            assertEquals("[alice@web1.example.com ~]$ pwd\r\n", echo.get("data").asText());
            assertEquals("b1", echo.get("commandId").asText());
            assertEquals("user", echo.get("source").asText());
            assertTrue(echo.get("user-initiated").asBoolean());
            assertEquals(SESSION, echo.get("sessionName").asText());

            JsonNode output = ws.nextFrame(WAIT_MS);
            assertEquals("/home/alice\r\n", output.get("data").asText());

            JsonNode ready = ws.nextFrameOfType("terminal_ready", WAIT_MS);
            assertNotNull(ready);
            assertEquals("b1", ready.get("commandId").asText());
        }

        @Test
        void terminalInput_populatesBrowserBuffer() throws Exception {
            send(Map.of("type", "terminal_input", "command", "ls", "commandId", "b7"));
            assertNotNull(ws.nextFrameOfType("terminal_ready", WAIT_MS));

            var buffer = manager.getBrowserCommandBuffer(SESSION);
            assertEquals(1, buffer.size());
            assertEquals("b7", buffer.get(0).commandId());
            assertEquals(0, buffer.get(0).result().exitCode());
        }

        @Test
        void terminalInput_missingCommandId_sendsCommandError() throws Exception {
            send(Map.of("type", "terminal_input", "command", "ls"));

            JsonNode frame = ws.nextFrame(WAIT_MS);
            assertEquals("command_error", frame.get("type").asText());
            assertEquals("INVALID_COMMAND_ID", frame.get("error").asText());
            assertTrue(shell().getExecuted().isEmpty());
        }

        @Test
        void terminalInput_exit_isRejected() throws Exception {
            send(Map.of("type", "terminal_input", "command", "exit", "commandId", "b2"));

            JsonNode frame = ws.nextFrame(WAIT_MS);
            assertEquals("command_error", frame.get("type").asText());
            assertEquals("SESSION_TERMINATING_COMMAND", frame.get("error").asText());
            assertEquals("b2", frame.get("commandId").asText());
        }

        @Test
        void terminalInput_whileAgentRuns_sendsSessionBusy() throws Exception {
            var agent = manager.enqueue(SESSION, "block a1", CommandOptions.claude());
            assertTrue(shell().awaitStarted("a1", WAIT_MS));

            send(Map.of("type", "terminal_input", "command", "ls", "commandId", "b3"));

            JsonNode error = ws.nextFrameOfType("command_error", WAIT_MS);
            assertEquals("SESSION_BUSY", error.get("error").asText());
            assertTrue(manager.getBrowserCommandBuffer(SESSION).isEmpty());

            shell().release("a1");
            agent.get(WAIT_MS, TimeUnit.MILLISECONDS);
        }

        @Test
        void agentOutput_isStreamedWithClaudeSource() throws Exception {
            manager.enqueue(SESSION, "whoami", CommandOptions.claude()).get(WAIT_MS, TimeUnit.MILLISECONDS);

            JsonNode echo = ws.nextFrame(WAIT_MS);
            assertEquals("claude", echo.get("source").asText());
            assertFalse(echo.get("user-initiated").asBoolean());
            assertTrue(echo.get("data").asText().endsWith("$ whoami\r\n"));
            assertEquals("alice\r\n", ws.nextFrame(WAIT_MS).get("data").asText());
        }
    }

    @Nested
    class Control {

        @Test
        void resize_updatesShell() throws Exception {
            send(Map.of("type", "terminal_resize", "cols", 120, "rows", 40));

            assertEquals(120, shell().getCols());
            assertEquals(40, shell().getRows());
            assertEquals(0, ws.pendingFrames());
        }

        @Test
        void resize_outOfRange_sendsError() throws Exception {
            send(Map.of("type", "terminal_resize", "cols", 0, "rows", 40));

            JsonNode frame = ws.nextFrame(WAIT_MS);
            assertEquals("error", frame.get("type").asText());
            assertEquals("INVALID_TERMINAL_SIZE", frame.get("error").asText());
        }

        @Test
        void resize_nonNumeric_sendsError() throws Exception {
            send(Map.of("type", "terminal_resize", "cols", "wide", "rows", 40));

            assertEquals("error", ws.nextFrame(WAIT_MS).get("type").asText());
        }

        @Test
        void signal_isDelivered() throws Exception {
            send(Map.of("type", "terminal_signal", "signal", "SIGINT"));

            assertEquals(java.util.List.of(TerminalSignal.SIGINT), shell().getSignals());
        }

        @Test
        void signal_unsupported_sendsError() throws Exception {
            send(Map.of("type", "terminal_signal", "signal", "SIGKILL"));

            JsonNode frame = ws.nextFrame(WAIT_MS);
            assertEquals("UNSUPPORTED_SIGNAL", frame.get("error").asText());
        }
    }

    @Nested
    class Malformed {

        @Test
        void invalidJson_sendsError() throws Exception {
            handler.handleTextMessage(ws, new TextMessage("{not json"));

            JsonNode frame = ws.nextFrame(WAIT_MS);
            assertEquals("error", frame.get("type").asText());
            assertTrue(ws.isOpen());
        }

        @Test
        void unknownType_sendsError() throws Exception {
            send(Map.of("type", "terminal_paste"));

            JsonNode frame = ws.nextFrame(WAIT_MS);
            assertEquals("error", frame.get("type").asText());
            assertTrue(frame.get("message").asText().contains("terminal_paste"));
        }

        @Test
        void otherSessionName_sendsError() throws Exception {
            send(Map.of("type", "terminal_input", "sessionName", "db1", "command", "ls", "commandId", "b1"));

            assertEquals("error", ws.nextFrame(WAIT_MS).get("type").asText());
            assertTrue(shell().getExecuted().isEmpty());
        }
    }
}
