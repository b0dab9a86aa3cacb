package com.termbridge.gateway.terminal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termbridge.common.infra.ErrorUtils;
import com.termbridge.session.broadcast.TerminalOutputListener;
import com.termbridge.session.engine.TerminalSessionManager;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.error.TerminalBridgeException;
import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.model.TerminalOutputEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streaming channel for one session's terminal, served at
 * {@code /ws/session/<name>}.
 *
 * <p>
 * Frames sent to the browser:
 * <ul>
 * <li>{@code {type:"terminal_output", sessionName, data, commandId, source, "user-initiated", timestamp}}</li>
 * <li>{@code {type:"terminal_ready", sessionName, commandId, timestamp}}</li>
 * <li>{@code {type:"command_error", sessionName, commandId, error, message, timestamp}}</li>
 * <li>{@code {type:"error", error?, message}}</li>
 * </ul>
 * Frames accepted: {@code terminal_input}, {@code terminal_signal},
 * {@code terminal_resize}.
 */
@Slf4j
public class TerminalWebSocketHandler extends TextWebSocketHandler {

    public static final String SESSION_NAME_ATTRIBUTE = "terminal.sessionName";

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final TerminalSessionManager manager;
    private final Map<String, TerminalClient> clients = new ConcurrentHashMap<>();

    public TerminalWebSocketHandler(ObjectMapper objectMapper, TerminalSessionManager manager) {
        this.objectMapper = objectMapper;
        this.manager = manager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession out = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS,
                SEND_BUFFER_LIMIT);
        String sessionName = (String) session.getAttributes().get(SESSION_NAME_ATTRIBUTE);
        if (sessionName == null || !manager.getRegistry().hasSession(sessionName)) {
            send(out, errorFrame(ErrorCode.SESSION_NOT_FOUND.name(), "Session '" + sessionName + "' not found"));
            log.debug("ws:reject conn={} session={}", session.getId(), sessionName);
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }
        TerminalOutputListener listener = entry -> send(out, outputFrame(entry));
        TerminalClient client = new TerminalClient(sessionName, out, listener);
        clients.put(session.getId(), client);
        try {
            manager.addOutputListener(sessionName, listener);
        } catch (TerminalBridgeException e) {
            clients.remove(session.getId());
            send(out, errorFrame(e.errorCode(), e.getMessage()));
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }
        log.info("ws:open conn={} session={}", session.getId(), sessionName);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        TerminalClient client = clients.get(session.getId());
        if (client == null) {
            return;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("parse error conn={}: {}", session.getId(), e.getOriginalMessage());
            send(client.out(), errorFrame(null, "Invalid JSON message"));
            return;
        }
        if (node == null || !node.isObject()) {
            send(client.out(), errorFrame(null, "Message must be a JSON object"));
            return;
        }
        String frameSession = text(node, "sessionName");
        if (frameSession != null && !frameSession.equals(client.sessionName())) {
            send(client.out(), errorFrame(null, "Message is for session '" + frameSession
                    + "' but this channel serves '" + client.sessionName() + "'"));
            return;
        }

        String type = text(node, "type");
        if (type == null) {
            send(client.out(), errorFrame(null, "Message type is required"));
            return;
        }
        switch (type) {
            case "terminal_input" -> handleInput(client, node);
            case "terminal_signal" -> handleSignal(client, node);
            case "terminal_resize" -> handleResize(client, node);
            default -> send(client.out(), errorFrame(null, "Unsupported message type: " + type));
        }
    }

    private void handleInput(TerminalClient client, JsonNode node) {
        String command = text(node, "command");
        String commandId = text(node, "commandId");
        try {
            manager.enqueue(client.sessionName(), command, CommandOptions.user(commandId))
                    .whenComplete((result, error) -> {
                        if (error == null) {
                            send(client.out(), readyFrame(client.sessionName(), commandId));
                        } else {
                            send(client.out(), commandErrorFrame(client.sessionName(), commandId, error));
                        }
                    });
        } catch (TerminalBridgeException e) {
            log.debug("ws:input rejected session={} commandId={}: {}", client.sessionName(), commandId,
                    e.getMessage());
            send(client.out(), commandErrorFrame(client.sessionName(), commandId, e));
        }
    }

    private void handleSignal(TerminalClient client, JsonNode node) {
        String signal = text(node, "signal");
        if (signal == null) {
            send(client.out(), errorFrame(null, "signal is required"));
            return;
        }
        try {
            manager.sendTerminalSignal(client.sessionName(), signal);
        } catch (TerminalBridgeException e) {
            send(client.out(), errorFrame(e.errorCode(), e.getMessage()));
        }
    }

    private void handleResize(TerminalClient client, JsonNode node) {
        if (!node.path("cols").canConvertToInt() || !node.path("rows").canConvertToInt()) {
            send(client.out(), errorFrame(null, "cols and rows must be integers"));
            return;
        }
        try {
            manager.resizeTerminal(client.sessionName(), node.get("cols").asInt(), node.get("rows").asInt());
        } catch (TerminalBridgeException e) {
            send(client.out(), errorFrame(e.errorCode(), e.getMessage()));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        TerminalClient client = clients.remove(session.getId());
        if (client != null) {
            manager.removeOutputListener(client.sessionName(), client.listener());
            log.info("ws:close conn={} session={} code={}", session.getId(), client.sessionName(),
                    status.getCode());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("ws:error conn={}: {}", session.getId(), exception.getMessage());
        closeQuietly(session, CloseStatus.SERVER_ERROR);
    }

    public int getClientCount() {
        return clients.size();
    }

    // =========================================================================
    // Frames
    // =========================================================================

    Map<String, Object> outputFrame(TerminalOutputEntry entry) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "terminal_output");
        frame.put("sessionName", entry.sessionName());
        frame.put("data", entry.output());
        frame.put("commandId", entry.commandId());
        frame.put("source", entry.source().wireName());
        frame.put("user-initiated", entry.userInitiated());
        frame.put("timestamp", Instant.ofEpochMilli(entry.timestamp()).toString());
        return frame;
    }

    private static Map<String, Object> readyFrame(String sessionName, String commandId) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "terminal_ready");
        frame.put("sessionName", sessionName);
        frame.put("commandId", commandId);
        frame.put("timestamp", Instant.now().toString());
        return frame;
    }

    private static Map<String, Object> commandErrorFrame(String sessionName, String commandId, Throwable error) {
        String message = ErrorUtils.formatErrorMessage(error);
        String code = ErrorUtils.errorCode(error);
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "command_error");
        frame.put("sessionName", sessionName);
        frame.put("commandId", commandId);
        frame.put("error", code != null ? code : message);
        frame.put("message", message);
        frame.put("timestamp", Instant.now().toString());
        return frame;
    }

    private static Map<String, Object> errorFrame(String code, String message) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "error");
        if (code != null) {
            frame.put("error", code);
        }
        frame.put("message", message);
        return frame;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void send(WebSocketSession out, Map<String, Object> frame) {
        if (!out.isOpen()) {
            return;
        }
        try {
            out.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (IOException e) {
            log.warn("Failed to send to {}: {}", out.getId(), e.getMessage());
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.debug("close error: {}", e.getMessage());
        }
    }

    private record TerminalClient(String sessionName, WebSocketSession out, TerminalOutputListener listener) {
    }
}
