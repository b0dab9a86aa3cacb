package com.termbridge.gateway.control;

import com.fasterxml.jackson.databind.JsonNode;
import com.termbridge.common.config.TermBridgeConfig;
import com.termbridge.session.engine.TerminalSession;
import com.termbridge.session.engine.TerminalSessionManager;
import com.termbridge.session.error.BrowserCommandsExecutedException;
import com.termbridge.session.error.ErrorCode;
import com.termbridge.session.error.InvalidRequestException;
import com.termbridge.session.error.SessionBusyException;
import com.termbridge.session.model.CommandOptions;
import com.termbridge.session.model.CommandResult;
import com.termbridge.session.model.CommandSource;
import com.termbridge.session.model.ConnectionConfig;
import com.termbridge.session.model.SessionInfo;
import com.termbridge.session.registry.SessionRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registers the {@code ssh_*} control tools on a {@link ControlToolRouter}.
 */
@Slf4j
public class SshToolRegistrar {

    public static final String NO_ACTIVE_MCP_COMMAND = "NO_ACTIVE_MCP_COMMAND";
    public static final String TIMEOUT = "TIMEOUT";

    private final ControlToolRouter router;
    private final TerminalSessionManager manager;
    private final SessionRegistry registry;
    private final TermBridgeConfig.WebConfig web;

    public SshToolRegistrar(ControlToolRouter router, TerminalSessionManager manager,
            TermBridgeConfig.WebConfig web) {
        this.router = router;
        this.manager = manager;
        this.registry = manager.getRegistry();
        this.web = web;
    }

    public void registerTools() {
        router.registerTool("ssh_connect", this::handleConnect);
        router.registerTool("ssh_exec", this::handleExec);
        router.registerTool("ssh_list_sessions", this::handleListSessions);
        router.registerTool("ssh_disconnect", this::handleDisconnect);
        router.registerTool("ssh_get_monitoring_url", this::handleMonitoringUrl);
        router.registerTool("ssh_cancel_command", this::handleCancelCommand);
        log.info("Registered {} control tools", router.getRegisteredTools().size());
    }

    // =========================================================================
    // ssh_connect
    // =========================================================================
    private CompletableFuture<Map<String, Object>> handleConnect(JsonNode args) {
        ConnectionConfig config = ConnectionConfig.builder()
                .name(textParam(args, "name"))
                .host(textParam(args, "host"))
                .port(intParam(args, "port", 22))
                .username(textParam(args, "username"))
                .password(rawParam(args, "password"))
                .privateKey(rawParam(args, "privateKey"))
                .passphrase(rawParam(args, "passphrase"))
                .build();
        TerminalSession session = registry.connect(config);
        Map<String, Object> result = ToolResults.success();
        result.put("connection", ToolResults.connection(session.info()));
        return CompletableFuture.completedFuture(result);
    }

    // =========================================================================
    // ssh_exec
    // =========================================================================
    private CompletableFuture<Map<String, Object>> handleExec(JsonNode args) {
        String sessionName = requireText(args, "sessionName");
        String command = rawParam(args, "command");
        long timeoutMs = intParam(args, "timeout", 0);
        CommandOptions options = CommandOptions.builder()
                .source(CommandSource.CLAUDE)
                .timeoutMs(timeoutMs > 0 ? timeoutMs : null)
                .build();

        CompletableFuture<CommandResult> execution;
        try {
            execution = manager.enqueue(sessionName, command, options);
        } catch (BrowserCommandsExecutedException e) {
            Map<String, Object> result = ToolResults.failure(e.errorCode(), e.getMessage());
            result.put("browserCommands", ToolResults.browserCommands(e.getBrowserCommands()));
            result.put("retryAllowed", true);
            return CompletableFuture.completedFuture(result);
        } catch (SessionBusyException e) {
            Map<String, Object> result = ToolResults.failure(e.errorCode(), e.getMessage());
            result.put("retryAllowed", true);
            return CompletableFuture.completedFuture(result);
        }

        CompletableFuture<Map<String, Object>> response = execution
                .thenApply(commandResult -> {
                    Map<String, Object> result = ToolResults.success();
                    result.put("result", ToolResults.commandResult(commandResult));
                    return result;
                })
                .exceptionally(ToolResults::failure);
        if (timeoutMs > 0) {
            // completes only the response; the command keeps running
            response = response.completeOnTimeout(timeoutResult(sessionName, timeoutMs), timeoutMs,
                    TimeUnit.MILLISECONDS);
        }
        return response;
    }

    private static Map<String, Object> timeoutResult(String sessionName, long timeoutMs) {
        return ToolResults.failure(TIMEOUT, "Command on session '" + sessionName + "' did not finish within "
                + timeoutMs + "ms; it is still running");
    }

    // =========================================================================
    // ssh_list_sessions
    // =========================================================================
    private CompletableFuture<Map<String, Object>> handleListSessions(JsonNode args) {
        List<SessionInfo> sessions = registry.list();
        Map<String, Object> result = ToolResults.success();
        result.put("sessions", sessions.stream().map(ToolResults::connection).toList());
        return CompletableFuture.completedFuture(result);
    }

    // =========================================================================
    // ssh_disconnect
    // =========================================================================
    private CompletableFuture<Map<String, Object>> handleDisconnect(JsonNode args) {
        String sessionName = requireText(args, "sessionName");
        registry.disconnect(sessionName);
        Map<String, Object> result = ToolResults.success();
        result.put("message", "Session '" + sessionName + "' disconnected");
        return CompletableFuture.completedFuture(result);
    }

    // =========================================================================
    // ssh_get_monitoring_url
    // =========================================================================
    private CompletableFuture<Map<String, Object>> handleMonitoringUrl(JsonNode args) {
        String sessionName = requireText(args, "sessionName");
        registry.get(sessionName);
        Map<String, Object> result = ToolResults.success();
        result.put("monitoringUrl", monitoringUrl(sessionName));
        return CompletableFuture.completedFuture(result);
    }

    String monitoringUrl(String sessionName) {
        return "http://" + web.getHost() + ":" + web.getPort() + web.getMonitoringPath() + sessionName;
    }

    // =========================================================================
    // ssh_cancel_command
    // =========================================================================
    private CompletableFuture<Map<String, Object>> handleCancelCommand(JsonNode args) {
        String sessionName = requireText(args, "sessionName");
        int cancelled = manager.cancelCommands(sessionName, CommandSource.CLAUDE);
        if (cancelled == 0) {
            return CompletableFuture.completedFuture(
                    ToolResults.failure(NO_ACTIVE_MCP_COMMAND, "No active MCP command to cancel"));
        }
        Map<String, Object> result = ToolResults.success();
        result.put("cancelled", cancelled);
        result.put("message", "Cancelled " + cancelled + " MCP command(s)");
        return CompletableFuture.completedFuture(result);
    }

    // =========================================================================
    // Params
    // =========================================================================

    private static String textParam(JsonNode args, String field) {
        String raw = rawParam(args, field);
        return raw != null ? raw.trim() : null;
    }

    /**
     * Untrimmed; command text and secrets are passed through as given.
     */
    private static String rawParam(JsonNode args, String field) {
        if (args != null && args.has(field) && !args.get(field).isNull()) {
            return args.get(field).asText();
        }
        return null;
    }

    private static String requireText(JsonNode args, String field) {
        String value = textParam(args, field);
        if (value == null || value.isEmpty()) {
            throw new InvalidRequestException(ErrorCode.INVALID_SESSION_NAME, field + " is required");
        }
        return value;
    }

    private static int intParam(JsonNode args, String field, int defaultValue) {
        if (args != null && args.has(field) && args.get(field).canConvertToInt()) {
            return args.get(field).asInt();
        }
        return defaultValue;
    }
}
