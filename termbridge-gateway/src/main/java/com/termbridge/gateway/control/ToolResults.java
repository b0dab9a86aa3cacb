package com.termbridge.gateway.control;

import com.termbridge.common.infra.ErrorUtils;
import com.termbridge.session.model.BrowserCommandEntry;
import com.termbridge.session.model.CommandResult;
import com.termbridge.session.model.SessionInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for the JSON-shaped maps returned by control tools.
 */
public final class ToolResults {

    private ToolResults() {
    }

    public static Map<String, Object> success() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        return result;
    }

    public static Map<String, Object> failure(String error, String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", error);
        if (message != null) {
            result.put("message", message);
        }
        return result;
    }

    /**
     * Error code of a coded exception, otherwise its message.
     */
    public static Map<String, Object> failure(Throwable err) {
        String message = ErrorUtils.formatErrorMessage(err);
        String code = ErrorUtils.errorCode(err);
        return failure(code != null ? code : message, message);
    }

    public static Map<String, Object> unknownTool(String toolName) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", "Unknown tool: " + toolName);
        return result;
    }

    public static Map<String, Object> commandResult(CommandResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("stdout", result.stdout());
        map.put("stderr", result.stderr());
        map.put("exitCode", result.exitCode());
        return map;
    }

    public static List<Map<String, Object>> browserCommands(List<BrowserCommandEntry> entries) {
        return entries.stream().map(ToolResults::browserCommand).toList();
    }

    static Map<String, Object> browserCommand(BrowserCommandEntry entry) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("command", entry.command());
        map.put("commandId", entry.commandId());
        map.put("timestamp", entry.timestamp());
        map.put("source", entry.source().wireName());
        map.put("result", commandResult(entry.result()));
        return map;
    }

    public static Map<String, Object> connection(SessionInfo info) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", info.name());
        map.put("host", info.host());
        map.put("username", info.username());
        map.put("status", info.status().wireName());
        map.put("lastActivity", iso(info.lastActivity()));
        if (info.errorDetails() != null) {
            map.put("errorDetails", info.errorDetails());
            map.put("errorTimestamp", iso(info.errorTimestamp()));
        }
        return map;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
