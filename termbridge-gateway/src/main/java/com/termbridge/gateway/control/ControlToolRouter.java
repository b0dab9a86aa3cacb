package com.termbridge.gateway.control;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes control-protocol tool calls to registered handlers.
 *
 * <p>
 * Every call resolves to a result map; handler exceptions and failed futures
 * are turned into {@code {success:false, error, message}} results.
 */
@Slf4j
public class ControlToolRouter {

    @FunctionalInterface
    public interface ToolHandler {
        CompletableFuture<Map<String, Object>> handle(JsonNode args);
    }

    private final Map<String, ToolHandler> handlers = new ConcurrentHashMap<>();

    public void registerTool(String name, ToolHandler handler) {
        handlers.put(name, handler);
        log.debug("Registered tool handler: {}", name);
    }

    public CompletableFuture<Map<String, Object>> dispatch(String toolName, JsonNode args) {
        ToolHandler handler = toolName != null ? handlers.get(toolName) : null;
        if (handler == null) {
            log.debug("Unknown tool: {}", toolName);
            return CompletableFuture.completedFuture(ToolResults.unknownTool(toolName));
        }
        CompletableFuture<Map<String, Object>> result;
        try {
            result = handler.handle(args);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolResults.failure(e));
        }
        return result.exceptionally(ToolResults::failure);
    }

    public Set<String> getRegisteredTools() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
