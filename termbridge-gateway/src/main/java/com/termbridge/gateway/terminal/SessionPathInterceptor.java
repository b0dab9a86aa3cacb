package com.termbridge.gateway.terminal;

import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Captures the session name from {@code /ws/session/<name>} into the
 * WebSocket attributes. Handshakes without a name are refused.
 */
public class SessionPathInterceptor implements HandshakeInterceptor {

    public static final String PATH_PREFIX = "/ws/session/";

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @NonNull Map<String, Object> attributes) {
        String sessionName = sessionNameFromPath(request.getURI().getPath());
        if (sessionName == null) {
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        attributes.put(TerminalWebSocketHandler.SESSION_NAME_ATTRIBUTE, sessionName);
        return true;
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @Nullable Exception exception) {
        // no-op
    }

    static String sessionNameFromPath(String path) {
        if (path == null) {
            return null;
        }
        int idx = path.indexOf(PATH_PREFIX);
        if (idx < 0) {
            return null;
        }
        String name = path.substring(idx + PATH_PREFIX.length());
        if (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.isEmpty() || name.contains("/")) {
            return null;
        }
        return URLDecoder.decode(name, StandardCharsets.UTF_8);
    }
}
