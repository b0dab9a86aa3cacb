package com.termbridge.gateway.terminal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.termbridge.session.engine.TerminalSessionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the terminal streaming endpoint at {@code /ws/session/*}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ObjectMapper objectMapper;
    private final TerminalSessionManager manager;

    public WebSocketConfig(ObjectMapper objectMapper, TerminalSessionManager manager) {
        this.objectMapper = objectMapper;
        this.manager = manager;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(terminalWebSocketHandler(), SessionPathInterceptor.PATH_PREFIX + "*")
                .addInterceptors(new SessionPathInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public TerminalWebSocketHandler terminalWebSocketHandler() {
        return new TerminalWebSocketHandler(objectMapper, manager);
    }
}
