package com.termbridge.app.config;

import com.termbridge.common.config.TermBridgeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Binds the embedded server to {@code web.host}/{@code web.port} unless
 * {@code server.port} is given explicitly, and sizes WebSocket buffers.
 */
@Slf4j
@Configuration
public class WebServerConfig {

    @Bean
    public WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> termBridgeServerCustomizer(
            TermBridgeConfig config, Environment environment) {
        return factory -> {
            if (environment.containsProperty("server.port")) {
                return;
            }
            TermBridgeConfig.WebConfig web = config.getWeb();
            factory.setPort(web.getPort());
            try {
                factory.setAddress(InetAddress.getByName(web.getHost()));
            } catch (UnknownHostException e) {
                log.warn("Cannot resolve web.host {}, binding to all interfaces", web.getHost());
            }
        };
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(512 * 1024);
        container.setMaxBinaryMessageBufferSize(512 * 1024);
        container.setMaxSessionIdleTimeout(0L);
        return container;
    }
}
