package com.termbridge.gateway;

import com.termbridge.common.config.ConfigService;
import com.termbridge.common.config.TermBridgeConfig;
import com.termbridge.gateway.control.ControlToolRouter;
import com.termbridge.gateway.control.SshToolRegistrar;
import com.termbridge.session.engine.SessionLimits;
import com.termbridge.session.engine.TerminalSessionManager;
import com.termbridge.session.registry.SessionRegistry;
import com.termbridge.session.remote.JschRemoteConnector;
import com.termbridge.session.remote.RemoteConnector;
import com.termbridge.session.remote.TransportSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the session core and both protocol adapters.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${termbridge.config.path:~/.termbridge/termbridge.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public TermBridgeConfig termBridgeConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public RemoteConnector remoteConnector(TermBridgeConfig config) {
        return new JschRemoteConnector(TransportSettings.from(config.getSession()));
    }

    @Bean(destroyMethod = "shutdown")
    public SessionRegistry sessionRegistry(RemoteConnector remoteConnector, TermBridgeConfig config) {
        return new SessionRegistry(remoteConnector, SessionLimits.from(config.getSession()),
                Boolean.TRUE.equals(config.getLogging().getRedactSensitive()));
    }

    @Bean
    public TerminalSessionManager terminalSessionManager(SessionRegistry sessionRegistry) {
        return new TerminalSessionManager(sessionRegistry);
    }

    @Bean
    public ControlToolRouter controlToolRouter() {
        return new ControlToolRouter();
    }

    @Bean
    public SshToolRegistrar sshToolRegistrar(ControlToolRouter controlToolRouter,
            TerminalSessionManager terminalSessionManager, TermBridgeConfig config) {
        SshToolRegistrar registrar = new SshToolRegistrar(controlToolRouter, terminalSessionManager,
                config.getWeb());
        registrar.registerTools();
        return registrar;
    }
}
