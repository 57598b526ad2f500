package com.lineage.dispatch.api;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the real-time endpoints. Only active in serve mode, where a
 * servlet web server is running.
 */
@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TestChannelWebSocketHandler testChannelHandler;
    private final AgentWebSocketHandler agentHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(TestChannelWebSocketHandler testChannelHandler,
                           AgentWebSocketHandler agentHandler,
                           @Value("${lineage.realtime.allowed-origins:*}") String[] allowedOrigins) {
        this.testChannelHandler = testChannelHandler;
        this.agentHandler = agentHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(testChannelHandler, "/ws").setAllowedOriginPatterns(allowedOrigins);
        registry.addHandler(agentHandler, AgentWebSocketHandler.PATH_PREFIX + "*")
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
