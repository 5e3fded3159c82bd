package com.neoforge.orchestrator.progress;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the progress WebSocket at {@code /ws/progress} and turns on the scheduled broadcast.
 */
@Configuration
@EnableWebSocket
@EnableScheduling
public class ProgressPushConfig implements WebSocketConfigurer {

    private final ProgressWebSocketHandler handler;

    public ProgressPushConfig(ProgressWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws/progress").setAllowedOrigins("*");
    }
}
