package com.taskpilot.config;

import com.taskpilot.stream.TaskStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String STREAM_PATH = "/ws/stream";

    private final TaskStreamWebSocketHandler streamWebSocketHandler;
    private final AgentProperties properties;

    public WebSocketConfig(TaskStreamWebSocketHandler streamWebSocketHandler, AgentProperties properties) {
        this.streamWebSocketHandler = streamWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(streamWebSocketHandler, STREAM_PATH)
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }
}
