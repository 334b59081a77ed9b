package com.bko.gateway.config;

import com.bko.gateway.stream.JobStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final JobStreamWebSocketHandler jobStreamWebSocketHandler;

    public WebSocketConfig(JobStreamWebSocketHandler jobStreamWebSocketHandler) {
        this.jobStreamWebSocketHandler = jobStreamWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(jobStreamWebSocketHandler, "/ws/jobs")
                .setAllowedOrigins("*");
    }
}
