package com.example.chat.config;

import com.example.chat.websocket.ChatWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping chatWebSocketMapping(ChatWebSocketHandler chatWebSocketHandler, AppProperties appProperties) {
        return new SimpleUrlHandlerMapping(Map.of(appProperties.getWebsocket().getPath(), chatWebSocketHandler), -1);
    }
}
