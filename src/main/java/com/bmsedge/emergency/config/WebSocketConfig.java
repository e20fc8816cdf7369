package com.bmsedge.emergency.config;

import com.bmsedge.emergency.service.NotificationPublisher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP broker for engine notifications. Subscribers listen on
 * {@code /topic/emergency/<topic>}; clients never send to the engine over STOMP.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    static final String BROKER_PREFIX = NotificationPublisher.DESTINATION_PREFIX
            .substring(0, NotificationPublisher.DESTINATION_PREFIX.length() - 1);

    @Value("${emergency.websocket.endpoint:/ws-emergency}")
    private String endpoint = "/ws-emergency";

    @Value("${emergency.websocket.allowed-origins:*}")
    private String[] allowedOrigins = {"*"};

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker(BROKER_PREFIX);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // Native clients connect on <endpoint>/websocket
        registry.addEndpoint(endpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }
}
