package com.example.checkout.infrastructure.config;

import com.example.checkout.infrastructure.adapter.in.websocket.OrderStatusSocketHandler;
import com.example.checkout.infrastructure.adapter.in.websocket.UserOrdersSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.Map;

/**
 * Maps the notification sockets. Clients connect with
 * {@code ws://localhost:8080/ws/order/{orderId}?userId=...} or {@code /ws/user-orders/{userId}}.
 */
@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping notificationSocketMapping(
            OrderStatusSocketHandler orderStatusSocketHandler,
            UserOrdersSocketHandler userOrdersSocketHandler) {
        Map<String, WebSocketHandler> handlers = Map.of(
                "/ws/order/*", orderStatusSocketHandler,
                "/ws/user-orders/*", userOrdersSocketHandler);
        return new SimpleUrlHandlerMapping(handlers, -1);
    }
}
