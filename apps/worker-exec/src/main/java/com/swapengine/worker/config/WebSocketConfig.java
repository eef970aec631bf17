package com.swapengine.worker.config;

import com.swapengine.worker.notify.OrderStatusWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final OrderStatusWebSocketHandler orderStatusWebSocketHandler;
  private final NotificationProperties properties;

  public WebSocketConfig(
      OrderStatusWebSocketHandler orderStatusWebSocketHandler, NotificationProperties properties) {
    this.orderStatusWebSocketHandler = orderStatusWebSocketHandler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(orderStatusWebSocketHandler, properties.getPath())
        .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
  }
}
