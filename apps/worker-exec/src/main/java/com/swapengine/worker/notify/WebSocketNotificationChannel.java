package com.swapengine.worker.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swapengine.worker.lifecycle.OrderLifecycleEvent;
import java.io.IOException;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/** Writes lifecycle events as JSON text frames onto one WebSocket session. */
public class WebSocketNotificationChannel implements NotificationChannel {
  private final WebSocketSession session;
  private final ObjectMapper objectMapper;

  public WebSocketNotificationChannel(WebSocketSession session, ObjectMapper objectMapper) {
    this.session = session;
    this.objectMapper = objectMapper;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void send(OrderLifecycleEvent event) throws IOException {
    if (!session.isOpen()) {
      throw new IOException("WebSocket session " + session.getId() + " is closed");
    }
    session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
  }
}
