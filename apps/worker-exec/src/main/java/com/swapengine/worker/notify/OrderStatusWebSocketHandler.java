package com.swapengine.worker.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swapengine.worker.config.NotificationProperties;
import com.swapengine.worker.lifecycle.OrderLifecycleEvent;
import java.io.IOException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Accepts {@code /ws?orderId=...} subscriptions and attaches each connection to the registry.
 * The session attributes hold the only strong reference to the connection's channel.
 */
@Component
public class OrderStatusWebSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(OrderStatusWebSocketHandler.class);

  static final String ORDER_ID_PARAM = "orderId";
  static final String ORDER_ID_ATTRIBUTE = "swap.orderId";
  static final String CHANNEL_ATTRIBUTE = "swap.notificationChannel";
  static final String MISSING_ORDER_ID = "Missing orderId query parameter";

  private final ConnectionRegistry connectionRegistry;
  private final ObjectMapper objectMapper;
  private final NotificationProperties properties;

  public OrderStatusWebSocketHandler(
      ConnectionRegistry connectionRegistry,
      ObjectMapper objectMapper,
      NotificationProperties properties) {
    this.connectionRegistry = connectionRegistry;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    String orderId = orderIdOf(session.getUri());
    if (orderId == null) {
      log.debug("Rejecting subscription without orderId session={}", session.getId());
      session.close(CloseStatus.POLICY_VIOLATION.withReason(MISSING_ORDER_ID));
      return;
    }

    WebSocketSession decorated =
        new ConcurrentWebSocketSessionDecorator(
            session,
            (int) properties.getSendTimeLimit().toMillis(),
            properties.getBufferSizeLimit());
    NotificationChannel channel = new WebSocketNotificationChannel(decorated, objectMapper);

    // The welcome must be the first frame, so the channel only becomes publishable after it.
    try {
      channel.send(OrderLifecycleEvent.connected(orderId));
    } catch (IOException ex) {
      log.debug("Welcome message undeliverable orderId={} session={}", orderId, session.getId());
      return;
    }

    session.getAttributes().put(ORDER_ID_ATTRIBUTE, orderId);
    session.getAttributes().put(CHANNEL_ATTRIBUTE, channel);
    connectionRegistry.attach(orderId, channel);
    log.info("Subscriber attached orderId={} session={}", orderId, session.getId());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    log.debug(
        "Ignoring inbound message session={} length={}", session.getId(), message.getPayloadLength());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("Transport error session={} error={}", session.getId(), exception.toString());
    release(session);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    if (release(session)) {
      log.info(
          "Subscriber detached orderId={} session={} status={}",
          session.getAttributes().get(ORDER_ID_ATTRIBUTE),
          session.getId(),
          status);
    }
  }

  private boolean release(WebSocketSession session) {
    Object orderId = session.getAttributes().get(ORDER_ID_ATTRIBUTE);
    Object channel = session.getAttributes().get(CHANNEL_ATTRIBUTE);
    if (orderId instanceof String id && channel instanceof NotificationChannel attached) {
      return connectionRegistry.detach(id, attached);
    }
    return false;
  }

  static String orderIdOf(URI uri) {
    if (uri == null) {
      return null;
    }
    String orderId =
        UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(ORDER_ID_PARAM);
    if (orderId == null || orderId.isBlank()) {
      return null;
    }
    return orderId.trim();
  }
}
