package com.swapengine.worker.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.swapengine.domain.orders.FailureReason;
import com.swapengine.domain.orders.OrderStatus;
import com.swapengine.domain.orders.Quote;
import com.swapengine.domain.orders.SwapOrder;
import java.math.BigDecimal;
import java.util.List;

/** One JSON message pushed to the subscriber of an order. Absent fields are omitted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderLifecycleEvent(
    String orderId,
    String status,
    List<QuoteView> quotes,
    String chosenDex,
    String transactionRef,
    BigDecimal executedPrice,
    String reason,
    String message) {
  static final String CONNECTED_STATUS = "connected";
  static final String CONNECTED_MESSAGE = "WebSocket connection established";

  public static OrderLifecycleEvent connected(String orderId) {
    return new OrderLifecycleEvent(
        orderId, CONNECTED_STATUS, null, null, null, null, null, CONNECTED_MESSAGE);
  }

  public static OrderLifecycleEvent status(String orderId, OrderStatus status) {
    return new OrderLifecycleEvent(
        orderId, status.wireValue(), null, null, null, null, null, null);
  }

  public static OrderLifecycleEvent routed(SwapOrder order) {
    List<QuoteView> views = order.quotes().stream().map(QuoteView::from).toList();
    return new OrderLifecycleEvent(
        order.orderId(),
        order.status().wireValue(),
        views,
        order.chosenRoute(),
        null,
        null,
        null,
        null);
  }

  public static OrderLifecycleEvent confirmed(SwapOrder order) {
    return new OrderLifecycleEvent(
        order.orderId(),
        OrderStatus.CONFIRMED.wireValue(),
        null,
        order.chosenRoute(),
        order.settlement().transactionRef(),
        order.settlement().executedPrice(),
        null,
        null);
  }

  public static OrderLifecycleEvent failed(String orderId, FailureReason reason, String detail) {
    return new OrderLifecycleEvent(
        orderId, OrderStatus.FAILED.wireValue(), null, null, null, null, reason.code(), detail);
  }

  public record QuoteView(String source, BigDecimal price, BigDecimal fee) {
    static QuoteView from(Quote quote) {
      return new QuoteView(quote.source(), quote.price(), quote.fee());
    }
  }
}
