package com.swapengine.domain.orders;

import java.util.EnumMap;
import java.util.Map;

/**
 * The lifecycle is a single forward chain {@code queued -> pending -> routing -> building ->
 * submitted -> confirmed}. Any started, non-terminal order may also drop to {@code failed}.
 */
public final class OrderStateMachine {
  private static final Map<OrderStatus, OrderStatus> NEXT = new EnumMap<>(OrderStatus.class);

  static {
    NEXT.put(OrderStatus.QUEUED, OrderStatus.PENDING);
    NEXT.put(OrderStatus.PENDING, OrderStatus.ROUTING);
    NEXT.put(OrderStatus.ROUTING, OrderStatus.BUILDING);
    NEXT.put(OrderStatus.BUILDING, OrderStatus.SUBMITTED);
    NEXT.put(OrderStatus.SUBMITTED, OrderStatus.CONFIRMED);
  }

  private OrderStateMachine() {}

  public static boolean canTransition(OrderStatus from, OrderStatus to) {
    if (from == null || to == null) {
      return false;
    }
    if (to == OrderStatus.FAILED) {
      return from != OrderStatus.QUEUED && !from.isTerminal();
    }
    return NEXT.get(from) == to;
  }

  public static void validateTransition(OrderStatus from, OrderStatus to) {
    if (!canTransition(from, to)) {
      throw new OrderDomainException("Order cannot move from " + from + " to " + to);
    }
  }
}
