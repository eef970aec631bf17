package com.swapengine.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record SwapOrder(
    String orderId,
    String tokenIn,
    String tokenOut,
    BigDecimal amount,
    OrderStatus status,
    List<Quote> quotes,
    String chosenRoute,
    Settlement settlement,
    FailureReason failureReason,
    Instant createdAt,
    Instant updatedAt) {
  public SwapOrder {
    requireNonBlank(orderId, "orderId");
    requireNonBlank(tokenIn, "tokenIn");
    requireNonBlank(tokenOut, "tokenOut");
    if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
      throw new OrderDomainException("amount must be > 0");
    }
    Objects.requireNonNull(status, "status must not be null");
    quotes = quotes == null ? List.of() : List.copyOf(quotes);
    if (settlement != null && status != OrderStatus.CONFIRMED) {
      throw new OrderDomainException("settlement is only allowed on a confirmed order");
    }
    if (status == OrderStatus.CONFIRMED && settlement == null) {
      throw new OrderDomainException("confirmed order requires a settlement");
    }
    if (failureReason != null && status != OrderStatus.FAILED) {
      throw new OrderDomainException("failureReason is only allowed on a failed order");
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public static SwapOrder queued(
      String orderId, String tokenIn, String tokenOut, BigDecimal amount, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new SwapOrder(
        orderId, tokenIn, tokenOut, amount, OrderStatus.QUEUED, List.of(), null, null, null, now,
        now);
  }

  public SwapOrder transitionTo(OrderStatus toStatus, Instant now) {
    if (toStatus == OrderStatus.CONFIRMED || toStatus == OrderStatus.FAILED) {
      throw new OrderDomainException(
          "Use confirm or fail to move order " + orderId + " to " + toStatus);
    }
    if (toStatus == OrderStatus.BUILDING && chosenRoute == null) {
      throw new OrderDomainException("Order " + orderId + " has no chosen route");
    }
    OrderStateMachine.validateTransition(status, toStatus);
    return copy(toStatus, quotes, chosenRoute, null, null, now);
  }

  public SwapOrder withRoute(List<Quote> routedQuotes, String route, Instant now) {
    if (status != OrderStatus.ROUTING) {
      throw new OrderDomainException(
          "Route can only be recorded while routing; order " + orderId + " is " + status);
    }
    if (chosenRoute != null) {
      throw new OrderDomainException("Route already chosen for order " + orderId);
    }
    requireNonBlank(route, "route");
    if (routedQuotes == null || routedQuotes.isEmpty()) {
      throw new OrderDomainException("quotes must not be empty");
    }
    boolean routeQuoted = routedQuotes.stream().anyMatch(quote -> quote.source().equals(route));
    if (!routeQuoted) {
      throw new OrderDomainException("Chosen route " + route + " has no quote");
    }
    return copy(status, routedQuotes, route, null, null, now);
  }

  public SwapOrder confirm(Settlement nextSettlement, Instant now) {
    Objects.requireNonNull(nextSettlement, "settlement must not be null");
    OrderStateMachine.validateTransition(status, OrderStatus.CONFIRMED);
    return copy(OrderStatus.CONFIRMED, quotes, chosenRoute, nextSettlement, null, now);
  }

  public SwapOrder fail(FailureReason reason, Instant now) {
    Objects.requireNonNull(reason, "reason must not be null");
    OrderStateMachine.validateTransition(status, OrderStatus.FAILED);
    return copy(OrderStatus.FAILED, quotes, chosenRoute, null, reason, now);
  }

  private SwapOrder copy(
      OrderStatus nextStatus,
      List<Quote> nextQuotes,
      String nextRoute,
      Settlement nextSettlement,
      FailureReason nextFailureReason,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new SwapOrder(
        orderId,
        tokenIn,
        tokenOut,
        amount,
        nextStatus,
        nextQuotes,
        nextRoute,
        nextSettlement,
        nextFailureReason,
        createdAt,
        now);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException(fieldName + " must not be blank");
    }
  }
}
