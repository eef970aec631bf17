package com.swapengine.worker.lifecycle;

import com.swapengine.domain.orders.FailureReason;
import com.swapengine.domain.orders.OrderStateMachine;
import com.swapengine.domain.orders.OrderStatus;
import com.swapengine.domain.orders.Quote;
import com.swapengine.domain.orders.Settlement;
import com.swapengine.domain.orders.SwapOrder;
import com.swapengine.domain.routing.NoQuotesAvailableException;
import com.swapengine.domain.routing.QuoteAggregation;
import com.swapengine.domain.routing.QuoteAggregator;
import com.swapengine.domain.routing.QuoteRequest;
import com.swapengine.domain.routing.RouteSelector;
import com.swapengine.domain.routing.SourceFailure;
import com.swapengine.domain.routing.SwapExecutor;
import com.swapengine.worker.notify.ConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives one order from {@code queued} to a terminal state.
 *
 * <p>Steps run strictly in sequence: pending, routing (quote fan-out and route choice), building,
 * submitted (execution), then confirmed or failed. Every transition is pushed to the order's
 * subscriber through the {@link ConnectionRegistry}; a missing subscriber never affects
 * processing. Routing and execution failures end in {@code failed} instead of propagating.
 */
@Service
public class OrderLifecycleOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(OrderLifecycleOrchestrator.class);

  private final QuoteAggregator quoteAggregator;
  private final RouteSelector routeSelector;
  private final SwapExecutor swapExecutor;
  private final ConnectionRegistry connectionRegistry;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public OrderLifecycleOrchestrator(
      QuoteAggregator quoteAggregator,
      RouteSelector routeSelector,
      SwapExecutor swapExecutor,
      ConnectionRegistry connectionRegistry,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.quoteAggregator = quoteAggregator;
    this.routeSelector = routeSelector;
    this.swapExecutor = swapExecutor;
    this.connectionRegistry = connectionRegistry;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public SwapOrder process(SwapOrder order) {
    Objects.requireNonNull(order, "order must not be null");
    if (order.status() != OrderStatus.QUEUED) {
      throw new IllegalArgumentException(
          "Order " + order.orderId() + " must be queued, was " + order.status());
    }

    long started = System.nanoTime();
    log.info(
        "Processing order orderId={} pair={}/{} amount={}",
        order.orderId(),
        order.tokenIn(),
        order.tokenOut(),
        order.amount());

    SwapOrder current = order;
    try {
      current = advance(current, OrderStatus.PENDING);
      current = advance(current, OrderStatus.ROUTING);

      QuoteRequest request = new QuoteRequest(order.tokenIn(), order.tokenOut(), order.amount());
      QuoteAggregation aggregation = quoteAggregator.aggregate(request);
      List<Quote> quotes;
      try {
        quotes = aggregation.requireQuotes();
      } catch (NoQuotesAvailableException ex) {
        return finish(
            fail(current, FailureReason.NO_QUOTES_AVAILABLE, describe(ex.getFailures())),
            started);
      }

      Quote best = routeSelector.select(quotes);
      current = current.withRoute(quotes, best.source(), clock.instant());
      connectionRegistry.publish(current.orderId(), OrderLifecycleEvent.routed(current));
      log.info(
          "Route chosen orderId={} dex={} price={} quotes={} failedSources={}",
          current.orderId(),
          best.source(),
          best.price(),
          quotes.size(),
          aggregation.failures().size());

      current = advance(current, OrderStatus.BUILDING);
      current = advance(current, OrderStatus.SUBMITTED);

      Settlement settlement;
      try {
        settlement = swapExecutor.execute(current.chosenRoute(), request);
      } catch (RuntimeException ex) {
        log.warn(
            "Execution failed orderId={} dex={} error={}",
            current.orderId(),
            current.chosenRoute(),
            ex.getMessage());
        return finish(fail(current, FailureReason.EXECUTION_FAILED, ex.getMessage()), started);
      }

      current = current.confirm(settlement, clock.instant());
      connectionRegistry.publish(current.orderId(), OrderLifecycleEvent.confirmed(current));
      return finish(current, started);
    } catch (RuntimeException ex) {
      if (!OrderStateMachine.canTransition(current.status(), OrderStatus.FAILED)) {
        throw ex;
      }
      log.error(
          "Unexpected failure orderId={} status={}", current.orderId(), current.status(), ex);
      return finish(fail(current, FailureReason.INTERNAL_ERROR, ex.getMessage()), started);
    }
  }

  private SwapOrder advance(SwapOrder order, OrderStatus next) {
    SwapOrder advanced = order.transitionTo(next, clock.instant());
    connectionRegistry.publish(
        advanced.orderId(), OrderLifecycleEvent.status(advanced.orderId(), next));
    return advanced;
  }

  private SwapOrder fail(SwapOrder order, FailureReason reason, String detail) {
    SwapOrder failed = order.fail(reason, clock.instant());
    connectionRegistry.publish(
        failed.orderId(), OrderLifecycleEvent.failed(failed.orderId(), reason, detail));
    return failed;
  }

  private SwapOrder finish(SwapOrder order, long startedNanos) {
    String outcome = order.status().wireValue();
    String reason = order.failureReason() == null ? "none" : order.failureReason().code();
    Counter.builder("swap.orders.processed")
        .description("Orders that reached a terminal state")
        .tag("outcome", outcome)
        .tag("reason", reason)
        .register(meterRegistry)
        .increment();
    Timer.builder("swap.orders.duration")
        .description("Time from dequeue to terminal state")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(System.nanoTime() - startedNanos, TimeUnit.NANOSECONDS);

    if (order.status() == OrderStatus.CONFIRMED) {
      log.info(
          "Order confirmed orderId={} dex={} transactionRef={} executedPrice={}",
          order.orderId(),
          order.chosenRoute(),
          order.settlement().transactionRef(),
          order.settlement().executedPrice());
    } else {
      log.warn("Order failed orderId={} reason={}", order.orderId(), reason);
    }
    return order;
  }

  private static String describe(List<SourceFailure> failures) {
    if (failures.isEmpty()) {
      return "No price source returned a quote";
    }
    StringBuilder detail = new StringBuilder("No price source returned a quote:");
    for (SourceFailure failure : failures) {
      detail.append(' ').append(failure.source()).append('=').append(failure.reason());
    }
    return detail.toString();
  }
}
