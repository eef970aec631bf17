package com.swapengine.domain.routing;

import com.swapengine.domain.orders.Quote;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queries every configured {@link PriceSource} concurrently and waits for all of them to settle.
 *
 * <p>There is no early exit: the returned aggregation only exists once each source has produced a
 * quote, failed, or exceeded the timeout. A source still running at the timeout is cancelled, so
 * a hung provider never keeps an executor thread and never starves the other sources.
 * Quotes are listed in configured source order, not in completion order.
 */
public class QuoteAggregator {
  private static final Logger log = LoggerFactory.getLogger(QuoteAggregator.class);

  static final String TIMEOUT_REASON = "timeout";

  private final List<PriceSource> sources;
  private final ExecutorService executor;
  private final Duration quoteTimeout;

  public QuoteAggregator(List<PriceSource> sources, ExecutorService executor, Duration quoteTimeout) {
    Objects.requireNonNull(sources, "sources must not be null");
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("At least one price source must be configured");
    }
    Set<String> names = new HashSet<>();
    for (PriceSource source : sources) {
      if (!names.add(source.name())) {
        throw new IllegalArgumentException("Duplicate price source: " + source.name());
      }
    }
    this.sources = List.copyOf(sources);
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
    this.quoteTimeout = quoteTimeout == null ? Duration.ZERO : quoteTimeout;
  }

  public List<String> sourceNames() {
    return sources.stream().map(PriceSource::name).toList();
  }

  public QuoteAggregation aggregate(QuoteRequest request) {
    Objects.requireNonNull(request, "request must not be null");

    List<Callable<Quote>> calls = new ArrayList<>(sources.size());
    for (PriceSource source : sources) {
      calls.add(() -> source.quote(request));
    }

    List<Future<Quote>> settled;
    try {
      settled = invokeAll(calls);
    } catch (RejectedExecutionException ex) {
      List<SourceFailure> rejected = new ArrayList<>(sources.size());
      for (PriceSource source : sources) {
        rejected.add(new SourceFailure(source.name(), reasonOf(ex)));
      }
      log.warn("Quote executor rejected pair={} error={}", request.pair(), ex.getMessage());
      return new QuoteAggregation(List.of(), rejected);
    }

    List<Quote> quotes = new ArrayList<>();
    List<SourceFailure> failures = new ArrayList<>();
    for (int i = 0; i < sources.size(); i++) {
      String name = sources.get(i).name();
      Future<Quote> future = settled.get(i);
      if (future.isCancelled()) {
        failures.add(new SourceFailure(name, TIMEOUT_REASON));
        continue;
      }
      try {
        Quote quote = future.get();
        if (quote == null) {
          failures.add(new SourceFailure(name, "no quote returned"));
        } else if (!name.equals(quote.source())) {
          failures.add(new SourceFailure(name, "invalid quote: source mismatch " + quote.source()));
        } else {
          quotes.add(quote);
        }
      } catch (ExecutionException ex) {
        failures.add(new SourceFailure(name, reasonOf(ex.getCause())));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for price sources", ex);
      }
    }

    if (!failures.isEmpty()) {
      log.warn(
          "Quote aggregation pair={} amount={} succeeded={} failed={}",
          request.pair(),
          request.amount(),
          quotes.size(),
          failures);
    }
    return new QuoteAggregation(quotes, failures);
  }

  // Calls still running at the deadline are cancelled and interrupted, releasing their threads.
  private List<Future<Quote>> invokeAll(List<Callable<Quote>> calls) {
    try {
      if (quoteTimeout.isZero() || quoteTimeout.isNegative()) {
        return executor.invokeAll(calls);
      }
      return executor.invokeAll(calls, quoteTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for price sources", ex);
    }
  }

  private static String reasonOf(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return message;
  }
}
