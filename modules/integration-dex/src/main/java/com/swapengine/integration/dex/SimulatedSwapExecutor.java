package com.swapengine.integration.dex;

import com.swapengine.domain.orders.Settlement;
import com.swapengine.domain.routing.ExecutionFailedException;
import com.swapengine.domain.routing.QuoteRequest;
import com.swapengine.domain.routing.SwapExecutor;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SimulatedSwapExecutor implements SwapExecutor {
  private static final Logger log = LoggerFactory.getLogger(SimulatedSwapExecutor.class);

  private final Set<String> venues;
  private final BigDecimal basePrice;
  private final BigDecimal priceFloor;
  private final BigDecimal priceSpread;
  private final SimulatedLatency latency;
  private final RandomGenerator random;

  public SimulatedSwapExecutor(SimulatedDexProperties properties, RandomGenerator random) {
    Objects.requireNonNull(properties, "properties must not be null");
    this.venues = new LinkedHashSet<>();
    for (SimulatedDexProperties.Venue venue : properties.getVenues()) {
      venues.add(venue.getName());
    }
    this.basePrice = Objects.requireNonNull(properties.getBasePrice(), "basePrice must not be null");
    this.priceFloor = properties.getExecutionPriceFloor();
    this.priceSpread = properties.getExecutionPriceSpread();
    this.random = Objects.requireNonNull(random, "random must not be null");
    this.latency =
        new SimulatedLatency(
            properties.getExecutionLatencyMin(), properties.getExecutionLatencyMax(), random);
  }

  @Override
  public Settlement execute(String route, QuoteRequest request) {
    if (route == null || !venues.contains(route)) {
      throw new ExecutionFailedException(route, "Unknown execution venue: " + route);
    }
    latency.pause(route + " swap");
    BigDecimal executedPrice = PriceJitter.apply(basePrice, priceFloor, priceSpread, random);
    String transactionRef = UUID.randomUUID().toString();
    log.info(
        "Simulated swap executed dex={} pair={} amount={} transactionRef={} executedPrice={}",
        route,
        request.pair(),
        request.amount(),
        transactionRef,
        executedPrice);
    return new Settlement(transactionRef, executedPrice);
  }
}
