package com.swapengine.integration.dex;

import com.swapengine.domain.orders.Quote;
import com.swapengine.domain.routing.PriceSource;
import com.swapengine.domain.routing.QuoteRequest;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SimulatedDexPriceSource implements PriceSource {
  private static final Logger log = LoggerFactory.getLogger(SimulatedDexPriceSource.class);

  private final String name;
  private final BigDecimal basePrice;
  private final BigDecimal priceFloor;
  private final BigDecimal priceSpread;
  private final BigDecimal fee;
  private final SimulatedLatency latency;
  private final RandomGenerator random;

  public SimulatedDexPriceSource(
      SimulatedDexProperties.Venue venue, SimulatedDexProperties properties, RandomGenerator random) {
    Objects.requireNonNull(venue, "venue must not be null");
    if (venue.getName() == null || venue.getName().isBlank()) {
      throw new IllegalArgumentException("dex.simulated.venues[].name must be configured");
    }
    this.name = venue.getName();
    this.basePrice = Objects.requireNonNull(properties.getBasePrice(), "basePrice must not be null");
    this.priceFloor = Objects.requireNonNull(venue.getPriceFloor(), "priceFloor must not be null");
    this.priceSpread = Objects.requireNonNull(venue.getPriceSpread(), "priceSpread must not be null");
    this.fee = Objects.requireNonNull(venue.getFee(), "fee must not be null");
    this.random = Objects.requireNonNull(random, "random must not be null");
    this.latency =
        new SimulatedLatency(
            properties.getQuoteLatencyMin(), properties.getQuoteLatencyMax(), random);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Quote quote(QuoteRequest request) {
    latency.pause(name + " quote");
    BigDecimal price = PriceJitter.apply(basePrice, priceFloor, priceSpread, random);
    log.debug(
        "Simulated quote dex={} pair={} amount={} price={}",
        name,
        request.pair(),
        request.amount(),
        price);
    return new Quote(name, price, fee);
  }
}
