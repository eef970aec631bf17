package com.swapengine.integration.dex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.swapengine.domain.orders.Quote;
import com.swapengine.domain.routing.QuoteRequest;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SimulatedDexPriceSourceTest {
  private static final QuoteRequest REQUEST =
      new QuoteRequest("USDC", "SOL", new BigDecimal("100"));

  @Test
  void shouldQuoteRaydiumWithinItsPriceBand() {
    SimulatedDexProperties properties = instantProperties();
    SimulatedDexPriceSource raydium =
        new SimulatedDexPriceSource(properties.getVenues().get(0), properties, new Random(7L));

    for (int i = 0; i < 50; i++) {
      Quote quote = raydium.quote(REQUEST);
      assertEquals("Raydium", quote.source());
      assertEquals(0, new BigDecimal("0.003").compareTo(quote.fee()));
      assertTrue(quote.price().compareTo(new BigDecimal("98")) >= 0);
      assertTrue(quote.price().compareTo(new BigDecimal("102")) <= 0);
    }
  }

  @Test
  void shouldQuoteMeteoraWithinItsPriceBand() {
    SimulatedDexProperties properties = instantProperties();
    SimulatedDexPriceSource meteora =
        new SimulatedDexPriceSource(properties.getVenues().get(1), properties, new Random(11L));

    for (int i = 0; i < 50; i++) {
      Quote quote = meteora.quote(REQUEST);
      assertEquals("Meteora", quote.source());
      assertEquals(0, new BigDecimal("0.002").compareTo(quote.fee()));
      assertTrue(quote.price().compareTo(new BigDecimal("97")) >= 0);
      assertTrue(quote.price().compareTo(new BigDecimal("102")) <= 0);
    }
  }

  @Test
  void shouldHonourConfiguredLatency() {
    SimulatedDexProperties properties = instantProperties();
    properties.setQuoteLatencyMin(Duration.ofMillis(50));
    properties.setQuoteLatencyMax(Duration.ofMillis(60));
    SimulatedDexPriceSource source =
        new SimulatedDexPriceSource(properties.getVenues().get(0), properties, new Random(1L));

    long started = System.nanoTime();
    source.quote(REQUEST);
    long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

    assertTrue(elapsedMillis >= 50, "elapsed=" + elapsedMillis);
  }

  static SimulatedDexProperties instantProperties() {
    SimulatedDexProperties properties = new SimulatedDexProperties();
    properties.setQuoteLatencyMin(Duration.ZERO);
    properties.setQuoteLatencyMax(Duration.ZERO);
    properties.setExecutionLatencyMin(Duration.ZERO);
    properties.setExecutionLatencyMax(Duration.ZERO);
    return properties;
  }
}
