package com.swapengine.integration.dex;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dex.simulated")
public class SimulatedDexProperties {
  private BigDecimal basePrice = new BigDecimal("100");
  private Duration quoteLatencyMin = Duration.ofMillis(200);
  private Duration quoteLatencyMax = Duration.ofMillis(300);
  private Duration executionLatencyMin = Duration.ofMillis(2000);
  private Duration executionLatencyMax = Duration.ofMillis(3000);
  private BigDecimal executionPriceFloor = new BigDecimal("0.98");
  private BigDecimal executionPriceSpread = new BigDecimal("0.04");
  private List<Venue> venues = new ArrayList<>(defaultVenues());

  public BigDecimal getBasePrice() {
    return basePrice;
  }

  public void setBasePrice(BigDecimal basePrice) {
    this.basePrice = basePrice;
  }

  public Duration getQuoteLatencyMin() {
    return quoteLatencyMin;
  }

  public void setQuoteLatencyMin(Duration quoteLatencyMin) {
    this.quoteLatencyMin = quoteLatencyMin;
  }

  public Duration getQuoteLatencyMax() {
    return quoteLatencyMax;
  }

  public void setQuoteLatencyMax(Duration quoteLatencyMax) {
    this.quoteLatencyMax = quoteLatencyMax;
  }

  public Duration getExecutionLatencyMin() {
    return executionLatencyMin;
  }

  public void setExecutionLatencyMin(Duration executionLatencyMin) {
    this.executionLatencyMin = executionLatencyMin;
  }

  public Duration getExecutionLatencyMax() {
    return executionLatencyMax;
  }

  public void setExecutionLatencyMax(Duration executionLatencyMax) {
    this.executionLatencyMax = executionLatencyMax;
  }

  public BigDecimal getExecutionPriceFloor() {
    return executionPriceFloor;
  }

  public void setExecutionPriceFloor(BigDecimal executionPriceFloor) {
    this.executionPriceFloor = executionPriceFloor;
  }

  public BigDecimal getExecutionPriceSpread() {
    return executionPriceSpread;
  }

  public void setExecutionPriceSpread(BigDecimal executionPriceSpread) {
    this.executionPriceSpread = executionPriceSpread;
  }

  public List<Venue> getVenues() {
    return venues;
  }

  public void setVenues(List<Venue> venues) {
    this.venues = venues;
  }

  private static List<Venue> defaultVenues() {
    return List.of(
        new Venue("Raydium", new BigDecimal("0.98"), new BigDecimal("0.04"), new BigDecimal("0.003")),
        new Venue("Meteora", new BigDecimal("0.97"), new BigDecimal("0.05"), new BigDecimal("0.002")));
  }

  public static class Venue {
    private String name;
    private BigDecimal priceFloor;
    private BigDecimal priceSpread;
    private BigDecimal fee;

    public Venue() {}

    public Venue(String name, BigDecimal priceFloor, BigDecimal priceSpread, BigDecimal fee) {
      this.name = name;
      this.priceFloor = priceFloor;
      this.priceSpread = priceSpread;
      this.fee = fee;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public BigDecimal getPriceFloor() {
      return priceFloor;
    }

    public void setPriceFloor(BigDecimal priceFloor) {
      this.priceFloor = priceFloor;
    }

    public BigDecimal getPriceSpread() {
      return priceSpread;
    }

    public void setPriceSpread(BigDecimal priceSpread) {
      this.priceSpread = priceSpread;
    }

    public BigDecimal getFee() {
      return fee;
    }

    public void setFee(BigDecimal fee) {
      this.fee = fee;
    }
  }
}
