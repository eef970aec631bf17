package com.swapengine.integration.dex;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.random.RandomGenerator;

final class PriceJitter {
  private static final int PRICE_SCALE = 8;

  private PriceJitter() {}

  /** Returns {@code basePrice * (floor + u * spread)} for a uniform {@code u} in [0, 1). */
  static BigDecimal apply(
      BigDecimal basePrice, BigDecimal floor, BigDecimal spread, RandomGenerator random) {
    BigDecimal factor = floor.add(spread.multiply(BigDecimal.valueOf(random.nextDouble())));
    return basePrice.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
  }
}
