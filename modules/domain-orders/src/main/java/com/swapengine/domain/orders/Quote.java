package com.swapengine.domain.orders;

import java.math.BigDecimal;

/**
 * A price offer from one liquidity source. {@code price} is output-per-input for the pair and
 * amount of the order that requested it; quotes are never reused across orders.
 */
public record Quote(String source, BigDecimal price, BigDecimal fee) {
  public Quote {
    if (source == null || source.isBlank()) {
      throw new OrderDomainException("source must not be blank");
    }
    if (price == null || price.compareTo(BigDecimal.ZERO) <= 0) {
      throw new OrderDomainException("price must be > 0");
    }
    if (fee == null || fee.compareTo(BigDecimal.ZERO) < 0 || fee.compareTo(BigDecimal.ONE) >= 0) {
      throw new OrderDomainException("fee must be in [0, 1)");
    }
  }
}
