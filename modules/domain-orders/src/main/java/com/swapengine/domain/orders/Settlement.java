package com.swapengine.domain.orders;

import java.math.BigDecimal;

public record Settlement(String transactionRef, BigDecimal executedPrice) {
  public Settlement {
    if (transactionRef == null || transactionRef.isBlank()) {
      throw new OrderDomainException("transactionRef must not be blank");
    }
    if (executedPrice == null || executedPrice.compareTo(BigDecimal.ZERO) <= 0) {
      throw new OrderDomainException("executedPrice must be > 0");
    }
  }
}
