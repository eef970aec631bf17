package com.swapengine.domain.routing;

import java.math.BigDecimal;

public record QuoteRequest(String tokenIn, String tokenOut, BigDecimal amount) {
  public QuoteRequest {
    if (tokenIn == null || tokenIn.isBlank()) {
      throw new IllegalArgumentException("tokenIn must not be blank");
    }
    if (tokenOut == null || tokenOut.isBlank()) {
      throw new IllegalArgumentException("tokenOut must not be blank");
    }
    if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
  }

  public String pair() {
    return tokenIn + "/" + tokenOut;
  }
}
