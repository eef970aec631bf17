package com.swapengine.domain.routing;

import com.swapengine.domain.orders.Quote;

/**
 * A liquidity source able to price a swap. Implementations may block; any exception thrown from
 * {@link #quote(QuoteRequest)} is treated as a failure of this source only.
 */
public interface PriceSource {
  String name();

  Quote quote(QuoteRequest request);
}
