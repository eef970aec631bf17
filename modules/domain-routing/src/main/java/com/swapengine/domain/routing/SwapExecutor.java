package com.swapengine.domain.routing;

import com.swapengine.domain.orders.Settlement;

/**
 * Commits a swap on the chosen route. The executed price may differ from the quoted one. No retry
 * happens here; a thrown exception is terminal for the order.
 */
public interface SwapExecutor {
  Settlement execute(String route, QuoteRequest request);
}
