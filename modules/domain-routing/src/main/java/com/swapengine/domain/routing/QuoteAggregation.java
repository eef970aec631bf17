package com.swapengine.domain.routing;

import com.swapengine.domain.orders.Quote;
import java.util.List;

public record QuoteAggregation(List<Quote> quotes, List<SourceFailure> failures) {
  public QuoteAggregation {
    quotes = quotes == null ? List.of() : List.copyOf(quotes);
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public boolean hasQuotes() {
    return !quotes.isEmpty();
  }

  public boolean isPartial() {
    return hasQuotes() && !failures.isEmpty();
  }

  public List<Quote> requireQuotes() {
    if (!hasQuotes()) {
      throw new NoQuotesAvailableException("Every price source failed: " + failures, failures);
    }
    return quotes;
  }
}
