package com.swapengine.domain.routing;

import com.swapengine.domain.orders.Quote;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the quote with the greatest price. Input is first put in canonical order (configured
 * source priority, then source name for unranked sources) so that ties resolve to the same
 * source regardless of the order in which quotes arrived.
 */
public class RouteSelector {
  private final Map<String, Integer> priorities;
  private final Comparator<Quote> canonicalOrder;

  public RouteSelector(List<String> sourcePriority) {
    this.priorities = new HashMap<>();
    if (sourcePriority != null) {
      for (String source : sourcePriority) {
        if (source != null && !source.isBlank()) {
          priorities.putIfAbsent(source.trim(), priorities.size());
        }
      }
    }
    this.canonicalOrder =
        Comparator.comparingInt((Quote quote) -> rankOf(quote.source()))
            .thenComparing(Quote::source);
  }

  public Quote select(List<Quote> quotes) {
    if (quotes == null || quotes.isEmpty()) {
      throw new IllegalArgumentException("quotes must not be empty");
    }
    List<Quote> ordered = new ArrayList<>(quotes);
    ordered.sort(canonicalOrder);

    Quote best = ordered.get(0);
    for (int i = 1; i < ordered.size(); i++) {
      Quote candidate = ordered.get(i);
      if (candidate.price().compareTo(best.price()) > 0) {
        best = candidate;
      }
    }
    return best;
  }

  private int rankOf(String source) {
    if (source == null) {
      return Integer.MAX_VALUE;
    }
    return priorities.getOrDefault(source.trim(), Integer.MAX_VALUE);
  }
}
