package com.swapengine.domain.routing;

import java.util.List;

public class NoQuotesAvailableException extends RuntimeException {
  private final List<SourceFailure> failures;

  public NoQuotesAvailableException(String message, List<SourceFailure> failures) {
    super(message);
    this.failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public List<SourceFailure> getFailures() {
    return failures;
  }
}
