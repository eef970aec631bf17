package com.swapengine.domain.orders;

/** Reason carried by the terminal {@code failed} lifecycle event. */
public enum FailureReason {
  NO_QUOTES_AVAILABLE("NoQuotesAvailable"),
  EXECUTION_FAILED("ExecutionFailed"),
  INTERNAL_ERROR("InternalError");

  private final String code;

  FailureReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
