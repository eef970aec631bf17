package com.swapengine.infra.kafka.contract;

public final class JobTypes {
  public static final String ORDER_SUBMITTED = "OrderSubmitted";

  private JobTypes() {}
}
