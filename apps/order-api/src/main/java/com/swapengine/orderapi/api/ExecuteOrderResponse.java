package com.swapengine.orderapi.api;

public record ExecuteOrderResponse(String orderId, String message) {
  static final String SUBMITTED_MESSAGE = "Order submitted successfully";

  public static ExecuteOrderResponse submitted(String orderId) {
    return new ExecuteOrderResponse(orderId, SUBMITTED_MESSAGE);
  }
}
