package com.swapengine.domain.routing;

public class ExecutionFailedException extends RuntimeException {
  private final String route;

  public ExecutionFailedException(String route, String message) {
    super(message);
    this.route = route;
  }

  public ExecutionFailedException(String route, String message, Throwable cause) {
    super(message, cause);
    this.route = route;
  }

  public String getRoute() {
    return route;
  }
}
