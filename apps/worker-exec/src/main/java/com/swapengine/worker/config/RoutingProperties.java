package com.swapengine.worker.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {
  private int quotePoolSize = 8;
  private Duration quoteTimeout = Duration.ofSeconds(2);
  // Empty means venue registration order.
  private List<String> sourcePriority = new ArrayList<>();

  public int getQuotePoolSize() {
    return quotePoolSize;
  }

  public void setQuotePoolSize(int quotePoolSize) {
    this.quotePoolSize = quotePoolSize;
  }

  public Duration getQuoteTimeout() {
    return quoteTimeout;
  }

  public void setQuoteTimeout(Duration quoteTimeout) {
    this.quoteTimeout = quoteTimeout;
  }

  public List<String> getSourcePriority() {
    return sourcePriority;
  }

  public void setSourcePriority(List<String> sourcePriority) {
    this.sourcePriority = sourcePriority;
  }
}
