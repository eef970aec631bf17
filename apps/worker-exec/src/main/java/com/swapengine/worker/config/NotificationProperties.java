package com.swapengine.worker.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notifications.ws")
public class NotificationProperties {
  private String path = "/ws";
  private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
  private Duration sendTimeLimit = Duration.ofSeconds(5);
  private int bufferSizeLimit = 512 * 1024;

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public List<String> getAllowedOrigins() {
    return allowedOrigins;
  }

  public void setAllowedOrigins(List<String> allowedOrigins) {
    this.allowedOrigins = allowedOrigins;
  }

  public Duration getSendTimeLimit() {
    return sendTimeLimit;
  }

  public void setSendTimeLimit(Duration sendTimeLimit) {
    this.sendTimeLimit = sendTimeLimit;
  }

  public int getBufferSizeLimit() {
    return bufferSizeLimit;
  }

  public void setBufferSizeLimit(int bufferSizeLimit) {
    this.bufferSizeLimit = bufferSizeLimit;
  }
}
