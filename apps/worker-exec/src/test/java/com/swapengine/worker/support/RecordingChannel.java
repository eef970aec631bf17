package com.swapengine.worker.support;

import com.swapengine.worker.lifecycle.OrderLifecycleEvent;
import com.swapengine.worker.notify.NotificationChannel;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** In-memory channel that records every event; can be switched to fail on send. */
public class RecordingChannel implements NotificationChannel {
  private final String id;
  private final List<OrderLifecycleEvent> events = new ArrayList<>();
  private volatile boolean broken;

  public RecordingChannel(String id) {
    this.id = id;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public synchronized void send(OrderLifecycleEvent event) throws IOException {
    if (broken) {
      throw new IOException("channel " + id + " closed");
    }
    events.add(event);
  }

  public void breakChannel() {
    broken = true;
  }

  public synchronized List<OrderLifecycleEvent> events() {
    return List.copyOf(events);
  }

  public synchronized List<String> statuses() {
    return events.stream().map(OrderLifecycleEvent::status).toList();
  }
}
