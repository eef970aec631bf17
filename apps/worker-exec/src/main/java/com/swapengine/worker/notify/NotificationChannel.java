package com.swapengine.worker.notify;

import com.swapengine.worker.lifecycle.OrderLifecycleEvent;
import java.io.IOException;

/**
 * Send-only handle onto a subscriber connection. The transport layer owns the connection; an
 * {@link IOException} means the channel is no longer usable.
 */
public interface NotificationChannel {
  String id();

  void send(OrderLifecycleEvent event) throws IOException;
}
