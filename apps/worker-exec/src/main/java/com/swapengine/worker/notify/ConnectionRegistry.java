package com.swapengine.worker.notify;

import com.swapengine.worker.lifecycle.OrderLifecycleEvent;
import java.io.IOException;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps an order id to at most one subscriber channel.
 *
 * <p>Channels are held weakly; the transport keeps the strong reference for as long as the
 * connection is open. Map mutations and lookups happen under a single lock. The send itself runs
 * outside the lock, and a failed send removes the entry only if it still points at the channel
 * that failed.
 */
@Component
public class ConnectionRegistry {
  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, WeakReference<NotificationChannel>> channels = new HashMap<>();

  public void attach(String orderId, NotificationChannel channel) {
    requireOrderId(orderId);
    Objects.requireNonNull(channel, "channel must not be null");
    lock.lock();
    try {
      WeakReference<NotificationChannel> previous =
          channels.put(orderId, new WeakReference<>(channel));
      NotificationChannel replaced = previous == null ? null : previous.get();
      if (replaced != null && replaced != channel) {
        log.debug(
            "Replaced subscriber orderId={} previousChannel={} channel={}",
            orderId,
            replaced.id(),
            channel.id());
      }
    } finally {
      lock.unlock();
    }
  }

  public void detach(String orderId) {
    if (orderId == null) {
      return;
    }
    lock.lock();
    try {
      channels.remove(orderId);
    } finally {
      lock.unlock();
    }
  }

  /** Detaches only if {@code channel} is still the one registered for {@code orderId}. */
  public boolean detach(String orderId, NotificationChannel channel) {
    if (orderId == null || channel == null) {
      return false;
    }
    lock.lock();
    try {
      return removeIfCurrent(orderId, channel);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sends the event to the channel attached for {@code orderId}, if any.
   *
   * @return whether the event was handed to a live channel
   */
  public boolean publish(String orderId, OrderLifecycleEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    NotificationChannel channel = lookup(orderId);
    if (channel == null) {
      log.debug("No subscriber, dropping event orderId={} status={}", orderId, event.status());
      return false;
    }
    try {
      channel.send(event);
      return true;
    } catch (IOException | RuntimeException ex) {
      log.debug(
          "Subscriber undeliverable, detaching orderId={} channel={} status={} error={}",
          orderId,
          channel.id(),
          event.status(),
          ex.toString());
      detach(orderId, channel);
      return false;
    }
  }

  public boolean isAttached(String orderId) {
    return lookup(orderId) != null;
  }

  private NotificationChannel lookup(String orderId) {
    if (orderId == null) {
      return null;
    }
    lock.lock();
    try {
      WeakReference<NotificationChannel> reference = channels.get(orderId);
      if (reference == null) {
        return null;
      }
      NotificationChannel channel = reference.get();
      if (channel == null) {
        channels.remove(orderId);
      }
      return channel;
    } finally {
      lock.unlock();
    }
  }

  private boolean removeIfCurrent(String orderId, NotificationChannel channel) {
    WeakReference<NotificationChannel> reference = channels.get(orderId);
    if (reference == null) {
      return false;
    }
    NotificationChannel current = reference.get();
    if (current == null || current == channel) {
      channels.remove(orderId);
      return current != null;
    }
    return false;
  }

  private static void requireOrderId(String orderId) {
    if (orderId == null || orderId.isBlank()) {
      throw new IllegalArgumentException("orderId must not be blank");
    }
  }
}
