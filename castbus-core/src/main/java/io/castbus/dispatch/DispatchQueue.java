package io.castbus.dispatch;

import io.castbus.Event;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unbounded FIFO buffer of events awaiting delivery.
 *
 * <p>Every offered event receives a sequence number. The drain loop reports the highest
 * delivered sequence back through {@link #markDelivered(long)}, which lets
 * {@link DefaultEventBus#publishAsync} tell whether its event has been delivered.
 */
final class DispatchQueue {

  /** An event paired with its enqueue sequence. */
  record Pending(Event<?> event, long sequence) {}

  private final Queue<Pending> pending = new ConcurrentLinkedQueue<>();
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();

  long offer(Event<?> event) {
    long seq = sequence.incrementAndGet();
    pending.add(new Pending(event, seq));
    return seq;
  }

  Pending poll() {
    return pending.poll();
  }

  boolean isEmpty() {
    return pending.isEmpty();
  }

  int size() {
    return pending.size();
  }

  /** Highest sequence handed out so far. */
  long lastSequence() {
    return sequence.get();
  }

  void markDelivered(long seq) {
    delivered.accumulateAndGet(seq, Math::max);
  }

  long deliveredSequence() {
    return delivered.get();
  }
}
