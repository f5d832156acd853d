package io.castbus.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates daemon threads named {@code <prefix>1}, {@code <prefix>2}, ... so bus threads are
 * recognisable in thread dumps and never keep the JVM alive.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private final String prefix;
  private final AtomicInteger sequence = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    if (prefix.isEmpty()) {
      throw new IllegalArgumentException("prefix must not be empty");
    }
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, prefix + sequence.getAndIncrement());
    thread.setDaemon(true);
    return thread;
  }
}
