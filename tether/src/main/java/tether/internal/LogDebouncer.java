/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.internal;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

/**
 * Limits how often a repetitive diagnostic is written. The first occurrence is always logged, and
 * afterwards at most once per {@link #everyCount} occurrences or {@link #everyNanos} of elapsed
 * time, whichever comes first. The logged message carries the number of suppressed occurrences.
 */
public final class LogDebouncer {
  public static LogDebouncer create(Level level) {
    return new LogDebouncer(level, 1000, TimeUnit.SECONDS.toNanos(5));
  }

  final Level level;
  final long everyCount, everyNanos;
  final AtomicLong count = new AtomicLong();
  final AtomicLong lastLogged = new AtomicLong(Long.MIN_VALUE);

  LogDebouncer(Level level, long everyCount, long everyNanos) {
    this.level = level;
    this.everyCount = everyCount;
    this.everyNanos = everyNanos;
  }

  /** Logs the message when due. Returns true if it was written. */
  public boolean log(String msg, @Nullable Object param1) {
    long n = count.getAndIncrement();
    long now = System.nanoTime();
    long last = lastLogged.get();
    boolean due = n == 0 || n % everyCount == 0 || now - last >= everyNanos;
    if (!due || !lastLogged.compareAndSet(last, now)) return false;
    Platform.get().log(level, msg + " (occurrences: " + (n + 1) + ")", param1, null);
    return true;
  }

  public long count() {
    return count.get();
  }
}
