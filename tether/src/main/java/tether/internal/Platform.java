/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.internal;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import tether.Clock;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems.
 *
 * <p>Originally designed by OkHttp team, derived from {@code okhttp3.internal.platform.Platform}
 */
public class Platform {
  private static final Platform PLATFORM = new Platform();
  private static final Logger LOG = Logger.getLogger(tether.Tracer.class.getName());

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String)}, at {@link Level#FINE} to not fill logs. */
  public void log(String msg, @Nullable Throwable thrown) {
    log(Level.FINE, msg, null, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    log(Level.FINE, msg, param1, thrown);
  }

  public void warn(String msg, @Nullable Object param1) {
    log(Level.WARNING, msg, param1, null);
  }

  public void error(String msg, @Nullable Object param1, @Nullable Throwable thrown) {
    log(Level.SEVERE, msg, param1, thrown);
  }

  public boolean isLoggable(Level level) {
    return LOG.isLoggable(level);
  }

  public void log(Level level, String msg, @Nullable Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(level)) return;
    LogRecord lr = new LogRecord(level, msg);
    lr.setLoggerName(LOG.getName());
    lr.setParameters(new Object[] {param1});
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  /**
   * This class uses pseudo-random number generators to provision IDs.
   *
   * <p>This optimizes speed over full coverage of 64-bits, which is why it doesn't share a {@link
   * java.security.SecureRandom}.
   */
  public long randomLong() {
    return ThreadLocalRandom.current().nextLong();
  }

  public int randomInt() {
    return ThreadLocalRandom.current().nextInt();
  }

  public Clock clock() {
    return new Clock() {
      @Override public long currentTimeMicroseconds() {
        java.time.Instant instant = java.time.Clock.systemUTC().instant();
        return (instant.getEpochSecond() * 1000000) + (instant.getNano() / 1000);
      }

      @Override public String toString() {
        return "Clock.systemUTC().instant()";
      }
    };
  }

  /** Returns the stack trace of the calling thread, starting at the caller of this method. */
  public String backtrace() {
    StackTraceElement[] elements = new Throwable().getStackTrace();
    StringBuilder result = new StringBuilder();
    for (int i = 1; i < elements.length; i++) {
      StackTraceElement element = elements[i];
      result.append("    at ").append(element).append('\n');
    }
    return result.toString();
  }

  public String backtrace(Throwable error) {
    StringWriter writer = new StringWriter();
    error.printStackTrace(new PrintWriter(writer));
    return writer.toString();
  }

  @Override public String toString() {
    return "Platform{}";
  }

  Platform() {
  }
}
