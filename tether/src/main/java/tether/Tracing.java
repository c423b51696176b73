/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import java.io.Closeable;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.internal.handler.SafeEventReporter;
import tether.propagation.SpanStore;
import tether.propagation.ThreadLocalSpanStore;
import tether.sampler.Sampler;
import tether.sampler.TraceMode;
import zipkin2.reporter.Reporter;

/**
 * This provides utilities needed for trace instrumentation. For example, a {@link Tracer}.
 *
 * <p>Instances built via {@link #newBuilder()} are registered automatically such that statically
 * configured instrumentation can use {@link Tracing#currentTracer()}.
 *
 * <p>Trace mode and sample rate are fixed when the component is built. To change them, close this
 * component and build another.
 *
 * <p>This type can be extended so that the object graph can be built differently or overridden,
 * for example via Spring or when mocking.
 */
public abstract class Tracing implements Closeable {
  static final AtomicReference<Tracing> CURRENT = new AtomicReference<>();

  public static Builder newBuilder() {
    return new Builder();
  }

  /** All instrumentation starts with a {@link Tracer}. */
  abstract public Tracer tracer();

  /** Decides whether a request with no active span starts or continues a recorded trace. */
  abstract public Sampler sampler();

  /** This supports in-process propagation, typically across thread boundaries. */
  abstract public SpanStore spanStore();

  /** This exposes the microsecond clock used to timestamp events. */
  abstract public Clock clock();

  /**
   * Returns the most recently created tracing component iff it hasn't been closed. null otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracing current() {
    return CURRENT.get();
  }

  /**
   * Returns the most recently created tracer if its component hasn't been closed. null otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracer currentTracer() {
    Tracing tracing = current();
    return tracing != null ? tracing.tracer() : null;
  }

  /** When true, events are still recorded but nothing is reported. */
  public abstract boolean isNoop();

  /**
   * Set true to drop data regardless of sampling policy. This allows operators to stop reporting
   * in risk scenarios.
   */
  public abstract void setNoop(boolean noop);

  /** Ensures this component can be garbage collected, by making it not {@link #current()} */
  @Override abstract public void close();

  public static final class Builder {
    TraceMode traceMode = TraceMode.ALWAYS;
    int sampleRate = Sampler.MAX_SAMPLE_RATE;
    Sampler sampler;
    Clock clock;
    SpanStore spanStore = ThreadLocalSpanStore.create();
    LogTraceIdMode logTraceIdMode = LogTraceIdMode.NEVER;
    final Set<Reporter<Event>> reporters = new LinkedHashSet<>();

    /** Whether new traces may start. Defaults to {@link TraceMode#ALWAYS}. */
    public Builder traceMode(TraceMode traceMode) {
      if (traceMode == null) throw new NullPointerException("traceMode == null");
      this.traceMode = traceMode;
      return this;
    }

    /**
     * Like {@link #traceMode(TraceMode)}, but parsed from configuration text. Unrecognized values
     * are logged and leave the trace mode unchanged.
     *
     * @see TraceMode#parse(String)
     */
    public Builder traceMode(@Nullable String traceMode) {
      TraceMode parsed = TraceMode.parse(traceMode);
      if (parsed == null) {
        Platform.get().warn("Invalid trace mode {0}: keeping " + this.traceMode, traceMode);
        return this;
      }
      this.traceMode = parsed;
      return this;
    }

    /**
     * Parts per million of new traces to sample. Negative values are logged and ignored, and
     * values above {@link Sampler#MAX_SAMPLE_RATE} are logged and clamped. Defaults to sampling
     * every trace.
     */
    public Builder sampleRate(int sampleRate) {
      if (sampleRate < 0) {
        Platform.get().warn("Invalid sample rate {0}: keeping " + this.sampleRate, sampleRate);
        return this;
      }
      if (sampleRate > Sampler.MAX_SAMPLE_RATE) {
        Platform.get().warn("Sample rate {0} out of range: using " + Sampler.MAX_SAMPLE_RATE,
          sampleRate);
        sampleRate = Sampler.MAX_SAMPLE_RATE;
      }
      this.sampleRate = sampleRate;
      return this;
    }

    /**
     * Overrides the sampler derived from {@link #traceMode(TraceMode)} and {@link
     * #sampleRate(int)}.
     */
    public Builder sampler(Sampler sampler) {
      if (sampler == null) throw new NullPointerException("sampler == null");
      this.sampler = sampler;
      return this;
    }

    /**
     * Adds a destination for recorded events of sampled traces. When none is added, events are
     * logged at {@link Level#INFO}.
     */
    public Builder addReporter(Reporter<Event> reporter) {
      if (reporter == null) throw new NullPointerException("reporter == null");
      this.reporters.add(reporter);
      return this;
    }

    /** Defaults to the system clock, in microseconds. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /** Defaults to {@link ThreadLocalSpanStore#create()}. */
    public Builder spanStore(SpanStore spanStore) {
      if (spanStore == null) throw new NullPointerException("spanStore == null");
      this.spanStore = spanStore;
      return this;
    }

    /** Defaults to {@link LogTraceIdMode#NEVER}. */
    public Builder logTraceIdMode(LogTraceIdMode logTraceIdMode) {
      if (logTraceIdMode == null) throw new NullPointerException("logTraceIdMode == null");
      this.logTraceIdMode = logTraceIdMode;
      return this;
    }

    public Tracing build() {
      return new Default(this);
    }

    Builder() {
    }
  }

  static final class LogEventReporter implements Reporter<Event> {
    final Logger logger = Logger.getLogger(Tracer.class.getName());

    @Override public void report(Event event) {
      if (!logger.isLoggable(Level.INFO)) return;
      logger.info(event.toString());
    }

    @Override public String toString() {
      return "LogEventReporter{name=" + logger.getName() + "}";
    }
  }

  static final class Default extends Tracing {
    final Tracer tracer;
    final Sampler sampler;
    final SpanStore spanStore;
    final Clock clock;
    final AtomicBoolean noop;

    Default(Builder builder) {
      this.clock = builder.clock != null ? builder.clock : Platform.get().clock();
      this.sampler = builder.sampler != null
        ? builder.sampler
        : Sampler.create(builder.traceMode, builder.sampleRate);
      this.spanStore = builder.spanStore;
      this.noop = new AtomicBoolean();

      Set<Reporter<Event>> reporters = new LinkedHashSet<>(builder.reporters);
      if (reporters.isEmpty()) reporters.add(new LogEventReporter());

      // Make sure any exceptions caused by reporters don't crash callers
      @SuppressWarnings("unchecked")
      Reporter<Event> reporter =
        SafeEventReporter.create(reporters.toArray(new Reporter[0]), noop);

      this.tracer = new Tracer(clock, reporter, spanStore, sampler, builder.logTraceIdMode);
      // assign current IFF there's no instance already current
      CURRENT.compareAndSet(null, this);
    }

    @Override public Tracer tracer() {
      return tracer;
    }

    @Override public Sampler sampler() {
      return sampler;
    }

    @Override public SpanStore spanStore() {
      return spanStore;
    }

    @Override public Clock clock() {
      return clock;
    }

    @Override public boolean isNoop() {
      return noop.get();
    }

    @Override public void setNoop(boolean noop) {
      this.noop.set(noop);
    }

    @Override public String toString() {
      return tracer.toString();
    }

    @Override public void close() {
      // only set null if we are the outer-most instance
      CURRENT.compareAndSet(this, null);
    }
  }

  Tracing() { // intentionally hidden constructor
  }
}
