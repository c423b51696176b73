/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.context.slf4j;

import org.slf4j.MDC;
import tether.Span;
import tether.internal.Nullable;
import tether.propagation.SpanStore;

/**
 * Copies the active trace into the SLF4J {@linkplain MDC Mapped Diagnostic Context (MDC)}, so
 * log lines can be correlated with traces.
 *
 * <p>Ex.
 * <pre>{@code
 * tracing = Tracing.newBuilder()
 *                  .spanStore(ThreadLocalSpanStore.newBuilder()
 *                    .addContextListener(MDCContextListener.get())
 *                    .build()
 *                  )
 *                  ...
 *                  .build();
 * }</pre>
 */
public final class MDCContextListener implements SpanStore.ContextListener {
  /** The trace id in log form, for example {@code 5BF6...C2-1}. */
  public static final String TRACE_ID = "traceId";
  /** The name of the active span. */
  public static final String SPAN_NAME = "spanName";
  /** "true" when the trace is sampled. */
  public static final String SAMPLED = "sampled";

  static final SpanStore.ContextListener INSTANCE = new MDCContextListener();

  /** Returns a singleton that sets {@link #TRACE_ID}, {@link #SPAN_NAME} and {@link #SAMPLED}. */
  public static SpanStore.ContextListener get() {
    return INSTANCE;
  }

  @Override public void contextChanged(@Nullable Span current) {
    if (current != null) {
      MDC.put(TRACE_ID, current.identifier().toLogString());
      MDC.put(SPAN_NAME, current.name());
      MDC.put(SAMPLED, Boolean.toString(current.doSample()));
    } else {
      MDC.remove(TRACE_ID);
      MDC.remove(SPAN_NAME);
      MDC.remove(SAMPLED);
    }
  }

  @Override public String toString() {
    return "MDCContextListener{}";
  }

  MDCContextListener() {
  }
}
