/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.http;

import tether.InstrumentOptions;
import tether.Span;
import tether.SpanDescriptor;
import tether.SyncTask;
import tether.Tracer;
import tether.internal.Nullable;
import tether.propagation.SpanStore;

/**
 * Instruments request handlers whose span must last until the response ends, rather than until the
 * handler returns.
 *
 * <pre>{@code
 * httpInstrumenter.instrumentHttp(SpanDescriptor.named("handler"), () -> {
 *   handler.handle(request, response);
 *   return null;
 * }, null, response);
 * }</pre>
 */
public final class HttpInstrumenter {
  public static HttpInstrumenter create(Tracer tracer) {
    return new HttpInstrumenter(tracer, new ResponseFinalizers());
  }

  public static HttpInstrumenter create(Tracer tracer, ResponseFinalizers finalizers) {
    return new HttpInstrumenter(tracer, finalizers);
  }

  final Tracer tracer;
  final ResponseFinalizers finalizers;

  HttpInstrumenter(Tracer tracer, ResponseFinalizers finalizers) {
    if (tracer == null) throw new NullPointerException("tracer == null");
    if (finalizers == null) throw new NullPointerException("finalizers == null");
    this.tracer = tracer;
    this.finalizers = finalizers;
  }

  public ResponseFinalizers finalizers() {
    return finalizers;
  }

  /**
   * Runs the handler in a child of the current span, which exits when the response ends. If the
   * handler throws, the error is attached to the span's exit and rethrown. With no current span,
   * or when the options disable tracing, the handler runs as-is.
   */
  @Nullable public <V, E extends Throwable> V instrumentHttp(SpanDescriptor descriptor,
    SyncTask<V, E> handler, @Nullable InstrumentOptions options, Object response) throws E {
    if (response == null) throw new NullPointerException("response == null");
    Span span = tracer.nextSpan(descriptor, options);
    if (span == null) return handler.run();
    SpanStore store = tracer.spanStore();
    try (SpanStore.Scope scope = store.checkpoint()) {
      span.enter();
      Runnable exit = span::exit;
      finalizers.add(response, store.bind(exit));
      try {
        return handler.run();
      } catch (Throwable e) {
        span.setExitError(e);
        throw e;
      }
    }
  }
}
