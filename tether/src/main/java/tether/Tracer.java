/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.propagation.EventEmitter;
import tether.propagation.Identifier;
import tether.propagation.SpanStore;
import tether.sampler.Sampler;
import tether.sampler.SamplingDecision;
import zipkin2.reporter.Reporter;

import static tether.internal.Throwables.propagateIfFatal;

/**
 * Runs user code inside spans.
 *
 * <p>{@link #instrument} adds a child to the span active in the calling flow, and does nothing
 * when there is none. {@link #startOrContinueTrace} is for work with no guaranteed active span,
 * such as an inbound request: it asks the {@link Sampler} whether to start a trace, or to continue
 * the one identified by the request.
 *
 * <p>Work is given in one of three shapes, which fixes the {@link ExecutionMode}:
 * <ul>
 *   <li>{@link SyncTask}: the span exits when the task returns or throws</li>
 *   <li>{@link CallbackTask}: the span exits when the task invokes its callback</li>
 *   <li>{@code Supplier<CompletionStage>}: the span exits when the stage completes</li>
 * </ul>
 *
 * <p>Failures in the work are recorded on the span's exit event, then reach the caller unchanged.
 * Failures in tracing itself are logged, and the work runs without a span.
 *
 * <p>Example:
 * <pre>{@code
 * String body = tracer.instrument(SpanDescriptor.named("fetch"), () -> client.fetch(url));
 * }</pre>
 */
public class Tracer {
  /** The key under which {@link #insertLogObject} adds the trace id. */
  public static final String LOG_OBJECT_KEY = "tether";

  final Clock clock;
  final Reporter<Event> reporter;
  final SpanStore spanStore;
  final Sampler sampler;
  final LogTraceIdMode logTraceIdMode;

  Tracer(Clock clock, Reporter<Event> reporter, SpanStore spanStore, Sampler sampler,
    LogTraceIdMode logTraceIdMode) {
    this.clock = clock;
    this.reporter = reporter;
    this.spanStore = spanStore;
    this.sampler = sampler;
    this.logTraceIdMode = logTraceIdMode;
  }

  /** Same as {@code instrument(descriptor, run, InstrumentOptions.DEFAULT)} */
  @Nullable public <V, E extends Throwable> V instrument(SpanDescriptor descriptor,
    SyncTask<V, E> run) throws E {
    return instrument(descriptor, run, InstrumentOptions.DEFAULT);
  }

  /**
   * Runs the task in a child of the current span, returning its result. Anything the task throws
   * is recorded on the span and rethrown. When there is no current span, or the options disable
   * tracing, the task runs as-is.
   */
  @Nullable public <V, E extends Throwable> V instrument(SpanDescriptor descriptor,
    SyncTask<V, E> run, @Nullable InstrumentOptions options) throws E {
    if (run == null) return invalidTask("instrument");
    Span span = nextSpan(descriptor, options);
    if (span == null) return run.run();
    return span.runSync(run);
  }

  /** Same as {@code instrument(descriptor, run, InstrumentOptions.DEFAULT, callback)} */
  @Nullable public <V, R> R instrument(SpanDescriptor descriptor, CallbackTask<V, R> run,
    @Nullable Callback<V> callback) {
    return instrument(descriptor, run, InstrumentOptions.DEFAULT, callback);
  }

  /**
   * Starts the task in a child of the current span, returning what the task returns. The span
   * exits when the task invokes the callback it was given, which then invokes the input callback
   * with the same arguments.
   *
   * <p>When there is no current span the task gets the input callback as-is. When the options
   * disable tracing it gets the callback bound to the caller's context.
   *
   * @param callback notified when the task completes, or null to ignore completion
   */
  @Nullable public <V, R> R instrument(SpanDescriptor descriptor, CallbackTask<V, R> run,
    @Nullable InstrumentOptions options, @Nullable Callback<V> callback) {
    if (run == null) return invalidTask("instrument");
    return instrument(descriptor, run, options, callback, ExecutionMode.CALLBACK_ASYNC);
  }

  <V, R> R instrument(SpanDescriptor descriptor, CallbackTask<V, R> run,
    @Nullable InstrumentOptions options, @Nullable Callback<V> callback, ExecutionMode mode) {
    if (options == null) options = InstrumentOptions.DEFAULT;
    Callback<V> done = callback != null ? callback : Callback.noop();
    if (!options.enabled) return run.start(spanStore.bind(done));
    Span span = nextSpan(descriptor, options);
    if (span == null) return run.start(done);
    return runAsync(span, run, done, mode);
  }

  /** Same as {@code pInstrument(descriptor, task, InstrumentOptions.DEFAULT)} */
  @Nullable public <V, S extends CompletionStage<V>> S pInstrument(SpanDescriptor descriptor,
    Supplier<S> task) {
    return pInstrument(descriptor, task, InstrumentOptions.DEFAULT);
  }

  /**
   * Runs the task in a child of the current span, which exits when the returned stage completes.
   * The stage the task returned is returned as-is, so callers see the same value, failure and
   * timing as without tracing. A null stage exits the span immediately.
   */
  @Nullable public <V, S extends CompletionStage<V>> S pInstrument(SpanDescriptor descriptor,
    Supplier<S> task, @Nullable InstrumentOptions options) {
    if (task == null) return invalidTask("pInstrument");
    CallbackTask<V, S> run = done -> settle(task.get(), done);
    return instrument(descriptor, run, options, Callback.<V>noop(), ExecutionMode.PROMISE_ASYNC);
  }

  /** Same as {@code startOrContinueTrace(externalId, descriptor, run, InstrumentOptions.DEFAULT)} */
  @Nullable public <V, E extends Throwable> V startOrContinueTrace(@Nullable String externalId,
    SpanDescriptor descriptor, SyncTask<V, E> run) throws E {
    return startOrContinueTrace(externalId, descriptor, run, InstrumentOptions.DEFAULT);
  }

  /**
   * Runs the task in a new child of the current span, or when there is none, in a root span if the
   * sampler decides to record the trace. The external id is ignored when there is a current span.
   *
   * @param externalId an identifier token received from upstream, or null to start a new trace
   */
  @Nullable public <V, E extends Throwable> V startOrContinueTrace(@Nullable String externalId,
    SpanDescriptor descriptor, SyncTask<V, E> run, @Nullable InstrumentOptions options) throws E {
    if (run == null) return invalidTask("startOrContinueTrace");
    if (options == null) options = InstrumentOptions.DEFAULT;
    if (!options.enabled) return run.run();
    if (spanStore.current() != null) return instrument(descriptor, run, options);
    Span root = rootSpan(externalId, descriptor, options);
    if (root == null) return run.run();
    return root.runSync(run);
  }

  /**
   * Like {@link #startOrContinueTrace(String, SpanDescriptor, SyncTask, InstrumentOptions)}, for
   * work that completes through a callback.
   */
  @Nullable public <V, R> R startOrContinueTrace(@Nullable String externalId,
    SpanDescriptor descriptor, CallbackTask<V, R> run, @Nullable InstrumentOptions options,
    @Nullable Callback<V> callback) {
    if (run == null) return invalidTask("startOrContinueTrace");
    return startOrContinueTrace(externalId, descriptor, run, options, callback,
      ExecutionMode.CALLBACK_ASYNC);
  }

  <V, R> R startOrContinueTrace(@Nullable String externalId, SpanDescriptor descriptor,
    CallbackTask<V, R> run, @Nullable InstrumentOptions options, @Nullable Callback<V> callback,
    ExecutionMode mode) {
    if (options == null) options = InstrumentOptions.DEFAULT;
    Callback<V> done = callback != null ? callback : Callback.noop();
    if (!options.enabled) return run.start(spanStore.bind(done));
    if (spanStore.current() != null) return instrument(descriptor, run, options, done, mode);
    Span root = rootSpan(externalId, descriptor, options);
    if (root == null) return run.start(spanStore.bind(done));
    return runAsync(root, run, done, mode);
  }

  /**
   * Like {@link #startOrContinueTrace(String, SpanDescriptor, SyncTask, InstrumentOptions)}, for
   * work that completes a stage. The stage is returned as-is.
   */
  @Nullable public <V, S extends CompletionStage<V>> S pStartOrContinueTrace(
    @Nullable String externalId, SpanDescriptor descriptor, Supplier<S> task,
    @Nullable InstrumentOptions options) {
    if (task == null) return invalidTask("pStartOrContinueTrace");
    CallbackTask<V, S> run = done -> settle(task.get(), done);
    return startOrContinueTrace(externalId, descriptor, run, options, Callback.<V>noop(),
      ExecutionMode.PROMISE_ASYNC);
  }

  /**
   * Returns a child of the current span, not yet entered, or null when there is no current span,
   * the options disable tracing, or the descriptor yields no name. Failures building the span are
   * logged and also return null.
   *
   * <p>The child links its entry to the current span's last event as of now, if the current span
   * is no longer reachable when the child is entered.
   */
  @Nullable public Span nextSpan(SpanDescriptor descriptor, @Nullable InstrumentOptions options) {
    if (options == null) options = InstrumentOptions.DEFAULT;
    if (!options.enabled) return null;
    Span current = spanStore.current();
    if (current == null) return null;
    try {
      SpanInfo info = descriptor.resolve(current);
      if (info == null || info.name == null) {
        Platform.get().log("Tracer.nextSpan: no span name from {0}", descriptor, null);
        return null;
      }
      Span span = current.descend(info.name, info.attributes);
      if (span == null) return null;
      customize(span, info, options);
      return span;
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().error("Tracer.nextSpan: error creating span from {0}", descriptor, t);
      return null;
    }
  }

  @Nullable Span rootSpan(@Nullable String externalId, SpanDescriptor descriptor,
    InstrumentOptions options) {
    Identifier upstream = Identifier.parse(externalId);
    SamplingDecision decision;
    try {
      decision = sampler.decide(upstream);
      if (decision == null) throw new NullPointerException(sampler + " returned null");
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().error("Tracer.startOrContinueTrace: error sampling {0}", externalId, t);
      decision = SamplingDecision.FALLBACK;
    }
    if (!decision.doSample() && !decision.doMetrics()) return null;

    try {
      SpanInfo info = descriptor.resolve(null);
      if (info == null || info.name == null) {
        Platform.get().log("Tracer.startOrContinueTrace: no span name from {0}", descriptor, null);
        return null;
      }
      Identifier identifier = decision.identifier() != null
        ? decision.identifier().withSampled(decision.doSample())
        : Identifier.newRandom(decision.doSample());
      Span root = new Span(clock, reporter, spanStore, info.name, null, identifier, upstream,
        decision.doSample(), decision.doMetrics(), true);
      root.entry.set(info.attributes);
      if (externalId == null && decision.doSample()) {
        root.entry.set(EventKeys.SAMPLE_SOURCE, decision.source());
        root.entry.set(EventKeys.SAMPLE_RATE, decision.rate());
      }
      root.transactionName(
        options.transactionName != null ? options.transactionName : "custom-" + info.name);
      if (options.transactionNameSupplier != null) {
        root.transactionName(options.transactionNameSupplier);
      }
      customize(root, info, options);
      return root;
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().error("Tracer.startOrContinueTrace: error creating span from {0}",
        descriptor, t);
      return null;
    }
  }

  static void customize(Span span, SpanInfo info, InstrumentOptions options) {
    if (options.collectBacktraces && span.doSample) {
      span.entry.set(EventKeys.BACKTRACE, Platform.get().backtrace());
    }
    if (info.customizer != null) info.customizer.accept(span);
  }

  static <V, R> R runAsync(Span span, CallbackTask<V, R> run, Callback<V> done,
    ExecutionMode mode) {
    return span.runAsync(mode, wrapper -> run.start(wrapper.wrap(done)));
  }

  @Nullable static <V, S extends CompletionStage<V>> S settle(@Nullable S stage, Callback<V> done) {
    if (stage == null) {
      done.onComplete(null, null);
      return null;
    }
    stage.whenComplete((value, error) -> done.onComplete(unwrap(error), value));
    return stage;
  }

  @Nullable static Throwable unwrap(@Nullable Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) return error.getCause();
    return error;
  }

  @Nullable static <T> T invalidTask(String operation) {
    Platform.get().error("Tracer." + operation + ": task == null", null, null);
    return null;
  }

  /** Returns the span active in the calling flow, or null if there is none. */
  @Nullable public Span currentSpan() {
    return spanStore.current();
  }

  public SpanStore spanStore() {
    return spanStore;
  }

  /** Same as {@link SpanStore#bind(Runnable)} */
  public Runnable bind(Runnable task) {
    return spanStore.bind(task);
  }

  /** Same as {@link SpanStore#bind(Callback)} */
  public <V> Callback<V> bind(Callback<V> callback) {
    return spanStore.bind(callback);
  }

  /** Same as {@link SpanStore#bind(EventEmitter.Listener)} */
  public EventEmitter.Listener bind(EventEmitter.Listener listener) {
    return spanStore.bind(listener);
  }

  /** Same as {@link SpanStore#bindEmitter(Object)} */
  public <T> T bindEmitter(T emitter) {
    return spanStore.bindEmitter(emitter);
  }

  /** Records an error event on the current span. Returns false if there is none. */
  public boolean reportError(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    Span current = spanStore.current();
    if (current == null) return false;
    current.error(error);
    return true;
  }

  /** Records an info event on the current span. Returns false if there is none. */
  public boolean reportInfo(Map<String, ?> attributes) {
    if (attributes == null) throw new NullPointerException("attributes == null");
    Span current = spanStore.current();
    if (current == null) return false;
    current.info(attributes);
    return true;
  }

  /** Returns the current trace id in log form, or the all-zero form when nothing is traced. */
  public String formattedTraceId() {
    Span current = spanStore.current();
    return current != null ? current.identifier.toLogString() : Identifier.UNTRACED_LOG_STRING;
  }

  /**
   * Adds the current trace id to a structured log record, under {@link #LOG_OBJECT_KEY}, when
   * the configured {@link LogTraceIdMode} calls for it. Returns the input, or a new map if it was
   * null.
   */
  public Map<String, Object> insertLogObject(@Nullable Map<String, Object> object) {
    Map<String, Object> result = object != null ? object : new LinkedHashMap<>();
    Span current = spanStore.current();
    boolean insert;
    switch (logTraceIdMode) {
      case ALWAYS:
        insert = true;
        break;
      case TRACED:
        insert = current != null;
        break;
      case SAMPLED_ONLY:
        insert = current != null && current.doSample;
        break;
      default:
        insert = false;
    }
    if (insert) {
      result.put(LOG_OBJECT_KEY, Collections.singletonMap("traceId", formattedTraceId()));
    }
    return result;
  }

  /** Returns true if the identifier token has its sample flag set. */
  public static boolean sampling(@Nullable String token) {
    return Identifier.isSampled(token);
  }

  @Override public String toString() {
    return "Tracer{currentSpan=" + spanStore.current() + ", reporter=" + reporter
      + ", sampler=" + sampler + "}";
  }
}
