/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import java.lang.ref.WeakReference;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.internal.Throwables;
import tether.propagation.Identifier;
import tether.propagation.SpanStore;
import zipkin2.reporter.Reporter;

/**
 * A named unit of work in the tree of a single logical request.
 *
 * <p>A span is created, entered once and exited once. Entering records the entry {@link Event}
 * and makes the span active in the {@link SpanStore}. Exiting records the exit event, whose edge is
 * the last event recorded in the span's subtree, and removes the span from the store.
 *
 * <p>Spans are usually driven by {@link Tracer#instrument}, which calls {@link #runSync} or
 * {@link #runAsync}.
 */
public final class Span {
  /** Drives asynchronous work whose completion is signalled through wrapped callbacks. */
  @FunctionalInterface
  public interface AsyncRunner<R> {
    R run(Wrapper wrapper);
  }

  /** Returns a callback that exits the span before delegating to the input. */
  @FunctionalInterface
  public interface Wrapper {
    <V> Callback<V> wrap(Callback<V> callback);
  }

  final Clock clock;
  final Reporter<Event> reporter;
  final SpanStore store;
  final String name;
  @Nullable final WeakReference<Span> parent;
  final Identifier identifier;
  /** Entry edge if the parent is unreachable: upstream for a root, else the parent's last event. */
  @Nullable final Identifier detachedEdge;
  final boolean doSample, doMetrics, topSpan;
  final Event entry;
  final AtomicBoolean entered = new AtomicBoolean(), exited = new AtomicBoolean();
  @Nullable volatile Event exit;
  @Nullable volatile Throwable exitError;
  @Nullable volatile String transactionName;
  @Nullable volatile Supplier<String> transactionNameSupplier;
  @Nullable volatile ExecutionMode executionMode;
  Event last; // guarded by this

  Span(Clock clock, Reporter<Event> reporter, SpanStore store, String name, @Nullable Span parent,
    Identifier identifier, @Nullable Identifier detachedEdge, boolean doSample, boolean doMetrics,
    boolean topSpan) {
    if (name == null) throw new NullPointerException("name == null");
    this.clock = clock;
    this.reporter = reporter;
    this.store = store;
    this.name = name;
    this.parent = parent != null ? new WeakReference<>(parent) : null;
    this.identifier = identifier;
    this.detachedEdge = detachedEdge;
    this.doSample = doSample;
    this.doMetrics = doMetrics;
    this.topSpan = topSpan;
    this.entry = new Event(identifier.withNewOpId(), Event.Label.ENTRY, name);
  }

  public String name() {
    return name;
  }

  /** Returns the enclosing span if it is still reachable, or null for a root. */
  @Nullable public Span parent() {
    return parent != null ? parent.get() : null;
  }

  /** Identifies the trace this span belongs to. Each event gets its own operation id. */
  public Identifier identifier() {
    return identifier;
  }

  /** The entry event. Attributes may be added to it until the span is entered. */
  public Event entryEvent() {
    return entry;
  }

  /** The exit event, or null until the span exits. */
  @Nullable public Event exitEvent() {
    return exit;
  }

  public boolean doSample() {
    return doSample;
  }

  public boolean doMetrics() {
    return doMetrics;
  }

  /** True for the first span of a trace in this process. */
  public boolean isTopSpan() {
    return topSpan;
  }

  /** How the work in this span reports completion, or null when entered and exited directly. */
  @Nullable public ExecutionMode executionMode() {
    return executionMode;
  }

  public boolean isEntered() {
    return entered.get();
  }

  public boolean isExited() {
    return exited.get();
  }

  /** The transaction a top span is aggregated under. Ignored on other spans. */
  public Span transactionName(String transactionName) {
    if (transactionName == null) throw new NullPointerException("transactionName == null");
    this.transactionName = transactionName;
    this.transactionNameSupplier = null;
    return this;
  }

  /**
   * Like {@link #transactionName(String)}, but evaluated when the span exits. If the supplier fails
   * or returns null, the fixed name set before is used.
   */
  public Span transactionName(Supplier<String> transactionName) {
    if (transactionName == null) throw new NullPointerException("transactionName == null");
    this.transactionNameSupplier = transactionName;
    return this;
  }

  /** The fixed transaction name. A supplied name is only known at exit. */
  @Nullable public String transactionName() {
    return transactionName;
  }

  /**
   * Creates a child of this span. Returns null, after logging, when there is no active span in
   * the calling flow.
   */
  @Nullable public Span descend(String name, @Nullable Map<String, ?> attributes) {
    if (store.current() == null) {
      Platform.get().log("Span.descend: no active span to descend {0} from", name, null);
      return null;
    }
    Span child = new Span(clock, reporter, store, name, this, identifier, lastIdentifier(),
      doSample, doMetrics, false);
    child.entry.set(attributes);
    return child;
  }

  /** Records the entry event and makes this span active. Only the first call has effect. */
  public void enter() {
    if (!entered.compareAndSet(false, true)) {
      Platform.get().log("Span.enter: {0} was already entered", name, null);
      return;
    }
    Span parent = parent();
    Identifier edge = parent != null ? parent.lastIdentifier() : detachedEdge;
    synchronized (this) {
      last = entry;
    }
    record(entry, edge);
    store.enter(this);
  }

  /** Same as {@code exit(null)} */
  public void exit() {
    exit(null);
  }

  /**
   * Records the exit event, with the error if there was one, and removes this span from the
   * store. Has no effect unless the span is entered and not yet exited.
   */
  public void exit(@Nullable Throwable error) {
    if (!entered.get()) {
      Platform.get().log("Span.exit: {0} was never entered", name, null);
      return;
    }
    if (!exited.compareAndSet(false, true)) {
      Platform.get().log("Span.exit: {0} was already exited", name, null);
      return;
    }
    Event exit = new Event(identifier.withNewOpId(), Event.Label.EXIT, name);
    if (error == null) error = exitError;
    if (error != null) exit.error(error);
    if (topSpan && doMetrics) exit.set(EventKeys.TRANSACTION_NAME, resolveTransactionName());
    this.exit = exit;
    Identifier edge = advance(exit);
    record(exit, edge);
    Span parent = parent();
    if (parent != null) parent.advance(exit);
    store.exit(this);
  }

  /**
   * Sets an error to attach when this span exits, for when the error is seen before the point the
   * span ends, such as a handler that throws before its response completes.
   */
  public void setExitError(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    exitError = error;
  }

  /** Records an info event with the attributes. Ignored unless the span is active. */
  public void info(Map<String, ?> attributes) {
    if (!isOpen("info")) return;
    Event info = new Event(identifier.withNewOpId(), Event.Label.INFO, name);
    info.set(attributes);
    record(info, advance(info));
  }

  /** Records an error event. Ignored unless the span is active. */
  public void error(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    if (!isOpen("error")) return;
    Event event = new Event(identifier.withNewOpId(), Event.Label.ERROR, name);
    event.error(error);
    record(event, advance(event));
  }

  /**
   * Runs the task inside this span, exiting with its error if it throws. The error is rethrown
   * unchanged. The calling thread's context is restored afterwards.
   */
  public <V, E extends Throwable> V runSync(SyncTask<V, E> task) throws E {
    if (task == null) throw new NullPointerException("task == null");
    executionMode = ExecutionMode.SYNC;
    try (SpanStore.Scope scope = store.checkpoint()) {
      enter();
      V result;
      try {
        result = task.run();
      } catch (Throwable e) {
        exit(e);
        throw e;
      }
      exit();
      return result;
    }
  }

  /**
   * Enters this span and starts asynchronous work, which must complete through a callback returned
   * by the {@link Wrapper}. The span exits when that callback is invoked, and stays open if it
   * never is. If the runner throws, the span exits with the error, which is rethrown.
   */
  public <R> R runAsync(AsyncRunner<R> runner) {
    return runAsync(ExecutionMode.CALLBACK_ASYNC, runner);
  }

  <R> R runAsync(ExecutionMode mode, AsyncRunner<R> runner) {
    if (runner == null) throw new NullPointerException("runner == null");
    executionMode = mode;
    try (SpanStore.Scope scope = store.checkpoint()) {
      enter();
      try {
        return runner.run(this::wrap);
      } catch (RuntimeException | Error e) {
        exit(e);
        throw e;
      }
    }
  }

  /**
   * Returns a callback that, in this span's flow, exits the span with any error it receives, then
   * delegates to the input.
   */
  public <V> Callback<V> wrap(Callback<V> callback) {
    if (callback == null) throw new NullPointerException("callback == null");
    Callback<V> exiting = new Callback<V>() {
      @Override public void onComplete(Throwable error, V value) {
        exit(error);
        callback.onComplete(error, value);
      }

      @Override public String toString() {
        return callback.toString();
      }
    };
    return store.bind(exiting);
  }

  boolean isOpen(String operation) {
    if (entered.get() && !exited.get()) return true;
    Platform.get().log("Span." + operation + ": {0} is not active", name, null);
    return false;
  }

  /** Returns the identifier of the last event in this subtree. */
  @Nullable synchronized Identifier lastIdentifier() {
    return last != null ? last.identifier : detachedEdge;
  }

  @Nullable String resolveTransactionName() {
    Supplier<String> supplier = transactionNameSupplier;
    if (supplier == null) return transactionName;
    try {
      String result = supplier.get();
      if (result != null) return result;
      Platform.get().log("Span.exit: null transaction name from {0}", supplier, null);
    } catch (Throwable t) {
      Throwables.propagateIfFatal(t);
      Platform.get().error("Span.exit: error naming transaction of {0}", name, t);
    }
    return transactionName;
  }

  /** Makes the input the last event in this subtree, returning the identifier of the prior one. */
  @Nullable synchronized Identifier advance(Event next) {
    Identifier previous = last != null ? last.identifier : null;
    last = next;
    return previous;
  }

  void record(Event event, @Nullable Identifier edge) {
    if (!event.record(clock.currentTimeMicroseconds(), edge)) return;
    if (doSample) reporter.report(event);
  }

  @Override public String toString() {
    return "Span{name=" + name + ", id=" + identifier.toLogString()
      + ", entered=" + entered.get() + ", exited=" + exited.get() + "}";
  }
}
