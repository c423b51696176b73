/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.propagation;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import tether.Callback;
import tether.Span;
import tether.internal.LogDebouncer;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.internal.Throwables;

/**
 * Makes the active {@link Span} visible to code running now, and reproduces it for code that
 * runs later as part of the same flow, possibly on another thread.
 *
 * <p>The active span is held in an immutable {@link Frame}. Entering a span pushes a frame and
 * exiting it pops the frame. {@link #bind(Runnable) Binding} a task snapshots the frame, and the
 * task runs with that frame restored, then puts back whatever was active before it.
 *
 * <p>No operation here throws because of a tracing problem: errors are logged and the input is
 * returned unchanged.
 */
public abstract class SpanStore {
  static final AtomicLong NEXT_FLOW_ID = new AtomicLong();
  static final LogDebouncer NO_CONTEXT = LogDebouncer.create(Level.FINE);
  static final LogDebouncer NOT_ACTIVE = LogDebouncer.create(Level.FINE);

  /** Implementations of this allow standardized configuration, for example log correlation. */
  public abstract static class Builder {
    ArrayList<ContextListener> contextListeners = new ArrayList<>();

    /** Listeners are called in order each time the active span of a thread changes. */
    public Builder addContextListener(ContextListener contextListener) {
      if (contextListener == null) throw new NullPointerException("contextListener == null");
      this.contextListeners.add(contextListener);
      return this;
    }

    public abstract SpanStore build();
  }

  /** The active span of one flow, layered over the frame of its parent span. */
  public static final class Frame {
    final Span span;
    final long flowId;
    @Nullable final Frame parent;

    Frame(Span span, long flowId, @Nullable Frame parent) {
      this.span = span;
      this.flowId = flowId;
      this.parent = parent;
    }

    public Span span() {
      return span;
    }

    /** Shared by every frame pushed in the same flow, from its root span down. */
    public long flowId() {
      return flowId;
    }

    @Nullable public Frame parent() {
      return parent;
    }

    boolean contains(Span span) {
      for (Frame frame = this; frame != null; frame = frame.parent) {
        if (frame.span == span) return true;
      }
      return false;
    }

    @Override public String toString() {
      return "Frame{flowId=" + flowId + ", span=" + span.name() + "}";
    }
  }

  /** Restores the frame that was active before the scope was opened. */
  public interface Scope extends Closeable {
    Scope NOOP = new Scope() {
      @Override public void close() {
      }

      @Override public String toString() {
        return "NoopScope";
      }
    };

    /** No exceptions are thrown when reverting a scope. */
    @Override void close();
  }

  /** Notified on the affected thread whenever its active span changes. */
  @FunctionalInterface
  public interface ContextListener {
    void contextChanged(@Nullable Span current);
  }

  final List<ContextListener> contextListeners;

  protected SpanStore() {
    this.contextListeners = Collections.emptyList();
  }

  protected SpanStore(Builder builder) {
    this.contextListeners = new ArrayList<>(builder.contextListeners);
  }

  /** Returns the frame active in the calling thread, or null if there is none. */
  @Nullable public abstract Frame snapshot();

  /** Makes the frame active in the calling thread without notifying listeners. */
  protected abstract void replace(@Nullable Frame frame);

  /** Returns the active span of the calling flow, or null if no flow context exists. */
  @Nullable public Span current() {
    Frame frame = snapshot();
    return frame != null ? frame.span : null;
  }

  /**
   * Makes the frame active until the result is closed, then restores the frame active now.
   *
   * <pre>{@code
   * try (Scope scope = store.restore(frame)) {
   *   task.run();
   * }
   * }</pre>
   */
  public Scope restore(@Nullable Frame frame) {
    Frame previous = snapshot();
    set(frame);
    return new RevertScope(previous);
  }

  /** Returns a scope that, when closed, restores the frame active now. */
  public Scope checkpoint() {
    return new RevertScope(snapshot());
  }

  /** Makes the span active, layered on the current frame. A span with no frame starts a flow. */
  public void enter(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    try {
      Frame current = snapshot();
      long flowId = current != null ? current.flowId : NEXT_FLOW_ID.incrementAndGet();
      set(new Frame(span, flowId, current));
    } catch (Throwable t) {
      Throwables.propagateIfFatal(t);
      Platform.get().error("SpanStore.enter failed for {0}", span.name(), t);
    }
  }

  /**
   * Pops the frame pushed when the span was entered. This is a logged no-op when the span is not
   * the active one.
   */
  public void exit(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    try {
      Frame current = snapshot();
      if (current == null) {
        NOT_ACTIVE.log("SpanStore.exit: no context to exit {0}", span.name());
      } else if (current.span == span) {
        set(current.parent);
      } else if (current.contains(span)) {
        Platform.get().warn("SpanStore.exit: {0} exited out of order", span.name());
      } else {
        NOT_ACTIVE.log("SpanStore.exit: {0} is not in the current context", span.name());
      }
    } catch (Throwable t) {
      Throwables.propagateIfFatal(t);
      Platform.get().error("SpanStore.exit failed for {0}", span.name(), t);
    }
  }

  /** Wraps the input so that it executes with the same context as now. */
  public Runnable bind(Runnable task) {
    Frame invocationContext = snapshotOrLog(task);
    if (invocationContext == null) return task;
    class BoundRunnable implements Runnable {
      @Override public void run() {
        try (Scope scope = restore(invocationContext)) {
          task.run();
        }
      }

      @Override public String toString() {
        return task.toString();
      }
    }
    return new BoundRunnable();
  }

  /** Wraps the input so that it executes with the same context as now. */
  public <C> Callable<C> bind(Callable<C> task) {
    Frame invocationContext = snapshotOrLog(task);
    if (invocationContext == null) return task;
    class BoundCallable implements Callable<C> {
      @Override public C call() throws Exception {
        try (Scope scope = restore(invocationContext)) {
          return task.call();
        }
      }

      @Override public String toString() {
        return task.toString();
      }
    }
    return new BoundCallable();
  }

  /** Wraps the input so that it executes with the same context as now. */
  public <T> Supplier<T> bind(Supplier<T> task) {
    Frame invocationContext = snapshotOrLog(task);
    if (invocationContext == null) return task;
    class BoundSupplier implements Supplier<T> {
      @Override public T get() {
        try (Scope scope = restore(invocationContext)) {
          return task.get();
        }
      }

      @Override public String toString() {
        return task.toString();
      }
    }
    return new BoundSupplier();
  }

  /** Wraps the input so that it completes with the same context as now. */
  public <V> Callback<V> bind(Callback<V> callback) {
    Frame invocationContext = snapshotOrLog(callback);
    if (invocationContext == null) return callback;
    return bind(callback, invocationContext);
  }

  <V> Callback<V> bind(Callback<V> callback, Frame invocationContext) {
    class BoundCallback implements Callback<V> {
      @Override public void onComplete(Throwable error, V value) {
        try (Scope scope = restore(invocationContext)) {
          callback.onComplete(error, value);
        }
      }

      @Override public String toString() {
        return callback.toString();
      }
    }
    return new BoundCallback();
  }

  /** Wraps the input so that it is notified with the same context as now. */
  public EventEmitter.Listener bind(EventEmitter.Listener listener) {
    Frame invocationContext = snapshotOrLog(listener);
    if (invocationContext == null) return listener;
    return bind(listener, invocationContext);
  }

  EventEmitter.Listener bind(EventEmitter.Listener listener, Frame invocationContext) {
    class BoundListener implements EventEmitter.Listener {
      @Override public void onEvent(String event, Object payload) {
        try (Scope scope = restore(invocationContext)) {
          listener.onEvent(event, payload);
        }
      }

      @Override public String toString() {
        return listener.toString();
      }
    }
    return new BoundListener();
  }

  /**
   * Arranges that listeners attached to the emitter from now on are bound at the time they are
   * attached. Listeners attached where there is no context use the context active now. Inputs that
   * are not an {@link EventEmitter}, or emitters already bound, are returned unchanged.
   */
  public <T> T bindEmitter(T emitter) {
    try {
      if (!(emitter instanceof EventEmitter)) {
        Platform.get().log("SpanStore.bindEmitter: {0} cannot hold listeners", emitter, null);
        return emitter;
      }
      Frame invocationContext = snapshotOrLog(emitter);
      if (invocationContext == null) return emitter;
      EventEmitter target = (EventEmitter) emitter;
      if (!target.intercept(listener -> {
        Frame attachContext = snapshot();
        return bind(listener, attachContext != null ? attachContext : invocationContext);
      })) {
        Platform.get().log("SpanStore.bindEmitter: {0} is already bound", emitter, null);
      }
    } catch (Throwable t) {
      Throwables.propagateIfFatal(t);
      Platform.get().error("SpanStore.bindEmitter failed for {0}", emitter, t);
    }
    return emitter;
  }

  /**
   * Decorates the input such that each task it executes runs in the context active when the task
   * was submitted.
   */
  public Executor executor(Executor delegate) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    class BoundExecutor implements Executor {
      @Override public void execute(Runnable task) {
        delegate.execute(SpanStore.this.bind(task));
      }

      @Override public String toString() {
        return "BoundExecutor{" + delegate + "}";
      }
    }
    return new BoundExecutor();
  }

  /** Returns the frame to bind the input to, or null when the input should pass through as-is. */
  @Nullable Frame snapshotOrLog(@Nullable Object input) {
    if (input == null) return null;
    try {
      Frame frame = snapshot();
      if (frame == null) NO_CONTEXT.log("SpanStore.bind: no context to bind {0}", input);
      return frame;
    } catch (Throwable t) {
      Throwables.propagateIfFatal(t);
      Platform.get().error("SpanStore.bind failed for {0}", input, t);
      return null;
    }
  }

  /** Makes the frame active and notifies listeners when the active span changed. */
  final void set(@Nullable Frame frame) {
    Frame previous = snapshot();
    replace(frame);
    Span before = previous != null ? previous.span : null;
    Span after = frame != null ? frame.span : null;
    if (before == after) return;
    for (int i = 0, length = contextListeners.size(); i < length; i++) {
      try {
        contextListeners.get(i).contextChanged(after);
      } catch (Throwable t) {
        Throwables.propagateIfFatal(t);
        Platform.get().error("ContextListener failed: {0}", contextListeners.get(i), t);
      }
    }
  }

  final class RevertScope implements Scope {
    @Nullable final Frame previous;

    RevertScope(@Nullable Frame previous) {
      this.previous = previous;
    }

    @Override public void close() {
      set(previous);
    }

    @Override public String toString() {
      return "RevertScope{" + previous + "}";
    }
  }
}
