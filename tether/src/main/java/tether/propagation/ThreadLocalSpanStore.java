/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.propagation;

import tether.internal.Nullable;

/**
 * In-process span propagation backed by a static thread local.
 *
 * <h3>Design notes</h3>
 *
 * <p>A static thread local ensures we have one context per thread, as opposed to one per thread-
 * tracer. This means all tracer instances will be able to see any tracer's spans.
 *
 * <p>A flow that hops threads carries its frame with it through {@link #bind(Runnable)} and
 * friends, so interleaved flows on a shared thread never observe each other's frames.
 */
public class ThreadLocalSpanStore extends SpanStore {
  public static SpanStore create() {
    return new Builder(DEFAULT).build();
  }

  public static Builder newBuilder() {
    return new Builder(DEFAULT);
  }

  /**
   * This component is backed by a possibly static shared thread local. Call this to clear the
   * reference when you are sure any residual state is due to a leak. This is generally only useful
   * in tests.
   */
  public void clear() {
    local.remove();
  }

  public static final class Builder extends SpanStore.Builder {
    final ThreadLocal<Frame> local;

    Builder(ThreadLocal<Frame> local) {
      this.local = local;
    }

    @Override public Builder addContextListener(ContextListener contextListener) {
      return (Builder) super.addContextListener(contextListener);
    }

    @Override public ThreadLocalSpanStore build() {
      return new ThreadLocalSpanStore(this);
    }
  }

  static final ThreadLocal<Frame> DEFAULT = new ThreadLocal<>();

  @SuppressWarnings("ThreadLocalUsage") // intentional: to support multiple Tracer instances
  final ThreadLocal<Frame> local;

  ThreadLocalSpanStore(Builder builder) {
    super(builder);
    if (builder.local == null) throw new NullPointerException("local == null");
    local = builder.local;
  }

  @Override @Nullable public Frame snapshot() {
    return local.get();
  }

  @Override protected void replace(@Nullable Frame frame) {
    if (frame == null) {
      local.remove();
    } else {
      local.set(frame);
    }
  }
}
