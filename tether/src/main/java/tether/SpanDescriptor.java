/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import tether.internal.Nullable;

/**
 * Describes the span to create around instrumented work: either a fixed name, or a builder that
 * looks at the current span and decides.
 */
public abstract class SpanDescriptor {
  /** Builds the span from the current span, which is null when starting a trace. */
  @FunctionalInterface
  public interface SpanBuilder {
    @Nullable SpanInfo build(@Nullable Span current);
  }

  public static SpanDescriptor named(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return new Named(name);
  }

  public static SpanDescriptor builder(SpanBuilder builder) {
    if (builder == null) throw new NullPointerException("builder == null");
    return new Built(builder);
  }

  /** Returns what to create, or null when no span should be created. */
  @Nullable public abstract SpanInfo resolve(@Nullable Span current);

  static final class Named extends SpanDescriptor {
    final SpanInfo info;

    Named(String name) {
      this.info = SpanInfo.create(name);
    }

    @Override public SpanInfo resolve(@Nullable Span current) {
      return info;
    }

    @Override public String toString() {
      return info.name;
    }
  }

  static final class Built extends SpanDescriptor {
    final SpanBuilder builder;

    Built(SpanBuilder builder) {
      this.builder = builder;
    }

    @Override @Nullable public SpanInfo resolve(@Nullable Span current) {
      return builder.build(current);
    }

    @Override public String toString() {
      return "Built{" + builder + "}";
    }
  }

  SpanDescriptor() {
  }
}
