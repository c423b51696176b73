/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import java.util.function.Supplier;
import tether.internal.Nullable;

/** Per-call settings for {@link Tracer#instrument} and related methods. */
public final class InstrumentOptions {
  public static final InstrumentOptions DEFAULT = newBuilder().build();
  /** Runs the work in the caller's context without creating a span. */
  public static final InstrumentOptions DISABLED = newBuilder().enabled(false).build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    boolean enabled = true, collectBacktraces;
    String transactionName;
    Supplier<String> transactionNameSupplier;

    /** When false, no span is created. Defaults to true. */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /** When true, sampled spans record where they were created. Defaults to false. */
    public Builder collectBacktraces(boolean collectBacktraces) {
      this.collectBacktraces = collectBacktraces;
      return this;
    }

    /** Overrides the transaction name of a trace started by this call. */
    public Builder transactionName(String transactionName) {
      if (transactionName == null) throw new NullPointerException("transactionName == null");
      this.transactionName = transactionName;
      this.transactionNameSupplier = null;
      return this;
    }

    /**
     * Names the transaction of a trace started by this call when its root span exits. Replaces a
     * fixed name set by {@link #transactionName(String)}.
     */
    public Builder transactionName(Supplier<String> transactionName) {
      if (transactionName == null) throw new NullPointerException("transactionName == null");
      this.transactionName = null;
      this.transactionNameSupplier = transactionName;
      return this;
    }

    public InstrumentOptions build() {
      return new InstrumentOptions(this);
    }

    Builder() {
    }
  }

  final boolean enabled, collectBacktraces;
  @Nullable final String transactionName;
  @Nullable final Supplier<String> transactionNameSupplier;

  InstrumentOptions(Builder builder) {
    this.enabled = builder.enabled;
    this.collectBacktraces = builder.collectBacktraces;
    this.transactionName = builder.transactionName;
    this.transactionNameSupplier = builder.transactionNameSupplier;
  }

  public boolean enabled() {
    return enabled;
  }

  public boolean collectBacktraces() {
    return collectBacktraces;
  }

  @Nullable public String transactionName() {
    return transactionName;
  }

  public Builder toBuilder() {
    Builder result = new Builder();
    result.enabled = enabled;
    result.collectBacktraces = collectBacktraces;
    result.transactionName = transactionName;
    result.transactionNameSupplier = transactionNameSupplier;
    return result;
  }

  @Override public String toString() {
    return "InstrumentOptions{enabled=" + enabled + ", collectBacktraces=" + collectBacktraces
      + (transactionName != null ? ", transactionName=" + transactionName : "") + "}";
  }
}
