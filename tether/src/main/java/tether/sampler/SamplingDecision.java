/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.sampler;

import tether.internal.Nullable;
import tether.propagation.Identifier;

/** The outcome of {@link Sampler#decide(Identifier)} for one inbound request. */
public final class SamplingDecision {
  /** The decision came from local configuration. */
  public static final int SOURCE_LOCAL = 1;
  /** The decision came from built-in defaults. */
  public static final int SOURCE_DEFAULT = 2;
  /** No decision could be made, so nothing is recorded. */
  public static final int SOURCE_FALLBACK = 5;

  /** Used when the sampler fails: nothing is sampled or measured. */
  public static final SamplingDecision FALLBACK =
    new SamplingDecision(false, false, SOURCE_FALLBACK, 0, null);

  public static SamplingDecision create(boolean doSample, boolean doMetrics, int source, int rate,
    @Nullable Identifier identifier) {
    return new SamplingDecision(doSample, doMetrics, source, rate, identifier);
  }

  final boolean doSample, doMetrics;
  final int source, rate;
  @Nullable final Identifier identifier;

  SamplingDecision(boolean doSample, boolean doMetrics, int source, int rate,
    @Nullable Identifier identifier) {
    this.doSample = doSample;
    this.doMetrics = doMetrics;
    this.source = source;
    this.rate = rate;
    this.identifier = identifier;
  }

  /** When true, events of the trace are reported. */
  public boolean doSample() {
    return doSample;
  }

  /** When true, the trace contributes to transaction metrics even if it isn't sampled. */
  public boolean doMetrics() {
    return doMetrics;
  }

  public int source() {
    return source;
  }

  /** The sample rate in parts per million. */
  public int rate() {
    return rate;
  }

  /** The identifier the trace continues with, or null to start a new one. */
  @Nullable public Identifier identifier() {
    return identifier;
  }

  @Override public String toString() {
    return "SamplingDecision{doSample=" + doSample + ", doMetrics=" + doMetrics
      + ", source=" + source + ", rate=" + rate + "}";
  }
}
