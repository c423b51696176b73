/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.sampler;

import tether.internal.Nullable;
import tether.propagation.Identifier;

/**
 * Decides whether a request that has no active span starts or continues a recorded trace.
 *
 * <p>Implementations may throw. The tracer treats a failure as a decision to record nothing.
 */
public abstract class Sampler {
  /** The rate, in parts per million, that samples every trace. */
  public static final int MAX_SAMPLE_RATE = 1_000_000;

  public static final Sampler ALWAYS_SAMPLE = new Sampler() {
    @Override public SamplingDecision decide(@Nullable Identifier upstream) {
      Identifier identifier =
        upstream != null ? upstream.withSampled(true) : Identifier.newRandom(true);
      return SamplingDecision.create(true, true, SamplingDecision.SOURCE_LOCAL, MAX_SAMPLE_RATE,
        identifier);
    }

    @Override public String toString() {
      return "AlwaysSample";
    }
  };

  public static final Sampler NEVER_SAMPLE = new Sampler() {
    @Override public SamplingDecision decide(@Nullable Identifier upstream) {
      return SamplingDecision.create(false, false, SamplingDecision.SOURCE_LOCAL, 0, upstream);
    }

    @Override public String toString() {
      return "NeverSample";
    }
  };

  /**
   * Returns the decision for a request.
   *
   * @param upstream the identifier parsed from an inbound request, or null when it had none
   */
  public abstract SamplingDecision decide(@Nullable Identifier upstream);

  /**
   * Returns a sampler for the trace mode. With {@link TraceMode#ALWAYS}, new traces are sampled at
   * the given rate and continued traces keep the upstream decision.
   *
   * @param sampleRate parts per million, between 0 and {@link #MAX_SAMPLE_RATE}
   */
  public static Sampler create(TraceMode traceMode, int sampleRate) {
    if (traceMode == null) throw new NullPointerException("traceMode == null");
    if (traceMode == TraceMode.NEVER) return NEVER_SAMPLE;
    return RateSampler.create(sampleRate);
  }
}
