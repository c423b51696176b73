/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.sampler;

import java.util.Random;
import tether.internal.Nullable;
import tether.internal.Platform;
import tether.propagation.Identifier;

/**
 * Samples a new trace when a salted random value falls under a boundary derived from the rate.
 * A continued trace keeps the sample flag of its upstream identifier. All traces contribute to
 * metrics.
 *
 * <p>Based on {@code BoundarySampler}, which defends against nodes in the same cluster sampling
 * exactly the same subset of trace ids.
 */
public final class RateSampler extends Sampler {
  static final long SALT = new Random().nextLong();

  /** @param sampleRate parts per million, between 0 and {@link #MAX_SAMPLE_RATE} */
  public static RateSampler create(int sampleRate) {
    if (sampleRate < 0 || sampleRate > MAX_SAMPLE_RATE) {
      throw new IllegalArgumentException(
        "sampleRate should be between 0 and " + MAX_SAMPLE_RATE + ": was " + sampleRate);
    }
    return new RateSampler(sampleRate);
  }

  final int sampleRate;

  RateSampler(int sampleRate) {
    this.sampleRate = sampleRate;
  }

  public int sampleRate() {
    return sampleRate;
  }

  @Override public SamplingDecision decide(@Nullable Identifier upstream) {
    if (upstream != null) {
      return SamplingDecision.create(upstream.sampled(), true, SamplingDecision.SOURCE_LOCAL,
        sampleRate, upstream);
    }
    boolean sampled = isSampled(Platform.get().randomLong());
    return SamplingDecision.create(sampled, true, SamplingDecision.SOURCE_LOCAL, sampleRate,
      Identifier.newRandom(sampled));
  }

  /** Returns true when {@code abs(random) % 1000000 < rate} */
  boolean isSampled(long random) {
    long t = (random ^ SALT) & Long.MAX_VALUE;
    return t % MAX_SAMPLE_RATE < sampleRate;
  }

  @Override public String toString() {
    return "RateSampler(" + sampleRate + ")";
  }
}
