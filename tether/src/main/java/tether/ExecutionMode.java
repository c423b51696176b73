/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

/** How instrumented work reports completion. Decided once, where the work enters the tracer. */
public enum ExecutionMode {
  /** The work returns or throws on the calling thread. */
  SYNC,
  /** The work signals completion through a {@link Callback}. */
  CALLBACK_ASYNC,
  /** The work returns a {@link java.util.concurrent.CompletionStage}. */
  PROMISE_ASYNC
}
