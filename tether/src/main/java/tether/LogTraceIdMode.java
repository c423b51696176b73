/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

/** When {@link Tracer#insertLogObject} adds the current trace id to a log record. */
public enum LogTraceIdMode {
  /** Never inserted. */
  NEVER,
  /** Inserted only when the current trace is sampled. */
  SAMPLED_ONLY,
  /** Inserted whenever there is a current span, sampled or not. */
  TRACED,
  /** Always inserted, using the all-zero id when nothing is traced. */
  ALWAYS
}
