/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

/** Attribute keys the core writes onto {@link Event events}. */
public final class EventKeys {
  /** The simple class name of an error. */
  public static final String ERROR_CLASS = "ErrorClass";
  /** The message of an error, or its class name when it has none. */
  public static final String ERROR_MSG = "ErrorMsg";
  /** A stack trace, from an error or the point a span was created. */
  public static final String BACKTRACE = "Backtrace";
  /** The numeric source of the sampling decision for a new trace. */
  public static final String SAMPLE_SOURCE = "SampleSource";
  /** The sample rate, in parts per million, in effect for a new trace. */
  public static final String SAMPLE_RATE = "SampleRate";
  /** The transaction a top span is aggregated under for metrics. */
  public static final String TRANSACTION_NAME = "TransactionName";

  EventKeys() {
  }
}
