/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import tether.internal.Nullable;

/**
 * Completion of asynchronous work in error-first form: exactly one of the arguments is
 * meaningful. A non-null error means the work failed.
 *
 * @param <V> the type of the successful result
 */
@FunctionalInterface
public interface Callback<V> {
  void onComplete(@Nullable Throwable error, @Nullable V value);

  /** Returns a callback that does nothing, used when the caller supplied none. */
  @SuppressWarnings("unchecked")
  static <V> Callback<V> noop() {
    return (Callback<V>) Noop.INSTANCE;
  }

  enum Noop implements Callback<Object> {
    INSTANCE;

    @Override public void onComplete(Throwable error, Object value) {
    }

    @Override public String toString() {
      return "NoopCallback";
    }
  }
}
