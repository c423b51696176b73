/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

/**
 * Work run to completion on the calling thread.
 *
 * @param <V> the result type
 * @param <E> the checked exception the work may throw, rethrown unchanged when instrumented
 */
@FunctionalInterface
public interface SyncTask<V, E extends Throwable> {
  V run() throws E;
}
