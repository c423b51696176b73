/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

/**
 * Work that starts now and signals completion later through the supplied callback.
 *
 * @param <V> the type passed to the callback on success
 * @param <R> the type returned synchronously when the work is started
 */
@FunctionalInterface
public interface CallbackTask<V, R> {
  R start(Callback<V> done);
}
