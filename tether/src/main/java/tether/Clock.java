/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

/**
 * Epoch microseconds used for {@link Event#timestamp() event timestamps}.
 *
 * <p>This type can be extended so that the object graph can be built differently or overridden,
 * for example via Spring or when mocking.
 */
@FunctionalInterface
public interface Clock {

  long currentTimeMicroseconds();
}
