/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.internal;

public final class Throwables {
  /**
   * Similar to the bodies of Guava's {@code Throwables.throwIfFatal}. Rethrows errors the JVM
   * cannot recover from, so that catch-all blocks in instrumentation never hide them.
   */
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /** Returns the message of the input, or its simple class name when there is no message. */
  public static String message(Throwable error) {
    String message = error.getMessage();
    if (message != null) return message;
    return simpleName(error);
  }

  /** Returns the simple class name of the input, or of its superclass when anonymous. */
  public static String simpleName(Throwable error) {
    if (error.getClass().isAnonymousClass()) { // avoids ""
      return error.getClass().getSuperclass().getSimpleName();
    }
    return error.getClass().getSimpleName();
  }

  Throwables() {
  }
}
