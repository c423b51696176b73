/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.http;

import java.util.ArrayDeque;
import java.util.Deque;
import tether.internal.Platform;
import tether.internal.collect.WeakIdentityMap;

import static tether.internal.Throwables.propagateIfFatal;

/**
 * Hooks that run when a response ends, in reverse order of registration. The server integration
 * calls {@link #responseEnded(Object)} just before it completes the response.
 *
 * <p>Responses are tracked by identity without being kept alive. The entry for a response is
 * removed when it ends.
 */
public final class ResponseFinalizers {
  final WeakIdentityMap<Object, Deque<Runnable>> finalizers = new WeakIdentityMap<>();

  /** Starts tracking the response. Returns false if it was already tracked. */
  public boolean patch(Object response) {
    if (response == null) throw new NullPointerException("response == null");
    return finalizers.putIfAbsent(response, new ArrayDeque<>()) == null;
  }

  public boolean isPatched(Object response) {
    if (response == null) throw new NullPointerException("response == null");
    return finalizers.containsKey(response);
  }

  /** Adds a hook to run when the response ends, patching the response if needed. */
  public void add(Object response, Runnable finalizer) {
    if (finalizer == null) throw new NullPointerException("finalizer == null");
    patch(response);
    Deque<Runnable> deque = finalizers.getIfPresent(response);
    if (deque == null) { // ended concurrently
      Platform.get().log("Response {0} ended before its finalizer was added", response, null);
      return;
    }
    synchronized (deque) {
      deque.push(finalizer);
    }
  }

  /**
   * Runs the hooks of the response, most recently added first, and stops tracking it. A failing
   * hook is logged and does not prevent the others. Returns the count of hooks run.
   */
  public int responseEnded(Object response) {
    if (response == null) throw new NullPointerException("response == null");
    Deque<Runnable> deque = finalizers.remove(response);
    if (deque == null) return 0;
    int count = 0;
    while (true) {
      Runnable finalizer;
      synchronized (deque) {
        finalizer = deque.poll();
      }
      if (finalizer == null) return count;
      count++;
      try {
        finalizer.run();
      } catch (Throwable t) {
        propagateIfFatal(t);
        Platform.get().error("Response finalizer failed for {0}", response, t);
      }
    }
  }
}
