/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.propagation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import tether.internal.Nullable;

/**
 * An object that notifies named listeners, such as a response signalling "finish" or a stream
 * signalling "data". Listeners run on the thread that emits, so emitters that deliver later must be
 * {@linkplain SpanStore#bindEmitter(Object) bound} for listeners to see the right span.
 */
public class EventEmitter {
  /** Receives an event raised on an emitter. */
  @FunctionalInterface
  public interface Listener {
    void onEvent(String event, @Nullable Object payload);
  }

  /** Replaces each listener as it is attached. */
  @FunctionalInterface
  interface Interceptor {
    Listener intercept(Listener listener);
  }

  static final class Registration {
    final Listener listener, effective;

    Registration(Listener listener, Listener effective) {
      this.listener = listener;
      this.effective = effective;
    }
  }

  final Map<String, List<Registration>> registrations = new LinkedHashMap<>(); // guarded by this
  @Nullable Interceptor interceptor; // guarded by this

  /** Attaches the listener to the event, after any already attached. */
  public EventEmitter on(String event, Listener listener) {
    if (event == null) throw new NullPointerException("event == null");
    if (listener == null) throw new NullPointerException("listener == null");
    synchronized (this) {
      Listener effective = interceptor != null ? interceptor.intercept(listener) : listener;
      registrations.computeIfAbsent(event, k -> new ArrayList<>())
        .add(new Registration(listener, effective));
    }
    return this;
  }

  /** Detaches the first registration of the listener. Returns false if it was not attached. */
  public synchronized boolean removeListener(String event, Listener listener) {
    List<Registration> list = registrations.get(event);
    if (list == null) return false;
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i).listener == listener) {
        list.remove(i);
        if (list.isEmpty()) registrations.remove(event);
        return true;
      }
    }
    return false;
  }

  /**
   * Calls each listener of the event in the order attached. Returns false if there were none. An
   * exception from a listener propagates to the caller and skips the remaining listeners.
   */
  public boolean emit(String event, @Nullable Object payload) {
    List<Listener> toNotify;
    synchronized (this) {
      List<Registration> list = registrations.get(event);
      if (list == null) return false;
      toNotify = new ArrayList<>(list.size());
      for (Registration registration : list) toNotify.add(registration.effective);
    }
    for (Listener listener : toNotify) {
      listener.onEvent(event, payload);
    }
    return true;
  }

  public synchronized int listenerCount(String event) {
    List<Registration> list = registrations.get(event);
    return list != null ? list.size() : 0;
  }

  /** Returns true if listeners attached to this emitter are bound to a flow. */
  public synchronized boolean isBound() {
    return interceptor != null;
  }

  /** Installs the interceptor unless one is installed. Returns false if one already was. */
  synchronized boolean intercept(Interceptor interceptor) {
    if (this.interceptor != null) return false;
    this.interceptor = interceptor;
    return true;
  }
}
