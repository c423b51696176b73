/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.internal.handler;

import java.util.concurrent.atomic.AtomicBoolean;
import tether.Event;
import tether.internal.Platform;
import zipkin2.reporter.Reporter;

import static tether.internal.Throwables.propagateIfFatal;

/** This logs exceptions instead of raising an error, as the supplied reporter could have bugs. */
public final class SafeEventReporter implements Reporter<Event> {
  static final Reporter<Event> NOOP = new Reporter<Event>() {
    @Override public void report(Event event) {
    }

    @Override public String toString() {
      return "NoopEventReporter{}";
    }
  };

  // Array ensures no iterators are created at runtime
  public static Reporter<Event> create(Reporter<Event>[] reporters, AtomicBoolean noop) {
    if (reporters.length == 0) return NOOP;
    if (reporters.length == 1) return new SafeEventReporter(reporters[0], noop);
    return new SafeEventReporter(new CompositeReporter(reporters), noop);
  }

  final Reporter<Event> delegate;
  final AtomicBoolean noop;

  SafeEventReporter(Reporter<Event> delegate, AtomicBoolean noop) {
    this.delegate = delegate;
    this.noop = noop;
  }

  @Override public void report(Event event) {
    if (noop.get()) return;
    try {
      delegate.report(event);
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().log("error reporting {0}", event, t);
    }
  }

  @Override public String toString() {
    return delegate.toString();
  }

  static final class CompositeReporter implements Reporter<Event> {
    final Reporter<Event>[] reporters;

    CompositeReporter(Reporter<Event>[] reporters) {
      this.reporters = reporters;
    }

    @Override public void report(Event event) {
      for (Reporter<Event> reporter : reporters) {
        try {
          reporter.report(event);
        } catch (Throwable t) {
          propagateIfFatal(t);
          Platform.get().log("error reporting {0}", event, t);
        }
      }
    }

    @Override public String toString() {
      StringBuilder result = new StringBuilder("CompositeReporter(");
      for (int i = 0; i < reporters.length; i++) {
        if (i > 0) result.append(", ");
        result.append(reporters[i]);
      }
      return result.append(')').toString();
    }
  }
}
