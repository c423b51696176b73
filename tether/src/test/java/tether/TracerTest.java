/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import tether.propagation.Identifier;
import tether.propagation.ThreadLocalSpanStore;
import tether.sampler.Sampler;
import tether.sampler.SamplingDecision;
import tether.test.EventLoop;
import tether.test.LogCapture;
import tether.test.TestEventReporter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static tether.Event.Label.ENTRY;
import static tether.Event.Label.EXIT;
import static tether.SpanDescriptor.named;

class TracerTest {
  TestEventReporter events = new TestEventReporter();
  LogCapture logs = LogCapture.start();
  Tracing tracing = Tracing.newBuilder()
    .sampler(Sampler.ALWAYS_SAMPLE)
    .addReporter(events)
    .build();
  Tracer tracer = tracing.tracer();

  @AfterEach void close() {
    tracing.close();
    logs.close();
    ((ThreadLocalSpanStore) tracing.spanStore()).clear();
  }

  <V> V inRoot(SyncTask<V, RuntimeException> task) {
    return tracer.startOrContinueTrace(null, named("root"), task);
  }

  @Test void instrument_withoutCurrentSpan_runsTaskAsIs() {
    assertThat(tracer.instrument(named("x"), () -> "result")).isEqualTo("result");

    assertThat(events).isEmpty();
  }

  @Test void instrument_createsChildOfCurrentSpan() {
    AtomicReference<Span> root = new AtomicReference<>();
    Span child = inRoot(() -> {
      root.set(tracer.currentSpan());
      return tracer.instrument(named("x"), () -> tracer.currentSpan());
    });

    assertThat(child.name()).isEqualTo("x");
    assertThat(child.parent()).isSameAs(root.get());
    assertThat(child.isTopSpan()).isFalse();
    assertThat(child.identifier().taskId()).isEqualTo(root.get().identifier().taskId());
    assertThat(child.isEntered()).isTrue();
    assertThat(child.isExited()).isTrue();
    assertThat(tracer.currentSpan()).isNull();
    assertThat(events).extracting(Event::layer, Event::label).containsExactly(
      tuple("root", ENTRY),
      tuple("x", ENTRY),
      tuple("x", EXIT),
      tuple("root", EXIT)
    );
  }

  @Test void instrument_throws_recordsErrorAndRethrows() {
    assertThatThrownBy(() -> inRoot(() -> tracer.instrument(named("x"), () -> {
      throw new IllegalStateException("boom");
    }))).isInstanceOf(IllegalStateException.class).hasMessage("boom");

    Event exit = events.get("x", EXIT);
    assertThat(exit.attribute(EventKeys.ERROR_MSG)).isEqualTo("boom");
    assertThat(exit.attribute(EventKeys.ERROR_CLASS)).isEqualTo("IllegalStateException");
    assertThat((String) exit.attribute(EventKeys.BACKTRACE)).contains("boom");
    // the root saw the same error as it propagated
    assertThat(events.get("root", EXIT).attribute(EventKeys.ERROR_MSG)).isEqualTo("boom");
  }

  @Test void instrument_checkedExceptionRethrownUnchanged() {
    IOException error = new IOException("disk");
    SyncTask<String, IOException> task = () -> {
      throw error;
    };

    assertThatThrownBy(() -> tracer.startOrContinueTrace(null, named("x"), task))
      .isSameAs(error);
    assertThat(events.get("x", EXIT).attribute(EventKeys.ERROR_MSG)).isEqualTo("disk");
  }

  @Test void instrument_disabled_runsInCallersContextWithoutSpan() {
    InstrumentOptions disabled = InstrumentOptions.newBuilder().enabled(false).build();
    AtomicReference<Span> root = new AtomicReference<>();
    Span seen = inRoot(() -> {
      root.set(tracer.currentSpan());
      return tracer.instrument(named("x"), () -> tracer.currentSpan(), disabled);
    });

    assertThat(seen).isSameAs(root.get());
    assertThat(events.withLayer("x")).isEmpty();
  }

  @Test void instrument_noNameFromBuilder_runsWithoutSpan() {
    String result = inRoot(() -> tracer.instrument(SpanDescriptor.builder(current -> null),
      () -> tracer.currentSpan().name()));

    assertThat(result).isEqualTo("root");
    assertThat(events).hasSize(2);
  }

  @Test void instrument_builderThrows_runsWithoutSpanAndLogs() {
    SpanDescriptor broken = SpanDescriptor.builder(current -> {
      throw new IllegalArgumentException("bad builder");
    });

    assertThat(inRoot(() -> tracer.instrument(broken, () -> "ran"))).isEqualTo("ran");

    assertThat(events).extracting(Event::layer).containsOnly("root");
    assertThat(logs.messages(Level.SEVERE)).anySatisfy(m -> assertThat(m)
      .startsWith("Tracer.nextSpan: error creating span"));
  }

  @Test void instrument_builderSeesCurrentSpanAndCustomizes() {
    AtomicReference<Span> builderSaw = new AtomicReference<>();
    AtomicReference<Span> customized = new AtomicReference<>();
    SpanDescriptor descriptor = SpanDescriptor.builder(current -> {
      builderSaw.set(current);
      return SpanInfo.newBuilder()
        .name("query")
        .attribute("Query", "SELECT 1")
        .customizer(span -> {
          customized.set(span);
          span.entryEvent().set("Prepared", true);
        })
        .build();
    });

    Span root = inRoot(() -> {
      tracer.instrument(descriptor, () -> null);
      return tracer.currentSpan();
    });

    assertThat(builderSaw.get()).isSameAs(root);
    assertThat(customized.get().name()).isEqualTo("query");
    assertThat(events.get("query", ENTRY).attributes())
      .containsEntry("Query", "SELECT 1")
      .containsEntry("Prepared", true);
  }

  @Test void instrument_collectBacktraces() {
    InstrumentOptions options = InstrumentOptions.newBuilder().collectBacktraces(true).build();
    inRoot(() -> tracer.instrument(named("x"), () -> null, options));

    assertThat((String) events.get("x", ENTRY).attribute(EventKeys.BACKTRACE))
      .contains(TracerTest.class.getName());
    assertThat(events.get("root", ENTRY).attributes()).doesNotContainKey(EventKeys.BACKTRACE);
  }

  @Test void causalEdges_followExecutionOrder() {
    inRoot(() -> {
      tracer.instrument(named("c1"), () -> null);
      tracer.instrument(named("c2"), () -> null);
      return null;
    });

    Event rootEntry = events.get("root", ENTRY), rootExit = events.get("root", EXIT);
    Event c1Entry = events.get("c1", ENTRY), c1Exit = events.get("c1", EXIT);
    Event c2Entry = events.get("c2", ENTRY), c2Exit = events.get("c2", EXIT);

    assertThat(rootEntry.edge()).isNull();
    assertThat(c1Entry.edge()).isEqualTo(rootEntry.identifier());
    assertThat(c1Exit.edge()).isEqualTo(c1Entry.identifier());
    assertThat(c2Entry.edge()).isEqualTo(c1Exit.identifier());
    assertThat(c2Exit.edge()).isEqualTo(c2Entry.identifier());
    assertThat(rootExit.edge()).isEqualTo(c2Exit.identifier());
  }

  @Test void instrumentCallback_spanExitsWhenCallbackRuns() {
    EventLoop loop = new EventLoop();
    AtomicReference<Span> child = new AtomicReference<>();
    AtomicReference<Span> callbackSaw = new AtomicReference<>();
    AtomicReference<String> result = new AtomicReference<>();
    Callback<String> callback = (error, value) -> {
      callbackSaw.set(tracer.currentSpan());
      result.set(value);
    };

    Span root = inRoot(() -> {
      tracer.instrument(named("io"), done -> {
        child.set(tracer.currentSpan());
        loop.execute(() -> done.onComplete(null, "ok"));
        return null;
      }, callback);
      return tracer.currentSpan();
    });

    assertThat(child.get().name()).isEqualTo("io");
    assertThat(child.get().isExited()).isFalse();
    assertThat(tracer.currentSpan()).isNull();

    loop.runAll();

    assertThat(child.get().isExited()).isTrue();
    assertThat(result.get()).isEqualTo("ok");
    assertThat(callbackSaw.get()).isSameAs(root);
    assertThat(tracer.currentSpan()).isNull();
    assertThat(events.get("io", EXIT).attributes()).doesNotContainKey(EventKeys.ERROR_MSG);
  }

  @Test void instrumentCallback_errorArgumentRecordedAndPassedOn() {
    EventLoop loop = new EventLoop();
    IllegalStateException error = new IllegalStateException("late");
    AtomicReference<Throwable> callbackError = new AtomicReference<>();
    Callback<String> callback = (e, value) -> callbackError.set(e);

    inRoot(() -> tracer.instrument(named("io"), done -> {
      loop.execute(() -> done.onComplete(error, null));
      return null;
    }, callback));
    loop.runAll();

    assertThat(callbackError.get()).isSameAs(error);
    assertThat(events.get("io", EXIT).attribute(EventKeys.ERROR_MSG)).isEqualTo("late");
  }

  @Test void instrumentCallback_taskThrowsSynchronously() {
    Callback<String> callback = (e, value) -> {
      throw new AssertionError("callback should not run");
    };

    assertThatThrownBy(() -> inRoot(() -> tracer.instrument(named("io"), done -> {
      throw new IllegalStateException("sync");
    }, callback))).hasMessage("sync");

    assertThat(events.get("io", EXIT).attribute(EventKeys.ERROR_MSG)).isEqualTo("sync");
    assertThat(tracer.currentSpan()).isNull();
  }

  @Test void instrumentCallback_invokedTwice_exitsOnce() {
    AtomicReference<Callback<String>> done = new AtomicReference<>();
    inRoot(() -> tracer.instrument(named("io"), (Callback<String> d) -> {
      done.set(d);
      return null;
    }, null));

    done.get().onComplete(null, "first");
    done.get().onComplete(null, "second");

    assertThat(events.withLayer("io")).extracting(Event::label).containsExactly(ENTRY, EXIT);
  }

  @Test void instrumentCallback_withoutCurrentSpan_passesCallbackThrough() {
    Callback<String> callback = (e, value) -> {
    };
    AtomicReference<Callback<String>> given = new AtomicReference<>();

    tracer.instrument(named("io"), (Callback<String> d) -> {
      given.set(d);
      return null;
    }, callback);

    assertThat(given.get()).isSameAs(callback);
  }

  @Test void instrumentCallback_disabled_bindsCallbackToCaller() {
    EventLoop loop = new EventLoop();
    AtomicReference<Span> callbackSaw = new AtomicReference<>();
    Callback<String> callback = (e, value) -> callbackSaw.set(tracer.currentSpan());

    Span root = inRoot(() -> {
      tracer.instrument(named("io"), done -> {
        loop.execute(() -> done.onComplete(null, "ok"));
        return null;
      }, InstrumentOptions.DISABLED, callback);
      return tracer.currentSpan();
    });
    loop.runAll();

    assertThat(callbackSaw.get()).isSameAs(root);
    assertThat(events.withLayer("io")).isEmpty();
  }

  @Test void pInstrument_resolved() {
    CompletableFuture<Integer> stage = CompletableFuture.completedFuture(42);

    CompletableFuture<Integer> result = inRoot(() -> tracer.pInstrument(named("x"), () -> stage));

    assertThat(result).isSameAs(stage).isCompletedWithValue(42);
    assertThat(events.get("x", EXIT).attributes()).doesNotContainKey(EventKeys.ERROR_MSG);
  }

  @Test void pInstrument_rejected() {
    CompletableFuture<Integer> stage = new CompletableFuture<>();
    stage.completeExceptionally(new IllegalStateException("e"));

    CompletableFuture<Integer> result = inRoot(() -> tracer.pInstrument(named("x"), () -> stage));

    assertThat(result).isSameAs(stage).isCompletedExceptionally();
    assertThatThrownBy(result::join).hasRootCauseMessage("e");
    assertThat(events.get("x", EXIT).attribute(EventKeys.ERROR_MSG)).isEqualTo("e");
  }

  @Test void pInstrument_exitsWhenStageCompletes() {
    CompletableFuture<String> stage = new CompletableFuture<>();
    AtomicReference<Span> child = new AtomicReference<>();

    inRoot(() -> tracer.pInstrument(named("x"), () -> {
      child.set(tracer.currentSpan());
      return stage;
    }));

    assertThat(child.get().isExited()).isFalse();

    stage.complete("done");

    assertThat(child.get().isExited()).isTrue();
  }

  @Test void pInstrument_dependentStageFailure_recordsCause() {
    CompletableFuture<String> source = new CompletableFuture<>();
    CompletableFuture<String> dependent = source.thenApply(s -> {
      throw new IllegalArgumentException("mapped");
    });

    inRoot(() -> tracer.pInstrument(named("x"), () -> dependent));
    source.complete("value");

    assertThat(events.get("x", EXIT).attribute(EventKeys.ERROR_CLASS))
      .isEqualTo("IllegalArgumentException");
  }

  @Test void pInstrument_nullStage_exitsImmediately() {
    Object result = inRoot(() -> tracer.pInstrument(named("x"), () -> null));

    assertThat(result).isNull();
    assertThat(events.withLayer("x")).extracting(Event::label).containsExactly(ENTRY, EXIT);
  }

  @Test void startOrContinueTrace_newTrace() {
    Span root = tracer.startOrContinueTrace(null, named("request"), () -> tracer.currentSpan());

    assertThat(root.isTopSpan()).isTrue();
    assertThat(root.parent()).isNull();
    assertThat(root.doSample()).isTrue();
    assertThat(root.transactionName()).isEqualTo("custom-request");

    Event entry = events.get("request", ENTRY);
    assertThat(entry.edge()).isNull();
    assertThat(entry.attributes())
      .containsEntry(EventKeys.SAMPLE_SOURCE, SamplingDecision.SOURCE_LOCAL)
      .containsEntry(EventKeys.SAMPLE_RATE, Sampler.MAX_SAMPLE_RATE);
    assertThat(events.get("request", EXIT).attribute(EventKeys.TRANSACTION_NAME))
      .isEqualTo("custom-request");
  }

  @Test void startOrContinueTrace_customTransactionName() {
    InstrumentOptions options = InstrumentOptions.newBuilder().transactionName("checkout").build();

    tracer.startOrContinueTrace(null, named("request"), () -> null, options);

    assertThat(events.get("request", EXIT).attribute(EventKeys.TRANSACTION_NAME))
      .isEqualTo("checkout");
  }

  @Test void startOrContinueTrace_suppliedTransactionName_evaluatedAtExit() {
    AtomicReference<String> route = new AtomicReference<>("unknown");
    InstrumentOptions options = InstrumentOptions.newBuilder()
      .transactionName(() -> "route-" + route.get())
      .build();

    tracer.startOrContinueTrace(null, named("request"), () -> {
      route.set("/cart");
      return null;
    }, options);

    assertThat(events.get("request", EXIT).attribute(EventKeys.TRANSACTION_NAME))
      .isEqualTo("route-/cart");
  }

  @Test void startOrContinueTrace_suppliedTransactionNameFails_usesDefault() {
    InstrumentOptions options = InstrumentOptions.newBuilder()
      .transactionName(() -> {
        throw new IllegalStateException("no route");
      })
      .build();

    tracer.startOrContinueTrace(null, named("request"), () -> null, options);

    assertThat(events.get("request", EXIT).attribute(EventKeys.TRANSACTION_NAME))
      .isEqualTo("custom-request");
    assertThat(logs.messages(Level.SEVERE))
      .containsExactly("Span.exit: error naming transaction of request");
  }

  @Test void startOrContinueTrace_continuesUpstream() {
    Identifier upstream = Identifier.newRandom(true);

    Span root =
      tracer.startOrContinueTrace(upstream.toString(), named("request"), tracer::currentSpan);

    assertThat(root.identifier().taskId()).isEqualTo(upstream.taskId());
    Event entry = events.get("request", ENTRY);
    assertThat(entry.edge()).isEqualTo(upstream);
    assertThat(entry.attributes())
      .doesNotContainKeys(EventKeys.SAMPLE_SOURCE, EventKeys.SAMPLE_RATE);
  }

  @Test void startOrContinueTrace_invalidExternalId_startsNewTrace() {
    Span root = tracer.startOrContinueTrace("2Bnonsense", named("request"), tracer::currentSpan);

    assertThat(root).isNotNull();
    Event entry = events.get("request", ENTRY);
    assertThat(entry.edge()).isNull();
    // an id was supplied, so this process didn't originate the sampling decision
    assertThat(entry.attributes())
      .doesNotContainKeys(EventKeys.SAMPLE_SOURCE, EventKeys.SAMPLE_RATE);
  }

  @Test void startOrContinueTrace_activeSpanWinsOverExternalId() {
    Identifier upstream = Identifier.newRandom(true);
    AtomicReference<Span> root = new AtomicReference<>();

    Span child = inRoot(() -> {
      root.set(tracer.currentSpan());
      return tracer.startOrContinueTrace(upstream.toString(), named("x"), tracer::currentSpan);
    });

    assertThat(child.parent()).isSameAs(root.get());
    assertThat(child.isTopSpan()).isFalse();
    assertThat(child.identifier().taskId())
      .isEqualTo(root.get().identifier().taskId())
      .isNotEqualTo(upstream.taskId());
  }

  @Test void startOrContinueTrace_samplerThrows_runsWithoutTracing() {
    try (Tracing failing = Tracing.newBuilder()
      .sampler(new Sampler() {
        @Override public SamplingDecision decide(Identifier upstream) {
          throw new IllegalStateException("sampler down");
        }
      })
      .addReporter(events)
      .build()) {
      AtomicBoolean ran = new AtomicBoolean();

      String result = failing.tracer().startOrContinueTrace(null, named("x"), () -> {
        ran.set(true);
        assertThat(failing.tracer().currentSpan()).isNull();
        return "result";
      });

      assertThat(ran).isTrue();
      assertThat(result).isEqualTo("result");
    }

    assertThat(events).isEmpty();
    assertThat(logs.messages(Level.SEVERE))
      .contains("Tracer.startOrContinueTrace: error sampling null");
  }

  @Test void startOrContinueTrace_notRecorded_bindsCallback() {
    EventLoop loop = new EventLoop();
    AtomicReference<Throwable> callbackError = new AtomicReference<>(new AssertionError());
    Callback<String> callback = (e, value) -> callbackError.set(e);
    try (Tracing never = Tracing.newBuilder()
      .sampler(Sampler.NEVER_SAMPLE)
      .addReporter(events)
      .build()) {
      never.tracer().startOrContinueTrace(null, named("x"), done -> {
        loop.execute(() -> done.onComplete(null, "ok"));
        return null;
      }, null, callback);
    }
    loop.runAll();

    assertThat(callbackError.get()).isNull();
    assertThat(events).isEmpty();
  }

  @Test void startOrContinueTrace_metricsOnly_spanNotReported() {
    Sampler metricsOnly = new Sampler() {
      @Override public SamplingDecision decide(Identifier upstream) {
        return SamplingDecision.create(false, true, SamplingDecision.SOURCE_LOCAL, 0, null);
      }
    };
    try (Tracing tracing = Tracing.newBuilder().sampler(metricsOnly).addReporter(events).build()) {
      Span root = tracing.tracer()
        .startOrContinueTrace(null, named("x"), () -> tracing.tracer().currentSpan());

      assertThat(root.doSample()).isFalse();
      assertThat(root.doMetrics()).isTrue();
      assertThat(root.identifier().sampled()).isFalse();
      assertThat(root.entryEvent().attributes())
        .doesNotContainKeys(EventKeys.SAMPLE_SOURCE, EventKeys.SAMPLE_RATE);
      assertThat(root.exitEvent().attribute(EventKeys.TRANSACTION_NAME)).isEqualTo("custom-x");
    }

    assertThat(events).isEmpty();
  }

  @Test void startOrContinueTrace_callback() {
    EventLoop loop = new EventLoop();
    AtomicReference<String> result = new AtomicReference<>();
    Callback<String> callback = (e, value) -> result.set(value);

    tracer.startOrContinueTrace(null, named("request"), done -> {
      loop.execute(() -> done.onComplete(null, "ok"));
      return null;
    }, null, callback);

    assertThat(events.withLayer("request")).extracting(Event::label).containsExactly(ENTRY);

    loop.runAll();

    assertThat(result.get()).isEqualTo("ok");
    assertThat(events.withLayer("request")).extracting(Event::label).containsExactly(ENTRY, EXIT);
  }

  @Test void pStartOrContinueTrace() {
    CompletableFuture<Integer> stage = new CompletableFuture<>();

    CompletableFuture<Integer> result =
      tracer.pStartOrContinueTrace(null, named("request"), () -> stage, null);
    stage.complete(42);

    assertThat(result).isSameAs(stage).isCompletedWithValue(42);
    assertThat(events.withLayer("request")).extracting(Event::label).containsExactly(ENTRY, EXIT);
  }

  @Test void interleavedFlows_eachCompletesInItsOwnSpan() {
    EventLoop loop = new EventLoop();
    Map<String, Span> ioCallbackSaw = new LinkedHashMap<>();
    Map<String, Span> finalCallbackSaw = new LinkedHashMap<>();

    for (String name : new String[] {"a", "b"}) {
      Callback<String> callback = (e, value) -> finalCallbackSaw.put(name, tracer.currentSpan());
      tracer.startOrContinueTrace(null, named(name), done -> {
        Callback<String> ioCallback = (e, value) -> {
          ioCallbackSaw.put(name, tracer.currentSpan());
          done.onComplete(e, value);
        };
        return tracer.instrument(named(name + "-io"), (Callback<String> ioDone) -> {
          loop.execute(() -> ioDone.onComplete(null, name));
          return null;
        }, ioCallback);
      }, null, callback);
    }

    assertThat(tracer.currentSpan()).isNull();
    loop.runAll();

    assertThat(ioCallbackSaw.get("a").name()).isEqualTo("a");
    assertThat(ioCallbackSaw.get("b").name()).isEqualTo("b");
    assertThat(finalCallbackSaw).containsEntry("a", null).containsEntry("b", null);
    assertThat(events.get("a-io", ENTRY).identifier().taskId())
      .isEqualTo(events.get("a", ENTRY).identifier().taskId());
    assertThat(events.get("b-io", ENTRY).identifier().taskId())
      .isEqualTo(events.get("b", ENTRY).identifier().taskId());
    assertThat(events.get("a", EXIT).edge()).isEqualTo(events.get("a-io", EXIT).identifier());
    assertThat(events).filteredOn(e -> e.label() == EXIT).hasSize(4);
  }

  @Test void nullTask_logsAndReturnsNull() {
    assertThat(tracer.instrument(named("x"), (SyncTask<String, RuntimeException>) null)).isNull();

    assertThat(logs.messages(Level.SEVERE)).contains("Tracer.instrument: task == null");
  }

  @Test void reportErrorAndInfo() {
    assertThat(tracer.reportInfo(Collections.singletonMap("k", "v"))).isFalse();

    inRoot(() -> {
      assertThat(tracer.reportInfo(Collections.singletonMap("k", "v"))).isTrue();
      assertThat(tracer.reportError(new IllegalStateException("oops"))).isTrue();
      return null;
    });

    List<Event> root = events.withLayer("root");
    assertThat(root).extracting(Event::label)
      .containsExactly(ENTRY, Event.Label.INFO, Event.Label.ERROR, EXIT);
    assertThat(root.get(1).attribute("k")).isEqualTo("v");
    assertThat(root.get(1).edge()).isEqualTo(root.get(0).identifier());
    assertThat(root.get(2).attribute(EventKeys.ERROR_MSG)).isEqualTo("oops");
    assertThat(root.get(3).edge()).isEqualTo(root.get(2).identifier());
  }

  @Test void formattedTraceId() {
    assertThat(tracer.formattedTraceId()).isEqualTo(Identifier.UNTRACED_LOG_STRING);

    String traced = inRoot(tracer::formattedTraceId);

    assertThat(traced).matches("[0-9A-F]{40}-1");
  }

  @Test void insertLogObject_dependsOnMode() {
    assertThat(tracer.insertLogObject(null)).isEmpty();

    try (Tracing always = Tracing.newBuilder().logTraceIdMode(LogTraceIdMode.ALWAYS).build()) {
      assertThat(always.tracer().insertLogObject(null))
        .containsEntry(Tracer.LOG_OBJECT_KEY,
          Collections.singletonMap("traceId", Identifier.UNTRACED_LOG_STRING));
    }

    try (Tracing sampledOnly = Tracing.newBuilder()
      .sampler(Sampler.ALWAYS_SAMPLE)
      .addReporter(events)
      .logTraceIdMode(LogTraceIdMode.SAMPLED_ONLY)
      .build()) {
      Tracer tracer = sampledOnly.tracer();
      assertThat(tracer.insertLogObject(null)).isEmpty();

      Map<String, Object> record = new LinkedHashMap<>();
      record.put("msg", "hello");
      tracer.startOrContinueTrace(null, named("x"), () -> tracer.insertLogObject(record));

      assertThat(record).containsEntry("msg", "hello").containsKey(Tracer.LOG_OBJECT_KEY);
    }
  }

  @Test void sampling() {
    assertThat(Tracer.sampling(Identifier.newRandom(true).toString())).isTrue();
    assertThat(Tracer.sampling(Identifier.newRandom(false).toString())).isFalse();
    assertThat(Tracer.sampling("1")).isFalse();
    assertThat(Tracer.sampling(null)).isFalse();
  }

  @Test void executionMode_fixedByTaskShape() {
    List<Span> spans = new ArrayList<>();
    inRoot(() -> {
      spans.add(tracer.currentSpan());
      tracer.instrument(named("sync"), () -> spans.add(tracer.currentSpan()));
      CallbackTask<Object, Boolean> callbackTask = done -> {
        spans.add(tracer.currentSpan());
        done.onComplete(null, null);
        return true;
      };
      tracer.instrument(named("callback"), callbackTask, null);
      return tracer.pInstrument(named("promise"), () -> {
        spans.add(tracer.currentSpan());
        return CompletableFuture.completedFuture("done");
      });
    });

    assertThat(spans).extracting(Span::name, Span::executionMode).containsExactly(
      tuple("root", ExecutionMode.SYNC),
      tuple("sync", ExecutionMode.SYNC),
      tuple("callback", ExecutionMode.CALLBACK_ASYNC),
      tuple("promise", ExecutionMode.PROMISE_ASYNC)
    );
  }
}
