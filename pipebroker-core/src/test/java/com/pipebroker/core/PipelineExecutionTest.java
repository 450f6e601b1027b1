package com.pipebroker.core;

import com.pipebroker.core.scope.InMemoryScopeFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class PipelineExecutionTest {

  record Greeting(String text) {}
  record Trace(List<String> entries) {}

  private static Trace trace() { return new Trace(new ArrayList<>()); }

  static final class Connection implements AutoCloseable {
    boolean closed;
    @Override public void close() { closed = true; }
  }

  @Test
  void stepsWithoutNextRunInOrder() {
    Trace trace = trace();
    Pipeline p = Pipeline.builder("order")
        .execute("a", () -> trace.entries().add("a"))
        .execute("b", () -> trace.entries().add("b"))
        .execute("c", () -> trace.entries().add("c"))
        .build();

    PipelineRunResult result = p.run();

    assertTrue(result.isSuccessful());
    assertNull(result.exception());
    assertEquals(List.of("a", "b", "c"), trace.entries());
  }

  @Test
  void wrapperObservesBeforeAndAfterDownstream() {
    PipelineRunContext ctx = new PipelineRunContext().set(trace());
    Pipeline p = Pipeline.builder("wrap")
        .execute("outer", (Trace t, Next next) -> {
          t.entries().add("outer:before");
          next.run();
          t.entries().add("outer:after");
        }, Params.fromContext(Trace.class), Params.next())
        .execute("inner", (Trace t) -> t.entries().add("inner"), Params.fromContext(Trace.class))
        .build();

    PipelineRunResult result = p.run(ctx);

    assertTrue(result.isSuccessful());
    assertSame(ctx, result.context());
    assertEquals(List.of("outer:before", "inner", "outer:after"), ctx.get(Trace.class).entries());
  }

  @Test
  void notCallingNextSkipsRemainingSteps() {
    PipelineRunContext ctx = new PipelineRunContext().set(trace());
    Pipeline p = Pipeline.builder("short")
        .execute("gate", (Trace t, Next next) -> t.entries().add("gate"),
            Params.fromContext(Trace.class), Params.next())
        .execute("skipped", (Trace t) -> t.entries().add("skipped"), Params.fromContext(Trace.class))
        .build();

    PipelineRunResult result = p.run(ctx);

    assertTrue(result.isSuccessful());
    assertEquals(List.of("gate"), ctx.get(Trace.class).entries());
  }

  @Test
  void failureIsCapturedNotThrown() {
    PipelineRunContext ctx = new PipelineRunContext().set(trace());
    Pipeline p = Pipeline.builder("fail")
        .execute("ok", (Trace t) -> t.entries().add("ok"), Params.fromContext(Trace.class))
        .execute("boom", () -> { throw new IllegalStateException("boom"); })
        .execute("never", (Trace t) -> t.entries().add("never"), Params.fromContext(Trace.class))
        .build();

    PipelineRunResult result = assertDoesNotThrow(() -> p.run(ctx));

    assertFalse(result.isSuccessful());
    assertInstanceOf(IllegalStateException.class, result.exception());
    assertSame(result.exception(), ctx.exception());
    assertEquals(1, result.failedStepIndex());
    assertEquals("s1:boom", result.failedStepName());
    assertEquals(List.of("ok"), ctx.get(Trace.class).entries());
  }

  @Test
  void checkedExceptionsAreCaptured() {
    Pipeline p = Pipeline.builder("checked")
        .execute(() -> { throw new IOException("disk"); })
        .build();

    PipelineRunResult result = p.run();

    assertFalse(result.isSuccessful());
    assertInstanceOf(IOException.class, result.exception());
    assertEquals("s0", result.failedStepName());
    assertSame(result.exception(), result.context().exception());
  }

  @Test
  void wrapperCanHandleDownstreamFailure() {
    PipelineRunContext ctx = new PipelineRunContext();
    Pipeline p = Pipeline.builder("guard")
        .execute("guard", (PipelineRunContext c, Next next) -> {
          try {
            next.run();
          } catch (IllegalArgumentException e) {
            c.set(new Greeting("recovered"));
          }
        }, Params.runContext(), Params.next())
        .execute("bad", () -> { throw new IllegalArgumentException("bad"); })
        .build();

    PipelineRunResult result = p.run(ctx);

    assertTrue(result.isSuccessful());
    assertEquals("recovered", ctx.get(Greeting.class).text());
  }

  @Test
  void failureInNestedStepReportsInnermostIndex() {
    Pipeline p = Pipeline.builder("nested")
        .execute("outer", (Next next) -> next.run(), Params.next())
        .execute("middle", (Next next) -> next.run(), Params.next())
        .execute("inner", () -> { throw new IllegalStateException("deep"); })
        .build();

    PipelineRunResult result = p.run();

    assertFalse(result.isSuccessful());
    assertEquals(2, result.failedStepIndex());
    assertEquals("s2:inner", result.failedStepName());
  }

  @Test
  void secondNextCallFailsTheRun() {
    Pipeline p = Pipeline.builder("twice")
        .execute((Next next) -> {
          next.run();
          next.run();
        }, Params.next())
        .execute(() -> { })
        .build();

    PipelineRunResult result = p.run();

    assertFalse(result.isSuccessful());
    assertInstanceOf(IllegalStateException.class, result.exception());
  }

  @Test
  void nextFromLastStepHasNoEffect() {
    PipelineRunContext ctx = new PipelineRunContext().set(trace());
    Pipeline p = Pipeline.builder("last")
        .execute((Trace t, Next next) -> {
          next.run();
          t.entries().add("after");
        }, Params.fromContext(Trace.class), Params.next())
        .build();

    assertTrue(p.run(ctx).isSuccessful());
    assertEquals(List.of("after"), ctx.get(Trace.class).entries());
  }

  @Test
  void cancelledTokenStopsBeforeNextStep() {
    CancellationSource cts = new CancellationSource();
    PipelineRunContext ctx = new PipelineRunContext().set(trace());
    Pipeline p = Pipeline.builder("cancel")
        .execute("first", (Trace t) -> {
          t.entries().add("first");
          cts.cancel();
        }, Params.fromContext(Trace.class))
        .execute("second", (Trace t) -> t.entries().add("second"), Params.fromContext(Trace.class))
        .build();

    PipelineRunResult result = p.run(ctx, cts.token());

    assertFalse(result.isSuccessful());
    assertInstanceOf(CancellationException.class, result.exception());
    assertEquals(1, result.failedStepIndex());
    assertEquals(List.of("first"), ctx.get(Trace.class).entries());
  }

  @Test
  void preCancelledTokenFailsBeforeFirstStep() {
    CancellationSource cts = new CancellationSource();
    cts.cancel();
    PipelineRunContext ctx = new PipelineRunContext();
    Pipeline p = Pipeline.builder("token")
        .execute((CancellationToken token, Next next) -> {
          token.throwIfCancellationRequested();
          next.run();
        }, Params.cancellation(), Params.next())
        .build();

    PipelineRunResult result = p.run(ctx, cts.token());

    assertInstanceOf(CancellationException.class, result.exception());
    assertEquals(0, result.failedStepIndex());
  }

  @Test
  void pooledRunReturnsSnapshot() {
    Pipeline p = Pipeline.builder("snapshot")
        .execute((PipelineRunContext c) -> c.set(new Greeting("hi")), Params.runContext())
        .build();

    PipelineRunResult first = p.run();
    PipelineRunResult second = p.run();

    assertEquals("hi", first.context().get(Greeting.class).text());
    assertEquals("hi", second.context().get(Greeting.class).text());
    assertEquals(1, first.context().size());
  }

  @Test
  void runAsyncCompletesWithResult() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      PipelineRunContext ctx = new PipelineRunContext();
      Pipeline p = Pipeline.builder("async")
          .execute((PipelineRunContext c) -> c.set(new Greeting("async")), Params.runContext())
          .build();

      PipelineRunResult result = p.runAsync(ctx, CancellationToken.NONE, executor).get(5, TimeUnit.SECONDS);

      assertTrue(result.isSuccessful());
      assertEquals("async", ctx.get(Greeting.class).text());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void pipelineIsReusableAcrossRuns() {
    Pipeline p = Pipeline.builder("reuse")
        .execute((Greeting g, PipelineRunContext c) -> c.set(new Trace(List.of(g.text()))),
            Params.fromContext(Greeting.class), Params.runContext())
        .build();

    for (String text : List.of("one", "two", "three")) {
      PipelineRunContext ctx = new PipelineRunContext().set(new Greeting(text));
      assertTrue(p.run(ctx).isSuccessful());
      assertEquals(List.of(text), ctx.get(Trace.class).entries());
    }
  }

  @Test
  void errorPropagatesAfterRunScopeIsClosed() {
    Connection connection = new Connection();
    Pipeline p = Pipeline.builder("fatal")
        .scopeFactory(new InMemoryScopeFactory().scoped(Connection.class, () -> connection))
        .options(new PipelineRunOptions(false))
        .execute("open", (Connection c) -> assertFalse(c.closed), Params.requiredFromScope(Connection.class))
        .execute("crash", () -> { throw new AssertionError("boom"); })
        .build();

    AssertionError error = assertThrows(AssertionError.class, () -> p.run(new PipelineRunContext()));
    assertEquals("boom", error.getMessage());
    assertTrue(connection.closed);
  }
}
