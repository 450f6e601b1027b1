package com.pipebroker.examples;

import com.pipebroker.core.PipelineRunContext;
import com.pipebroker.core.PipelineRunResult;
import com.pipebroker.examples.steps.GreetingSteps;
import com.pipebroker.examples.steps.OrderSteps;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ExamplesSmokeTest {

  @Test
  void helloPipelineStampsEcho() {
    PipelineRunContext ctx = new PipelineRunContext().set(new GreetingSteps.Greeting("hi"));
    PipelineRunResult res = Example01HelloPipeline.pipeline().run(ctx);

    assertTrue(res.isSuccessful());
    assertEquals(new GreetingSteps.Echo("hi"), ctx.get(GreetingSteps.Echo.class));
    assertEquals("hi", ctx.get(GreetingSteps.Stamped.class).text());
  }

  @Test
  void allExamplesRun() {
    assertDoesNotThrow(() -> ExamplesMain.main(new String[0]));
    assertTrue(OrderSteps.FlakyPaymentHandler.calls() >= 3);
  }
}
