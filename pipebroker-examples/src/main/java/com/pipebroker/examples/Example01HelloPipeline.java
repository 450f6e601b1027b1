package com.pipebroker.examples;

import com.pipebroker.broker.DisruptorEventBroker;
import com.pipebroker.broker.EventBrokerSettings;
import com.pipebroker.broker.PublishMode;
import com.pipebroker.core.Params;
import com.pipebroker.core.Pipeline;
import com.pipebroker.core.PipelineRunContext;
import com.pipebroker.core.PipelineRunResult;
import com.pipebroker.examples.steps.GreetingSteps;

import java.util.concurrent.TimeUnit;

public final class Example01HelloPipeline {
  private Example01HelloPipeline() {}

  static Pipeline pipeline() {
    return Pipeline.builder("hello")
        .execute("echo", GreetingSteps::echo,
            Params.requiredFromContext(GreetingSteps.Greeting.class), Params.runContext())
        .execute("timestamp", GreetingSteps::appendTimestamp,
            Params.requiredFromContext(GreetingSteps.Echo.class), Params.runContext())
        .build();
  }

  public static void run() throws Exception {
    Pipeline hello = pipeline();

    // direct run
    PipelineRunContext ctx = new PipelineRunContext().set(new GreetingSteps.Greeting("hello"));
    PipelineRunResult res = hello.run(ctx);
    System.out.println("[ex01] direct => " + res.isSuccessful() + " " + ctx.get(GreetingSteps.Stamped.class));

    // through the broker
    Pipeline printing = Pipeline.builder("hello-printing")
        .steps(hello)
        .execute("print", (GreetingSteps.Stamped s) -> System.out.println("[ex01] broker => " + s),
            Params.requiredFromContext(GreetingSteps.Stamped.class))
        .build();
    EventBrokerSettings settings = EventBrokerSettings.builder().publishMode(PublishMode.AWAIT_COMPLETION).build();
    try (DisruptorEventBroker broker = DisruptorEventBroker.builder().name("ex01").settings(settings)
        .register(GreetingSteps.Greeting.class, printing)
        .build()) {
      broker.publish(new GreetingSteps.Greeting("hello")).get(5, TimeUnit.SECONDS);
    }
  }
}
