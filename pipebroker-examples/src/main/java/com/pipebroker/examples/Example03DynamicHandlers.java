package com.pipebroker.examples;

import com.pipebroker.broker.ClaimTicket;
import com.pipebroker.broker.DisruptorEventBroker;
import com.pipebroker.broker.EventBrokerSettings;
import com.pipebroker.broker.PublishMode;
import com.pipebroker.examples.steps.GreetingSteps;

import java.util.List;
import java.util.concurrent.TimeUnit;

public final class Example03DynamicHandlers {
  private Example03DynamicHandlers() {}

  public static void run() throws Exception {
    EventBrokerSettings settings = EventBrokerSettings.builder()
        .publishMode(PublishMode.AWAIT_COMPLETION)
        .disableMissingHandlerWarningLog(true)
        .build();

    try (DisruptorEventBroker broker = DisruptorEventBroker.builder().name("ex03").settings(settings).build()) {
      ClaimTicket upper = broker.dynamicHandlers().add(GreetingSteps.Greeting.class,
          (event, policy, token) -> System.out.println("[ex03] upper => " + event.text().toUpperCase()));
      ClaimTicket length = broker.dynamicHandlers().add(GreetingSteps.Greeting.class,
          (event, policy, token) -> System.out.println("[ex03] length => " + event.text().length()));

      broker.publish(new GreetingSteps.Greeting("two handlers")).get(5, TimeUnit.SECONDS);

      broker.dynamicHandlers().remove(upper);
      broker.publish(new GreetingSteps.Greeting("one handler")).get(5, TimeUnit.SECONDS);

      broker.dynamicHandlers().removeRange(List.of(length));
      broker.publish(new GreetingSteps.Greeting("nobody listens")).get(5, TimeUnit.SECONDS);
      System.out.println("[ex03] handlers left => " + broker.dynamicHandlers().size());
    }
  }
}
