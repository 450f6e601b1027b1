package com.pipebroker.examples;

import com.pipebroker.broker.DisruptorEventBroker;
import com.pipebroker.broker.EventBrokerSettings;
import com.pipebroker.broker.EventRegistration;
import com.pipebroker.broker.PublishMode;
import com.pipebroker.broker.RetrySettings;
import com.pipebroker.examples.steps.OrderSteps;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

public final class Example02RetryingHandler {
  private Example02RetryingHandler() {}

  public static void run() throws Exception {
    EventBrokerSettings settings = EventBrokerSettings.builder()
        .maxConcurrentHandlers(4)
        .publishMode(PublishMode.AWAIT_COMPLETION)
        .build();

    try (DisruptorEventBroker broker = DisruptorEventBroker.builder().name("ex02").settings(settings)
        .register(EventRegistration.handler(OrderSteps.OrderPlaced.class, OrderSteps.FlakyPaymentHandler::new)
            .withRetry(RetrySettings.exponential(3, Duration.ofMillis(10), Duration.ofMillis(100))))
        .register(EventRegistration.handler(OrderSteps.OrderPlaced.class, OrderSteps.BrokenAuditHandler::new)
            .withRetry(RetrySettings.fixed(2, Duration.ofMillis(10))))
        .build()) {
      broker.publish(new OrderSteps.OrderPlaced("o-42", 99.5)).get(5, TimeUnit.SECONDS);
    }
  }
}
