package com.pipebroker.examples;

import com.pipebroker.broker.DisruptorEventBroker;
import com.pipebroker.config.BrokerConfig;
import com.pipebroker.config.BrokerJsonLoader;
import com.pipebroker.config.PipelineCatalog;
import com.pipebroker.core.Params;
import com.pipebroker.core.Pipeline;
import com.pipebroker.examples.steps.OrderSteps;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public final class Example04LoadFromJsonConfig {
  private Example04LoadFromJsonConfig() {}

  public static void run() throws Exception {
    PipelineCatalog catalog = new PipelineCatalog()
        .register(Pipeline.builder("audit")
            .execute((OrderSteps.OrderPlaced o) -> System.out.println("[ex04] audit " + o),
                Params.requiredFromContext(OrderSteps.OrderPlaced.class))
            .build());

    BrokerConfig config;
    try (InputStream in = Example04LoadFromJsonConfig.class.getResourceAsStream("/examples-broker.json")) {
      if (in == null) throw new IOException("examples-broker.json not on classpath");
      config = BrokerJsonLoader.load(in, catalog);
    }

    try (DisruptorEventBroker broker = config.brokerBuilder().name("ex04").build()) {
      broker.publish(new OrderSteps.OrderPlaced("o-7", 12.0)).get(5, TimeUnit.SECONDS);
      broker.publishDeferred(new OrderSteps.OrderPlaced("o-8", 3.0), Duration.ofMillis(50)).get(5, TimeUnit.SECONDS);
    }
  }
}
