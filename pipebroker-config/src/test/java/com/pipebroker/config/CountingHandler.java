package com.pipebroker.config;

import com.pipebroker.broker.EventHandler;
import com.pipebroker.broker.RetryPolicy;
import com.pipebroker.core.CancellationToken;

import java.util.concurrent.atomic.AtomicInteger;

final class CountingHandler implements EventHandler<OrderPlaced> {
  static final AtomicInteger HANDLED = new AtomicInteger();
  static final AtomicInteger INSTANCES = new AtomicInteger();

  CountingHandler() {
    INSTANCES.incrementAndGet();
  }

  @Override
  public void handle(OrderPlaced event, RetryPolicy retryPolicy, CancellationToken cancellationToken) {
    HANDLED.incrementAndGet();
  }
}
