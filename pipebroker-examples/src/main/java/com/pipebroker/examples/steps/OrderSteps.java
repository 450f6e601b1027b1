package com.pipebroker.examples.steps;

import com.pipebroker.broker.EventHandler;
import com.pipebroker.broker.RetryPolicy;
import com.pipebroker.core.CancellationToken;

import java.util.concurrent.atomic.AtomicInteger;

public final class OrderSteps {
  private OrderSteps() {}

  public record OrderPlaced(String id, double amount) {}

  /** Fails until the third attempt, like a downstream service coming back online. */
  public static final class FlakyPaymentHandler implements EventHandler<OrderPlaced> {
    private static final AtomicInteger CALLS = new AtomicInteger();

    @Override
    public void handle(OrderPlaced event, RetryPolicy retryPolicy, CancellationToken cancellationToken) {
      CALLS.incrementAndGet();
      if (retryPolicy.attempt() < 3) {
        throw new IllegalStateException("payment gateway unavailable (attempt " + retryPolicy.attempt() + ")");
      }
      System.out.println("[ex02] charged " + event.id() + " on attempt " + retryPolicy.attempt());
    }

    @Override
    public void onError(Exception exception, OrderPlaced event, RetryPolicy retryPolicy, CancellationToken token) {
      System.out.println("[ex02] giving up on " + event.id() + ": " + exception.getMessage());
    }

    public static int calls() {
      return CALLS.get();
    }
  }

  /** Never succeeds; its error hook runs once the retries are spent. */
  public static final class BrokenAuditHandler implements EventHandler<OrderPlaced> {
    @Override
    public void handle(OrderPlaced event, RetryPolicy retryPolicy, CancellationToken cancellationToken) {
      throw new IllegalStateException("audit store offline");
    }

    @Override
    public void onError(Exception exception, OrderPlaced event, RetryPolicy retryPolicy, CancellationToken token) {
      System.out.println("[ex02] audit failed for " + event.id() + " after " + retryPolicy.attempt() + " attempts");
    }
  }
}
