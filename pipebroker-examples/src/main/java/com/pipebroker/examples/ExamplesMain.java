package com.pipebroker.examples;

public final class ExamplesMain {
  public static void main(String[] args) throws Exception {
    System.out.println("== Pipeline Broker Examples ==");
    Example01HelloPipeline.run();
    Example02RetryingHandler.run();
    Example03DynamicHandlers.run();
    Example04LoadFromJsonConfig.run();
    System.out.println("-- done --");
  }
}
