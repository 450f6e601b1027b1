package com.pipebroker.examples.steps;

import com.pipebroker.core.PipelineRunContext;

import java.time.Instant;

public final class GreetingSteps {
  private GreetingSteps() {}

  public record Greeting(String text) {}
  public record Echo(String text) {}
  public record Stamped(String text, Instant at) {}

  public static void echo(Greeting greeting, PipelineRunContext ctx) {
    ctx.set(new Echo(greeting.text()));
  }

  public static void appendTimestamp(Echo echo, PipelineRunContext ctx) {
    ctx.set(new Stamped(echo.text(), Instant.now()));
  }
}
