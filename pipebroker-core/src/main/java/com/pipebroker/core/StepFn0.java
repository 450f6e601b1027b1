package com.pipebroker.core;

@FunctionalInterface
public interface StepFn0 {
    void apply() throws Exception;
}
