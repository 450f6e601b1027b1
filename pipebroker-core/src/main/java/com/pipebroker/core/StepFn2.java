package com.pipebroker.core;

@FunctionalInterface
public interface StepFn2<A, B> {
    void apply(A a, B b) throws Exception;
}
