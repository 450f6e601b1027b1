package com.pipebroker.core;

@FunctionalInterface
public interface StepFn3<A, B, C> {
    void apply(A a, B b, C c) throws Exception;
}
