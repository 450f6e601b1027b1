package com.pipebroker.core;

@FunctionalInterface
public interface StepFn4<A, B, C, D> {
    void apply(A a, B b, C c, D d) throws Exception;
}
