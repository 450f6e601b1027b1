package com.pipebroker.core;

@FunctionalInterface
public interface StepFn1<A> {
    void apply(A a) throws Exception;
}
