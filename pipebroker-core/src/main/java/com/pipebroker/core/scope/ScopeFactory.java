package com.pipebroker.core.scope;

@FunctionalInterface
public interface ScopeFactory {
    ServiceScope createScope();
}
