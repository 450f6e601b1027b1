package com.pipebroker.config;

import com.pipebroker.core.Pipeline;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Pipelines that configuration files may refer to by name. */
public final class PipelineCatalog {
    private final Map<String, Pipeline> pipelines = new ConcurrentHashMap<>();

    /** Registers {@code pipeline} under its own name. */
    public PipelineCatalog register(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "pipeline");
        return register(pipeline.name(), pipeline);
    }

    public PipelineCatalog register(String name, Pipeline pipeline) {
        pipelines.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(pipeline, "pipeline"));
        return this;
    }

    public boolean has(String name) { return pipelines.containsKey(name); }

    public Pipeline get(String name) {
        Pipeline pipeline = pipelines.get(name);
        if (pipeline == null) throw new IllegalArgumentException("Unknown pipeline: " + name);
        return pipeline;
    }
}
