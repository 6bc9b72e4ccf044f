package com.naag.docsync.pipeline;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Configured pipelines by name, in configuration order. */
public class PipelineRegistry {

    private final Map<String, PipelineOrchestrator> pipelines = new LinkedHashMap<>();

    public PipelineRegistry(List<PipelineOrchestrator> orchestrators) {
        for (PipelineOrchestrator o : orchestrators) {
            if (pipelines.putIfAbsent(o.name(), o) != null) {
                throw new IllegalArgumentException("Duplicate pipeline name: " + o.name());
            }
        }
    }

    public Optional<PipelineOrchestrator> get(String name) {
        return Optional.ofNullable(name == null ? null : pipelines.get(name));
    }

    public Collection<PipelineOrchestrator> all() {
        return Collections.unmodifiableCollection(pipelines.values());
    }

    public List<String> names() {
        return List.copyOf(pipelines.keySet());
    }
}
