package com.jobkeeper.core;

import org.quartz.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Explicit mapping from a job name (usually the class name) to a factory for
 * the job. Class-kind definitions can only reference registered names.
 */
public class JobClassRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobClassRegistry.class);

    private final Map<String, Supplier<? extends Job>> factories = new ConcurrentHashMap<>();

    /** Registers {@code factory} under the fully qualified name of {@code type}. */
    public <T extends Job> JobClassRegistry register(Class<T> type, Supplier<T> factory) {
        return register(type.getName(), factory);
    }

    public JobClassRegistry register(String name, Supplier<? extends Job> factory) {
        if (factories.put(name, factory) != null) {
            log.warn("Job class {} registered twice, keeping the latest factory", name);
        }
        return this;
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    /** Creates a new job instance, or returns {@code null} for an unknown name. */
    public Job create(String name) {
        Supplier<? extends Job> f = name == null ? null : factories.get(name);
        return f == null ? null : f.get();
    }

    /** Registered names in alphabetical order. */
    public List<String> names() {
        List<String> names = new ArrayList<>(factories.keySet());
        Collections.sort(names);
        return names;
    }
}
