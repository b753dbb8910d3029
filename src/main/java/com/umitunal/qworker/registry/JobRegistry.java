package com.umitunal.qworker.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps job names to the factories that rebuild them.
 *
 * <p>Names are checked at registration, so a typo or a clash fails at startup
 * rather than when the first record is decoded.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final ConcurrentMap<String, JobFactory> factories = new ConcurrentHashMap<>();

    /**
     * Register a factory for a job name.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public JobRegistry register(String name, JobFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Factory must not be null for job " + name);
        }
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Job already registered: " + name);
        }
        log.debug("Registered job type: name={}", name);
        return this;
    }

    public Optional<JobFactory> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(factories.get(name));
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    /**
     * Registered names, sorted.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * Build a registry from every {@link JobModule} visible to the class loader.
     */
    public static JobRegistry fromModules(ClassLoader classLoader) {
        JobRegistry registry = new JobRegistry();
        for (JobModule module : ServiceLoader.load(JobModule.class, classLoader)) {
            log.info("Loading job module: {}", module.getClass().getName());
            module.register(registry);
        }
        return registry;
    }
}
