package com.umitunal.qworker.registry;

/**
 * Service-provider hook for contributing job types to a worker.
 *
 * <p>Implementations are listed in
 * {@code META-INF/services/com.umitunal.qworker.registry.JobModule} and must
 * have a public no-argument constructor.
 */
public interface JobModule {

    void register(JobRegistry registry);
}
