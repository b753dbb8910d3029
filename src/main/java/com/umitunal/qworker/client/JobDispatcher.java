package com.umitunal.qworker.client;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.Priority;
import com.umitunal.qworker.core.QueueStore;
import com.umitunal.qworker.registry.JobRegistry;
import com.umitunal.qworker.serialization.JobCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Enqueues jobs for a worker to pick up.
 *
 * <p>Only registered job types are accepted, so nothing reaches the store
 * that a worker could not decode.
 */
public class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final QueueStore store;
    private final JobRegistry registry;
    private final JobCodec codec;

    public JobDispatcher(QueueStore store, JobRegistry registry) {
        this(store, registry, new JobCodec(registry));
    }

    public JobDispatcher(QueueStore store, JobRegistry registry, JobCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Enqueue a job at default priority, available immediately.
     *
     * @return the record id
     */
    public String dispatch(Job job) {
        return dispatch(job, Priority.DEFAULT, 0);
    }

    /**
     * Enqueue a job.
     *
     * @param priority queue priority
     * @param delaySeconds seconds before the job becomes available
     * @return the record id
     * @throws IllegalArgumentException if the job type is not registered
     * @throws com.umitunal.qworker.core.QueueStoreException if the store rejects the write
     */
    public String dispatch(Job job, Priority priority, long delaySeconds) {
        Objects.requireNonNull(job, "job");
        if (!registry.contains(job.getName())) {
            throw new IllegalArgumentException("Job type not registered: " + job.getName());
        }
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds must be >= 0");
        }

        String id = store.push(codec.encode(job), priority, delaySeconds);
        log.info("Job queued: job_id={}, job={}, priority={}, delay={}s",
                id, job.getName(), priority, delaySeconds);
        return id;
    }
}
