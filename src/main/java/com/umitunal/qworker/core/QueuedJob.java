package com.umitunal.qworker.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A record claimed from the queue by {@link QueueStore#pop(long)}.
 *
 * <p>The caller owns the record exclusively until it completes, retries or
 * fails it.
 */
public final class QueuedJob {
    private final String id;
    private final byte[] serializedJob;
    private final Priority priority;

    public QueuedJob(String id, byte[] serializedJob, Priority priority) {
        this.id = Objects.requireNonNull(id, "id");
        this.serializedJob = Objects.requireNonNull(serializedJob, "serializedJob");
        this.priority = Objects.requireNonNull(priority, "priority");
    }

    public String getId() { return id; }
    public byte[] getSerializedJob() { return serializedJob; }
    public Priority getPriority() { return priority; }

    @Override
    public String toString() {
        return String.format("QueuedJob{id='%s', priority=%s, job=%s}",
                id, priority, new String(serializedJob, StandardCharsets.UTF_8));
    }
}
