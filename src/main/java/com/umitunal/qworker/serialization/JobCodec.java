package com.umitunal.qworker.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.JobDeserializationException;
import com.umitunal.qworker.core.JobValidationException;
import com.umitunal.qworker.registry.JobFactory;
import com.umitunal.qworker.registry.JobRegistry;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;

/**
 * JSON codec for jobs using Jackson.
 *
 * <p>Decoding goes through the {@link JobRegistry} factory for the stored name,
 * so payload validation runs again on the way out of the store. Anything that
 * prevents rebuilding the exact job raises {@link JobDeserializationException}.
 */
public class JobCodec {
    private final JobRegistry registry;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JobCodec(JobRegistry registry) {
        this(registry, createDefaultMapper(), Clock.systemUTC());
    }

    public JobCodec(JobRegistry registry, ObjectMapper mapper, Clock clock) {
        this.registry = registry;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Encode a job for storage.
     */
    public byte[] encode(Job job) {
        JobEnvelope envelope = new JobEnvelope();
        envelope.name = job.getName();
        envelope.payload = job.getPayload();
        envelope.maxAttempts = job.getMaxAttempts();
        envelope.retryDelay = job.getRetryDelay();
        envelope.attempts = job.getAttempts();
        envelope.createdAt = clock.instant().toString();

        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize job " + job.getName() + " to JSON", e);
        }
    }

    /**
     * Decode a stored job.
     *
     * @throws JobDeserializationException if the data is corrupt or names an unknown job
     */
    public Job decode(byte[] bytes) {
        JobEnvelope envelope;
        try {
            envelope = mapper.readValue(bytes, JobEnvelope.class);
        } catch (IOException e) {
            throw new JobDeserializationException("Malformed job data: " + e.getMessage(), e);
        }
        if (envelope == null || envelope.name == null || envelope.name.isBlank()) {
            throw new JobDeserializationException("Job data has no name");
        }

        JobFactory factory = registry.lookup(envelope.name)
                .orElseThrow(() -> new JobDeserializationException("Job type not registered: " + envelope.name));

        Job job;
        String builtName;
        try {
            job = factory.create(envelope.payload != null ? envelope.payload : new LinkedHashMap<>());
            builtName = job != null ? job.getName() : null;
        } catch (JobValidationException e) {
            throw new JobDeserializationException("Stored payload rejected by " + envelope.name + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new JobDeserializationException("Factory for " + envelope.name + " failed: " + describe(e), e);
        }
        if (job == null || !envelope.name.equals(builtName)) {
            throw new JobDeserializationException("Factory for " + envelope.name + " produced "
                    + (job == null ? "no job" : "job " + builtName));
        }

        try {
            job.setAttempts(envelope.attempts != null ? envelope.attempts : 0);
            if (envelope.maxAttempts != null) {
                job.setMaxAttempts(envelope.maxAttempts);
            }
            if (envelope.retryDelay != null) {
                job.setRetryDelay(envelope.retryDelay);
            }
        } catch (RuntimeException e) {
            throw new JobDeserializationException("Invalid retry state for " + envelope.name + ": " + describe(e), e);
        }
        return job;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        return mapper;
    }
}
