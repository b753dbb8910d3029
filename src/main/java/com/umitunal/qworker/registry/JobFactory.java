package com.umitunal.qworker.registry;

import com.umitunal.qworker.core.Job;

import java.util.Map;

/**
 * Builds a job of one type from its payload.
 */
@FunctionalInterface
public interface JobFactory {

    /**
     * Create a job from a payload.
     *
     * @throws com.umitunal.qworker.core.JobValidationException if the payload is invalid
     */
    Job create(Map<String, Object> payload);
}
