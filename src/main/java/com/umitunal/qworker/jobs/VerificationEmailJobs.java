package com.umitunal.qworker.jobs;

import com.umitunal.qworker.registry.JobRegistry;

/**
 * Registers {@link SendVerificationEmailJob} against a token service.
 */
public final class VerificationEmailJobs {

    private VerificationEmailJobs() {}

    public static JobRegistry register(JobRegistry registry, TokenService tokenService) {
        return registry.register(SendVerificationEmailJob.NAME,
                payload -> new SendVerificationEmailJob(tokenService, payload));
    }
}
