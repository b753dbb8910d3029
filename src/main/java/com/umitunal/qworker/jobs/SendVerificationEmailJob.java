package com.umitunal.qworker.jobs;

import com.umitunal.qworker.core.AbstractJob;
import com.umitunal.qworker.core.JobExecutionException;
import com.umitunal.qworker.core.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sends the email verification token after a user registers, outside the
 * registration request.
 */
public class SendVerificationEmailJob extends AbstractJob {
    private static final Logger log = LoggerFactory.getLogger(SendVerificationEmailJob.class);
    private static final Logger audit = LoggerFactory.getLogger("audit");

    public static final String NAME = "send_verification_email";

    public static final String USER_ID = "user_id";
    public static final String EMAIL = "email";
    public static final String IP_ADDRESS = "ip_address";

    static final int MAX_ATTEMPTS = 3;
    static final long RETRY_DELAY = 120; // 2 minutes between retries

    private final TokenService tokenService;

    public SendVerificationEmailJob(TokenService tokenService, Map<String, Object> payload) {
        super(payload, MAX_ATTEMPTS, RETRY_DELAY, USER_ID, EMAIL);
        this.tokenService = Objects.requireNonNull(tokenService, "tokenService");
    }

    /**
     * Build a job for a freshly registered user.
     *
     * @param ipAddress client address of the registration request, may be null
     */
    public static SendVerificationEmailJob of(TokenService tokenService, String userId, String email, String ipAddress) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(USER_ID, userId);
        payload.put(EMAIL, email);
        if (ipAddress != null) {
            payload.put(IP_ADDRESS, ipAddress);
        }
        return new SendVerificationEmailJob(tokenService, payload);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public JobResult handle() {
        String userId = getString(USER_ID);
        String email = getString(EMAIL);
        int attempt = getAttempts();

        log.info("Processing {}: user_id={}, email={}, attempt={}", NAME, userId, email, attempt);

        try {
            tokenService.createToken(userId, email, getString(IP_ADDRESS));
        } catch (RuntimeException e) {
            log.error("{} failed: user_id={}, email={}, attempt={}, error={}",
                    NAME, userId, email, attempt, e.getMessage());
            return JobResult.retryable(e);
        }

        log.info("Verification email sent: user_id={}, email={}", userId, email);
        return JobResult.success();
    }

    @Override
    public void failed(JobExecutionException error) {
        super.failed(error);

        audit.warn("Verification email permanently failed: user_id={}, email={}, error={}, action_required={}",
                getString(USER_ID), getString(EMAIL), error.getMessage(),
                "Manual email verification or resend needed");
    }
}
