package com.umitunal.qworker.jobs;

import com.umitunal.qworker.client.JobDispatcher;
import com.umitunal.qworker.config.WorkerConfig;
import com.umitunal.qworker.core.FailedRecord;
import com.umitunal.qworker.core.JobExecutionException;
import com.umitunal.qworker.core.JobResult;
import com.umitunal.qworker.core.JobValidationException;
import com.umitunal.qworker.core.QueueStore;
import com.umitunal.qworker.registry.JobRegistry;
import com.umitunal.qworker.serialization.JobCodec;
import com.umitunal.qworker.storage.InMemoryQueueStore;
import com.umitunal.qworker.support.MutableClock;
import com.umitunal.qworker.worker.Worker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class SendVerificationEmailJobTest {

    private final List<String> sent = new CopyOnWriteArrayList<>();

    private final TokenService recordingService = (userId, identifier, context) -> {
        sent.add(userId + "|" + identifier + "|" + context);
        return "token-" + userId;
    };

    @Test
    @DisplayName("Should require user id and email")
    void testRequiredFields() {
        assertThatThrownBy(() -> new SendVerificationEmailJob(recordingService, Map.of("user_id", "42")))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("send_verification_email requires email in payload");

        assertThatThrownBy(() -> new SendVerificationEmailJob(recordingService, Map.of()))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("send_verification_email requires user_id, email in payload");
    }

    @Test
    @DisplayName("Should retry three times, two minutes apart")
    void testRetryPolicy() {
        SendVerificationEmailJob job = SendVerificationEmailJob.of(recordingService, "42", "a@example.com", null);

        assertThat(job.getMaxAttempts()).isEqualTo(3);
        assertThat(job.getRetryDelay()).isEqualTo(120);
        assertThat(job.getPayload()).doesNotContainKey(SendVerificationEmailJob.IP_ADDRESS);
    }

    @Test
    @DisplayName("Should send the token with the request address")
    void testHandle() {
        // Given
        SendVerificationEmailJob job = SendVerificationEmailJob.of(recordingService, "42", "a@example.com", "10.0.0.1");

        // When
        JobResult result = job.handle();

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(sent).containsExactly("42|a@example.com|10.0.0.1");
    }

    @Test
    @DisplayName("Should report token service errors as retryable")
    void testHandleFailure() {
        // Given
        TokenService failing = (userId, identifier, context) -> {
            throw new IllegalStateException("mail relay unavailable");
        };
        SendVerificationEmailJob job = SendVerificationEmailJob.of(failing, "42", "a@example.com", null);

        // When
        JobResult result = job.handle();

        // Then
        assertThat(result.getKind()).isEqualTo(JobResult.Kind.RETRYABLE);
        assertThat(result.getMessage()).isEqualTo("mail relay unavailable");
    }

    @Test
    @DisplayName("Should write the audit entry without throwing")
    void testFailedHook() {
        SendVerificationEmailJob job = SendVerificationEmailJob.of(recordingService, "42", "a@example.com", null);

        assertThatCode(() -> job.failed(new JobExecutionException(job.getName(), 3, "boom", null, false)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should fail permanently after three attempts through the worker")
    void testEndToEndFailure() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        TokenService failing = (userId, identifier, context) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("mail relay unavailable");
        };
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        JobRegistry registry = VerificationEmailJobs.register(new JobRegistry(), failing);

        try (QueueStore store = new InMemoryQueueStore(clock)) {
            new JobDispatcher(store, registry).dispatch(
                    SendVerificationEmailJob.of(failing, "42", "a@example.com", "10.0.0.1"));
            Worker worker = new Worker(store, new JobCodec(registry),
                    WorkerConfig.newBuilder("w1").withPopTimeout(0).build(), clock);

            // When
            for (int i = 0; i < 3; i++) {
                assertThat(worker.runOnce()).isTrue();
                clock.advance(Duration.ofSeconds(120));
            }

            // Then
            assertThat(calls.get()).isEqualTo(3);
            assertThat(worker.getRetriedCount()).isEqualTo(2);
            List<FailedRecord> failed = store.failedRecords();
            assertThat(failed).hasSize(1);
            assertThat(failed.get(0).getReason()).isEqualTo("mail relay unavailable");
        }
    }

    @Test
    @DisplayName("Should complete through the worker when the token is sent")
    void testEndToEndSuccess() {
        // Given
        JobRegistry registry = VerificationEmailJobs.register(new JobRegistry(), recordingService);

        try (QueueStore store = new InMemoryQueueStore()) {
            new JobDispatcher(store, registry).dispatch(
                    SendVerificationEmailJob.of(recordingService, "7", "b@example.com", null));
            Worker worker = new Worker(store, new JobCodec(registry),
                    WorkerConfig.newBuilder("w1").withPopTimeout(0).build());

            // When
            worker.runOnce();

            // Then
            assertThat(sent).containsExactly("7|b@example.com|null");
            assertThat(store.getMetrics().getTotalJobs()).isZero();
        }
    }
}
