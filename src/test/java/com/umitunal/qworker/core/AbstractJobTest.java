package com.umitunal.qworker.core;

import com.umitunal.qworker.support.ScriptedJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AbstractJobTest {

    private final ScriptedJob.Recorder recorder = new ScriptedJob.Recorder();

    private ScriptedJob newJob(Map<String, Object> payload) {
        return new ScriptedJob(payload, 3, 60, attempt -> JobResult.success(), recorder);
    }

    @Test
    @DisplayName("Should reject payload missing a required field")
    void testMissingRequiredField() {
        assertThatThrownBy(() -> newJob(Map.of("other", "x")))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("scripted requires label in payload");
    }

    @Test
    @DisplayName("Should treat null and blank required fields as missing")
    void testBlankRequiredField() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(ScriptedJob.LABEL, null);

        assertThatThrownBy(() -> newJob(payload)).isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> newJob(Map.of(ScriptedJob.LABEL, "  "))).isInstanceOf(JobValidationException.class);
    }

    @Test
    @DisplayName("Should copy payload and expose it read-only")
    void testPayloadIsCopied() {
        // Given
        Map<String, Object> payload = new HashMap<>();
        payload.put(ScriptedJob.LABEL, "a");

        // When
        ScriptedJob job = newJob(payload);
        payload.put(ScriptedJob.LABEL, "changed");

        // Then
        assertThat(job.getPayload()).containsEntry(ScriptedJob.LABEL, "a");
        assertThatThrownBy(() -> job.getPayload().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should start with zero attempts and the configured retry policy")
    void testInitialState() {
        ScriptedJob job = newJob(Map.of(ScriptedJob.LABEL, "a"));

        assertThat(job.getAttempts()).isZero();
        assertThat(job.getMaxAttempts()).isEqualTo(3);
        assertThat(job.getRetryDelay()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should validate retry policy setters")
    void testSetterValidation() {
        ScriptedJob job = newJob(Map.of(ScriptedJob.LABEL, "a"));

        assertThatThrownBy(() -> job.setAttempts(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> job.setMaxAttempts(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> job.setRetryDelay(-5)).isInstanceOf(IllegalArgumentException.class);

        job.setMaxAttempts(1);
        job.setRetryDelay(0);
        assertThat(job.getMaxAttempts()).isEqualTo(1);
        assertThat(job.getRetryDelay()).isZero();
    }

    @Test
    @DisplayName("Should compare jobs by name, payload and retry state")
    void testEquality() {
        ScriptedJob first = newJob(Map.of(ScriptedJob.LABEL, "a"));
        ScriptedJob second = newJob(Map.of(ScriptedJob.LABEL, "a"));

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);

        second.setAttempts(1);
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("Should store payload numbers the way JSON reads them back")
    void testPayloadNumbersNormalized() {
        // Given
        Map<String, Object> payload = new HashMap<>();
        payload.put(ScriptedJob.LABEL, "a");
        payload.put("small", 7L);
        payload.put("large", 5_000_000_000L);
        payload.put("huge", new BigInteger("99999999999999999999"));
        payload.put("ratio", 1.5f);
        payload.put("ids", List.of((short) 1, 2L));

        // When
        ScriptedJob job = newJob(payload);

        // Then
        assertThat(job.getPayload())
                .containsEntry("small", 7)
                .containsEntry("large", 5_000_000_000L)
                .containsEntry("huge", new BigInteger("99999999999999999999"))
                .containsEntry("ratio", 1.5d)
                .containsEntry("ids", List.of(1, 2));
        assertThat(job).isEqualTo(newJob(Map.of(ScriptedJob.LABEL, "a", "small", 7, "large", 5_000_000_000L,
                "huge", new BigInteger("99999999999999999999"), "ratio", 1.5d, "ids", List.of(1, 2))));
    }

    @Test
    @DisplayName("Should reject payload values with no JSON form")
    void testUnsupportedPayloadValue() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(ScriptedJob.LABEL, "a");
        payload.put("blob", new byte[] {1, 2});

        assertThatThrownBy(() -> newJob(payload))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("scripted payload field blob has unsupported type [B");
        assertThatThrownBy(() -> newJob(Map.of(ScriptedJob.LABEL, "a", "score", Double.NaN)))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("score is not a finite number");
    }
}
