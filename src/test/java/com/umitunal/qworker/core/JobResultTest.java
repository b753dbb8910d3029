package com.umitunal.qworker.core;

import com.umitunal.qworker.support.ScriptedJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobResultTest {

    @Test
    @DisplayName("Should report success")
    void testSuccess() {
        JobResult result = JobResult.success();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getKind()).isEqualTo(JobResult.Kind.SUCCESS);
        assertThat(result.getMessage()).isNull();
    }

    @Test
    @DisplayName("Should take the message of a retryable cause")
    void testRetryableFromCause() {
        IllegalStateException cause = new IllegalStateException("SMTP unavailable");

        JobResult result = JobResult.retryable(cause);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getKind()).isEqualTo(JobResult.Kind.RETRYABLE);
        assertThat(result.getMessage()).isEqualTo("SMTP unavailable");
        assertThat(result.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("Should fall back to the exception class when the cause has no message")
    void testRetryableWithoutMessage() {
        JobResult result = JobResult.retryable(new NullPointerException());

        assertThat(result.getMessage()).isEqualTo(NullPointerException.class.getName());
    }

    @Test
    @DisplayName("Should mark terminal failures in the execution exception")
    void testTerminalToException() {
        // Given
        Job job = new ScriptedJob(Map.of(ScriptedJob.LABEL, "x"), 3, 0,
                attempt -> JobResult.success(), new ScriptedJob.Recorder());
        job.setAttempts(2);

        // When
        JobExecutionException error = JobExecutionException.from(job, JobResult.terminal("bad address"));

        // Then
        assertThat(error.isTerminal()).isTrue();
        assertThat(error.getJobName()).isEqualTo("scripted");
        assertThat(error.getAttempt()).isEqualTo(2);
        assertThat(error.getMessage()).isEqualTo("bad address");
    }

    @Test
    @DisplayName("Should parse priorities case-insensitively")
    void testPriorityParse() {
        assertThat(Priority.parse("high")).isEqualTo(Priority.HIGH);
        assertThat(Priority.parse("Default")).isEqualTo(Priority.DEFAULT);
        assertThatThrownBy(() -> Priority.parse("urgent")).isInstanceOf(IllegalArgumentException.class);
    }
}
