package com.umitunal.qworker.model;

import com.umitunal.qworker.core.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class QueueRecordSerializerTest {

    private final QueueRecordSerializer serializer = new QueueRecordSerializer();

    @Test
    @DisplayName("Should serialize and deserialize a queued record")
    void testQueuedRecord() {
        // Given
        long now = System.currentTimeMillis();
        QueueRecord original = new QueueRecord("job-1", "{\"name\":\"x\"}".getBytes(UTF_8),
                Priority.HIGH, 7, now, now + 5000);

        // When
        QueueRecord deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getId()).isEqualTo("job-1");
        assertThat(deserialized.getSerializedJob()).isEqualTo(original.getSerializedJob());
        assertThat(deserialized.getPriority()).isEqualTo(Priority.HIGH);
        assertThat(deserialized.getSequence()).isEqualTo(7);
        assertThat(deserialized.getQueuedAt()).isEqualTo(now);
        assertThat(deserialized.getAvailableAt()).isEqualTo(now + 5000);
        assertThat(deserialized.getStatus()).isEqualTo(RecordStatus.QUEUED);
        assertThat(deserialized.getFailureReason()).isNull();
        assertThat(deserialized.getVersion()).isZero();
    }

    @Test
    @DisplayName("Should preserve failure metadata")
    void testFailedRecord() {
        // Given
        QueueRecord original = new QueueRecord("job-2", new byte[]{1, 2, 3}, Priority.LOW, 1, 100, 100);
        original.claim(200);
        original.markFailed(new byte[]{4, 5}, "Connection timeout ☹", 300);

        // When
        QueueRecord deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getStatus()).isEqualTo(RecordStatus.FAILED);
        assertThat(deserialized.getSerializedJob()).containsExactly(4, 5);
        assertThat(deserialized.getFailureReason()).isEqualTo("Connection timeout ☹");
        assertThat(deserialized.getFailedAt()).isEqualTo(300);
        assertThat(deserialized.getClaimedAt()).isZero();
        assertThat(deserialized.getVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep the claim time of a processing record")
    void testProcessingRecord() {
        QueueRecord original = new QueueRecord("job-3", new byte[0], Priority.DEFAULT, 2, 100, 100);
        original.claim(150);

        QueueRecord deserialized = serializer.deserialize(serializer.serialize(original));

        assertThat(deserialized.getStatus()).isEqualTo(RecordStatus.PROCESSING);
        assertThat(deserialized.getClaimedAt()).isEqualTo(150);
        assertThat(deserialized.getSerializedJob()).isEmpty();
    }

    @Test
    @DisplayName("Should reject truncated data")
    void testTruncated() {
        QueueRecord original = new QueueRecord("job-4", new byte[]{1}, Priority.DEFAULT, 1, 0, 0);
        byte[] truncated = Arrays.copyOf(serializer.serialize(original), 10);

        assertThatThrownBy(() -> serializer.deserialize(truncated))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Corrupt queue record");
    }
}
