package com.umitunal.qworker.model;

import com.umitunal.qworker.core.Priority;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for {@link QueueRecord} using ByteBuffer.
 *
 * Binary format:
 * - id length (4 bytes) + id bytes (UTF-8)
 * - serialized job length (4 bytes) + job bytes
 * - priority ordinal (4 bytes)
 * - sequence (8 bytes)
 * - queuedAt (8 bytes)
 * - availableAt (8 bytes)
 * - status ordinal (4 bytes)
 * - claimedAt (8 bytes)
 * - failedAt (8 bytes)
 * - failureReason length (4 bytes, -1 for null) + reason bytes (UTF-8)
 * - version (8 bytes)
 */
public class QueueRecordSerializer {

    private static final int FIXED_SIZE = 4 + 4 + 4 + 8 + 8 + 8 + 4 + 8 + 8 + 4 + 8;

    public byte[] serialize(QueueRecord record) {
        byte[] idBytes = record.getId().getBytes(UTF_8);
        byte[] jobBytes = record.getSerializedJob();
        byte[] reasonBytes = record.getFailureReason() != null
            ? record.getFailureReason().getBytes(UTF_8)
            : null;

        ByteBuffer buffer = ByteBuffer.allocate(FIXED_SIZE + idBytes.length + jobBytes.length
                + (reasonBytes != null ? reasonBytes.length : 0));

        buffer.putInt(idBytes.length);
        buffer.put(idBytes);

        buffer.putInt(jobBytes.length);
        buffer.put(jobBytes);

        buffer.putInt(record.getPriority().ordinal());
        buffer.putLong(record.getSequence());
        buffer.putLong(record.getQueuedAt());
        buffer.putLong(record.getAvailableAt());
        buffer.putInt(record.getStatus().ordinal());
        buffer.putLong(record.getClaimedAt());
        buffer.putLong(record.getFailedAt());

        if (reasonBytes != null) {
            buffer.putInt(reasonBytes.length);
            buffer.put(reasonBytes);
        } else {
            buffer.putInt(-1);
        }

        buffer.putLong(record.getVersion());

        return buffer.array();
    }

    /**
     * Rebuild a record.
     *
     * @throws IllegalArgumentException if the bytes are truncated or out of range
     */
    public QueueRecord deserialize(byte[] bytes) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);

            String id = new String(readBytes(buffer, buffer.getInt()), UTF_8);
            byte[] job = readBytes(buffer, buffer.getInt());

            Priority priority = Priority.values()[buffer.getInt()];
            long sequence = buffer.getLong();
            long queuedAt = buffer.getLong();
            long availableAt = buffer.getLong();

            QueueRecord record = new QueueRecord(id, job, priority, sequence, queuedAt, availableAt);
            record.setStatus(RecordStatus.values()[buffer.getInt()]);
            record.setClaimedAt(buffer.getLong());
            record.setFailedAt(buffer.getLong());

            int reasonLength = buffer.getInt();
            if (reasonLength >= 0) {
                record.setFailureReason(new String(readBytes(buffer, reasonLength), UTF_8));
            }

            record.setVersion(buffer.getLong());
            return record;
        } catch (BufferUnderflowException | IndexOutOfBoundsException | NegativeArraySizeException e) {
            throw new IllegalArgumentException("Corrupt queue record (" + bytes.length + " bytes)", e);
        }
    }

    private static byte[] readBytes(ByteBuffer buffer, int length) {
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }
}
