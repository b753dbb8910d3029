package com.umitunal.qworker.storage;

import com.umitunal.qworker.core.QueueMetrics;
import com.umitunal.qworker.model.QueueRecord;

import java.util.UUID;

/**
 * Helpers shared by the store implementations.
 */
final class Records {

    private Records() {}

    /**
     * Random 32-character hex record id.
     */
    static String newId() {
        UUID uuid = UUID.randomUUID();
        return String.format("%016x%016x", uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
    }

    static void requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }

    static QueueMetrics metricsOf(Iterable<QueueRecord> records, long now) {
        long high = 0;
        long normal = 0;
        long low = 0;
        long delayed = 0;
        long processing = 0;
        long failed = 0;

        for (QueueRecord record : records) {
            switch (record.getStatus()) {
                case QUEUED -> {
                    if (record.isDelayed(now)) {
                        delayed++;
                    } else {
                        switch (record.getPriority()) {
                            case HIGH -> high++;
                            case DEFAULT -> normal++;
                            case LOW -> low++;
                        }
                    }
                }
                case PROCESSING -> processing++;
                case FAILED -> failed++;
            }
        }

        return new QueueMetrics(high, normal, low, delayed, processing, failed);
    }
}
