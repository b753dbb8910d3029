package com.umitunal.qworker.storage;

import com.umitunal.qworker.core.FailedRecord;
import com.umitunal.qworker.core.Priority;
import com.umitunal.qworker.core.QueueMetrics;
import com.umitunal.qworker.core.QueueStore;
import com.umitunal.qworker.core.QueueStoreException;
import com.umitunal.qworker.core.QueuedJob;
import com.umitunal.qworker.model.QueueRecord;
import com.umitunal.qworker.model.RecordStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local queue store guarded by a single lock.
 *
 * <p>Every operation runs under the lock, so a record is claimed by exactly
 * one caller. Not durable: contents are lost when the process exits.
 */
public class InMemoryQueueStore implements QueueStore {
    private final Clock clock;
    private final Map<String, QueueRecord> records = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private long sequence;
    private boolean closed;

    public InMemoryQueueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryQueueStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String push(byte[] serializedJob, Priority priority, long delaySeconds) {
        Objects.requireNonNull(serializedJob, "serializedJob");
        Objects.requireNonNull(priority, "priority");
        Records.requireNonNegative(delaySeconds, "delaySeconds");

        lock.lock();
        try {
            ensureOpen();
            String id = Records.newId();
            long now = clock.millis();
            records.put(id, new QueueRecord(id, serializedJob, priority, ++sequence, now,
                    now + TimeUnit.SECONDS.toMillis(delaySeconds)));
            changed.signalAll();
            return id;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<QueuedJob> pop(long timeoutSeconds) {
        Records.requireNonNegative(timeoutSeconds, "timeoutSeconds");
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);

        lock.lock();
        try {
            while (true) {
                ensureOpen();
                long now = clock.millis();

                QueueRecord next = records.values().stream()
                        .filter(record -> record.isReady(now))
                        .min(QueueRecord.POP_ORDER)
                        .orElse(null);
                if (next != null) {
                    next.claim(now);
                    return Optional.of(next.toQueuedJob());
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }

                // Wake up no later than the next delayed record becomes available
                long wait = records.values().stream()
                        .filter(record -> record.isDelayed(now))
                        .mapToLong(record -> TimeUnit.MILLISECONDS.toNanos(record.getAvailableAt() - now))
                        .min()
                        .orElse(remaining);
                changed.awaitNanos(Math.max(1, Math.min(wait, remaining)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void complete(String id) {
        lock.lock();
        try {
            ensureOpen();
            records.remove(id);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void retry(String id, byte[] serializedJob, long delaySeconds) {
        Objects.requireNonNull(serializedJob, "serializedJob");
        Records.requireNonNegative(delaySeconds, "delaySeconds");

        lock.lock();
        try {
            ensureOpen();
            long now = clock.millis();
            QueueRecord record = records.computeIfAbsent(id,
                    key -> new QueueRecord(key, serializedJob, Priority.DEFAULT, ++sequence, now, now));
            record.requeue(serializedJob, now + TimeUnit.SECONDS.toMillis(delaySeconds));
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void fail(String id, byte[] serializedJob, String reason) {
        Objects.requireNonNull(serializedJob, "serializedJob");

        lock.lock();
        try {
            ensureOpen();
            long now = clock.millis();
            QueueRecord record = records.computeIfAbsent(id,
                    key -> new QueueRecord(key, serializedJob, Priority.DEFAULT, ++sequence, now, now));
            record.markFailed(serializedJob, reason, now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<FailedRecord> failedRecords() {
        lock.lock();
        try {
            ensureOpen();
            List<FailedRecord> failed = new ArrayList<>();
            records.values().stream()
                    .filter(record -> record.getStatus() == RecordStatus.FAILED)
                    .sorted(Comparator.comparingLong(QueueRecord::getFailedAt))
                    .forEach(record -> failed.add(record.toFailedRecord()));
            return failed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long purgeFailed() {
        lock.lock();
        try {
            ensureOpen();
            long purged = 0;
            Iterator<QueueRecord> iter = records.values().iterator();
            while (iter.hasNext()) {
                if (iter.next().getStatus() == RecordStatus.FAILED) {
                    iter.remove();
                    purged++;
                }
            }
            return purged;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long recoverAbandoned(long olderThanSeconds) {
        Records.requireNonNegative(olderThanSeconds, "olderThanSeconds");

        lock.lock();
        try {
            ensureOpen();
            long now = clock.millis();
            long threshold = TimeUnit.SECONDS.toMillis(olderThanSeconds);
            long recovered = 0;
            for (QueueRecord record : records.values()) {
                if (record.isAbandoned(now, threshold)) {
                    record.requeue(record.getSerializedJob(), now);
                    recovered++;
                }
            }
            if (recovered > 0) {
                changed.signalAll();
            }
            return recovered;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueMetrics getMetrics() {
        lock.lock();
        try {
            ensureOpen();
            return Records.metricsOf(records.values(), clock.millis());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            ensureOpen();
            records.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new QueueStoreException("Queue store is closed");
        }
    }
}
