package com.umitunal.qworker.storage;

import com.umitunal.qworker.config.StorageConfig;
import com.umitunal.qworker.core.FailedRecord;
import com.umitunal.qworker.core.Priority;
import com.umitunal.qworker.core.QueueMetrics;
import com.umitunal.qworker.core.QueueStore;
import com.umitunal.qworker.core.QueueStoreException;
import com.umitunal.qworker.core.QueuedJob;
import com.umitunal.qworker.model.QueueRecord;
import com.umitunal.qworker.model.QueueRecordSerializer;
import com.umitunal.qworker.model.RecordStatus;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of QueueStore.
 *
 * <p>Records are keyed by id. A pop scans for the best ready record and claims
 * it in an optimistic transaction that also checks the record version, so
 * concurrent callers sharing this instance never claim the same record twice.
 * RocksDB locks its data directory, which limits a store to one process.
 */
public class RocksQueueStore implements QueueStore {
    private static final Logger log = LoggerFactory.getLogger(RocksQueueStore.class);

    private static final int MAX_CLAIM_CONFLICTS = 16;

    private final OptimisticTransactionDB transactionDB;
    private final QueueRecordSerializer serializer = new QueueRecordSerializer();
    private final Clock clock;
    private final long popPollIntervalMs;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong sequence;
    private final AtomicLong txnConflictCount = new AtomicLong(0);

    public RocksQueueStore(StorageConfig config) {
        this(config, Clock.systemUTC());
    }

    public RocksQueueStore(StorageConfig config, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.popPollIntervalMs = config.getPopPollIntervalMs();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            dbOptions.close();
            blockCache.close();
            bloomFilter.close();
            throw new QueueStoreException("Failed to open queue store at " + config.getDataDirectory(), e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        // ReadOptions for scans - don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        this.sequence = new AtomicLong(highestSequence());
        log.info("Opened queue store: {}", config);
    }

    @Override
    public String push(byte[] serializedJob, Priority priority, long delaySeconds) {
        Objects.requireNonNull(serializedJob, "serializedJob");
        Objects.requireNonNull(priority, "priority");
        Records.requireNonNegative(delaySeconds, "delaySeconds");

        String id = Records.newId();
        long now = clock.millis();
        QueueRecord record = new QueueRecord(id, serializedJob, priority, sequence.incrementAndGet(), now,
                now + TimeUnit.SECONDS.toMillis(delaySeconds));
        try {
            transactionDB.put(writeOpts, key(id), serializer.serialize(record));
        } catch (RocksDBException e) {
            throw new QueueStoreException("Failed to push job", e);
        }
        return id;
    }

    @Override
    public Optional<QueuedJob> pop(long timeoutSeconds) {
        Records.requireNonNegative(timeoutSeconds, "timeoutSeconds");
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);

        while (true) {
            Optional<QueuedJob> claimed = claimNext();
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (claimed.isPresent() || remainingMs <= 0) {
                return claimed;
            }
            try {
                Thread.sleep(Math.min(popPollIntervalMs, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public void complete(String id) {
        try {
            // Removing a missing key is a no-op in RocksDB
            transactionDB.delete(writeOpts, key(id));
        } catch (RocksDBException e) {
            throw new QueueStoreException("Failed to complete job " + id, e);
        }
    }

    @Override
    public void retry(String id, byte[] serializedJob, long delaySeconds) {
        Objects.requireNonNull(serializedJob, "serializedJob");
        Records.requireNonNegative(delaySeconds, "delaySeconds");

        long now = clock.millis();
        upsert(id, serializedJob, record ->
                record.requeue(serializedJob, now + TimeUnit.SECONDS.toMillis(delaySeconds)));
    }

    @Override
    public void fail(String id, byte[] serializedJob, String reason) {
        Objects.requireNonNull(serializedJob, "serializedJob");

        long now = clock.millis();
        upsert(id, serializedJob, record -> record.markFailed(serializedJob, reason, now));
    }

    @Override
    public List<FailedRecord> failedRecords() {
        List<QueueRecord> failed = new ArrayList<>();
        scan(record -> {
            if (record.getStatus() == RecordStatus.FAILED) {
                failed.add(record);
            }
        });
        failed.sort(Comparator.comparingLong(QueueRecord::getFailedAt));

        List<FailedRecord> result = new ArrayList<>(failed.size());
        for (QueueRecord record : failed) {
            result.add(record.toFailedRecord());
        }
        return result;
    }

    @Override
    public long purgeFailed() {
        long purged = 0;

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts);
             final WriteBatch batch = new WriteBatch()) {

            iter.seekToFirst();

            while (iter.isValid()) {
                QueueRecord record = decode(iter.key(), iter.value());

                if (record != null && record.getStatus() == RecordStatus.FAILED) {
                    batch.delete(iter.key());
                    purged++;

                    if (purged % 1000 == 0) {
                        transactionDB.write(writeOpts, batch);
                        batch.clear();
                    }
                }

                iter.next();
            }

            if (batch.count() > 0) {
                transactionDB.write(writeOpts, batch);
            }
        } catch (RocksDBException e) {
            throw new QueueStoreException("Failed to purge failed jobs", e);
        }

        return purged;
    }

    @Override
    public long recoverAbandoned(long olderThanSeconds) {
        Records.requireNonNegative(olderThanSeconds, "olderThanSeconds");
        long now = clock.millis();
        long threshold = TimeUnit.SECONDS.toMillis(olderThanSeconds);

        List<QueueRecord> abandoned = new ArrayList<>();
        scan(record -> {
            if (record.isAbandoned(now, threshold)) {
                abandoned.add(record);
            }
        });

        long recovered = 0;
        for (QueueRecord record : abandoned) {
            // A worker may have resolved the record since the scan; the version check skips it
            boolean updated = updateIfUnchanged(record, current -> current.requeue(current.getSerializedJob(), now));
            if (updated) {
                recovered++;
            }
        }
        return recovered;
    }

    @Override
    public QueueMetrics getMetrics() {
        List<QueueRecord> records = new ArrayList<>();
        scan(records::add);
        return Records.metricsOf(records, clock.millis());
    }

    @Override
    public void clear() {
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts);
             final WriteBatch batch = new WriteBatch()) {

            iter.seekToFirst();
            while (iter.isValid()) {
                batch.delete(iter.key());
                iter.next();
            }
            if (batch.count() > 0) {
                transactionDB.write(writeOpts, batch);
            }
        } catch (RocksDBException e) {
            throw new QueueStoreException("Failed to clear queue store", e);
        }
    }

    /**
     * Number of claims lost to a concurrent writer. Useful for monitoring contention.
     */
    public long getTransactionConflictCount() {
        return txnConflictCount.get();
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        // BlockBasedTableConfig is released with Options
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }

    private Optional<QueuedJob> claimNext() {
        for (int conflicts = 0; conflicts < MAX_CLAIM_CONFLICTS; conflicts++) {
            long now = clock.millis();
            QueueRecord[] best = new QueueRecord[1];
            scan(record -> {
                if (record.isReady(now) && (best[0] == null || QueueRecord.POP_ORDER.compare(record, best[0]) < 0)) {
                    best[0] = record;
                }
            });

            if (best[0] == null) {
                return Optional.empty();
            }

            QueueRecord candidate = best[0];
            boolean claimed = updateIfUnchanged(candidate, current -> current.claim(now));
            if (claimed) {
                candidate.claim(now);
                return Optional.of(candidate.toQueuedJob());
            }
            // Another caller got there first, look for the next candidate
        }
        log.warn("Gave up claiming a job after {} conflicts", MAX_CLAIM_CONFLICTS);
        return Optional.empty();
    }

    /**
     * Apply a change to a stored record only if it still has the version the caller saw.
     *
     * @return true if the change was committed
     */
    private boolean updateIfUnchanged(QueueRecord expected, Consumer<QueueRecord> change) {
        byte[] key = key(expected.getId());

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions readOpts = new ReadOptions()) {
            byte[] currentValue = txn.getForUpdate(readOpts, key, true);

            if (currentValue == null) {
                return false; // Record was removed
            }

            QueueRecord current = serializer.deserialize(currentValue);
            if (current.getVersion() != expected.getVersion() || current.getStatus() != expected.getStatus()) {
                return false;
            }

            change.accept(current);
            txn.put(key, serializer.serialize(current));
            txn.commit();
            return true;

        } catch (RocksDBException e) {
            // Commit conflict - another writer changed the record first
            txnConflictCount.incrementAndGet();
            log.debug("Optimistic update of record {} lost: {}", expected.getId(), e.getMessage());
            return false;
        }
    }

    private void upsert(String id, byte[] serializedJob, Consumer<QueueRecord> change) {
        byte[] key = key(id);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions readOpts = new ReadOptions()) {
            byte[] currentValue = txn.getForUpdate(readOpts, key, true);

            QueueRecord record;
            if (currentValue != null) {
                record = serializer.deserialize(currentValue);
            } else {
                long now = clock.millis();
                record = new QueueRecord(id, serializedJob, Priority.DEFAULT, sequence.incrementAndGet(), now, now);
            }

            change.accept(record);
            txn.put(key, serializer.serialize(record));
            txn.commit();
        } catch (RocksDBException e) {
            throw new QueueStoreException("Failed to update job " + id, e);
        }
    }

    private void scan(Consumer<QueueRecord> visitor) {
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seekToFirst();

            while (iter.isValid()) {
                QueueRecord record = decode(iter.key(), iter.value());
                if (record != null) {
                    visitor.accept(record);
                }
                iter.next();
            }
        }
    }

    private QueueRecord decode(byte[] key, byte[] value) {
        try {
            return serializer.deserialize(value);
        } catch (IllegalArgumentException e) {
            log.error("Skipping unreadable queue record {}: {}", new String(key, UTF_8), e.getMessage());
            return null;
        }
    }

    private long highestSequence() {
        long[] highest = new long[1];
        scan(record -> highest[0] = Math.max(highest[0], record.getSequence()));
        return highest[0];
    }

    private static byte[] key(String id) {
        return id.getBytes(UTF_8);
    }
}
