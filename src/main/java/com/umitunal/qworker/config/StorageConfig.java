package com.umitunal.qworker.config;

import java.util.Objects;

/**
 * Settings for the RocksDB-backed queue store.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final long blockCacheSizeMB;
    private final long popPollIntervalMs;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
        this.popPollIntervalMs = builder.popPollIntervalMs;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public long getBlockCacheSizeMB() { return blockCacheSizeMB; }
    public long getPopPollIntervalMs() { return popPollIntervalMs; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    @Override
    public String toString() {
        return String.format("StorageConfig{dataDirectory='%s', durableWrites=%s}", dataDirectory, durableWrites);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;
        private long blockCacheSizeMB = 32;
        private long popPollIntervalMs = 100;

        private Builder(String dataDirectory) {
            this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory");
        }

        /**
         * Sync the write-ahead log on every write.
         * Default: true, a popped record must survive a crash.
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Memtable size in MB. Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Maximum number of memtables. Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Background flush and compaction threads. Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        public Builder withBlockCacheSize(long sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        /**
         * How often a waiting pop rescans the store. Default: 100 ms
         */
        public Builder withPopPollInterval(long millis) {
            if (millis <= 0) {
                throw new IllegalArgumentException("popPollInterval must be > 0");
            }
            this.popPollIntervalMs = millis;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
