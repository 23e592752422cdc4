package com.umitunal.leasejob.config;

/**
 * Configuration for the RocksDB instance backing the job collection.
 */
public class StorageConfig {
    public static final String DEFAULT_COLLECTION_NAME = "scheduledJobs";

    private final String dataDirectory;
    private final String collectionName;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.collectionName = builder.collectionName;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
    }

    public String getDataDirectory() { return dataDirectory; }
    public String getCollectionName() { return collectionName; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private String collectionName = DEFAULT_COLLECTION_NAME;
        private boolean durableWrites = false;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;

        private Builder(String dataDirectory) {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be blank");
            }
            this.dataDirectory = dataDirectory;
        }

        /**
         * Name of the column family holding job documents.
         * Default: scheduledJobs
         */
        public Builder withCollectionName(String collectionName) {
            if (collectionName == null || collectionName.isBlank()) {
                throw new IllegalArgumentException("collectionName must not be blank");
            }
            this.collectionName = collectionName;
            return this;
        }

        /**
         * Enable durable writes (fsync on every write).
         * Slower but guarantees a claim survives a machine crash.
         * Default: false
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set maximum number of memory buffers.
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
