package com.umitunal.leasejob.storage;

import com.umitunal.leasejob.config.StorageConfig;
import com.umitunal.leasejob.model.JobIds;
import com.umitunal.leasejob.model.JobRecord;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed job collection. Documents live in one column family named
 * after the collection and are keyed by job id. A second column family,
 * {@code <collection>.runAt}, indexes every document by run time so a claim
 * pass only visits jobs that are already due.
 * <p>
 * Every document mutation runs in an optimistic transaction: the document is
 * read with {@code getForUpdate}, checked, written and committed. If another
 * writer touched the document in between, the commit fails and the change is
 * either abandoned (claims) or retried from a fresh read (replace, delete).
 * One store instance may be shared by any number of schedulers in the process.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);
    private static final int MAX_CONFLICT_RETRIES = 16;
    private static final String DUE_INDEX_SUFFIX = ".runAt";
    private static final byte[] EMPTY = new byte[0];

    private final OptimisticTransactionDB transactionDB;
    private final List<ColumnFamilyHandle> columnFamilies;
    private final ColumnFamilyHandle jobs;
    private final ColumnFamilyHandle dueIndex;
    private final String collectionName;
    private final Clock clock;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions txnReadOpts;
    private final ReadOptions scanReadOpts;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong txnConflictCount = new AtomicLong(0);
    private final AtomicLong examinedCount = new AtomicLong(0);
    private final Set<String> unreadableIds = ConcurrentHashMap.newKeySet();

    public RocksJobStore(StorageConfig config) throws RocksDBException {
        this(config, Clock.systemUTC());
    }

    public RocksJobStore(StorageConfig config, Clock clock) throws RocksDBException {
        this.collectionName = config.getCollectionName();
        this.clock = clock;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(32 * 1024 * 1024); // 32MB cache
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads());

        List<byte[]> existing = existingColumnFamilies(config);
        byte[] collectionKey = collectionName.getBytes(UTF_8);
        byte[] indexKey = (collectionName + DUE_INDEX_SUFFIX).getBytes(UTF_8);
        boolean indexExisted = contains(existing, indexKey);

        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions));
        for (byte[] name : existing) {
            descriptors.add(new ColumnFamilyDescriptor(name, cfOptions));
        }
        if (!contains(existing, collectionKey)) {
            descriptors.add(new ColumnFamilyDescriptor(collectionKey, cfOptions));
        }
        if (!indexExisted) {
            descriptors.add(new ColumnFamilyDescriptor(indexKey, cfOptions));
        }

        this.columnFamilies = new ArrayList<>();
        this.transactionDB = OptimisticTransactionDB.open(
                dbOptions, config.getDataDirectory(), descriptors, columnFamilies);

        this.jobs = handleFor(descriptors, collectionKey);
        this.dueIndex = handleFor(descriptors, indexKey);

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        // conflicts are checked against the snapshot taken when the transaction begins
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.txnReadOpts = new ReadOptions();

        // scans only pick candidates; they don't need to pollute the cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        if (!indexExisted) {
            rebuildDueIndex();
        }
    }

    @Override
    public JobRecord insert(String name, byte[] payload, long runAt) throws RocksDBException {
        long now = clock.millis();
        JobRecord record = new JobRecord(JobIds.next(now), name, payload, runAt, now);
        byte[] key = JobRecord.storageKey(record.getId());

        return inTransaction(key, (txn, current) -> {
            txn.put(jobs, key, record.serialize());
            txn.put(dueIndex, JobRecord.dueIndexKey(runAt, record.getId()), EMPTY);
            return record;
        });
    }

    @Override
    public List<JobRecord> claimDue(ClaimRequest request) throws RocksDBException {
        List<JobRecord> claimed = new ArrayList<>();
        Map<String, Integer> claimedPerName = new HashMap<>();

        if (request.getGlobalLimit() <= 0) {
            return claimed;
        }

        try (final RocksIterator iter = transactionDB.newIterator(dueIndex, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid() && claimed.size() < request.getGlobalLimit(); iter.next()) {
                byte[] indexKey = iter.key();

                // index is ordered by run time: everything from here on is not due yet
                if (JobRecord.runAtOfDueIndexKey(indexKey) > request.getNow()) {
                    break;
                }

                String jobId = JobRecord.jobIdOfDueIndexKey(indexKey);
                if (request.getExcludedIds().contains(jobId)) {
                    continue;
                }

                byte[] key = JobRecord.storageKey(jobId);
                JobRecord candidate = decode(jobId, transactionDB.get(jobs, scanReadOpts, key));
                if (candidate == null) {
                    continue;
                }
                examinedCount.incrementAndGet();

                String name = candidate.getName();
                if (candidate.isClaimable(request.getNow())
                        && claimedPerName.getOrDefault(name, 0) < request.limitFor(name)) {

                    JobRecord leased = tryClaim(key, request);
                    if (leased != null) {
                        claimed.add(leased);
                        claimedPerName.merge(leased.getName(), 1, Integer::sum);
                    }
                }
            }

            iter.status();
        }

        return claimed;
    }

    @Override
    public boolean replace(String jobId, String name, byte[] payload, long runAt) throws RocksDBException {
        byte[] key = JobRecord.storageKey(jobId);

        return inTransaction(key, (txn, current) -> {
            if (current == null) {
                return false;
            }
            JobRecord record = JobRecord.deserialize(current);
            txn.delete(dueIndex, JobRecord.dueIndexKey(record.getRunAt(), jobId));
            record.replace(name, payload, runAt, clock.millis());
            txn.put(jobs, key, record.serialize());
            txn.put(dueIndex, JobRecord.dueIndexKey(runAt, jobId), EMPTY);
            return true;
        });
    }

    @Override
    public boolean deleteById(String jobId) throws RocksDBException {
        byte[] key = JobRecord.storageKey(jobId);

        return inTransaction(key, (txn, current) -> {
            if (current == null) {
                return false;
            }
            remove(txn, jobId, current);
            return true;
        });
    }

    @Override
    public boolean releaseClaim(String jobId, String owner, long lockedUntil) throws RocksDBException {
        byte[] key = JobRecord.storageKey(jobId);

        return inTransaction(key, (txn, current) -> {
            if (current == null || !JobRecord.deserialize(current).isLeasedBy(owner, lockedUntil)) {
                return false;
            }
            remove(txn, jobId, current);
            return true;
        });
    }

    @Override
    public Optional<JobRecord> findById(String jobId) throws RocksDBException {
        byte[] value = transactionDB.get(jobs, txnReadOpts, JobRecord.storageKey(jobId));
        return value == null ? Optional.empty() : Optional.of(JobRecord.deserialize(value));
    }

    @Override
    public List<JobRecord> findAll() throws RocksDBException {
        List<JobRecord> records = new ArrayList<>();

        try (final RocksIterator iter = transactionDB.newIterator(jobs, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                JobRecord record = decode(new String(iter.key(), UTF_8), iter.value());
                if (record != null) {
                    records.add(record);
                }
            }
            iter.status();
        }

        return records;
    }

    @Override
    public StoreMetrics getMetrics() throws RocksDBException {
        long now = clock.millis();
        long total = 0;
        long pending = 0;
        long due = 0;
        long leased = 0;
        long expired = 0;

        for (JobRecord record : findAll()) {
            total++;
            if (record.isLeaseActive(now)) {
                leased++;
            } else if (!record.isDue(now)) {
                pending++;
            } else {
                due++;
                if (record.getLockedUntil() != null) {
                    expired++;
                }
            }
        }

        return new StoreMetrics(total, pending, due, leased, expired);
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Number of commits that lost to a concurrent writer.
     * Useful for monitoring contention between schedulers.
     */
    public long getTransactionConflictCount() {
        return txnConflictCount.get();
    }

    /**
     * Number of documents read by claim passes. Only due jobs are ever read.
     */
    public long getExaminedCount() {
        return examinedCount.get();
    }

    /**
     * Ids of documents that could not be decoded and are skipped by claims.
     */
    public Set<String> getUnreadableIds() {
        return Set.copyOf(unreadableIds);
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (txnReadOpts != null) {
            txnReadOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        for (ColumnFamilyHandle handle : columnFamilies) {
            handle.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        if (cfOptions != null) {
            cfOptions.close();
        }
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }

    /**
     * Lease one candidate: re-read it inside the transaction and swap only if
     * it is still claimable. Returns null when the job is gone, was leased in
     * the meantime, or the commit lost to a concurrent writer.
     */
    private JobRecord tryClaim(byte[] key, ClaimRequest request) throws RocksDBException {
        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            byte[] currentValue = txn.getForUpdate(txnReadOpts, jobs, key, true);

            if (currentValue == null) {
                return null;
            }

            JobRecord current = JobRecord.deserialize(currentValue);
            if (!current.isClaimable(request.getNow())) {
                return null;
            }

            current.lease(request.getOwner(), request.getNow(), request.getLockedUntil());
            txn.put(jobs, key, current.serialize());
            txn.commit();

            return current;
        } catch (RocksDBException e) {
            if (isConflict(e)) {
                txnConflictCount.incrementAndGet();
                return null;
            }
            throw e;
        }
    }

    private <R> R inTransaction(byte[] key, DocumentUpdate<R> update) throws RocksDBException {
        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                byte[] current = txn.getForUpdate(txnReadOpts, jobs, key, true);
                R result = update.apply(txn, current);
                txn.commit();
                return result;
            } catch (RocksDBException e) {
                if (!isConflict(e) || attempt >= MAX_CONFLICT_RETRIES) {
                    throw e;
                }
                txnConflictCount.incrementAndGet();
            }
        }
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private void remove(Transaction txn, String jobId, byte[] current) throws RocksDBException {
        txn.delete(jobs, JobRecord.storageKey(jobId));
        JobRecord record = decode(jobId, current);
        if (record != null) {
            txn.delete(dueIndex, JobRecord.dueIndexKey(record.getRunAt(), jobId));
        }
    }

    /**
     * Decode a stored document, or report it and return null if it is not
     * readable. Returns null for a missing document.
     */
    private JobRecord decode(String jobId, byte[] value) {
        if (value == null) {
            return null;
        }
        try {
            return JobRecord.deserialize(value);
        } catch (IllegalArgumentException e) {
            if (unreadableIds.add(jobId)) {
                log.warn("Skipping unreadable job document {} in {}: {}", jobId, collectionName, e.getMessage());
            }
            return null;
        }
    }

    private void rebuildDueIndex() throws RocksDBException {
        int indexed = 0;
        try (final RocksIterator iter = transactionDB.newIterator(jobs, scanReadOpts);
             final WriteBatch batch = new WriteBatch()) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                JobRecord record = decode(new String(iter.key(), UTF_8), iter.value());
                if (record != null) {
                    batch.put(dueIndex, JobRecord.dueIndexKey(record.getRunAt(), record.getId()), EMPTY);
                    indexed++;
                }
            }
            iter.status();
            transactionDB.write(writeOpts, batch);
        }
        if (indexed > 0) {
            log.info("Indexed {} existing job(s) in {} by run time", indexed, collectionName);
        }
    }

    /**
     * Existing column families must all be opened, so reopening a database
     * that holds other collections lists them first.
     */
    private static List<byte[]> existingColumnFamilies(StorageConfig config) throws RocksDBException {
        List<byte[]> names = new ArrayList<>();

        if (Files.exists(Path.of(config.getDataDirectory(), "CURRENT"))) {
            try (Options options = new Options()) {
                for (byte[] existing : RocksDB.listColumnFamilies(options, config.getDataDirectory())) {
                    if (!Arrays.equals(existing, RocksDB.DEFAULT_COLUMN_FAMILY)) {
                        names.add(existing);
                    }
                }
            }
        }
        return names;
    }

    private static boolean contains(List<byte[]> names, byte[] name) {
        return names.stream().anyMatch(candidate -> Arrays.equals(candidate, name));
    }

    private ColumnFamilyHandle handleFor(List<ColumnFamilyDescriptor> descriptors, byte[] name) {
        for (int i = 0; i < descriptors.size(); i++) {
            if (Arrays.equals(descriptors.get(i).getName(), name)) {
                return columnFamilies.get(i);
            }
        }
        throw new IllegalStateException("Column family not opened: " + new String(name, UTF_8));
    }

    @FunctionalInterface
    private interface DocumentUpdate<R> {
        R apply(Transaction txn, byte[] current) throws RocksDBException;
    }
}
