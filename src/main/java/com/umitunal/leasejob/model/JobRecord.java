package com.umitunal.leasejob.model;

import com.umitunal.leasejob.core.Job;

import java.nio.ByteBuffer;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Stored form of a job: one document in the job collection.
 * The payload is kept exactly as the job kind's codec produced it.
 */
public class JobRecord implements Job<byte[]> {
    private final String id;
    private final long createdAt;

    private String name;
    private byte[] payload;
    private long runAt;
    private Long lockedUntil;
    private String lockedBy;
    private Long lastRunAt;
    private long updatedAt;

    public JobRecord(String id, String name, byte[] payload, long runAt, long createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.runAt = runAt;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public byte[] getPayload() {
        return payload;
    }

    @Override
    public long getRunAt() {
        return runAt;
    }

    @Override
    public Long getLockedUntil() {
        return lockedUntil;
    }

    @Override
    public String getLockedBy() {
        return lockedBy;
    }

    @Override
    public Long getLastRunAt() {
        return lastRunAt;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public long getUpdatedAt() {
        return updatedAt;
    }

    // Package-private setters for deserialization
    void setLockedUntil(Long lockedUntil) {
        this.lockedUntil = lockedUntil;
    }

    void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    void setLastRunAt(Long lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public boolean isDue(long now) {
        return runAt <= now;
    }

    /**
     * True while some worker holds an unexpired lease.
     */
    public boolean isLeaseActive(long now) {
        return lockedUntil != null && lockedUntil > now;
    }

    /**
     * Due and not under an active lease.
     */
    public boolean isClaimable(long now) {
        return isDue(now) && !isLeaseActive(now);
    }

    /**
     * True if the document still carries the lease granted to {@code owner}
     * that expires at {@code until}.
     */
    public boolean isLeasedBy(String owner, long until) {
        return lockedUntil != null && lockedUntil == until && Objects.equals(lockedBy, owner);
    }

    public void lease(String owner, long now, long until) {
        this.lockedBy = owner;
        this.lockedUntil = until;
        this.lastRunAt = now;
        this.updatedAt = now;
    }

    /**
     * Overwrite what and when to run, discarding any lease.
     */
    public void replace(String name, byte[] payload, long runAt, long now) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.runAt = runAt;
        this.lockedUntil = null;
        this.lockedBy = null;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', name='%s', runAt=%d, lockedUntil=%s, lockedBy='%s'}",
                id, name, runAt, lockedUntil, lockedBy);
    }

    /**
     * Serialize to bytes for storage.
     */
    public byte[] serialize() {
        return JobRecordSerializer.serialize(this);
    }

    /**
     * Deserialize from bytes.
     */
    public static JobRecord deserialize(byte[] bytes) {
        return JobRecordSerializer.deserialize(bytes);
    }

    /**
     * Storage key of a job document: the UTF-8 bytes of its id.
     */
    public static byte[] storageKey(String jobId) {
        return jobId.getBytes(UTF_8);
    }

    /**
     * Key of a job in the run-time index: runAt (8 bytes, sign bit flipped so
     * unsigned byte order matches numeric order) followed by the id.
     */
    public static byte[] dueIndexKey(long runAt, String jobId) {
        byte[] jobIdBytes = jobId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(8 + jobIdBytes.length);
        buffer.putLong(runAt ^ Long.MIN_VALUE);
        buffer.put(jobIdBytes);
        return buffer.array();
    }

    public static long runAtOfDueIndexKey(byte[] key) {
        return ByteBuffer.wrap(key, 0, 8).getLong() ^ Long.MIN_VALUE;
    }

    public static String jobIdOfDueIndexKey(byte[] key) {
        return new String(key, 8, key.length - 8, UTF_8);
    }
}
