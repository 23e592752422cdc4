package com.umitunal.leasejob.storage;

/**
 * Snapshot of the job collection at one instant.
 */
public class StoreMetrics {
    private final long totalJobs;
    private final long pendingJobs;
    private final long dueJobs;
    private final long leasedJobs;
    private final long expiredLeases;

    public StoreMetrics(long totalJobs, long pendingJobs, long dueJobs, long leasedJobs, long expiredLeases) {
        this.totalJobs = totalJobs;
        this.pendingJobs = pendingJobs;
        this.dueJobs = dueJobs;
        this.leasedJobs = leasedJobs;
        this.expiredLeases = expiredLeases;
    }

    public long getTotalJobs() { return totalJobs; }

    /** Not yet at their run time. */
    public long getPendingJobs() { return pendingJobs; }

    /** Claimable right now. */
    public long getDueJobs() { return dueJobs; }

    /** Under an unexpired lease. */
    public long getLeasedJobs() { return leasedJobs; }

    /** Previously claimed, lease now expired: claimable again. */
    public long getExpiredLeases() { return expiredLeases; }

    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{total=%d, pending=%d, due=%d, leased=%d, expiredLeases=%d}",
            totalJobs, pendingJobs, dueJobs, leasedJobs, expiredLeases
        );
    }
}
