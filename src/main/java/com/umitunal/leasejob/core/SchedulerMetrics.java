package com.umitunal.leasejob.core;

/**
 * Execution counters of one scheduler instance since it was created.
 */
public class SchedulerMetrics {
    private final long scheduledJobs;
    private final long completedJobs;
    private final long failedJobs;
    private final long unknownJobs;
    private final long pollFailures;
    private final int inFlightJobs;

    public SchedulerMetrics(long scheduledJobs, long completedJobs, long failedJobs,
                            long unknownJobs, long pollFailures, int inFlightJobs) {
        this.scheduledJobs = scheduledJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
        this.unknownJobs = unknownJobs;
        this.pollFailures = pollFailures;
        this.inFlightJobs = inFlightJobs;
    }

    public long getScheduledJobs() { return scheduledJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }
    public long getUnknownJobs() { return unknownJobs; }
    public long getPollFailures() { return pollFailures; }
    public int getInFlightJobs() { return inFlightJobs; }

    @Override
    public String toString() {
        return String.format(
            "SchedulerMetrics{scheduled=%d, completed=%d, failed=%d, unknown=%d, pollFailures=%d, inFlight=%d}",
            scheduledJobs, completedJobs, failedJobs, unknownJobs, pollFailures, inFlightJobs
        );
    }
}
