package com.umitunal.leasejob.core;

/**
 * A scheduled one-shot unit of work as seen by a job handler.
 *
 * @param <P> the type of the job payload
 */
public interface Job<P> {

    /**
     * Gets the unique identifier assigned when the job was scheduled.
     */
    String getId();

    /**
     * Gets the job name, the key into the handler registry.
     */
    String getName();

    /**
     * Gets the job payload.
     */
    P getPayload();

    /**
     * Gets the time before which the job must not run, in milliseconds since epoch.
     */
    long getRunAt();

    /**
     * Gets the lease expiry, or null if the job is not leased.
     */
    Long getLockedUntil();

    /**
     * Gets the id of the scheduler instance holding the lease, or null.
     */
    String getLockedBy();

    /**
     * Gets the start time of the most recent execution attempt, or null.
     */
    Long getLastRunAt();

    long getCreatedAt();

    long getUpdatedAt();
}
