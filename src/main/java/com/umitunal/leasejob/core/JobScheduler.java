package com.umitunal.leasejob.core;

/**
 * Persistent scheduler for one-shot, timestamp-triggered jobs.
 * <p>
 * Several instances may share one job collection; each due job is run by
 * at most one of them at a time.
 */
public interface JobScheduler extends AutoCloseable {

    /**
     * Register handlers and begin polling for due jobs.
     * Calling this while already running keeps the current registry.
     */
    void start(JobHandlers handlers);

    /**
     * Persist a new job.
     *
     * @return the id of the new job
     * @throws SchedulerNotRunningException if the scheduler has not been started
     */
    <P> String schedule(JobSpec<P> spec) throws Exception;

    /**
     * Delete a job. A handler already running for it is not interrupted.
     *
     * @return true if the job existed and was removed
     */
    boolean cancel(String jobId) throws Exception;

    /**
     * Replace a job's name, payload and run time, and drop any lease on it.
     *
     * @return true if the job existed and was updated
     */
    <P> boolean reschedule(String jobId, JobSpec<P> spec) throws Exception;

    /**
     * Stop polling and wait for running handlers to finish. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Name of the collection holding this scheduler's job documents.
     */
    String getCollectionName();

    SchedulerMetrics getMetrics();

    @Override
    default void close() {
        stop();
    }
}
