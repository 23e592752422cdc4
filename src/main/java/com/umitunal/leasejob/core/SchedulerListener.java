package com.umitunal.leasejob.core;

import java.util.Set;

/**
 * Receives structured scheduler events. All methods default to no-ops.
 * Implementations are called from scheduler threads and must not block.
 */
public interface SchedulerListener {

    default void onStarted(String instanceId, Set<String> jobNames) {}

    default void onStopped(String instanceId) {}

    default void onScheduled(Job<byte[]> job) {}

    default void onCanceled(String jobId, boolean removed) {}

    default void onRescheduled(String jobId, String name, long runAt, boolean updated) {}

    default void onClaimed(Job<byte[]> job) {}

    default void onCompleted(Job<byte[]> job, long durationMillis) {}

    default void onJobFailed(Job<byte[]> job, Throwable error, long durationMillis) {}

    default void onUnknownJob(Job<byte[]> job) {}

    /**
     * A poll tick could not reach the store; the next tick retries.
     */
    default void onPollFailed(Exception error) {}

    /**
     * The finished job's document could not be removed. Its lease expires
     * normally, after which it may run again.
     */
    default void onReleaseFailed(Job<byte[]> job, Exception error) {}
}
