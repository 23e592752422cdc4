package com.umitunal.leasejob.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Default listener: writes each scheduler event as a key=value log line.
 */
public class LoggingSchedulerListener implements SchedulerListener {
    private final Logger log;

    public LoggingSchedulerListener() {
        this(LoggerFactory.getLogger("com.umitunal.leasejob.scheduler"));
    }

    public LoggingSchedulerListener(Logger log) {
        this.log = log;
    }

    @Override
    public void onStarted(String instanceId, Set<String> jobNames) {
        log.info("event=started instance={} jobs={}", instanceId, jobNames);
    }

    @Override
    public void onStopped(String instanceId) {
        log.info("event=stopped instance={}", instanceId);
    }

    @Override
    public void onScheduled(Job<byte[]> job) {
        log.debug("event=scheduled id={} name={} runAt={}", job.getId(), job.getName(), job.getRunAt());
    }

    @Override
    public void onCanceled(String jobId, boolean removed) {
        log.debug("event=canceled id={} removed={}", jobId, removed);
    }

    @Override
    public void onRescheduled(String jobId, String name, long runAt, boolean updated) {
        log.debug("event=rescheduled id={} name={} runAt={} updated={}", jobId, name, runAt, updated);
    }

    @Override
    public void onClaimed(Job<byte[]> job) {
        log.debug("event=claimed id={} name={} lockedUntil={}", job.getId(), job.getName(), job.getLockedUntil());
    }

    @Override
    public void onCompleted(Job<byte[]> job, long durationMillis) {
        log.info("event=completed id={} name={} durationMs={}", job.getId(), job.getName(), durationMillis);
    }

    @Override
    public void onJobFailed(Job<byte[]> job, Throwable error, long durationMillis) {
        log.error("event=failed id={} name={} payloadBytes={} durationMs={}",
                job.getId(), job.getName(), job.getPayload().length, durationMillis, error);
    }

    @Override
    public void onUnknownJob(Job<byte[]> job) {
        log.warn("event=unknown_job id={} name={}", job.getId(), job.getName());
    }

    @Override
    public void onPollFailed(Exception error) {
        log.warn("event=poll_failed error={}", error.toString());
    }

    @Override
    public void onReleaseFailed(Job<byte[]> job, Exception error) {
        log.warn("event=release_failed id={} name={} error={}", job.getId(), job.getName(), error.toString());
    }
}
