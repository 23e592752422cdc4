package com.umitunal.leasejob.core;

/**
 * Thrown when a job is scheduled before the scheduler has been started.
 */
public class SchedulerNotRunningException extends IllegalStateException {

    public SchedulerNotRunningException() {
        super("Scheduler is not running.");
    }
}
