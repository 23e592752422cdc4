package com.umitunal.leasejob.core;

/**
 * Caller-supplied function executed when a job of its kind is claimed.
 * Returning normally counts as success; throwing counts as failure.
 * Either way the job is removed afterwards.
 *
 * @param <P> the payload type
 */
@FunctionalInterface
public interface JobHandler<P> {

    void handle(Job<P> job) throws Exception;
}
