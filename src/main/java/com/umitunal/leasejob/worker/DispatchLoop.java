package com.umitunal.leasejob.worker;

import com.umitunal.leasejob.core.JobHandlers;
import com.umitunal.leasejob.core.SchedulerListener;
import com.umitunal.leasejob.lease.LeaseManager;
import com.umitunal.leasejob.model.JobRecord;
import com.umitunal.leasejob.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Timer-driven poll/execute cycle of one scheduler instance.
 * <p>
 * A single timer thread ticks every {@code processEvery} milliseconds with a
 * fixed delay, so ticks never overlap. Each tick claims what the lease
 * manager allows and hands every claimed job to a separate executor; the
 * tick never waits for the jobs it launched. When a handler returns or
 * throws, the job's document is removed. Failed jobs are not retried.
 */
public class DispatchLoop {
    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    // loop whose handler is running on the current thread
    private static final ThreadLocal<DispatchLoop> EXECUTING = new ThreadLocal<>();

    private final String instanceId;
    private final LeaseManager leaseManager;
    private final JobStore store;
    private final SchedulerListener listener;
    private final long processEvery;
    private final InFlightCounters inFlight = new InFlightCounters();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong unknownCount = new AtomicLong(0);
    private final AtomicLong pollFailureCount = new AtomicLong(0);

    private volatile JobHandlers handlers;
    private ScheduledExecutorService timer;
    private ExecutorService executor;

    public DispatchLoop(String instanceId, LeaseManager leaseManager, JobStore store,
                        long processEvery, SchedulerListener listener) {
        this.instanceId = instanceId;
        this.leaseManager = leaseManager;
        this.store = store;
        this.processEvery = processEvery;
        this.listener = listener;
    }

    /**
     * Begin ticking with the given handlers.
     *
     * @return false if the loop was already running; the current handlers are kept
     */
    public synchronized boolean start(JobHandlers handlers) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        this.handlers = handlers;
        this.executor = Executors.newCachedThreadPool(threadFactory("leasejob-job-" + instanceId));
        this.timer = Executors.newSingleThreadScheduledExecutor(threadFactory("leasejob-poll-" + instanceId));
        timer.scheduleWithFixedDelay(this::tick, 0, processEvery, TimeUnit.MILLISECONDS);
        return true;
    }

    /**
     * Stop claiming, then wait for every running execution to finish.
     * Called from one of this loop's own handlers, it stops claiming without
     * waiting for the running executions.
     *
     * @return false if the loop was not running
     */
    public synchronized boolean stop() {
        if (!running.compareAndSet(true, false)) {
            return false;
        }

        // let a tick that is mid-claim hand off its jobs before draining
        timer.shutdown();
        awaitQuietly(timer);

        executor.shutdown();
        if (isHandlerThread()) {
            log.info("Scheduler {} stopped from one of its handlers; {} job(s) finish in the background",
                    instanceId, inFlight.total());
        } else {
            awaitQuietly(executor);
        }

        handlers = null;
        inFlight.clear();
        return true;
    }

    /**
     * Run one claim pass and launch the claimed jobs.
     *
     * @return the number of jobs claimed
     */
    public int pollOnce() throws Exception {
        JobHandlers current = handlers;
        if (current == null || !running.get()) {
            return 0;
        }

        List<JobRecord> claimed = leaseManager.claim(current, inFlight.snapshot());
        for (JobRecord job : claimed) {
            dispatch(job, current);
        }
        return claimed.size();
    }

    public boolean isRunning() { return running.get(); }
    public int getInFlightCount() { return inFlight.total(); }
    public int getInFlightCount(String name) { return inFlight.forName(name); }
    public long getCompletedCount() { return completedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getUnknownCount() { return unknownCount.get(); }
    public long getPollFailureCount() { return pollFailureCount.get(); }

    private void tick() {
        try {
            pollOnce();
        } catch (Exception e) {
            // store unreachable or similar: skip this tick, the next one retries
            pollFailureCount.incrementAndGet();
            notifyListener("onPollFailed", () -> listener.onPollFailed(e));
        }
    }

    private void dispatch(JobRecord job, JobHandlers current) {
        inFlight.begin(job);
        notifyListener("onClaimed", () -> listener.onClaimed(job));
        try {
            executor.execute(() -> execute(job, current));
        } catch (RejectedExecutionException e) {
            // never launched: the lease expires and the job becomes claimable again
            inFlight.end(job);
            log.warn("Scheduler {} could not launch job {}: {}", instanceId, job.getId(), e.getMessage());
        }
    }

    private void execute(JobRecord job, JobHandlers current) {
        long start = System.nanoTime();
        EXECUTING.set(this);
        try {
            Optional<JobHandlers.Registration<?>> registration = current.lookup(job.getName());
            if (registration.isEmpty()) {
                unknownCount.incrementAndGet();
                notifyListener("onUnknownJob", () -> listener.onUnknownJob(job));
                return;
            }

            registration.get().execute(job);
            completedCount.incrementAndGet();
            long elapsed = elapsedMillis(start);
            notifyListener("onCompleted", () -> listener.onCompleted(job, elapsed));
        } catch (Exception e) {
            failedCount.incrementAndGet();
            long elapsed = elapsedMillis(start);
            notifyListener("onJobFailed", () -> listener.onJobFailed(job, e, elapsed));
        } finally {
            EXECUTING.remove();
            release(job);
            inFlight.end(job);
        }
    }

    private void release(JobRecord job) {
        try {
            store.releaseClaim(job.getId(), job.getLockedBy(), job.getLockedUntil());
        } catch (Exception e) {
            notifyListener("onReleaseFailed", () -> listener.onReleaseFailed(job, e));
        }
    }

    /**
     * Listener failures are logged and never reach the loop or the counters.
     */
    private void notifyListener(String event, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("Scheduler {} listener failed on {}", instanceId, event, e);
        }
    }

    private boolean isHandlerThread() {
        return EXECUTING.get() == this;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private void awaitQuietly(ExecutorService service) {
        try {
            while (!service.awaitTermination(processEvery * 10, TimeUnit.MILLISECONDS)) {
                log.info("Scheduler {} waiting for {} running job(s) to finish", instanceId, inFlight.total());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
