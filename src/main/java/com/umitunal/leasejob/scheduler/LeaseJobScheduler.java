package com.umitunal.leasejob.scheduler;

import com.umitunal.leasejob.config.SchedulerConfig;
import com.umitunal.leasejob.core.JobHandlers;
import com.umitunal.leasejob.core.JobScheduler;
import com.umitunal.leasejob.core.JobSpec;
import com.umitunal.leasejob.core.LoggingSchedulerListener;
import com.umitunal.leasejob.core.SchedulerListener;
import com.umitunal.leasejob.core.SchedulerMetrics;
import com.umitunal.leasejob.core.SchedulerNotRunningException;
import com.umitunal.leasejob.lease.LeaseManager;
import com.umitunal.leasejob.model.JobRecord;
import com.umitunal.leasejob.storage.JobStore;
import com.umitunal.leasejob.worker.DispatchLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scheduler for one-shot jobs persisted in a {@link JobStore}.
 * <pre>{@code
 * JobKind<Reminder> remind = JobKind.json("remind", Reminder.class);
 *
 * try (JobStore store = new RocksJobStore(StorageConfig.newBuilder("/var/lib/jobs").build());
 *      JobScheduler scheduler = LeaseJobScheduler.builder(store, config).build()) {
 *
 *     scheduler.start(JobHandlers.builder()
 *             .register(remind, job -> notify(job.getPayload()))
 *             .build());
 *
 *     String id = scheduler.schedule(JobSpec.of(remind, Instant.now().plusSeconds(30), reminder));
 * }
 * }</pre>
 * Instances hold no static state; any number of them may share one store.
 */
public class LeaseJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(LeaseJobScheduler.class);

    private final String instanceId;
    private final JobStore store;
    private final SchedulerListener listener;
    private final DispatchLoop loop;
    private final AtomicLong scheduledCount = new AtomicLong(0);

    private LeaseJobScheduler(Builder builder) {
        this.instanceId = builder.instanceId != null
                ? builder.instanceId
                : "scheduler-" + UUID.randomUUID().toString().substring(0, 8);
        this.store = builder.store;
        this.listener = builder.listener != null ? builder.listener : new LoggingSchedulerListener();

        LeaseManager leaseManager = new LeaseManager(store, builder.config, instanceId, builder.clock);
        this.loop = new DispatchLoop(instanceId, leaseManager, store, builder.config.getProcessEvery(), listener);
    }

    public static Builder builder(JobStore store, SchedulerConfig config) {
        return new Builder(store, config);
    }

    @Override
    public void start(JobHandlers handlers) {
        Objects.requireNonNull(handlers, "handlers must not be null");

        if (loop.start(handlers)) {
            listener.onStarted(instanceId, handlers.names());
        } else {
            log.warn("Scheduler {} is already running; keeping its current handlers", instanceId);
        }
    }

    @Override
    public <P> String schedule(JobSpec<P> spec) throws Exception {
        Objects.requireNonNull(spec, "spec must not be null");
        if (!loop.isRunning()) {
            throw new SchedulerNotRunningException();
        }

        JobRecord record = store.insert(spec.getName(), spec.encodePayload(), spec.getRunAt());
        scheduledCount.incrementAndGet();
        listener.onScheduled(record);
        return record.getId();
    }

    @Override
    public boolean cancel(String jobId) throws Exception {
        Objects.requireNonNull(jobId, "jobId must not be null");

        boolean removed = store.deleteById(jobId);
        listener.onCanceled(jobId, removed);
        return removed;
    }

    @Override
    public <P> boolean reschedule(String jobId, JobSpec<P> spec) throws Exception {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        boolean updated = store.replace(jobId, spec.getName(), spec.encodePayload(), spec.getRunAt());
        listener.onRescheduled(jobId, spec.getName(), spec.getRunAt(), updated);
        return updated;
    }

    @Override
    public void stop() {
        if (loop.stop()) {
            listener.onStopped(instanceId);
        }
    }

    @Override
    public boolean isRunning() {
        return loop.isRunning();
    }

    @Override
    public String getCollectionName() {
        return store.getCollectionName();
    }

    @Override
    public SchedulerMetrics getMetrics() {
        return new SchedulerMetrics(
                scheduledCount.get(),
                loop.getCompletedCount(),
                loop.getFailedCount(),
                loop.getUnknownCount(),
                loop.getPollFailureCount(),
                loop.getInFlightCount());
    }

    /**
     * Id written into the lease of every job this instance claims.
     */
    public String getInstanceId() {
        return instanceId;
    }

    public static class Builder {
        private final JobStore store;
        private final SchedulerConfig config;
        private SchedulerListener listener;
        private Clock clock = Clock.systemUTC();
        private String instanceId;

        private Builder(JobStore store, SchedulerConfig config) {
            this.store = Objects.requireNonNull(store, "store must not be null");
            this.config = Objects.requireNonNull(config, "config must not be null");
        }

        /**
         * Receiver of scheduler events.
         * Default: {@link LoggingSchedulerListener}
         */
        public Builder withListener(SchedulerListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Clock used for due checks and lease expiry.
         * Default: system UTC clock
         */
        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Lease owner id of this instance.
         * Default: random "scheduler-xxxxxxxx"
         */
        public Builder withInstanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public LeaseJobScheduler build() {
            return new LeaseJobScheduler(this);
        }
    }
}
