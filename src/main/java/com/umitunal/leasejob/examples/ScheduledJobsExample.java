package com.umitunal.leasejob.examples;

import com.umitunal.leasejob.config.SchedulerConfig;
import com.umitunal.leasejob.config.StorageConfig;
import com.umitunal.leasejob.core.JobHandlers;
import com.umitunal.leasejob.core.JobKind;
import com.umitunal.leasejob.core.JobScheduler;
import com.umitunal.leasejob.core.JobSpec;
import com.umitunal.leasejob.scheduler.LeaseJobScheduler;
import com.umitunal.leasejob.storage.JobStore;
import com.umitunal.leasejob.storage.RocksJobStore;

/**
 * Schedules a single delayed job and lets the scheduler run it.
 */
public class ScheduledJobsExample {

    public static class Message {
        public String message;

        public Message() {
        }

        public Message(String message) {
            this.message = message;
        }
    }

    static final JobKind<Message> TEST = JobKind.json("test", Message.class);

    public static void main(String[] args) throws Exception {
        System.out.println("=== Scheduled Jobs Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/leasejob-scheduled").build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .processEvery(100)
                .defaultConcurrency(1)
                .maxConcurrency(1)
                .defaultLockLimit(1)
                .lockLimit(1)
                .defaultLockLifetime(10_000)
                .build();

        try (JobStore store = new RocksJobStore(storage);
             JobScheduler scheduler = LeaseJobScheduler.builder(store, config).build()) {

            scheduler.start(JobHandlers.builder()
                    .register(TEST, job -> System.out.println("[test] " + job.getPayload().message))
                    .build());

            String jobId = scheduler.schedule(JobSpec.of(TEST,
                    System.currentTimeMillis() + 500,
                    new Message("hello from the scheduled jobs example")));
            System.out.println("Scheduled job " + jobId);

            Thread.sleep(2000);

            System.out.println("\n" + scheduler.getMetrics());
            System.out.println(store.getMetrics());
        }
    }
}
