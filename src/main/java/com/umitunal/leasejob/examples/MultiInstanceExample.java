package com.umitunal.leasejob.examples;

import com.umitunal.leasejob.config.SchedulerConfig;
import com.umitunal.leasejob.config.StorageConfig;
import com.umitunal.leasejob.core.JobHandlers;
import com.umitunal.leasejob.core.JobKind;
import com.umitunal.leasejob.core.JobSpec;
import com.umitunal.leasejob.scheduler.LeaseJobScheduler;
import com.umitunal.leasejob.storage.RocksJobStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Three scheduler instances share one job collection; every job runs once.
 */
public class MultiInstanceExample {

    static final JobKind<String> REPORT = JobKind.text("report").withConcurrency(2);

    public static void main(String[] args) throws Exception {
        System.out.println("=== Multi Instance Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/leasejob-multi").build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .processEvery(50)
                .defaultConcurrency(2)
                .maxConcurrency(4)
                .defaultLockLimit(2)
                .lockLimit(4)
                .defaultLockLifetime(5_000)
                .build();

        Map<String, AtomicInteger> runsPerInstance = new ConcurrentHashMap<>();

        try (RocksJobStore store = new RocksJobStore(storage)) {
            LeaseJobScheduler[] schedulers = new LeaseJobScheduler[3];

            for (int i = 0; i < schedulers.length; i++) {
                String instanceId = "instance-" + (i + 1);
                schedulers[i] = LeaseJobScheduler.builder(store, config)
                        .withInstanceId(instanceId)
                        .build();
                schedulers[i].start(JobHandlers.builder()
                        .register(REPORT, job -> {
                            runsPerInstance.computeIfAbsent(instanceId, k -> new AtomicInteger()).incrementAndGet();
                            Thread.sleep(100); // Simulate work
                        })
                        .build());
            }

            long now = System.currentTimeMillis();
            for (int i = 1; i <= 24; i++) {
                schedulers[i % schedulers.length].schedule(JobSpec.of(REPORT, now, "report #" + i));
            }
            System.out.println("Scheduled 24 jobs");

            Thread.sleep(3000);

            for (LeaseJobScheduler scheduler : schedulers) {
                scheduler.stop();
            }

            runsPerInstance.forEach((instance, runs) -> System.out.println(instance + " ran " + runs.get() + " job(s)"));
            System.out.println("\nCommit conflicts: " + store.getTransactionConflictCount());
            System.out.println(store.getMetrics());
        }
    }
}
