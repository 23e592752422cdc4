package com.umitunal.leasejob.lease;

import com.umitunal.leasejob.config.SchedulerConfig;
import com.umitunal.leasejob.core.JobHandlers;
import com.umitunal.leasejob.core.JobKind;
import com.umitunal.leasejob.model.JobRecord;
import com.umitunal.leasejob.storage.ClaimRequest;
import com.umitunal.leasejob.storage.JobStore;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Claims due jobs for one scheduler instance.
 * <p>
 * A lease is only an expiry time written into the job document. There is no
 * heartbeat: when a worker dies its lease runs out and any instance polling
 * the same collection may claim the job again. A live worker that outlasts
 * its lease can therefore race a second claim, so handlers that need
 * exactly-once side effects must be idempotent.
 * <p>
 * Two caps bound each claim pass:
 * <ul>
 *   <li>claims per tick: {@code lockLimit} overall, {@code defaultLockLimit}
 *       (or the kind's own lock limit) per name</li>
 *   <li>free execution slots: {@code maxConcurrency} minus everything in
 *       flight, {@code defaultConcurrency} (or the kind's own concurrency)
 *       minus what is in flight for that name</li>
 * </ul>
 */
public class LeaseManager {
    private final JobStore store;
    private final SchedulerConfig config;
    private final String owner;
    private final Clock clock;

    public LeaseManager(JobStore store, SchedulerConfig config, String owner, Clock clock) {
        this.store = store;
        this.config = config;
        this.owner = owner;
        this.clock = clock;
    }

    /**
     * Claim as many due jobs as the caps allow.
     *
     * @return the jobs this instance now holds a lease on; empty when no slot is free
     */
    public List<JobRecord> claim(JobHandlers handlers, InFlightSnapshot inFlight) throws Exception {
        ClaimRequest request = plan(handlers, inFlight, clock.millis());
        if (request == null) {
            return List.of();
        }
        return store.claimDue(request);
    }

    /**
     * Work out the caps for one claim pass.
     *
     * @return null if no job may be claimed at all
     */
    ClaimRequest plan(JobHandlers handlers, InFlightSnapshot inFlight, long now) {
        int globalLimit = Math.min(config.getLockLimit(), config.getMaxConcurrency() - inFlight.total());
        if (globalLimit <= 0) {
            return null;
        }

        Map<String, Integer> nameLimits = new HashMap<>();
        for (String name : handlers.names()) {
            JobKind<?> kind = handlers.lookup(name).orElseThrow().getKind();
            nameLimits.put(name, freeSlots(lockLimitFor(kind), concurrencyFor(kind), inFlight.forName(name)));
        }

        // names without a handler still get claimed, so they can be failed and removed
        int defaultLimit = config.getDefaultLockLimit();
        int defaultConcurrency = config.getDefaultConcurrency();
        for (Map.Entry<String, Integer> running : inFlight.byName().entrySet()) {
            nameLimits.putIfAbsent(running.getKey(),
                    freeSlots(defaultLimit, defaultConcurrency, running.getValue()));
        }

        return new ClaimRequest(now, leaseExpiry(now), owner, globalLimit,
                nameLimits, freeSlots(defaultLimit, defaultConcurrency, 0), inFlight.jobIds());
    }

    public long leaseExpiry(long now) {
        return now + config.getDefaultLockLifetime();
    }

    public int concurrencyFor(JobKind<?> kind) {
        int own = kind.getConcurrency();
        return own > 0 ? Math.min(own, config.getMaxConcurrency()) : config.getDefaultConcurrency();
    }

    public int lockLimitFor(JobKind<?> kind) {
        int own = kind.getLockLimit();
        return own > 0 ? Math.min(own, config.getLockLimit()) : config.getDefaultLockLimit();
    }

    private static int freeSlots(int lockLimit, int concurrency, int running) {
        return Math.max(0, Math.min(lockLimit, concurrency - running));
    }
}
