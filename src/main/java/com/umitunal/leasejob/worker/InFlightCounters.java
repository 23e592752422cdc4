package com.umitunal.leasejob.worker;

import com.umitunal.leasejob.lease.InFlightSnapshot;
import com.umitunal.leasejob.model.JobRecord;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-name and total count of executions running in this process.
 * Private to one scheduler instance; never shared across processes.
 */
public class InFlightCounters {
    private final Map<String, Integer> byName = new HashMap<>();
    private final Set<String> jobIds = new HashSet<>();

    public synchronized void begin(JobRecord job) {
        if (jobIds.add(job.getId())) {
            byName.merge(job.getName(), 1, Integer::sum);
        }
    }

    public synchronized void end(JobRecord job) {
        if (jobIds.remove(job.getId())) {
            byName.computeIfPresent(job.getName(), (name, count) -> count > 1 ? count - 1 : null);
        }
    }

    public synchronized int total() {
        return jobIds.size();
    }

    public synchronized int forName(String name) {
        return byName.getOrDefault(name, 0);
    }

    public synchronized InFlightSnapshot snapshot() {
        return new InFlightSnapshot(byName, jobIds);
    }

    public synchronized void clear() {
        byName.clear();
        jobIds.clear();
    }
}
