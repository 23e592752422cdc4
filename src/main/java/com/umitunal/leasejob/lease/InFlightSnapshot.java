package com.umitunal.leasejob.lease;

import java.util.Map;
import java.util.Set;

/**
 * Executions running in this scheduler instance at one instant.
 */
public final class InFlightSnapshot {
    public static final InFlightSnapshot EMPTY = new InFlightSnapshot(Map.of(), Set.of());

    private final Map<String, Integer> byName;
    private final Set<String> jobIds;
    private final int total;

    public InFlightSnapshot(Map<String, Integer> byName, Set<String> jobIds) {
        this.byName = Map.copyOf(byName);
        this.jobIds = Set.copyOf(jobIds);
        this.total = this.byName.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int forName(String name) {
        return byName.getOrDefault(name, 0);
    }

    public Map<String, Integer> byName() {
        return byName;
    }

    public Set<String> jobIds() {
        return jobIds;
    }

    public int total() {
        return total;
    }
}
