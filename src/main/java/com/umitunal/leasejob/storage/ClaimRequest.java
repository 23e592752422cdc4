package com.umitunal.leasejob.storage;

import java.util.Map;
import java.util.Set;

/**
 * Parameters of one claim pass over the job collection.
 */
public final class ClaimRequest {
    private final long now;
    private final long lockedUntil;
    private final String owner;
    private final int globalLimit;
    private final Map<String, Integer> nameLimits;
    private final int defaultNameLimit;
    private final Set<String> excludedIds;

    public ClaimRequest(long now, long lockedUntil, String owner, int globalLimit,
                        Map<String, Integer> nameLimits, int defaultNameLimit, Set<String> excludedIds) {
        this.now = now;
        this.lockedUntil = lockedUntil;
        this.owner = owner;
        this.globalLimit = globalLimit;
        this.nameLimits = Map.copyOf(nameLimits);
        this.defaultNameLimit = defaultNameLimit;
        this.excludedIds = Set.copyOf(excludedIds);
    }

    public long getNow() { return now; }
    public long getLockedUntil() { return lockedUntil; }
    public String getOwner() { return owner; }
    public int getGlobalLimit() { return globalLimit; }
    public Set<String> getExcludedIds() { return excludedIds; }

    /**
     * Max claims for a name in this pass; names without their own entry
     * share the default.
     */
    public int limitFor(String name) {
        return nameLimits.getOrDefault(name, defaultNameLimit);
    }

    @Override
    public String toString() {
        return String.format("ClaimRequest{now=%d, lockedUntil=%d, owner='%s', global=%d, perName=%s, default=%d, excluded=%d}",
                now, lockedUntil, owner, globalLimit, nameLimits, defaultNameLimit, excludedIds.size());
    }
}
