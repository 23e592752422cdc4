package com.umitunal.leasejob.model;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates 24-hex-digit job ids: creation seconds, a per-process random
 * part and a counter. Ids from one process sort in creation order.
 */
public final class JobIds {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final long PROCESS_PART = RANDOM.nextLong() & 0xFF_FFFF_FFFFL;
    private static final AtomicInteger COUNTER = new AtomicInteger(RANDOM.nextInt());

    private JobIds() {
    }

    public static String next(long nowMillis) {
        long seconds = (nowMillis / 1000) & 0xFFFF_FFFFL;
        int count = COUNTER.getAndIncrement() & 0xFF_FFFF;
        return String.format("%08x%010x%06x", seconds, PROCESS_PART, count);
    }

    public static boolean isValid(String id) {
        return id != null && id.length() == 24 && id.chars().allMatch(c -> Character.digit(c, 16) >= 0);
    }
}
