package com.umitunal.leasejob.core;

import java.time.Instant;
import java.util.Objects;

/**
 * What to run and when: the input to schedule and reschedule.
 *
 * @param <P> the payload type
 */
public final class JobSpec<P> {
    private final JobKind<P> kind;
    private final long runAt;
    private final P payload;

    private JobSpec(JobKind<P> kind, long runAt, P payload) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.runAt = runAt;
    }

    public static <P> JobSpec<P> of(JobKind<P> kind, long runAt, P payload) {
        return new JobSpec<>(kind, runAt, payload);
    }

    public static <P> JobSpec<P> of(JobKind<P> kind, Instant runAt, P payload) {
        return new JobSpec<>(kind, runAt.toEpochMilli(), payload);
    }

    public JobKind<P> getKind() { return kind; }
    public String getName() { return kind.getName(); }
    public long getRunAt() { return runAt; }
    public P getPayload() { return payload; }

    /**
     * Payload in its stored form.
     */
    public byte[] encodePayload() {
        return kind.getCodec().encode(payload);
    }
}
