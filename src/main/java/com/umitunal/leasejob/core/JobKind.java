package com.umitunal.leasejob.core;

import com.umitunal.leasejob.serialization.JsonCodec;
import com.umitunal.leasejob.serialization.KryoCodec;
import com.umitunal.leasejob.serialization.PayloadCodec;
import com.umitunal.leasejob.serialization.StringCodec;

import java.util.Objects;

/**
 * A named kind of job together with the codec for its payload type.
 * <p>
 * Kinds are compared by name. A kind may carry its own concurrency and
 * per-tick lock limit; zero means the scheduler-wide default applies.
 *
 * @param <P> the payload type
 */
public final class JobKind<P> {
    private final String name;
    private final PayloadCodec<P> codec;
    private final int concurrency;
    private final int lockLimit;

    private JobKind(String name, PayloadCodec<P> codec, int concurrency, int lockLimit) {
        this.name = name;
        this.codec = codec;
        this.concurrency = concurrency;
        this.lockLimit = lockLimit;
    }

    public static <P> JobKind<P> of(String name, PayloadCodec<P> codec) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(codec, "codec must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank");
        }
        return new JobKind<>(name, codec, 0, 0);
    }

    /**
     * A kind whose payload is stored as JSON.
     */
    public static <P> JobKind<P> json(String name, Class<P> payloadType) {
        return of(name, new JsonCodec<>(payloadType));
    }

    /**
     * A kind whose payload is stored in Kryo's binary format.
     */
    public static <P> JobKind<P> kryo(String name, Class<P> payloadType) {
        return of(name, new KryoCodec<>(payloadType));
    }

    /**
     * A kind whose payload is a plain UTF-8 string.
     */
    public static JobKind<String> text(String name) {
        return of(name, new StringCodec());
    }

    /**
     * Copy of this kind limited to {@code concurrency} simultaneous executions.
     */
    public JobKind<P> withConcurrency(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive, got " + concurrency);
        }
        return new JobKind<>(name, codec, concurrency, lockLimit);
    }

    /**
     * Copy of this kind limited to {@code lockLimit} claims per poll tick.
     */
    public JobKind<P> withLockLimit(int lockLimit) {
        if (lockLimit <= 0) {
            throw new IllegalArgumentException("lockLimit must be positive, got " + lockLimit);
        }
        return new JobKind<>(name, codec, concurrency, lockLimit);
    }

    public String getName() { return name; }
    public PayloadCodec<P> getCodec() { return codec; }
    public int getConcurrency() { return concurrency; }
    public int getLockLimit() { return lockLimit; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobKind)) return false;
        return name.equals(((JobKind<?>) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "JobKind{" + name + "}";
    }
}
