package com.umitunal.leasejob.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of job kinds and their handlers.
 * <pre>{@code
 * JobKind<Greeting> greet = JobKind.json("greet", Greeting.class);
 *
 * JobHandlers handlers = JobHandlers.builder()
 *     .register(greet, job -> send(job.getPayload()))
 *     .build();
 * }</pre>
 */
public final class JobHandlers {
    private final Map<String, Registration<?>> registrations;

    private JobHandlers(Map<String, Registration<?>> registrations) {
        this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find the registration for a stored job name.
     * An empty result is the unknown-job-name case.
     */
    public Optional<Registration<?>> lookup(String name) {
        return Optional.ofNullable(registrations.get(name));
    }

    public Set<String> names() {
        return registrations.keySet();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    /**
     * A kind bound to its handler.
     *
     * @param <P> the payload type
     */
    public static final class Registration<P> {
        private final JobKind<P> kind;
        private final JobHandler<P> handler;

        private Registration(JobKind<P> kind, JobHandler<P> handler) {
            this.kind = kind;
            this.handler = handler;
        }

        public JobKind<P> getKind() {
            return kind;
        }

        /**
         * Decode the stored payload with this kind's codec and run the handler.
         *
         * @throws com.umitunal.leasejob.serialization.PayloadCodecException if the payload does not decode
         * @throws Exception whatever the handler throws
         */
        public void execute(Job<byte[]> stored) throws Exception {
            P payload = kind.getCodec().decode(stored.getPayload());
            handler.handle(new DecodedJob<>(stored, payload));
        }
    }

    public static final class Builder {
        private final Map<String, Registration<?>> registrations = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if a kind with the same name is already registered
         */
        public <P> Builder register(JobKind<P> kind, JobHandler<P> handler) {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
            if (registrations.containsKey(kind.getName())) {
                throw new IllegalArgumentException("Handler already registered for job: " + kind.getName());
            }
            registrations.put(kind.getName(), new Registration<>(kind, handler));
            return this;
        }

        public JobHandlers build() {
            return new JobHandlers(registrations);
        }
    }

    private static final class DecodedJob<P> implements Job<P> {
        private final Job<byte[]> stored;
        private final P payload;

        private DecodedJob(Job<byte[]> stored, P payload) {
            this.stored = stored;
            this.payload = payload;
        }

        @Override public String getId() { return stored.getId(); }
        @Override public String getName() { return stored.getName(); }
        @Override public P getPayload() { return payload; }
        @Override public long getRunAt() { return stored.getRunAt(); }
        @Override public Long getLockedUntil() { return stored.getLockedUntil(); }
        @Override public String getLockedBy() { return stored.getLockedBy(); }
        @Override public Long getLastRunAt() { return stored.getLastRunAt(); }
        @Override public long getCreatedAt() { return stored.getCreatedAt(); }
        @Override public long getUpdatedAt() { return stored.getUpdatedAt(); }

        @Override
        public String toString() {
            return "Job{id='" + getId() + "', name='" + getName() + "', payload=" + payload + "}";
        }
    }
}
