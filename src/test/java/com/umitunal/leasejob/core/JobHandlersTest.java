package com.umitunal.leasejob.core;

import com.umitunal.leasejob.model.JobRecord;
import com.umitunal.leasejob.serialization.PayloadCodecException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class JobHandlersTest {

    private static final JobKind<Reminder> REMIND = JobKind.json("remind", Reminder.class);

    @Test
    @DisplayName("Should reject a second handler for the same name")
    void testDuplicateRegistration() {
        // Given
        JobHandlers.Builder builder = JobHandlers.builder().register(REMIND, job -> {});

        // When/Then
        assertThatThrownBy(() -> builder.register(JobKind.text("remind"), job -> {}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("remind");
    }

    @Test
    @DisplayName("Should return empty for names without a handler")
    void testLookupUnknown() {
        // Given
        JobHandlers handlers = JobHandlers.builder().register(REMIND, job -> {}).build();

        // When/Then
        assertThat(handlers.lookup("remind")).isPresent();
        assertThat(handlers.lookup("unknown")).isEmpty();
        assertThat(handlers.names()).containsExactly("remind");
        assertThat(JobHandlers.builder().build().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should decode the stored payload before calling the handler")
    void testExecuteDecodesPayload() throws Exception {
        // Given
        AtomicReference<Job<Reminder>> received = new AtomicReference<>();
        JobHandlers handlers = JobHandlers.builder().register(REMIND, received::set).build();
        JobSpec<Reminder> spec = JobSpec.of(REMIND, 1_000L, new Reminder("call home", 2));
        JobRecord stored = new JobRecord("job-1", "remind", spec.encodePayload(), 1_000L, 500L);

        // When
        handlers.lookup("remind").orElseThrow().execute(stored);

        // Then
        Job<Reminder> job = received.get();
        assertThat(job.getId()).isEqualTo("job-1");
        assertThat(job.getName()).isEqualTo("remind");
        assertThat(job.getRunAt()).isEqualTo(1_000L);
        assertThat(job.getPayload().text).isEqualTo("call home");
        assertThat(job.getPayload().priority).isEqualTo(2);
    }

    @Test
    @DisplayName("Should surface handler exceptions to the caller")
    void testHandlerFailurePropagates() {
        // Given
        JobKind<String> text = JobKind.text("text");
        JobHandlers handlers = JobHandlers.builder()
                .register(text, job -> { throw new IllegalStateException("boom"); })
                .build();
        JobRecord stored = new JobRecord("job-2", "text", "x".getBytes(StandardCharsets.UTF_8), 0L, 0L);

        // When/Then
        assertThatThrownBy(() -> handlers.lookup("text").orElseThrow().execute(stored))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    @DisplayName("Should fail without calling the handler when the payload is corrupt")
    void testCorruptPayload() {
        // Given
        AtomicReference<Job<Reminder>> received = new AtomicReference<>();
        JobHandlers handlers = JobHandlers.builder().register(REMIND, received::set).build();
        JobRecord stored = new JobRecord("job-3", "remind", "{not json".getBytes(StandardCharsets.UTF_8), 0L, 0L);

        // When/Then
        assertThatThrownBy(() -> handlers.lookup("remind").orElseThrow().execute(stored))
                .isInstanceOf(PayloadCodecException.class);
        assertThat(received.get()).isNull();
    }

    @Test
    @DisplayName("Should compare kinds by name and validate overrides")
    void testJobKind() {
        // When/Then
        assertThat(JobKind.text("remind")).isEqualTo(REMIND);
        assertThat(REMIND.withConcurrency(4).getConcurrency()).isEqualTo(4);
        assertThat(REMIND.getConcurrency()).isZero();
        assertThatThrownBy(() -> REMIND.withLockLimit(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobKind.text(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    public static class Reminder {
        public String text;
        public int priority;

        public Reminder() {}

        public Reminder(String text, int priority) {
            this.text = text;
            this.priority = priority;
        }
    }
}
