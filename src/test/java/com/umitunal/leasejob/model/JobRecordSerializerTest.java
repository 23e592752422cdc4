package com.umitunal.leasejob.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class JobRecordSerializerTest {

    @Test
    @DisplayName("Should keep an unleased job's nullable fields null")
    void testUnleasedRecord() {
        // Given
        long now = System.currentTimeMillis();
        JobRecord original = new JobRecord("job-1", "test", bytes("{\"message\":\"hello\"}"), now + 500, now);

        // When
        JobRecord restored = JobRecord.deserialize(original.serialize());

        // Then
        assertThat(restored.getId()).isEqualTo("job-1");
        assertThat(restored.getName()).isEqualTo("test");
        assertThat(new String(restored.getPayload(), StandardCharsets.UTF_8)).isEqualTo("{\"message\":\"hello\"}");
        assertThat(restored.getRunAt()).isEqualTo(now + 500);
        assertThat(restored.getLockedUntil()).isNull();
        assertThat(restored.getLockedBy()).isNull();
        assertThat(restored.getLastRunAt()).isNull();
        assertThat(restored.getCreatedAt()).isEqualTo(now);
        assertThat(restored.getUpdatedAt()).isEqualTo(now);
    }

    @Test
    @DisplayName("Should preserve lease fields")
    void testLeasedRecord() {
        // Given
        JobRecord original = new JobRecord("job-2", "report", bytes("payload"), 1_000, 900);
        original.lease("scheduler-a", 1_200, 11_200);

        // When
        JobRecord restored = JobRecord.deserialize(original.serialize());

        // Then
        assertThat(restored.getLockedUntil()).isEqualTo(11_200L);
        assertThat(restored.getLockedBy()).isEqualTo("scheduler-a");
        assertThat(restored.getLastRunAt()).isEqualTo(1_200L);
        assertThat(restored.getUpdatedAt()).isEqualTo(1_200L);
        assertThat(restored.isLeasedBy("scheduler-a", 11_200)).isTrue();
    }

    @Test
    @DisplayName("Should keep an empty owner distinct from no owner")
    void testEmptyOwner() {
        // Given
        JobRecord original = new JobRecord("job-3", "test", new byte[0], 1_000, 1_000);
        original.lease("", 1_000, 2_000);

        // When
        JobRecord restored = JobRecord.deserialize(original.serialize());

        // Then
        assertThat(restored.getLockedBy()).isEmpty();
        assertThat(restored.getPayload()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an unknown format version")
    void testUnknownFormat() {
        // Given
        byte[] serialized = new JobRecord("job-4", "test", bytes("x"), 1, 1).serialize();
        serialized[0] = 42;

        // When/Then
        assertThatThrownBy(() -> JobRecord.deserialize(serialized))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("format");
    }

    @Test
    @DisplayName("Should reject a truncated record")
    void testTruncatedRecord() {
        // Given
        byte[] serialized = new JobRecord("job-4b", "test", bytes("payload"), 1, 1).serialize();
        byte[] truncated = Arrays.copyOf(serialized, serialized.length / 2);

        // When/Then
        assertThatThrownBy(() -> JobRecord.deserialize(truncated))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    @DisplayName("Should order run time index keys numerically")
    void testDueIndexKeyOrder() {
        // Given
        byte[] past = JobRecord.dueIndexKey(-5, "a");
        byte[] early = JobRecord.dueIndexKey(1_000, "b");
        byte[] late = JobRecord.dueIndexKey(1_000_000, "a");

        // Then
        assertThat(Arrays.compareUnsigned(past, early)).isNegative();
        assertThat(Arrays.compareUnsigned(early, late)).isNegative();
        assertThat(JobRecord.runAtOfDueIndexKey(early)).isEqualTo(1_000);
        assertThat(JobRecord.jobIdOfDueIndexKey(early)).isEqualTo("b");
    }

    @Test
    @DisplayName("Should apply the claimable predicate at lease boundaries")
    void testClaimablePredicate() {
        // Given
        JobRecord record = new JobRecord("job-5", "test", bytes("x"), 1_000, 0);

        // Then - not before runAt
        assertThat(record.isClaimable(999)).isFalse();
        assertThat(record.isClaimable(1_000)).isTrue();

        // When - leased until 2000
        record.lease("a", 1_000, 2_000);

        // Then - lease active strictly before expiry
        assertThat(record.isClaimable(1_999)).isFalse();
        assertThat(record.isClaimable(2_000)).isTrue();
    }

    @Test
    @DisplayName("Should clear the lease on replace")
    void testReplaceClearsLease() {
        // Given
        JobRecord record = new JobRecord("job-6", "old", bytes("old"), 1_000, 0);
        record.lease("a", 1_000, 5_000);

        // When
        record.replace("new", bytes("new"), 3_000, 1_500);

        // Then
        assertThat(record.getName()).isEqualTo("new");
        assertThat(record.getRunAt()).isEqualTo(3_000);
        assertThat(record.getLockedUntil()).isNull();
        assertThat(record.getLockedBy()).isNull();
        assertThat(record.getUpdatedAt()).isEqualTo(1_500);
        assertThat(record.getLastRunAt()).isEqualTo(1_000L);
    }

    @Test
    @DisplayName("Should generate distinct, well-formed ids")
    void testJobIds() {
        // When
        String first = JobIds.next(System.currentTimeMillis());
        String second = JobIds.next(System.currentTimeMillis());

        // Then
        assertThat(first).isNotEqualTo(second);
        assertThat(JobIds.isValid(first)).isTrue();
        assertThat(JobIds.isValid("not-an-id")).isFalse();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
