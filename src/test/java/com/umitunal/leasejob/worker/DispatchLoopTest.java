package com.umitunal.leasejob.worker;

import com.umitunal.leasejob.config.SchedulerConfig;
import com.umitunal.leasejob.core.JobHandlers;
import com.umitunal.leasejob.core.JobKind;
import com.umitunal.leasejob.core.SchedulerListener;
import com.umitunal.leasejob.lease.LeaseManager;
import com.umitunal.leasejob.model.JobRecord;
import com.umitunal.leasejob.storage.JobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.rocksdb.RocksDBException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DispatchLoopTest {

    private static final JobKind<String> TEXT = JobKind.text("text");

    @Mock
    private JobStore store;

    @Mock
    private SchedulerListener listener;

    private DispatchLoop loop;

    @BeforeEach
    void setUp() {
        loop = newLoop(2);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    @DisplayName("Should keep ticking after the store fails")
    void testStoreFailureDoesNotStopLoop() throws Exception {
        // Given - two failed polls, then a job
        JobRecord job = leased("job-1", "text");
        when(store.claimDue(any()))
                .thenThrow(new RocksDBException("store unavailable"))
                .thenThrow(new RocksDBException("store unavailable"))
                .thenReturn(List.of(job))
                .thenReturn(List.of());
        CountDownLatch ran = new CountDownLatch(1);

        // When
        loop.start(JobHandlers.builder().register(TEXT, j -> ran.countDown()).build());

        // Then
        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                verify(store).releaseClaim("job-1", "loop-test", job.getLockedUntil()));
        assertThat(loop.getPollFailureCount()).isEqualTo(2);
        verify(listener, times(2)).onPollFailed(any(RocksDBException.class));
    }

    @Test
    @DisplayName("Should claim more work while earlier handlers are still running")
    void testTickDoesNotWaitForHandlers() throws Exception {
        // Given
        when(store.claimDue(any()))
                .thenReturn(List.of(leased("slow-1", "text")))
                .thenReturn(List.of(leased("slow-2", "text")))
                .thenReturn(List.of());
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch bothRunning = new CountDownLatch(2);

        // When
        loop.start(JobHandlers.builder().register(TEXT, j -> {
            bothRunning.countDown();
            release.await();
        }).build());

        // Then - the second claim happened while the first handler blocked
        try {
            assertThat(bothRunning.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(loop.getInFlightCount("text")).isEqualTo(2);
        } finally {
            release.countDown();
        }
        await().atMost(5, TimeUnit.SECONDS).until(() -> loop.getInFlightCount() == 0);
        assertThat(loop.getCompletedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report a failed release and still free the slot")
    void testReleaseFailure() throws Exception {
        // Given
        JobRecord job = leased("job-2", "text");
        when(store.claimDue(any())).thenReturn(List.of(job)).thenReturn(List.of());
        when(store.releaseClaim(anyString(), anyString(), anyLong())).thenThrow(new RocksDBException("gone"));

        // When
        loop.start(JobHandlers.builder().register(TEXT, j -> {}).build());

        // Then
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                verify(listener).onReleaseFailed(eq(job), any(RocksDBException.class)));
        await().atMost(5, TimeUnit.SECONDS).until(() -> loop.getInFlightCount() == 0);
    }

    @Test
    @DisplayName("Should wait for running handlers when stopped")
    void testStopDrains() throws Exception {
        // Given
        when(store.claimDue(any())).thenReturn(List.of(leased("drain-1", "text"))).thenReturn(List.of());
        CountDownLatch started = new CountDownLatch(1);
        loop.start(JobHandlers.builder().register(TEXT, j -> {
            started.countDown();
            Thread.sleep(300);
        }).build());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        boolean stopped = loop.stop();

        // Then - the handler finished and its job was released before stop returned
        assertThat(stopped).isTrue();
        assertThat(loop.getCompletedCount()).isEqualTo(1);
        verify(store).releaseClaim(eq("drain-1"), eq("loop-test"), anyLong());
        assertThat(loop.stop()).isFalse();
    }

    @Test
    @DisplayName("Should not replace handlers when started twice")
    void testStartTwice() throws Exception {
        // Given
        when(store.claimDue(any())).thenReturn(List.of());

        // When
        boolean first = loop.start(JobHandlers.builder().register(TEXT, j -> {}).build());
        boolean second = loop.start(JobHandlers.builder().build());

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(loop.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should free the slot and run the job when the claim listener throws")
    void testClaimListenerFailure() throws Exception {
        // Given - a single slot, and a listener that breaks on the first claim
        loop = newLoop(1);
        when(store.claimDue(any()))
                .thenReturn(List.of(leased("first", "text")))
                .thenReturn(List.of(leased("second", "text")))
                .thenReturn(List.of());
        doThrow(new IllegalStateException("listener broke")).doNothing().when(listener).onClaimed(any());
        List<String> received = new CopyOnWriteArrayList<>();

        // When
        loop.start(JobHandlers.builder().register(TEXT, j -> received.add(j.getId())).build());

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> received.size() == 2);
        assertThat(received).containsExactly("first", "second");
        await().atMost(5, TimeUnit.SECONDS).until(() -> loop.getInFlightCount() == 0);
        assertThat(loop.getCompletedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep ticking when the poll failure listener throws")
    void testPollFailureListenerFailure() throws Exception {
        // Given
        when(store.claimDue(any()))
                .thenThrow(new RocksDBException("store unavailable"))
                .thenReturn(List.of(leased("after-failure", "text")))
                .thenReturn(List.of());
        doThrow(new IllegalStateException("listener broke")).when(listener).onPollFailed(any());
        CountDownLatch ran = new CountDownLatch(1);

        // When
        loop.start(JobHandlers.builder().register(TEXT, j -> ran.countDown()).build());

        // Then
        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(loop.getPollFailureCount()).isEqualTo(1);
        assertThat(loop.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should count a job as completed even if the completion listener throws")
    void testCompletionListenerFailure() throws Exception {
        // Given
        when(store.claimDue(any())).thenReturn(List.of(leased("done", "text"))).thenReturn(List.of());
        doThrow(new IllegalStateException("listener broke")).when(listener).onCompleted(any(), anyLong());

        // When
        loop.start(JobHandlers.builder().register(TEXT, j -> {}).build());

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> loop.getCompletedCount() == 1);
        assertThat(loop.getFailedCount()).isZero();
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                verify(store).releaseClaim(eq("done"), eq("loop-test"), anyLong()));
    }

    @Test
    @DisplayName("Should stop without deadlocking when a handler stops its own loop")
    void testStopFromHandler() throws Exception {
        // Given
        when(store.claimDue(any())).thenReturn(List.of(leased("stopper", "text"))).thenReturn(List.of());
        AtomicBoolean stopped = new AtomicBoolean();

        // When
        loop.start(JobHandlers.builder().register(TEXT, j -> stopped.set(loop.stop())).build());

        // Then
        await().atMost(5, TimeUnit.SECONDS).untilTrue(stopped);
        assertThat(loop.isRunning()).isFalse();
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                verify(store).releaseClaim(eq("stopper"), eq("loop-test"), anyLong()));
        assertThat(loop.stop()).isFalse();
    }

    private DispatchLoop newLoop(int concurrency) {
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .processEvery(20)
                .defaultConcurrency(concurrency)
                .maxConcurrency(concurrency)
                .defaultLockLimit(concurrency)
                .lockLimit(concurrency)
                .defaultLockLifetime(5_000)
                .build();
        LeaseManager leaseManager = new LeaseManager(store, config, "loop-test", Clock.systemUTC());
        return new DispatchLoop("loop-test", leaseManager, store, config.getProcessEvery(), listener);
    }

    private static JobRecord leased(String id, String name) {
        long now = System.currentTimeMillis();
        JobRecord record = new JobRecord(id, name, "payload".getBytes(StandardCharsets.UTF_8), now, now);
        record.lease("loop-test", now, now + 5_000);
        return record;
    }
}
