/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.mockito.ArgumentCaptor;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.threadpool.Scheduler;
import org.opensearch.threadpool.ThreadPool;

public class IntervalJobTests extends AbstractPredictionTest {
    private static final Duration INTERVAL = Duration.ofHours(1);
    private static final Duration GRACE = Duration.ofMinutes(15);

    private MutableClock clock;
    private ThreadPool threadPool;
    private Scheduler.ScheduledCancellable cancellable;
    private AtomicInteger runs;
    private IntervalJob job;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        clock = new MutableClock(START);
        threadPool = mock(ThreadPool.class);
        cancellable = mock(Scheduler.ScheduledCancellable.class);
        when(threadPool.schedule(any(Runnable.class), any(TimeValue.class), eq(ThreadPool.Names.GENERIC))).thenReturn(cancellable);
        runs = new AtomicInteger();
        job = new IntervalJob("test_job", INTERVAL, GRACE, runs::incrementAndGet, threadPool, clock);
    }

    public void testFirstRunOneIntervalAfterStart() {
        job.start();

        ArgumentCaptor<TimeValue> delay = ArgumentCaptor.forClass(TimeValue.class);
        verify(threadPool).schedule(any(Runnable.class), delay.capture(), eq(ThreadPool.Names.GENERIC));
        assertEquals(INTERVAL.toMillis(), delay.getValue().millis());
        assertEquals(START.plus(INTERVAL), job.getNextFireTime());
        assertTrue(job.isRunning());
    }

    public void testRunsWhenDue() {
        job.start();
        clock.advance(INTERVAL);

        job.fire();

        assertEquals(1, runs.get());
        assertEquals(1, job.getRuns());
        assertEquals(START.plus(INTERVAL.multipliedBy(2)), job.getNextFireTime());
        verify(threadPool, times(2)).schedule(any(Runnable.class), any(TimeValue.class), eq(ThreadPool.Names.GENERIC));
    }

    public void testEarlyWakeUpDoesNotRun() {
        job.start();
        clock.advance(Duration.ofMinutes(30));

        job.fire();

        assertEquals(0, runs.get());
        assertEquals(START.plus(INTERVAL), job.getNextFireTime());
    }

    public void testMissedRunsAreCoalesced() {
        job.start();
        clock.advance(Duration.ofHours(3).plusMinutes(10));

        job.fire();

        assertEquals(1, runs.get());
        assertEquals(START.plus(Duration.ofHours(4)), job.getNextFireTime());
    }

    public void testRunBeyondGraceIsSkipped() {
        job.start();
        clock.advance(INTERVAL.plusMinutes(30));

        job.fire();

        assertEquals(0, runs.get());
        assertEquals(1, job.getSkippedRuns());
        assertEquals(START.plus(INTERVAL.multipliedBy(2)), job.getNextFireTime());
        verify(threadPool, times(2)).schedule(any(Runnable.class), any(TimeValue.class), eq(ThreadPool.Names.GENERIC));
    }

    public void testFailureDoesNotStopSchedule() {
        IntervalJob failing = new IntervalJob("failing_job", INTERVAL, GRACE, () -> {
            throw new IllegalStateException("boom");
        }, threadPool, clock);
        failing.start();
        clock.advance(INTERVAL);

        failing.fire();

        assertEquals(1, failing.getRuns());
        assertTrue(failing.isRunning());
        verify(threadPool, times(2)).schedule(any(Runnable.class), any(TimeValue.class), eq(ThreadPool.Names.GENERIC));
    }

    public void testStopCancels() {
        job.start();
        job.stop();

        verify(cancellable).cancel();
        clock.advance(INTERVAL);
        job.fire();
        assertEquals(0, runs.get());
        assertFalse(job.isRunning());
    }

    public void testScheduledRunnableFiresJob() {
        job.start();
        ArgumentCaptor<Runnable> command = ArgumentCaptor.forClass(Runnable.class);
        verify(threadPool).schedule(command.capture(), any(TimeValue.class), eq(ThreadPool.Names.GENERIC));

        clock.advance(INTERVAL);
        command.getValue().run();

        assertEquals(1, runs.get());
    }

    public void testRejectsZeroInterval() {
        expectThrows(IllegalArgumentException.class, () -> new IntervalJob("bad", Duration.ZERO, GRACE, runs::incrementAndGet, threadPool, clock));
    }
}
