/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.threadpool.Scheduler;
import org.opensearch.threadpool.ThreadPool;

import com.google.common.base.Preconditions;

/**
 * A job firing every interval, one interval after {@link #start()}.
 *
 * Firings missed while the process was busy or suspended are coalesced: the
 * job runs once for the latest due time, or not at all when that due time is
 * more than the misfire grace time in the past. The next firing is always
 * one interval after the latest due time. The body runs on the generic
 * executor and the next firing is scheduled only after it returns, so runs of
 * one job never overlap. Exceptions from the body are logged and do not stop
 * the schedule.
 */
public class IntervalJob {
    private static final Logger logger = LogManager.getLogger(IntervalJob.class);

    private final String name;
    private final Duration interval;
    private final Duration misfireGrace;
    private final Runnable body;
    private final ThreadPool threadPool;
    private final Clock clock;

    private final AtomicLong runs;
    private final AtomicLong skippedRuns;
    private volatile Instant nextFireTime;
    private volatile Scheduler.ScheduledCancellable scheduled;
    private volatile boolean running;

    public IntervalJob(String name, Duration interval, Duration misfireGrace, Runnable body, ThreadPool threadPool, Clock clock) {
        Preconditions.checkArgument(false == interval.isNegative() && false == interval.isZero(), "interval must be positive");
        this.name = name;
        this.interval = interval;
        this.misfireGrace = misfireGrace;
        this.body = body;
        this.threadPool = threadPool;
        this.clock = clock;
        this.runs = new AtomicLong();
        this.skippedRuns = new AtomicLong();
        this.running = false;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        nextFireTime = clock.instant().plus(interval);
        scheduleNext();
        logger.info("Scheduled job [{}] every {}, first run at {}", name, interval, nextFireTime);
    }

    public synchronized void stop() {
        running = false;
        Scheduler.ScheduledCancellable current = scheduled;
        if (current != null) {
            current.cancel();
        }
        logger.info("Stopped job [{}]", name);
    }

    void fire() {
        if (false == running) {
            return;
        }
        try {
            Instant now = clock.instant();
            Instant due = nextFireTime;
            if (now.isBefore(due)) {
                // woke up early, wait for the due time
                return;
            }
            long missed = Duration.between(due, now).toMillis() / interval.toMillis();
            Instant latestDue = due.plus(interval.multipliedBy(missed));
            nextFireTime = latestDue.plus(interval);
            if (missed > 0) {
                logger.warn("Job [{}] missed {} run(s), coalescing into one", name, missed);
            }

            Duration lateness = Duration.between(latestDue, now);
            if (lateness.compareTo(misfireGrace) > 0) {
                skippedRuns.incrementAndGet();
                logger.warn("Job [{}] skipped: run due at {} is {} late, beyond grace time {}", name, latestDue, lateness, misfireGrace);
                return;
            }

            runs.incrementAndGet();
            logger.info("Running job [{}]", name);
            try {
                body.run();
            } catch (Exception e) {
                logger.error(new ParameterizedMessage("Job [{}] failed", name), e);
            }
        } finally {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        if (false == running) {
            return;
        }
        long delayMillis = Math.max(0, Duration.between(clock.instant(), nextFireTime).toMillis());
        scheduled = threadPool.schedule(this::fire, TimeValue.timeValueMillis(delayMillis), ThreadPool.Names.GENERIC);
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return next due time, null before the job is started
     */
    public Instant getNextFireTime() {
        return nextFireTime;
    }

    public long getRuns() {
        return runs.get();
    }

    public long getSkippedRuns() {
        return skippedRuns.get();
    }
}
