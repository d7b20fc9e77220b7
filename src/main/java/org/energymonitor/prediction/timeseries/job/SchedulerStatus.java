/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.collect.ImmutableList;

/**
 * Snapshot of the orchestrator's scheduler.
 */
public class SchedulerStatus {

    public enum State {
        NOT_INITIALIZED,
        STOPPED,
        RUNNING;

        public String getName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static class JobStatus {
        private final String id;
        private final Duration interval;
        private final Instant nextRunTime;
        private final long runs;
        private final long skippedRuns;

        public JobStatus(String id, Duration interval, Instant nextRunTime, long runs, long skippedRuns) {
            this.id = id;
            this.interval = interval;
            this.nextRunTime = nextRunTime;
            this.runs = runs;
            this.skippedRuns = skippedRuns;
        }

        static JobStatus of(IntervalJob job) {
            return new JobStatus(job.getName(), job.getInterval(), job.getNextFireTime(), job.getRuns(), job.getSkippedRuns());
        }

        public String getId() {
            return id;
        }

        public Duration getInterval() {
            return interval;
        }

        public Instant getNextRunTime() {
            return nextRunTime;
        }

        public long getRuns() {
            return runs;
        }

        public long getSkippedRuns() {
            return skippedRuns;
        }

        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", id);
            map.put("next_run_time", nextRunTime == null ? null : nextRunTime.toString());
            map.put("interval_seconds", interval.getSeconds());
            return map;
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this).append("id", id).append("interval", interval).append("nextRunTime", nextRunTime).toString();
        }
    }

    private final State state;
    private final List<JobStatus> jobs;

    public SchedulerStatus(State state, List<JobStatus> jobs) {
        this.state = state;
        this.jobs = ImmutableList.copyOf(jobs);
    }

    public State getState() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public List<JobStatus> getJobs() {
        return jobs;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", state.getName());
        if (state == State.RUNNING) {
            List<Map<String, Object>> jobMaps = new ArrayList<>();
            for (JobStatus job : jobs) {
                jobMaps.add(job.toMap());
            }
            map.put("jobs", jobMaps);
        }
        return map;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("state", state).append("jobs", jobs).toString();
    }
}
