/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.feature;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.settings.TimeSeriesSettings;
import org.opensearch.common.settings.Settings;

import com.google.common.base.Preconditions;

/**
 * {@link TelemetryDao} over an in-memory sorted map. A later write to an
 * existing timestamp replaces the earlier value.
 */
public class InMemoryTelemetryStore implements TelemetryDao {
    private static final Logger logger = LogManager.getLogger(InMemoryTelemetryStore.class);

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ConcurrentSkipListMap<Instant, Double> samples;
    private final Clock clock;
    private final int maxRows;
    private final int maxRecentRows;

    public InMemoryTelemetryStore(Clock clock, Settings settings) {
        this(clock, TimeSeriesSettings.MAX_QUERY_ROWS.get(settings), TimeSeriesSettings.MAX_RECENT_QUERY_ROWS.get(settings));
    }

    /**
     * @param clock UTC clock defining "now"
     * @param maxRows row cap of training queries
     * @param maxRecentRows row cap of recent data queries
     */
    public InMemoryTelemetryStore(Clock clock, int maxRows, int maxRecentRows) {
        Preconditions.checkArgument(maxRows > 0 && maxRecentRows > 0, "row caps must be positive");
        this.samples = new ConcurrentSkipListMap<>();
        this.clock = clock;
        this.maxRows = maxRows;
        this.maxRecentRows = Math.min(maxRows, maxRecentRows);
    }

    public void add(Sample sample) {
        Preconditions.checkNotNull(sample.getTimestamp(), "timestamp is required");
        double value = sample.getValue();
        if (false == Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException("Power value must be a non-negative number, got " + value);
        }
        samples.put(sample.getTimestamp(), value);
    }

    public void addAll(Collection<Sample> toAdd) {
        for (Sample sample : toAdd) {
            add(sample);
        }
    }

    public int size() {
        return samples.size();
    }

    @Override
    public List<Sample> getTrainingData(int days, boolean downsampleHourly) {
        Instant now = clock.instant();
        NavigableMap<Instant, Double> window = samples.subMap(now.minus(days, ChronoUnit.DAYS), true, now, true);
        List<Sample> result = downsampleHourly ? hourlyMeans(window) : toSamples(window);
        List<Sample> capped = keepLast(result, maxRows);
        logger.debug("Training query over {} days returned {} samples (hourly={})", days, capped.size(), downsampleHourly);
        return capped;
    }

    @Override
    public List<Sample> getRecentData(int hours) {
        Instant now = clock.instant();
        NavigableMap<Instant, Double> window = samples.subMap(now.minus(hours, ChronoUnit.HOURS), true, now, true);
        return keepLast(toSamples(window), maxRecentRows);
    }

    @Override
    public double getDataAgeDays() {
        Map.Entry<Instant, Double> oldest = samples.firstEntry();
        if (oldest == null) {
            return 0.0;
        }
        long millis = clock.instant().toEpochMilli() - oldest.getKey().toEpochMilli();
        return Math.max(0.0, millis / MILLIS_PER_DAY);
    }

    private static List<Sample> toSamples(Map<Instant, Double> window) {
        List<Sample> result = new ArrayList<>(window.size());
        for (Map.Entry<Instant, Double> entry : window.entrySet()) {
            result.add(new Sample(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private static List<Sample> hourlyMeans(Map<Instant, Double> window) {
        TreeMap<Instant, double[]> buckets = new TreeMap<>();
        for (Map.Entry<Instant, Double> entry : window.entrySet()) {
            // [sum, count]
            double[] acc = buckets.computeIfAbsent(entry.getKey().truncatedTo(ChronoUnit.HOURS), k -> new double[2]);
            acc[0] += entry.getValue();
            acc[1] += 1;
        }
        List<Sample> result = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, double[]> bucket : buckets.entrySet()) {
            result.add(new Sample(bucket.getKey(), bucket.getValue()[0] / bucket.getValue()[1]));
        }
        return result;
    }

    private static List<Sample> keepLast(List<Sample> ascending, int cap) {
        if (ascending.size() <= cap) {
            return ascending;
        }
        return new ArrayList<>(ascending.subList(ascending.size() - cap, ascending.size()));
    }
}
