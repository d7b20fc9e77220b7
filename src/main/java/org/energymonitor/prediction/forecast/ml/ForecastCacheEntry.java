/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.forecast.ml;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.energymonitor.prediction.forecast.model.ForecastPoint;

import com.google.common.collect.ImmutableList;

/**
 * A computed max-horizon forecast. Replaced as a whole, never updated.
 */
public class ForecastCacheEntry {
    private final Instant createdAt;
    private final int horizonHours;
    private final long modelGeneration;
    private final List<ForecastPoint> predictions;

    public ForecastCacheEntry(Instant createdAt, int horizonHours, long modelGeneration, List<ForecastPoint> predictions) {
        this.createdAt = createdAt;
        this.horizonHours = horizonHours;
        this.modelGeneration = modelGeneration;
        this.predictions = ImmutableList.copyOf(predictions);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getHorizonHours() {
        return horizonHours;
    }

    public long getModelGeneration() {
        return modelGeneration;
    }

    public List<ForecastPoint> getPredictions() {
        return predictions;
    }

    /**
     * @param now current time
     * @param ttl time to live
     * @param generation generation of the installed model
     * @return true if the entry was computed by that model and is younger than ttl
     */
    public boolean isValid(Instant now, Duration ttl, long generation) {
        return modelGeneration == generation && Duration.between(createdAt, now).compareTo(ttl) < 0;
    }
}
