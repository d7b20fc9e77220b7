/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.ml;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.energymonitor.prediction.timeseries.model.ModelStatus;

/**
 * One generation of a trained model. Instances are never mutated: a
 * successful training installs a new generation, so readers holding the
 * previous one keep a consistent view.
 *
 * @param <T> fitted model type
 */
public class ModelState<T> {
    private static final ModelState<?> UNTRAINED = new ModelState<>(null, null, 0, 0L);

    protected final T model;
    protected final Instant lastTrained;
    protected final int dataPointsUsed;
    // increases by one on every installed model; caches key on it
    protected final long generation;

    private ModelState(T model, Instant lastTrained, int dataPointsUsed, long generation) {
        this.model = model;
        this.lastTrained = lastTrained;
        this.dataPointsUsed = dataPointsUsed;
        this.generation = generation;
    }

    @SuppressWarnings("unchecked")
    public static <T> ModelState<T> untrained() {
        return (ModelState<T>) UNTRAINED;
    }

    /**
     * Creates the generation following this one.
     *
     * @param model fitted model
     * @param clock UTC clock
     * @param dataPointsUsed number of samples the model was fitted on
     * @return new state
     */
    public ModelState<T> next(T model, Clock clock, int dataPointsUsed) {
        return new ModelState<>(model, clock.instant(), dataPointsUsed, generation + 1);
    }

    public boolean isTrained() {
        return model != null;
    }

    public Optional<T> getModel() {
        return Optional.ofNullable(model);
    }

    public Instant getLastTrained() {
        return lastTrained;
    }

    public int getDataPointsUsed() {
        return dataPointsUsed;
    }

    public long getGeneration() {
        return generation;
    }

    /**
     * @param clock UTC clock
     * @param interval retrain interval
     * @return true when untrained or last trained longer ago than interval
     */
    public boolean isStale(Clock clock, Duration interval) {
        if (false == isTrained()) {
            return true;
        }
        return Duration.between(lastTrained, clock.instant()).compareTo(interval) > 0;
    }

    public ModelStatus toStatus(String modelName) {
        return new ModelStatus(modelName, isTrained(), lastTrained, dataPointsUsed);
    }
}
