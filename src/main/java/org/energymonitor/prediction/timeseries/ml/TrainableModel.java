/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.ml;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.energymonitor.prediction.timeseries.common.exception.InsufficientDataException;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.energymonitor.prediction.timeseries.common.exception.ModelTrainingException;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;
import org.energymonitor.prediction.timeseries.model.ModelStatus;
import org.energymonitor.prediction.timeseries.model.Sample;

/**
 * Owns one model's state and serializes its training.
 *
 * Only fitting and installing the result happen under the training lock. Reads
 * go through the volatile state without locking and may see the previous
 * generation while a training is in progress.
 *
 * @param <T> fitted model type
 */
public abstract class TrainableModel<T> {
    private static final Logger logger = LogManager.getLogger(TrainableModel.class);

    protected final String modelName;
    protected final Clock clock;
    protected final int minTrainingSamples;

    private final ReentrantLock trainingLock;
    private volatile ModelState<T> state;

    protected TrainableModel(String modelName, Clock clock, int minTrainingSamples) {
        this.modelName = modelName;
        this.clock = clock;
        this.minTrainingSamples = minTrainingSamples;
        this.trainingLock = new ReentrantLock();
        this.state = ModelState.untrained();
    }

    /**
     * Fits a new model and installs it. A second concurrent call waits for the
     * first one to finish.
     *
     * @param samples ascending samples without duplicate timestamps
     * @param params hyperparameters, missing entries fall back to model defaults
     * @return the installed state
     * @throws InsufficientDataException if fewer than the minimum number of samples are given
     * @throws ModelTrainingException if fitting fails; the previous state is kept
     */
    public ModelState<T> train(List<Sample> samples, HyperparameterSet params) {
        if (samples.size() < minTrainingSamples) {
            logger.warn("Insufficient data to train {}: {} points", modelName, samples.size());
            throw new InsufficientDataException(modelName, samples.size(), minTrainingSamples);
        }
        checkOrdered(samples);

        trainingLock.lock();
        try {
            long startNanos = System.nanoTime();
            logger.info("Training {} on {} data points", modelName, samples.size());
            T fitted;
            try {
                fitted = fit(samples, params);
            } catch (RuntimeException e) {
                logger.error(new ParameterizedMessage("Failed to train [{}]", modelName), e);
                throw new ModelTrainingException(modelName, e);
            }
            ModelState<T> next = state.next(fitted, clock, samples.size());
            state = next;
            onInstalled(next);
            logger
                .info(
                    "Training of {} completed with {} data points in {} ms",
                    modelName,
                    samples.size(),
                    Duration.ofNanos(System.nanoTime() - startNanos).toMillis()
                );
            return next;
        } finally {
            trainingLock.unlock();
        }
    }

    /**
     * Fits a model with the given samples. Runs under the training lock.
     *
     * @param samples validated ascending samples
     * @param params hyperparameters
     * @return fitted model
     */
    protected abstract T fit(List<Sample> samples, HyperparameterSet params);

    /**
     * Called under the training lock right after a new state is installed.
     *
     * @param installed the new state
     */
    protected void onInstalled(ModelState<T> installed) {}

    protected T requireTrained() {
        return state.getModel().orElseThrow(() -> new ModelNotTrainedException(modelName));
    }

    public ModelState<T> getState() {
        return state;
    }

    public boolean isTrained() {
        return state.isTrained();
    }

    public String getModelName() {
        return modelName;
    }

    public ModelStatus getStatus() {
        return state.toStatus(modelName);
    }

    public boolean isStale(Duration interval) {
        return state.isStale(clock, interval);
    }

    protected void checkOrdered(List<Sample> samples) {
        Instant previous = null;
        for (Sample sample : samples) {
            Instant current = sample.getTimestamp();
            if (previous != null && false == current.isAfter(previous)) {
                throw new IllegalArgumentException(
                    modelName + " requires ascending samples without duplicate timestamps, got " + current + " after " + previous
                );
            }
            previous = current;
        }
    }
}
