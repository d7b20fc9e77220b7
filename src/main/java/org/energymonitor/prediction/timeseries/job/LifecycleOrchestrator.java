/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.ad.ml.AnomalyModel;
import org.energymonitor.prediction.forecast.ml.ForecastModel;
import org.energymonitor.prediction.timeseries.AnalysisType;
import org.energymonitor.prediction.timeseries.common.exception.PredictionException;
import org.energymonitor.prediction.timeseries.feature.TelemetryDao;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.settings.TimeSeriesSettings;
import org.energymonitor.prediction.timeseries.tuning.HyperparameterTuner;
import org.energymonitor.prediction.timeseries.tuning.TuningResult;
import org.opensearch.action.support.PlainActionFuture;
import org.opensearch.common.settings.Settings;
import org.opensearch.core.action.ActionListener;
import org.opensearch.threadpool.ThreadPool;

/**
 * Drives periodic training and tuning of both models.
 *
 * A training cycle fetches an hourly view of the training window for the
 * forecaster and a full-resolution view for the anomaly detector, then trains
 * both on the ML executor concurrently. Each model's outcome is collected
 * independently. A tuning cycle runs the grid search on the ML executor and,
 * once it succeeds, starts an extra training cycle with the new parameters.
 */
public class LifecycleOrchestrator {
    private static final Logger logger = LogManager.getLogger(LifecycleOrchestrator.class);

    public static final String TRAINING_JOB_ID = "model_training";
    public static final String TUNING_JOB_ID = "hyperparameter_tuning";

    private final ThreadPool threadPool;
    private final MlTaskRunner mlTaskRunner;
    private final Clock clock;
    private final TelemetryDao telemetryDao;
    private final ForecastModel forecastModel;
    private final AnomalyModel anomalyModel;
    private final HyperparameterTuner tuner;

    private final int trainingWindowDays;
    private final int tuningWindowDays;
    private final Duration trainingInterval;
    private final Duration tuningInterval;
    private final boolean tuningEnabled;
    private final Duration misfireGrace;

    private volatile SchedulerStatus.State state;
    private volatile IntervalJob trainingJob;
    private volatile IntervalJob tuningJob;

    public LifecycleOrchestrator(
        Settings settings,
        Clock clock,
        ThreadPool threadPool,
        MlTaskRunner mlTaskRunner,
        TelemetryDao telemetryDao,
        ForecastModel forecastModel,
        AnomalyModel anomalyModel,
        HyperparameterTuner tuner
    ) {
        this.threadPool = threadPool;
        this.mlTaskRunner = mlTaskRunner;
        this.clock = clock;
        this.telemetryDao = telemetryDao;
        this.forecastModel = forecastModel;
        this.anomalyModel = anomalyModel;
        this.tuner = tuner;
        this.trainingWindowDays = TimeSeriesSettings.TRAINING_WINDOW_DAYS.get(settings);
        this.tuningWindowDays = TimeSeriesSettings.TUNING_WINDOW_DAYS.get(settings);
        this.trainingInterval = Duration.ofMillis(TimeSeriesSettings.TRAINING_INTERVAL.get(settings).millis());
        this.tuningInterval = Duration.ofMillis(TimeSeriesSettings.TUNING_INTERVAL.get(settings).millis());
        this.tuningEnabled = TimeSeriesSettings.TUNING_ENABLED.get(settings);
        this.misfireGrace = Duration.ofMillis(TimeSeriesSettings.MISFIRE_GRACE_TIME.get(settings).millis());
        this.state = SchedulerStatus.State.NOT_INITIALIZED;
    }

    /**
     * Loads persisted parameters, schedules the jobs and trains right away
     * when a model is stale.
     */
    public synchronized void start() {
        if (state == SchedulerStatus.State.RUNNING) {
            return;
        }
        tuner.loadParams();

        trainingJob = new IntervalJob(TRAINING_JOB_ID, trainingInterval, misfireGrace, this::runTrainingCycle, threadPool, clock);
        trainingJob.start();
        if (tuningEnabled) {
            tuningJob = new IntervalJob(TUNING_JOB_ID, tuningInterval, misfireGrace, this::runTuningCycle, threadPool, clock);
            tuningJob.start();
        } else {
            tuningJob = null;
        }
        state = SchedulerStatus.State.RUNNING;

        if (isStale()) {
            logger.info("Models are stale, training on startup");
            threadPool.executor(ThreadPool.Names.GENERIC).execute(() -> {
                try {
                    runTrainingCycle();
                } catch (Exception e) {
                    logger.error("Startup training failed", e);
                }
            });
        } else {
            logger.info("Models are fresh, skipping startup training");
        }
        logger.info("Lifecycle orchestrator started");
    }

    public synchronized void stop() {
        if (state != SchedulerStatus.State.RUNNING) {
            return;
        }
        trainingJob.stop();
        if (tuningJob != null) {
            tuningJob.stop();
        }
        state = SchedulerStatus.State.STOPPED;
        logger.info("Lifecycle orchestrator stopped");
    }

    /**
     * @return true when either model is untrained or older than the training interval
     */
    public boolean isStale() {
        return forecastModel.isStale(trainingInterval) || anomalyModel.isStale(trainingInterval);
    }

    /**
     * Fetches the training window and trains both models concurrently.
     *
     * @param listener receives the report once both trainings finished; fails
     *        only when the training data cannot be fetched
     */
    public void trainModels(ActionListener<TrainingReport> listener) {
        List<Sample> forecastSamples;
        List<Sample> anomalySamples;
        try {
            forecastSamples = telemetryDao.getTrainingData(trainingWindowDays, true);
            anomalySamples = telemetryDao.getTrainingData(trainingWindowDays, false);
        } catch (Exception e) {
            logger.error("Failed to fetch training data", e);
            listener.onFailure(e);
            return;
        }

        TrainingOutcomeCollector collector = new TrainingOutcomeCollector(ActionListener.wrap(report -> {
            logger.info("Training cycle completed: {}", report.toMap());
            listener.onResponse(report);
        }, listener::onFailure), AnalysisType.values().length, clock);

        mlTaskRunner.submit(() -> trainForecaster(forecastSamples), collector);
        mlTaskRunner.submit(() -> trainAnomalyDetector(anomalySamples), collector);
    }

    /**
     * Tunes both models, then retrains them with the winning parameters.
     *
     * @param listener receives the tuning result after the follow-up training
     *        finished; fails when fetching data or tuning fails
     */
    public void tuneModels(ActionListener<TuningResult> listener) {
        List<Sample> forecastSamples;
        List<Sample> anomalySamples;
        try {
            forecastSamples = telemetryDao.getTrainingData(tuningWindowDays, true);
            anomalySamples = telemetryDao.getTrainingData(tuningWindowDays, false);
        } catch (Exception e) {
            logger.error("Failed to fetch tuning data", e);
            listener.onFailure(e);
            return;
        }

        mlTaskRunner.submit(() -> tuner.tuneAll(forecastSamples, anomalySamples), ActionListener.wrap(result -> {
            logger.info("Tuning complete, retraining with new parameters");
            threadPool
                .executor(ThreadPool.Names.GENERIC)
                .execute(() -> trainModels(ActionListener.wrap(report -> listener.onResponse(result), e -> {
                    logger.error("Training after tuning failed", e);
                    listener.onResponse(result);
                })));
        }, e -> {
            logger.error("Hyperparameter tuning failed", e);
            listener.onFailure(e);
        }));
    }

    public SchedulerStatus getSchedulerStatus() {
        SchedulerStatus.State current = state;
        List<SchedulerStatus.JobStatus> jobs = new ArrayList<>();
        if (current == SchedulerStatus.State.RUNNING) {
            jobs.add(SchedulerStatus.JobStatus.of(trainingJob));
            IntervalJob tuning = tuningJob;
            if (tuning != null) {
                jobs.add(SchedulerStatus.JobStatus.of(tuning));
            }
        }
        return new SchedulerStatus(current, jobs);
    }

    void runTrainingCycle() {
        PlainActionFuture<TrainingReport> future = PlainActionFuture.newFuture();
        trainModels(future);
        future.actionGet();
    }

    void runTuningCycle() {
        PlainActionFuture<TuningResult> future = PlainActionFuture.newFuture();
        tuneModels(future);
        future.actionGet();
    }

    private TrainingOutcome trainForecaster(List<Sample> samples) {
        try {
            forecastModel.train(samples, tuner.getForecastParams());
        } catch (RuntimeException e) {
            return TrainingOutcome.fromException(AnalysisType.FORECAST, e);
        }
        try {
            forecastModel.warmCache();
        } catch (PredictionException e) {
            logger.warn("Failed to warm the forecast cache: {}", e.getMessage());
        }
        return TrainingOutcome.trained(AnalysisType.FORECAST, samples.size());
    }

    private TrainingOutcome trainAnomalyDetector(List<Sample> samples) {
        try {
            anomalyModel.train(samples, tuner.getAnomalyParams());
        } catch (RuntimeException e) {
            return TrainingOutcome.fromException(AnalysisType.AD, e);
        }
        return TrainingOutcome.trained(AnalysisType.AD, samples.size());
    }
}
