/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries;

import java.io.Closeable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.ad.ml.AnomalyModel;
import org.energymonitor.prediction.ad.model.AnomalyPoint;
import org.energymonitor.prediction.ad.model.AnomalyReport;
import org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings;
import org.energymonitor.prediction.forecast.ml.ForecastModel;
import org.energymonitor.prediction.forecast.model.ForecastPoint;
import org.energymonitor.prediction.forecast.settings.ForecastSettings;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.energymonitor.prediction.timeseries.common.exception.ResourceLimitException;
import org.energymonitor.prediction.timeseries.common.exception.ValidationException;
import org.energymonitor.prediction.timeseries.constant.CommonMessages;
import org.energymonitor.prediction.timeseries.feature.FeatureExtractor;
import org.energymonitor.prediction.timeseries.feature.TelemetryDao;
import org.energymonitor.prediction.timeseries.job.LifecycleOrchestrator;
import org.energymonitor.prediction.timeseries.job.MlTaskRunner;
import org.energymonitor.prediction.timeseries.job.SchedulerStatus;
import org.energymonitor.prediction.timeseries.job.TrainingReport;
import org.energymonitor.prediction.timeseries.model.ModelStatus;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.settings.TimeSeriesSettings;
import org.energymonitor.prediction.timeseries.stats.HealthReport;
import org.energymonitor.prediction.timeseries.tuning.HyperparameterStore;
import org.energymonitor.prediction.timeseries.tuning.HyperparameterTuner;
import org.energymonitor.prediction.timeseries.tuning.TimeSeriesCrossValidator;
import org.energymonitor.prediction.timeseries.tuning.TuningResult;
import org.opensearch.action.support.PlainActionFuture;
import org.opensearch.common.settings.Settings;
import org.opensearch.threadpool.FixedExecutorBuilder;
import org.opensearch.threadpool.ThreadPool;

/**
 * Entry point of the prediction engine. Owns the models, the tuner, the
 * orchestrator and, unless one is passed in, the thread pool they run on.
 *
 * Request arguments are validated here before any model is touched. CPU-bound
 * work runs on the {@value TimeSeriesSettings#ML_THREAD_POOL_NAME} executor
 * while the calling thread waits.
 */
public class PredictionEngine implements Closeable {
    private static final Logger logger = LogManager.getLogger(PredictionEngine.class);

    public static final String NODE_NAME = "prediction-engine";
    public static final String THREAD_POOL_PREFIX = "thread_pool.";

    private final Settings settings;
    private final Clock clock;
    private final TelemetryDao telemetryDao;
    private final ThreadPool threadPool;
    private final boolean ownsThreadPool;
    private final MlTaskRunner mlTaskRunner;
    private final ForecastModel forecastModel;
    private final AnomalyModel anomalyModel;
    private final HyperparameterTuner tuner;
    private final LifecycleOrchestrator orchestrator;

    private final int minRequestHours;
    private final int maxForecastHours;
    private final int maxAnomalyHours;
    private final double minReliableDataDays;

    /**
     * Creates an engine with its own thread pool, terminated by {@link #close()}.
     *
     * @param settings engine settings
     * @param clock UTC clock
     * @param telemetryDao data source
     */
    public PredictionEngine(Settings settings, Clock clock, TelemetryDao telemetryDao) {
        this(settings, clock, telemetryDao, createThreadPool(settings), true);
    }

    /**
     * Creates an engine on an existing thread pool. The pool must have an
     * executor named {@value TimeSeriesSettings#ML_THREAD_POOL_NAME}; it is
     * not terminated by {@link #close()}.
     *
     * @param settings engine settings
     * @param clock UTC clock
     * @param telemetryDao data source
     * @param threadPool thread pool
     */
    public PredictionEngine(Settings settings, Clock clock, TelemetryDao telemetryDao, ThreadPool threadPool) {
        this(settings, clock, telemetryDao, threadPool, false);
    }

    private PredictionEngine(Settings settings, Clock clock, TelemetryDao telemetryDao, ThreadPool threadPool, boolean ownsThreadPool) {
        this.settings = settings;
        this.clock = clock;
        this.telemetryDao = telemetryDao;
        this.threadPool = threadPool;
        this.ownsThreadPool = ownsThreadPool;
        this.mlTaskRunner = new MlTaskRunner(threadPool, TimeSeriesSettings.ML_THREAD_POOL_NAME);

        FeatureExtractor featureExtractor = new FeatureExtractor(TimeSeriesSettings.ROLLING_WINDOW_SIZE.get(settings));
        this.forecastModel = new ForecastModel(clock, settings);
        this.anomalyModel = new AnomalyModel(clock, settings, featureExtractor);

        TimeSeriesCrossValidator crossValidator = new TimeSeriesCrossValidator(
            TimeSeriesSettings.TUNING_CV_FOLDS.get(settings),
            TimeSeriesSettings.TUNING_MIN_TRAIN_DAYS.get(settings),
            TimeSeriesSettings.TUNING_VALIDATION_DAYS.get(settings)
        );
        Path paramsFile = Paths.get(TimeSeriesSettings.TUNING_PARAMS_FILE.get(settings));
        this.tuner = new HyperparameterTuner(clock, crossValidator, new HyperparameterStore(paramsFile), featureExtractor);

        this.orchestrator = new LifecycleOrchestrator(
            settings,
            clock,
            threadPool,
            mlTaskRunner,
            telemetryDao,
            forecastModel,
            anomalyModel,
            tuner
        );

        this.minRequestHours = TimeSeriesSettings.MIN_REQUEST_HOURS.get(settings);
        this.maxForecastHours = ForecastSettings.MAX_FORECAST_HOURS.get(settings);
        this.maxAnomalyHours = AnomalyDetectorSettings.MAX_ANOMALY_HOURS.get(settings);
        this.minReliableDataDays = TimeSeriesSettings.MIN_RELIABLE_DATA_DAYS.get(settings);
    }

    /**
     * Builds a thread pool with a fixed ML executor sized by
     * {@link TimeSeriesSettings#ML_THREAD_POOL_SIZE}.
     *
     * @param settings engine settings
     * @return new thread pool
     */
    public static ThreadPool createThreadPool(Settings settings) {
        Settings poolSettings = Settings.builder().put(settings).put("node.name", NODE_NAME).build();
        return new ThreadPool(
            poolSettings,
            new FixedExecutorBuilder(
                poolSettings,
                TimeSeriesSettings.ML_THREAD_POOL_NAME,
                TimeSeriesSettings.ML_THREAD_POOL_SIZE.get(settings),
                TimeSeriesSettings.ML_THREAD_POOL_QUEUE_SIZE.get(settings),
                THREAD_POOL_PREFIX + TimeSeriesSettings.ML_THREAD_POOL_NAME
            )
        );
    }

    /**
     * Starts the periodic jobs; trains right away when a model is stale.
     */
    public void start() {
        logger.info("Starting prediction engine");
        orchestrator.start();
    }

    /**
     * Trains both models on the latest training window.
     *
     * @return each model's outcome
     */
    public TrainingReport trainModels() {
        PlainActionFuture<TrainingReport> future = PlainActionFuture.newFuture();
        orchestrator.trainModels(future);
        return future.actionGet();
    }

    /**
     * Tunes both models and retrains them with the winning parameters.
     *
     * @return the tuning result
     */
    public TuningResult tuneModels() {
        PlainActionFuture<TuningResult> future = PlainActionFuture.newFuture();
        orchestrator.tuneModels(future);
        return future.actionGet();
    }

    public List<ForecastPoint> forecast(int hours) {
        return forecast(hours, 0);
    }

    /**
     * @param hours hours past now to forecast
     * @param pastContextHours hours before now to include
     * @return ascending hourly points
     * @throws ValidationException if hours is below the minimum or the past context is negative
     * @throws ResourceLimitException if hours exceeds the maximum
     * @throws ModelNotTrainedException if the forecaster is untrained
     */
    public List<ForecastPoint> forecast(int hours, int pastContextHours) {
        validateHours(hours, maxForecastHours);
        if (pastContextHours < 0) {
            throw new ValidationException("past_context_hours", CommonMessages.NEGATIVE_PAST_CONTEXT);
        }
        return mlTaskRunner.submitAndWait(() -> forecastModel.predict(hours, pastContextHours));
    }

    /**
     * Checks the most recent hours for anomalies. A failure to read the
     * window degrades to an empty report.
     *
     * @param hours hours of recent data to check
     * @param sensitivity value in [0.1, 1.0], higher flags more
     * @return anomalies with their summary
     * @throws ValidationException if hours or sensitivity are out of range
     * @throws ResourceLimitException if hours exceeds the maximum
     * @throws ModelNotTrainedException if the anomaly detector is untrained
     */
    public AnomalyReport detectAnomalies(int hours, double sensitivity) {
        validateHours(hours, maxAnomalyHours);
        if (sensitivity < TimeSeriesSettings.MIN_SENSITIVITY || sensitivity > TimeSeriesSettings.MAX_SENSITIVITY) {
            throw new ValidationException(
                "sensitivity",
                String
                    .format(
                        Locale.ROOT,
                        CommonMessages.SENSITIVITY_OUT_OF_RANGE,
                        TimeSeriesSettings.MIN_SENSITIVITY,
                        TimeSeriesSettings.MAX_SENSITIVITY
                    )
            );
        }
        if (false == anomalyModel.isTrained()) {
            throw new ModelNotTrainedException(anomalyModel.getModelName());
        }

        List<Sample> recent;
        try {
            recent = telemetryDao.getRecentData(hours);
        } catch (Exception e) {
            logger.warn("Failed to fetch the last {} hours for anomaly detection, returning no anomalies: {}", hours, e.getMessage());
            return AnomalyReport.degraded();
        }

        return mlTaskRunner.submitAndWait(() -> {
            List<AnomalyPoint> anomalies = anomalyModel.detect(recent, sensitivity);
            return new AnomalyReport(anomalies, anomalyModel.summarize(anomalies));
        });
    }

    /**
     * @return status of both models keyed by model name
     */
    public Map<String, ModelStatus> getStatus() {
        Map<String, ModelStatus> status = new LinkedHashMap<>();
        status.put(forecastModel.getModelName(), forecastModel.getStatus());
        status.put(anomalyModel.getModelName(), anomalyModel.getStatus());
        return status;
    }

    public SchedulerStatus getSchedulerStatus() {
        return orchestrator.getSchedulerStatus();
    }

    /**
     * @return true when samples exist and the oldest one is at least
     *         {@link TimeSeriesSettings#MIN_RELIABLE_DATA_DAYS} old
     */
    public boolean hasSufficientData() {
        double ageDays = telemetryDao.getDataAgeDays();
        return ageDays > 0 && ageDays >= minReliableDataDays;
    }

    public HealthReport getHealth() {
        Map<String, HealthReport.ComponentHealth> components = new LinkedHashMap<>();
        HealthReport.Status overall = HealthReport.Status.HEALTHY;

        Map<String, Object> databaseDetails = new LinkedHashMap<>();
        try {
            databaseDetails.put("data_age_days", telemetryDao.getDataAgeDays());
            components.put(HealthReport.DATABASE, new HealthReport.ComponentHealth(HealthReport.Status.HEALTHY, databaseDetails));
        } catch (Exception e) {
            logger.warn("Database health check failed: {}", e.getMessage());
            databaseDetails.put("error", e.getMessage());
            components.put(HealthReport.DATABASE, new HealthReport.ComponentHealth(HealthReport.Status.UNHEALTHY, databaseDetails));
            overall = HealthReport.Status.DEGRADED;
        }

        for (ModelStatus status : getStatus().values()) {
            Map<String, Object> details = new LinkedHashMap<>();
            if (status.isTrained()) {
                details.put(ModelStatus.DATA_POINTS_USED_FIELD, status.getDataPointsUsed());
                details.put(ModelStatus.LAST_TRAINED_FIELD, status.getLastTrained().toString());
                components.put(status.getModelName(), new HealthReport.ComponentHealth(HealthReport.Status.HEALTHY, details));
            } else {
                components.put(status.getModelName(), new HealthReport.ComponentHealth(HealthReport.Status.INITIALIZING, details));
                if (overall == HealthReport.Status.HEALTHY) {
                    overall = HealthReport.Status.INITIALIZING;
                }
            }
        }

        SchedulerStatus schedulerStatus = orchestrator.getSchedulerStatus();
        Map<String, Object> schedulerDetails = new LinkedHashMap<>(schedulerStatus.toMap());
        schedulerDetails.remove("status");
        switch (schedulerStatus.getState()) {
            case RUNNING:
                components.put(HealthReport.SCHEDULER, new HealthReport.ComponentHealth(HealthReport.Status.HEALTHY, schedulerDetails));
                break;
            case NOT_INITIALIZED:
                components.put(HealthReport.SCHEDULER, new HealthReport.ComponentHealth(HealthReport.Status.INITIALIZING, schedulerDetails));
                if (overall == HealthReport.Status.HEALTHY) {
                    overall = HealthReport.Status.INITIALIZING;
                }
                break;
            default:
                components.put(HealthReport.SCHEDULER, new HealthReport.ComponentHealth(HealthReport.Status.DEGRADED, schedulerDetails));
                overall = HealthReport.Status.DEGRADED;
        }
        return new HealthReport(overall, components, clock.instant());
    }

    public ForecastModel getForecastModel() {
        return forecastModel;
    }

    public AnomalyModel getAnomalyModel() {
        return anomalyModel;
    }

    public HyperparameterTuner getTuner() {
        return tuner;
    }

    public Settings getSettings() {
        return settings;
    }

    /**
     * Stops the periodic jobs and terminates the thread pool if the engine created it.
     */
    @Override
    public void close() {
        orchestrator.stop();
        if (ownsThreadPool) {
            ThreadPool.terminate(threadPool, 30, TimeUnit.SECONDS);
        }
        logger.info("Prediction engine closed");
    }

    private void validateHours(int hours, int maxHours) {
        if (hours < minRequestHours) {
            throw new ValidationException("hours", String.format(Locale.ROOT, CommonMessages.HOURS_BELOW_MINIMUM, minRequestHours));
        }
        if (hours > maxHours) {
            throw new ResourceLimitException("hours", maxHours);
        }
    }
}
