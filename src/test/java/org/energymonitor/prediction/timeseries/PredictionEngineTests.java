/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.energymonitor.prediction.ad.model.AnomalyReport;
import org.energymonitor.prediction.forecast.model.ForecastPoint;
import org.energymonitor.prediction.timeseries.common.exception.DatabaseConnectionException;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.energymonitor.prediction.timeseries.common.exception.ResourceLimitException;
import org.energymonitor.prediction.timeseries.common.exception.ValidationException;
import org.energymonitor.prediction.timeseries.constant.CommonMessages;
import org.energymonitor.prediction.timeseries.feature.InMemoryTelemetryStore;
import org.energymonitor.prediction.timeseries.feature.TelemetryDao;
import org.energymonitor.prediction.timeseries.job.SchedulerStatus;
import org.energymonitor.prediction.timeseries.job.TrainingReport;
import org.energymonitor.prediction.timeseries.model.ModelStatus;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.settings.EngineSettingsLoader;
import org.energymonitor.prediction.timeseries.stats.HealthReport;
import org.opensearch.common.settings.Settings;

public class PredictionEngineTests extends AbstractPredictionTest {
    private List<Sample> samples;
    private MutableClock clock;
    private InMemoryTelemetryStore store;
    private Settings settings;
    private PredictionEngine engine;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        samples = dailySine(START, 4 * 24 * 7, Duration.ofMinutes(15), 500, 100, 10, 7);
        clock = new MutableClock(lastTimestamp(samples));
        settings = settings(Settings.EMPTY);
        store = new InMemoryTelemetryStore(clock, settings);
        store.addAll(samples);
        engine = new PredictionEngine(settings, clock, store);
    }

    @Override
    public void tearDown() throws Exception {
        engine.close();
        super.tearDown();
    }

    private Settings settings(Settings overrides) {
        return EngineSettingsLoader
            .load(
                null,
                Settings
                    .builder()
                    .put("prediction.tuning.params_file", createTempDir().resolve("best_params.json").toString())
                    .put("prediction.tuning.enabled", false)
                    .put(overrides)
                    .build()
            );
    }

    public void testForecastValidation() {
        expectThrows(ValidationException.class, () -> engine.forecast(0));
        expectThrows(ResourceLimitException.class, () -> engine.forecast(49));
        ValidationException e = expectThrows(ValidationException.class, () -> engine.forecast(24, -1));
        assertEquals("past_context_hours", e.getParameter());
    }

    public void testAnomalyValidation() {
        expectThrows(ValidationException.class, () -> engine.detectAnomalies(0, 0.5));
        expectThrows(ResourceLimitException.class, () -> engine.detectAnomalies(49, 0.5));
        ValidationException e = expectThrows(ValidationException.class, () -> engine.detectAnomalies(24, 0.05));
        assertEquals("sensitivity", e.getParameter());
        expectThrows(ValidationException.class, () -> engine.detectAnomalies(24, 1.1));
    }

    public void testUntrainedModels() {
        expectThrows(ModelNotTrainedException.class, () -> engine.forecast(24));
        expectThrows(ModelNotTrainedException.class, () -> engine.detectAnomalies(24, 0.5));
    }

    public void testTrainForecastAndDetect() {
        TrainingReport report = engine.trainModels();
        assertTrue(report.allTrained());

        List<ForecastPoint> forecast = engine.forecast(24);
        assertEquals(24, forecast.size());
        for (int i = 1; i < forecast.size(); i++) {
            assertTrue(forecast.get(i).getTimestamp().isAfter(forecast.get(i - 1).getTimestamp()));
        }
        for (ForecastPoint point : forecast) {
            assertTrue(point.getLowerBound() <= point.getPredictedValue());
            assertTrue(point.getPredictedValue() <= point.getUpperBound());
        }

        AnomalyReport anomalies = engine.detectAnomalies(24, 0.5);
        assertFalse(anomalies.isDegraded());
        assertEquals(anomalies.getAnomalies().size(), anomalies.getSummary().getCount());
    }

    public void testStatus() {
        Map<String, ModelStatus> status = engine.getStatus();
        assertEquals(2, status.size());
        assertFalse(status.get(CommonMessages.FORECASTER).isTrained());
        assertFalse(status.get(CommonMessages.ANOMALY_DETECTOR).isTrained());

        engine.trainModels();

        ModelStatus forecaster = engine.getStatus().get(CommonMessages.FORECASTER);
        assertTrue(forecaster.isTrained());
        assertEquals(clock.instant(), forecaster.getLastTrained());
        assertEquals(samples.size(), engine.getStatus().get(CommonMessages.ANOMALY_DETECTOR).getDataPointsUsed());
    }

    public void testHealth() {
        HealthReport initial = engine.getHealth();
        assertEquals(HealthReport.Status.INITIALIZING, initial.getStatus());
        assertEquals(HealthReport.Status.HEALTHY, initial.getComponent(HealthReport.DATABASE).getStatus());
        assertEquals(HealthReport.Status.INITIALIZING, initial.getComponent(HealthReport.SCHEDULER).getStatus());

        engine.trainModels();
        engine.start();

        HealthReport healthy = engine.getHealth();
        assertEquals(HealthReport.Status.HEALTHY, healthy.getStatus());
        assertEquals(HealthReport.Status.HEALTHY, healthy.getComponent(CommonMessages.FORECASTER).getStatus());
        SchedulerStatus scheduler = engine.getSchedulerStatus();
        assertTrue(scheduler.isRunning());
        assertEquals(1, scheduler.getJobs().size());
    }

    public void testHasSufficientData() {
        assertTrue(engine.hasSufficientData());

        try (PredictionEngine empty = new PredictionEngine(settings, clock, new InMemoryTelemetryStore(clock, settings))) {
            assertFalse(empty.hasSufficientData());
        }
        try (
            PredictionEngine demanding = new PredictionEngine(
                settings(Settings.builder().put("prediction.training.min_reliable_data_days", 30.0).build()),
                clock,
                store
            )
        ) {
            assertFalse(demanding.hasSufficientData());
        }
    }

    public void testRecentDataFailureDegrades() {
        TelemetryDao failing = mock(TelemetryDao.class);
        when(failing.getTrainingData(anyInt(), anyBoolean())).thenReturn(samples);
        when(failing.getRecentData(anyInt())).thenThrow(new DatabaseConnectionException("connection reset"));
        when(failing.getDataAgeDays()).thenThrow(new DatabaseConnectionException("connection reset"));

        try (PredictionEngine degraded = new PredictionEngine(settings, clock, failing)) {
            degraded.trainModels();

            AnomalyReport report = degraded.detectAnomalies(24, 0.5);
            assertTrue(report.isDegraded());
            assertTrue(report.getAnomalies().isEmpty());

            HealthReport health = degraded.getHealth();
            assertEquals(HealthReport.Status.DEGRADED, health.getStatus());
            assertEquals(HealthReport.Status.UNHEALTHY, health.getComponent(HealthReport.DATABASE).getStatus());
        }
    }
}
