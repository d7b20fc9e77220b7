/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.settings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings;
import org.energymonitor.prediction.forecast.settings.ForecastSettings;
import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;

public class EngineSettingsLoaderTests extends AbstractPredictionTest {
    public void testBundledDefaults() {
        Settings settings = EngineSettingsLoader.load();

        assertEquals(Integer.valueOf(7), TimeSeriesSettings.TRAINING_WINDOW_DAYS.get(settings));
        assertEquals(TimeValue.timeValueHours(24), TimeSeriesSettings.TRAINING_INTERVAL.get(settings));
        assertEquals(TimeValue.timeValueDays(7), TimeSeriesSettings.TUNING_INTERVAL.get(settings));
        assertEquals(Integer.valueOf(48), ForecastSettings.MAX_FORECAST_HOURS.get(settings));
        assertEquals(50.0, AnomalyDetectorSettings.MIN_POWER_DIFF.get(settings), 0);
        assertTrue(TimeSeriesSettings.TUNING_ENABLED.get(settings));
    }

    public void testOverridesWin() {
        Settings settings = EngineSettingsLoader.load(null, Settings.builder().put("prediction.training.window_days", 3).build());

        assertEquals(Integer.valueOf(3), TimeSeriesSettings.TRAINING_WINDOW_DAYS.get(settings));
        assertEquals(Integer.valueOf(14), TimeSeriesSettings.TUNING_WINDOW_DAYS.get(settings));
    }

    public void testInvalidValueFailsFast() {
        expectThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.load(null, Settings.builder().put("prediction.training.window_days", 0).build()));
    }

    public void testExternalFile() throws IOException {
        Path file = createTempDir().resolve("prediction.yml");
        Files.write(file, "prediction.tuning.enabled: false\nprediction.scheduler.misfire_grace: 10m\n".getBytes(StandardCharsets.UTF_8));

        Settings settings = EngineSettingsLoader.load(file, Settings.builder().put("prediction.scheduler.misfire_grace", "5m").build());

        assertFalse(TimeSeriesSettings.TUNING_ENABLED.get(settings));
        assertEquals(TimeValue.timeValueMinutes(5), TimeSeriesSettings.MISFIRE_GRACE_TIME.get(settings));
    }

    public void testMissingExternalFile() {
        expectThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.load(createTempDir().resolve("missing.yml"), Settings.EMPTY));
    }
}
