/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.settings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings;
import org.energymonitor.prediction.forecast.settings.ForecastSettings;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;

import com.google.common.collect.ImmutableList;

/**
 * Resolves engine settings from the bundled {@code prediction-engine.yml}, an
 * optional external YAML file and explicit overrides, in that order.
 */
public final class EngineSettingsLoader {
    private static final Logger logger = LogManager.getLogger(EngineSettingsLoader.class);

    public static final String DEFAULT_RESOURCE = "prediction-engine.yml";
    public static final String KEY_PREFIX = "prediction.";

    public static final List<Setting<?>> ALL_SETTINGS = ImmutableList
        .<Setting<?>>builder()
        .addAll(TimeSeriesSettings.ALL_SETTINGS)
        .addAll(ForecastSettings.ALL_SETTINGS)
        .addAll(AnomalyDetectorSettings.ALL_SETTINGS)
        .build();

    private EngineSettingsLoader() {}

    public static Settings load() {
        return load(null, Settings.EMPTY);
    }

    /**
     * @param externalFile YAML file overriding the bundled defaults, may be null
     * @param overrides settings applied last
     * @return merged settings
     * @throws IllegalArgumentException if a file cannot be parsed or a value is out of range
     */
    public static Settings load(Path externalFile, Settings overrides) {
        Settings.Builder builder = Settings.builder();
        try (InputStream in = EngineSettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                builder.loadFromStream(DEFAULT_RESOURCE, in, false);
            } else {
                logger.info("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read " + DEFAULT_RESOURCE, e);
        }

        if (externalFile != null) {
            if (false == Files.exists(externalFile)) {
                throw new IllegalArgumentException("Settings file does not exist: " + externalFile);
            }
            try {
                builder.loadFromPath(externalFile);
            } catch (IOException e) {
                throw new IllegalArgumentException("Failed to read settings file " + externalFile, e);
            }
        }

        Settings settings = builder.put(overrides).build();
        validate(settings);
        return settings;
    }

    /**
     * Reads every known setting once so out-of-range values fail fast, and
     * warns about unknown keys under the engine prefix.
     */
    static void validate(Settings settings) {
        Set<String> known = new HashSet<>();
        for (Setting<?> setting : ALL_SETTINGS) {
            setting.get(settings);
            known.add(setting.getKey());
        }
        for (String key : settings.keySet()) {
            if (key.startsWith(KEY_PREFIX) && false == known.contains(key)) {
                logger.warn("Ignoring unknown setting [{}]", key);
            }
        }
    }
}
