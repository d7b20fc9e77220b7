/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.energymonitor.prediction.timeseries.AnalysisType;
import org.energymonitor.prediction.timeseries.common.exception.TimeSeriesException;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Persists the latest {@link TuningResult} as a JSON document:
 *
 * <pre>
 * {
 *   "forecast": { ... },
 *   "anomaly": { ... },
 *   "tuned_at": "2024-05-01T00:00:00Z",
 *   "metrics": { "forecast_mae": 12.3, "anomaly_score": 0.04 }
 * }
 * </pre>
 *
 * A missing or unreadable document loads as empty.
 */
public class HyperparameterStore {
    private static final Logger logger = LogManager.getLogger(HyperparameterStore.class);

    public static final String TUNED_AT_FIELD = "tuned_at";
    public static final String METRICS_FIELD = "metrics";

    private static final Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().setPrettyPrinting().create();

    private final Path file;

    public HyperparameterStore(Path file) {
        this.file = file;
    }

    /**
     * Writes the result, replacing any previous document.
     *
     * @param result result to persist
     * @throws TimeSeriesException if the file cannot be written
     */
    public void save(TuningResult result) {
        JsonObject root = new JsonObject();
        for (AnalysisType type : AnalysisType.values()) {
            HyperparameterSet params = result.getParams(type);
            if (params != null) {
                root.add(type.getRecordKey(), gson.toJsonTree(params.asMap()));
            }
        }
        if (result.getTunedAt() != null) {
            root.addProperty(TUNED_AT_FIELD, result.getTunedAt().toString());
        }
        root.add(METRICS_FIELD, gson.toJsonTree(result.getMetrics()));

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(root, writer);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TimeSeriesException(null, "Failed to save tuned parameters to " + file, e);
        }
        logger.info("Saved best parameters to {}", file);
    }

    /**
     * @return the persisted result, empty when the file is absent or corrupt
     */
    public Optional<TuningResult> load() {
        if (false == Files.exists(file)) {
            logger.info("No cached parameters found at {}, using defaults", file);
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (false == parsed.isJsonObject()) {
                logger.warn("Ignoring parameter file {}: not a JSON object", file);
                return Optional.empty();
            }
            JsonObject root = parsed.getAsJsonObject();
            HyperparameterSet forecast = readParams(root, AnalysisType.FORECAST.getRecordKey());
            HyperparameterSet anomaly = readParams(root, AnalysisType.AD.getRecordKey());
            Instant tunedAt = root.has(TUNED_AT_FIELD) ? Instant.parse(root.get(TUNED_AT_FIELD).getAsString()) : null;
            Map<String, Double> metrics = new LinkedHashMap<>();
            if (root.has(METRICS_FIELD)) {
                for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject(METRICS_FIELD).entrySet()) {
                    metrics.put(entry.getKey(), entry.getValue().getAsDouble());
                }
            }
            logger.info("Loaded parameters from {}", file);
            return Optional.of(new TuningResult(forecast, anomaly, tunedAt, metrics));
        } catch (IOException | RuntimeException e) {
            logger.error(new ParameterizedMessage("Failed to load parameters from [{}], using defaults", file), e);
            return Optional.empty();
        }
    }

    private static HyperparameterSet readParams(JsonObject root, String key) {
        if (false == root.has(key) || false == root.get(key).isJsonObject()) {
            return null;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject(key).entrySet()) {
            JsonElement value = entry.getValue();
            if (false == value.isJsonPrimitive()) {
                continue;
            }
            JsonPrimitive primitive = value.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                params.put(entry.getKey(), primitive.getAsBoolean());
            } else if (primitive.isNumber()) {
                params.put(entry.getKey(), primitive.getAsDouble());
            } else {
                params.put(entry.getKey(), primitive.getAsString());
            }
        }
        return new HyperparameterSet(params);
    }
}
