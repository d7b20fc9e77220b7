/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.time.Instant;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.AnalysisType;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;

import com.google.common.collect.ImmutableMap;

/**
 * Winning hyperparameters of both models with the metrics they scored. Each
 * tuning run produces a new result; results are never modified.
 */
public class TuningResult {
    public static final String FORECAST_MAE = "forecast_mae";
    public static final String ANOMALY_SCORE = "anomaly_score";

    private final HyperparameterSet forecastParams;
    private final HyperparameterSet anomalyParams;
    private final Instant tunedAt;
    private final Map<String, Double> metrics;

    public TuningResult(HyperparameterSet forecastParams, HyperparameterSet anomalyParams, Instant tunedAt, Map<String, Double> metrics) {
        this.forecastParams = forecastParams;
        this.anomalyParams = anomalyParams;
        this.tunedAt = tunedAt;
        this.metrics = ImmutableMap.copyOf(metrics);
    }

    /**
     * @param type model kind
     * @return parameters of that kind, null when the record has none
     */
    public HyperparameterSet getParams(AnalysisType type) {
        return type.isForecast() ? forecastParams : anomalyParams;
    }

    public HyperparameterSet getForecastParams() {
        return forecastParams;
    }

    public HyperparameterSet getAnomalyParams() {
        return anomalyParams;
    }

    public Instant getTunedAt() {
        return tunedAt;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("forecast", forecastParams)
            .append("anomaly", anomalyParams)
            .append("tunedAt", tunedAt)
            .append("metrics", metrics)
            .toString();
    }
}
