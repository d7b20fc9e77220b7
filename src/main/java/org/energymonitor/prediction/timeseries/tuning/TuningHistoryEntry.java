/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.AnalysisType;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;

/**
 * One evaluated parameter combination. Diagnostics only.
 */
public class TuningHistoryEntry {
    private final AnalysisType modelKind;
    private final HyperparameterSet params;
    private final String metricName;
    private final double metric;
    private final Instant timestamp;

    public TuningHistoryEntry(AnalysisType modelKind, HyperparameterSet params, String metricName, double metric, Instant timestamp) {
        this.modelKind = modelKind;
        this.params = params;
        this.metricName = metricName;
        this.metric = metric;
        this.timestamp = timestamp;
    }

    public AnalysisType getModelKind() {
        return modelKind;
    }

    public HyperparameterSet getParams() {
        return params;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getMetric() {
        return metric;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("modelKind", modelKind)
            .append("params", params)
            .append(metricName, metric)
            .append("timestamp", timestamp)
            .toString();
    }
}
