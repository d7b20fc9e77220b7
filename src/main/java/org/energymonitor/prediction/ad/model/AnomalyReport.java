/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.model;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Anomalies found in a detection window together with their summary.
 */
public class AnomalyReport {
    private final List<AnomalyPoint> anomalies;
    private final AnomalySummary summary;
    // true when the window could not be read and the report is empty for that reason
    private final boolean degraded;

    public AnomalyReport(List<AnomalyPoint> anomalies, AnomalySummary summary) {
        this(anomalies, summary, false);
    }

    private AnomalyReport(List<AnomalyPoint> anomalies, AnomalySummary summary, boolean degraded) {
        this.anomalies = ImmutableList.copyOf(anomalies);
        this.summary = summary;
        this.degraded = degraded;
    }

    public static AnomalyReport degraded() {
        return new AnomalyReport(Collections.emptyList(), AnomalySummary.EMPTY, true);
    }

    public List<AnomalyPoint> getAnomalies() {
        return anomalies;
    }

    public AnomalySummary getSummary() {
        return summary;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
