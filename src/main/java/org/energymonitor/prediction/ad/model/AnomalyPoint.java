/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.model;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.annotation.Generated;

import com.google.common.base.Objects;

/**
 * A flagged sample with the value it was expected to have.
 */
public class AnomalyPoint {
    private final Instant timestamp;
    private final double actualValue;
    private final double expectedValue;
    // in [0, 1], 1 is most anomalous
    private final double anomalyScore;
    private final AnomalyType anomalyType;

    public AnomalyPoint(Instant timestamp, double actualValue, double expectedValue, double anomalyScore, AnomalyType anomalyType) {
        this.timestamp = timestamp;
        this.actualValue = actualValue;
        this.expectedValue = expectedValue;
        this.anomalyScore = anomalyScore;
        this.anomalyType = anomalyType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getActualValue() {
        return actualValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("timestamp", timestamp)
            .append("actualValue", actualValue)
            .append("expectedValue", expectedValue)
            .append("anomalyScore", anomalyScore)
            .append("anomalyType", anomalyType.getName())
            .toString();
    }

    @Generated
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AnomalyPoint that = (AnomalyPoint) o;
        return Objects.equal(timestamp, that.timestamp)
            && Double.compare(actualValue, that.actualValue) == 0
            && Double.compare(expectedValue, that.expectedValue) == 0
            && Double.compare(anomalyScore, that.anomalyScore) == 0
            && anomalyType == that.anomalyType;
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(timestamp, actualValue, expectedValue, anomalyScore, anomalyType);
    }
}
