/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.forecast.model;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.annotation.Generated;

import com.google.common.base.Objects;

/**
 * Forecast for one hour. The point estimate and the lower bound are never
 * negative; the upper bound is left as computed.
 */
public class ForecastPoint {
    private final Instant timestamp;
    private final double predictedValue;
    private final double lowerBound;
    private final double upperBound;

    public ForecastPoint(Instant timestamp, double predictedValue, double lowerBound, double upperBound) {
        this.timestamp = timestamp;
        this.predictedValue = predictedValue;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getPredictedValue() {
        return predictedValue;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("timestamp", timestamp)
            .append("predictedValue", predictedValue)
            .append("lowerBound", lowerBound)
            .append("upperBound", upperBound)
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
        ForecastPoint that = (ForecastPoint) o;
        return Objects.equal(timestamp, that.timestamp)
            && Double.compare(predictedValue, that.predictedValue) == 0
            && Double.compare(lowerBound, that.lowerBound) == 0
            && Double.compare(upperBound, that.upperBound) == 0;
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(timestamp, predictedValue, lowerBound, upperBound);
    }
}
