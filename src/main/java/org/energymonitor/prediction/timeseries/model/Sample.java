/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.model;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.annotation.Generated;

import com.google.common.base.Objects;

/**
 * One power reading. Model-facing sequences of samples are ascending by
 * timestamp with no duplicate timestamps.
 */
public class Sample {
    private final Instant timestamp;
    private final double value;

    public Sample(Instant timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("timestamp", timestamp).append("value", value).toString();
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
        Sample sample = (Sample) o;
        return Double.compare(sample.value, value) == 0 && Objects.equal(timestamp, sample.timestamp);
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(timestamp, value);
    }
}
