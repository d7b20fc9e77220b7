/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.model;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class AnomalySummary {
    public static final AnomalySummary EMPTY = new AnomalySummary(0, 0.0, Severity.LOW);

    private final int count;
    private final double meanScore;
    private final Severity severity;

    public AnomalySummary(int count, double meanScore, Severity severity) {
        this.count = count;
        this.meanScore = meanScore;
        this.severity = severity;
    }

    public int getCount() {
        return count;
    }

    public double getMeanScore() {
        return meanScore;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("count", count)
            .append("meanScore", meanScore)
            .append("severity", severity.getName())
            .toString();
    }
}
