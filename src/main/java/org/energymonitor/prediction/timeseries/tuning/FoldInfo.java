/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class FoldInfo {
    private final int fold;
    private final int trainSize;
    private final int validationSize;
    private final Instant trainStart;
    private final Instant trainEnd;
    private final Instant validationStart;
    private final Instant validationEnd;

    public FoldInfo(
        int fold,
        int trainSize,
        int validationSize,
        Instant trainStart,
        Instant trainEnd,
        Instant validationStart,
        Instant validationEnd
    ) {
        this.fold = fold;
        this.trainSize = trainSize;
        this.validationSize = validationSize;
        this.trainStart = trainStart;
        this.trainEnd = trainEnd;
        this.validationStart = validationStart;
        this.validationEnd = validationEnd;
    }

    public int getFold() {
        return fold;
    }

    public int getTrainSize() {
        return trainSize;
    }

    public int getValidationSize() {
        return validationSize;
    }

    public Instant getTrainStart() {
        return trainStart;
    }

    public Instant getTrainEnd() {
        return trainEnd;
    }

    public Instant getValidationStart() {
        return validationStart;
    }

    public Instant getValidationEnd() {
        return validationEnd;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("fold", fold)
            .append("trainSize", trainSize)
            .append("validationSize", validationSize)
            .append("trainStart", trainStart)
            .append("trainEnd", trainEnd)
            .append("validationStart", validationStart)
            .append("validationEnd", validationEnd)
            .toString();
    }
}
