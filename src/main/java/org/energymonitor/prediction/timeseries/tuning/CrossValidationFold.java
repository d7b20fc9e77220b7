/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.util.List;

import org.energymonitor.prediction.timeseries.model.Sample;

import com.google.common.collect.ImmutableList;

/**
 * Contiguous train and validation slices; every training sample precedes
 * every validation sample.
 */
public class CrossValidationFold {
    private final int foldNumber;
    private final List<Sample> trainSamples;
    private final List<Sample> validationSamples;

    public CrossValidationFold(int foldNumber, List<Sample> trainSamples, List<Sample> validationSamples) {
        this.foldNumber = foldNumber;
        this.trainSamples = ImmutableList.copyOf(trainSamples);
        this.validationSamples = ImmutableList.copyOf(validationSamples);
    }

    /**
     * @return 1-based position of the fold among the configured folds
     */
    public int getFoldNumber() {
        return foldNumber;
    }

    public List<Sample> getTrainSamples() {
        return trainSamples;
    }

    public List<Sample> getValidationSamples() {
        return validationSamples;
    }

    public FoldInfo toFoldInfo() {
        return new FoldInfo(
            foldNumber,
            trainSamples.size(),
            validationSamples.size(),
            trainSamples.get(0).getTimestamp(),
            trainSamples.get(trainSamples.size() - 1).getTimestamp(),
            validationSamples.get(0).getTimestamp(),
            validationSamples.get(validationSamples.size() - 1).getTimestamp()
        );
    }
}
