/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

import java.util.Locale;

import org.energymonitor.prediction.timeseries.constant.CommonMessages;

/**
 * Wraps any internal error while computing a forecast or scoring samples.
 */
public class PredictionException extends TimeSeriesException {
    private final String operation;

    public PredictionException(String modelId, String operation, Throwable cause) {
        super(modelId, String.format(Locale.ROOT, CommonMessages.PREDICTION_FAILED_MSG, modelId, operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
