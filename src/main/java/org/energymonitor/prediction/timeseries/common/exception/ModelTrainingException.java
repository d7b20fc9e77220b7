/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

import java.util.Locale;

import org.energymonitor.prediction.timeseries.constant.CommonMessages;

/**
 * Fitting failed. The model keeps its previous state.
 */
public class ModelTrainingException extends TimeSeriesException {

    public ModelTrainingException(String modelId, Throwable cause) {
        super(modelId, String.format(Locale.ROOT, CommonMessages.TRAINING_FAILED_MSG, modelId, cause.getMessage()), cause);
    }
}
