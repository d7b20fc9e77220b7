/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

import java.util.Locale;

import org.energymonitor.prediction.timeseries.constant.CommonMessages;

public class ModelNotTrainedException extends ClientException {

    public ModelNotTrainedException(String modelId) {
        super(modelId, String.format(Locale.ROOT, CommonMessages.MODEL_NOT_TRAINED_MSG, modelId));
    }
}
