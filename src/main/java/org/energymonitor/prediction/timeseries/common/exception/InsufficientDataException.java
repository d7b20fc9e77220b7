/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

import java.util.Locale;

import org.energymonitor.prediction.timeseries.constant.CommonMessages;

/**
 * Thrown when fewer samples are available than training requires.
 */
public class InsufficientDataException extends ClientException {
    private final int actual;
    private final int required;

    public InsufficientDataException(String modelId, int actual, int required) {
        super(modelId, String.format(Locale.ROOT, CommonMessages.INSUFFICIENT_DATA_MSG, actual, required));
        this.actual = actual;
        this.required = required;
        countedInStats(false);
    }

    public int getActual() {
        return actual;
    }

    public int getRequired() {
        return required;
    }
}
