/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

/**
 * All exception visible to the caller: the request cannot proceed because of
 * its arguments or the current state of a model.
 */
public class ClientException extends TimeSeriesException {

    public ClientException(String message) {
        super(message);
    }

    public ClientException(String modelId, String message) {
        super(modelId, message);
    }

    public ClientException(String modelId, String message, Throwable throwable) {
        super(modelId, message, throwable);
    }
}
