/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

/**
 * Raised by data query implementations when the backing store cannot be reached.
 */
public class DatabaseConnectionException extends TimeSeriesException {

    public DatabaseConnectionException(String message) {
        super(message);
    }

    public DatabaseConnectionException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
