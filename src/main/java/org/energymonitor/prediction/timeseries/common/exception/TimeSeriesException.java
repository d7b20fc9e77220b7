/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

/**
 * Base exception of the prediction engine. Carries the name of the model the
 * failure relates to, when there is one.
 */
public class TimeSeriesException extends RuntimeException {

    private String modelId;
    // countedInStats tells whether the exception should be counted as a
    // failure in training reports and health.
    private boolean countedInStats = true;

    public TimeSeriesException(String message) {
        super(message);
    }

    /**
     * Constructor with a model ID and a message.
     *
     * @param modelId model ID
     * @param message message of the exception
     */
    public TimeSeriesException(String modelId, String message) {
        super(message);
        this.modelId = modelId;
    }

    public TimeSeriesException(String modelId, String message, Throwable cause) {
        super(message, cause);
        this.modelId = modelId;
    }

    public TimeSeriesException(Throwable cause) {
        super(cause);
    }

    /**
     * Returns the ID of the model, may be null.
     *
     * @return model ID
     */
    public String getModelId() {
        return this.modelId;
    }

    /**
     * Returns if the exception should be counted in stats.
     *
     * @return true if should count the exception in stats; otherwise return false
     */
    public boolean isCountedInStats() {
        return countedInStats;
    }

    /**
     * Set if the exception should be counted in stats.
     *
     * @param countInStats count the exception in stats
     * @return the exception itself
     */
    public TimeSeriesException countedInStats(boolean countInStats) {
        this.countedInStats = countInStats;
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(modelId);
        sb.append(' ');
        sb.append(super.toString());
        return sb.toString();
    }
}
