/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries;

/**
 * Kind of model a hyperparameter set, tuning run or training outcome belongs to.
 */
public enum AnalysisType {
    AD("anomaly"),
    FORECAST("forecast");

    private final String recordKey;

    AnalysisType(String recordKey) {
        this.recordKey = recordKey;
    }

    /**
     * @return key of this kind's parameters in the persisted tuning record
     */
    public String getRecordKey() {
        return recordKey;
    }

    public boolean isForecast() {
        return this == FORECAST;
    }

    public boolean isAD() {
        return this == AD;
    }
}
