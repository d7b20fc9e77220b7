/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Public snapshot of a model's state, without the fitted model itself.
 */
public class ModelStatus {
    public static final String IS_TRAINED_FIELD = "is_trained";
    public static final String LAST_TRAINED_FIELD = "last_trained";
    public static final String DATA_POINTS_USED_FIELD = "data_points_used";

    private final String modelName;
    private final boolean trained;
    private final Instant lastTrained;
    private final int dataPointsUsed;

    public ModelStatus(String modelName, boolean trained, Instant lastTrained, int dataPointsUsed) {
        this.modelName = modelName;
        this.trained = trained;
        this.lastTrained = lastTrained;
        this.dataPointsUsed = dataPointsUsed;
    }

    public String getModelName() {
        return modelName;
    }

    public boolean isTrained() {
        return trained;
    }

    /**
     * @return last training time, null when never trained
     */
    public Instant getLastTrained() {
        return lastTrained;
    }

    public int getDataPointsUsed() {
        return dataPointsUsed;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(IS_TRAINED_FIELD, trained);
        map.put(LAST_TRAINED_FIELD, lastTrained == null ? null : lastTrained.toString());
        map.put(DATA_POINTS_USED_FIELD, dataPointsUsed);
        return map;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("modelName", modelName)
            .append("trained", trained)
            .append("lastTrained", lastTrained)
            .append("dataPointsUsed", dataPointsUsed)
            .toString();
    }
}
