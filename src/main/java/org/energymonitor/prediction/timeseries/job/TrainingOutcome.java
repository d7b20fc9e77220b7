/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.AnalysisType;
import org.energymonitor.prediction.timeseries.common.exception.TimeSeriesException;

/**
 * Result of training one model in a training cycle.
 */
public class TrainingOutcome {

    public enum Status {
        TRAINED,
        SKIPPED,
        FAILED;

        public String getName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final AnalysisType analysisType;
    private final Status status;
    private final int dataPointsUsed;
    private final String message;

    private TrainingOutcome(AnalysisType analysisType, Status status, int dataPointsUsed, String message) {
        this.analysisType = analysisType;
        this.status = status;
        this.dataPointsUsed = dataPointsUsed;
        this.message = message;
    }

    public static TrainingOutcome trained(AnalysisType analysisType, int dataPointsUsed) {
        return new TrainingOutcome(analysisType, Status.TRAINED, dataPointsUsed, null);
    }

    /**
     * Exceptions not counted in stats, such as insufficient data, skip the
     * model; everything else fails it.
     *
     * @param analysisType model kind
     * @param e training exception
     * @return outcome describing the exception
     */
    public static TrainingOutcome fromException(AnalysisType analysisType, Exception e) {
        if (e instanceof TimeSeriesException && false == ((TimeSeriesException) e).isCountedInStats()) {
            return new TrainingOutcome(analysisType, Status.SKIPPED, 0, e.getMessage());
        }
        return new TrainingOutcome(analysisType, Status.FAILED, 0, e.getMessage());
    }

    public AnalysisType getAnalysisType() {
        return analysisType;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isTrained() {
        return status == Status.TRAINED;
    }

    public int getDataPointsUsed() {
        return dataPointsUsed;
    }

    /**
     * @return reason for a skipped or failed outcome, null when trained
     */
    public String getMessage() {
        return message;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.getName());
        if (status == Status.TRAINED) {
            map.put("data_points_used", dataPointsUsed);
        } else {
            map.put("message", message);
        }
        return map;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("analysisType", analysisType)
            .append("status", status)
            .append("dataPointsUsed", dataPointsUsed)
            .append("message", message)
            .toString();
    }
}
