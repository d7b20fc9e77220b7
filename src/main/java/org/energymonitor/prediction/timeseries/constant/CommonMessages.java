/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.constant;

public class CommonMessages {
    // ======================================
    // Validation message
    // ======================================
    public static String HOURS_BELOW_MINIMUM = "hours must be at least %d";
    public static String NEGATIVE_PAST_CONTEXT = "past_context_hours should be non-negative";
    public static String SENSITIVITY_OUT_OF_RANGE = "sensitivity must be between %.1f and %.1f";

    // ======================================
    // Model lifecycle message
    // ======================================
    public static final String INSUFFICIENT_DATA_MSG = "Insufficient data: %d points available, %d required";
    public static final String MODEL_NOT_TRAINED_MSG = "%s model is not trained";
    public static final String TRAINING_FAILED_MSG = "Failed to train %s model: %s";
    public static final String PREDICTION_FAILED_MSG = "%s failed to %s: %s";
    public static final String RESOURCE_LIMIT_MSG = "%s exceeds the limit of %d";

    // ======================================
    // Model names
    // ======================================
    public static final String FORECASTER = "forecaster";
    public static final String ANOMALY_DETECTOR = "anomaly_detector";
}
