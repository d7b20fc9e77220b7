/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.settings;

import java.util.List;

import org.opensearch.common.settings.Setting;

import com.google.common.collect.ImmutableList;

/**
 * Anomaly detection settings.
 */
public final class AnomalyDetectorSettings {

    private AnomalyDetectorSettings() {}

    public static final Setting<Integer> MAX_ANOMALY_HOURS = Setting
        .intSetting("prediction.anomaly.max_hours", 48, 1, 24 * 31, Setting.Property.NodeScope);

    // ======================================
    // gates and classification
    // ======================================
    public static final Setting<Double> MIN_POWER_DIFF = Setting
        .doubleSetting("prediction.anomaly.min_power_diff", 50.0, 0.0, Setting.Property.NodeScope);

    public static final Setting<Double> SPIKE_MULTIPLIER = Setting
        .doubleSetting("prediction.anomaly.spike_multiplier", 1.5, 1.0, Setting.Property.NodeScope);

    public static final Setting<Double> DIP_MULTIPLIER = Setting
        .doubleSetting("prediction.anomaly.dip_multiplier", 0.5, 0.0, 1.0, Setting.Property.NodeScope);

    public static final Setting<Integer> EXPECTED_VALUE_WINDOW = Setting
        .intSetting("prediction.anomaly.expected_window", 24, 1, 24 * 7, Setting.Property.NodeScope);

    // ======================================
    // summary severity
    // ======================================
    public static final Setting<Integer> HIGH_SEVERITY_COUNT = Setting
        .intSetting("prediction.anomaly.severity.high_count", 10, 0, Setting.Property.NodeScope);

    public static final Setting<Integer> MEDIUM_SEVERITY_COUNT = Setting
        .intSetting("prediction.anomaly.severity.medium_count", 5, 0, Setting.Property.NodeScope);

    public static final Setting<Double> HIGH_SEVERITY_SCORE = Setting
        .doubleSetting("prediction.anomaly.severity.high_score", 0.8, 0.0, 1.0, Setting.Property.NodeScope);

    public static final Setting<Double> MEDIUM_SEVERITY_SCORE = Setting
        .doubleSetting("prediction.anomaly.severity.medium_score", 0.6, 0.0, 1.0, Setting.Property.NodeScope);

    public static final List<Setting<?>> ALL_SETTINGS = ImmutableList
        .of(
            MAX_ANOMALY_HOURS,
            MIN_POWER_DIFF,
            SPIKE_MULTIPLIER,
            DIP_MULTIPLIER,
            EXPECTED_VALUE_WINDOW,
            HIGH_SEVERITY_COUNT,
            MEDIUM_SEVERITY_COUNT,
            HIGH_SEVERITY_SCORE,
            MEDIUM_SEVERITY_SCORE
        );

    // ======================================
    // model defaults
    // ======================================
    public static final int DEFAULT_NUMBER_OF_TREES = 100;
    public static final int DEFAULT_SAMPLE_SIZE = 256;
    public static final double DEFAULT_MAX_FEATURES = 1.0;
    public static final String AUTO_CONTAMINATION = "auto";
    // outlier fraction used when contamination is "auto"
    public static final double AUTO_CONTAMINATION_VALUE = 0.005;
    public static final long RANDOM_SEED = 42L;

    // score floor below which nothing is flagged, whatever the sensitivity
    public static final double THRESHOLD_FLOOR = 0.5;
    public static final double MIN_FLAGGED_FRACTION = 0.01;
    public static final double FLAGGED_FRACTION_RANGE = 0.14;
}
