/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.settings;

import java.util.List;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.unit.TimeValue;

import com.google.common.collect.ImmutableList;

/**
 * Engine-wide settings shared by training, tuning and scheduling.
 */
public final class TimeSeriesSettings {

    private TimeSeriesSettings() {}

    public static final String ML_THREAD_POOL_NAME = "prediction_ml";

    // ======================================
    // Training
    // ======================================
    // minimum number of samples a model needs before it can be fitted
    public static final Setting<Integer> MIN_TRAINING_DATA_POINTS = Setting
        .intSetting("prediction.training.min_data_points", 48, 2, Setting.Property.NodeScope);

    public static final Setting<Integer> TRAINING_WINDOW_DAYS = Setting
        .intSetting("prediction.training.window_days", 7, 1, 365, Setting.Property.NodeScope);

    public static final Setting<TimeValue> TRAINING_INTERVAL = Setting
        .positiveTimeSetting("prediction.training.interval", TimeValue.timeValueHours(24), Setting.Property.NodeScope);

    public static final Setting<Double> MIN_RELIABLE_DATA_DAYS = Setting
        .doubleSetting("prediction.training.min_reliable_data_days", 0.0, 0.0, Setting.Property.NodeScope);

    // ======================================
    // Tuning
    // ======================================
    public static final Setting<Boolean> TUNING_ENABLED = Setting
        .boolSetting("prediction.tuning.enabled", true, Setting.Property.NodeScope);

    public static final Setting<TimeValue> TUNING_INTERVAL = Setting
        .positiveTimeSetting("prediction.tuning.interval", TimeValue.timeValueDays(7), Setting.Property.NodeScope);

    public static final Setting<Integer> TUNING_WINDOW_DAYS = Setting
        .intSetting("prediction.tuning.window_days", 14, 1, 365, Setting.Property.NodeScope);

    public static final Setting<Integer> TUNING_CV_FOLDS = Setting
        .intSetting("prediction.tuning.cv_folds", 4, 1, 30, Setting.Property.NodeScope);

    public static final Setting<Integer> TUNING_MIN_TRAIN_DAYS = Setting
        .intSetting("prediction.tuning.min_train_days", 3, 1, 365, Setting.Property.NodeScope);

    public static final Setting<Integer> TUNING_VALIDATION_DAYS = Setting
        .intSetting("prediction.tuning.validation_days", 1, 1, 30, Setting.Property.NodeScope);

    public static final Setting<String> TUNING_PARAMS_FILE = Setting
        .simpleString("prediction.tuning.params_file", "best_params.json", Setting.Property.NodeScope);

    // ======================================
    // Scheduling and thread pool
    // ======================================
    public static final Setting<TimeValue> MISFIRE_GRACE_TIME = Setting
        .timeSetting("prediction.scheduler.misfire_grace", TimeValue.timeValueHours(1), TimeValue.ZERO, Setting.Property.NodeScope);

    public static final Setting<Integer> ML_THREAD_POOL_SIZE = Setting
        .intSetting("prediction.thread_pool.ml.size", 2, 1, 64, Setting.Property.NodeScope);

    public static final Setting<Integer> ML_THREAD_POOL_QUEUE_SIZE = Setting
        .intSetting("prediction.thread_pool.ml.queue_size", 100, 1, Setting.Property.NodeScope);

    // ======================================
    // Query and request limits
    // ======================================
    public static final Setting<Integer> MAX_QUERY_ROWS = Setting
        .intSetting("prediction.query.max_rows", 50000, 1, Setting.Property.NodeScope);

    public static final Setting<Integer> MAX_RECENT_QUERY_ROWS = Setting
        .intSetting("prediction.query.recent_max_rows", 10000, 1, Setting.Property.NodeScope);

    public static final Setting<Integer> MIN_REQUEST_HOURS = Setting
        .intSetting("prediction.request.min_hours", 1, 1, Setting.Property.NodeScope);

    public static final double MIN_SENSITIVITY = 0.1;
    public static final double MAX_SENSITIVITY = 1.0;

    // ======================================
    // Feature pipeline
    // ======================================
    public static final Setting<Integer> ROLLING_WINDOW_SIZE = Setting
        .intSetting("prediction.feature.rolling_window", 24, 1, 24 * 7, Setting.Property.NodeScope);

    public static final List<Setting<?>> ALL_SETTINGS = ImmutableList
        .of(
            MIN_TRAINING_DATA_POINTS,
            TRAINING_WINDOW_DAYS,
            TRAINING_INTERVAL,
            MIN_RELIABLE_DATA_DAYS,
            TUNING_ENABLED,
            TUNING_INTERVAL,
            TUNING_WINDOW_DAYS,
            TUNING_CV_FOLDS,
            TUNING_MIN_TRAIN_DAYS,
            TUNING_VALIDATION_DAYS,
            TUNING_PARAMS_FILE,
            MISFIRE_GRACE_TIME,
            ML_THREAD_POOL_SIZE,
            ML_THREAD_POOL_QUEUE_SIZE,
            MAX_QUERY_ROWS,
            MAX_RECENT_QUERY_ROWS,
            MIN_REQUEST_HOURS,
            ROLLING_WINDOW_SIZE
        );
}
