/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.forecast.settings;

import java.util.List;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.unit.TimeValue;

import com.google.common.collect.ImmutableList;

public final class ForecastSettings {

    private ForecastSettings() {}

    // ======================================
    // cache
    // ======================================
    public static final Setting<TimeValue> FORECAST_CACHE_TTL = Setting
        .positiveTimeSetting("prediction.forecast.cache_ttl", TimeValue.timeValueSeconds(3600), Setting.Property.NodeScope);

    // horizon computed on a cache miss; requests are served from its prefix
    public static final Setting<Integer> MAX_HORIZON_HOURS = Setting
        .intSetting("prediction.forecast.max_horizon_hours", 168, 1, 24 * 31, Setting.Property.NodeScope);

    // ======================================
    // resource constraint
    // ======================================
    public static final Setting<Integer> MAX_FORECAST_HOURS = Setting
        .intSetting("prediction.forecast.max_hours", 48, 1, 24 * 31, Setting.Property.NodeScope);

    public static final List<Setting<?>> ALL_SETTINGS = ImmutableList.of(FORECAST_CACHE_TTL, MAX_HORIZON_HOURS, MAX_FORECAST_HOURS);

    // ======================================
    // model defaults
    // ======================================
    public static final double DEFAULT_CHANGEPOINT_PRIOR_SCALE = 0.05;
    public static final double DEFAULT_SEASONALITY_PRIOR_SCALE = 1.0;
    public static final String DEFAULT_SEASONALITY_MODE = "additive";

    public static final int DAILY_FOURIER_ORDER = 4;
    public static final int WEEKLY_FOURIER_ORDER = 3;
    public static final int MAX_CHANGEPOINTS = 25;
    public static final double CHANGEPOINT_RANGE = 0.8;
    // z value of a central 80% interval
    public static final double INTERVAL_Z = 1.2815515655446004;
}
