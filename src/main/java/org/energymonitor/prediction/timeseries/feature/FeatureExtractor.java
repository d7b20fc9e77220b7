/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.feature;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.util.DataUtil;

import com.google.common.base.Preconditions;

/**
 * Turns an ordered sample sequence into one fixed-width feature vector per
 * sample. Deterministic for a given input and window size.
 *
 * Columns, in order: raw value, sine and cosine of the UTC hour of day,
 * sine and cosine of the UTC day of week (Monday is 0), trailing rolling mean,
 * trailing rolling standard deviation, and value minus rolling mean.
 *
 * Input is expected to be validated: ascending, no duplicate timestamps.
 */
public class FeatureExtractor {
    public static final int VALUE = 0;
    public static final int HOUR_SIN = 1;
    public static final int HOUR_COS = 2;
    public static final int DAY_SIN = 3;
    public static final int DAY_COS = 4;
    public static final int ROLLING_MEAN = 5;
    public static final int ROLLING_STD = 6;
    public static final int DIFF_FROM_MEAN = 7;
    public static final int NUM_FEATURES = 8;

    private static final double HOURS_PER_DAY = 24.0;
    private static final double DAYS_PER_WEEK = 7.0;

    private final int rollingWindow;

    public FeatureExtractor(int rollingWindow) {
        Preconditions.checkArgument(rollingWindow > 0, "rolling window must be positive");
        this.rollingWindow = rollingWindow;
    }

    public int getRollingWindow() {
        return rollingWindow;
    }

    /**
     * @param samples ascending samples
     * @return a samples.size() x {@link #NUM_FEATURES} matrix
     */
    public double[][] extract(List<Sample> samples) {
        double[] values = DataUtil.values(samples);
        double[] rollingMean = DataUtil.trailingRollingMean(values, rollingWindow);
        double[] rollingStd = DataUtil.trailingRollingStd(values, rollingWindow);

        double[][] features = new double[samples.size()][NUM_FEATURES];
        for (int i = 0; i < features.length; i++) {
            ZonedDateTime time = samples.get(i).getTimestamp().atZone(ZoneOffset.UTC);
            double hourAngle = 2 * Math.PI * time.getHour() / HOURS_PER_DAY;
            double dayAngle = 2 * Math.PI * dayIndex(time.getDayOfWeek()) / DAYS_PER_WEEK;

            double[] row = features[i];
            row[VALUE] = values[i];
            row[HOUR_SIN] = Math.sin(hourAngle);
            row[HOUR_COS] = Math.cos(hourAngle);
            row[DAY_SIN] = Math.sin(dayAngle);
            row[DAY_COS] = Math.cos(dayAngle);
            row[ROLLING_MEAN] = rollingMean[i];
            row[ROLLING_STD] = rollingStd[i];
            row[DIFF_FROM_MEAN] = values[i] - rollingMean[i];
        }
        return features;
    }

    // Monday = 0 ... Sunday = 6
    private static int dayIndex(DayOfWeek day) {
        return day.getValue() - 1;
    }
}
