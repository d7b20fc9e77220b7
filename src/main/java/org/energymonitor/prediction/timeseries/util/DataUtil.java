/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.util;

import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.energymonitor.prediction.timeseries.model.Sample;

import com.google.common.base.Preconditions;

public class DataUtil {

    public static double[] values(List<Sample> samples) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getValue();
        }
        return values;
    }

    /**
     * @param values input values
     * @return arithmetic mean, NaN for empty input
     */
    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    /**
     * Sample standard deviation (n - 1 denominator). A single value has no
     * spread, so 0 is returned for it.
     *
     * @param values input values
     * @return standard deviation, NaN for empty input
     */
    public static double sampleStd(double[] values) {
        return new StandardDeviation(true).evaluate(values);
    }

    /**
     * Mean over the trailing window [i - window + 1, i]. The window shrinks at
     * the start of the sequence instead of producing NaN.
     *
     * @param values input values
     * @param window window width
     * @return rolling mean per index
     */
    public static double[] trailingRollingMean(double[] values, int window) {
        Preconditions.checkArgument(window > 0, "window must be positive");
        double[] result = new double[values.length];
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            result[i] = sum / Math.min(i + 1, window);
        }
        return result;
    }

    /**
     * Sample standard deviation over the trailing window [i - window + 1, i],
     * shrinking at the start of the sequence; 0 where the window holds one value.
     *
     * @param values input values
     * @param window window width
     * @return rolling standard deviation per index
     */
    public static double[] trailingRollingStd(double[] values, int window) {
        Preconditions.checkArgument(window > 0, "window must be positive");
        StandardDeviation std = new StandardDeviation(true);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - window + 1);
            result[i] = std.evaluate(values, start, i + 1 - start);
        }
        return result;
    }

    /**
     * Mean over the centered window [i - window / 2, i + (window - 1) / 2],
     * clipped to the sequence bounds.
     *
     * @param values input values
     * @param window window width
     * @return centered rolling mean per index
     */
    public static double[] centeredRollingMean(double[] values, int window) {
        Preconditions.checkArgument(window > 0, "window must be positive");
        double[] prefix = new double[values.length + 1];
        for (int i = 0; i < values.length; i++) {
            prefix[i + 1] = prefix[i] + values[i];
        }
        int before = window / 2;
        int after = (window - 1) / 2;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - before);
            int end = Math.min(values.length - 1, i + after);
            result[i] = (prefix[end + 1] - prefix[start]) / (end - start + 1);
        }
        return result;
    }

    /**
     * Percentile with linear interpolation between the closest ranks
     * (estimation type R-7).
     *
     * @param values input values, not modified
     * @param percentile value in [0, 100]
     * @return the percentile, NaN for empty input
     */
    public static double percentile(double[] values, double percentile) {
        Preconditions.checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in [0, 100]");
        if (values.length == 0) {
            return Double.NaN;
        }
        // the estimator only accepts (0, 100]
        if (percentile == 0) {
            return StatUtils.min(values);
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percentile);
    }

    public static double meanAbsoluteError(double[] actual, double[] predicted) {
        Preconditions.checkArgument(actual.length == predicted.length, "length mismatch");
        Preconditions.checkArgument(actual.length > 0, "no values to compare");
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }
}
