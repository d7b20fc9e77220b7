/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.ml;

import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.FLAGGED_FRACTION_RANGE;
import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.MIN_FLAGGED_FRACTION;
import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.THRESHOLD_FLOOR;

import org.energymonitor.prediction.timeseries.util.DataUtil;

/**
 * Maps the user-facing sensitivity to a score threshold over the current
 * batch of normalized scores.
 *
 * Sensitivity is squared, so that high settings do not flag too much, and
 * mapped to a target flagged fraction between about 1% (0.1) and 15% (1.0).
 * The threshold is the score percentile leaving that fraction above it,
 * never lower than 0.5.
 */
public final class AdaptiveThreshold {

    private AdaptiveThreshold() {}

    public static double targetFraction(double sensitivity) {
        return MIN_FLAGGED_FRACTION + FLAGGED_FRACTION_RANGE * sensitivity * sensitivity;
    }

    /**
     * @param normalizedScores scores in [0, 1], 1 is most anomalous
     * @param sensitivity value in [0.1, 1.0]
     * @return threshold a score must exceed to be flagged
     */
    public static double threshold(double[] normalizedScores, double sensitivity) {
        if (normalizedScores.length == 0) {
            return THRESHOLD_FLOOR;
        }
        double percentile = DataUtil.percentile(normalizedScores, 100.0 * (1.0 - targetFraction(sensitivity)));
        return Math.max(THRESHOLD_FLOOR, percentile);
    }

    /**
     * Rescales decision values to [0, 1] where the lowest decision becomes 1.
     * All scores are 0 when every decision is the same.
     *
     * @param decisions decision function values, negative is anomalous
     * @return normalized scores
     */
    public static double[] normalize(double[] decisions) {
        double[] normalized = new double[decisions.length];
        if (decisions.length == 0) {
            return normalized;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double d : decisions) {
            min = Math.min(min, d);
            max = Math.max(max, d);
        }
        double range = max - min;
        if (false == range > 0) {
            return normalized;
        }
        for (int i = 0; i < decisions.length; i++) {
            normalized[i] = 1.0 - (decisions[i] - min) / range;
        }
        return normalized;
    }
}
