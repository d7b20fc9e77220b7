/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.model;

import java.util.Locale;

public enum AnomalyType {
    SPIKE,
    DIP,
    PATTERN_CHANGE;

    /**
     * @return lower case name, e.g. pattern_change
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies a flagged point by how far it is from its expected value.
     *
     * @param actual observed value
     * @param expected expected value
     * @param spikeMultiplier actual above expected times this is a spike
     * @param dipMultiplier actual below expected times this is a dip
     * @return anomaly type
     */
    public static AnomalyType classify(double actual, double expected, double spikeMultiplier, double dipMultiplier) {
        if (actual > expected * spikeMultiplier) {
            return SPIKE;
        }
        if (actual < expected * dipMultiplier) {
            return DIP;
        }
        return PATTERN_CHANGE;
    }
}
