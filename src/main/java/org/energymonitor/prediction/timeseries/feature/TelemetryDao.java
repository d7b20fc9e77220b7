/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.feature;

import java.util.List;

import org.energymonitor.prediction.timeseries.model.Sample;

/**
 * Read access to stored power samples. Implementations throw
 * {@link org.energymonitor.prediction.timeseries.common.exception.DatabaseConnectionException}
 * when the store cannot be reached. Every returned list is ascending by
 * timestamp.
 */
public interface TelemetryDao {

    /**
     * Samples from now - days to now.
     *
     * @param days number of days to look back
     * @param downsampleHourly if true, one mean value per hour bucket; hours
     *        without raw samples are absent
     * @return ascending samples
     */
    List<Sample> getTrainingData(int days, boolean downsampleHourly);

    /**
     * Full resolution samples of the most recent hours, capped to the
     * implementation's maximum row count.
     *
     * @param hours number of hours to look back
     * @return ascending samples
     */
    List<Sample> getRecentData(int hours);

    /**
     * @return age in days of the oldest qualifying sample, 0.0 when none exists
     */
    double getDataAgeDays();
}
