/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.feature;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.energymonitor.prediction.timeseries.model.Sample;

public class FeatureExtractorTests extends AbstractPredictionTest {
    private static final double DELTA = 1e-9;

    public void testCyclicalEncoding() {
        // 2024-05-06 is a Monday
        List<Sample> samples = Arrays
            .asList(new Sample(Instant.parse("2024-05-06T00:00:00Z"), 10), new Sample(Instant.parse("2024-05-06T06:00:00Z"), 20));
        double[][] features = new FeatureExtractor(24).extract(samples);

        assertEquals(FeatureExtractor.NUM_FEATURES, features[0].length);
        assertEquals(0, features[0][FeatureExtractor.HOUR_SIN], DELTA);
        assertEquals(1, features[0][FeatureExtractor.HOUR_COS], DELTA);
        assertEquals(0, features[0][FeatureExtractor.DAY_SIN], DELTA);
        assertEquals(1, features[0][FeatureExtractor.DAY_COS], DELTA);
        assertEquals(1, features[1][FeatureExtractor.HOUR_SIN], DELTA);
        assertEquals(0, features[1][FeatureExtractor.HOUR_COS], DELTA);
    }

    public void testRollingStatistics() {
        List<Sample> samples = flatWithSpike(3, 10, 2, 40);
        double[][] features = new FeatureExtractor(2).extract(samples);

        assertEquals(10, features[0][FeatureExtractor.ROLLING_MEAN], DELTA);
        assertEquals(0, features[0][FeatureExtractor.ROLLING_STD], DELTA);
        assertEquals(25, features[2][FeatureExtractor.ROLLING_MEAN], DELTA);
        assertEquals(15, features[2][FeatureExtractor.DIFF_FROM_MEAN], DELTA);
        assertEquals(40, features[2][FeatureExtractor.VALUE], DELTA);
    }

    public void testDeterministic() {
        List<Sample> samples = hourlySine(100);
        FeatureExtractor extractor = new FeatureExtractor(24);
        assertTrue(Arrays.deepEquals(extractor.extract(samples), extractor.extract(samples)));
    }

    public void testEmptyInput() {
        assertEquals(0, new FeatureExtractor(24).extract(Arrays.asList()).length);
    }
}
