/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.ml;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.energymonitor.prediction.ad.model.AnomalyPoint;
import org.energymonitor.prediction.ad.model.AnomalySummary;
import org.energymonitor.prediction.ad.model.AnomalyType;
import org.energymonitor.prediction.ad.model.Severity;
import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.energymonitor.prediction.timeseries.feature.FeatureExtractor;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.opensearch.common.settings.Settings;

public class AnomalyModelTests extends AbstractPredictionTest {
    private MutableClock clock;
    private AnomalyModel model;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        clock = new MutableClock(START.plusSeconds(3600L * 200));
        model = new AnomalyModel(clock, Settings.EMPTY, new FeatureExtractor(24));
    }

    public void testSpikeIsDetected() {
        List<Sample> samples = flatWithSpike(50, 100, 25, 500);
        model.train(samples, IsolationEnsemble.defaultParams());

        List<AnomalyPoint> anomalies = model.detect(samples, 0.8);

        Instant spike = samples.get(25).getTimestamp();
        AnomalyPoint flagged = anomalies.stream().filter(a -> a.getTimestamp().equals(spike)).findFirst().orElse(null);
        assertNotNull("spike was not flagged: " + anomalies, flagged);
        assertEquals(AnomalyType.SPIKE, flagged.getAnomalyType());
        assertEquals(500, flagged.getActualValue(), 0);
        assertEquals((23 * 100 + 500) / 24.0, flagged.getExpectedValue(), 1e-9);
        assertEquals(1.0, flagged.getAnomalyScore(), 1e-9);
    }

    public void testDipIsDetected() {
        List<Sample> samples = flatWithSpike(50, 1000, 25, 100);
        model.train(samples, IsolationEnsemble.defaultParams());

        List<AnomalyPoint> anomalies = model.detect(samples, 0.8);

        Instant dip = samples.get(25).getTimestamp();
        assertTrue(anomalies.stream().anyMatch(a -> a.getTimestamp().equals(dip) && a.getAnomalyType() == AnomalyType.DIP));
    }

    public void testHigherSensitivityFlagsAtLeastAsMany() {
        List<Sample> samples = withOutliers(hourlySine(200));
        model.train(samples, IsolationEnsemble.defaultParams());

        int relaxed = model.detect(samples, 0.3).size();
        int strict = model.detect(samples, 0.9).size();

        assertThat(strict, greaterThanOrEqualTo(relaxed));
    }

    public void testScoresBelowFloorAreNeverFlagged() {
        List<Sample> samples = withOutliers(hourlySine(200));
        model.train(samples, IsolationEnsemble.defaultParams());

        for (AnomalyPoint anomaly : model.detect(samples, 1.0)) {
            assertThat(anomaly.getAnomalyScore(), greaterThan(0.5));
        }
    }

    public void testFlatSeriesHasNoAnomalies() {
        List<Sample> samples = flatWithSpike(60, 100, -1, 0);
        model.train(samples, IsolationEnsemble.defaultParams());
        assertTrue(model.detect(samples, 1.0).isEmpty());
    }

    public void testEmptyInput() {
        model.train(hourlySine(60), IsolationEnsemble.defaultParams());
        assertTrue(model.detect(Collections.emptyList(), 0.5).isEmpty());
    }

    public void testDetectRequiresTraining() {
        expectThrows(ModelNotTrainedException.class, () -> model.detect(hourlySine(60), 0.5));
    }

    public void testSensitivityOutOfRange() {
        model.train(hourlySine(60), IsolationEnsemble.defaultParams());
        expectThrows(IllegalArgumentException.class, () -> model.detect(hourlySine(60), 1.5));
    }

    public void testSummarize() {
        assertEquals(AnomalySummary.EMPTY, model.summarize(Collections.emptyList()));
        assertEquals(0, model.summarize(Collections.emptyList()).getCount());

        assertEquals(Severity.HIGH, model.summarize(points(11, 0.1)).getSeverity());
        assertEquals(Severity.HIGH, model.summarize(points(1, 0.9)).getSeverity());
        assertEquals(Severity.MEDIUM, model.summarize(points(6, 0.1)).getSeverity());
        assertEquals(Severity.MEDIUM, model.summarize(points(1, 0.7)).getSeverity());
        assertEquals(Severity.LOW, model.summarize(points(5, 0.6)).getSeverity());

        AnomalySummary summary = model.summarize(points(2, 0.4));
        assertEquals(2, summary.getCount());
        assertEquals(0.4, summary.getMeanScore(), 1e-9);
    }

    private static List<Sample> withOutliers(List<Sample> samples) {
        List<Sample> result = new ArrayList<>(samples);
        result.set(50, new Sample(result.get(50).getTimestamp(), 1500));
        result.set(120, new Sample(result.get(120).getTimestamp(), 0));
        result.set(170, new Sample(result.get(170).getTimestamp(), 1200));
        return result;
    }

    private static List<AnomalyPoint> points(int count, double score) {
        List<AnomalyPoint> points = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            points.add(new AnomalyPoint(START.plusSeconds(3600L * i), 300, 100, score, AnomalyType.SPIKE));
        }
        return points;
    }
}
