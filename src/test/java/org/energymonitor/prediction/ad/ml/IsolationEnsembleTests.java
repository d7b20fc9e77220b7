/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.ml;

import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.energymonitor.prediction.timeseries.feature.FeatureExtractor;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;

import com.google.common.collect.ImmutableMap;

public class IsolationEnsembleTests extends AbstractPredictionTest {

    public void testAutoContamination() {
        assertEquals(0.005, IsolationEnsemble.contamination(IsolationEnsemble.defaultParams()), 0);
        assertEquals(0.02, IsolationEnsemble.contamination(new HyperparameterSet(ImmutableMap.of(IsolationEnsemble.CONTAMINATION, 0.02))), 0);
    }

    public void testContaminationOutOfRange() {
        expectThrows(IllegalArgumentException.class, () -> IsolationEnsemble.contamination(new HyperparameterSet(ImmutableMap.of(IsolationEnsemble.CONTAMINATION, 0.9))));
    }

    public void testColumnSelectionIsSeeded() {
        int[] first = IsolationEnsemble.selectColumns(8, 0.5, 42);
        assertEquals(4, first.length);
        assertArrayEquals(first, IsolationEnsemble.selectColumns(8, 0.5, 42));
        assertEquals(8, IsolationEnsemble.selectColumns(8, 1.0, 42).length);
        assertEquals(1, IsolationEnsemble.selectColumns(8, 0.01, 42).length);
    }

    public void testDecisionFunctionFlagsSpike() {
        double[][] features = new FeatureExtractor(24).extract(flatWithSpike(50, 100, 25, 500));
        IsolationEnsemble ensemble = IsolationEnsemble.fit(features, HyperparameterSet.EMPTY);

        double[] decisions = ensemble.decisionFunction(features);
        double[] scores = ensemble.score(features);
        int lowest = 0;
        for (int i = 1; i < decisions.length; i++) {
            if (decisions[i] < decisions[lowest]) {
                lowest = i;
            }
        }
        assertEquals(25, lowest);
        assertTrue(decisions[25] < 0);
        assertEquals(ensemble.getOffset() - scores[25], decisions[25], 1e-12);
    }

    public void testFitIsDeterministic() {
        double[][] features = new FeatureExtractor(24).extract(hourlySine(100));
        HyperparameterSet params = new HyperparameterSet(ImmutableMap.of(IsolationEnsemble.N_ESTIMATORS, 20));
        assertArrayEquals(
            IsolationEnsemble.fit(features, params).decisionFunction(features),
            IsolationEnsemble.fit(features, params).decisionFunction(features),
            1e-12
        );
    }

    public void testRejectsInvalidMaxFeatures() {
        double[][] features = new FeatureExtractor(24).extract(hourlySine(60));
        expectThrows(IllegalArgumentException.class, () -> IsolationEnsemble.fit(features, new HyperparameterSet(ImmutableMap.of(IsolationEnsemble.MAX_FEATURES, 1.5))));
    }
}
