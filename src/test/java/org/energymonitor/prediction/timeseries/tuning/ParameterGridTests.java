/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.util.List;

import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;

public class ParameterGridTests extends AbstractPredictionTest {

    public void testCombinations() {
        ParameterGrid grid = ParameterGrid.builder().add("a", 1, 2).add("b", "x", "y", "z").build();
        List<HyperparameterSet> combinations = grid.combinations();

        assertEquals(6, grid.size());
        assertEquals(6, combinations.size());
        assertEquals(1, combinations.get(0).getInt("a", -1));
        assertEquals("x", combinations.get(0).getString("b", null));
        assertEquals(1, combinations.get(2).getInt("a", -1));
        assertEquals("z", combinations.get(2).getString("b", null));
        assertEquals(2, combinations.get(5).getInt("a", -1));
        assertEquals("z", combinations.get(5).getString("b", null));
    }

    public void testDefaultGrids() {
        assertEquals(32, HyperparameterTuner.defaultForecastGrid().size());
        assertEquals(27, HyperparameterTuner.defaultAnomalyGrid().size());
    }

    public void testParameterWithoutValues() {
        expectThrows(IllegalArgumentException.class, () -> ParameterGrid.builder().add("a"));
    }

    public void testEmptyGrid() {
        expectThrows(IllegalStateException.class, () -> ParameterGrid.builder().build());
    }
}
