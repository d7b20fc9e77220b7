/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.model;

import static org.hamcrest.Matchers.containsString;

import org.energymonitor.prediction.timeseries.AbstractPredictionTest;

import com.google.common.collect.ImmutableMap;

public class HyperparameterSetTests extends AbstractPredictionTest {
    public void testTypedAccessorsCoerce() {
        HyperparameterSet params = new HyperparameterSet(ImmutableMap.of("n_estimators", 100.0, "mode", "additive", "daily", true));

        assertEquals(100, params.getInt("n_estimators", 0));
        assertEquals(100.0, params.getDouble("n_estimators", 0), 0);
        assertEquals("additive", params.getString("mode", "multiplicative"));
        assertTrue(params.getBoolean("daily", false));
        assertEquals(7, params.getInt("missing", 7));
        assertEquals(0.5, params.getDouble("mode", 0.5), 0);
    }

    public void testMergeKeepsOriginal() {
        HyperparameterSet base = new HyperparameterSet(ImmutableMap.of("a", 1.0, "b", 2.0));

        HyperparameterSet merged = base.merge(new HyperparameterSet(ImmutableMap.of("b", 3.0)));

        assertEquals(3.0, merged.getDouble("b", 0), 0);
        assertEquals(1.0, merged.getDouble("a", 0), 0);
        assertEquals(2.0, base.getDouble("b", 0), 0);
        assertNotEquals(base, merged);
    }

    public void testToString() {
        String text = new HyperparameterSet(ImmutableMap.of("contamination", "auto")).toString();

        assertThat(text, containsString("HyperparameterSet"));
        assertThat(text, containsString("params={contamination=auto}"));
    }
}
