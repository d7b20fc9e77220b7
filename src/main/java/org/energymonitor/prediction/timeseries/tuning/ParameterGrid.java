/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energymonitor.prediction.timeseries.model.HyperparameterSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Candidate values per parameter name. Combinations are enumerated in
 * insertion order, the last parameter varying fastest.
 */
public class ParameterGrid {
    private final Map<String, List<Object>> candidates;

    private ParameterGrid(Map<String, List<Object>> candidates) {
        this.candidates = candidates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<HyperparameterSet> combinations() {
        List<String> names = new ArrayList<>(candidates.keySet());
        List<HyperparameterSet> result = new ArrayList<>();
        for (List<Object> values : Lists.cartesianProduct(new ArrayList<>(candidates.values()))) {
            Map<String, Object> combination = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                combination.put(names.get(i), values.get(i));
            }
            result.add(new HyperparameterSet(combination));
        }
        return result;
    }

    public int size() {
        int size = 1;
        for (List<Object> values : candidates.values()) {
            size *= values.size();
        }
        return size;
    }

    public static class Builder {
        private final Map<String, List<Object>> candidates = new LinkedHashMap<>();

        public Builder add(String name, Object... values) {
            Preconditions.checkArgument(values.length > 0, "parameter %s needs at least one value", name);
            candidates.put(name, ImmutableList.copyOf(values));
            return this;
        }

        public ParameterGrid build() {
            Preconditions.checkState(false == candidates.isEmpty(), "grid has no parameters");
            return new ParameterGrid(new LinkedHashMap<>(candidates));
        }
    }
}
