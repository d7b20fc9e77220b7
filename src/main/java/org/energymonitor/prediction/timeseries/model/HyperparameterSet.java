/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.model;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.annotation.Generated;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable mapping from parameter name to value for one model kind.
 *
 * Values are numbers, strings or booleans. Numbers read back from JSON are
 * doubles, so the typed accessors coerce.
 */
public class HyperparameterSet {
    public static final HyperparameterSet EMPTY = new HyperparameterSet(ImmutableMap.of());

    private final Map<String, Object> params;

    public HyperparameterSet(Map<String, ?> params) {
        this.params = ImmutableMap.copyOf(params);
    }

    public Map<String, Object> asMap() {
        return params;
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    public boolean contains(String name) {
        return params.containsKey(name);
    }

    public Object get(String name) {
        return params.get(name);
    }

    /**
     * @param name parameter name
     * @param defaultValue value returned when the parameter is absent or not numeric
     * @return parameter as a double
     */
    public double getDouble(String name, double defaultValue) {
        Object value = params.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    public int getInt(String name, int defaultValue) {
        Object value = params.get(name);
        if (value instanceof Number) {
            return (int) Math.round(((Number) value).doubleValue());
        }
        return defaultValue;
    }

    public String getString(String name, String defaultValue) {
        Object value = params.get(name);
        return value == null ? defaultValue : value.toString();
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = params.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    /**
     * @param overrides values replacing or adding to this set
     * @return a new set, this one is unchanged
     */
    public HyperparameterSet merge(HyperparameterSet overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(params);
        merged.putAll(overrides.params);
        return new HyperparameterSet(merged);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("params", params).toString();
    }

    @Generated
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        HyperparameterSet that = (HyperparameterSet) o;
        return Objects.equal(params, that.params);
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(params);
    }
}
