/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.stats;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.collect.ImmutableMap;

/**
 * Health of the engine and of each of its components.
 */
public class HealthReport {
    public static final String DATABASE = "database";
    public static final String SCHEDULER = "scheduler";

    public enum Status {
        HEALTHY,
        INITIALIZING,
        DEGRADED,
        UNHEALTHY;

        public String getName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static class ComponentHealth {
        private final Status status;
        private final Map<String, Object> details;

        public ComponentHealth(Status status, Map<String, Object> details) {
            this.status = status;
            this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }

        public Status getStatus() {
            return status;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("status", status.getName());
            map.putAll(details);
            return map;
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this).append("status", status).append("details", details).toString();
        }
    }

    private final Status status;
    private final Map<String, ComponentHealth> components;
    private final Instant timestamp;

    public HealthReport(Status status, Map<String, ComponentHealth> components, Instant timestamp) {
        this.status = status;
        this.components = ImmutableMap.copyOf(components);
        this.timestamp = timestamp;
    }

    /**
     * Overall status: degraded wins over initializing, which wins over healthy.
     */
    public Status getStatus() {
        return status;
    }

    public Map<String, ComponentHealth> getComponents() {
        return components;
    }

    public ComponentHealth getComponent(String name) {
        return components.get(name);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> componentMaps = new LinkedHashMap<>();
        for (Map.Entry<String, ComponentHealth> entry : components.entrySet()) {
            componentMaps.put(entry.getKey(), entry.getValue().toMap());
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.getName());
        map.put("timestamp", timestamp.toString());
        map.put("components", componentMaps);
        return map;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("status", status).append("components", components).append("timestamp", timestamp).toString();
    }
}
