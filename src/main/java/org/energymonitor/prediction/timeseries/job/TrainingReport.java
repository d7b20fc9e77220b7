/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.energymonitor.prediction.timeseries.AnalysisType;

import com.google.common.collect.ImmutableList;

/**
 * Outcomes of one training cycle, one per model kind.
 */
public class TrainingReport {
    private final List<TrainingOutcome> outcomes;
    private final List<String> errors;
    private final Instant completedAt;

    public TrainingReport(List<TrainingOutcome> outcomes, List<String> errors, Instant completedAt) {
        this.outcomes = ImmutableList.copyOf(outcomes);
        this.errors = ImmutableList.copyOf(errors);
        this.completedAt = completedAt;
    }

    public List<TrainingOutcome> getOutcomes() {
        return outcomes;
    }

    public Optional<TrainingOutcome> getOutcome(AnalysisType type) {
        return outcomes.stream().filter(o -> o.getAnalysisType() == type).findFirst();
    }

    /**
     * @return errors that could not be attributed to a model
     */
    public List<String> getErrors() {
        return errors;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean allTrained() {
        return errors.isEmpty() && outcomes.size() == AnalysisType.values().length && outcomes.stream().allMatch(TrainingOutcome::isTrained);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (TrainingOutcome outcome : outcomes) {
            map.put(outcome.getAnalysisType().getRecordKey(), outcome.toMap());
        }
        if (false == errors.isEmpty()) {
            map.put("errors", errors);
        }
        map.put("completed_at", completedAt == null ? null : completedAt.toString());
        return map;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("outcomes", outcomes).append("errors", errors).append("completedAt", completedAt).toString();
    }
}
