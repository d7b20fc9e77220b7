/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.core.action.ActionListener;

/**
 * A listener collecting the outcomes of trainings that run concurrently and
 * returning them together once all of them responded. A failure does not
 * stop the collection; it is recorded in the report.
 */
public class TrainingOutcomeCollector implements ActionListener<TrainingOutcome> {
    private static final Logger LOG = LogManager.getLogger(TrainingOutcomeCollector.class);

    private final ActionListener<TrainingReport> delegate;
    private final Clock clock;
    private final AtomicInteger collectedResponseCount;
    private final int maxResponseCount;
    private final List<TrainingOutcome> savedOutcomes;
    private final List<String> exceptions;

    public TrainingOutcomeCollector(ActionListener<TrainingReport> delegate, int maxResponseCount, Clock clock) {
        this.delegate = delegate;
        this.clock = clock;
        this.collectedResponseCount = new AtomicInteger(0);
        this.maxResponseCount = maxResponseCount;
        this.savedOutcomes = Collections.synchronizedList(new ArrayList<>());
        this.exceptions = Collections.synchronizedList(new ArrayList<>());
    }

    @Override
    public void onResponse(TrainingOutcome outcome) {
        try {
            if (outcome != null) {
                savedOutcomes.add(outcome);
            }
        } finally {
            if (collectedResponseCount.incrementAndGet() >= maxResponseCount) {
                finish();
            }
        }
    }

    @Override
    public void onFailure(Exception e) {
        LOG.error("Failure in training response", e);
        try {
            exceptions.add(e.getMessage());
        } finally {
            // count failures too, otherwise the report is never sent
            if (collectedResponseCount.incrementAndGet() >= maxResponseCount) {
                finish();
            }
        }
    }

    private void finish() {
        List<TrainingOutcome> outcomes;
        List<String> errors;
        synchronized (savedOutcomes) {
            outcomes = new ArrayList<>(savedOutcomes);
        }
        synchronized (exceptions) {
            errors = new ArrayList<>(exceptions);
        }
        delegate.onResponse(new TrainingReport(outcomes, errors, clock.instant()));
    }
}
