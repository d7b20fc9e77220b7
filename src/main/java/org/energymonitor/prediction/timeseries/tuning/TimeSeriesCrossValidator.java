/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.timeseries.model.Sample;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;

/**
 * Expanding window cross-validation.
 *
 * Fold k (0-based) trains on every sample before start + minTrainDays + k *
 * validationDays and validates on the following validationDays. Training
 * windows grow by one validation window per fold, so validation data never
 * precedes or overlaps its own training data.
 */
public class TimeSeriesCrossValidator {
    private static final Logger logger = LogManager.getLogger(TimeSeriesCrossValidator.class);

    private final int numFolds;
    private final int minTrainDays;
    private final int validationDays;

    public TimeSeriesCrossValidator(int numFolds, int minTrainDays, int validationDays) {
        Preconditions.checkArgument(numFolds > 0, "number of folds must be positive");
        Preconditions.checkArgument(minTrainDays > 0, "minimum training days must be positive");
        Preconditions.checkArgument(validationDays > 0, "validation days must be positive");
        this.numFolds = numFolds;
        this.minTrainDays = minTrainDays;
        this.validationDays = validationDays;
    }

    /**
     * Number of folds that fit in the sample span: the configured number, or
     * as many as the span allows but at least one.
     *
     * @param spanDays whole days between the first and last sample
     * @return number of folds to attempt
     */
    public int effectiveFolds(long spanDays) {
        long required = minTrainDays + (long) numFolds * validationDays;
        if (spanDays >= required) {
            return numFolds;
        }
        int reduced = (int) Math.max(1, (spanDays - minTrainDays) / validationDays);
        logger
            .warn(
                "Insufficient data for {} folds. Have {} days, need {}. Reducing number of folds to {}",
                numFolds,
                spanDays,
                required,
                reduced
            );
        return reduced;
    }

    /**
     * Folds are produced lazily. Iterating the result again reproduces the
     * same folds. Folds with an empty train or validation slice are skipped.
     *
     * @param samples samples, sorted by timestamp before splitting
     * @return folds in time order
     */
    public Iterable<CrossValidationFold> split(List<Sample> samples) {
        List<Sample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(Sample::getTimestamp));
        return () -> new FoldIterator(sorted);
    }

    /**
     * @param samples samples to split
     * @return metadata of each fold {@link #split} would produce
     */
    public List<FoldInfo> describe(List<Sample> samples) {
        List<FoldInfo> info = new ArrayList<>();
        for (CrossValidationFold fold : split(samples)) {
            info.add(fold.toFoldInfo());
        }
        return info;
    }

    public int getNumFolds() {
        return numFolds;
    }

    private class FoldIterator extends AbstractIterator<CrossValidationFold> {
        private final List<Sample> sorted;
        private final Instant start;
        private final int folds;
        private int fold;

        FoldIterator(List<Sample> sorted) {
            this.sorted = sorted;
            if (sorted.isEmpty()) {
                this.start = null;
                this.folds = 0;
            } else {
                this.start = sorted.get(0).getTimestamp();
                long spanDays = Duration.between(start, sorted.get(sorted.size() - 1).getTimestamp()).toDays();
                this.folds = effectiveFolds(spanDays);
            }
            this.fold = 0;
        }

        @Override
        protected CrossValidationFold computeNext() {
            while (fold < folds) {
                int current = fold++;
                Instant trainEnd = start.plus(Duration.ofDays(minTrainDays + (long) current * validationDays));
                Instant validationEnd = trainEnd.plus(Duration.ofDays(validationDays));
                int trainEndIndex = firstIndexAtOrAfter(trainEnd);
                int validationEndIndex = firstIndexAtOrAfter(validationEnd);

                if (trainEndIndex == 0 || validationEndIndex == trainEndIndex) {
                    logger.warn("Fold {}: Empty split, skipping", current + 1);
                    continue;
                }
                List<Sample> train = sorted.subList(0, trainEndIndex);
                List<Sample> validation = sorted.subList(trainEndIndex, validationEndIndex);
                logger.debug("Fold {}/{}: Train={} points, Val={} points", current + 1, folds, train.size(), validation.size());
                return new CrossValidationFold(current + 1, train, validation);
            }
            return endOfData();
        }

        private int firstIndexAtOrAfter(Instant boundary) {
            int low = 0;
            int high = sorted.size();
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (sorted.get(mid).getTimestamp().isBefore(boundary)) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }
    }
}
