/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.ml;

import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.AUTO_CONTAMINATION;
import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.AUTO_CONTAMINATION_VALUE;
import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.DEFAULT_MAX_FEATURES;
import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.DEFAULT_NUMBER_OF_TREES;
import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.DEFAULT_SAMPLE_SIZE;
import static org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings.RANDOM_SEED;

import java.util.Arrays;
import java.util.Locale;
import java.util.Random;

import org.energymonitor.prediction.timeseries.model.HyperparameterSet;
import org.energymonitor.prediction.timeseries.util.DataUtil;

import com.amazon.randomcutforest.RandomCutForest;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Ensemble of random cut trees scoring how easily a feature vector is
 * isolated from the training data.
 *
 * Features are standardized with the training mean and standard deviation.
 * The decision offset is the (1 - contamination) quantile of the training
 * scores, so {@link #decisionFunction} is negative for outliers and roughly a
 * contamination fraction of the training data is flagged.
 */
public class IsolationEnsemble {
    public static final String N_ESTIMATORS = "n_estimators";
    public static final String CONTAMINATION = "contamination";
    public static final String MAX_FEATURES = "max_features";
    public static final String MAX_SAMPLES = "max_samples";
    public static final String RANDOM_STATE = "random_state";

    private static final double MIN_STD = 1e-12;

    private final RandomCutForest forest;
    private final HyperparameterSet params;
    private final int[] columns;
    private final double[] means;
    private final double[] stds;
    private final double offset;

    private IsolationEnsemble(
        RandomCutForest forest,
        HyperparameterSet params,
        int[] columns,
        double[] means,
        double[] stds,
        double offset
    ) {
        this.forest = forest;
        this.params = params;
        this.columns = columns;
        this.means = means;
        this.stds = stds;
        this.offset = offset;
    }

    public static HyperparameterSet defaultParams() {
        return new HyperparameterSet(
            ImmutableMap
                .of(
                    CONTAMINATION,
                    AUTO_CONTAMINATION,
                    N_ESTIMATORS,
                    DEFAULT_NUMBER_OF_TREES,
                    MAX_FEATURES,
                    DEFAULT_MAX_FEATURES,
                    MAX_SAMPLES,
                    DEFAULT_SAMPLE_SIZE,
                    RANDOM_STATE,
                    RANDOM_SEED
                )
        );
    }

    /**
     * Fits an ensemble on the rows of a feature matrix, in row order.
     *
     * @param features n x d matrix, n at least 1
     * @param overrides hyperparameters overriding {@link #defaultParams()}
     * @return fitted ensemble
     * @throws IllegalArgumentException on invalid input or hyperparameters
     */
    public static IsolationEnsemble fit(double[][] features, HyperparameterSet overrides) {
        Preconditions.checkArgument(features.length > 0, "no training rows");
        HyperparameterSet params = defaultParams().merge(overrides);
        int numberOfTrees = params.getInt(N_ESTIMATORS, DEFAULT_NUMBER_OF_TREES);
        int sampleSize = params.getInt(MAX_SAMPLES, DEFAULT_SAMPLE_SIZE);
        double maxFeatures = params.getDouble(MAX_FEATURES, DEFAULT_MAX_FEATURES);
        long seed = (long) params.getDouble(RANDOM_STATE, RANDOM_SEED);
        double contamination = contamination(params);
        Preconditions.checkArgument(numberOfTrees > 0, "n_estimators must be positive");
        Preconditions.checkArgument(sampleSize > 1, "max_samples must be greater than 1");
        Preconditions.checkArgument(maxFeatures > 0 && maxFeatures <= 1.0, "max_features must be in (0, 1]");

        int width = features[0].length;
        int[] columns = selectColumns(width, maxFeatures, seed);
        double[] means = new double[columns.length];
        double[] stds = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            double[] column = new double[features.length];
            for (int i = 0; i < features.length; i++) {
                column[i] = features[i][columns[c]];
            }
            means[c] = DataUtil.mean(column);
            double std = DataUtil.sampleStd(column);
            stds[c] = std > MIN_STD ? std : 1.0;
        }

        RandomCutForest forest = RandomCutForest
            .builder()
            .dimensions(columns.length)
            .numberOfTrees(numberOfTrees)
            .sampleSize(sampleSize)
            .outputAfter(1)
            .initialAcceptFraction(1.0)
            .parallelExecutionEnabled(false)
            .randomSeed(seed)
            .build();

        double[][] projected = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            projected[i] = project(features[i], columns, means, stds);
            forest.update(projected[i]);
        }
        double[] trainingScores = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            trainingScores[i] = forest.getAnomalyScore(projected[i]);
        }
        double offset = DataUtil.percentile(trainingScores, 100.0 * (1.0 - contamination));
        return new IsolationEnsemble(forest, params, columns, means, stds, offset);
    }

    /**
     * @param features rows to score
     * @return raw anomaly score per row, larger is more anomalous
     */
    public double[] score(double[][] features) {
        double[] scores = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            scores[i] = forest.getAnomalyScore(project(features[i], columns, means, stds));
        }
        return scores;
    }

    /**
     * @param features rows to score
     * @return offset minus raw score per row; negative values are outliers
     */
    public double[] decisionFunction(double[][] features) {
        double[] scores = score(features);
        for (int i = 0; i < scores.length; i++) {
            scores[i] = offset - scores[i];
        }
        return scores;
    }

    public double getOffset() {
        return offset;
    }

    public HyperparameterSet getParams() {
        return params;
    }

    static double contamination(HyperparameterSet params) {
        Object value = params.get(CONTAMINATION);
        if (value == null || AUTO_CONTAMINATION.equals(value.toString().toLowerCase(Locale.ROOT))) {
            return AUTO_CONTAMINATION_VALUE;
        }
        double contamination = value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString());
        Preconditions.checkArgument(contamination > 0 && contamination <= 0.5, "contamination must be in (0, 0.5]");
        return contamination;
    }

    // seeded choice of floor(maxFeatures * width) columns, at least one, in column order
    static int[] selectColumns(int width, double maxFeatures, long seed) {
        int count = Math.max(1, (int) (maxFeatures * width));
        int[] all = new int[width];
        for (int i = 0; i < width; i++) {
            all[i] = i;
        }
        if (count >= width) {
            return all;
        }
        Random random = new Random(seed);
        for (int i = width - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] selected = Arrays.copyOf(all, count);
        Arrays.sort(selected);
        return selected;
    }

    private static double[] project(double[] row, int[] columns, double[] means, double[] stds) {
        double[] point = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            point[c] = (row[columns[c]] - means[c]) / stds[c];
        }
        return point;
    }
}
