/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.tuning;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.ad.ml.IsolationEnsemble;
import org.energymonitor.prediction.forecast.ml.SeasonalRegression;
import org.energymonitor.prediction.timeseries.AnalysisType;
import org.energymonitor.prediction.timeseries.feature.FeatureExtractor;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.util.DataUtil;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/**
 * Grid search over both models' hyperparameters.
 *
 * Forecast combinations are scored by the mean absolute error over
 * cross-validation folds, lower is better. Anomaly combinations have no
 * labels to score against; they are scored by the mean decision value of the
 * fitted ensemble over the tuning data, higher is better. That score is a
 * proxy for how cleanly normal points separate, not a detection accuracy.
 *
 * The default parameters are evaluated first and only replaced by a strictly
 * better combination. Failing combinations are logged and skipped.
 */
public class HyperparameterTuner {
    private static final Logger logger = LogManager.getLogger(HyperparameterTuner.class);

    public static final String MAE_METRIC = "mae";
    public static final String DECISION_METRIC = "score";
    private static final int PROGRESS_LOG_INTERVAL = 10;

    private final Clock clock;
    private final TimeSeriesCrossValidator crossValidator;
    private final HyperparameterStore store;
    private final FeatureExtractor featureExtractor;
    private final List<TuningHistoryEntry> history;
    private volatile TuningResult bestResult;
    private volatile boolean loaded;

    public HyperparameterTuner(
        Clock clock,
        TimeSeriesCrossValidator crossValidator,
        HyperparameterStore store,
        FeatureExtractor featureExtractor
    ) {
        this.clock = clock;
        this.crossValidator = crossValidator;
        this.store = store;
        this.featureExtractor = featureExtractor;
        this.history = new CopyOnWriteArrayList<>();
        this.bestResult = null;
        this.loaded = false;
    }

    public static ParameterGrid defaultForecastGrid() {
        return ParameterGrid
            .builder()
            .add(SeasonalRegression.CHANGEPOINT_PRIOR_SCALE, 0.001, 0.01, 0.1, 0.5)
            .add(SeasonalRegression.SEASONALITY_PRIOR_SCALE, 0.01, 0.1, 1.0, 10.0)
            .add(SeasonalRegression.SEASONALITY_MODE, SeasonalRegression.ADDITIVE, SeasonalRegression.MULTIPLICATIVE)
            .build();
    }

    public static ParameterGrid defaultAnomalyGrid() {
        return ParameterGrid
            .builder()
            .add(IsolationEnsemble.N_ESTIMATORS, 50, 100, 200)
            .add(IsolationEnsemble.CONTAMINATION, 0.005, 0.01, 0.02)
            .add(IsolationEnsemble.MAX_FEATURES, 0.5, 0.75, 1.0)
            .build();
    }

    /**
     * @param samples ascending samples, usually hourly
     * @param grid candidate values
     * @return best parameters (defaults merged with the winning combination)
     *         and their mean absolute error; infinite error if nothing could be evaluated
     */
    public Pair<HyperparameterSet, Double> tuneForecast(List<Sample> samples, ParameterGrid grid) {
        List<HyperparameterSet> combinations = grid.combinations();
        logger.info("Starting forecast tuning: {} parameter combinations", combinations.size());

        HyperparameterSet defaults = SeasonalRegression.defaultParams();
        HyperparameterSet bestParams = defaults;
        double bestMae = Double.POSITIVE_INFINITY;
        try {
            bestMae = crossValidatedMae(samples, defaults);
            record(AnalysisType.FORECAST, defaults, MAE_METRIC, bestMae);
            logger.info("Default forecast params scored MAE={}", bestMae);
        } catch (RuntimeException e) {
            logger.warn("Default forecast params could not be evaluated: {}", e.getMessage());
        }

        for (int i = 0; i < combinations.size(); i++) {
            HyperparameterSet combination = combinations.get(i);
            try {
                double mae = crossValidatedMae(samples, combination);
                record(AnalysisType.FORECAST, combination, MAE_METRIC, mae);
                if (mae < bestMae) {
                    bestMae = mae;
                    bestParams = defaults.merge(combination);
                    logger.info("New best forecast params (MAE={}): {}", mae, combination);
                }
            } catch (RuntimeException e) {
                logger.warn("Forecast combo {}/{} failed: {}", i + 1, combinations.size(), e.getMessage());
            }
            if ((i + 1) % PROGRESS_LOG_INTERVAL == 0) {
                logger.info("Forecast tuning progress: {}/{}", i + 1, combinations.size());
            }
        }
        logger.info("Forecast tuning complete. Best MAE: {}", bestMae);
        return Pair.of(bestParams, bestMae);
    }

    /**
     * @param samples ascending samples at full resolution
     * @param grid candidate values
     * @return best parameters (defaults merged with the winning combination)
     *         and their mean decision value; negative infinity if nothing could be evaluated
     */
    public Pair<HyperparameterSet, Double> tuneAnomaly(List<Sample> samples, ParameterGrid grid) {
        List<HyperparameterSet> combinations = grid.combinations();
        logger.info("Starting anomaly tuning: {} parameter combinations", combinations.size());
        double[][] features = featureExtractor.extract(samples);

        HyperparameterSet defaults = IsolationEnsemble.defaultParams();
        HyperparameterSet bestParams = defaults;
        double bestScore = Double.NEGATIVE_INFINITY;
        try {
            bestScore = meanDecision(features, defaults);
            record(AnalysisType.AD, defaults, DECISION_METRIC, bestScore);
        } catch (RuntimeException e) {
            logger.warn("Default anomaly params could not be evaluated: {}", e.getMessage());
        }

        for (int i = 0; i < combinations.size(); i++) {
            HyperparameterSet combination = combinations.get(i);
            try {
                double score = meanDecision(features, combination);
                record(AnalysisType.AD, combination, DECISION_METRIC, score);
                if (score > bestScore) {
                    bestScore = score;
                    bestParams = defaults.merge(combination);
                    logger.info("New best anomaly params (score={}): {}", score, combination);
                }
            } catch (RuntimeException e) {
                logger.warn("Anomaly combo {}/{} failed: {}", i + 1, combinations.size(), e.getMessage());
            }
        }
        logger.info("Anomaly tuning complete. Best score: {}", bestScore);
        return Pair.of(bestParams, bestScore);
    }

    public TuningResult tuneAll(List<Sample> samples) {
        return tuneAll(samples, samples);
    }

    /**
     * Tunes both models with the default grids, installs and persists the result.
     *
     * @param forecastSamples samples for forecast tuning
     * @param anomalySamples samples for anomaly tuning
     * @return the new result
     */
    public TuningResult tuneAll(List<Sample> forecastSamples, List<Sample> anomalySamples) {
        logger.info("Starting full hyperparameter tuning");
        Pair<HyperparameterSet, Double> forecast = tuneForecast(forecastSamples, defaultForecastGrid());
        Pair<HyperparameterSet, Double> anomaly = tuneAnomaly(anomalySamples, defaultAnomalyGrid());

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(TuningResult.FORECAST_MAE, forecast.getRight());
        metrics.put(TuningResult.ANOMALY_SCORE, anomaly.getRight());
        TuningResult result = new TuningResult(forecast.getLeft(), anomaly.getLeft(), clock.instant(), metrics);
        bestResult = result;
        loaded = true;
        store.save(result);
        return result;
    }

    /**
     * Loads the persisted result into memory.
     *
     * @return the persisted result, empty if absent or corrupt
     */
    public Optional<TuningResult> loadParams() {
        Optional<TuningResult> result = store.load();
        result.ifPresent(r -> bestResult = r);
        loaded = true;
        return result;
    }

    public HyperparameterSet getForecastParams() {
        return getParams(AnalysisType.FORECAST, SeasonalRegression.defaultParams());
    }

    public HyperparameterSet getAnomalyParams() {
        return getParams(AnalysisType.AD, IsolationEnsemble.defaultParams());
    }

    public Optional<TuningResult> getBestResult() {
        return Optional.ofNullable(bestResult);
    }

    public List<TuningHistoryEntry> getTuningHistory() {
        return ImmutableList.copyOf(history);
    }

    private HyperparameterSet getParams(AnalysisType type, HyperparameterSet defaults) {
        if (false == loaded) {
            loadParams();
        }
        TuningResult result = bestResult;
        if (result == null || result.getParams(type) == null) {
            return defaults;
        }
        return defaults.merge(result.getParams(type));
    }

    private double crossValidatedMae(List<Sample> samples, HyperparameterSet params) {
        List<Double> foldMaes = new ArrayList<>();
        for (CrossValidationFold fold : crossValidator.split(samples)) {
            SeasonalRegression model = SeasonalRegression.fit(fold.getTrainSamples(), params);
            List<Sample> validation = fold.getValidationSamples();
            double[] predicted = new double[validation.size()];
            for (int i = 0; i < predicted.length; i++) {
                predicted[i] = model.predict(validation.get(i).getTimestamp())[0];
            }
            foldMaes.add(DataUtil.meanAbsoluteError(DataUtil.values(validation), predicted));
        }
        if (foldMaes.isEmpty()) {
            throw new IllegalStateException("no cross-validation folds for " + samples.size() + " samples");
        }
        return DataUtil.mean(Doubles.toArray(foldMaes));
    }

    private double meanDecision(double[][] features, HyperparameterSet params) {
        IsolationEnsemble ensemble = IsolationEnsemble.fit(features, params);
        return DataUtil.mean(ensemble.decisionFunction(features));
    }

    private void record(AnalysisType type, HyperparameterSet params, String metricName, double metric) {
        history.add(new TuningHistoryEntry(type, params, metricName, metric, clock.instant()));
    }
}
