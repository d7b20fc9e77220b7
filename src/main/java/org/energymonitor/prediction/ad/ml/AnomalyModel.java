/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.ml;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.ad.model.AnomalyPoint;
import org.energymonitor.prediction.ad.model.AnomalySummary;
import org.energymonitor.prediction.ad.model.AnomalyType;
import org.energymonitor.prediction.ad.model.Severity;
import org.energymonitor.prediction.ad.settings.AnomalyDetectorSettings;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.energymonitor.prediction.timeseries.common.exception.PredictionException;
import org.energymonitor.prediction.timeseries.constant.CommonMessages;
import org.energymonitor.prediction.timeseries.feature.FeatureExtractor;
import org.energymonitor.prediction.timeseries.ml.TrainableModel;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.settings.TimeSeriesSettings;
import org.energymonitor.prediction.timeseries.util.DataUtil;
import org.opensearch.common.settings.Settings;

import com.google.common.base.Preconditions;

/**
 * Anomaly model wrapper: an {@link IsolationEnsemble} over pipeline features,
 * a centered rolling mean as the expected value, and an
 * {@link AdaptiveThreshold} driven by the caller's sensitivity.
 */
public class AnomalyModel extends TrainableModel<IsolationEnsemble> {
    private static final Logger logger = LogManager.getLogger(AnomalyModel.class);

    private final FeatureExtractor featureExtractor;
    private final int expectedValueWindow;
    private final double minPowerDiff;
    private final double spikeMultiplier;
    private final double dipMultiplier;
    private final int highSeverityCount;
    private final int mediumSeverityCount;
    private final double highSeverityScore;
    private final double mediumSeverityScore;

    public AnomalyModel(Clock clock, Settings settings, FeatureExtractor featureExtractor) {
        super(CommonMessages.ANOMALY_DETECTOR, clock, TimeSeriesSettings.MIN_TRAINING_DATA_POINTS.get(settings));
        this.featureExtractor = featureExtractor;
        this.expectedValueWindow = AnomalyDetectorSettings.EXPECTED_VALUE_WINDOW.get(settings);
        this.minPowerDiff = AnomalyDetectorSettings.MIN_POWER_DIFF.get(settings);
        this.spikeMultiplier = AnomalyDetectorSettings.SPIKE_MULTIPLIER.get(settings);
        this.dipMultiplier = AnomalyDetectorSettings.DIP_MULTIPLIER.get(settings);
        this.highSeverityCount = AnomalyDetectorSettings.HIGH_SEVERITY_COUNT.get(settings);
        this.mediumSeverityCount = AnomalyDetectorSettings.MEDIUM_SEVERITY_COUNT.get(settings);
        this.highSeverityScore = AnomalyDetectorSettings.HIGH_SEVERITY_SCORE.get(settings);
        this.mediumSeverityScore = AnomalyDetectorSettings.MEDIUM_SEVERITY_SCORE.get(settings);
    }

    @Override
    protected IsolationEnsemble fit(List<Sample> samples, HyperparameterSet params) {
        return IsolationEnsemble.fit(featureExtractor.extract(samples), params);
    }

    /**
     * Flags samples that the ensemble considers outliers, whose normalized
     * score exceeds the sensitivity threshold, and whose distance from the
     * expected value exceeds the minimum power difference.
     *
     * @param samples ascending samples to check
     * @param sensitivity value in [0.1, 1.0], higher flags more
     * @return flagged samples in time order
     * @throws ModelNotTrainedException if no model is installed
     * @throws PredictionException if scoring fails
     */
    public List<AnomalyPoint> detect(List<Sample> samples, double sensitivity) {
        Preconditions
            .checkArgument(
                sensitivity >= TimeSeriesSettings.MIN_SENSITIVITY && sensitivity <= TimeSeriesSettings.MAX_SENSITIVITY,
                "sensitivity must be in [0.1, 1.0]"
            );
        IsolationEnsemble ensemble = requireTrained();
        if (samples.isEmpty()) {
            return Collections.emptyList();
        }
        checkOrdered(samples);

        try {
            double[][] features = featureExtractor.extract(samples);
            double[] decisions = ensemble.decisionFunction(features);
            double[] normalized = AdaptiveThreshold.normalize(decisions);
            double threshold = AdaptiveThreshold.threshold(normalized, sensitivity);
            double[] values = DataUtil.values(samples);
            double[] expected = DataUtil.centeredRollingMean(values, expectedValueWindow);

            List<AnomalyPoint> anomalies = new ArrayList<>();
            for (int i = 0; i < samples.size(); i++) {
                boolean outlier = decisions[i] < 0;
                if (outlier && normalized[i] > threshold && Math.abs(values[i] - expected[i]) > minPowerDiff) {
                    anomalies
                        .add(
                            new AnomalyPoint(
                                samples.get(i).getTimestamp(),
                                values[i],
                                expected[i],
                                normalized[i],
                                AnomalyType.classify(values[i], expected[i], spikeMultiplier, dipMultiplier)
                            )
                        );
                }
            }
            logger
                .debug(
                    "Checked {} samples at sensitivity {} with threshold {}, found {} anomalies",
                    samples.size(),
                    sensitivity,
                    threshold,
                    anomalies.size()
                );
            return anomalies;
        } catch (RuntimeException e) {
            throw new PredictionException(modelName, "detect anomalies", e);
        }
    }

    public AnomalySummary summarize(List<AnomalyPoint> anomalies) {
        if (anomalies.isEmpty()) {
            return AnomalySummary.EMPTY;
        }
        double sum = 0;
        for (AnomalyPoint anomaly : anomalies) {
            sum += anomaly.getAnomalyScore();
        }
        int count = anomalies.size();
        double meanScore = sum / count;

        Severity severity;
        if (count > highSeverityCount || meanScore > highSeverityScore) {
            severity = Severity.HIGH;
        } else if (count > mediumSeverityCount || meanScore > mediumSeverityScore) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.LOW;
        }
        return new AnomalySummary(count, meanScore, severity);
    }

    public FeatureExtractor getFeatureExtractor() {
        return featureExtractor;
    }
}
