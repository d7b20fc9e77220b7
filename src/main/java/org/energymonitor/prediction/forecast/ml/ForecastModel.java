/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.forecast.ml;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.energymonitor.prediction.forecast.model.ForecastPoint;
import org.energymonitor.prediction.forecast.settings.ForecastSettings;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.energymonitor.prediction.timeseries.common.exception.PredictionException;
import org.energymonitor.prediction.timeseries.constant.CommonMessages;
import org.energymonitor.prediction.timeseries.ml.ModelState;
import org.energymonitor.prediction.timeseries.ml.TrainableModel;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.energymonitor.prediction.timeseries.settings.TimeSeriesSettings;
import org.opensearch.common.settings.Settings;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Forecasting model wrapper with a time-limited prediction cache.
 *
 * A cache miss computes the maximum horizon once; requests without past
 * context are then served from its prefix until the entry expires or a new
 * model is installed. Requests anchored in the past bypass the cache.
 */
public class ForecastModel extends TrainableModel<SeasonalRegression> {
    private static final Logger logger = LogManager.getLogger(ForecastModel.class);

    private static final long HOUR_MILLIS = Duration.ofHours(1).toMillis();

    private final Duration cacheTtl;
    private final int maxHorizonHours;
    private final AtomicReference<ForecastCacheEntry> cache;

    public ForecastModel(Clock clock, Settings settings) {
        this(
            clock,
            TimeSeriesSettings.MIN_TRAINING_DATA_POINTS.get(settings),
            Duration.ofMillis(ForecastSettings.FORECAST_CACHE_TTL.get(settings).millis()),
            ForecastSettings.MAX_HORIZON_HOURS.get(settings)
        );
    }

    /**
     * @param clock UTC clock
     * @param minTrainingSamples minimum number of samples to train
     * @param cacheTtl lifetime of a cached forecast
     * @param maxHorizonHours horizon computed and cached on a miss
     */
    public ForecastModel(Clock clock, int minTrainingSamples, Duration cacheTtl, int maxHorizonHours) {
        super(CommonMessages.FORECASTER, clock, minTrainingSamples);
        Preconditions.checkArgument(maxHorizonHours > 0, "max horizon must be positive");
        this.cacheTtl = cacheTtl;
        this.maxHorizonHours = maxHorizonHours;
        this.cache = new AtomicReference<>();
    }

    @Override
    protected SeasonalRegression fit(List<Sample> samples, HyperparameterSet params) {
        return SeasonalRegression.fit(samples, params);
    }

    @Override
    protected void onInstalled(ModelState<SeasonalRegression> installed) {
        cache.set(null);
    }

    public List<ForecastPoint> predict(int hours) {
        return predict(hours, 0);
    }

    /**
     * Forecasts from now - pastContextHours through now + hours, one point per hour.
     *
     * @param hours hours to forecast past now
     * @param pastContextHours hours before now to include; more than 0 bypasses the cache
     * @return ascending points, at most one per hour bucket
     * @throws ModelNotTrainedException if no model is installed
     * @throws PredictionException if computing the forecast fails
     */
    public List<ForecastPoint> predict(int hours, int pastContextHours) {
        Preconditions.checkArgument(hours > 0, "hours must be positive");
        Preconditions.checkArgument(pastContextHours >= 0, "past context must be non-negative");
        ModelState<SeasonalRegression> state = getState();
        SeasonalRegression model = state.getModel().orElseThrow(() -> new ModelNotTrainedException(modelName));

        try {
            Instant now = clock.instant();
            if (pastContextHours > 0) {
                Instant end = now.plus(hours, ChronoUnit.HOURS);
                List<ForecastPoint> result = new ArrayList<>();
                for (ForecastPoint point : compute(model, hours, pastContextHours, now)) {
                    if (false == point.getTimestamp().isAfter(end)) {
                        result.add(point);
                    }
                }
                return result;
            }
            if (hours > maxHorizonHours) {
                return firstHours(compute(model, hours, 0, now), hours);
            }

            ForecastCacheEntry entry = cache.get();
            if (entry != null && entry.isValid(now, cacheTtl, state.getGeneration())) {
                logger.debug("Forecast cache hit for {} hours", hours);
                return firstHours(entry.getPredictions(), hours);
            }
            logger.debug("Forecast cache miss, computing {} hours", maxHorizonHours);
            entry = new ForecastCacheEntry(now, maxHorizonHours, state.getGeneration(), compute(model, maxHorizonHours, 0, now));
            // a retrain may have cleared the cache meanwhile; only keep entries of the installed model
            if (getState().getGeneration() == state.getGeneration()) {
                cache.set(entry);
            }
            return firstHours(entry.getPredictions(), hours);
        } catch (RuntimeException e) {
            throw new PredictionException(modelName, "forecast " + hours + "h", e);
        }
    }

    /**
     * Computes and caches the maximum horizon. Does nothing when untrained.
     */
    public void warmCache() {
        if (false == isTrained()) {
            return;
        }
        cache.set(null);
        predict(maxHorizonHours);
        logger.info("Forecast cache warmed with {} hours", maxHorizonHours);
    }

    public Optional<ForecastCacheEntry> getCacheEntry() {
        return Optional.ofNullable(cache.get());
    }

    /**
     * Evaluates the model on the hourly grid around its training cutoff. The
     * number of future periods bridges the gap between the cutoff and now, so
     * the result reaches now + hours. With past context, every hour bucket
     * from floor(now - pastContextHours) onwards is filled even where the
     * training history has gaps.
     */
    static List<ForecastPoint> compute(SeasonalRegression model, int hours, int pastContextHours, Instant now) {
        long nowMillis = now.toEpochMilli();
        long cutoffMillis = model.getCutoff().toEpochMilli();
        long elapsedMillis = Math.max(0, nowMillis - cutoffMillis);
        long periods = hours + (long) Math.ceil(elapsedMillis / (double) HOUR_MILLIS);
        long windowStart = pastContextHours > 0
            ? Math.floorDiv(nowMillis - pastContextHours * HOUR_MILLIS, HOUR_MILLIS) * HOUR_MILLIS
            : nowMillis - HOUR_MILLIS + 1;

        // keyed by hour bucket, first occurrence wins: observed timestamps, then the cutoff grid, then the fixed grid
        TreeMap<Long, ForecastPoint> buckets = new TreeMap<>();
        for (long millis : model.getHistoryMillis()) {
            if (millis >= windowStart) {
                addPoint(buckets, model, millis);
            }
        }
        for (long k = 1; k <= periods; k++) {
            long millis = cutoffMillis + k * HOUR_MILLIS;
            if (millis >= windowStart) {
                addPoint(buckets, model, millis);
            }
        }
        if (pastContextHours > 0) {
            long endMillis = nowMillis + hours * HOUR_MILLIS;
            for (long millis = windowStart; millis <= endMillis; millis += HOUR_MILLIS) {
                addPoint(buckets, model, millis);
            }
        }
        return new ArrayList<>(buckets.values());
    }

    private static void addPoint(Map<Long, ForecastPoint> buckets, SeasonalRegression model, long millis) {
        long bucket = Math.floorDiv(millis, HOUR_MILLIS);
        if (buckets.containsKey(bucket)) {
            return;
        }
        Instant timestamp = Instant.ofEpochMilli(millis);
        double[] prediction = model.predict(timestamp);
        buckets.put(bucket, new ForecastPoint(timestamp, Math.max(0, prediction[0]), Math.max(0, prediction[1]), prediction[2]));
    }

    private static List<ForecastPoint> firstHours(List<ForecastPoint> points, int hours) {
        return ImmutableList.copyOf(points.subList(0, Math.min(hours, points.size())));
    }
}
