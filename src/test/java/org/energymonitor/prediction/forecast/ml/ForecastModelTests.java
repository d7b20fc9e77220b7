/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.forecast.ml;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.energymonitor.prediction.forecast.model.ForecastPoint;
import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.energymonitor.prediction.timeseries.common.exception.InsufficientDataException;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.energymonitor.prediction.timeseries.ml.ModelState;
import org.energymonitor.prediction.timeseries.model.Sample;
import org.opensearch.common.settings.Settings;

public class ForecastModelTests extends AbstractPredictionTest {
    private List<Sample> samples;
    private MutableClock clock;
    private ForecastModel model;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        samples = hourlySine(200);
        clock = new MutableClock(lastTimestamp(samples).plus(Duration.ofMinutes(10)));
        model = new ForecastModel(clock, Settings.EMPTY);
    }

    public void testTrainAndForecast() {
        model.train(samples, SeasonalRegression.defaultParams());

        assertTrue(model.isTrained());
        assertEquals(200, model.getStatus().getDataPointsUsed());
        assertEquals(clock.instant(), model.getStatus().getLastTrained());

        List<ForecastPoint> forecast = model.predict(24);
        assertEquals(24, forecast.size());
        for (int i = 0; i < forecast.size(); i++) {
            ForecastPoint point = forecast.get(i);
            assertThat(point.getPredictedValue(), greaterThanOrEqualTo(0.0));
            assertThat(point.getLowerBound(), greaterThanOrEqualTo(0.0));
            if (i > 0) {
                assertTrue(point.getTimestamp().isAfter(forecast.get(i - 1).getTimestamp()));
            }
        }
        assertThat(forecast.get(0).getTimestamp(), lessThanOrEqualTo(clock.instant()));
    }

    public void testForecastIsCachedWithinTtl() {
        model.train(samples, SeasonalRegression.defaultParams());

        List<ForecastPoint> first = model.predict(24);
        ForecastCacheEntry entry = model.getCacheEntry().get();
        assertEquals(168, entry.getHorizonHours());

        clock.advance(Duration.ofMinutes(30));
        List<ForecastPoint> second = model.predict(24);

        assertEquals(first, second);
        assertSame(entry, model.getCacheEntry().get());
    }

    public void testCacheExpires() {
        model.train(samples, SeasonalRegression.defaultParams());
        model.predict(24);
        ForecastCacheEntry entry = model.getCacheEntry().get();

        clock.advance(Duration.ofHours(1));
        model.predict(24);

        assertNotSame(entry, model.getCacheEntry().get());
    }

    public void testRetrainClearsCache() {
        model.train(samples, SeasonalRegression.defaultParams());
        model.predict(12);
        assertTrue(model.getCacheEntry().isPresent());

        model.train(samples, SeasonalRegression.defaultParams());

        assertFalse(model.getCacheEntry().isPresent());
        assertEquals(2, model.getState().getGeneration());
    }

    public void testWarmCache() {
        model.warmCache();
        assertFalse(model.getCacheEntry().isPresent());

        model.train(samples, SeasonalRegression.defaultParams());
        model.warmCache();

        ForecastCacheEntry entry = model.getCacheEntry().get();
        assertEquals(clock.instant(), entry.getCreatedAt());
        assertThat(entry.getPredictions().size(), greaterThanOrEqualTo(168));
    }

    public void testPastContextBypassesCache() {
        model.train(samples, SeasonalRegression.defaultParams());

        List<ForecastPoint> forecast = model.predict(6, 12);

        assertFalse(model.getCacheEntry().isPresent());
        Instant now = clock.instant();
        assertThat(forecast.get(0).getTimestamp(), lessThanOrEqualTo(now.minus(Duration.ofHours(12))));
        assertThat(forecast.get(forecast.size() - 1).getTimestamp(), lessThanOrEqualTo(now.plus(Duration.ofHours(6))));
        assertThat(forecast.get(forecast.size() - 1).getTimestamp(), greaterThanOrEqualTo(now.plus(Duration.ofHours(5))));
    }

    public void testPastContextCoversGapsInHistory() {
        List<Sample> gapped = new ArrayList<>(hourlySine(100));
        gapped.subList(85, 91).clear();
        Instant cutoff = lastTimestamp(gapped);
        clock.set(cutoff.plus(Duration.ofMinutes(30)));
        model.train(gapped, SeasonalRegression.defaultParams());

        List<ForecastPoint> forecast = model.predict(6, 12);

        Instant now = clock.instant();
        assertEquals(cutoff.minus(Duration.ofHours(12)), forecast.get(0).getTimestamp());
        assertThat(forecast.get(0).getTimestamp(), lessThanOrEqualTo(now.minus(Duration.ofHours(12))));
        for (int i = 1; i < forecast.size(); i++) {
            assertEquals(Duration.ofHours(1), Duration.between(forecast.get(i - 1).getTimestamp(), forecast.get(i).getTimestamp()));
        }
        assertEquals(cutoff.plus(Duration.ofHours(6)), forecast.get(forecast.size() - 1).getTimestamp());
        assertEquals(19, forecast.size());
    }

    public void testForecastBridgesGapSinceTraining() {
        model.train(samples, SeasonalRegression.defaultParams());
        clock.advance(Duration.ofHours(30));

        List<ForecastPoint> forecast = model.predict(24);

        assertEquals(24, forecast.size());
        assertThat(forecast.get(0).getTimestamp(), greaterThanOrEqualTo(clock.instant().minus(Duration.ofHours(1))));
    }

    public void testHorizonBeyondCacheIsComputedDirectly() {
        ForecastModel shortHorizon = new ForecastModel(clock, 48, Duration.ofHours(1), 24);
        shortHorizon.train(samples, SeasonalRegression.defaultParams());

        assertEquals(36, shortHorizon.predict(36).size());
        assertFalse(shortHorizon.getCacheEntry().isPresent());
    }

    public void testPredictRequiresTraining() {
        expectThrows(ModelNotTrainedException.class, () -> model.predict(24));
    }

    public void testInsufficientDataLeavesStateUnchanged() {
        ModelState<SeasonalRegression> before = model.getState();
        try {
            model.train(samples.subList(0, 47), SeasonalRegression.defaultParams());
            fail("expected InsufficientDataException");
        } catch (InsufficientDataException e) {
            assertEquals(47, e.getActual());
            assertEquals(48, e.getRequired());
        }
        assertSame(before, model.getState());
        assertFalse(model.isTrained());
    }

    public void testRejectsUnsortedSamples() {
        List<Sample> shuffled = new ArrayList<>(samples);
        Collections.reverse(shuffled);
        expectThrows(IllegalArgumentException.class, () -> model.train(shuffled, SeasonalRegression.defaultParams()));
    }
}
