/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.forecast.ml;

import static org.energymonitor.prediction.forecast.settings.ForecastSettings.CHANGEPOINT_RANGE;
import static org.energymonitor.prediction.forecast.settings.ForecastSettings.DAILY_FOURIER_ORDER;
import static org.energymonitor.prediction.forecast.settings.ForecastSettings.DEFAULT_CHANGEPOINT_PRIOR_SCALE;
import static org.energymonitor.prediction.forecast.settings.ForecastSettings.DEFAULT_SEASONALITY_MODE;
import static org.energymonitor.prediction.forecast.settings.ForecastSettings.DEFAULT_SEASONALITY_PRIOR_SCALE;
import static org.energymonitor.prediction.forecast.settings.ForecastSettings.INTERVAL_Z;
import static org.energymonitor.prediction.forecast.settings.ForecastSettings.MAX_CHANGEPOINTS;
import static org.energymonitor.prediction.forecast.settings.ForecastSettings.WEEKLY_FOURIER_ORDER;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.energymonitor.prediction.timeseries.model.HyperparameterSet;
import org.energymonitor.prediction.timeseries.model.Sample;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Seasonal regression forecaster: a piecewise linear trend with changepoints
 * plus Fourier seasonality, fitted by penalized least squares.
 *
 * The changepoint prior scale bounds how much the trend may bend at each
 * changepoint, the seasonality prior scale how strong the seasonal terms may
 * get. In multiplicative mode seasonality scales the trend instead of adding
 * to it. Predictions carry an 80% uncertainty interval that widens with the
 * distance past the training cutoff.
 *
 * Instances are immutable once fitted.
 */
public class SeasonalRegression {
    public static final String CHANGEPOINT_PRIOR_SCALE = "changepoint_prior_scale";
    public static final String SEASONALITY_PRIOR_SCALE = "seasonality_prior_scale";
    public static final String SEASONALITY_MODE = "seasonality_mode";
    public static final String DAILY_SEASONALITY = "daily_seasonality";
    public static final String WEEKLY_SEASONALITY = "weekly_seasonality";
    public static final String YEARLY_SEASONALITY = "yearly_seasonality";

    public static final String ADDITIVE = "additive";
    public static final String MULTIPLICATIVE = "multiplicative";

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();
    private static final long WEEK_MILLIS = Duration.ofDays(7).toMillis();
    private static final long YEAR_MILLIS = (long) (365.25 * DAY_MILLIS);
    private static final int YEARLY_FOURIER_ORDER = 10;

    // converts prior scales to penalty weights in the scaled target space
    private static final double PRIOR_PENALTY = 0.01;
    private static final double INTERCEPT_PENALTY = 1e-9;
    private static final double SLOPE_PENALTY = 1e-6;
    private static final double MIN_TREND = 1e-6;

    private final HyperparameterSet params;
    private final boolean multiplicative;
    private final boolean daily;
    private final boolean weekly;
    private final boolean yearly;

    private final long startMillis;
    private final double spanMillis;
    private final double yScale;
    private final long[] historyMillis;
    private final double[] changepoints;
    private final double[] trendCoefficients;
    private final double[] seasonalCoefficients;
    private final double residualStd;

    private SeasonalRegression(
        HyperparameterSet params,
        boolean multiplicative,
        boolean daily,
        boolean weekly,
        boolean yearly,
        long startMillis,
        double spanMillis,
        double yScale,
        long[] historyMillis,
        double[] changepoints,
        double[] trendCoefficients,
        double[] seasonalCoefficients,
        double residualStd
    ) {
        this.params = params;
        this.multiplicative = multiplicative;
        this.daily = daily;
        this.weekly = weekly;
        this.yearly = yearly;
        this.startMillis = startMillis;
        this.spanMillis = spanMillis;
        this.yScale = yScale;
        this.historyMillis = historyMillis;
        this.changepoints = changepoints;
        this.trendCoefficients = trendCoefficients;
        this.seasonalCoefficients = seasonalCoefficients;
        this.residualStd = residualStd;
    }

    public static HyperparameterSet defaultParams() {
        return new HyperparameterSet(
            ImmutableMap
                .of(
                    CHANGEPOINT_PRIOR_SCALE,
                    DEFAULT_CHANGEPOINT_PRIOR_SCALE,
                    SEASONALITY_PRIOR_SCALE,
                    DEFAULT_SEASONALITY_PRIOR_SCALE,
                    SEASONALITY_MODE,
                    DEFAULT_SEASONALITY_MODE,
                    DAILY_SEASONALITY,
                    true,
                    WEEKLY_SEASONALITY,
                    true,
                    YEARLY_SEASONALITY,
                    false
                )
        );
    }

    /**
     * Fits a model.
     *
     * @param samples ascending samples, at least two
     * @param overrides hyperparameters overriding {@link #defaultParams()}
     * @return fitted model
     * @throws IllegalArgumentException on invalid input or hyperparameters
     * @throws IllegalStateException if the regression cannot be solved
     */
    public static SeasonalRegression fit(List<Sample> samples, HyperparameterSet overrides) {
        Preconditions.checkArgument(samples.size() >= 2, "at least two samples are required");
        HyperparameterSet params = defaultParams().merge(overrides);
        double changepointPriorScale = params.getDouble(CHANGEPOINT_PRIOR_SCALE, DEFAULT_CHANGEPOINT_PRIOR_SCALE);
        double seasonalityPriorScale = params.getDouble(SEASONALITY_PRIOR_SCALE, DEFAULT_SEASONALITY_PRIOR_SCALE);
        Preconditions.checkArgument(changepointPriorScale > 0, "changepoint_prior_scale must be positive");
        Preconditions.checkArgument(seasonalityPriorScale > 0, "seasonality_prior_scale must be positive");
        String mode = params.getString(SEASONALITY_MODE, DEFAULT_SEASONALITY_MODE).toLowerCase(Locale.ROOT);
        Preconditions.checkArgument(ADDITIVE.equals(mode) || MULTIPLICATIVE.equals(mode), "unknown seasonality_mode %s", mode);
        boolean multiplicative = MULTIPLICATIVE.equals(mode);
        boolean daily = params.getBoolean(DAILY_SEASONALITY, true);
        boolean weekly = params.getBoolean(WEEKLY_SEASONALITY, true);
        boolean yearly = params.getBoolean(YEARLY_SEASONALITY, false);

        int n = samples.size();
        long[] millis = new long[n];
        double[] y = new double[n];
        double maxAbs = 0;
        for (int i = 0; i < n; i++) {
            Sample sample = samples.get(i);
            Preconditions.checkArgument(Double.isFinite(sample.getValue()), "non-finite value at %s", sample.getTimestamp());
            millis[i] = sample.getTimestamp().toEpochMilli();
            y[i] = sample.getValue();
            maxAbs = Math.max(maxAbs, Math.abs(y[i]));
        }
        long startMillis = millis[0];
        double spanMillis = Math.max(1.0, millis[n - 1] - startMillis);
        double yScale = maxAbs > 0 ? maxAbs : 1.0;
        double[] scaled = new double[n];
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            scaled[i] = y[i] / yScale;
            t[i] = (millis[i] - startMillis) / spanMillis;
        }

        double[] changepoints = placeChangepoints(t);
        double changepointPenalty = PRIOR_PENALTY / (changepointPriorScale * changepointPriorScale);
        double seasonalPenalty = PRIOR_PENALTY / (seasonalityPriorScale * seasonalityPriorScale);

        int trendWidth = 2 + changepoints.length;
        int seasonalWidth = seasonalWidth(daily, weekly, yearly);
        double[][] trendRows = new double[n][];
        double[][] seasonalRows = new double[n][];
        for (int i = 0; i < n; i++) {
            trendRows[i] = trendRow(t[i], changepoints);
            seasonalRows[i] = seasonalRow(millis[i], daily, weekly, yearly);
        }

        double[] trendPenalty = new double[trendWidth];
        trendPenalty[0] = INTERCEPT_PENALTY;
        trendPenalty[1] = SLOPE_PENALTY;
        for (int j = 2; j < trendWidth; j++) {
            trendPenalty[j] = changepointPenalty;
        }
        double[] seasonalPenaltyVector = new double[seasonalWidth];
        Arrays.fill(seasonalPenaltyVector, seasonalPenalty);

        double[] trendCoefficients;
        double[] seasonalCoefficients;
        if (multiplicative) {
            // trend first, then seasonal ratios around it
            trendCoefficients = RidgeRegression.solve(trendRows, scaled, trendPenalty);
            double[] ratios = new double[n];
            for (int i = 0; i < n; i++) {
                double trend = dot(trendRows[i], trendCoefficients);
                ratios[i] = Math.abs(trend) < MIN_TREND ? 0 : scaled[i] / trend - 1;
            }
            seasonalCoefficients = seasonalWidth == 0 ? new double[0] : RidgeRegression.solve(seasonalRows, ratios, seasonalPenaltyVector);
        } else {
            double[][] rows = new double[n][];
            for (int i = 0; i < n; i++) {
                rows[i] = concat(trendRows[i], seasonalRows[i]);
            }
            double[] coefficients = RidgeRegression.solve(rows, scaled, concat(trendPenalty, seasonalPenaltyVector));
            trendCoefficients = Arrays.copyOfRange(coefficients, 0, trendWidth);
            seasonalCoefficients = Arrays.copyOfRange(coefficients, trendWidth, coefficients.length);
        }
        checkFinite(trendCoefficients);
        checkFinite(seasonalCoefficients);

        double squared = 0;
        for (int i = 0; i < n; i++) {
            double fitted = combine(dot(trendRows[i], trendCoefficients), dot(seasonalRows[i], seasonalCoefficients), multiplicative);
            double residual = scaled[i] - fitted;
            squared += residual * residual;
        }
        double residualStd = Math.sqrt(squared / n) * yScale;

        return new SeasonalRegression(
            params,
            multiplicative,
            daily,
            weekly,
            yearly,
            startMillis,
            spanMillis,
            yScale,
            millis,
            changepoints,
            trendCoefficients,
            seasonalCoefficients,
            residualStd
        );
    }

    /**
     * @param timestamp point in time, before or after the training cutoff
     * @return {point estimate, lower bound, upper bound}, unclamped
     */
    public double[] predict(Instant timestamp) {
        long millis = timestamp.toEpochMilli();
        double t = (millis - startMillis) / spanMillis;
        double trend = dot(trendRow(t, changepoints), trendCoefficients);
        double seasonal = dot(seasonalRow(millis, daily, weekly, yearly), seasonalCoefficients);
        double estimate = combine(trend, seasonal, multiplicative) * yScale;
        double width = INTERVAL_Z * residualStd * Math.sqrt(1 + Math.max(0, t - 1));
        return new double[] { estimate, estimate - width, estimate + width };
    }

    /**
     * @return timestamp of the last training sample
     */
    public Instant getCutoff() {
        return Instant.ofEpochMilli(historyMillis[historyMillis.length - 1]);
    }

    /**
     * @return training timestamps in epoch milliseconds, ascending
     */
    public long[] getHistoryMillis() {
        return historyMillis.clone();
    }

    public HyperparameterSet getParams() {
        return params;
    }

    public double getResidualStd() {
        return residualStd;
    }

    public int getNumChangepoints() {
        return changepoints.length;
    }

    // changepoints evenly spread over the first part of the history, in scaled time
    private static double[] placeChangepoints(double[] t) {
        int historySize = (int) Math.floor(t.length * CHANGEPOINT_RANGE);
        int count = Math.min(MAX_CHANGEPOINTS, historySize - 1);
        if (count <= 0) {
            return new double[0];
        }
        double[] changepoints = new double[count];
        double step = (historySize - 1) / (double) count;
        for (int j = 1; j <= count; j++) {
            changepoints[j - 1] = t[(int) Math.round(j * step)];
        }
        return changepoints;
    }

    private static double[] trendRow(double t, double[] changepoints) {
        double[] row = new double[2 + changepoints.length];
        row[0] = 1;
        row[1] = t;
        for (int j = 0; j < changepoints.length; j++) {
            row[2 + j] = Math.max(0, t - changepoints[j]);
        }
        return row;
    }

    private static int seasonalWidth(boolean daily, boolean weekly, boolean yearly) {
        return 2 * ((daily ? DAILY_FOURIER_ORDER : 0) + (weekly ? WEEKLY_FOURIER_ORDER : 0) + (yearly ? YEARLY_FOURIER_ORDER : 0));
    }

    private static double[] seasonalRow(long millis, boolean daily, boolean weekly, boolean yearly) {
        double[] row = new double[seasonalWidth(daily, weekly, yearly)];
        int offset = 0;
        if (daily) {
            offset = fourier(row, offset, millis, DAY_MILLIS, DAILY_FOURIER_ORDER);
        }
        if (weekly) {
            offset = fourier(row, offset, millis, WEEK_MILLIS, WEEKLY_FOURIER_ORDER);
        }
        if (yearly) {
            fourier(row, offset, millis, YEAR_MILLIS, YEARLY_FOURIER_ORDER);
        }
        return row;
    }

    private static int fourier(double[] row, int offset, long millis, long periodMillis, int order) {
        double phase = Math.floorMod(millis, periodMillis) / (double) periodMillis;
        for (int k = 1; k <= order; k++) {
            double angle = 2 * Math.PI * k * phase;
            row[offset++] = Math.sin(angle);
            row[offset++] = Math.cos(angle);
        }
        return offset;
    }

    private static double combine(double trend, double seasonal, boolean multiplicative) {
        return multiplicative ? trend * (1 + seasonal) : trend + seasonal;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double[] concat(double[] a, double[] b) {
        double[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private static void checkFinite(double[] coefficients) {
        for (double c : coefficients) {
            if (false == Double.isFinite(c)) {
                throw new IllegalStateException("Regression produced non-finite coefficients");
            }
        }
    }
}
