/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.tsensemble.anomalydetection.decomposition;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Getter;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import com.amazon.tsensemble.config.SeasonalityMode;
import com.amazon.tsensemble.returntypes.DecompositionComponents;

/**
 * A piecewise linear trend with changepoints plus Fourier seasonalities, fitted
 * by ridge regularized least squares on the series scaled by its largest
 * absolute value. Changepoints are spread evenly over the first
 * {@code changepointRange} of the fitting points; their slope changes are
 * penalized by {@code 1/changepointPriorScale}, the seasonal coefficients by
 * {@code 1/seasonalityPriorScale}. In multiplicative mode the trend is fitted
 * first and the seasonalities model the relative deviation from it. The
 * prediction interval is {@code yhat +/- z sigma} where sigma is the residual
 * root mean square.
 */
@Getter
public class TrendSeasonalModel {

    public static final int DEFAULT_MAX_CHANGEPOINTS = 25;

    public static final double DEFAULT_CHANGEPOINT_RANGE = 0.8;

    public static final double DEFAULT_CHANGEPOINT_PRIOR_SCALE = 0.05;

    public static final double DEFAULT_SEASONALITY_PRIOR_SCALE = 10.0;

    public static final double DEFAULT_INTERVAL_WIDTH = 0.99;

    static final double MINIMUM_HALF_WIDTH = 1e-8;

    private static final double JITTER = 1e-10;

    private final List<Seasonality> seasonalities;

    private final SeasonalityMode mode;

    private final int maxChangepoints;

    private final double changepointRange;

    private final double changepointPriorScale;

    private final double seasonalityPriorScale;

    private final double intervalWidth;

    private double origin;

    private double span;

    private double valueScale;

    // normalized times of the changepoints
    private double[] changepoints;

    // intercept, slope, then one slope change per changepoint
    private double[] trendCoefficients;

    private double[] seasonalCoefficients;

    // residual root mean square in scaled units
    private double sigma;

    public TrendSeasonalModel(List<Seasonality> seasonalities, SeasonalityMode mode, int maxChangepoints,
            double changepointRange, double changepointPriorScale, double seasonalityPriorScale,
            double intervalWidth) {
        checkArgument(seasonalities != null, "seasonalities cannot be null");
        checkArgument(mode != null, "mode cannot be null");
        checkArgument(maxChangepoints >= 0, "changepoints cannot be negative");
        checkArgument(changepointRange > 0 && changepointRange <= 1, "changepoint range must be in (0,1]");
        checkArgument(changepointPriorScale > 0 && seasonalityPriorScale > 0, "prior scales must be positive");
        checkArgument(intervalWidth > 0 && intervalWidth < 1, "interval width must be in (0,1)");
        this.seasonalities = new ArrayList<>(seasonalities);
        this.mode = mode;
        this.maxChangepoints = maxChangepoints;
        this.changepointRange = changepointRange;
        this.changepointPriorScale = changepointPriorScale;
        this.seasonalityPriorScale = seasonalityPriorScale;
        this.intervalWidth = intervalWidth;
    }

    /**
     * restores fitted parameters
     */
    public void restore(double origin, double span, double valueScale, double[] changepoints,
            double[] trendCoefficients, double[] seasonalCoefficients, double sigma) {
        checkArgument(trendCoefficients.length == 2 + changepoints.length, "inconsistent trend coefficients");
        checkArgument(seasonalCoefficients.length == seasonalColumns(), "inconsistent seasonal coefficients");
        this.origin = origin;
        this.span = span;
        this.valueScale = valueScale;
        this.changepoints = Arrays.copyOf(changepoints, changepoints.length);
        this.trendCoefficients = Arrays.copyOf(trendCoefficients, trendCoefficients.length);
        this.seasonalCoefficients = Arrays.copyOf(seasonalCoefficients, seasonalCoefficients.length);
        this.sigma = sigma;
    }

    public boolean isFitted() {
        return trendCoefficients != null;
    }

    int seasonalColumns() {
        int answer = 0;
        for (Seasonality seasonality : seasonalities) {
            answer += seasonality.columns();
        }
        return answer;
    }

    /**
     * @param times  increasing time points
     * @param values observations at those times
     */
    public void fit(double[] times, double[] values) {
        checkArgument(times.length == values.length, "times and values must align");
        checkArgument(times.length >= 2, "at least two observations are required");
        int length = times.length;
        origin = times[0];
        span = times[length - 1] - times[0];
        if (span <= 0) {
            span = 1;
        }
        double max = 0;
        for (double value : values) {
            checkArgument(Double.isFinite(value), "values must be finite");
            max = Math.max(max, Math.abs(value));
        }
        valueScale = (max == 0) ? 1 : max;
        double[] scaled = new double[length];
        double[] normalized = new double[length];
        for (int i = 0; i < length; i++) {
            scaled[i] = values[i] / valueScale;
            normalized[i] = (times[i] - origin) / span;
        }
        changepoints = placeChangepoints(normalized);

        double[][] trendDesign = new double[length][];
        double[][] seasonalDesign = new double[length][];
        for (int i = 0; i < length; i++) {
            trendDesign[i] = trendFeatures(normalized[i]);
            seasonalDesign[i] = seasonalFeatures(times[i]);
        }
        int seasonalCount = seasonalColumns();
        double[] trendPenalty = new double[2 + changepoints.length];
        Arrays.fill(trendPenalty, 2, trendPenalty.length, 1.0 / changepointPriorScale);
        double[] seasonalPenalty = new double[seasonalCount];
        Arrays.fill(seasonalPenalty, 1.0 / seasonalityPriorScale);

        if (mode == SeasonalityMode.ADDITIVE || seasonalCount == 0) {
            double[][] design = new double[length][];
            for (int i = 0; i < length; i++) {
                design[i] = concat(trendDesign[i], seasonalDesign[i]);
            }
            double[] coefficients = ridge(design, scaled, concat(trendPenalty, seasonalPenalty));
            trendCoefficients = Arrays.copyOf(coefficients, trendPenalty.length);
            seasonalCoefficients = Arrays.copyOfRange(coefficients, trendPenalty.length, coefficients.length);
        } else {
            trendCoefficients = ridge(trendDesign, scaled, trendPenalty);
            double[] relative = new double[length];
            for (int i = 0; i < length; i++) {
                double trend = dot(trendCoefficients, trendDesign[i]);
                relative[i] = (Math.abs(trend) > MINIMUM_HALF_WIDTH) ? scaled[i] / trend - 1 : 0;
            }
            seasonalCoefficients = ridge(seasonalDesign, relative, seasonalPenalty);
        }

        double sum = 0;
        for (int i = 0; i < length; i++) {
            double error = scaled[i] - expected(trendDesign[i], seasonalDesign[i]);
            sum += error * error;
        }
        sigma = Math.sqrt(sum / length);
    }

    double[] placeChangepoints(double[] normalized) {
        int history = (int) Math.floor(normalized.length * changepointRange);
        int count = Math.min(maxChangepoints, history - 1);
        if (count <= 0) {
            return new double[0];
        }
        double[] answer = new double[count];
        for (int j = 1; j <= count; j++) {
            int index = (int) Math.round((double) j * (history - 1) / count);
            answer[j - 1] = normalized[index];
        }
        return answer;
    }

    double[] trendFeatures(double normalizedTime) {
        double[] row = new double[2 + changepoints.length];
        row[0] = 1;
        row[1] = normalizedTime;
        for (int j = 0; j < changepoints.length; j++) {
            row[2 + j] = Math.max(0, normalizedTime - changepoints[j]);
        }
        return row;
    }

    double[] seasonalFeatures(double time) {
        double[] row = new double[seasonalColumns()];
        int offset = 0;
        for (Seasonality seasonality : seasonalities) {
            seasonality.features(time, row, offset);
            offset += seasonality.columns();
        }
        return row;
    }

    double expected(double[] trendRow, double[] seasonalRow) {
        double trend = dot(trendCoefficients, trendRow);
        double seasonal = dot(seasonalCoefficients, seasonalRow);
        return (mode == SeasonalityMode.MULTIPLICATIVE) ? trend * (1 + seasonal) : trend + seasonal;
    }

    static double dot(double[] a, double[] b) {
        double answer = 0;
        for (int i = 0; i < a.length; i++) {
            answer += a[i] * b[i];
        }
        return answer;
    }

    static double[] concat(double[] a, double[] b) {
        double[] answer = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, answer, a.length, b.length);
        return answer;
    }

    /**
     * solves {@code (X'X + diag(penalty)) beta = X'y}
     */
    static double[] ridge(double[][] design, double[] target, double[] penalty) {
        int columns = penalty.length;
        if (columns == 0) {
            return new double[0];
        }
        RealMatrix x = new Array2DRowRealMatrix(design, false);
        RealMatrix gram = x.transpose().multiply(x);
        double scale = 0;
        for (int j = 0; j < columns; j++) {
            scale = Math.max(scale, gram.getEntry(j, j));
        }
        for (int j = 0; j < columns; j++) {
            gram.addToEntry(j, j, penalty[j] + JITTER * (1 + scale));
        }
        RealVector rhs = x.transpose().operate(new ArrayRealVector(target, false));
        return new LUDecomposition(gram).getSolver().solve(rhs).toArray();
    }

    /**
     * @return the z value of the two sided interval
     */
    public double zValue() {
        return new NormalDistribution(0, 1).inverseCumulativeProbability(0.5 + intervalWidth / 2);
    }

    /**
     * @param times time points, inside or beyond the fitting range
     * @return the components and the interval in the units of the fitting values
     */
    public DecompositionComponents predict(double[] times) {
        checkState(isFitted(), "model is not fitted");
        double halfWidth = Math.max(zValue() * sigma, MINIMUM_HALF_WIDTH) * valueScale;
        int length = times.length;
        double[] trend = new double[length];
        double[] seasonal = new double[length];
        double[] expected = new double[length];
        double[] lower = new double[length];
        double[] upper = new double[length];
        for (int i = 0; i < length; i++) {
            double g = dot(trendCoefficients, trendFeatures((times[i] - origin) / span));
            double s = dot(seasonalCoefficients, seasonalFeatures(times[i]));
            double seasonalPart = (mode == SeasonalityMode.MULTIPLICATIVE) ? g * s : s;
            trend[i] = g * valueScale;
            seasonal[i] = seasonalPart * valueScale;
            expected[i] = (g + seasonalPart) * valueScale;
            lower[i] = expected[i] - halfWidth;
            upper[i] = expected[i] + halfWidth;
        }
        return new DecompositionComponents(trend, seasonal, expected, lower, upper);
    }

    /**
     * @return slope of the trend at the end of the history, per unit of time
     */
    public double getFinalSlope() {
        checkState(isFitted(), "model is not fitted");
        double slope = trendCoefficients[1];
        for (int j = 0; j < changepoints.length; j++) {
            slope += trendCoefficients[2 + j];
        }
        return slope * valueScale / span;
    }
}
