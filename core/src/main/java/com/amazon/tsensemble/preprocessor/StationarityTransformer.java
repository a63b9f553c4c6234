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

package com.amazon.tsensemble.preprocessor;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkState;

import java.util.Arrays;

import lombok.Getter;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import com.amazon.tsensemble.config.StationarityTransform;
import com.amazon.tsensemble.exception.ValidationException;

/**
 * Applies a {@link StationarityTransform} to a whole series and remembers what
 * is needed to map a forecast that continues the series back to the original
 * units.
 */
@Getter
public class StationarityTransformer {

    public static final double LOG_OFFSET = 1e-8;

    private final StationarityTransform transform;

    // last raw row of the series that was transformed
    private double[] lastValues;

    // per feature least squares trend over the row index
    private double[] intercept;

    private double[] slope;

    // number of raw rows seen
    private int length;

    public StationarityTransformer(StationarityTransform transform) {
        checkArgument(transform != null, "transform cannot be null");
        this.transform = transform;
    }

    /**
     * restores a transformer from its parameters
     */
    public StationarityTransformer(StationarityTransform transform, double[] lastValues, double[] intercept,
            double[] slope, int length) {
        this(transform);
        this.lastValues = lastValues;
        this.intercept = intercept;
        this.slope = slope;
        this.length = length;
    }

    public boolean isFitted() {
        return lastValues != null;
    }

    /**
     * @param rows number of raw rows
     * @return number of rows that {@link #apply} produces from them
     */
    public int transformedLength(int rows) {
        boolean differencing = transform == StationarityTransform.DIFFERENCE
                || transform == StationarityTransform.LOG_DIFFERENCE;
        return differencing ? Math.max(rows - 1, 0) : rows;
    }

    public double[][] apply(double[][] values) {
        return apply(values, values.length);
    }

    /**
     * @param values  rows of the raw series
     * @param fitRows leading rows the trend is estimated on, the remaining rows
     *                are detrended with that estimate
     * @return the transformed rows; the differencing transforms drop the first
     *         row
     */
    public double[][] apply(double[][] values, int fitRows) {
        checkArgument(values.length > 0, "values cannot be empty");
        checkArgument(fitRows > 0, "fitRows must be positive");
        int dimensions = values[0].length;
        length = values.length;
        lastValues = Arrays.copyOf(values[length - 1], dimensions);
        intercept = new double[dimensions];
        slope = new double[dimensions];
        switch (transform) {
        case NONE:
            return values;
        case DIFFERENCE:
            return difference(values, false);
        case LOG_DIFFERENCE:
            return difference(values, true);
        case DETREND:
            return detrend(values, Math.min(fitRows, values.length));
        default:
            throw new IllegalStateException("unknown transform " + transform);
        }
    }

    double[][] difference(double[][] values, boolean logarithm) {
        checkArgument(values.length > 1, "differencing needs at least two observations");
        double[][] answer = new double[values.length - 1][];
        for (int i = 1; i < values.length; i++) {
            answer[i - 1] = new double[values[i].length];
            for (int j = 0; j < values[i].length; j++) {
                answer[i - 1][j] = logarithm ? log(values[i][j]) - log(values[i - 1][j])
                        : values[i][j] - values[i - 1][j];
            }
        }
        return answer;
    }

    double[][] detrend(double[][] values, int fitRows) {
        int dimensions = values[0].length;
        for (int j = 0; j < dimensions; j++) {
            SimpleRegression regression = new SimpleRegression();
            for (int i = 0; i < fitRows; i++) {
                regression.addData(i, values[i][j]);
            }
            // a single point has no slope
            slope[j] = (fitRows > 1) ? regression.getSlope() : 0;
            intercept[j] = (fitRows > 1) ? regression.getIntercept() : values[0][j];
        }
        double[][] answer = new double[values.length][dimensions];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < dimensions; j++) {
                answer[i][j] = values[i][j] - (intercept[j] + slope[j] * i);
            }
        }
        return answer;
    }

    static double log(double value) {
        double answer = Math.log(value + LOG_OFFSET);
        if (!Double.isFinite(answer)) {
            throw new ValidationException("log difference requires values greater than " + (-LOG_OFFSET));
        }
        return answer;
    }

    /**
     * maps a forecast of consecutive future values of one feature, expressed in
     * the transformed units, back to the units of the raw series
     *
     * @param forecast consecutive values following the end of the series
     * @param feature  the feature that was forecast
     * @return the forecast in raw units
     */
    public double[] invertForecast(double[] forecast, int feature) {
        checkState(isFitted(), "transformer has not been applied");
        checkArgument(feature >= 0 && feature < lastValues.length, "incorrect feature");
        double[] answer = new double[forecast.length];
        double last = lastValues[feature];
        switch (transform) {
        case NONE:
            return Arrays.copyOf(forecast, forecast.length);
        case DIFFERENCE:
            for (int i = 0; i < forecast.length; i++) {
                last += forecast[i];
                answer[i] = last;
            }
            return answer;
        case LOG_DIFFERENCE:
            double level = Math.log(last + LOG_OFFSET);
            for (int i = 0; i < forecast.length; i++) {
                level += forecast[i];
                answer[i] = Math.exp(level) - LOG_OFFSET;
            }
            return answer;
        case DETREND:
            for (int i = 0; i < forecast.length; i++) {
                answer[i] = forecast[i] + intercept[feature] + slope[feature] * (length + i);
            }
            return answer;
        default:
            throw new IllegalStateException("unknown transform " + transform);
        }
    }
}
