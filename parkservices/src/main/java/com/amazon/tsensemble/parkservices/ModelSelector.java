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

package com.amazon.tsensemble.parkservices;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.returntypes.TimeSeries;

/**
 * Rules of thumb for picking a model family from the size and shape of the
 * data. Long histories with long windows favor the recurrent model, medium
 * sized ones the convolutional model. Series with a trend or a seasonal
 * pattern are best served by the decomposition detector.
 */
public class ModelSelector {

    public static final int LARGE_SAMPLE_SIZE = 1000;

    public static final int MEDIUM_SAMPLE_SIZE = 500;

    public static final int LONG_WINDOW = 20;

    // significance level of the slope of a linear fit over the index
    static final double TREND_SIGNIFICANCE = 0.01;

    static final double TREND_MINIMUM_R_SQUARE = 0.3;

    static final double SEASONAL_AUTOCORRELATION = 0.5;

    private ModelSelector() {
    }

    public static ForecastModelType recommendForecastModel(int samples, int dimensions, int windowLength) {
        checkArgument(samples > 0 && dimensions > 0 && windowLength > 0, "sizes must be positive");
        if (samples > LARGE_SAMPLE_SIZE && windowLength > LONG_WINDOW) {
            return ForecastModelType.RECURRENT;
        }
        if (samples > MEDIUM_SAMPLE_SIZE) {
            // several features are easier to relate through the recurrent state
            return (dimensions > 1) ? ForecastModelType.RECURRENT : ForecastModelType.CONVOLUTIONAL;
        }
        return ForecastModelType.CONVOLUTIONAL;
    }

    public static AnomalyMethod recommendAnomalyMethod(boolean hasTrend, boolean hasSeasonality) {
        return (hasTrend || hasSeasonality) ? AnomalyMethod.TREND_DECOMPOSITION : AnomalyMethod.STATE_TRANSITION;
    }

    public static AnomalyMethod recommendAnomalyMethod(TimeSeries series) {
        checkArgument(series != null, "series cannot be null");
        double[] values = series.getFeature(0);
        return recommendAnomalyMethod(hasTrend(values), hasSeasonality(values));
    }

    /**
     * @return true if a straight line over the index explains a meaningful part
     *         of the variance and its slope is significant
     */
    public static boolean hasTrend(double[] values) {
        if (values.length < 3) {
            return false;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double significance = regression.getSignificance();
        return !Double.isNaN(significance) && significance < TREND_SIGNIFICANCE
                && regression.getRSquare() >= TREND_MINIMUM_R_SQUARE;
    }

    /**
     * @return true if the detrended series correlates strongly with itself at
     *         some lag between 2 and half its length
     */
    public static boolean hasSeasonality(double[] values) {
        int length = values.length;
        if (length < 8) {
            return false;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < length; i++) {
            regression.addData(i, values[i]);
        }
        double[] residual = new double[length];
        double mean = 0;
        for (int i = 0; i < length; i++) {
            residual[i] = values[i] - regression.predict(i);
            mean += residual[i] / length;
        }
        double variance = 0;
        for (int i = 0; i < length; i++) {
            residual[i] -= mean;
            variance += residual[i] * residual[i];
        }
        if (variance == 0) {
            return false;
        }
        for (int lag = 2; lag <= length / 2; lag++) {
            double sum = 0;
            for (int i = lag; i < length; i++) {
                sum += residual[i] * residual[i - lag];
            }
            if (sum / variance > SEASONAL_AUTOCORRELATION) {
                return true;
            }
        }
        return false;
    }
}
