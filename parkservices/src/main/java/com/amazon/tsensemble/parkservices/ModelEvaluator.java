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

import org.apache.commons.math3.stat.StatUtils;

import com.amazon.tsensemble.parkservices.returntypes.AnomalyMetrics;
import com.amazon.tsensemble.parkservices.returntypes.ForecastMetrics;

/**
 * Accuracy measures for forecasts and for anomaly flags.
 */
public class ModelEvaluator {

    // keeps the percentage error finite at zero actuals
    static final double MAPE_EPSILON = 1e-8;

    private ModelEvaluator() {
    }

    public static ForecastMetrics forecastMetrics(double[] actual, double[] predicted) {
        check(actual, predicted);
        double mse = meanSquaredError(actual, predicted);
        return new ForecastMetrics(mse, Math.sqrt(mse), meanAbsoluteError(actual, predicted),
                meanAbsolutePercentageError(actual, predicted), coefficientOfDetermination(actual, predicted));
    }

    public static double meanSquaredError(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double error = actual[i] - predicted[i];
            sum += error * error;
        }
        return sum / actual.length;
    }

    public static double rootMeanSquaredError(double[] actual, double[] predicted) {
        return Math.sqrt(meanSquaredError(actual, predicted));
    }

    public static double meanAbsoluteError(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    /**
     * @return the mean of {@code |actual - predicted| / (actual + 1e-8)} in
     *         percent
     */
    public static double meanAbsolutePercentageError(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs((actual[i] - predicted[i]) / (actual[i] + MAPE_EPSILON));
        }
        return 100 * sum / actual.length;
    }

    /**
     * R squared; for a constant {@code actual} it is 1 when the prediction is
     * exact and 0 otherwise
     */
    public static double coefficientOfDetermination(double[] actual, double[] predicted) {
        check(actual, predicted);
        double mean = StatUtils.mean(actual);
        double residual = 0;
        double total = 0;
        for (int i = 0; i < actual.length; i++) {
            residual += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            total += (actual[i] - mean) * (actual[i] - mean);
        }
        if (total == 0) {
            return (residual == 0) ? 1.0 : 0.0;
        }
        return 1 - residual / total;
    }

    /**
     * @param labels    true anomaly labels
     * @param scores    anomaly scores
     * @param threshold a score above it counts as a predicted anomaly
     */
    public static AnomalyMetrics anomalyMetrics(boolean[] labels, double[] scores, double threshold) {
        checkArgument(labels != null && scores != null && labels.length == scores.length,
                "labels and scores must have the same length");
        boolean[] predicted = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            predicted[i] = scores[i] > threshold;
        }
        return anomalyMetrics(labels, predicted);
    }

    public static AnomalyMetrics anomalyMetrics(boolean[] labels, boolean[] predicted) {
        checkArgument(labels != null && predicted != null && labels.length == predicted.length,
                "labels and predictions must have the same length");
        int truePositives = 0;
        int falsePositives = 0;
        int falseNegatives = 0;
        int trueNegatives = 0;
        for (int i = 0; i < labels.length; i++) {
            if (predicted[i]) {
                if (labels[i]) {
                    ++truePositives;
                } else {
                    ++falsePositives;
                }
            } else if (labels[i]) {
                ++falseNegatives;
            } else {
                ++trueNegatives;
            }
        }
        return new AnomalyMetrics(truePositives, falsePositives, falseNegatives, trueNegatives);
    }

    private static void check(double[] actual, double[] predicted) {
        checkArgument(actual != null && predicted != null, "values cannot be null");
        checkArgument(actual.length == predicted.length, "actual and predicted values must have the same length");
        checkArgument(actual.length > 0, "values cannot be empty");
    }
}
