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

package com.amazon.tsensemble.examples.forecast;

import java.util.Arrays;
import java.util.Map;
import java.util.Random;

import com.amazon.tsensemble.examples.Example;
import com.amazon.tsensemble.parkservices.EnsembleForecaster;
import com.amazon.tsensemble.parkservices.ModelEvaluator;
import com.amazon.tsensemble.parkservices.config.ForecastRequest;
import com.amazon.tsensemble.parkservices.returntypes.ForecastMetrics;
import com.amazon.tsensemble.parkservices.returntypes.ForecastResult;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

/**
 * Trains a recurrent and a convolutional model on a daily cycle of hourly
 * values, combines their next hour forecasts and compares the members with the
 * value that actually followed.
 */
public class EnsembleForecastExample implements Example {

    public static void main(String[] args) throws Exception {
        new EnsembleForecastExample().run();
    }

    @Override
    public String command() {
        return "ensemble_forecast";
    }

    @Override
    public String description() {
        return "combine a recurrent and a convolutional forecast weighted by validation error";
    }

    @Override
    public void run() throws Exception {
        int length = 24 * 20;
        int windowLength = 24;
        long seed = new Random().nextLong();
        System.out.println("seed = " + seed);

        // the last value is held back to check the forecast against
        double[] all = SyntheticSeries.sineWithSpikes(length + 1, 24, 20, 5, 0.3, seed, 0);
        double[] history = Arrays.copyOf(all, length);

        EnsembleForecaster forecaster = EnsembleForecaster.builder().epochs(30).randomSeed(seed)
                .parallelExecutionEnabled(true).threadPoolSize(2).build();
        ForecastRequest request = ForecastRequest.builder().windowLength(windowLength).build();
        ForecastResult result = forecaster.forecast(TimeSeries.univariate(history), request);

        System.out.printf("actual next value %.3f%n", all[length]);
        System.out.printf("ensemble forecast %.3f", result.getEnsemblePrediction()[0]);
        if (result.hasUncertainty()) {
            System.out.printf(" +/- %.3f", result.getUncertainty()[0]);
        }
        System.out.println();
        for (Map.Entry<String, double[]> entry : result.getPerModelPredictions().entrySet()) {
            String id = entry.getKey();
            System.out.printf("  %-14s forecast %.3f, validation RMSE %.4f, weight %.3f%n", id, entry.getValue()[0],
                    result.getValidationErrors().get(id), result.getWeights().get(id));
        }
        result.getFailures().forEach((id, failure) -> System.out.printf("  %-14s failed: %s%n", id,
                failure.getMessage()));

        ForecastMetrics metrics = ModelEvaluator.forecastMetrics(new double[] { all[length] },
                result.getEnsemblePrediction());
        System.out.printf("absolute error %.4f%n", metrics.getMae());
    }
}
