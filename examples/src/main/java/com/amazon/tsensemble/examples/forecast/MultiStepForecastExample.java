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

import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.config.StationarityTransform;
import com.amazon.tsensemble.examples.Example;
import com.amazon.tsensemble.parkservices.EnsembleForecaster;
import com.amazon.tsensemble.parkservices.ModelEvaluator;
import com.amazon.tsensemble.parkservices.config.ForecastRequest;
import com.amazon.tsensemble.parkservices.returntypes.ForecastMetrics;
import com.amazon.tsensemble.parkservices.returntypes.ForecastResult;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

public class MultiStepForecastExample implements Example {

    public static void main(String[] args) throws Exception {
        new MultiStepForecastExample().run();
    }

    @Override
    public String command() {
        return "multi_step_forecast";
    }

    @Override
    public String description() {
        return "forecast a trending series twelve steps ahead after differencing it";
    }

    @Override
    public void run() throws Exception {
        int length = 300;
        int ahead = 12;
        double[] trend = SyntheticSeries.linear(length + ahead, 100, 0.5);
        double[] season = SyntheticSeries.sineWithSpikes(length + ahead, 12, 0, 3, 0.2, 42L, 0);
        double[] all = new double[length + ahead];
        for (int i = 0; i < all.length; i++) {
            all[i] = trend[i] + season[i];
        }

        EnsembleForecaster forecaster = EnsembleForecaster.builder()
                .stationarityTransform(StationarityTransform.DIFFERENCE).epochs(40).randomSeed(42L).build();
        // four steps of three values each
        ForecastRequest request = ForecastRequest.builder().modelTypes(ForecastModelType.CONVOLUTIONAL)
                .windowLength(24).horizon(3).steps(ahead / 3).build();
        ForecastResult result = forecaster.forecast(TimeSeries.univariate(Arrays.copyOf(all, length)), request);

        double[] actual = Arrays.copyOfRange(all, length, length + ahead);
        for (int i = 0; i < ahead; i++) {
            System.out.printf("t+%-2d actual %8.3f forecast %8.3f%n", i + 1, actual[i],
                    result.getEnsemblePrediction()[i]);
        }
        ForecastMetrics metrics = ModelEvaluator.forecastMetrics(actual, result.getEnsemblePrediction());
        System.out.printf("RMSE %.4f, MAPE %.3f%%, R2 %.3f%n", metrics.getRmse(), metrics.getMape(),
                metrics.getR2());
    }
}
