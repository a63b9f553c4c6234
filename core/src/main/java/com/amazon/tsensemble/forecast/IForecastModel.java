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

package com.amazon.tsensemble.forecast;

import java.util.Map;

import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.returntypes.TrainingResult;
import com.amazon.tsensemble.returntypes.WindowedData;

/**
 * A sequence model that maps a window of {@code windowLength} rows to the next
 * {@code horizon} values of the target feature.
 */
public interface IForecastModel {

    /**
     * trains the model; any earlier training is discarded
     *
     * @param inputs     windows {@code [n][windowLength][dimensions]}
     * @param targets    {@code [n][horizon]}
     * @param validation optional windows used for early stopping, may be null or
     *                   empty
     * @return the history of the run
     */
    TrainingResult fit(double[][][] inputs, double[][] targets, WindowedData validation);

    default TrainingResult fit(WindowedData train, WindowedData validation) {
        return fit(train.getInputs(), train.getTargets(), validation);
    }

    /**
     * @param inputs windows {@code [n][windowLength][dimensions]}
     * @return predictions {@code [n][horizon]}
     */
    double[][] predict(double[][][] inputs);

    /**
     * autoregressive forecast of a univariate series; after each step the
     * prediction is appended to the window and the oldest values are dropped
     *
     * @param lastWindow the most recent {@code windowLength} rows, one feature
     * @param steps      number of steps
     * @return {@code [steps][horizon]}
     */
    double[][] predictFuture(double[][] lastWindow, int steps);

    boolean isFitted();

    ForecastModelType getModelType();

    int getWindowLength();

    int getHorizon();

    int getInputDimensions();

    TrainingResult getTrainingResult();

    Map<String, Object> getHyperparameters();

    String getModelSummary();
}
