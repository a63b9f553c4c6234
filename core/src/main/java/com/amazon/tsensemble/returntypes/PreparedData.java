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

package com.amazon.tsensemble.returntypes;

import lombok.Getter;

import com.amazon.tsensemble.config.StationarityTransform;
import com.amazon.tsensemble.preprocessor.IScalingTransform;

/**
 * Output of {@code Preprocessor.fitTransform}: chronological train, validation
 * and test windows plus the transform that was fitted on the training rows.
 */
@Getter
public class PreparedData {

    private final WindowedData train;

    private final WindowedData validation;

    private final WindowedData test;

    private final IScalingTransform scalingTransform;

    private final StationarityTransform stationarityTransform;

    /**
     * the series after the stationarity transform and scaling
     */
    private final double[][] scaledValues;

    /**
     * the number of leading rows the scaler was fitted on
     */
    private final int trainingRows;

    private final boolean stationary;

    public PreparedData(WindowedData train, WindowedData validation, WindowedData test,
            IScalingTransform scalingTransform, StationarityTransform stationarityTransform, double[][] scaledValues,
            int trainingRows, boolean stationary) {
        this.train = train;
        this.validation = validation;
        this.test = test;
        this.scalingTransform = scalingTransform;
        this.stationarityTransform = stationarityTransform;
        this.scaledValues = scaledValues;
        this.trainingRows = trainingRows;
        this.stationary = stationary;
    }

    /**
     * @param windowLength the window length used
     * @return the last {@code windowLength} scaled rows, the input for a forecast
     *         past the end of the series
     */
    public double[][] lastWindow(int windowLength) {
        double[][] answer = new double[windowLength][];
        System.arraycopy(scaledValues, scaledValues.length - windowLength, answer, 0, windowLength);
        return answer;
    }
}
