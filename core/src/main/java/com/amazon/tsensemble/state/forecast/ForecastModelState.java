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

package com.amazon.tsensemble.state.forecast;

import static com.amazon.tsensemble.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

import com.amazon.tsensemble.state.returntypes.TrainingResultState;

@Data
public class ForecastModelState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;
    private String modelType;
    private int windowLength;
    private int inputDimensions;
    private int horizon;
    private double learningRate;
    private int epochs;
    private int batchSize;
    private int patience;
    private double dropout;
    private long randomSeed;

    // recurrent
    private int[] units;

    // convolutional
    private int[] filters;
    private int[] kernelSizes;
    private int[] denseUnits;

    private boolean fitted;
    private double[] parameters;
    private TrainingResultState trainingResultState;
}
