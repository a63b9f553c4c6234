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

package com.amazon.tsensemble.forecast.nn;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.Collections;
import java.util.List;

/**
 * Max pooling over non overlapping groups of steps; trailing steps that do not
 * fill a group are dropped.
 */
public class MaxPool1DLayer implements ILayer {

    private final int poolSize;

    private int inputSteps;

    // argmax[t][i] is the input step chosen for output step t and feature i
    private int[][] argmax;

    public MaxPool1DLayer(int poolSize) {
        checkArgument(poolSize > 0, "pool size must be positive");
        this.poolSize = poolSize;
    }

    @Override
    public double[][] forward(double[][] input, boolean training) {
        int steps = input.length / poolSize;
        checkArgument(steps > 0, "input shorter than the pool");
        int features = input[0].length;
        double[][] output = new double[steps][features];
        argmax = new int[steps][features];
        inputSteps = input.length;
        for (int t = 0; t < steps; t++) {
            for (int i = 0; i < features; i++) {
                int best = t * poolSize;
                for (int k = 1; k < poolSize; k++) {
                    if (input[t * poolSize + k][i] > input[best][i]) {
                        best = t * poolSize + k;
                    }
                }
                argmax[t][i] = best;
                output[t][i] = input[best][i];
            }
        }
        return output;
    }

    @Override
    public double[][] backward(double[][] gradient) {
        int features = argmax[0].length;
        double[][] inputGradient = new double[inputSteps][features];
        for (int t = 0; t < argmax.length; t++) {
            for (int i = 0; i < features; i++) {
                inputGradient[argmax[t][i]][i] += gradient[t][i];
            }
        }
        return inputGradient;
    }

    @Override
    public List<Parameter> getParameters() {
        return Collections.emptyList();
    }

    @Override
    public int[] outputShape(int[] inputShape) {
        return new int[] { inputShape[0] / poolSize, inputShape[1] };
    }

    @Override
    public String getName() {
        return "maxpool1d(" + poolSize + ")";
    }
}
