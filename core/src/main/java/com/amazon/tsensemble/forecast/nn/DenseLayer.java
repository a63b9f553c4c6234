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

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import lombok.Getter;

/**
 * Fully connected layer applied to every step of its input.
 */
@Getter
public class DenseLayer implements ILayer {

    private final int inputSize;

    private final int units;

    private final Activation activation;

    // weights[i * units + j] connects input i to unit j
    private final Parameter weights;

    private final Parameter bias;

    private double[][] lastInput;

    private double[][] lastOutput;

    public DenseLayer(int inputSize, int units, Activation activation, Random random) {
        checkArgument(inputSize > 0 && units > 0, "sizes must be positive");
        this.inputSize = inputSize;
        this.units = units;
        this.activation = activation;
        this.weights = new Parameter("kernel", inputSize * units);
        this.bias = new Parameter("bias", units);
        weights.glorotUniform(inputSize, units, random);
    }

    @Override
    public double[][] forward(double[][] input, boolean training) {
        double[] w = weights.getValues();
        double[] b = bias.getValues();
        double[][] output = new double[input.length][units];
        for (int t = 0; t < input.length; t++) {
            checkArgument(input[t].length == inputSize, "incorrect input size");
            double[] row = output[t];
            System.arraycopy(b, 0, row, 0, units);
            for (int i = 0; i < inputSize; i++) {
                double x = input[t][i];
                if (x != 0) {
                    int base = i * units;
                    for (int j = 0; j < units; j++) {
                        row[j] += x * w[base + j];
                    }
                }
            }
            for (int j = 0; j < units; j++) {
                row[j] = activation.apply(row[j]);
            }
        }
        lastInput = input;
        lastOutput = output;
        return output;
    }

    @Override
    public double[][] backward(double[][] gradient) {
        double[] w = weights.getValues();
        double[] dw = weights.getGradients();
        double[] db = bias.getGradients();
        double[][] inputGradient = new double[lastInput.length][inputSize];
        double[] delta = new double[units];
        for (int t = 0; t < lastInput.length; t++) {
            for (int j = 0; j < units; j++) {
                delta[j] = gradient[t][j] * activation.derivative(lastOutput[t][j]);
                db[j] += delta[j];
            }
            for (int i = 0; i < inputSize; i++) {
                int base = i * units;
                double x = lastInput[t][i];
                double sum = 0;
                for (int j = 0; j < units; j++) {
                    dw[base + j] += x * delta[j];
                    sum += w[base + j] * delta[j];
                }
                inputGradient[t][i] = sum;
            }
        }
        return inputGradient;
    }

    @Override
    public List<Parameter> getParameters() {
        return Arrays.asList(weights, bias);
    }

    @Override
    public int[] outputShape(int[] inputShape) {
        checkArgument(inputShape[1] == inputSize, "incorrect input size");
        return new int[] { inputShape[0], units };
    }

    @Override
    public String getName() {
        return "dense(" + units + ", " + activation.name().toLowerCase() + ")";
    }
}
