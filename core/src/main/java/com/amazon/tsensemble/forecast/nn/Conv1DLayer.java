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
 * One dimensional convolution over steps with stride 1 and no padding, so the
 * output has {@code steps - kernelSize + 1} steps.
 */
@Getter
public class Conv1DLayer implements ILayer {

    private final int inputSize;

    private final int filters;

    private final int kernelSize;

    private final Activation activation;

    // kernel[(offset * inputSize + i) * filters + c]
    private final Parameter kernel;

    private final Parameter bias;

    private double[][] lastInput;

    private double[][] lastOutput;

    public Conv1DLayer(int inputSize, int filters, int kernelSize, Activation activation, Random random) {
        checkArgument(inputSize > 0 && filters > 0 && kernelSize > 0, "sizes must be positive");
        this.inputSize = inputSize;
        this.filters = filters;
        this.kernelSize = kernelSize;
        this.activation = activation;
        this.kernel = new Parameter("kernel", kernelSize * inputSize * filters);
        this.bias = new Parameter("bias", filters);
        kernel.glorotUniform(kernelSize * inputSize, kernelSize * filters, random);
    }

    @Override
    public double[][] forward(double[][] input, boolean training) {
        int steps = input.length - kernelSize + 1;
        checkArgument(steps > 0, "input shorter than the kernel");
        double[] w = kernel.getValues();
        double[] b = bias.getValues();
        double[][] output = new double[steps][filters];
        for (int t = 0; t < steps; t++) {
            double[] row = output[t];
            System.arraycopy(b, 0, row, 0, filters);
            for (int offset = 0; offset < kernelSize; offset++) {
                double[] x = input[t + offset];
                for (int i = 0; i < inputSize; i++) {
                    int base = (offset * inputSize + i) * filters;
                    for (int c = 0; c < filters; c++) {
                        row[c] += x[i] * w[base + c];
                    }
                }
            }
            for (int c = 0; c < filters; c++) {
                row[c] = activation.apply(row[c]);
            }
        }
        lastInput = input;
        lastOutput = output;
        return output;
    }

    @Override
    public double[][] backward(double[][] gradient) {
        double[] w = kernel.getValues();
        double[] dw = kernel.getGradients();
        double[] db = bias.getGradients();
        double[][] inputGradient = new double[lastInput.length][inputSize];
        double[] delta = new double[filters];
        for (int t = 0; t < lastOutput.length; t++) {
            for (int c = 0; c < filters; c++) {
                delta[c] = gradient[t][c] * activation.derivative(lastOutput[t][c]);
                db[c] += delta[c];
            }
            for (int offset = 0; offset < kernelSize; offset++) {
                double[] x = lastInput[t + offset];
                for (int i = 0; i < inputSize; i++) {
                    int base = (offset * inputSize + i) * filters;
                    double sum = 0;
                    for (int c = 0; c < filters; c++) {
                        dw[base + c] += x[i] * delta[c];
                        sum += w[base + c] * delta[c];
                    }
                    inputGradient[t + offset][i] += sum;
                }
            }
        }
        return inputGradient;
    }

    @Override
    public List<Parameter> getParameters() {
        return Arrays.asList(kernel, bias);
    }

    @Override
    public int[] outputShape(int[] inputShape) {
        checkArgument(inputShape[1] == inputSize, "incorrect input size");
        return new int[] { inputShape[0] - kernelSize + 1, filters };
    }

    @Override
    public String getName() {
        return "conv1d(" + filters + ", " + kernelSize + ", " + activation.name().toLowerCase() + ")";
    }
}
