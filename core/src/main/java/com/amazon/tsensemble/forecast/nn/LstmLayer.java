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
 * A long short-term memory layer trained by backpropagation through time. The
 * gates are packed in the order input, forget, candidate, output; the forget
 * gate bias starts at 1.
 */
@Getter
public class LstmLayer implements ILayer {

    private final int inputSize;

    private final int units;

    private final boolean returnSequences;

    // input[i * 4 * units + k]
    private final Parameter kernel;

    // hidden[h * 4 * units + k]
    private final Parameter recurrentKernel;

    private final Parameter bias;

    // caches of the last forward pass, indexed by step
    private double[][] inputs;
    private double[][] gates;
    private double[][] cells;
    private double[][] hidden;

    public LstmLayer(int inputSize, int units, boolean returnSequences, Random random) {
        checkArgument(inputSize > 0 && units > 0, "sizes must be positive");
        this.inputSize = inputSize;
        this.units = units;
        this.returnSequences = returnSequences;
        this.kernel = new Parameter("kernel", inputSize * 4 * units);
        this.recurrentKernel = new Parameter("recurrent_kernel", units * 4 * units);
        this.bias = new Parameter("bias", 4 * units);
        kernel.glorotUniform(inputSize, 4 * units, random);
        recurrentKernel.glorotUniform(units, 4 * units, random);
        bias.fill(1.0, units, 2 * units);
    }

    @Override
    public double[][] forward(double[][] input, boolean training) {
        int steps = input.length;
        int width = 4 * units;
        double[] w = kernel.getValues();
        double[] u = recurrentKernel.getValues();
        double[] b = bias.getValues();
        inputs = input;
        gates = new double[steps][width];
        // cells[t + 1] and hidden[t + 1] hold the state after step t
        cells = new double[steps + 1][units];
        hidden = new double[steps + 1][units];
        for (int t = 0; t < steps; t++) {
            checkArgument(input[t].length == inputSize, "incorrect input size");
            double[] z = gates[t];
            System.arraycopy(b, 0, z, 0, width);
            for (int i = 0; i < inputSize; i++) {
                double x = input[t][i];
                int base = i * width;
                for (int k = 0; k < width; k++) {
                    z[k] += x * w[base + k];
                }
            }
            double[] previous = hidden[t];
            for (int h = 0; h < units; h++) {
                double value = previous[h];
                if (value != 0) {
                    int base = h * width;
                    for (int k = 0; k < width; k++) {
                        z[k] += value * u[base + k];
                    }
                }
            }
            for (int j = 0; j < units; j++) {
                z[j] = Activation.SIGMOID.apply(z[j]);
                z[units + j] = Activation.SIGMOID.apply(z[units + j]);
                z[2 * units + j] = Math.tanh(z[2 * units + j]);
                z[3 * units + j] = Activation.SIGMOID.apply(z[3 * units + j]);
                cells[t + 1][j] = z[units + j] * cells[t][j] + z[j] * z[2 * units + j];
                hidden[t + 1][j] = z[3 * units + j] * Math.tanh(cells[t + 1][j]);
            }
        }
        if (returnSequences) {
            double[][] output = new double[steps][];
            for (int t = 0; t < steps; t++) {
                output[t] = Arrays.copyOf(hidden[t + 1], units);
            }
            return output;
        }
        return new double[][] { Arrays.copyOf(hidden[steps], units) };
    }

    @Override
    public double[][] backward(double[][] gradient) {
        int steps = inputs.length;
        int width = 4 * units;
        double[] w = kernel.getValues();
        double[] u = recurrentKernel.getValues();
        double[] dw = kernel.getGradients();
        double[] du = recurrentKernel.getGradients();
        double[] db = bias.getGradients();
        double[][] inputGradient = new double[steps][inputSize];
        double[] nextHidden = new double[units];
        double[] nextCell = new double[units];
        double[] dz = new double[width];
        for (int t = steps - 1; t >= 0; t--) {
            double[] z = gates[t];
            for (int j = 0; j < units; j++) {
                double dh = nextHidden[j];
                if (returnSequences) {
                    dh += gradient[t][j];
                } else if (t == steps - 1) {
                    dh += gradient[0][j];
                }
                double inputGate = z[j];
                double forgetGate = z[units + j];
                double candidate = z[2 * units + j];
                double outputGate = z[3 * units + j];
                double tanhCell = Math.tanh(cells[t + 1][j]);
                double dc = nextCell[j] + dh * outputGate * (1 - tanhCell * tanhCell);
                dz[j] = dc * candidate * inputGate * (1 - inputGate);
                dz[units + j] = dc * cells[t][j] * forgetGate * (1 - forgetGate);
                dz[2 * units + j] = dc * inputGate * (1 - candidate * candidate);
                dz[3 * units + j] = dh * tanhCell * outputGate * (1 - outputGate);
                nextCell[j] = dc * forgetGate;
            }
            for (int k = 0; k < width; k++) {
                db[k] += dz[k];
            }
            for (int i = 0; i < inputSize; i++) {
                double x = inputs[t][i];
                int base = i * width;
                double sum = 0;
                for (int k = 0; k < width; k++) {
                    dw[base + k] += x * dz[k];
                    sum += w[base + k] * dz[k];
                }
                inputGradient[t][i] = sum;
            }
            double[] previous = hidden[t];
            for (int h = 0; h < units; h++) {
                int base = h * width;
                double value = previous[h];
                double sum = 0;
                for (int k = 0; k < width; k++) {
                    du[base + k] += value * dz[k];
                    sum += u[base + k] * dz[k];
                }
                nextHidden[h] = sum;
            }
        }
        return inputGradient;
    }

    @Override
    public List<Parameter> getParameters() {
        return Arrays.asList(kernel, recurrentKernel, bias);
    }

    @Override
    public int[] outputShape(int[] inputShape) {
        checkArgument(inputShape[1] == inputSize, "incorrect input size");
        return new int[] { returnSequences ? inputShape[0] : 1, units };
    }

    @Override
    public String getName() {
        return "lstm(" + units + (returnSequences ? ", sequences" : "") + ")";
    }
}
