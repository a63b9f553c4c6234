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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 * Compares the analytic gradients of each layer with central differences of
 * the loss {@code sum(output * weights)}.
 */
public class LayerGradientTest {

    private static final double EPSILON = 1e-6;

    private static final double TOLERANCE = 1e-5;

    private static double[][] random(int rows, int columns, Random random) {
        double[][] answer = new double[rows][columns];
        for (double[] row : answer) {
            for (int j = 0; j < columns; j++) {
                row[j] = random.nextGaussian();
            }
        }
        return answer;
    }

    private static double loss(ILayer layer, double[][] input, double[][] weights) {
        double[][] output = layer.forward(input, false);
        double answer = 0;
        for (int t = 0; t < output.length; t++) {
            for (int j = 0; j < output[t].length; j++) {
                answer += output[t][j] * weights[t][j];
            }
        }
        return answer;
    }

    private static void check(ILayer layer, int steps, int features, long seed) {
        Random random = new Random(seed);
        double[][] input = random(steps, features, random);
        int[] shape = layer.outputShape(new int[] { steps, features });
        double[][] weights = random(shape[0], shape[1], random);

        double[][] output = layer.forward(input, false);
        assertEquals(shape[0], output.length);
        assertEquals(shape[1], output[0].length);
        layer.getParameters().forEach(Parameter::zeroGradients);
        double[][] inputGradient = layer.backward(weights);

        for (int t = 0; t < steps; t++) {
            for (int i = 0; i < features; i++) {
                double saved = input[t][i];
                input[t][i] = saved + EPSILON;
                double plus = loss(layer, input, weights);
                input[t][i] = saved - EPSILON;
                double minus = loss(layer, input, weights);
                input[t][i] = saved;
                assertThat(inputGradient[t][i], closeTo((plus - minus) / (2 * EPSILON), TOLERANCE));
            }
        }
        for (Parameter parameter : layer.getParameters()) {
            double[] values = parameter.getValues();
            double[] analytic = Arrays.copyOf(parameter.getGradients(), values.length);
            for (int k = 0; k < values.length; k++) {
                double saved = values[k];
                values[k] = saved + EPSILON;
                double plus = loss(layer, input, weights);
                values[k] = saved - EPSILON;
                double minus = loss(layer, input, weights);
                values[k] = saved;
                assertThat(parameter.getName() + " " + k, analytic[k],
                        closeTo((plus - minus) / (2 * EPSILON), TOLERANCE));
            }
        }
    }

    @Test
    void testDense() {
        check(new DenseLayer(4, 3, Activation.TANH, new Random(1)), 2, 4, 11);
        check(new DenseLayer(5, 2, Activation.LINEAR, new Random(2)), 1, 5, 12);
        check(new DenseLayer(3, 3, Activation.SIGMOID, new Random(3)), 1, 3, 13);
    }

    @Test
    void testConvolution() {
        check(new Conv1DLayer(2, 3, 2, Activation.TANH, new Random(4)), 6, 2, 14);
        check(new Conv1DLayer(1, 4, 3, Activation.LINEAR, new Random(5)), 7, 1, 15);
    }

    @Test
    void testLstm() {
        LstmLayer sequences = new LstmLayer(2, 3, true, new Random(6));
        // random biases so that the forget gate is exercised away from its start
        Random random = new Random(60);
        double[] bias = sequences.getBias().getValues();
        for (int k = 0; k < bias.length; k++) {
            bias[k] += 0.5 * random.nextGaussian();
        }
        check(sequences, 5, 2, 16);
        check(new LstmLayer(1, 4, false, new Random(7)), 6, 1, 17);
    }

    @Test
    void testPoolingAndFlatten() {
        check(new MaxPool1DLayer(2), 7, 3, 18);
        check(new FlattenLayer(), 4, 3, 19);
    }

    @Test
    void testDropout() {
        DropoutLayer inference = new DropoutLayer(0.5, false, new Random(0));
        double[][] input = random(4, 3, new Random(8));
        assertSame(input, inference.forward(input, false));

        DropoutLayer shared = new DropoutLayer(0.5, true, new Random(9));
        double[][] output = shared.forward(input, true);
        for (int i = 0; i < 3; i++) {
            boolean dropped = output[0][i] == 0;
            for (int t = 1; t < 4; t++) {
                assertEquals(dropped, output[t][i] == 0);
                if (!dropped) {
                    assertThat(output[t][i], closeTo(2 * input[t][i], 1e-12));
                }
            }
        }
        double[][] gradient = shared.backward(random(4, 3, new Random(10)));
        for (int i = 0; i < 3; i++) {
            assertEquals(output[0][i] == 0, gradient[0][i] == 0);
        }
        assertThrows(IllegalArgumentException.class, () -> new DropoutLayer(1.0, false, new Random()));
    }

    @Test
    void testNetworkParameterValues() {
        Random random = new Random(21);
        List<ILayer> layers = Arrays.asList(new LstmLayer(1, 2, false, random),
                new DenseLayer(2, 1, Activation.LINEAR, random));
        SequentialNetwork network = new SequentialNetwork(layers, new int[] { 3, 1 });
        assertEquals(1 * 8 + 2 * 8 + 8 + 2 + 1, network.getParameterCount());
        double[] values = network.getParameterValues();
        double[][] input = { { 0.1 }, { 0.2 }, { 0.3 } };
        double[] before = network.forward(input, false)[0].clone();
        double[] changed = new double[values.length];
        network.setParameterValues(changed);
        assertArrayEquals(new double[] { 0 }, network.forward(input, false)[0]);
        network.setParameterValues(values);
        assertArrayEquals(before, network.forward(input, false)[0]);
        assertThrows(IllegalArgumentException.class, () -> network.setParameterValues(new double[3]));
    }

    @Test
    void testAdamMovesAgainstGradient() {
        Parameter parameter = new Parameter("w", 2);
        parameter.getValues()[0] = 1;
        parameter.getValues()[1] = -1;
        parameter.getGradients()[0] = 4;
        parameter.getGradients()[1] = -4;
        AdamOptimizer optimizer = new AdamOptimizer(0.1);
        optimizer.step(Arrays.asList(parameter), 2);
        // the first bias corrected step has size close to the learning rate
        assertThat(parameter.getValues()[0], closeTo(0.9, 1e-6));
        assertThat(parameter.getValues()[1], closeTo(-0.9, 1e-6));
        assertEquals(0, parameter.getGradients()[0]);
        assertEquals(1, optimizer.getSteps());
    }
}
