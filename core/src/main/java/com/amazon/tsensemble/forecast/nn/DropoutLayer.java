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
import java.util.Random;

/**
 * Inverted dropout: during training each value is zeroed with probability
 * {@code rate} and the survivors are scaled by {@code 1/(1 - rate)}; at
 * inference the layer is the identity. With {@code sharedAcrossSteps} one mask
 * per feature is drawn and reused for every step, as is done for the inputs of
 * recurrent layers.
 */
public class DropoutLayer implements ILayer {

    private final double rate;

    private final boolean sharedAcrossSteps;

    private final Random random;

    private double[][] mask;

    public DropoutLayer(double rate, boolean sharedAcrossSteps, Random random) {
        checkArgument(rate >= 0 && rate < 1, "dropout rate must be in [0,1)");
        this.rate = rate;
        this.sharedAcrossSteps = sharedAcrossSteps;
        this.random = random;
    }

    @Override
    public double[][] forward(double[][] input, boolean training) {
        if (!training || rate == 0) {
            mask = null;
            return input;
        }
        int features = input[0].length;
        double keep = 1.0 / (1 - rate);
        mask = new double[input.length][];
        double[] shared = null;
        if (sharedAcrossSteps) {
            shared = draw(features, keep);
        }
        double[][] output = new double[input.length][features];
        for (int t = 0; t < input.length; t++) {
            mask[t] = sharedAcrossSteps ? shared : draw(features, keep);
            for (int i = 0; i < features; i++) {
                output[t][i] = input[t][i] * mask[t][i];
            }
        }
        return output;
    }

    private double[] draw(int features, double keep) {
        double[] answer = new double[features];
        for (int i = 0; i < features; i++) {
            answer[i] = (random.nextDouble() < rate) ? 0 : keep;
        }
        return answer;
    }

    @Override
    public double[][] backward(double[][] gradient) {
        if (mask == null) {
            return gradient;
        }
        double[][] inputGradient = new double[gradient.length][];
        for (int t = 0; t < gradient.length; t++) {
            inputGradient[t] = new double[gradient[t].length];
            for (int i = 0; i < gradient[t].length; i++) {
                inputGradient[t][i] = gradient[t][i] * mask[t][i];
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
        return inputShape;
    }

    @Override
    public String getName() {
        return "dropout(" + rate + ")";
    }
}
