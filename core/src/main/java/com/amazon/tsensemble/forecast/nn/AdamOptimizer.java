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

import java.util.List;

import lombok.Getter;

/**
 * Adam with bias correction. Gradients accumulated over a mini batch are
 * averaged before each step and cleared afterwards.
 */
@Getter
public class AdamOptimizer {

    public static final double DEFAULT_BETA1 = 0.9;

    public static final double DEFAULT_BETA2 = 0.999;

    public static final double DEFAULT_EPSILON = 1e-7;

    private final double learningRate;

    private final double beta1;

    private final double beta2;

    private final double epsilon;

    private long steps;

    public AdamOptimizer(double learningRate) {
        this(learningRate, DEFAULT_BETA1, DEFAULT_BETA2, DEFAULT_EPSILON);
    }

    public AdamOptimizer(double learningRate, double beta1, double beta2, double epsilon) {
        checkArgument(learningRate > 0, "learning rate must be positive");
        checkArgument(beta1 >= 0 && beta1 < 1 && beta2 >= 0 && beta2 < 1, "incorrect decay rates");
        this.learningRate = learningRate;
        this.beta1 = beta1;
        this.beta2 = beta2;
        this.epsilon = epsilon;
    }

    public void step(List<Parameter> parameters, int batchSize) {
        checkArgument(batchSize > 0, "batch size must be positive");
        ++steps;
        double correction1 = 1 - Math.pow(beta1, steps);
        double correction2 = 1 - Math.pow(beta2, steps);
        for (Parameter parameter : parameters) {
            double[] values = parameter.getValues();
            double[] gradients = parameter.getGradients();
            double[] m = parameter.getFirstMoment();
            double[] v = parameter.getSecondMoment();
            for (int i = 0; i < values.length; i++) {
                double g = gradients[i] / batchSize;
                m[i] = beta1 * m[i] + (1 - beta1) * g;
                v[i] = beta2 * v[i] + (1 - beta2) * g * g;
                values[i] -= learningRate * (m[i] / correction1) / (Math.sqrt(v[i] / correction2) + epsilon);
            }
            parameter.zeroGradients();
        }
    }
}
