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
import java.util.Random;

import lombok.Getter;

/**
 * A trainable array together with its accumulated gradient and the two moment
 * estimates kept by {@link AdamOptimizer}.
 */
@Getter
public class Parameter {

    private final String name;

    private final double[] values;

    private final double[] gradients;

    private final double[] firstMoment;

    private final double[] secondMoment;

    public Parameter(String name, int size) {
        checkArgument(size > 0, "size must be positive");
        this.name = name;
        this.values = new double[size];
        this.gradients = new double[size];
        this.firstMoment = new double[size];
        this.secondMoment = new double[size];
    }

    public int size() {
        return values.length;
    }

    /**
     * Glorot (Xavier) uniform initialization
     */
    public void glorotUniform(int fanIn, int fanOut, Random random) {
        double limit = Math.sqrt(6.0 / (fanIn + fanOut));
        for (int i = 0; i < values.length; i++) {
            values[i] = (2 * random.nextDouble() - 1) * limit;
        }
    }

    public void fill(double value, int from, int to) {
        Arrays.fill(values, from, to, value);
    }

    public void zeroGradients() {
        Arrays.fill(gradients, 0);
    }

    public void copyFrom(double[] source, int offset) {
        System.arraycopy(source, offset, values, 0, values.length);
    }
}
