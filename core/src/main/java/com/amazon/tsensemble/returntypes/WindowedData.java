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

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Supervised windows over a (scaled) series: {@code inputs[n][windowLength][d]}
 * and {@code targets[n][horizon]}. Window {@code i} covers rows
 * {@code i .. i+windowLength-1} and its target is the target feature of rows
 * {@code i+windowLength .. i+windowLength+horizon-1}.
 */
@Getter
public class WindowedData {

    private final double[][][] inputs;

    private final double[][] targets;

    private final int windowLength;

    private final int horizon;

    private final int dimensions;

    public WindowedData(double[][][] inputs, double[][] targets, int windowLength, int horizon, int dimensions) {
        checkArgument(inputs.length == targets.length, "inputs and targets must have the same count");
        this.inputs = inputs;
        this.targets = targets;
        this.windowLength = windowLength;
        this.horizon = horizon;
        this.dimensions = dimensions;
    }

    public int size() {
        return inputs.length;
    }

    public boolean isEmpty() {
        return inputs.length == 0;
    }

    /**
     * the contiguous range [from, to) of windows
     */
    public WindowedData slice(int from, int to) {
        checkArgument(0 <= from && from <= to && to <= inputs.length, "incorrect range");
        double[][][] x = new double[to - from][][];
        double[][] y = new double[to - from][];
        System.arraycopy(inputs, from, x, 0, to - from);
        System.arraycopy(targets, from, y, 0, to - from);
        return new WindowedData(x, y, windowLength, horizon, dimensions);
    }
}
