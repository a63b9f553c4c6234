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

import java.util.Collections;
import java.util.List;

import com.amazon.tsensemble.util.ArrayUtils;

public class FlattenLayer implements ILayer {

    private int steps;

    private int features;

    @Override
    public double[][] forward(double[][] input, boolean training) {
        steps = input.length;
        features = input[0].length;
        return new double[][] { ArrayUtils.flatten(input) };
    }

    @Override
    public double[][] backward(double[][] gradient) {
        return ArrayUtils.reshape(gradient[0], steps, features);
    }

    @Override
    public List<Parameter> getParameters() {
        return Collections.emptyList();
    }

    @Override
    public int[] outputShape(int[] inputShape) {
        return new int[] { 1, inputShape[0] * inputShape[1] };
    }

    @Override
    public String getName() {
        return "flatten";
    }
}
