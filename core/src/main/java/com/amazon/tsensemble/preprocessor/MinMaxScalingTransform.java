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

package com.amazon.tsensemble.preprocessor;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.Arrays;

import com.amazon.tsensemble.config.ScalingMethod;
import com.amazon.tsensemble.util.ArrayUtils;

/**
 * Maps the fitted range of each feature to [0,1]. Values outside the fitted
 * range map outside [0,1]; there is no clipping.
 */
public class MinMaxScalingTransform extends AffineScalingTransform {

    public MinMaxScalingTransform(double[] minimum, double[] maximum) {
        super(minimum, range(minimum, maximum));
    }

    private static double[] range(double[] minimum, double[] maximum) {
        checkArgument(minimum.length == maximum.length, "incorrect lengths");
        double[] answer = new double[minimum.length];
        for (int i = 0; i < minimum.length; i++) {
            checkArgument(maximum[i] >= minimum[i], "maximum cannot be smaller than minimum");
            answer[i] = maximum[i] - minimum[i];
        }
        return answer;
    }

    public static MinMaxScalingTransform fit(double[][] values) {
        int dimensions = ArrayUtils.checkRectangular(values);
        double[] minimum = new double[dimensions];
        double[] maximum = new double[dimensions];
        Arrays.fill(minimum, Double.MAX_VALUE);
        Arrays.fill(maximum, -Double.MAX_VALUE);
        for (double[] row : values) {
            for (int j = 0; j < dimensions; j++) {
                checkArgument(Double.isFinite(row[j]), "values must be finite");
                minimum[j] = Math.min(minimum[j], row[j]);
                maximum[j] = Math.max(maximum[j], row[j]);
            }
        }
        return new MinMaxScalingTransform(minimum, maximum);
    }

    @Override
    public ScalingMethod getMethod() {
        return ScalingMethod.MINMAX;
    }

    public double[] getMinimum() {
        return Arrays.copyOf(offset, offset.length);
    }

    public double[] getMaximum() {
        double[] answer = new double[offset.length];
        for (int i = 0; i < offset.length; i++) {
            answer[i] = offset[i] + scale[i];
        }
        return answer;
    }
}
