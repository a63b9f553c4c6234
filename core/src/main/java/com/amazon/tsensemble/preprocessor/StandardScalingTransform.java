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
 * Zero mean, unit (population) standard deviation per feature.
 */
public class StandardScalingTransform extends AffineScalingTransform {

    public StandardScalingTransform(double[] mean, double[] standardDeviation) {
        super(mean, standardDeviation);
        for (double value : standardDeviation) {
            checkArgument(value >= 0, "standard deviation cannot be negative");
        }
    }

    public static StandardScalingTransform fit(double[][] values) {
        int dimensions = ArrayUtils.checkRectangular(values);
        double[] mean = new double[dimensions];
        double[] deviation = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            double[] column = ArrayUtils.column(values, j);
            for (double value : column) {
                checkArgument(Double.isFinite(value), "values must be finite");
            }
            mean[j] = ArrayUtils.mean(column);
            deviation[j] = ArrayUtils.populationStandardDeviation(column);
        }
        return new StandardScalingTransform(mean, deviation);
    }

    @Override
    public ScalingMethod getMethod() {
        return ScalingMethod.STANDARD;
    }

    public double[] getMean() {
        return Arrays.copyOf(offset, offset.length);
    }

    public double[] getStandardDeviation() {
        return Arrays.copyOf(scale, scale.length);
    }
}
