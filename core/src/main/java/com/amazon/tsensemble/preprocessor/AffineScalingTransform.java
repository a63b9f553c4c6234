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

/**
 * Scaling of the form {@code (x - offset) / scale}. A feature with zero scale
 * is constant in the fitting data; it maps to 0 and inverts to the offset.
 */
public abstract class AffineScalingTransform implements IScalingTransform {

    protected final double[] offset;

    protected final double[] scale;

    protected AffineScalingTransform(double[] offset, double[] scale) {
        checkArgument(offset.length == scale.length, "incorrect lengths");
        checkArgument(offset.length > 0, "dimensions must be positive");
        this.offset = Arrays.copyOf(offset, offset.length);
        this.scale = Arrays.copyOf(scale, scale.length);
    }

    @Override
    public int getDimensions() {
        return offset.length;
    }

    @Override
    public double[][] transform(double[][] values) {
        double[][] answer = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            checkArgument(values[i].length == offset.length, "incorrect dimensions");
            answer[i] = new double[offset.length];
            for (int j = 0; j < offset.length; j++) {
                answer[i][j] = (scale[j] == 0) ? 0 : (values[i][j] - offset[j]) / scale[j];
            }
        }
        return answer;
    }

    @Override
    public double[][] inverseTransform(double[][] values) {
        double[][] answer = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            checkArgument(values[i].length == offset.length, "incorrect dimensions");
            answer[i] = new double[offset.length];
            for (int j = 0; j < offset.length; j++) {
                answer[i][j] = values[i][j] * scale[j] + offset[j];
            }
        }
        return answer;
    }

    @Override
    public double[] inverseTransform(double[] values, int feature) {
        checkArgument(feature >= 0 && feature < offset.length, "incorrect feature");
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = values[i] * scale[feature] + offset[feature];
        }
        return answer;
    }
}
