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

import com.amazon.tsensemble.config.ScalingMethod;

/**
 * A fitted, invertible per feature scaling. Implementations are immutable once
 * created, so the same parameters apply to training, validation, test and
 * future data.
 */
public interface IScalingTransform {

    ScalingMethod getMethod();

    int getDimensions();

    /**
     * @param values rows of width {@code getDimensions()}
     * @return the scaled rows, the input is not modified
     */
    double[][] transform(double[][] values);

    /**
     * @param values scaled rows of width {@code getDimensions()}
     * @return the rows in original units
     */
    double[][] inverseTransform(double[][] values);

    /**
     * inverts values of a single feature, used for forecast targets
     *
     * @param values  scaled values of one feature
     * @param feature the feature index
     * @return the values in original units
     */
    double[] inverseTransform(double[] values, int feature);
}
