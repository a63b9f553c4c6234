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

import java.util.List;

/**
 * A layer of a feed forward network. Activations are {@code [steps][features]}
 * matrices; a plain vector is a single step. A layer caches what it needs from
 * the last forward pass, so forward and backward calls must alternate for one
 * sample at a time.
 */
public interface ILayer {

    double[][] forward(double[][] input, boolean training);

    /**
     * accumulates the parameter gradients of the last forward pass
     *
     * @param gradient gradient of the loss with respect to the output
     * @return gradient of the loss with respect to the input
     */
    double[][] backward(double[][] gradient);

    List<Parameter> getParameters();

    /**
     * @param inputShape {steps, features}
     * @return {steps, features} of the output
     */
    int[] outputShape(int[] inputShape);

    String getName();
}
