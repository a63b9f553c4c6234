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

package com.amazon.tsensemble.state.preprocessor;

import com.amazon.tsensemble.config.ScalingMethod;
import com.amazon.tsensemble.preprocessor.IScalingTransform;
import com.amazon.tsensemble.preprocessor.MinMaxScalingTransform;
import com.amazon.tsensemble.preprocessor.StandardScalingTransform;
import com.amazon.tsensemble.state.IStateMapper;

public class ScalingTransformMapper implements IStateMapper<IScalingTransform, ScalingTransformState> {

    @Override
    public IScalingTransform toModel(ScalingTransformState state, long seed) {
        ScalingMethod method = ScalingMethod.valueOf(state.getScalingMethod());
        if (method == ScalingMethod.MINMAX) {
            return new MinMaxScalingTransform(state.getOffset(), state.getSpread());
        }
        return new StandardScalingTransform(state.getOffset(), state.getSpread());
    }

    @Override
    public ScalingTransformState toState(IScalingTransform model) {
        ScalingTransformState state = new ScalingTransformState();
        state.setScalingMethod(model.getMethod().name());
        if (model instanceof MinMaxScalingTransform) {
            state.setOffset(((MinMaxScalingTransform) model).getMinimum());
            state.setSpread(((MinMaxScalingTransform) model).getMaximum());
        } else if (model instanceof StandardScalingTransform) {
            state.setOffset(((StandardScalingTransform) model).getMean());
            state.setSpread(((StandardScalingTransform) model).getStandardDeviation());
        } else {
            throw new IllegalArgumentException("unknown scaling transform " + model.getClass().getName());
        }
        return state;
    }
}
