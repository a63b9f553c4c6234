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

package com.amazon.tsensemble.state.returntypes;

import com.amazon.tsensemble.returntypes.TrainingResult;
import com.amazon.tsensemble.state.IStateMapper;

public class TrainingResultMapper implements IStateMapper<TrainingResult, TrainingResultState> {

    @Override
    public TrainingResult toModel(TrainingResultState state, long seed) {
        return new TrainingResult(orEmpty(state.getLoss()), orEmpty(state.getValidationLoss()),
                orEmpty(state.getMae()), orEmpty(state.getValidationMae()), state.isStoppedEarly(),
                state.getBestEpoch());
    }

    // protostuff does not distinguish an empty array from a missing one
    private static double[] orEmpty(double[] values) {
        return (values == null) ? new double[0] : values;
    }

    @Override
    public TrainingResultState toState(TrainingResult model) {
        TrainingResultState state = new TrainingResultState();
        state.setLoss(model.getLoss());
        state.setValidationLoss(model.getValidationLoss());
        state.setMae(model.getMae());
        state.setValidationMae(model.getValidationMae());
        state.setStoppedEarly(model.isStoppedEarly());
        state.setBestEpoch(model.getBestEpoch());
        return state;
    }
}
