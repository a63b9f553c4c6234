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
import com.amazon.tsensemble.config.StationarityTransform;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.preprocessor.StationarityTransformer;
import com.amazon.tsensemble.state.IStateMapper;

public class PreprocessorMapper implements IStateMapper<Preprocessor, PreprocessorState> {

    @Override
    public Preprocessor toModel(PreprocessorState state, long seed) {
        StationarityTransform transform = StationarityTransform.valueOf(state.getStationarityTransform());
        Preprocessor preprocessor = Preprocessor.builder().windowLength(state.getWindowLength())
                .horizon(state.getHorizon()).trainRatio(state.getTrainRatio())
                .validationRatio(state.getValidationRatio())
                .scalingMethod(ScalingMethod.valueOf(state.getScalingMethod()))
                .targetFeature(state.getTargetFeature()).stationarityTransform(transform)
                .minimumObservations(state.getMinimumObservations())
                .strictMinimumSamples(state.isStrictMinimumSamples()).build();
        if (state.getScalingTransformState() != null) {
            preprocessor.setScalingTransform(new ScalingTransformMapper().toModel(state.getScalingTransformState()));
            preprocessor.setStationarityTransformer(new StationarityTransformer(transform, state.getLastValues(),
                    state.getTrendIntercept(), state.getTrendSlope(), state.getTransformedLength()));
        }
        return preprocessor;
    }

    @Override
    public PreprocessorState toState(Preprocessor model) {
        PreprocessorState state = new PreprocessorState();
        state.setWindowLength(model.getWindowLength());
        state.setHorizon(model.getHorizon());
        state.setTrainRatio(model.getTrainRatio());
        state.setValidationRatio(model.getValidationRatio());
        state.setScalingMethod(model.getScalingMethod().name());
        state.setTargetFeature(model.getTargetFeature());
        state.setStationarityTransform(model.getStationarityTransform().name());
        state.setMinimumObservations(model.getMinimumObservations());
        state.setStrictMinimumSamples(model.isStrictMinimumSamples());
        if (model.isFitted()) {
            state.setScalingTransformState(new ScalingTransformMapper().toState(model.getScalingTransform()));
            StationarityTransformer transformer = model.getStationarityTransformer();
            state.setLastValues(transformer.getLastValues());
            state.setTrendIntercept(transformer.getIntercept());
            state.setTrendSlope(transformer.getSlope());
            state.setTransformedLength(transformer.getLength());
        }
        return state;
    }
}
