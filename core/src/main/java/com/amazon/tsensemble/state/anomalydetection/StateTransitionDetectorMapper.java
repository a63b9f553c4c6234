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

package com.amazon.tsensemble.state.anomalydetection;

import com.amazon.tsensemble.anomalydetection.StateTransitionDetector;
import com.amazon.tsensemble.anomalydetection.hmm.GaussianHiddenMarkovModel;
import com.amazon.tsensemble.state.IStateMapper;
import com.amazon.tsensemble.util.ArrayUtils;

public class StateTransitionDetectorMapper implements IStateMapper<StateTransitionDetector, StateTransitionDetectorState> {

    @Override
    public StateTransitionDetector toModel(StateTransitionDetectorState state, long seed) {
        StateTransitionDetector.Builder<?> builder = StateTransitionDetector.builder().states(state.getStates())
                .maxIterations(state.getMaxIterations()).tolerance(state.getTolerance())
                .varianceFloor(state.getVarianceFloor()).threshold(state.getThreshold())
                .includeAbsoluteDifference(state.isIncludeAbsoluteDifference())
                .strictMinimumSamples(state.isStrictMinimumSamples());
        if (!state.isFitted()) {
            return builder.build();
        }
        int states = state.getFittedStates();
        int dimensions = state.getObservationDimensions();
        GaussianHiddenMarkovModel model = new GaussianHiddenMarkovModel(state.getStartProbabilities(),
                ArrayUtils.reshape(state.getTransitions(), states, states),
                ArrayUtils.reshape(state.getMeans(), states, dimensions),
                ArrayUtils.reshape(state.getVariances(), states, dimensions), state.getVarianceFloor(),
                state.isConverged(), state.getIterations(), state.getLogLikelihood());
        double[][] observations = ArrayUtils.reshape(state.getFittedObservations(),
                state.getFittedObservations().length / dimensions, dimensions);
        return new StateTransitionDetector(builder, model, state.getInputDimensions(), state.getThresholdValue(),
                observations);
    }

    @Override
    public StateTransitionDetectorState toState(StateTransitionDetector model) {
        StateTransitionDetectorState state = new StateTransitionDetectorState();
        state.setStates(model.getStates());
        state.setMaxIterations(model.getMaxIterations());
        state.setTolerance(model.getTolerance());
        state.setVarianceFloor(model.getVarianceFloor());
        state.setThreshold(model.getThreshold());
        state.setIncludeAbsoluteDifference(model.isIncludeAbsoluteDifference());
        state.setStrictMinimumSamples(model.isStrictMinimumSamples());
        state.setFitted(model.isFitted());
        if (model.isFitted()) {
            GaussianHiddenMarkovModel hmm = model.getModel();
            state.setInputDimensions(model.getInputDimensions());
            state.setThresholdValue(model.getThresholdValue());
            state.setFittedStates(hmm.getStates());
            state.setObservationDimensions(hmm.getDimensions());
            state.setStartProbabilities(hmm.getStartProbabilities());
            state.setTransitions(ArrayUtils.flatten(hmm.getTransitions()));
            state.setMeans(ArrayUtils.flatten(hmm.getMeans()));
            state.setVariances(ArrayUtils.flatten(hmm.getVariances()));
            state.setConverged(hmm.isConverged());
            state.setIterations(hmm.getIterations());
            state.setLogLikelihood(hmm.getLogLikelihood());
            state.setFittedObservations(ArrayUtils.flatten(model.getFittedObservations()));
        }
        return state;
    }
}
