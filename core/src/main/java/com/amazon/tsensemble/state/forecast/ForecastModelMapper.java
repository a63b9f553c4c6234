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

package com.amazon.tsensemble.state.forecast;

import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.forecast.AbstractForecastModel;
import com.amazon.tsensemble.forecast.ConvolutionalForecastModel;
import com.amazon.tsensemble.forecast.RecurrentForecastModel;
import com.amazon.tsensemble.returntypes.TrainingResult;
import com.amazon.tsensemble.state.IStateMapper;
import com.amazon.tsensemble.state.returntypes.TrainingResultMapper;

/**
 * Maps both forecast variants; the state records the variant tag.
 */
public class ForecastModelMapper implements IStateMapper<AbstractForecastModel, ForecastModelState> {

    @Override
    public AbstractForecastModel toModel(ForecastModelState state, long seed) {
        ForecastModelType type = ForecastModelType.valueOf(state.getModelType());
        AbstractForecastModel.Builder<?> builder;
        if (type == ForecastModelType.RECURRENT) {
            builder = RecurrentForecastModel.builder().units(state.getUnits());
        } else {
            builder = ConvolutionalForecastModel.builder().filters(state.getFilters())
                    .kernelSizes(state.getKernelSizes())
                    .denseUnits((state.getDenseUnits() == null) ? new int[0] : state.getDenseUnits());
        }
        builder.windowLength(state.getWindowLength()).inputDimensions(state.getInputDimensions())
                .horizon(state.getHorizon()).learningRate(state.getLearningRate()).epochs(state.getEpochs())
                .batchSize(state.getBatchSize()).patience(state.getPatience()).dropout(state.getDropout())
                .randomSeed(state.getRandomSeed());
        AbstractForecastModel model = (type == ForecastModelType.RECURRENT)
                ? ((RecurrentForecastModel.Builder) builder).build()
                : ((ConvolutionalForecastModel.Builder) builder).build();
        if (state.isFitted()) {
            TrainingResult result = (state.getTrainingResultState() == null) ? null
                    : new TrainingResultMapper().toModel(state.getTrainingResultState());
            model.restoreFittedState(state.getParameters(), result);
        }
        return model;
    }

    @Override
    public ForecastModelState toState(AbstractForecastModel model) {
        ForecastModelState state = new ForecastModelState();
        state.setModelType(model.getModelType().name());
        state.setWindowLength(model.getWindowLength());
        state.setInputDimensions(model.getInputDimensions());
        state.setHorizon(model.getHorizon());
        state.setLearningRate(model.getLearningRate());
        state.setEpochs(model.getEpochs());
        state.setBatchSize(model.getBatchSize());
        state.setPatience(model.getPatience());
        state.setDropout(model.getDropout());
        state.setRandomSeed(model.getRandomSeed());
        if (model instanceof RecurrentForecastModel) {
            state.setUnits(((RecurrentForecastModel) model).getUnits());
        } else if (model instanceof ConvolutionalForecastModel) {
            ConvolutionalForecastModel convolutional = (ConvolutionalForecastModel) model;
            state.setFilters(convolutional.getFilters());
            state.setKernelSizes(convolutional.getKernelSizes());
            state.setDenseUnits(convolutional.getDenseUnits());
        }
        state.setFitted(model.isFitted());
        if (model.isFitted()) {
            state.setParameters(model.getParameterValues());
            if (model.getTrainingResult() != null) {
                state.setTrainingResultState(new TrainingResultMapper().toState(model.getTrainingResult()));
            }
        }
        return state;
    }
}
