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

package com.amazon.tsensemble.forecast;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.forecast.nn.Activation;
import com.amazon.tsensemble.forecast.nn.Conv1DLayer;
import com.amazon.tsensemble.forecast.nn.DenseLayer;
import com.amazon.tsensemble.forecast.nn.DropoutLayer;
import com.amazon.tsensemble.forecast.nn.FlattenLayer;
import com.amazon.tsensemble.forecast.nn.ILayer;
import com.amazon.tsensemble.forecast.nn.MaxPool1DLayer;
import com.amazon.tsensemble.forecast.nn.SequentialNetwork;

/**
 * Blocks of ReLU convolution followed by max pooling of size 2, then a flatten,
 * ReLU dense layers with dropout and a linear output of the horizon.
 */
public class ConvolutionalForecastModel extends AbstractForecastModel {

    public static final int[] DEFAULT_FILTERS = { 64, 128, 256 };

    public static final int[] DEFAULT_KERNEL_SIZES = { 2, 2, 2 };

    public static final int[] DEFAULT_DENSE_UNITS = { 50 };

    public static final int POOL_SIZE = 2;

    private final int[] filters;

    private final int[] kernelSizes;

    private final int[] denseUnits;

    public ConvolutionalForecastModel(Builder builder) {
        super(builder);
        checkArgument(builder.filters != null && builder.kernelSizes != null, "filters and kernels required");
        checkArgument(builder.filters.length > 0, "at least one convolution is required");
        checkArgument(builder.filters.length == builder.kernelSizes.length,
                "filters and kernel sizes must have the same length");
        checkArgument(builder.denseUnits != null, "dense units cannot be null");
        filters = Arrays.copyOf(builder.filters, builder.filters.length);
        kernelSizes = Arrays.copyOf(builder.kernelSizes, builder.kernelSizes.length);
        denseUnits = Arrays.copyOf(builder.denseUnits, builder.denseUnits.length);
        for (int i = 0; i < filters.length; i++) {
            checkArgument(filters[i] > 0 && kernelSizes[i] > 0, "filters and kernel sizes must be positive");
        }
        for (int value : denseUnits) {
            checkArgument(value > 0, "dense units must be positive");
        }
        int steps = windowLength;
        for (int i = 0; i < filters.length; i++) {
            steps = (steps - kernelSizes[i] + 1) / POOL_SIZE;
            if (steps < 1) {
                throw new ValidationException("window length " + windowLength
                        + " is too short for the convolution stack " + Arrays.toString(filters));
            }
        }
        initializeNetwork();
    }

    @Override
    protected SequentialNetwork buildNetwork(Random random) {
        List<ILayer> layers = new ArrayList<>();
        int steps = windowLength;
        int size = inputDimensions;
        for (int i = 0; i < filters.length; i++) {
            layers.add(new Conv1DLayer(size, filters[i], kernelSizes[i], Activation.RELU, random));
            layers.add(new MaxPool1DLayer(POOL_SIZE));
            steps = (steps - kernelSizes[i] + 1) / POOL_SIZE;
            size = filters[i];
        }
        layers.add(new FlattenLayer());
        size = steps * size;
        for (int units : denseUnits) {
            layers.add(new DenseLayer(size, units, Activation.RELU, random));
            layers.add(new DropoutLayer(dropout, false, random));
            size = units;
        }
        layers.add(new DenseLayer(size, horizon, Activation.LINEAR, random));
        return new SequentialNetwork(layers, new int[] { windowLength, inputDimensions });
    }

    @Override
    protected void addHyperparameters(Map<String, Object> map) {
        map.put("filters", Arrays.copyOf(filters, filters.length));
        map.put("kernelSizes", Arrays.copyOf(kernelSizes, kernelSizes.length));
        map.put("denseUnits", Arrays.copyOf(denseUnits, denseUnits.length));
    }

    @Override
    public ForecastModelType getModelType() {
        return ForecastModelType.CONVOLUTIONAL;
    }

    public int[] getFilters() {
        return Arrays.copyOf(filters, filters.length);
    }

    public int[] getKernelSizes() {
        return Arrays.copyOf(kernelSizes, kernelSizes.length);
    }

    public int[] getDenseUnits() {
        return Arrays.copyOf(denseUnits, denseUnits.length);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractForecastModel.Builder<Builder> {

        protected int[] filters = DEFAULT_FILTERS;
        protected int[] kernelSizes = DEFAULT_KERNEL_SIZES;
        protected int[] denseUnits = DEFAULT_DENSE_UNITS;

        public Builder filters(int... filters) {
            this.filters = filters;
            return this;
        }

        public Builder kernelSizes(int... kernelSizes) {
            this.kernelSizes = kernelSizes;
            return this;
        }

        public Builder denseUnits(int... denseUnits) {
            this.denseUnits = denseUnits;
            return this;
        }

        public ConvolutionalForecastModel build() {
            return new ConvolutionalForecastModel(this);
        }
    }
}
