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
import com.amazon.tsensemble.forecast.nn.Activation;
import com.amazon.tsensemble.forecast.nn.DenseLayer;
import com.amazon.tsensemble.forecast.nn.DropoutLayer;
import com.amazon.tsensemble.forecast.nn.ILayer;
import com.amazon.tsensemble.forecast.nn.LstmLayer;
import com.amazon.tsensemble.forecast.nn.SequentialNetwork;

/**
 * Stacked LSTM layers, each with dropout on its inputs, followed by a linear
 * dense layer producing the horizon. Every LSTM layer except the last returns
 * its full sequence.
 */
public class RecurrentForecastModel extends AbstractForecastModel {

    public static final int[] DEFAULT_UNITS = { 64, 32 };

    private final int[] units;

    public RecurrentForecastModel(Builder builder) {
        super(builder);
        checkArgument(builder.units != null && builder.units.length > 0, "at least one recurrent layer is required");
        for (int value : builder.units) {
            checkArgument(value > 0, "units must be positive");
        }
        units = Arrays.copyOf(builder.units, builder.units.length);
        initializeNetwork();
    }

    @Override
    protected SequentialNetwork buildNetwork(Random random) {
        List<ILayer> layers = new ArrayList<>();
        int size = inputDimensions;
        for (int i = 0; i < units.length; i++) {
            layers.add(new DropoutLayer(dropout, true, random));
            layers.add(new LstmLayer(size, units[i], i < units.length - 1, random));
            size = units[i];
        }
        layers.add(new DenseLayer(size, horizon, Activation.LINEAR, random));
        return new SequentialNetwork(layers, new int[] { windowLength, inputDimensions });
    }

    @Override
    protected void addHyperparameters(Map<String, Object> map) {
        map.put("units", Arrays.copyOf(units, units.length));
    }

    @Override
    public ForecastModelType getModelType() {
        return ForecastModelType.RECURRENT;
    }

    public int[] getUnits() {
        return Arrays.copyOf(units, units.length);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractForecastModel.Builder<Builder> {

        protected int[] units = DEFAULT_UNITS;

        public Builder units(int... units) {
            this.units = units;
            return this;
        }

        public RecurrentForecastModel build() {
            return new RecurrentForecastModel(this);
        }
    }
}
