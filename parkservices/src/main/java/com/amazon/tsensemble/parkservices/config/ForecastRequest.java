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

package com.amazon.tsensemble.parkservices.config;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.tsensemble.config.ForecastModelType;

/**
 * What to forecast: the ensemble members, the window and horizon they are
 * trained with and how many horizons to roll forward.
 */
@Getter
public class ForecastRequest {

    public static final int DEFAULT_STEPS = 1;

    private final List<ForecastModelType> modelTypes;

    private final int windowLength;

    private final int horizon;

    private final int steps;

    /**
     * null for inverse validation error weighting
     */
    private final Map<String, Double> explicitWeights;

    public ForecastRequest(Builder<?> builder) {
        checkArgument(builder.modelTypes != null && !builder.modelTypes.isEmpty(),
                "at least one model type is required");
        checkArgument(builder.modelTypes.stream().distinct().count() == builder.modelTypes.size(),
                "model types must be distinct");
        checkArgument(builder.windowLength > 0, "window length must be positive");
        checkArgument(builder.horizon > 0, "horizon must be positive");
        checkArgument(builder.steps > 0, "steps must be positive");
        modelTypes = Collections.unmodifiableList(new ArrayList<>(builder.modelTypes));
        windowLength = builder.windowLength;
        horizon = builder.horizon;
        steps = builder.steps;
        explicitWeights = (builder.explicitWeights == null) ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.explicitWeights));
    }

    /**
     * @return the identifier of a member in results and weight maps
     */
    public static String modelId(ForecastModelType type) {
        return type.name().toLowerCase();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected List<ForecastModelType> modelTypes = Arrays.asList(ForecastModelType.values());
        protected int windowLength;
        protected int horizon = 1;
        protected int steps = DEFAULT_STEPS;
        protected Map<String, Double> explicitWeights;

        public ForecastRequest build() {
            return new ForecastRequest(this);
        }

        public T modelTypes(ForecastModelType... modelTypes) {
            this.modelTypes = Arrays.asList(modelTypes);
            return (T) this;
        }

        public T windowLength(int windowLength) {
            this.windowLength = windowLength;
            return (T) this;
        }

        public T horizon(int horizon) {
            this.horizon = horizon;
            return (T) this;
        }

        public T steps(int steps) {
            this.steps = steps;
            return (T) this;
        }

        public T explicitWeights(Map<String, Double> explicitWeights) {
            this.explicitWeights = explicitWeights;
            return (T) this;
        }
    }
}
