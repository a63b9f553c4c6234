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

package com.amazon.tsensemble.parkservices.ensemble;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.tsensemble.forecast.IForecastModel;

/**
 * The result of one ensemble member: either a prediction with its validation
 * error, or the failure that stopped the member. Exactly one of
 * {@code prediction} and {@code failure} is set.
 */
@Getter
public class ModelOutcome {

    private final String modelId;

    private final double[] prediction;

    /**
     * root mean square error on the validation windows, in the units of the
     * target before scaling
     */
    private final double validationError;

    private final Throwable failure;

    /**
     * the fitted model, may be null when the outcome was assembled by hand
     */
    private final IForecastModel model;

    private ModelOutcome(String modelId, double[] prediction, double validationError, Throwable failure,
            IForecastModel model) {
        checkArgument(modelId != null, "model id cannot be null");
        this.modelId = modelId;
        this.prediction = prediction;
        this.validationError = validationError;
        this.failure = failure;
        this.model = model;
    }

    public static ModelOutcome success(String modelId, double[] prediction, double validationError) {
        return success(modelId, prediction, validationError, null);
    }

    public static ModelOutcome success(String modelId, double[] prediction, double validationError,
            IForecastModel model) {
        checkArgument(prediction != null, "prediction cannot be null");
        return new ModelOutcome(modelId, Arrays.copyOf(prediction, prediction.length), validationError, null,
                model);
    }

    public static ModelOutcome failure(String modelId, Throwable failure) {
        checkArgument(failure != null, "failure cannot be null");
        return new ModelOutcome(modelId, null, Double.NaN, failure, null);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
