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

package com.amazon.tsensemble.parkservices.returntypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.preprocessor.Preprocessor;

/**
 * The fused forecast. All maps are keyed by model identifier in the order the
 * members were requested; {@code weights} has an entry for every member,
 * failed members carry weight 0.
 */
@Getter
public class ForecastResult {

    private final double[] ensemblePrediction;

    /**
     * population standard deviation across the contributing members, null when
     * fewer than two members contributed
     */
    private final double[] uncertainty;

    private final Map<String, double[]> perModelPredictions;

    private final Map<String, Double> weights;

    private final Map<String, Double> validationErrors;

    private final Map<String, Throwable> failures;

    private final Map<String, IForecastModel> models;

    /**
     * the preprocessor the members were trained with, null when the members
     * were run elsewhere
     */
    private final Preprocessor preprocessor;

    public ForecastResult(double[] ensemblePrediction, double[] uncertainty, Map<String, double[]> perModelPredictions,
            Map<String, Double> weights, Map<String, Double> validationErrors, Map<String, Throwable> failures,
            Map<String, IForecastModel> models) {
        this(ensemblePrediction, uncertainty, perModelPredictions, weights, validationErrors, failures, models, null);
    }

    public ForecastResult(double[] ensemblePrediction, double[] uncertainty, Map<String, double[]> perModelPredictions,
            Map<String, Double> weights, Map<String, Double> validationErrors, Map<String, Throwable> failures,
            Map<String, IForecastModel> models, Preprocessor preprocessor) {
        this.ensemblePrediction = ensemblePrediction;
        this.uncertainty = uncertainty;
        this.perModelPredictions = Collections.unmodifiableMap(new LinkedHashMap<>(perModelPredictions));
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.validationErrors = Collections.unmodifiableMap(new LinkedHashMap<>(validationErrors));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.preprocessor = preprocessor;
    }

    public ForecastResult withPreprocessor(Preprocessor preprocessor) {
        return new ForecastResult(ensemblePrediction, uncertainty, perModelPredictions, weights, validationErrors,
                failures, models, preprocessor);
    }

    public boolean hasUncertainty() {
        return uncertainty != null;
    }

    public int getContributorCount() {
        return perModelPredictions.size();
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
