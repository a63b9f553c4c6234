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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.exception.AggregationFailureException;
import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.parkservices.returntypes.ForecastResult;

/**
 * Fuses member predictions into a weighted mean.
 * <p>
 * Without explicit weights a member receives {@code (1/e_i) / sum_j (1/e_j)}
 * where the sum runs over the members that produced a prediction. If some
 * contributors have error 0 they share the weight equally and the others get
 * none; if some contributor has no finite error all contributors are weighted
 * equally. Explicit weights must be non negative, a missing weight counts as
 * 0, weights of failed members are dropped and the rest is normalized.
 * <p>
 * The uncertainty is the elementwise population standard deviation of the
 * contributing predictions and is only reported for two or more contributors.
 */
public class EnsembleCombiner {

    private static final Logger logger = LogManager.getLogger(EnsembleCombiner.class);

    public ForecastResult combine(List<ModelOutcome> outcomes) {
        return combine(outcomes, null);
    }

    /**
     * @param outcomes        one outcome per requested member
     * @param explicitWeights weights by model id, or null for inverse error
     *                        weighting
     * @return the fused forecast
     * @throws AggregationFailureException if no member produced a prediction
     */
    public ForecastResult combine(List<ModelOutcome> outcomes, Map<String, Double> explicitWeights) {
        checkArgument(outcomes != null, "outcomes cannot be null");
        if (explicitWeights != null) {
            for (Map.Entry<String, Double> entry : explicitWeights.entrySet()) {
                Double value = entry.getValue();
                if (value == null || !(value >= 0) || value.isInfinite()) {
                    throw new ValidationException("weight of " + entry.getKey() + " must be a finite non negative"
                            + " number, got " + value);
                }
            }
        }

        List<ModelOutcome> contributors = new ArrayList<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        for (ModelOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                contributors.add(outcome);
            } else {
                failures.put(outcome.getModelId(), outcome.getFailure());
            }
        }
        if (contributors.isEmpty()) {
            throw new AggregationFailureException("no ensemble member produced a prediction", failures);
        }
        int length = contributors.get(0).getPrediction().length;
        for (ModelOutcome outcome : contributors) {
            if (outcome.getPrediction().length != length) {
                throw new ShapeMismatchException("prediction of " + outcome.getModelId() + " has length "
                        + outcome.getPrediction().length + ", expected " + length);
            }
        }

        double[] contributorWeights = (explicitWeights == null) ? errorWeights(contributors)
                : explicitWeights(contributors, explicitWeights);

        double[] ensemble = new double[length];
        for (int i = 0; i < contributors.size(); i++) {
            double[] prediction = contributors.get(i).getPrediction();
            for (int k = 0; k < length; k++) {
                ensemble[k] += contributorWeights[i] * prediction[k];
            }
        }
        double[] uncertainty = (contributors.size() >= 2) ? populationDeviation(contributors, length) : null;

        Map<String, Double> weights = new LinkedHashMap<>();
        Map<String, double[]> predictions = new LinkedHashMap<>();
        Map<String, Double> errors = new LinkedHashMap<>();
        Map<String, IForecastModel> models = new LinkedHashMap<>();
        int index = 0;
        for (ModelOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                weights.put(outcome.getModelId(), contributorWeights[index++]);
                predictions.put(outcome.getModelId(), outcome.getPrediction());
                errors.put(outcome.getModelId(), outcome.getValidationError());
                if (outcome.getModel() != null) {
                    models.put(outcome.getModelId(), outcome.getModel());
                }
            } else {
                weights.put(outcome.getModelId(), 0.0);
            }
        }
        return new ForecastResult(ensemble, uncertainty, predictions, weights, errors, failures, models);
    }

    double[] errorWeights(List<ModelOutcome> contributors) {
        int size = contributors.size();
        double[] answer = new double[size];
        int zeros = 0;
        for (ModelOutcome outcome : contributors) {
            double error = outcome.getValidationError();
            if (!Double.isFinite(error) || error < 0) {
                logger.warn("member {} has validation error {}, using equal weights", outcome.getModelId(), error);
                Arrays.fill(answer, 1.0 / size);
                return answer;
            }
            if (error == 0) {
                ++zeros;
            }
        }
        if (zeros > 0) {
            for (int i = 0; i < size; i++) {
                answer[i] = (contributors.get(i).getValidationError() == 0) ? 1.0 / zeros : 0;
            }
            return answer;
        }
        double sum = 0;
        for (int i = 0; i < size; i++) {
            answer[i] = 1.0 / contributors.get(i).getValidationError();
            sum += answer[i];
        }
        for (int i = 0; i < size; i++) {
            answer[i] /= sum;
        }
        return answer;
    }

    double[] explicitWeights(List<ModelOutcome> contributors, Map<String, Double> explicitWeights) {
        double[] answer = new double[contributors.size()];
        double sum = 0;
        for (int i = 0; i < answer.length; i++) {
            answer[i] = explicitWeights.getOrDefault(contributors.get(i).getModelId(), 0.0);
            sum += answer[i];
        }
        if (sum == 0) {
            throw new ValidationException("explicit weights of the contributing members sum to 0");
        }
        for (int i = 0; i < answer.length; i++) {
            answer[i] /= sum;
        }
        return answer;
    }

    static double[] populationDeviation(List<ModelOutcome> contributors, int length) {
        double[] answer = new double[length];
        int count = contributors.size();
        for (int k = 0; k < length; k++) {
            double mean = 0;
            for (ModelOutcome outcome : contributors) {
                mean += outcome.getPrediction()[k] / count;
            }
            double sum = 0;
            for (ModelOutcome outcome : contributors) {
                double difference = outcome.getPrediction()[k] - mean;
                sum += difference * difference;
            }
            answer[k] = Math.sqrt(sum / count);
        }
        return answer;
    }
}
