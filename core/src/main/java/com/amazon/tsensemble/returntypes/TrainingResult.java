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

package com.amazon.tsensemble.returntypes;

import java.util.Arrays;

import lombok.Getter;

/**
 * The per epoch history of a training run. The validation curves are empty when
 * no validation data was supplied.
 */
@Getter
public class TrainingResult {

    private final double[] loss;

    private final double[] validationLoss;

    private final double[] mae;

    private final double[] validationMae;

    private final int epochsRun;

    private final boolean stoppedEarly;

    /**
     * zero based epoch whose weights were retained
     */
    private final int bestEpoch;

    public TrainingResult(double[] loss, double[] validationLoss, double[] mae, double[] validationMae,
            boolean stoppedEarly, int bestEpoch) {
        this.loss = Arrays.copyOf(loss, loss.length);
        this.validationLoss = Arrays.copyOf(validationLoss, validationLoss.length);
        this.mae = Arrays.copyOf(mae, mae.length);
        this.validationMae = Arrays.copyOf(validationMae, validationMae.length);
        this.epochsRun = loss.length;
        this.stoppedEarly = stoppedEarly;
        this.bestEpoch = bestEpoch;
    }

    public boolean hasValidation() {
        return validationLoss.length > 0;
    }

    public double getFinalLoss() {
        return (loss.length == 0) ? Double.NaN : loss[loss.length - 1];
    }

    public double getBestValidationLoss() {
        return hasValidation() ? validationLoss[bestEpoch] : Double.NaN;
    }
}
