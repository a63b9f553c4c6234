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

import lombok.Getter;

/**
 * Confusion counts of anomaly flags against labels. A ratio with a zero
 * denominator is reported as 0.
 */
@Getter
public class AnomalyMetrics {

    private final int truePositives;

    private final int falsePositives;

    private final int falseNegatives;

    private final int trueNegatives;

    public AnomalyMetrics(int truePositives, int falsePositives, int falseNegatives, int trueNegatives) {
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.falseNegatives = falseNegatives;
        this.trueNegatives = trueNegatives;
    }

    public double getPrecision() {
        return ratio(truePositives, truePositives + falsePositives);
    }

    public double getRecall() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public double getF1() {
        double precision = getPrecision();
        double recall = getRecall();
        return (precision + recall > 0) ? 2 * precision * recall / (precision + recall) : 0;
    }

    public double getAccuracy() {
        return ratio(truePositives + trueNegatives, truePositives + falsePositives + falseNegatives + trueNegatives);
    }

    private static double ratio(int numerator, int denominator) {
        return (denominator > 0) ? (double) numerator / denominator : 0;
    }
}
