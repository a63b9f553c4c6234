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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;

/**
 * Verdicts of every requested method plus their union. Confidence is the
 * fraction of points a method flagged; it is not a probability.
 */
@Getter
public class AnomalyReport {

    private final Map<AnomalyMethod, AnomalyScoreSeries> perMethod;

    /**
     * sorted, distinct indices flagged by at least one method
     */
    private final List<Integer> consensusIndices;

    private final Map<AnomalyMethod, Double> methodConfidence;

    private final Map<AnomalyMethod, Throwable> failures;

    private final Map<AnomalyMethod, IAnomalyDetector> detectors;

    public AnomalyReport(Map<AnomalyMethod, AnomalyScoreSeries> perMethod, List<Integer> consensusIndices,
            Map<AnomalyMethod, Double> methodConfidence, Map<AnomalyMethod, Throwable> failures,
            Map<AnomalyMethod, IAnomalyDetector> detectors) {
        this.perMethod = Collections.unmodifiableMap(new LinkedHashMap<>(perMethod));
        this.consensusIndices = Collections.unmodifiableList(new ArrayList<>(consensusIndices));
        this.methodConfidence = Collections.unmodifiableMap(new LinkedHashMap<>(methodConfidence));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.detectors = Collections.unmodifiableMap(new LinkedHashMap<>(detectors));
    }

    public boolean isAnomalous(int index) {
        return Collections.binarySearch(consensusIndices, index) >= 0;
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
