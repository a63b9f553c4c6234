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

package com.amazon.tsensemble.parkservices.consensus;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.exception.AggregationFailureException;
import com.amazon.tsensemble.parkservices.returntypes.AnomalyReport;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;

/**
 * Merges detector verdicts by union: a point flagged by any single method is
 * in the consensus set. There is no voting or weighting.
 */
public class AnomalyConsensusMerger {

    private static final Logger logger = LogManager.getLogger(AnomalyConsensusMerger.class);

    /**
     * @param outcomes one outcome per requested method
     * @return the merged report
     * @throws AggregationFailureException if every method failed
     */
    public AnomalyReport merge(List<DetectorOutcome> outcomes) {
        checkArgument(outcomes != null, "outcomes cannot be null");
        Map<AnomalyMethod, AnomalyScoreSeries> perMethod = new LinkedHashMap<>();
        Map<AnomalyMethod, Double> confidence = new LinkedHashMap<>();
        Map<AnomalyMethod, Throwable> failures = new LinkedHashMap<>();
        Map<AnomalyMethod, IAnomalyDetector> detectors = new LinkedHashMap<>();
        TreeSet<Integer> union = new TreeSet<>();
        for (DetectorOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                failures.put(outcome.getMethod(), outcome.getFailure());
                continue;
            }
            AnomalyScoreSeries series = outcome.getScores();
            perMethod.put(outcome.getMethod(), series);
            union.addAll(series.getFlaggedIndices());
            confidence.put(outcome.getMethod(),
                    (series.size() == 0) ? 0.0 : (double) series.getFlaggedCount() / series.size());
            if (outcome.getDetector() != null) {
                detectors.put(outcome.getMethod(), outcome.getDetector());
            }
        }
        if (perMethod.isEmpty()) {
            Map<String, Throwable> byName = new LinkedHashMap<>();
            failures.forEach((method, failure) -> byName.put(method.name(), failure));
            throw new AggregationFailureException("no anomaly detector produced scores", byName);
        }
        logger.debug("consensus of {} methods flags {} points", perMethod.size(), union.size());
        return new AnomalyReport(perMethod, new ArrayList<>(union), confidence, failures, detectors);
    }
}
