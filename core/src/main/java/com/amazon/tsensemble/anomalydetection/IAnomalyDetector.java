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

package com.amazon.tsensemble.anomalydetection;

import java.util.Map;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.TimeSeries;

/**
 * An anomaly scoring method. The threshold value is derived once, from the
 * fitting data, and afterwards only re-applied.
 */
public interface IAnomalyDetector {

    /**
     * fits the model and derives the threshold value from the fitting data
     *
     * @param series the fitting data
     */
    void fit(TimeSeries series);

    /**
     * @return scores and flags for every index of the fitting data
     */
    AnomalyScoreSeries detect();

    /**
     * scores data that was not seen during fitting with the stored model and
     * threshold value
     *
     * @param series new data with the dimensions of the fitting data
     * @return scores and flags for every index of {@code series}
     */
    AnomalyScoreSeries score(TimeSeries series);

    AnomalyMethod getMethod();

    boolean isFitted();

    /**
     * @return the threshold value in score units
     */
    double getThresholdValue();

    Map<String, Object> getDiagnostics();

    /**
     * fits and scores the fitting data in one call
     */
    default AnomalyScoreSeries fitDetect(TimeSeries series) {
        fit(series);
        return detect();
    }
}
