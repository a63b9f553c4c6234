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

import lombok.Getter;

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;

/**
 * The result of one detector: its scores, or the failure that stopped it.
 */
@Getter
public class DetectorOutcome {

    private final AnomalyMethod method;

    private final AnomalyScoreSeries scores;

    private final Throwable failure;

    private final IAnomalyDetector detector;

    private DetectorOutcome(AnomalyMethod method, AnomalyScoreSeries scores, Throwable failure,
            IAnomalyDetector detector) {
        checkArgument(method != null, "method cannot be null");
        this.method = method;
        this.scores = scores;
        this.failure = failure;
        this.detector = detector;
    }

    public static DetectorOutcome success(AnomalyScoreSeries scores) {
        return success(scores, null);
    }

    public static DetectorOutcome success(AnomalyScoreSeries scores, IAnomalyDetector detector) {
        checkArgument(scores != null, "scores cannot be null");
        return new DetectorOutcome(scores.getMethod(), scores, null, detector);
    }

    public static DetectorOutcome failure(AnomalyMethod method, Throwable failure) {
        checkArgument(failure != null, "failure cannot be null");
        return new DetectorOutcome(method, null, failure, null);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
