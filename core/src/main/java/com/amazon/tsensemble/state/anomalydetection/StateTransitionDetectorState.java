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

package com.amazon.tsensemble.state.anomalydetection;

import static com.amazon.tsensemble.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

@Data
public class StateTransitionDetectorState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;
    private int states;
    private int maxIterations;
    private double tolerance;
    private double varianceFloor;
    private double threshold;
    private boolean includeAbsoluteDifference;
    private boolean strictMinimumSamples;

    private boolean fitted;
    private int inputDimensions;
    private double thresholdValue;

    // hidden Markov model, matrices are stored row major
    private int fittedStates;
    private int observationDimensions;
    private double[] startProbabilities;
    private double[] transitions;
    private double[] means;
    private double[] variances;
    private boolean converged;
    private int iterations;
    private double logLikelihood;

    private double[] fittedObservations;
}
