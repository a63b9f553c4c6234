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

package com.amazon.tsensemble.registry.state;

import static com.amazon.tsensemble.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

import com.amazon.tsensemble.state.anomalydetection.StateTransitionDetectorState;
import com.amazon.tsensemble.state.anomalydetection.TrendDecompositionDetectorState;
import com.amazon.tsensemble.state.forecast.ForecastModelState;
import com.amazon.tsensemble.state.preprocessor.PreprocessorState;

/**
 * The fitted state of a record. Exactly the fields that belong to the kind are
 * set; a forecast model may carry a preprocessor as well.
 */
@Data
public class ModelRecordState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;
    private String kind;
    private ForecastModelState forecastModelState;
    private PreprocessorState preprocessorState;
    private StateTransitionDetectorState stateTransitionDetectorState;
    private TrendDecompositionDetectorState trendDecompositionDetectorState;
}
