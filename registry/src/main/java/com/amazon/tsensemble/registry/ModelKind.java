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

package com.amazon.tsensemble.registry;

/**
 * What a {@link ModelRecord} holds.
 */
public enum ModelKind {
    /**
     * a recurrent or convolutional forecast model, optionally stored with the
     * preprocessor that prepared its data
     */
    FORECAST_MODEL,
    STATE_TRANSITION_DETECTOR,
    TREND_DECOMPOSITION_DETECTOR,
    /**
     * a preprocessor on its own, including its fitted scaling transform
     */
    PREPROCESSOR
}
