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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The fitted components of a trend and seasonality model over a sequence of
 * time points, in the original units.
 */
@Getter
@AllArgsConstructor
public class DecompositionComponents {

    private final double[] trend;

    private final double[] seasonal;

    private final double[] expected;

    private final double[] lower;

    private final double[] upper;
}
