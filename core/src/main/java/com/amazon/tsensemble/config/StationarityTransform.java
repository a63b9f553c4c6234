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

package com.amazon.tsensemble.config;

/**
 * Optional transformation applied to the raw series before scaling. These are
 * a convenience; knowing the data usually beats any of them.
 */
public enum StationarityTransform {

    NONE,
    /**
     * first difference, the series loses its first observation
     */
    DIFFERENCE,
    /**
     * first difference of log(x + 1e-8)
     */
    LOG_DIFFERENCE,
    /**
     * removes the least squares linear trend over the index
     */
    DETREND;
}
