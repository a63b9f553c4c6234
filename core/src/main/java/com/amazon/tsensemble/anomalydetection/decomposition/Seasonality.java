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

package com.amazon.tsensemble.anomalydetection.decomposition;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A Fourier seasonality: {@code order} sine and cosine pairs of the given
 * period, measured in the time unit of the model.
 */
@Getter
@AllArgsConstructor
public class Seasonality {

    public static final Seasonality DAILY = new Seasonality("daily", 1.0, 4);

    public static final Seasonality WEEKLY = new Seasonality("weekly", 7.0, 3);

    public static final Seasonality YEARLY = new Seasonality("yearly", 365.25, 10);

    private final String name;

    private final double period;

    private final int order;

    public static Seasonality custom(double period, int order) {
        checkArgument(period > 0, "period must be positive");
        checkArgument(order > 0, "order must be positive");
        return new Seasonality("custom", period, order);
    }

    public int columns() {
        return 2 * order;
    }

    /**
     * writes the Fourier features of time {@code t} into {@code row} starting at
     * {@code offset}
     */
    public void features(double t, double[] row, int offset) {
        for (int k = 1; k <= order; k++) {
            double angle = 2 * Math.PI * k * t / period;
            row[offset + 2 * (k - 1)] = Math.sin(angle);
            row[offset + 2 * (k - 1) + 1] = Math.cos(angle);
        }
    }
}
