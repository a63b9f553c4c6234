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

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.Arrays;

import com.amazon.tsensemble.util.ArrayUtils;

/**
 * An ordered sequence of observations, each a fixed width vector of doubles,
 * with optional timestamps. Instances are immutable; arrays are copied on the
 * way in and on the way out.
 */
public class TimeSeries {

    private final double[][] values;

    private final long[] timestamps;

    private final int dimensions;

    public TimeSeries(double[][] values) {
        this(values, null);
    }

    public TimeSeries(double[][] values, long[] timestamps) {
        this.dimensions = ArrayUtils.checkRectangular(values);
        checkArgument(timestamps == null || timestamps.length == values.length,
                "timestamps must align with the values");
        if (timestamps != null) {
            for (int i = 1; i < timestamps.length; i++) {
                checkArgument(timestamps[i] > timestamps[i - 1], "timestamps must be strictly increasing");
            }
        }
        this.values = ArrayUtils.deepCopy(values);
        this.timestamps = (timestamps == null) ? null : Arrays.copyOf(timestamps, timestamps.length);
    }

    /**
     * a single feature series
     *
     * @param values the observations
     * @return a series of dimension 1
     */
    public static TimeSeries univariate(double[] values) {
        checkArgument(values != null && values.length > 0, "values cannot be empty");
        return new TimeSeries(ArrayUtils.asColumn(values));
    }

    public static TimeSeries univariate(double[] values, long[] timestamps) {
        checkArgument(values != null && values.length > 0, "values cannot be empty");
        return new TimeSeries(ArrayUtils.asColumn(values), timestamps);
    }

    public int size() {
        return values.length;
    }

    public int getDimensions() {
        return dimensions;
    }

    public double[][] getValues() {
        return ArrayUtils.deepCopy(values);
    }

    public double[] getFeature(int index) {
        checkArgument(index >= 0 && index < dimensions, "incorrect feature index");
        return ArrayUtils.column(values, index);
    }

    public double getValue(int index, int feature) {
        return values[index][feature];
    }

    public boolean hasTimestamps() {
        return timestamps != null;
    }

    public long[] getTimestamps() {
        return (timestamps == null) ? null : Arrays.copyOf(timestamps, timestamps.length);
    }
}
