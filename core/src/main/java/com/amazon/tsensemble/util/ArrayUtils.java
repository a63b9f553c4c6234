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

package com.amazon.tsensemble.util;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * A utility class for data arrays.
 */
public class ArrayUtils {

    private ArrayUtils() {
    }

    public static double[][] deepCopy(double[][] values) {
        if (values == null) {
            return null;
        }
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = Arrays.copyOf(values[i], values[i].length);
        }
        return copy;
    }

    public static double[][][] deepCopy(double[][][] values) {
        if (values == null) {
            return null;
        }
        double[][][] copy = new double[values.length][][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = deepCopy(values[i]);
        }
        return copy;
    }

    /**
     * checks that a matrix is non-empty and rectangular
     *
     * @param values the matrix
     * @return the common row width
     */
    public static int checkRectangular(double[][] values) {
        checkArgument(values != null && values.length > 0, "values cannot be empty");
        int width = values[0].length;
        checkArgument(width > 0, "rows cannot be empty");
        for (double[] row : values) {
            checkArgument(row != null && row.length == width, "rows must have the same length");
        }
        return width;
    }

    public static double[] column(double[][] values, int index) {
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = values[i][index];
        }
        return answer;
    }

    public static double[][] asColumn(double[] values) {
        double[][] answer = new double[values.length][1];
        for (int i = 0; i < values.length; i++) {
            answer[i][0] = values[i];
        }
        return answer;
    }

    public static double mean(double[] values) {
        checkArgument(values.length > 0, "cannot average empty values");
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * standard deviation with denominator n
     */
    public static double populationStandardDeviation(double[] values) {
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return Math.sqrt(sum / values.length);
    }

    /**
     * standard deviation with denominator n - 1, 0 for fewer than two values
     */
    public static double sampleStandardDeviation(double[] values) {
        if (values.length < 2) {
            return 0;
        }
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return Math.sqrt(sum / (values.length - 1));
    }

    public static double[] flatten(double[][] values) {
        int total = 0;
        for (double[] row : values) {
            total += row.length;
        }
        double[] answer = new double[total];
        int position = 0;
        for (double[] row : values) {
            System.arraycopy(row, 0, answer, position, row.length);
            position += row.length;
        }
        return answer;
    }

    public static double[][] reshape(double[] values, int rows, int columns) {
        checkArgument(values.length == rows * columns, "incorrect length for reshape");
        double[][] answer = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(values, i * columns, answer[i], 0, columns);
        }
        return answer;
    }
}
