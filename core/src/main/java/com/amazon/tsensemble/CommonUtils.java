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

package com.amazon.tsensemble;

import java.util.Objects;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import com.amazon.tsensemble.exception.ModelNotFittedException;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link ModelNotFittedException} if a model is queried before it was
     * fitted.
     *
     * @param fitted    whether the model has been fitted
     * @param modelName a name used in the error message
     * @throws ModelNotFittedException if {@code fitted} is false.
     */
    public static void checkFitted(boolean fitted, String modelName) {
        if (!fitted) {
            throw new ModelNotFittedException(modelName + " must be fitted before making predictions");
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * the numpy style percentile that interpolates linearly between the closest
     * ranks
     *
     * @param values   the values (not modified)
     * @param fraction a value in (0,1]
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double fraction) {
        checkArgument(values != null && values.length > 0, "cannot compute percentile of empty values");
        checkArgument(fraction > 0 && fraction <= 1.0, "fraction must be in (0,1]");
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, 100 * fraction);
    }
}
