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

package com.amazon.tsensemble.parkservices.ensemble;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.tsensemble.exception.AggregationFailureException;
import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.parkservices.returntypes.ForecastResult;

public class EnsembleCombinerTest {

    private EnsembleCombiner combiner;

    @BeforeEach
    void setUp() {
        combiner = new EnsembleCombiner();
    }

    @Test
    void testInverseErrorWeights() {
        ForecastResult result = combiner.combine(Arrays.asList(ModelOutcome.success("a", new double[] { 1, 2 }, 0.1),
                ModelOutcome.success("b", new double[] { 4, 8 }, 0.2)));
        assertThat(result.getWeights().get("a"), closeTo(2.0 / 3, 1e-12));
        assertThat(result.getWeights().get("b"), closeTo(1.0 / 3, 1e-12));
        assertThat(result.getEnsemblePrediction()[0], closeTo(2.0, 1e-12));
        assertThat(result.getEnsemblePrediction()[1], closeTo(4.0, 1e-12));
        assertTrue(result.hasUncertainty());
        assertArrayEquals(new double[] { 1.5, 3.0 }, result.getUncertainty(), 1e-12);
        assertEquals(0.1, result.getValidationErrors().get("a"));
        assertFalse(result.isPartial());
    }

    @Test
    void testRandomWeightsSumToOne() {
        long seed = new Random().nextLong();
        System.out.println("seed = " + seed);
        Random random = new Random(seed);
        for (int trial = 0; trial < 50; trial++) {
            int members = 1 + random.nextInt(6);
            List<ModelOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < members; i++) {
                if (i > 0 && random.nextDouble() < 0.3) {
                    outcomes.add(ModelOutcome.failure("m" + i, new RuntimeException("failed")));
                } else {
                    outcomes.add(ModelOutcome.success("m" + i, new double[] { random.nextGaussian() },
                            0.01 + random.nextDouble()));
                }
            }
            ForecastResult result = combiner.combine(outcomes);
            double sum = 0;
            for (double weight : result.getWeights().values()) {
                assertTrue(weight >= 0);
                sum += weight;
            }
            assertEquals(1.0, sum, 1e-9);
            assertEquals(members, result.getWeights().size());
            assertEquals(result.getContributorCount() >= 2, result.hasUncertainty());
        }
    }

    @Test
    void testFailedMemberIsExcluded() {
        RuntimeException cause = new RuntimeException("did not converge");
        ForecastResult result = combiner.combine(Arrays.asList(ModelOutcome.success("a", new double[] { 3 }, 0.5),
                ModelOutcome.failure("b", cause)));
        assertEquals(1.0, result.getWeights().get("a"));
        assertEquals(0.0, result.getWeights().get("b"));
        assertArrayEquals(new double[] { 3 }, result.getEnsemblePrediction());
        assertNull(result.getUncertainty());
        assertSame(cause, result.getFailures().get("b"));
        assertTrue(result.isPartial());
        assertThat(result.getPerModelPredictions().keySet(), contains("a"));
    }

    @Test
    void testNoContributors() {
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second");
        AggregationFailureException exception = assertThrows(AggregationFailureException.class,
                () -> combiner.combine(
                        Arrays.asList(ModelOutcome.failure("a", first), ModelOutcome.failure("b", second))));
        assertThat(exception.getMemberFailures().keySet(), contains("a", "b"));
        assertThat(Arrays.asList(exception.getSuppressed()), containsInAnyOrder(first, second));
        assertThrows(AggregationFailureException.class, () -> combiner.combine(new ArrayList<>()));
    }

    @Test
    void testZeroErrorTakesAllWeight() {
        ForecastResult result = combiner.combine(Arrays.asList(ModelOutcome.success("a", new double[] { 1 }, 0.0),
                ModelOutcome.success("b", new double[] { 5 }, 0.3), ModelOutcome.success("c", new double[] { 3 }, 0.0)));
        assertEquals(0.5, result.getWeights().get("a"));
        assertEquals(0.0, result.getWeights().get("b"));
        assertEquals(0.5, result.getWeights().get("c"));
        assertArrayEquals(new double[] { 2 }, result.getEnsemblePrediction(), 1e-12);
    }

    @Test
    void testNonFiniteErrorFallsBackToEqualWeights() {
        ForecastResult result = combiner.combine(Arrays.asList(
                ModelOutcome.success("a", new double[] { 1 }, Double.NaN),
                ModelOutcome.success("b", new double[] { 5 }, 0.3)));
        assertEquals(0.5, result.getWeights().get("a"));
        assertEquals(0.5, result.getWeights().get("b"));
    }

    @Test
    void testExplicitWeights() {
        List<ModelOutcome> outcomes = Arrays.asList(ModelOutcome.success("a", new double[] { 0 }, 0.1),
                ModelOutcome.success("b", new double[] { 10 }, 0.2), ModelOutcome.failure("c", new RuntimeException()));
        Map<String, Double> weights = new HashMap<>();
        weights.put("a", 1.0);
        weights.put("b", 3.0);
        weights.put("c", 4.0);
        ForecastResult result = combiner.combine(outcomes, weights);
        assertEquals(0.25, result.getWeights().get("a"));
        assertEquals(0.75, result.getWeights().get("b"));
        assertEquals(0.0, result.getWeights().get("c"));
        assertArrayEquals(new double[] { 7.5 }, result.getEnsemblePrediction(), 1e-12);

        // a missing weight counts as zero
        Map<String, Double> partial = new HashMap<>();
        partial.put("b", 2.0);
        assertEquals(0.0, combiner.combine(outcomes, partial).getWeights().get("a"));

        Map<String, Double> negative = new HashMap<>();
        negative.put("a", -1.0);
        negative.put("b", 2.0);
        assertThrows(ValidationException.class, () -> combiner.combine(outcomes, negative));

        Map<String, Double> onlyFailed = new HashMap<>();
        onlyFailed.put("c", 1.0);
        assertThrows(ValidationException.class, () -> combiner.combine(outcomes, onlyFailed));
    }

    @Test
    void testPredictionLengthsMustAgree() {
        assertThrows(ShapeMismatchException.class,
                () -> combiner.combine(Arrays.asList(ModelOutcome.success("a", new double[] { 1, 2 }, 0.1),
                        ModelOutcome.success("b", new double[] { 1 }, 0.1))));
    }
}
