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

package com.amazon.tsensemble.anomalydetection.hmm;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class GaussianHiddenMarkovModelTest {

    static double[][] twoRegimes(long seed) {
        Random random = new Random(seed);
        double[][] answer = new double[200][1];
        for (int t = 0; t < 200; t++) {
            answer[t][0] = ((t < 100) ? -2 : 2) + 0.2 * random.nextGaussian();
        }
        return answer;
    }

    @Test
    void testRecoversRegimes() {
        long seed = new Random().nextLong();
        System.out.println("seed = " + seed);
        double[][] observations = twoRegimes(seed);
        GaussianHiddenMarkovModel model = new GaussianHiddenMarkovModel(2, 1, 1e-3);
        model.fit(observations, 200, 1e-4);
        assertTrue(model.isFitted());
        assertTrue(model.isConverged());

        double low = Math.min(model.getMeans()[0][0], model.getMeans()[1][0]);
        double high = Math.max(model.getMeans()[0][0], model.getMeans()[1][0]);
        assertThat(low, closeTo(-2, 0.15));
        assertThat(high, closeTo(2, 0.15));

        int[] path = model.viterbi(observations);
        assertNotEquals(path[0], path[199]);
        for (int t = 1; t < 100; t++) {
            assertEquals(path[0], path[t]);
            assertEquals(path[199], path[100 + t - 1]);
        }
        // one switch in 199 transitions
        int stay = path[0];
        assertThat(model.getTransitions()[stay][stay], closeTo(1.0, 0.05));
    }

    @Test
    void testSurpriseAtRegimeChange() {
        double[][] observations = twoRegimes(5L);
        GaussianHiddenMarkovModel model = new GaussianHiddenMarkovModel(2, 1, 1e-3);
        model.fit(observations, 200, 1e-4);
        double[] conditional = model.conditionalLogLikelihood(observations);
        assertEquals(200, conditional.length);
        double total = 0;
        for (double value : conditional) {
            total += value;
        }
        // the switch is paid for with a transition of probability about 0.01
        assertTrue(conditional[100] < total / 200 - 3);
        assertThat(total, closeTo(model.getLogLikelihood(), 1e-6));
    }

    @Test
    void testRestoredModelScoresIdentically() {
        double[][] observations = twoRegimes(9L);
        GaussianHiddenMarkovModel model = new GaussianHiddenMarkovModel(3, 1, 1e-3);
        model.fit(observations, 50, 1e-3);
        GaussianHiddenMarkovModel copy = new GaussianHiddenMarkovModel(model.getStartProbabilities(),
                model.getTransitions(), model.getMeans(), model.getVariances(), model.getVarianceFloor(),
                model.isConverged(), model.getIterations(), model.getLogLikelihood());
        assertArrayEquals(model.conditionalLogLikelihood(observations), copy.conditionalLogLikelihood(observations));
        assertArrayEquals(model.viterbi(observations), copy.viterbi(observations));
    }

    @Test
    void testVarianceFloor() {
        double[][] observations = new double[20][1];
        GaussianHiddenMarkovModel model = new GaussianHiddenMarkovModel(2, 1, 0.01);
        model.fit(observations, 10, 1e-3);
        for (double[] variance : model.getVariances()) {
            assertTrue(variance[0] >= 0.01);
        }
        for (double value : model.conditionalLogLikelihood(observations)) {
            assertTrue(Double.isFinite(value));
        }
    }

    @Test
    void testArguments() {
        assertThrows(IllegalArgumentException.class, () -> new GaussianHiddenMarkovModel(0, 1, 1e-3));
        assertThrows(IllegalArgumentException.class, () -> new GaussianHiddenMarkovModel(2, 1, 0));
        GaussianHiddenMarkovModel model = new GaussianHiddenMarkovModel(5, 1, 1e-3);
        assertThrows(IllegalArgumentException.class, () -> model.fit(new double[3][1], 10, 1e-3));
        assertThrows(IllegalStateException.class, () -> model.conditionalLogLikelihood(new double[3][1]));
    }
}
