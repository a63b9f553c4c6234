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

package com.amazon.tsensemble.anomalydetection;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.exception.ModelNotFittedException;
import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.state.anomalydetection.StateTransitionDetectorMapper;
import com.amazon.tsensemble.state.anomalydetection.StateTransitionDetectorState;
import com.amazon.tsensemble.testutils.SyntheticSeries;

public class StateTransitionDetectorTest {

    @Test
    void testConfig() {
        assertThrows(ValidationException.class, () -> StateTransitionDetector.builder().threshold(0).build());
        assertThrows(ValidationException.class, () -> StateTransitionDetector.builder().threshold(1.5).build());
        assertThrows(ValidationException.class, () -> StateTransitionDetector.builder().threshold(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> StateTransitionDetector.builder().states(0).build());
        StateTransitionDetector detector = StateTransitionDetector.builder().threshold(1.0).build();
        assertFalse(detector.isFitted());
        assertTrue(Double.isNaN(detector.getThresholdValue()));
        assertThrows(ModelNotFittedException.class, detector::detect);
        assertThrows(ModelNotFittedException.class, () -> detector.score(TimeSeries.univariate(new double[3])));
    }

    @Test
    void testConstantSeriesHasFewFlags() {
        StateTransitionDetector detector = StateTransitionDetector.builder().build();
        AnomalyScoreSeries result = detector.fitDetect(TimeSeries.univariate(SyntheticSeries.constant(50, 7.0)));
        assertEquals(50, result.size());
        assertEquals(AnomalyMethod.STATE_TRANSITION, result.getMethod());
        assertThat(result.getFlaggedCount(), lessThanOrEqualTo(5));
        assertFalse(result.getFlags()[0]);
        assertEquals(0.0, result.getScores()[0]);
    }

    @Test
    void testDetectReportIsNotAliased() {
        StateTransitionDetector detector = StateTransitionDetector.builder().threshold(0.95).build();
        detector.fit(TimeSeries.univariate(SyntheticSeries.constant(50, 7.0)));
        AnomalyScoreSeries first = detector.detect();
        int flagged = first.getFlaggedCount();
        double score = first.getScores()[10];
        first.getFlags()[10] = true;
        first.getScores()[10] = 1e9;

        AnomalyScoreSeries second = detector.detect();
        assertEquals(flagged, second.getFlaggedCount());
        assertEquals(score, second.getScores()[10]);
        assertEquals(flagged, first.getFlaggedCount());
    }

    @Test
    void testSpikeIsFlagged() {
        long seed = new Random().nextLong();
        System.out.println("seed = " + seed);
        double[] values = SyntheticSeries.sineWithSpikes(200, 20, 10, 1, 0.05, seed, 8, 120);
        StateTransitionDetector detector = StateTransitionDetector.builder().states(3).build();
        AnomalyScoreSeries result = detector.fitDetect(TimeSeries.univariate(values));
        assertTrue(result.getFlags()[120]);
        assertFalse(result.getFlags()[0]);
        // at most the top five percent of the differences exceed the percentile
        assertThat(result.getFlaggedCount(), lessThanOrEqualTo(10));
        assertThat(result.getScores()[120], greaterThan(detector.getThresholdValue()));
        assertEquals(199, detector.getHiddenStates().length);
        for (double[] row : detector.getTransitionMatrix()) {
            double sum = 0;
            for (double value : row) {
                sum += value;
            }
            assertEquals(1.0, sum, 1e-6);
        }
    }

    @Test
    void testScoreReusesFittedThreshold() {
        double[] values = SyntheticSeries.sineWithSpikes(150, 25, 5, 2, 0.1, 3L, 0);
        StateTransitionDetector detector = StateTransitionDetector.builder().states(4).threshold(0.9).build();
        detector.fit(TimeSeries.univariate(values));
        double threshold = detector.getThresholdValue();

        double[] fresh = SyntheticSeries.sineWithSpikes(60, 25, 5, 2, 0.1, 4L, 10, 30);
        AnomalyScoreSeries scored = detector.score(TimeSeries.univariate(fresh));
        assertEquals(threshold, detector.getThresholdValue());
        assertEquals(threshold, scored.getThreshold());
        assertEquals(60, scored.size());
        assertTrue(scored.getFlags()[30]);
        for (int i = 0; i < scored.size(); i++) {
            assertEquals(scored.getScores()[i] > threshold && i > 0, scored.getFlags()[i]);
        }

        assertEquals(1, detector.score(TimeSeries.univariate(new double[] { 1 })).size());
        assertThrows(ShapeMismatchException.class, () -> detector.score(new TimeSeries(new double[5][2])));
    }

    @Test
    void testMinimumObservations() {
        assertThrows(ValidationException.class,
                () -> StateTransitionDetector.builder().build().fit(TimeSeries.univariate(new double[] { 1, 2 })));
        double[] short20 = SyntheticSeries.sineWithSpikes(20, 5, 3, 1, 0.1, 0L, 0);
        assertThrows(ValidationException.class, () -> StateTransitionDetector.builder().strictMinimumSamples(true)
                .build().fit(TimeSeries.univariate(short20)));
        StateTransitionDetector relaxed = StateTransitionDetector.builder().build();
        relaxed.fit(TimeSeries.univariate(short20));
        assertTrue(relaxed.isFitted());
        // capped at the number of differences
        assertEquals(10, relaxed.getModel().getStates());
        StateTransitionDetector tiny = StateTransitionDetector.builder().build();
        tiny.fit(TimeSeries.univariate(new double[] { 1, 3, 2, 5 }));
        assertEquals(3, tiny.getModel().getStates());
    }

    @Test
    void testAbsoluteDifferenceFeature() {
        double[] values = SyntheticSeries.sineWithSpikes(100, 10, 5, 1, 0.05, 8L, 0);
        StateTransitionDetector detector = StateTransitionDetector.builder().states(3)
                .includeAbsoluteDifference(true).build();
        detector.fit(TimeSeries.univariate(values));
        assertEquals(2, detector.getStateMeans()[0].length);
        assertEquals(Boolean.TRUE, detector.getDiagnostics().get("includeAbsoluteDifference"));
    }

    @Test
    void testStateRoundTrip() {
        double[] values = SyntheticSeries.sineWithSpikes(120, 12, 5, 1, 0.1, 21L, 4, 70);
        StateTransitionDetector detector = StateTransitionDetector.builder().states(4).threshold(0.97).build();
        detector.fit(TimeSeries.univariate(values));
        StateTransitionDetectorMapper mapper = new StateTransitionDetectorMapper();
        StateTransitionDetectorState state = mapper.toState(detector);
        StateTransitionDetector copy = mapper.toModel(state);
        assertEquals(detector.getThresholdValue(), copy.getThresholdValue());
        assertArrayEquals(detector.detect().getScores(), copy.detect().getScores(), 1e-12);
        assertArrayEquals(detector.detect().getFlags(), copy.detect().getFlags());
        TimeSeries fresh = TimeSeries.univariate(SyntheticSeries.sineWithSpikes(30, 12, 5, 1, 0.1, 22L, 0));
        assertArrayEquals(detector.score(fresh).getScores(), copy.score(fresh).getScores(), 1e-12);
    }
}
