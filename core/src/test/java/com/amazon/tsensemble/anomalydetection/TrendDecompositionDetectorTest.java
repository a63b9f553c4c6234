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
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.config.SeasonalityMode;
import com.amazon.tsensemble.exception.ModelNotFittedException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.DecompositionComponents;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.state.anomalydetection.TrendDecompositionDetectorMapper;
import com.amazon.tsensemble.state.anomalydetection.TrendDecompositionDetectorState;
import com.amazon.tsensemble.testutils.SyntheticSeries;

public class TrendDecompositionDetectorTest {

    @Test
    void testConfig() {
        assertThrows(ValidationException.class, () -> TrendDecompositionDetector.builder().threshold(-0.1).build());
        assertThrows(IllegalArgumentException.class,
                () -> TrendDecompositionDetector.builder().intervalWidth(1.0).build());
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().build();
        assertEquals(AnomalyMethod.TREND_DECOMPOSITION, detector.getMethod());
        assertTrue(Double.isNaN(detector.getThresholdValue()));
        assertThrows(ModelNotFittedException.class, detector::detect);
        assertThrows(ValidationException.class, () -> detector.fit(TimeSeries.univariate(new double[] { 1 })));
        assertThrows(ValidationException.class, () -> TrendDecompositionDetector.builder().strictMinimumSamples(true)
                .build().fit(TimeSeries.univariate(SyntheticSeries.linear(9, 1, 1))));
    }

    @Test
    void testConstantSeriesHasNoFlags() {
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().build();
        AnomalyScoreSeries result = detector.fitDetect(TimeSeries.univariate(SyntheticSeries.constant(40, 5.0)));
        assertEquals(40, result.size());
        assertEquals(0, result.getFlaggedCount());
        assertEquals(0.0, detector.getThresholdValue());
        assertEquals(0.0, detector.getModel().getFinalSlope(), 1e-6);
    }

    @Test
    void testDetectReportIsNotAliased() {
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().build();
        detector.fit(TimeSeries.univariate(SyntheticSeries.constant(40, 5.0)));
        boolean[] flags = detector.detect().getFlags();
        Arrays.fill(flags, true);

        assertEquals(0, detector.detect().getFlaggedCount());
    }

    @Test
    void testSpikeAboveTrendIsFlagged() {
        double[] values = SyntheticSeries.linear(100, 0.5, 0.001);
        values[60] += 1.0;
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().build();
        AnomalyScoreSeries result = detector.fitDetect(TimeSeries.univariate(values));
        assertEquals(1, result.getFlaggedCount());
        assertTrue(result.getFlags()[60]);
        assertThat(detector.getThresholdValue(), closeTo(0.1 * (values[60] - values[0]), 1e-12));
        DecompositionComponents components = detector.getComponents();
        assertTrue(values[60] > components.getUpper()[60]);
        assertThat(result.getScores()[60],
                closeTo((values[60] - components.getUpper()[60]) / values[60], 1e-12));
        for (int i = 0; i < values.length; i++) {
            if (i != 60) {
                assertEquals(0.0, result.getScores()[i]);
            }
        }
    }

    @Test
    void testDipBelowTrendIsFlagged() {
        double[] values = SyntheticSeries.linear(80, 2.0, 0.0);
        values[40] = 1.0;
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().threshold(0.05).build();
        AnomalyScoreSeries result = detector.fitDetect(TimeSeries.univariate(values));
        assertTrue(result.getFlags()[40]);
        assertEquals(1, result.getFlaggedCount());
    }

    @Test
    void testDailySeasonalityWithTimestamps() {
        int num = 24 * 14;
        double[] values = SyntheticSeries.sineWithSpikes(num, 24, 1, 0.3, 0.01, 13L, 2, 200);
        long[] stamps = SyntheticSeries.hourlyTimestamps(num, 1_600_000_000_000L);
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().dailySeasonality(true)
                .seasonalityMode(SeasonalityMode.ADDITIVE).build();
        AnomalyScoreSeries result = detector.fitDetect(TimeSeries.univariate(values, stamps));
        assertTrue(detector.isTimestamped());
        assertTrue(result.getFlags()[200]);
        assertEquals(1, result.getFlaggedCount());

        // one day later the seasonal part repeats
        double[] seasonal = detector.getComponents().getSeasonal();
        assertThat(seasonal[30], closeTo(seasonal[54], 1e-9));
        assertThat(seasonal[6] - seasonal[18], closeTo(0.6, 0.05));

        long[] nextStamps = SyntheticSeries.hourlyTimestamps(48, stamps[num - 1] + SyntheticSeries.HOUR_MILLIS);
        double[] next = SyntheticSeries.sineWithSpikes(48, 24, 1, 0.3, 0.01, 14L, 2, 10);
        AnomalyScoreSeries scored = detector.score(TimeSeries.univariate(next, nextStamps));
        assertEquals(detector.getThresholdValue(), scored.getThreshold());
        assertTrue(scored.getFlags()[10]);
        assertThrows(IllegalArgumentException.class, () -> detector.score(TimeSeries.univariate(next)));
    }

    @Test
    void testNewDataContinuesAfterFittedIndices() {
        double[] values = SyntheticSeries.linear(50, 1, 0.1);
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().build();
        detector.fit(TimeSeries.univariate(values));
        DecompositionComponents next = detector.decompose(TimeSeries.univariate(new double[5]));
        for (int i = 0; i < 5; i++) {
            assertThat(next.getExpected()[i], closeTo(1 + 0.1 * (50 + i), 1e-3));
        }
        double[] continued = SyntheticSeries.linear(5, 6, 0.1);
        assertFalse(detector.score(TimeSeries.univariate(continued)).getFlags()[0]);
    }

    @Test
    void testStateRoundTrip() {
        int num = 24 * 7;
        double[] values = SyntheticSeries.sineWithSpikes(num, 24, 2, 0.5, 0.05, 17L, 3, 100);
        long[] stamps = SyntheticSeries.hourlyTimestamps(num, 0L);
        TrendDecompositionDetector detector = TrendDecompositionDetector.builder().dailySeasonality(true).build();
        detector.fit(TimeSeries.univariate(values, stamps));
        TrendDecompositionDetectorMapper mapper = new TrendDecompositionDetectorMapper();
        TrendDecompositionDetectorState state = mapper.toState(detector);
        TrendDecompositionDetector copy = mapper.toModel(state);
        assertEquals(detector.getThresholdValue(), copy.getThresholdValue());
        assertArrayEquals(detector.detect().getScores(), copy.detect().getScores(), 1e-12);
        assertArrayEquals(detector.detect().getFlags(), copy.detect().getFlags());
        long[] nextStamps = Arrays.copyOfRange(stamps, 0, 24);
        double[] next = Arrays.copyOfRange(values, 0, 24);
        assertArrayEquals(detector.score(TimeSeries.univariate(next, nextStamps)).getScores(),
                copy.score(TimeSeries.univariate(next, nextStamps)).getScores(), 1e-12);
    }
}
