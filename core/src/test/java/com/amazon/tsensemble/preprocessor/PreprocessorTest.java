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

package com.amazon.tsensemble.preprocessor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.tsensemble.config.ScalingMethod;
import com.amazon.tsensemble.config.StationarityTransform;
import com.amazon.tsensemble.exception.ModelNotFittedException;
import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.returntypes.PreparedData;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.returntypes.WindowedData;
import com.amazon.tsensemble.testutils.MultiDimDataWithKey;
import com.amazon.tsensemble.testutils.SyntheticSeries;
import com.amazon.tsensemble.util.ArrayUtils;

public class PreprocessorTest {

    @Test
    void testConfig() {
        assertThrows(IllegalArgumentException.class, () -> Preprocessor.builder().build());
        assertThrows(IllegalArgumentException.class, () -> Preprocessor.builder().windowLength(3).horizon(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> Preprocessor.builder().windowLength(3).trainRatio(0.9).validationRatio(0.2).build());
        assertThrows(IllegalArgumentException.class,
                () -> Preprocessor.builder().windowLength(3).scalingMethod(null).build());
        assertThrows(IllegalArgumentException.class,
                () -> Preprocessor.builder().windowLength(3).targetFeature(-1).build());
        assertDoesNotThrow(() -> Preprocessor.builder().windowLength(3).horizon(2).build());
    }

    @Test
    void testWindowsOfOneToTwelve() {
        double[][] values = ArrayUtils.asColumn(SyntheticSeries.linear(12, 1, 1));
        WindowedData windows = Preprocessor.createWindows(values, 3, 1, 0);
        assertEquals(9, windows.size());
        assertArrayEquals(new double[] { 1 }, windows.getInputs()[0][0]);
        assertArrayEquals(new double[] { 3 }, windows.getInputs()[0][2]);
        assertArrayEquals(new double[] { 4 }, windows.getTargets()[0]);
        assertArrayEquals(new double[] { 9 }, windows.getInputs()[8][0]);
        assertArrayEquals(new double[] { 11 }, windows.getInputs()[8][2]);
        assertArrayEquals(new double[] { 12 }, windows.getTargets()[8]);
    }

    @Test
    void testWindowCountAndShapes() {
        Random random = new Random(17);
        for (int trial = 0; trial < 20; trial++) {
            int length = 5 + random.nextInt(100);
            int windowLength = 1 + random.nextInt(4);
            int horizon = 1 + random.nextInt(3);
            int dimensions = 1 + random.nextInt(3);
            double[][] values = new double[length][dimensions];
            WindowedData windows = Preprocessor.createWindows(values, windowLength, horizon, dimensions - 1);
            assertEquals(length - windowLength - horizon + 1, windows.size());
            assertEquals(windowLength, windows.getInputs()[0].length);
            assertEquals(dimensions, windows.getInputs()[0][0].length);
            assertEquals(horizon, windows.getTargets()[0].length);
        }
    }

    @Test
    void testShortSeries() {
        double[][] values = new double[4][1];
        assertThrows(ShapeMismatchException.class, () -> Preprocessor.createWindows(values, 3, 2, 0));
        Preprocessor preprocessor = Preprocessor.builder().windowLength(3).horizon(2).build();
        assertThrows(ShapeMismatchException.class,
                () -> preprocessor.fitTransform(TimeSeries.univariate(new double[4])));
        // a series of exactly window plus horizon produces a single window, used for training
        PreparedData single = Preprocessor.builder().windowLength(3).horizon(2).trainRatio(0.5).build()
                .fitTransform(TimeSeries.univariate(new double[5]));
        assertEquals(1, single.getTrain().size());
        assertEquals(0, single.getValidation().size());
        assertEquals(0, single.getTest().size());
        PreparedData data = Preprocessor.builder().windowLength(3).horizon(2).trainRatio(1.0).validationRatio(0)
                .build().fitTransform(TimeSeries.univariate(new double[5]));
        assertEquals(1, data.getTrain().size());
    }

    @Test
    void testMinimalSeriesFits() {
        Preprocessor preprocessor = Preprocessor.builder().windowLength(3).horizon(1).build();
        PreparedData data = preprocessor.fitTransform(TimeSeries.univariate(new double[] { 1, 2, 3, 4 }));
        assertEquals(1, data.getTrain().size());
        assertEquals(4, data.getTrainingRows());
        assertArrayEquals(new double[] { 4 }, preprocessor.inverseTarget(data.getTrain().getTargets()[0]), 1e-9);
    }

    @Test
    void testSplit() {
        assertArrayEquals(new int[] { 7, 0, 2 }, Preprocessor.split(9, 0.8, 0.1));
        assertArrayEquals(new int[] { 80, 10, 10 }, Preprocessor.split(100, 0.8, 0.1));
        assertArrayEquals(new int[] { 8, 1, 2 }, Preprocessor.split(11, 0.8, 0.1));
        assertArrayEquals(new int[] { 0, 0, 0 }, Preprocessor.split(0, 0.8, 0.1));
        assertArrayEquals(new int[] { 1, 0, 0 }, Preprocessor.split(1, 0.8, 0.1));
        assertArrayEquals(new int[] { 1, 0, 1 }, Preprocessor.split(2, 0.4, 0.1));
        assertArrayEquals(new int[] { 0, 1, 1 }, Preprocessor.split(2, 0.0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> Preprocessor.split(10, 0.8, 0.3));
    }

    @Test
    void testScalerFittedOnTrainingRowsOnly() {
        // the tail of the series is far outside the training range
        double[] values = SyntheticSeries.linear(100, 0, 1);
        Preprocessor preprocessor = Preprocessor.builder().windowLength(5).build();
        PreparedData data = preprocessor.fitTransform(TimeSeries.univariate(values));
        int windows = 100 - 5 - 1 + 1;
        int train = (int) Math.floor(windows * 0.8);
        assertEquals(train + 5, data.getTrainingRows());
        MinMaxScalingTransform transform = (MinMaxScalingTransform) data.getScalingTransform();
        assertEquals(0, transform.getMinimum()[0]);
        assertEquals(train + 4, transform.getMaximum()[0]);
        double[][] scaled = data.getScaledValues();
        assertThat(scaled[train + 4][0], closeTo(1.0, 1e-12));
        assertTrue(scaled[99][0] > 1.0);
        assertEquals(train, data.getTrain().size());
        assertEquals(9, data.getValidation().size());
        assertEquals(windows - train - 9, data.getTest().size());
    }

    @ParameterizedTest
    @EnumSource(ScalingMethod.class)
    void testScalingRoundTrip(ScalingMethod method) {
        long seed = new Random().nextLong();
        System.out.println(" seed " + seed);
        Random random = new Random(seed);
        double[][] values = new double[200][3];
        for (double[] row : values) {
            row[0] = 100 * random.nextGaussian();
            row[1] = 5 + random.nextDouble();
            row[2] = 42;
        }
        IScalingTransform transform = Preprocessor.fitScaling(method, values);
        double[][] back = transform.inverseTransform(transform.transform(values));
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < 3; j++) {
                assertThat(back[i][j], closeTo(values[i][j], 1e-9 * (1 + Math.abs(values[i][j]))));
            }
            // constant feature maps to zero
            assertEquals(0, transform.transform(values)[i][2]);
        }
        assertArrayEquals(new double[] { 42, 42 }, transform.inverseTransform(new double[] { 0, 0 }, 2));
    }

    @Test
    void testTransformBeforeFit() {
        Preprocessor preprocessor = Preprocessor.builder().windowLength(3).build();
        assertFalse(preprocessor.isFitted());
        assertThrows(ModelNotFittedException.class, () -> preprocessor.transform(new double[1][1]));
        assertThrows(ModelNotFittedException.class, () -> preprocessor.inverseTarget(new double[1]));
    }

    @Test
    void testTargetFeature() {
        double[][] values = new double[40][2];
        for (int i = 0; i < 40; i++) {
            values[i][0] = i;
            values[i][1] = -3 * i;
        }
        Preprocessor preprocessor = Preprocessor.builder().windowLength(4).horizon(2).targetFeature(1).build();
        PreparedData data = preprocessor.fitTransform(new TimeSeries(values));
        double[] target = preprocessor.inverseTarget(data.getTrain().getTargets()[0]);
        assertThat(target[0], closeTo(-12, 1e-9));
        assertThat(target[1], closeTo(-15, 1e-9));
        assertThrows(ShapeMismatchException.class, () -> Preprocessor.builder().windowLength(4).targetFeature(2)
                .build().fitTransform(new TimeSeries(values)));
    }

    @Test
    void testStationarity() {
        assertTrue(Preprocessor.isStationary(SyntheticSeries.constant(500, 3.0)));
        assertFalse(Preprocessor.isStationary(SyntheticSeries.linear(500, 0, 1)));
        // too short to tell
        assertTrue(Preprocessor.isStationary(SyntheticSeries.linear(7, 0, 1)));
        Random random = new Random(0);
        double[] noise = new double[2000];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = 0.1 * random.nextGaussian();
        }
        assertTrue(Preprocessor.isStationary(noise));
    }

    @Test
    void testStrictMinimumSamples() {
        TimeSeries series = TimeSeries.univariate(SyntheticSeries.linear(20, 0, 1));
        assertDoesNotThrow(() -> Preprocessor.builder().windowLength(3).build().fitTransform(series));
        assertThrows(ValidationException.class,
                () -> Preprocessor.builder().windowLength(3).strictMinimumSamples(true).build().fitTransform(series));
    }

    @Test
    void testTrendEstimatedOnTrainingRowsOnly() {
        // the rows after the training partition jump far above the line
        double[] values = SyntheticSeries.linear(100, 0, 1);
        for (int i = 81; i < values.length; i++) {
            values[i] += 1000;
        }
        Preprocessor preprocessor = Preprocessor.builder().windowLength(5)
                .stationarityTransform(StationarityTransform.DETREND).build();
        PreparedData data = preprocessor.fitTransform(TimeSeries.univariate(values));
        // 95 windows, 76 for training
        assertEquals(81, data.getTrainingRows());
        StationarityTransformer transformer = preprocessor.getStationarityTransformer();
        assertEquals(1.0, transformer.getSlope()[0], 1e-9);
        assertEquals(0.0, transformer.getIntercept()[0], 1e-9);
    }

    @ParameterizedTest
    @EnumSource(value = StationarityTransform.class, names = { "DIFFERENCE", "LOG_DIFFERENCE", "DETREND" })
    void testStationarityTransformForecastInversion(StationarityTransform transform) {
        double[] values = new double[60];
        for (int i = 0; i < values.length; i++) {
            values[i] = 10 + 2 * i;
        }
        Preprocessor preprocessor = Preprocessor.builder().windowLength(5).stationarityTransform(transform).build();
        PreparedData data = preprocessor.fitTransform(TimeSeries.univariate(values));
        assertThat(data.getStationarityTransform(), is(transform));
        // a perfect forecast of the transformed continuation maps back to the line
        double[][] next = new double[3][1];
        for (int i = 0; i < 3; i++) {
            double x = 10 + 2 * (60 + i);
            double previous = 10 + 2 * (59 + i);
            switch (transform) {
            case DIFFERENCE:
                next[i][0] = 2;
                break;
            case LOG_DIFFERENCE:
                next[i][0] = Math.log(x + 1e-8) - Math.log(previous + 1e-8);
                break;
            default:
                next[i][0] = 0;
            }
        }
        double[][] scaled = preprocessor.transform(next);
        double[] forecast = preprocessor.inverseForecast(ArrayUtils.column(scaled, 0));
        for (int i = 0; i < 3; i++) {
            assertThat(forecast[i], closeTo(10 + 2 * (60 + i), 1e-6));
        }
    }

    @Test
    void testMultivariateWindows() {
        long seed = new Random().nextLong();
        System.out.println("seed = " + seed);
        MultiDimDataWithKey dataWithKey = SyntheticSeries.getMultiDimData(200, 40, 5, 0.1, seed, 3, 0.0, 5, true);
        assertEquals(0, dataWithKey.changeIndices.length);
        Preprocessor preprocessor = Preprocessor.builder().windowLength(10).targetFeature(2).build();
        PreparedData data = preprocessor.fitTransform(new TimeSeries(dataWithKey.data));
        WindowedData train = data.getTrain();
        assertEquals(3, train.getInputs()[0][0].length);
        for (int i = 0; i < train.size(); i++) {
            for (double[] row : train.getInputs()[i]) {
                for (double value : row) {
                    assertTrue(value >= -1e-12 && value <= 1 + 1e-12);
                }
            }
            if (i + 1 < train.size()) {
                assertArrayEquals(train.getInputs()[i][1], train.getInputs()[i + 1][0]);
                assertEquals(train.getTargets()[i][0], train.getInputs()[i + 1][9][2]);
            }
        }
        double[] target = preprocessor.inverseTarget(train.getTargets()[0]);
        assertThat(target[0], closeTo(dataWithKey.feature(2)[10], 1e-9));
    }
}
