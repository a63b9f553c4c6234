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

package com.amazon.tsensemble.parkservices;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.exception.AggregationFailureException;
import com.amazon.tsensemble.exception.DependencyUnavailableException;
import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.forecast.ConvolutionalForecastModel;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.forecast.RecurrentForecastModel;
import com.amazon.tsensemble.parkservices.config.ForecastRequest;
import com.amazon.tsensemble.parkservices.returntypes.ForecastResult;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.returntypes.WindowedData;
import com.amazon.tsensemble.testutils.SyntheticSeries;

public class EnsembleForecasterTest {

    static final int WINDOW = 5;

    /**
     * repeats the last value of each window
     */
    static IForecastModel persistence() {
        IForecastModel model = mock(IForecastModel.class);
        when(model.predict(any(double[][][].class))).thenAnswer(invocation -> {
            double[][][] inputs = invocation.getArgument(0);
            double[][] answer = new double[inputs.length][1];
            for (int i = 0; i < inputs.length; i++) {
                answer[i][0] = inputs[i][WINDOW - 1][0];
            }
            return answer;
        });
        return model;
    }

    /**
     * repeats the value before the last, one step further off than persistence
     * on a straight line
     */
    static IForecastModel backwards() {
        IForecastModel model = mock(IForecastModel.class);
        when(model.predict(any(double[][][].class))).thenAnswer(invocation -> {
            double[][][] inputs = invocation.getArgument(0);
            double[][] answer = new double[inputs.length][1];
            for (int i = 0; i < inputs.length; i++) {
                answer[i][0] = inputs[i][WINDOW - 2][0];
            }
            return answer;
        });
        return model;
    }

    static TimeSeries line() {
        return TimeSeries.univariate(SyntheticSeries.linear(100, 0, 1));
    }

    @Test
    void testMembersWeightedByValidationError() {
        IForecastModel recurrent = persistence();
        IForecastModel convolutional = backwards();
        EnsembleForecaster forecaster = EnsembleForecaster.builder()
                .modelFactory((type, window, dimensions,
                        horizon) -> (type == ForecastModelType.RECURRENT) ? recurrent : convolutional)
                .build();
        ForecastResult result = forecaster.forecast(line(), ForecastRequest.builder().windowLength(WINDOW).build());

        // errors of one and two steps on a unit slope line
        assertThat(result.getValidationErrors().get("recurrent"), closeTo(1.0, 1e-9));
        assertThat(result.getValidationErrors().get("convolutional"), closeTo(2.0, 1e-9));
        assertThat(result.getWeights().get("recurrent"), closeTo(2.0 / 3, 1e-9));
        assertThat(result.getWeights().get("convolutional"), closeTo(1.0 / 3, 1e-9));
        assertThat(result.getPerModelPredictions().get("recurrent")[0], closeTo(99, 1e-9));
        assertThat(result.getPerModelPredictions().get("convolutional")[0], closeTo(98, 1e-9));
        assertThat(result.getEnsemblePrediction()[0], closeTo(99 - 1.0 / 3, 1e-9));
        assertThat(result.getUncertainty()[0], closeTo(0.5, 1e-9));
        assertNotNull(result.getPreprocessor());
        assertTrue(result.getPreprocessor().isFitted());
        verify(recurrent, times(1)).fit(any(WindowedData.class), any(WindowedData.class));
        verify(convolutional, times(1)).fit(any(WindowedData.class), any(WindowedData.class));
    }

    @Test
    void testFailedMemberIsRecorded() {
        IForecastModel recurrent = persistence();
        IForecastModel convolutional = persistence();
        doThrow(new IllegalStateException("diverged")).when(convolutional).fit(any(WindowedData.class),
                any(WindowedData.class));
        EnsembleForecaster forecaster = EnsembleForecaster.builder()
                .modelFactory((type, window, dimensions,
                        horizon) -> (type == ForecastModelType.RECURRENT) ? recurrent : convolutional)
                .build();
        ForecastResult result = forecaster.forecast(line(), ForecastRequest.builder().windowLength(WINDOW).build());
        assertTrue(result.isPartial());
        assertThat(result.getFailures().get("convolutional"), instanceOf(IllegalStateException.class));
        assertEquals(1.0, result.getWeights().get("recurrent"));
        assertEquals(0.0, result.getWeights().get("convolutional"));
        assertFalse(result.hasUncertainty());
        assertThat(result.getModels().keySet(), contains("recurrent"));
    }

    @Test
    void testAllMembersFail() {
        EnsembleForecaster forecaster = EnsembleForecaster.builder().modelFactory((type, window, dimensions,
                horizon) -> {
            throw new ValidationException("window too short for " + type);
        }).build();
        AggregationFailureException exception = assertThrows(AggregationFailureException.class,
                () -> forecaster.forecast(line(), ForecastRequest.builder().windowLength(WINDOW).build()));
        assertThat(exception.getMemberFailures().keySet(), contains("recurrent", "convolutional"));
    }

    @Test
    void testRequestErrorsSurface() {
        EnsembleForecaster forecaster = EnsembleForecaster.builder()
                .modelFactory((type, window, dimensions, horizon) -> persistence()).build();
        assertThrows(ShapeMismatchException.class,
                () -> forecaster.forecast(TimeSeries.univariate(new double[] { 1, 2, 3 }),
                        ForecastRequest.builder().windowLength(WINDOW).build()));
        assertThrows(IllegalArgumentException.class, () -> forecaster.forecast(new TimeSeries(new double[50][2]),
                ForecastRequest.builder().windowLength(WINDOW).steps(2).build()));
        EnsembleForecaster restricted = EnsembleForecaster.builder()
                .capabilities(new EngineCapabilities(false, true, true)).build();
        assertThrows(DependencyUnavailableException.class,
                () -> restricted.forecast(line(), ForecastRequest.builder().windowLength(WINDOW).build()));
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testFixedSeedGivesIdenticalForecasts(boolean parallel) {
        double[] values = SyntheticSeries.sineWithSpikes(160, 16, 10, 2, 0.1, 4L, 0);
        ForecastModelFactory factory = (type, window, dimensions, horizon) -> {
            if (type == ForecastModelType.RECURRENT) {
                return RecurrentForecastModel.builder().windowLength(window).inputDimensions(dimensions)
                        .horizon(horizon).units(6).epochs(3).randomSeed(17L).build();
            }
            return ConvolutionalForecastModel.builder().windowLength(window).inputDimensions(dimensions)
                    .horizon(horizon).filters(4).kernelSizes(2).denseUnits(4).epochs(3).randomSeed(17L).build();
        };
        ForecastRequest request = ForecastRequest.builder().windowLength(12).horizon(2).steps(3).build();
        ForecastResult first = EnsembleForecaster.builder().modelFactory(factory).parallelExecutionEnabled(parallel)
                .threadPoolSize(2).build().forecast(TimeSeries.univariate(values), request);
        ForecastResult second = EnsembleForecaster.builder().modelFactory(factory).build()
                .forecast(TimeSeries.univariate(values), request);
        assertEquals(6, first.getEnsemblePrediction().length);
        assertArrayEquals(first.getEnsemblePrediction(), second.getEnsemblePrediction());
        assertEquals(first.getWeights(), second.getWeights());
        double sum = first.getWeights().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, sum, 1e-9);
        for (double value : first.getEnsemblePrediction()) {
            assertTrue(Double.isFinite(value));
        }
    }
}
