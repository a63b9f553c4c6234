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

package com.amazon.tsensemble.registry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.anomalydetection.StateTransitionDetector;
import com.amazon.tsensemble.anomalydetection.TrendDecompositionDetector;
import com.amazon.tsensemble.exception.ModelNotFoundException;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.forecast.RecurrentForecastModel;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.PreparedData;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

/**
 * Behavior every registry shares; subclasses supply the implementation.
 */
public abstract class AbstractModelRegistryTest {

    static final int WINDOW = 12;

    protected ModelRegistry registry;

    protected abstract ModelRegistry createRegistry();

    @BeforeEach
    void setUp() {
        registry = createRegistry();
    }

    @Test
    void testForecastModelWithPreprocessor() {
        double[] values = SyntheticSeries.sineWithSpikes(200, 24, 10, 3, 0.1, 7L, 0);
        Preprocessor preprocessor = Preprocessor.builder().windowLength(WINDOW).horizon(2).build();
        PreparedData data = preprocessor.fitTransform(TimeSeries.univariate(values));
        IForecastModel model = RecurrentForecastModel.builder().windowLength(WINDOW).horizon(2).units(8).epochs(3)
                .batchSize(16).randomSeed(11L).build();
        model.fit(data.getTrain(), data.getValidation());

        registry.save("sine-forecast", ModelRecord.of(model, preprocessor).withDescription("hourly sine"));
        assertTrue(registry.exists("sine-forecast"));

        ModelRecord record = registry.load("sine-forecast");
        assertEquals(ModelKind.FORECAST_MODEL, record.getKind());
        assertEquals("RECURRENT", record.getModelType());
        assertArrayEquals(new int[] { WINDOW, 1, 2 }, record.getDataShape());
        assertEquals("hourly sine", record.getDescription().get());
        assertEquals("[8]", record.getHyperparameters().get("units"));
        assertEquals(3, record.getTrainingResult().get().getEpochsRun());

        IForecastModel restored = record.getForecastModel();
        double[][][] inputs = data.getTest().getInputs();
        assertArrayEquals(model.predict(inputs), restored.predict(inputs));
        Preprocessor restoredPreprocessor = record.getPreprocessor().get();
        double[] forecast = model.predict(new double[][][] { data.lastWindow(WINDOW) })[0];
        assertArrayEquals(preprocessor.inverseForecast(forecast), restoredPreprocessor.inverseForecast(forecast));
        assertThrows(IllegalStateException.class, record::getAnomalyDetector);
    }

    @Test
    void testDetectors() {
        int seed = new Random().nextInt();
        System.out.println("seed = " + seed);
        double[] values = SyntheticSeries.sineWithSpikes(150, 20, 5, 1, 0.05, seed, 3, 75);
        TimeSeries series = TimeSeries.univariate(values);
        StateTransitionDetector stateTransition = StateTransitionDetector.builder().states(3).build();
        stateTransition.fit(series);
        TrendDecompositionDetector trend = TrendDecompositionDetector.builder().build();
        trend.fit(series);

        registry.save("state", ModelRecord.of(stateTransition));
        registry.save("trend", ModelRecord.of(trend));
        assertThat(registry.list(), contains("state", "trend"));

        ModelRecord stateRecord = registry.load("state");
        assertEquals(ModelKind.STATE_TRANSITION_DETECTOR, stateRecord.getKind());
        assertArrayEquals(new int[] { 150, 1 }, stateRecord.getDataShape());
        IAnomalyDetector restoredState = stateRecord.getAnomalyDetector();
        assertThat(restoredState, instanceOf(StateTransitionDetector.class));
        assertEquals(stateTransition.getThresholdValue(), restoredState.getThresholdValue());

        IAnomalyDetector restoredTrend = registry.load("trend").getAnomalyDetector();
        double[] next = SyntheticSeries.sineWithSpikes(30, 20, 5, 1, 0.05, seed + 1L, 3, 10);
        AnomalyScoreSeries expected = trend.score(TimeSeries.univariate(next));
        AnomalyScoreSeries actual = restoredTrend.score(TimeSeries.univariate(next));
        assertArrayEquals(expected.getScores(), actual.getScores(), 1e-12);
        assertEquals(expected.getFlaggedIndices(), actual.getFlaggedIndices());
        assertFalse(registry.load("trend").getPreprocessor().isPresent());
        assertThrows(IllegalStateException.class, () -> registry.load("trend").getForecastModel());
    }

    @Test
    void testPreprocessorOnly() {
        Preprocessor preprocessor = Preprocessor.builder().windowLength(3).build();
        preprocessor.fitTransform(TimeSeries.univariate(SyntheticSeries.linear(40, 1, 1)));
        registry.save("scaler", ModelRecord.of(preprocessor));
        ModelRecord record = registry.load("scaler");
        assertEquals(ModelKind.PREPROCESSOR, record.getKind());
        assertEquals("MINMAX", record.getModelType());
        assertArrayEquals(new int[] { 3, 1, 1 }, record.getDataShape());
        double[][] rows = { { 5 }, { 20 } };
        assertArrayEquals(preprocessor.transform(rows), record.getPreprocessor().get().transform(rows));
    }

    @Test
    void testMissingAndDelete() {
        assertThat(registry.list(), empty());
        assertThrows(ModelNotFoundException.class, () -> registry.load("absent"));
        assertThrows(ModelNotFoundException.class, () -> registry.delete("absent"));
        assertFalse(registry.exists("absent"));

        registry.save("scaler", ModelRecord.of(Preprocessor.builder().windowLength(3).build()));
        registry.delete("scaler");
        assertFalse(registry.exists("scaler"));
        ModelNotFoundException exception = assertThrows(ModelNotFoundException.class,
                () -> registry.load("scaler"));
        assertEquals("scaler", exception.getModelName());
    }

    @Test
    void testLastWriteWins() throws InterruptedException {
        ModelRecord base = ModelRecord.of(Preprocessor.builder().windowLength(3).build());
        registry.save("shared", base.withDescription("first"));
        registry.save("shared", base.withDescription("second"));
        assertEquals("second", registry.load("shared").getDescription().get());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 20; i++) {
            String description = "writer " + i;
            executor.submit(() -> registry.save("shared", base.withDescription(description)));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(1, TimeUnit.MINUTES));
        ModelRecord survivor = registry.load("shared");
        assertTrue(survivor.getDescription().get().startsWith("writer "));
        assertEquals(ModelKind.PREPROCESSOR, survivor.getKind());
        assertThat(registry.list(), contains("shared"));
    }
}
