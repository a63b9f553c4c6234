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
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.forecast.ConvolutionalForecastModel;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.registry.state.ModelMetadata;
import com.amazon.tsensemble.registry.state.ModelRecordState;

public class ModelRecordTest {

    @Test
    void testUnfittedModelSnapshot() {
        Instant before = Instant.now().minusMillis(1);
        IForecastModel model = ConvolutionalForecastModel.builder().windowLength(24).horizon(3).randomSeed(5L)
                .build();
        ModelRecord record = ModelRecord.of(model);
        assertEquals("CONVOLUTIONAL", record.getModelType());
        assertArrayEquals(new int[] { 24, 1, 3 }, record.getDataShape());
        assertFalse(record.getTrainingResult().isPresent());
        assertFalse(record.getPreprocessor().isPresent());
        assertFalse(record.getDescription().isPresent());
        assertEquals("5", record.getHyperparameters().get("randomSeed"));
        assertThat(record.getCreatedAt(), greaterThanOrEqualTo(before));

        IForecastModel first = record.getForecastModel();
        assertNotSame(first, record.getForecastModel());
        assertFalse(first.isFitted());
        assertEquals(3, first.getHorizon());
    }

    @Test
    void testImmutability() {
        ModelRecord record = ModelRecord.of(Preprocessor.builder().windowLength(3).build());
        record.getDataShape()[0] = 99;
        assertEquals(3, record.getDataShape()[0]);
        assertThrows(UnsupportedOperationException.class, () -> record.getHyperparameters().put("a", "b"));
        ModelRecord described = record.withDescription("changed");
        assertFalse(record.getDescription().isPresent());
        assertEquals(record.getCreatedAt(), described.getCreatedAt());
    }

    @Test
    void testUnsupportedModels() {
        IForecastModel forecastModel = mock(IForecastModel.class);
        assertThrows(IllegalArgumentException.class, () -> ModelRecord.of(forecastModel));
        IAnomalyDetector detector = mock(IAnomalyDetector.class);
        when(detector.getMethod()).thenReturn(AnomalyMethod.STATE_TRANSITION);
        assertThrows(IllegalArgumentException.class, () -> ModelRecord.of(detector));
    }

    @Test
    void testMismatchedHalves() {
        ModelMetadata metadata = new ModelMetadata();
        metadata.setKind(ModelKind.PREPROCESSOR.name());
        ModelRecordState state = new ModelRecordState();
        state.setKind(ModelKind.FORECAST_MODEL.name());
        assertThrows(IllegalArgumentException.class, () -> new ModelRecord(metadata, state));
    }

    @Test
    void testSerializerRoundTrip() {
        ModelRecordSerializer serializer = new ModelRecordSerializer();
        ModelRecord record = ModelRecord.of(Preprocessor.builder().windowLength(4).horizon(2).build())
                .withDescription("window of four");
        ModelRecord copy = serializer.toRecord(serializer.metadataToJson(record), serializer.stateToBytes(record));
        assertEquals(record.getKind(), copy.getKind());
        assertEquals(record.getCreatedAt(), copy.getCreatedAt());
        assertEquals(record.getHyperparameters(), copy.getHyperparameters());
        assertArrayEquals(record.getDataShape(), copy.getDataShape());
        assertEquals(2, copy.getPreprocessor().get().getHorizon());
    }
}
