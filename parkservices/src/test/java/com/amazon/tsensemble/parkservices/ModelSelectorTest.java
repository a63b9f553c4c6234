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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

public class ModelSelectorTest {

    @Test
    void testForecastRecommendation() {
        assertEquals(ForecastModelType.RECURRENT, ModelSelector.recommendForecastModel(2000, 1, 30));
        assertEquals(ForecastModelType.CONVOLUTIONAL, ModelSelector.recommendForecastModel(2000, 1, 10));
        assertEquals(ForecastModelType.RECURRENT, ModelSelector.recommendForecastModel(800, 3, 10));
        assertEquals(ForecastModelType.CONVOLUTIONAL, ModelSelector.recommendForecastModel(100, 1, 10));
    }

    @Test
    void testTrendAndSeasonality() {
        double[] line = SyntheticSeries.linear(100, 3, 0.5);
        assertTrue(ModelSelector.hasTrend(line));
        double[] seasonal = SyntheticSeries.sineWithSpikes(240, 24, 10, 3, 0.1, 1L, 0);
        assertTrue(ModelSelector.hasSeasonality(seasonal));
        assertFalse(ModelSelector.hasTrend(seasonal));
        double[] flat = SyntheticSeries.constant(50, 4);
        assertFalse(ModelSelector.hasTrend(flat));
        assertFalse(ModelSelector.hasSeasonality(flat));

        assertEquals(AnomalyMethod.TREND_DECOMPOSITION,
                ModelSelector.recommendAnomalyMethod(TimeSeries.univariate(seasonal)));
        assertEquals(AnomalyMethod.STATE_TRANSITION, ModelSelector.recommendAnomalyMethod(false, false));
    }
}
