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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.exception.DependencyUnavailableException;

public class EngineCapabilitiesTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(EngineCapabilities.TREND_DECOMPOSITION);
    }

    @Test
    void testResourceEnablesEverything() {
        EngineCapabilities capabilities = EngineCapabilities.resolve();
        for (ForecastModelType type : ForecastModelType.values()) {
            assertTrue(capabilities.isAvailable(type));
        }
        for (AnomalyMethod method : AnomalyMethod.values()) {
            assertTrue(capabilities.isAvailable(method));
        }
    }

    @Test
    void testSystemPropertyOverridesResource() {
        System.setProperty(EngineCapabilities.TREND_DECOMPOSITION, "false");
        EngineCapabilities capabilities = EngineCapabilities.resolve();
        assertFalse(capabilities.isAvailable(AnomalyMethod.TREND_DECOMPOSITION));
        assertTrue(capabilities.isAvailable(AnomalyMethod.STATE_TRANSITION));
        assertThrows(DependencyUnavailableException.class,
                () -> capabilities.require(AnomalyMethod.TREND_DECOMPOSITION));
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(EngineCapabilities.NEURAL_FORECASTING, " FALSE ");
        EngineCapabilities capabilities = EngineCapabilities.fromProperties(properties);
        assertFalse(capabilities.isNeuralForecastingAvailable());
        assertThrows(DependencyUnavailableException.class,
                () -> capabilities.require(ForecastModelType.CONVOLUTIONAL));
        assertDoesNotThrow(() -> capabilities.require(AnomalyMethod.STATE_TRANSITION));
    }
}
