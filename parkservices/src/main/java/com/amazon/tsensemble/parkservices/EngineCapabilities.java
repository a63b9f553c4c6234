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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.exception.DependencyUnavailableException;

/**
 * Which model families a deployment offers. Resolved once, from
 * {@code tsensemble.properties} on the classpath overridden by system
 * properties of the same name, and handed to the services that need it.
 */
@Getter
public class EngineCapabilities {

    private static final Logger logger = LogManager.getLogger(EngineCapabilities.class);

    public static final String RESOURCE = "tsensemble.properties";

    public static final String NEURAL_FORECASTING = "tsensemble.forecasting.neural.enabled";

    public static final String STATE_TRANSITION = "tsensemble.anomaly.statetransition.enabled";

    public static final String TREND_DECOMPOSITION = "tsensemble.anomaly.trenddecomposition.enabled";

    private final boolean neuralForecastingAvailable;

    private final boolean stateTransitionAvailable;

    private final boolean trendDecompositionAvailable;

    public EngineCapabilities(boolean neuralForecastingAvailable, boolean stateTransitionAvailable,
            boolean trendDecompositionAvailable) {
        this.neuralForecastingAvailable = neuralForecastingAvailable;
        this.stateTransitionAvailable = stateTransitionAvailable;
        this.trendDecompositionAvailable = trendDecompositionAvailable;
    }

    public static EngineCapabilities all() {
        return new EngineCapabilities(true, true, true);
    }

    /**
     * reads the classpath resource and the system properties
     */
    public static EngineCapabilities resolve() {
        Properties properties = new Properties();
        try (InputStream stream = EngineCapabilities.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (stream != null) {
                properties.load(stream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + RESOURCE, e);
        }
        properties.putAll(System.getProperties());
        return fromProperties(properties);
    }

    public static EngineCapabilities fromProperties(Properties properties) {
        EngineCapabilities capabilities = new EngineCapabilities(flag(properties, NEURAL_FORECASTING),
                flag(properties, STATE_TRANSITION), flag(properties, TREND_DECOMPOSITION));
        logger.info("engine capabilities: neural forecasting {}, state transition {}, trend decomposition {}",
                capabilities.neuralForecastingAvailable, capabilities.stateTransitionAvailable,
                capabilities.trendDecompositionAvailable);
        return capabilities;
    }

    // absent means available
    private static boolean flag(Properties properties, String key) {
        return Boolean.parseBoolean(properties.getProperty(key, "true").trim());
    }

    public boolean isAvailable(ForecastModelType type) {
        return neuralForecastingAvailable;
    }

    public boolean isAvailable(AnomalyMethod method) {
        switch (method) {
        case STATE_TRANSITION:
            return stateTransitionAvailable;
        case TREND_DECOMPOSITION:
            return trendDecompositionAvailable;
        default:
            return false;
        }
    }

    public void require(ForecastModelType type) {
        if (!isAvailable(type)) {
            throw new DependencyUnavailableException(type + " forecasting is not available in this deployment");
        }
    }

    public void require(AnomalyMethod method) {
        if (!isAvailable(method)) {
            throw new DependencyUnavailableException(method + " detection is not available in this deployment");
        }
    }
}
