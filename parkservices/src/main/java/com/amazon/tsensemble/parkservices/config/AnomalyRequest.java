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

package com.amazon.tsensemble.parkservices.config;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.exception.ValidationException;

/**
 * Which detectors to run and how sensitive they should be. The two detector
 * families read thresholds differently, so a single sensitivity is mapped to
 * each explicitly: the state transition detector flags scores above the
 * {@code sensitivity} percentile, the trend decomposition detector flags
 * relative deviations above {@code 1 - sensitivity} times the value range. A
 * per method override is passed to the detector unchanged.
 */
@Getter
public class AnomalyRequest {

    public static final double DEFAULT_SENSITIVITY = 0.95;

    private final List<AnomalyMethod> methods;

    private final double sensitivity;

    private final Map<AnomalyMethod, Double> thresholdOverrides;

    public AnomalyRequest(Builder<?> builder) {
        checkArgument(builder.methods != null && !builder.methods.isEmpty(), "at least one method is required");
        checkArgument(builder.methods.stream().distinct().count() == builder.methods.size(),
                "methods must be distinct");
        if (!(builder.sensitivity > 0 && builder.sensitivity < 1)) {
            throw new ValidationException("sensitivity must be in (0,1), got " + builder.sensitivity);
        }
        methods = Collections.unmodifiableList(new ArrayList<>(builder.methods));
        sensitivity = builder.sensitivity;
        Map<AnomalyMethod, Double> overrides = new EnumMap<>(AnomalyMethod.class);
        overrides.putAll(builder.thresholdOverrides);
        thresholdOverrides = Collections.unmodifiableMap(overrides);
    }

    /**
     * @param method a detector family
     * @return the threshold handed to that detector
     */
    public double thresholdFor(AnomalyMethod method) {
        Double override = thresholdOverrides.get(method);
        if (override != null) {
            return override;
        }
        switch (method) {
        case STATE_TRANSITION:
            return sensitivity;
        case TREND_DECOMPOSITION:
            return 1 - sensitivity;
        default:
            throw new IllegalStateException("unknown method " + method);
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected List<AnomalyMethod> methods = Arrays.asList(AnomalyMethod.values());
        protected double sensitivity = DEFAULT_SENSITIVITY;
        protected Map<AnomalyMethod, Double> thresholdOverrides = new EnumMap<>(AnomalyMethod.class);

        public AnomalyRequest build() {
            return new AnomalyRequest(this);
        }

        public T methods(AnomalyMethod... methods) {
            this.methods = Arrays.asList(methods);
            return (T) this;
        }

        public T sensitivity(double sensitivity) {
            this.sensitivity = sensitivity;
            return (T) this;
        }

        public T thresholdOverride(AnomalyMethod method, double threshold) {
            this.thresholdOverrides.put(method, threshold);
            return (T) this;
        }
    }
}
