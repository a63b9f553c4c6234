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

package com.amazon.tsensemble.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * No member of an ensemble (or consensus) produced a result. The failure of
 * every member is kept, keyed by member identifier, in the order the members
 * were requested.
 */
@Getter
public class AggregationFailureException extends TimeSeriesEnsembleException {

    private static final long serialVersionUID = 1L;

    private final Map<String, Throwable> memberFailures;

    public AggregationFailureException(String message, Map<String, Throwable> memberFailures) {
        super(message + " " + memberFailures.keySet());
        this.memberFailures = Collections.unmodifiableMap(new LinkedHashMap<>(memberFailures));
        memberFailures.values().forEach(this::addSuppressed);
    }
}
