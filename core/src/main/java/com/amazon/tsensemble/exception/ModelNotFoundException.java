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

import lombok.Getter;

/**
 * Raised by a model registry when no record exists under a name.
 */
@Getter
public class ModelNotFoundException extends TimeSeriesEnsembleException {

    private static final long serialVersionUID = 1L;

    private final String modelName;

    public ModelNotFoundException(String modelName) {
        super("Model " + modelName + " not found");
        this.modelName = modelName;
    }

    public ModelNotFoundException(String modelName, Throwable cause) {
        super("Model " + modelName + " not found", cause);
        this.modelName = modelName;
    }
}
