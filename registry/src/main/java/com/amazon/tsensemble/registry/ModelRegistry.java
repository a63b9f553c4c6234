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

import java.util.List;

import com.amazon.tsensemble.exception.ModelNotFoundException;

/**
 * A name keyed store of {@link ModelRecord}s. Saving under an existing name
 * replaces the record; when saves to the same name race, the last one wins.
 * Implementations are safe for concurrent use.
 */
public interface ModelRegistry {

    /**
     * @param name   the key of the record
     * @param record the model and its metadata
     * @return where the record was stored
     */
    String save(String name, ModelRecord record);

    /**
     * @param name the key of the record
     * @return the record last saved under {@code name}
     * @throws ModelNotFoundException if no such record exists
     */
    ModelRecord load(String name);

    /**
     * @return the names of all records, in ascending order
     */
    List<String> list();

    /**
     * @param name the key of the record
     * @throws ModelNotFoundException if no such record exists
     */
    void delete(String name);

    boolean exists(String name);
}
