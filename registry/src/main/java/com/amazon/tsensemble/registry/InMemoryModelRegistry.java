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

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.exception.ModelNotFoundException;

/**
 * Keeps records in a map for the lifetime of the registry. Callers that want a
 * process wide set of active models share one instance.
 */
public class InMemoryModelRegistry implements ModelRegistry {

    private static final Logger logger = LogManager.getLogger(InMemoryModelRegistry.class);

    public static final String LOCATION_PREFIX = "memory:";

    private final ConcurrentHashMap<String, ModelRecord> records = new ConcurrentHashMap<>();

    @Override
    public String save(String name, ModelRecord record) {
        checkName(name);
        checkNotNull(record, "record cannot be null");
        if (records.put(name, record) != null) {
            logger.debug("replaced model {}", name);
        }
        return LOCATION_PREFIX + name;
    }

    @Override
    public ModelRecord load(String name) {
        checkName(name);
        ModelRecord record = records.get(name);
        if (record == null) {
            throw new ModelNotFoundException(name);
        }
        return record;
    }

    @Override
    public List<String> list() {
        List<String> names = new ArrayList<>(records.keySet());
        Collections.sort(names);
        return names;
    }

    @Override
    public void delete(String name) {
        checkName(name);
        if (records.remove(name) == null) {
            throw new ModelNotFoundException(name);
        }
    }

    @Override
    public boolean exists(String name) {
        checkName(name);
        return records.containsKey(name);
    }

    private static void checkName(String name) {
        checkArgument(name != null && !name.isEmpty(), "name cannot be empty");
    }
}
