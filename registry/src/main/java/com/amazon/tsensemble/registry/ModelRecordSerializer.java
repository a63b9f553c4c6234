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

import java.io.IOException;
import java.io.UncheckedIOException;

import com.amazon.tsensemble.registry.state.ModelMetadata;
import com.amazon.tsensemble.registry.state.ModelRecordState;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Writes the metadata of a record as JSON with
 * <a href="https://github.com/FasterXML/jackson">Jackson</a> and its fitted
 * state as a binary blob with
 * <a href="https://github.com/protostuff/protostuff">protostuff</a>.
 */
public class ModelRecordSerializer {

    private final ObjectMapper jsonMapper = new ObjectMapper();

    private final Schema<ModelRecordState> schema = RuntimeSchema.getSchema(ModelRecordState.class);

    public byte[] metadataToJson(ModelRecord record) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record.getMetadata());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write model metadata", e);
        }
    }

    public ModelMetadata metadataFromJson(byte[] json) {
        try {
            return jsonMapper.readValue(json, ModelMetadata.class);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read model metadata", e);
        }
    }

    public byte[] stateToBytes(ModelRecord record) {
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        try {
            return ProtostuffIOUtil.toByteArray(record.getState(), schema, buffer);
        } finally {
            buffer.clear();
        }
    }

    public ModelRecordState stateFromBytes(byte[] bytes) {
        ModelRecordState state = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state, schema);
        return state;
    }

    public ModelRecord toRecord(byte[] json, byte[] bytes) {
        return new ModelRecord(metadataFromJson(json), stateFromBytes(bytes));
    }
}
