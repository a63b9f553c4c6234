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

package com.amazon.tsensemble.state;

/**
 * A mapper between a model and a plain state object that carries everything
 * needed to rebuild it. State objects hold only primitives, strings, flat
 * arrays and other state objects, so they can be written with any of the
 * serialization libraries.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * @param state the state
     * @param seed  a random seed for models that need one and did not record
     *              their own
     * @return the model
     */
    Model toModel(State state, long seed);

    default Model toModel(State state) {
        return toModel(state, 0L);
    }

    State toState(Model model);
}
