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

package com.amazon.tsensemble.forecast.nn;

public enum Activation {

    LINEAR {
        @Override
        public double apply(double x) {
            return x;
        }

        @Override
        public double derivative(double y) {
            return 1;
        }
    },
    RELU {
        @Override
        public double apply(double x) {
            return (x > 0) ? x : 0;
        }

        @Override
        public double derivative(double y) {
            return (y > 0) ? 1 : 0;
        }
    },
    TANH {
        @Override
        public double apply(double x) {
            return Math.tanh(x);
        }

        @Override
        public double derivative(double y) {
            return 1 - y * y;
        }
    },
    SIGMOID {
        @Override
        public double apply(double x) {
            return 1.0 / (1.0 + Math.exp(-x));
        }

        @Override
        public double derivative(double y) {
            return y * (1 - y);
        }
    };

    public abstract double apply(double x);

    /**
     * the derivative expressed through the activated value {@code y}
     */
    public abstract double derivative(double y);
}
