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

package com.amazon.tsensemble.examples.selection;

import com.amazon.tsensemble.examples.Example;
import com.amazon.tsensemble.parkservices.ModelSelector;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

public class ModelSelectionExample implements Example {

    public static void main(String[] args) throws Exception {
        new ModelSelectionExample().run();
    }

    @Override
    public String command() {
        return "model_selection";
    }

    @Override
    public String description() {
        return "recommend a forecast variant and an anomaly method for a few series";
    }

    @Override
    public void run() throws Exception {
        describe("flat", SyntheticSeries.constant(200, 3));
        describe("linear", SyntheticSeries.linear(200, 0, 0.1));
        describe("seasonal", SyntheticSeries.sineWithSpikes(1200, 24, 10, 3, 0.1, 3L, 0));
    }

    void describe(String name, double[] values) {
        System.out.printf("%-9s trend %-5b seasonal %-5b -> forecast with %s, detect with %s%n", name,
                ModelSelector.hasTrend(values), ModelSelector.hasSeasonality(values),
                ModelSelector.recommendForecastModel(values.length, 1, 24),
                ModelSelector.recommendAnomalyMethod(TimeSeries.univariate(values)));
    }
}
