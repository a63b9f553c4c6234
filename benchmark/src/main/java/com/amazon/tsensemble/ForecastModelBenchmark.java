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

package com.amazon.tsensemble;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.forecast.AbstractForecastModel;
import com.amazon.tsensemble.forecast.ConvolutionalForecastModel;
import com.amazon.tsensemble.forecast.RecurrentForecastModel;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.returntypes.PreparedData;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.returntypes.TrainingResult;
import com.amazon.tsensemble.testutils.SyntheticSeries;

@Warmup(iterations = 1)
@Measurement(iterations = 3)
@Fork(value = 1)
@State(Scope.Benchmark)
public class ForecastModelBenchmark {
    public static final int DATA_SIZE = 1000;
    public static final int EPOCHS = 5;

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "24" })
        int windowLength;

        @Param({ "RECURRENT", "CONVOLUTIONAL" })
        ForecastModelType modelType;

        PreparedData data;
        AbstractForecastModel fittedModel;

        @Setup(Level.Trial)
        public void setUpData() {
            double[] values = SyntheticSeries.sineWithSpikes(DATA_SIZE, 24, 10, 3, 0.2, 0L, 0);
            data = Preprocessor.builder().windowLength(windowLength).build()
                    .fitTransform(TimeSeries.univariate(values));
            fittedModel = newModel();
            fittedModel.fit(data.getTrain(), data.getValidation());
        }

        AbstractForecastModel newModel() {
            if (modelType == ForecastModelType.RECURRENT) {
                return RecurrentForecastModel.builder().windowLength(windowLength).epochs(EPOCHS).randomSeed(0L)
                        .build();
            }
            return ConvolutionalForecastModel.builder().windowLength(windowLength).epochs(EPOCHS).randomSeed(0L)
                    .build();
        }
    }

    @Benchmark
    public TrainingResult fit(BenchmarkState state) {
        return state.newModel().fit(state.data.getTrain(), state.data.getValidation());
    }

    @Benchmark
    public void predict(BenchmarkState state, Blackhole blackhole) {
        blackhole.consume(state.fittedModel.predict(state.data.getTest().getInputs()));
    }

    @Benchmark
    public double[][] predictFuture(BenchmarkState state) {
        return state.fittedModel.predictFuture(state.data.lastWindow(state.windowLength), 24);
    }
}
