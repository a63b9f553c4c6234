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

import com.amazon.tsensemble.forecast.ConvolutionalForecastModel;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.forecast.RecurrentForecastModel;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.registry.ModelRecord;
import com.amazon.tsensemble.registry.ModelRecordSerializer;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class ModelRecordBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "RECURRENT", "CONVOLUTIONAL" })
        String modelType;

        ModelRecordSerializer serializer = new ModelRecordSerializer();
        ModelRecord record;
        byte[] json;
        byte[] bytes;

        @Setup(Level.Trial)
        public void setUpRecord() {
            // one epoch is enough, the parameter count drives the cost
            IForecastModel model = "RECURRENT".equals(modelType)
                    ? RecurrentForecastModel.builder().windowLength(48).units(64, 32).epochs(1).randomSeed(0L).build()
                    : ConvolutionalForecastModel.builder().windowLength(48).epochs(1).randomSeed(0L).build();
            double[] values = SyntheticSeries.sineWithSpikes(300, 24, 10, 3, 0.2, 0L, 0);
            model.fit(Preprocessor.builder().windowLength(48).build().fitTransform(TimeSeries.univariate(values))
                    .getTrain(), null);
            record = ModelRecord.of(model);
            json = serializer.metadataToJson(record);
            bytes = serializer.stateToBytes(record);
        }
    }

    @Benchmark
    public void write(BenchmarkState state, Blackhole blackhole) {
        blackhole.consume(state.serializer.metadataToJson(state.record));
        blackhole.consume(state.serializer.stateToBytes(state.record));
    }

    @Benchmark
    public IForecastModel readAndRestore(BenchmarkState state) {
        return state.serializer.toRecord(state.json, state.bytes).getForecastModel();
    }
}
