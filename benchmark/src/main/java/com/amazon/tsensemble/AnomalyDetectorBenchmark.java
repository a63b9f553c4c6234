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

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.anomalydetection.StateTransitionDetector;
import com.amazon.tsensemble.anomalydetection.TrendDecompositionDetector;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.parkservices.ConsensusAnomalyDetector;
import com.amazon.tsensemble.parkservices.config.AnomalyRequest;
import com.amazon.tsensemble.parkservices.returntypes.AnomalyReport;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class AnomalyDetectorBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "500", "2000" })
        int dataSize;

        @Param({ "STATE_TRANSITION", "TREND_DECOMPOSITION" })
        AnomalyMethod method;

        TimeSeries series;
        IAnomalyDetector fittedDetector;

        @Setup(Level.Trial)
        public void setUpData() {
            long[] timestamps = SyntheticSeries.hourlyTimestamps(dataSize, 0L);
            series = TimeSeries.univariate(
                    SyntheticSeries.sineWithSpikes(dataSize, 24, 10, 3, 0.2, 0L, 5, dataSize / 2), timestamps);
            fittedDetector = newDetector();
            fittedDetector.fit(series);
        }

        IAnomalyDetector newDetector() {
            if (method == AnomalyMethod.STATE_TRANSITION) {
                return StateTransitionDetector.builder().build();
            }
            return TrendDecompositionDetector.builder().dailySeasonality(true).build();
        }
    }

    @Benchmark
    public AnomalyScoreSeries fitDetect(BenchmarkState state) {
        return state.newDetector().fitDetect(state.series);
    }

    @Benchmark
    public AnomalyScoreSeries score(BenchmarkState state) {
        return state.fittedDetector.score(state.series);
    }

    @Benchmark
    public AnomalyReport consensus(BenchmarkState state) {
        return ConsensusAnomalyDetector.builder().dailySeasonality(true).build().detect(state.series,
                AnomalyRequest.builder().methods(state.method).build());
    }
}
