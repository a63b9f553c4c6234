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

package com.amazon.tsensemble.examples.anomalydetection;

import java.util.Map;
import java.util.Random;

import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.examples.Example;
import com.amazon.tsensemble.parkservices.ConsensusAnomalyDetector;
import com.amazon.tsensemble.parkservices.ModelEvaluator;
import com.amazon.tsensemble.parkservices.config.AnomalyRequest;
import com.amazon.tsensemble.parkservices.returntypes.AnomalyMetrics;
import com.amazon.tsensemble.parkservices.returntypes.AnomalyReport;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

/**
 * Injects spikes into a week of hourly readings, runs both detection methods
 * and scores the consensus against the injected positions.
 */
public class AnomalyConsensusExample implements Example {

    public static void main(String[] args) throws Exception {
        new AnomalyConsensusExample().run();
    }

    @Override
    public String command() {
        return "anomaly_consensus";
    }

    @Override
    public String description() {
        return "merge state transition and trend decomposition anomalies";
    }

    @Override
    public void run() throws Exception {
        int length = 24 * 7;
        long seed = new Random().nextLong();
        System.out.println("seed = " + seed);
        Random rng = new Random(seed);

        int[] spikes = new int[4];
        boolean[] labels = new boolean[length];
        for (int i = 0; i < spikes.length; i++) {
            // keep the spikes apart so each one is a separate event
            spikes[i] = 20 + i * 40 + rng.nextInt(20);
            labels[spikes[i]] = true;
        }
        double[] values = SyntheticSeries.sineWithSpikes(length, 24, 50, 10, 0.5, seed, 25, spikes);
        long[] timestamps = SyntheticSeries.hourlyTimestamps(length, 1_600_000_000_000L);

        ConsensusAnomalyDetector detector = ConsensusAnomalyDetector.builder().dailySeasonality(true).build();
        AnomalyReport report = detector.detect(TimeSeries.univariate(values, timestamps),
                AnomalyRequest.builder().sensitivity(0.97).build());

        for (Map.Entry<AnomalyMethod, AnomalyScoreSeries> entry : report.getPerMethod().entrySet()) {
            AnomalyScoreSeries series = entry.getValue();
            System.out.printf("%-20s threshold %.4f flagged %s (confidence %.3f)%n", entry.getKey(),
                    series.getThreshold(), series.getFlaggedIndices(),
                    report.getMethodConfidence().get(entry.getKey()));
        }
        report.getFailures().forEach(
                (method, failure) -> System.out.printf("%-20s failed: %s%n", method, failure.getMessage()));
        System.out.println("consensus " + report.getConsensusIndices());

        boolean[] predicted = new boolean[length];
        for (int index : report.getConsensusIndices()) {
            predicted[index] = true;
        }
        AnomalyMetrics metrics = ModelEvaluator.anomalyMetrics(labels, predicted);
        System.out.printf("precision %.3f recall %.3f F1 %.3f%n", metrics.getPrecision(), metrics.getRecall(),
                metrics.getF1());
    }
}
