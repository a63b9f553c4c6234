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

package com.amazon.tsensemble.testutils;

import static java.lang.Math.PI;

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic series: seasonal signals with noise, optional slope and level, and
 * spikes injected at random (recorded) positions.
 */
public class SyntheticSeries {

    public static final long HOUR_MILLIS = 3_600_000L;

    public static MultiDimDataWithKey getMultiDimData(int num, int period, double amplitude, double noise, long seed,
            int baseDimension) {
        return getMultiDimData(num, period, amplitude, noise, seed, baseDimension, 0.0, 5.0, false);
    }

    /**
     * @param num           number of observations
     * @param period        period of the cosine signal
     * @param amplitude     amplitude of the signal
     * @param noise         uniform noise in [-noise, noise]
     * @param seed          random seed
     * @param baseDimension number of features
     * @param spikeRate     probability of a spike at each observation
     * @param anomalyFactor spikes are between factor and 2 factor times noise
     * @param useSlope      adds a level shift and a slope to each feature
     * @return the data and the injected spikes
     */
    public static MultiDimDataWithKey getMultiDimData(int num, int period, double amplitude, double noise, long seed,
            int baseDimension, double spikeRate, double anomalyFactor, boolean useSlope) {
        double[][] data = new double[num][];
        double[][] changes = new double[num][];
        int[] changedIndices = new int[num];
        int counter = 0;
        Random prg = new Random(seed);
        Random noiseprg = new Random(prg.nextLong());
        double[] phase = new double[baseDimension];
        double[] amp = new double[baseDimension];
        double[] slope = new double[baseDimension];
        double[] shift = new double[baseDimension];

        for (int i = 0; i < baseDimension; i++) {
            phase[i] = prg.nextInt(period);
            if (useSlope) {
                shift[i] = (4 * prg.nextDouble() - 1) * amplitude;
                slope[i] = (0.25 - prg.nextDouble() * 0.5) * amplitude / period;
            }
            amp[i] = (1 + 0.2 * prg.nextDouble()) * amplitude;
        }

        for (int i = 0; i < num; i++) {
            data[i] = new double[baseDimension];
            boolean flag = (noiseprg.nextDouble() < spikeRate);
            double[] newChange = new double[baseDimension];
            for (int j = 0; j < baseDimension; j++) {
                data[i][j] = amp[j] * Math.cos(2 * PI * (i + phase[j]) / period) + slope[j] * i + shift[j];
                if (flag) {
                    double factor = anomalyFactor * (1 + noiseprg.nextDouble());
                    double change = noiseprg.nextDouble() < 0.5 ? factor * noise : -factor * noise;
                    data[i][j] += newChange[j] = change;
                } else {
                    data[i][j] += noise * (2 * noiseprg.nextDouble() - 1);
                }
            }
            if (flag) {
                changedIndices[counter] = i;
                changes[counter++] = newChange;
            }
        }
        return new MultiDimDataWithKey(data, Arrays.copyOf(changedIndices, counter), Arrays.copyOf(changes, counter));
    }

    /**
     * a positive univariate seasonal series with spikes of {@code spikeSize} added
     * at the given indices
     */
    public static double[] sineWithSpikes(int num, int period, double level, double amplitude, double noise,
            long seed, double spikeSize, int... spikeIndices) {
        Random random = new Random(seed);
        double[] answer = new double[num];
        for (int i = 0; i < num; i++) {
            answer[i] = level + amplitude * Math.sin(2 * PI * i / period) + noise * (2 * random.nextDouble() - 1);
        }
        for (int index : spikeIndices) {
            answer[index] += spikeSize;
        }
        return answer;
    }

    public static double[] linear(int num, double start, double step) {
        double[] answer = new double[num];
        for (int i = 0; i < num; i++) {
            answer[i] = start + step * i;
        }
        return answer;
    }

    public static double[] constant(int num, double value) {
        double[] answer = new double[num];
        Arrays.fill(answer, value);
        return answer;
    }

    public static long[] hourlyTimestamps(int num, long start) {
        long[] answer = new long[num];
        for (int i = 0; i < num; i++) {
            answer[i] = start + i * HOUR_MILLIS;
        }
        return answer;
    }
}
