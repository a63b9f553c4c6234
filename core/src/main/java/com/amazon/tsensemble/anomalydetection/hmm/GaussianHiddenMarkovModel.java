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

package com.amazon.tsensemble.anomalydetection.hmm;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkState;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.tsensemble.util.ArrayUtils;

/**
 * A hidden Markov model with Gaussian emissions and diagonal covariances,
 * fitted by Baum-Welch. The forward and backward passes are scaled per step,
 * which also yields the log likelihood of each observation conditioned on the
 * observations before it.
 */
@Getter
public class GaussianHiddenMarkovModel {

    private static final double LOG_2PI = Math.log(2 * Math.PI);

    private final int states;

    private final int dimensions;

    private final double varianceFloor;

    private double[] startProbabilities;

    private double[][] transitions;

    private double[][] means;

    private double[][] variances;

    private boolean converged;

    private int iterations;

    private double logLikelihood = Double.NaN;

    public GaussianHiddenMarkovModel(int states, int dimensions, double varianceFloor) {
        checkArgument(states > 0, "states must be positive");
        checkArgument(dimensions > 0, "dimensions must be positive");
        checkArgument(varianceFloor > 0, "variance floor must be positive");
        this.states = states;
        this.dimensions = dimensions;
        this.varianceFloor = varianceFloor;
    }

    /**
     * restores a fitted model
     */
    public GaussianHiddenMarkovModel(double[] startProbabilities, double[][] transitions, double[][] means,
            double[][] variances, double varianceFloor, boolean converged, int iterations, double logLikelihood) {
        this(startProbabilities.length, means[0].length, varianceFloor);
        checkArgument(transitions.length == states && means.length == states && variances.length == states,
                "inconsistent number of states");
        this.startProbabilities = Arrays.copyOf(startProbabilities, states);
        this.transitions = ArrayUtils.deepCopy(transitions);
        this.means = ArrayUtils.deepCopy(means);
        this.variances = ArrayUtils.deepCopy(variances);
        this.converged = converged;
        this.iterations = iterations;
        this.logLikelihood = logLikelihood;
    }

    public boolean isFitted() {
        return means != null;
    }

    /**
     * Baum-Welch from a deterministic start: state means at quantiles of the
     * first feature, the global variance for every state, uniform start and
     * transition probabilities.
     *
     * @param observations  {@code [T][dimensions]}, T at least the number of
     *                      states
     * @param maxIterations maximum number of EM iterations
     * @param tolerance     stop once the log likelihood improves by less
     * @return the log likelihood of the fitted model
     */
    public double fit(double[][] observations, int maxIterations, double tolerance) {
        checkArgument(observations.length >= states, "need at least as many observations as states");
        checkArgument(ArrayUtils.checkRectangular(observations) == dimensions, "incorrect dimensions");
        checkArgument(maxIterations > 0, "iterations must be positive");
        initialize(observations);
        int length = observations.length;
        double previous = Double.NEGATIVE_INFINITY;
        converged = false;
        iterations = 0;
        double[][] alpha = new double[length][states];
        double[][] beta = new double[length][states];
        double[][] emission = new double[length][states];
        double[] scale = new double[length];
        double[] shift = new double[length];
        while (iterations < maxIterations) {
            emissions(observations, emission, shift);
            double current = forward(emission, shift, alpha, scale);
            backward(emission, scale, beta);
            maximize(observations, emission, alpha, beta, scale);
            ++iterations;
            logLikelihood = current;
            if (Math.abs(current - previous) < tolerance) {
                converged = true;
                break;
            }
            previous = current;
        }
        // the parameters were updated once more after the last likelihood
        emissions(observations, emission, shift);
        logLikelihood = forward(emission, shift, alpha, scale);
        return logLikelihood;
    }

    void initialize(double[][] observations) {
        int length = observations.length;
        Integer[] order = new Integer[length];
        for (int i = 0; i < length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(observations[a][0], observations[b][0]));
        means = new double[states][dimensions];
        for (int k = 0; k < states; k++) {
            int from = (int) ((long) k * length / states);
            int to = (int) ((long) (k + 1) * length / states);
            for (int i = from; i < to; i++) {
                for (int d = 0; d < dimensions; d++) {
                    means[k][d] += observations[order[i]][d] / (to - from);
                }
            }
        }
        double[] globalVariance = new double[dimensions];
        for (int d = 0; d < dimensions; d++) {
            double deviation = ArrayUtils.populationStandardDeviation(ArrayUtils.column(observations, d));
            globalVariance[d] = Math.max(deviation * deviation, varianceFloor);
        }
        variances = new double[states][];
        transitions = new double[states][states];
        startProbabilities = new double[states];
        for (int k = 0; k < states; k++) {
            variances[k] = Arrays.copyOf(globalVariance, dimensions);
            Arrays.fill(transitions[k], 1.0 / states);
        }
        Arrays.fill(startProbabilities, 1.0 / states);
    }

    double logDensity(double[] x, int state) {
        double answer = 0;
        for (int d = 0; d < dimensions; d++) {
            double difference = x[d] - means[state][d];
            answer -= 0.5 * (LOG_2PI + Math.log(variances[state][d]) + difference * difference / variances[state][d]);
        }
        return answer;
    }

    // emission[t][k] = exp(logDensity - shift[t]) where shift[t] is the max over k
    void emissions(double[][] observations, double[][] emission, double[] shift) {
        for (int t = 0; t < observations.length; t++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < states; k++) {
                emission[t][k] = logDensity(observations[t], k);
                max = Math.max(max, emission[t][k]);
            }
            shift[t] = max;
            for (int k = 0; k < states; k++) {
                emission[t][k] = Math.exp(emission[t][k] - max);
            }
        }
    }

    // returns the log likelihood; scale[t] normalizes alpha[t]
    double forward(double[][] emission, double[] shift, double[][] alpha, double[] scale) {
        double answer = 0;
        for (int t = 0; t < emission.length; t++) {
            double sum = 0;
            for (int k = 0; k < states; k++) {
                double prior;
                if (t == 0) {
                    prior = startProbabilities[k];
                } else {
                    prior = 0;
                    for (int j = 0; j < states; j++) {
                        prior += alpha[t - 1][j] * transitions[j][k];
                    }
                }
                alpha[t][k] = prior * emission[t][k];
                sum += alpha[t][k];
            }
            sum = Math.max(sum, Double.MIN_NORMAL);
            for (int k = 0; k < states; k++) {
                alpha[t][k] /= sum;
            }
            scale[t] = sum;
            answer += Math.log(sum) + shift[t];
        }
        return answer;
    }

    void backward(double[][] emission, double[] scale, double[][] beta) {
        int length = emission.length;
        Arrays.fill(beta[length - 1], 1.0);
        for (int t = length - 2; t >= 0; t--) {
            for (int j = 0; j < states; j++) {
                double sum = 0;
                for (int k = 0; k < states; k++) {
                    sum += transitions[j][k] * emission[t + 1][k] * beta[t + 1][k];
                }
                beta[t][j] = sum / scale[t + 1];
            }
        }
    }

    void maximize(double[][] observations, double[][] emission, double[][] alpha, double[][] beta, double[] scale) {
        int length = observations.length;
        double[][] expectedTransitions = new double[states][states];
        double[] occupancy = new double[states];
        double[][] weightedSum = new double[states][dimensions];
        double[][] gamma = new double[length][states];
        for (int t = 0; t < length; t++) {
            double total = 0;
            for (int k = 0; k < states; k++) {
                gamma[t][k] = alpha[t][k] * beta[t][k];
                total += gamma[t][k];
            }
            for (int k = 0; k < states; k++) {
                gamma[t][k] = (total > 0) ? gamma[t][k] / total : 1.0 / states;
                occupancy[k] += gamma[t][k];
                for (int d = 0; d < dimensions; d++) {
                    weightedSum[k][d] += gamma[t][k] * observations[t][d];
                }
            }
            if (t < length - 1) {
                for (int j = 0; j < states; j++) {
                    for (int k = 0; k < states; k++) {
                        expectedTransitions[j][k] += alpha[t][j] * transitions[j][k] * emission[t + 1][k]
                                * beta[t + 1][k] / scale[t + 1];
                    }
                }
            }
        }
        startProbabilities = Arrays.copyOf(gamma[0], states);
        for (int j = 0; j < states; j++) {
            double total = 0;
            for (int k = 0; k < states; k++) {
                total += expectedTransitions[j][k];
            }
            if (total > 0) {
                for (int k = 0; k < states; k++) {
                    transitions[j][k] = expectedTransitions[j][k] / total;
                }
            }
        }
        for (int k = 0; k < states; k++) {
            if (occupancy[k] <= Double.MIN_NORMAL) {
                continue;
            }
            for (int d = 0; d < dimensions; d++) {
                means[k][d] = weightedSum[k][d] / occupancy[k];
            }
        }
        for (int k = 0; k < states; k++) {
            if (occupancy[k] <= Double.MIN_NORMAL) {
                continue;
            }
            for (int d = 0; d < dimensions; d++) {
                double sum = 0;
                for (int t = 0; t < length; t++) {
                    double difference = observations[t][d] - means[k][d];
                    sum += gamma[t][k] * difference * difference;
                }
                variances[k][d] = Math.max(sum / occupancy[k], varianceFloor);
            }
        }
    }

    /**
     * @param observations {@code [T][dimensions]}
     * @return {@code log p(x_t | x_0 .. x_{t-1})} for every t
     */
    public double[] conditionalLogLikelihood(double[][] observations) {
        checkState(isFitted(), "model is not fitted");
        checkArgument(ArrayUtils.checkRectangular(observations) == dimensions, "incorrect dimensions");
        int length = observations.length;
        double[][] emission = new double[length][states];
        double[] shift = new double[length];
        double[][] alpha = new double[length][states];
        double[] scale = new double[length];
        emissions(observations, emission, shift);
        forward(emission, shift, alpha, scale);
        double[] answer = new double[length];
        for (int t = 0; t < length; t++) {
            answer[t] = Math.log(scale[t]) + shift[t];
        }
        return answer;
    }

    /**
     * @param observations {@code [T][dimensions]}
     * @return the most likely hidden state sequence
     */
    public int[] viterbi(double[][] observations) {
        checkState(isFitted(), "model is not fitted");
        int length = observations.length;
        double[][] delta = new double[length][states];
        int[][] pointer = new int[length][states];
        for (int k = 0; k < states; k++) {
            delta[0][k] = Math.log(startProbabilities[k]) + logDensity(observations[0], k);
        }
        for (int t = 1; t < length; t++) {
            for (int k = 0; k < states; k++) {
                double best = Double.NEGATIVE_INFINITY;
                int argmax = 0;
                for (int j = 0; j < states; j++) {
                    double value = delta[t - 1][j] + Math.log(transitions[j][k]);
                    if (value > best) {
                        best = value;
                        argmax = j;
                    }
                }
                delta[t][k] = best + logDensity(observations[t], k);
                pointer[t][k] = argmax;
            }
        }
        int[] path = new int[length];
        for (int k = 1; k < states; k++) {
            if (delta[length - 1][k] > delta[length - 1][path[length - 1]]) {
                path[length - 1] = k;
            }
        }
        for (int t = length - 1; t > 0; t--) {
            path[t - 1] = pointer[t][path[t]];
        }
        return path;
    }
}
