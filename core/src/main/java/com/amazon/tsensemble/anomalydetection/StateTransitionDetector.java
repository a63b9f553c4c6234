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

package com.amazon.tsensemble.anomalydetection;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkFitted;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.CommonUtils;
import com.amazon.tsensemble.anomalydetection.hmm.GaussianHiddenMarkovModel;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.util.ArrayUtils;

/**
 * Scores each point by how unlikely its first difference is under a Gaussian
 * hidden Markov model, given the differences before it. The score of index
 * {@code t > 0} is {@code -log p(x_t - x_{t-1} | earlier differences)}; index 0
 * has no difference, scores 0 and is never flagged. A point is flagged when its
 * score exceeds the {@code threshold} percentile of the fitting scores.
 */
@Getter
public class StateTransitionDetector implements IAnomalyDetector {

    private static final Logger logger = LogManager.getLogger(StateTransitionDetector.class);

    public static final int DEFAULT_STATES = 10;

    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    public static final double DEFAULT_TOLERANCE = 0.01;

    public static final double DEFAULT_VARIANCE_FLOOR = 1e-3;

    public static final double DEFAULT_THRESHOLD = 0.95;

    public static final int MINIMUM_OBSERVATIONS = 50;

    // two differences are needed for a percentile to mean anything
    public static final int REQUIRED_OBSERVATIONS = 3;

    private final int states;

    private final int maxIterations;

    private final double tolerance;

    private final double varianceFloor;

    /**
     * fraction in (0,1]; the percentile of the fitting scores used as threshold
     */
    private final double threshold;

    private final boolean includeAbsoluteDifference;

    private final boolean strictMinimumSamples;

    private GaussianHiddenMarkovModel model;

    private int inputDimensions;

    private double thresholdValue = Double.NaN;

    private AnomalyScoreSeries fittedScores;

    private double[][] fittedObservations;

    public StateTransitionDetector(Builder<?> builder) {
        checkArgument(builder.states > 0, "states must be positive");
        checkArgument(builder.maxIterations > 0, "iterations must be positive");
        checkArgument(builder.tolerance > 0, "tolerance must be positive");
        checkArgument(builder.varianceFloor > 0, "variance floor must be positive");
        if (!(builder.threshold > 0 && builder.threshold <= 1)) {
            throw new ValidationException("threshold percentile fraction must be in (0,1], got " + builder.threshold);
        }
        states = builder.states;
        maxIterations = builder.maxIterations;
        tolerance = builder.tolerance;
        varianceFloor = builder.varianceFloor;
        threshold = builder.threshold;
        includeAbsoluteDifference = builder.includeAbsoluteDifference;
        strictMinimumSamples = builder.strictMinimumSamples;
    }

    /**
     * restores a fitted detector
     */
    public StateTransitionDetector(Builder<?> builder, GaussianHiddenMarkovModel model, int inputDimensions,
            double thresholdValue, double[][] fittedObservations) {
        this(builder);
        this.model = model;
        this.inputDimensions = inputDimensions;
        this.thresholdValue = thresholdValue;
        this.fittedObservations = fittedObservations;
        double[] scores = scores(fittedObservations);
        this.fittedScores = new AnomalyScoreSeries(getMethod(), scores, flags(scores), thresholdValue);
    }

    @Override
    public void fit(TimeSeries series) {
        checkArgument(series != null, "series cannot be null");
        if (series.size() < REQUIRED_OBSERVATIONS) {
            throw new ValidationException("state transition detection needs at least " + REQUIRED_OBSERVATIONS
                    + " observations, got " + series.size());
        }
        Preprocessor.checkMinimumObservations(series.size(), MINIMUM_OBSERVATIONS, strictMinimumSamples,
                "state transition models");
        inputDimensions = series.getDimensions();
        double[][] observations = observations(series.getValues());
        int effectiveStates = Math.min(states, observations.length);
        if (effectiveStates < states) {
            logger.warn("only {} differences available, using {} hidden states instead of {}", observations.length,
                    effectiveStates, states);
        }
        GaussianHiddenMarkovModel candidate = new GaussianHiddenMarkovModel(effectiveStates,
                observations[0].length, varianceFloor);
        candidate.fit(observations, maxIterations, tolerance);
        if (!candidate.isConverged()) {
            logger.warn("hidden Markov model did not converge in {} iterations", maxIterations);
        }
        model = candidate;
        fittedObservations = observations;
        double[] scores = scores(observations);
        double[] differenceScores = new double[scores.length - 1];
        System.arraycopy(scores, 1, differenceScores, 0, differenceScores.length);
        thresholdValue = CommonUtils.percentile(differenceScores, threshold);
        fittedScores = new AnomalyScoreSeries(getMethod(), scores, flags(scores), thresholdValue);
        logger.debug("state transition threshold {} flags {} of {} points", thresholdValue,
                fittedScores.getFlaggedCount(), scores.length);
    }

    /**
     * first differences, optionally followed by their absolute values for a
     * single feature series
     */
    double[][] observations(double[][] values) {
        int width = values[0].length;
        boolean augment = includeAbsoluteDifference && width == 1;
        double[][] answer = new double[values.length - 1][augment ? 2 : width];
        for (int t = 1; t < values.length; t++) {
            for (int d = 0; d < width; d++) {
                answer[t - 1][d] = values[t][d] - values[t - 1][d];
            }
            if (augment) {
                answer[t - 1][1] = Math.abs(answer[t - 1][0]);
            }
        }
        return answer;
    }

    // one score per original index, the first is 0
    double[] scores(double[][] observations) {
        double[] likelihood = model.conditionalLogLikelihood(observations);
        double[] answer = new double[likelihood.length + 1];
        for (int t = 0; t < likelihood.length; t++) {
            answer[t + 1] = -likelihood[t];
        }
        return answer;
    }

    boolean[] flags(double[] scores) {
        boolean[] answer = new boolean[scores.length];
        for (int t = 1; t < scores.length; t++) {
            answer[t] = scores[t] > thresholdValue;
        }
        return answer;
    }

    @Override
    public AnomalyScoreSeries detect() {
        checkFitted(isFitted(), "state transition detector");
        return fittedScores;
    }

    @Override
    public AnomalyScoreSeries score(TimeSeries series) {
        checkFitted(isFitted(), "state transition detector");
        checkArgument(series != null, "series cannot be null");
        if (series.getDimensions() != inputDimensions) {
            throw new ShapeMismatchException(
                    "expected " + inputDimensions + " features, got " + series.getDimensions());
        }
        if (series.size() < 2) {
            return new AnomalyScoreSeries(getMethod(), new double[series.size()], new boolean[series.size()],
                    thresholdValue);
        }
        double[] scores = scores(observations(series.getValues()));
        return new AnomalyScoreSeries(getMethod(), scores, flags(scores), thresholdValue);
    }

    /**
     * @return the most likely hidden state of each first difference of the
     *         fitting data
     */
    public int[] getHiddenStates() {
        checkFitted(isFitted(), "state transition detector");
        return model.viterbi(fittedObservations);
    }

    public double[][] getTransitionMatrix() {
        checkFitted(isFitted(), "state transition detector");
        return ArrayUtils.deepCopy(model.getTransitions());
    }

    public double[][] getStateMeans() {
        checkFitted(isFitted(), "state transition detector");
        return ArrayUtils.deepCopy(model.getMeans());
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.STATE_TRANSITION;
    }

    @Override
    public boolean isFitted() {
        return model != null;
    }

    @Override
    public Map<String, Object> getDiagnostics() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("method", getMethod().name());
        map.put("states", isFitted() ? model.getStates() : states);
        map.put("threshold", threshold);
        map.put("includeAbsoluteDifference", includeAbsoluteDifference);
        if (isFitted()) {
            map.put("thresholdValue", thresholdValue);
            map.put("converged", model.isConverged());
            map.put("iterations", model.getIterations());
            map.put("logLikelihood", model.getLogLikelihood());
            map.put("flagged", fittedScores.getFlaggedCount());
        }
        return map;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected int states = DEFAULT_STATES;
        protected int maxIterations = DEFAULT_MAX_ITERATIONS;
        protected double tolerance = DEFAULT_TOLERANCE;
        protected double varianceFloor = DEFAULT_VARIANCE_FLOOR;
        protected double threshold = DEFAULT_THRESHOLD;
        protected boolean includeAbsoluteDifference = false;
        protected boolean strictMinimumSamples = false;

        public StateTransitionDetector build() {
            return new StateTransitionDetector(this);
        }

        public T states(int states) {
            this.states = states;
            return (T) this;
        }

        public T maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return (T) this;
        }

        public T tolerance(double tolerance) {
            this.tolerance = tolerance;
            return (T) this;
        }

        public T varianceFloor(double varianceFloor) {
            this.varianceFloor = varianceFloor;
            return (T) this;
        }

        public T threshold(double threshold) {
            this.threshold = threshold;
            return (T) this;
        }

        public T includeAbsoluteDifference(boolean includeAbsoluteDifference) {
            this.includeAbsoluteDifference = includeAbsoluteDifference;
            return (T) this;
        }

        public T strictMinimumSamples(boolean strictMinimumSamples) {
            this.strictMinimumSamples = strictMinimumSamples;
            return (T) this;
        }
    }
}
