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

package com.amazon.tsensemble.forecast;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkFitted;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.forecast.nn.AdamOptimizer;
import com.amazon.tsensemble.forecast.nn.Parameter;
import com.amazon.tsensemble.forecast.nn.SequentialNetwork;
import com.amazon.tsensemble.returntypes.TrainingResult;
import com.amazon.tsensemble.returntypes.WindowedData;

/**
 * Shared training loop of the neural forecast models: mini batch Adam on the
 * mean squared error, batches taken in chronological order, early stopping on
 * the validation loss (or the training loss when there is no validation data)
 * and restoration of the best weights seen.
 */
@Getter
public abstract class AbstractForecastModel implements IForecastModel {

    private static final Logger logger = LogManager.getLogger(AbstractForecastModel.class);

    public static final double DEFAULT_LEARNING_RATE = 0.001;

    public static final int DEFAULT_EPOCHS = 100;

    public static final int DEFAULT_BATCH_SIZE = 32;

    public static final int DEFAULT_PATIENCE = 10;

    public static final double DEFAULT_DROPOUT = 0.2;

    public static final int DEFAULT_HORIZON = 1;

    protected final int windowLength;

    protected final int inputDimensions;

    protected final int horizon;

    protected final double learningRate;

    protected final int epochs;

    protected final int batchSize;

    protected final int patience;

    protected final double dropout;

    protected final long randomSeed;

    protected SequentialNetwork network;

    protected boolean fitted;

    protected TrainingResult trainingResult;

    protected AbstractForecastModel(Builder<?> builder) {
        checkArgument(builder.windowLength > 0, "window length must be positive");
        checkArgument(builder.inputDimensions > 0, "input dimensions must be positive");
        checkArgument(builder.horizon > 0, "horizon must be positive");
        checkArgument(builder.learningRate > 0, "learning rate must be positive");
        checkArgument(builder.epochs > 0, "epochs must be positive");
        checkArgument(builder.batchSize > 0, "batch size must be positive");
        checkArgument(builder.patience > 0, "patience must be positive");
        checkArgument(builder.dropout >= 0 && builder.dropout < 1, "dropout must be in [0,1)");
        windowLength = builder.windowLength;
        inputDimensions = builder.inputDimensions;
        horizon = builder.horizon;
        learningRate = builder.learningRate;
        epochs = builder.epochs;
        batchSize = builder.batchSize;
        patience = builder.patience;
        dropout = builder.dropout;
        randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());
    }

    /**
     * creates a freshly initialized network; all randomness, initialization as
     * well as dropout, is drawn from {@code random}
     */
    protected abstract SequentialNetwork buildNetwork(Random random);

    protected abstract void addHyperparameters(Map<String, Object> map);

    protected void initializeNetwork() {
        network = buildNetwork(new Random(randomSeed));
    }

    @Override
    public TrainingResult fit(double[][][] inputs, double[][] targets, WindowedData validation) {
        checkArgument(inputs != null && targets != null, "inputs and targets cannot be null");
        if (inputs.length == 0) {
            throw new ValidationException("no training windows");
        }
        if (inputs.length != targets.length) {
            throw new ShapeMismatchException("got " + inputs.length + " windows and " + targets.length + " targets");
        }
        checkWindows(inputs);
        checkTargets(targets);
        boolean validate = validation != null && !validation.isEmpty();
        if (validate) {
            checkWindows(validation.getInputs());
            checkTargets(validation.getTargets());
        }

        Random random = new Random(randomSeed);
        network = buildNetwork(random);
        fitted = false;
        AdamOptimizer optimizer = new AdamOptimizer(learningRate);
        List<Parameter> parameters = network.getParameters();

        List<Double> loss = new ArrayList<>();
        List<Double> mae = new ArrayList<>();
        List<Double> validationLoss = new ArrayList<>();
        List<Double> validationMae = new ArrayList<>();
        double best = Double.MAX_VALUE;
        int bestEpoch = 0;
        double[] bestValues = network.getParameterValues();
        int wait = 0;
        boolean stoppedEarly = false;

        for (int epoch = 0; epoch < epochs; epoch++) {
            double squared = 0;
            double absolute = 0;
            for (int start = 0; start < inputs.length; start += batchSize) {
                int end = Math.min(inputs.length, start + batchSize);
                for (int i = start; i < end; i++) {
                    double[] output = network.forward(inputs[i], true)[0];
                    double[] gradient = new double[horizon];
                    for (int k = 0; k < horizon; k++) {
                        double error = output[k] - targets[i][k];
                        squared += error * error / horizon;
                        absolute += Math.abs(error) / horizon;
                        gradient[k] = 2 * error / horizon;
                    }
                    network.backward(new double[][] { gradient });
                }
                optimizer.step(parameters, end - start);
            }
            loss.add(squared / inputs.length);
            mae.add(absolute / inputs.length);
            double monitored = loss.get(epoch);
            if (validate) {
                double[] errors = errors(validation.getInputs(), validation.getTargets());
                validationLoss.add(errors[0]);
                validationMae.add(errors[1]);
                monitored = errors[0];
            }
            if (monitored < best) {
                best = monitored;
                bestEpoch = epoch;
                bestValues = network.getParameterValues();
                wait = 0;
            } else if (++wait >= patience) {
                stoppedEarly = true;
                logger.debug("early stopping after epoch {}, best epoch {}", epoch, bestEpoch);
                break;
            }
        }
        network.setParameterValues(bestValues);
        fitted = true;
        trainingResult = new TrainingResult(toArray(loss), toArray(validationLoss), toArray(mae),
                toArray(validationMae), stoppedEarly, bestEpoch);
        logger.info("{} model trained for {} epochs, best loss {}", getModelType(), loss.size(), best);
        return trainingResult;
    }

    /**
     * @return {mean squared error, mean absolute error} of the current weights
     */
    protected double[] errors(double[][][] inputs, double[][] targets) {
        double squared = 0;
        double absolute = 0;
        for (int i = 0; i < inputs.length; i++) {
            double[] output = network.forward(inputs[i], false)[0];
            for (int k = 0; k < horizon; k++) {
                double error = output[k] - targets[i][k];
                squared += error * error / horizon;
                absolute += Math.abs(error) / horizon;
            }
        }
        return new double[] { squared / inputs.length, absolute / inputs.length };
    }

    private static double[] toArray(List<Double> list) {
        return list.stream().mapToDouble(Double::doubleValue).toArray();
    }

    protected void checkWindows(double[][][] inputs) {
        for (double[][] window : inputs) {
            if (window.length != windowLength) {
                throw new ShapeMismatchException(
                        "expected windows of length " + windowLength + ", got " + window.length);
            }
            for (double[] row : window) {
                if (row.length != inputDimensions) {
                    throw new ShapeMismatchException(
                            "expected " + inputDimensions + " features per step, got " + row.length);
                }
            }
        }
    }

    protected void checkTargets(double[][] targets) {
        for (double[] target : targets) {
            if (target.length != horizon) {
                throw new ShapeMismatchException("expected targets of length " + horizon + ", got " + target.length);
            }
        }
    }

    @Override
    public double[][] predict(double[][][] inputs) {
        checkFitted(fitted, getModelType().name().toLowerCase() + " model");
        checkArgument(inputs != null, "inputs cannot be null");
        checkWindows(inputs);
        double[][] answer = new double[inputs.length][];
        for (int i = 0; i < inputs.length; i++) {
            answer[i] = network.forward(inputs[i], false)[0].clone();
        }
        return answer;
    }

    @Override
    public double[][] predictFuture(double[][] lastWindow, int steps) {
        checkFitted(fitted, getModelType().name().toLowerCase() + " model");
        checkArgument(inputDimensions == 1, "future prediction is only supported for univariate series");
        checkArgument(steps > 0, "steps must be positive");
        checkWindows(new double[][][] { lastWindow });
        double[] window = new double[windowLength];
        for (int i = 0; i < windowLength; i++) {
            window[i] = lastWindow[i][0];
        }
        double[][] answer = new double[steps][];
        for (int step = 0; step < steps; step++) {
            double[][] input = new double[windowLength][1];
            for (int i = 0; i < windowLength; i++) {
                input[i][0] = window[i];
            }
            answer[step] = network.forward(input, false)[0].clone();
            // the new window is the tail of window followed by the prediction
            double[] extended = new double[windowLength + horizon];
            System.arraycopy(window, 0, extended, 0, windowLength);
            System.arraycopy(answer[step], 0, extended, windowLength, horizon);
            System.arraycopy(extended, horizon, window, 0, windowLength);
        }
        return answer;
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    /**
     * @return the current parameter values in network order
     */
    public double[] getParameterValues() {
        return network.getParameterValues();
    }

    /**
     * reinstates a fitted model from its parameter values
     *
     * @param parameterValues values as produced by {@link #getParameterValues()}
     * @param result          the training history, may be null
     */
    public void restoreFittedState(double[] parameterValues, TrainingResult result) {
        network.setParameterValues(parameterValues);
        trainingResult = result;
        fitted = true;
    }

    @Override
    public Map<String, Object> getHyperparameters() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("windowLength", windowLength);
        map.put("inputDimensions", inputDimensions);
        map.put("horizon", horizon);
        map.put("learningRate", learningRate);
        map.put("epochs", epochs);
        map.put("batchSize", batchSize);
        map.put("patience", patience);
        map.put("dropout", dropout);
        addHyperparameters(map);
        map.put("randomSeed", randomSeed);
        return map;
    }

    @Override
    public String getModelSummary() {
        return getModelType().name().toLowerCase() + " forecast model, input (" + windowLength + ", "
                + inputDimensions + "), horizon " + horizon + (fitted ? ", fitted" : ", not fitted")
                + System.lineSeparator() + network.summary();
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        protected int windowLength;
        protected int inputDimensions = 1;
        protected int horizon = DEFAULT_HORIZON;
        protected double learningRate = DEFAULT_LEARNING_RATE;
        protected int epochs = DEFAULT_EPOCHS;
        protected int batchSize = DEFAULT_BATCH_SIZE;
        protected int patience = DEFAULT_PATIENCE;
        protected double dropout = DEFAULT_DROPOUT;
        protected Optional<Long> randomSeed = Optional.empty();

        public T windowLength(int windowLength) {
            this.windowLength = windowLength;
            return (T) this;
        }

        public T inputDimensions(int inputDimensions) {
            this.inputDimensions = inputDimensions;
            return (T) this;
        }

        public T horizon(int horizon) {
            this.horizon = horizon;
            return (T) this;
        }

        public T learningRate(double learningRate) {
            this.learningRate = learningRate;
            return (T) this;
        }

        public T epochs(int epochs) {
            this.epochs = epochs;
            return (T) this;
        }

        public T batchSize(int batchSize) {
            this.batchSize = batchSize;
            return (T) this;
        }

        public T patience(int patience) {
            this.patience = patience;
            return (T) this;
        }

        public T dropout(double dropout) {
            this.dropout = dropout;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }
    }
}
