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

package com.amazon.tsensemble.preprocessor;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkFitted;

import lombok.Getter;
import lombok.Setter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.config.ScalingMethod;
import com.amazon.tsensemble.config.StationarityTransform;
import com.amazon.tsensemble.exception.ShapeMismatchException;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.returntypes.PreparedData;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.returntypes.WindowedData;
import com.amazon.tsensemble.util.ArrayUtils;

/**
 * Turns a raw series into scaled, windowed and chronologically split training
 * data. The scaler is fitted on the rows covered by the training windows and
 * then reused, unchanged, for everything else.
 */
@Getter
public class Preprocessor {

    private static final Logger logger = LogManager.getLogger(Preprocessor.class);

    public static final double DEFAULT_TRAIN_RATIO = 0.8;

    public static final double DEFAULT_VALIDATION_RATIO = 0.1;

    public static final ScalingMethod DEFAULT_SCALING_METHOD = ScalingMethod.MINMAX;

    // observations recommended for the sequence models
    public static final int DEFAULT_MINIMUM_OBSERVATIONS = 30;

    public static final int MAX_STATIONARITY_WINDOW = 50;

    public static final double STATIONARITY_TOLERANCE = 0.1;

    private final int windowLength;

    private final int horizon;

    private final double trainRatio;

    private final double validationRatio;

    private final ScalingMethod scalingMethod;

    private final int targetFeature;

    private final StationarityTransform stationarityTransform;

    private final int minimumObservations;

    private final boolean strictMinimumSamples;

    @Setter
    private IScalingTransform scalingTransform;

    @Setter
    private StationarityTransformer stationarityTransformer;

    public Preprocessor(Builder<?> builder) {
        checkArgument(builder.windowLength > 0, "window length must be positive");
        checkArgument(builder.horizon > 0, "horizon must be positive");
        checkArgument(builder.trainRatio > 0 && builder.trainRatio <= 1, "train ratio must be in (0,1]");
        checkArgument(builder.validationRatio >= 0 && builder.trainRatio + builder.validationRatio <= 1,
                "incorrect validation ratio");
        checkArgument(builder.scalingMethod != null, "scaling method required");
        checkArgument(builder.stationarityTransform != null, "stationarity transform required");
        checkArgument(builder.targetFeature >= 0, "target feature cannot be negative");
        windowLength = builder.windowLength;
        horizon = builder.horizon;
        trainRatio = builder.trainRatio;
        validationRatio = builder.validationRatio;
        scalingMethod = builder.scalingMethod;
        targetFeature = builder.targetFeature;
        stationarityTransform = builder.stationarityTransform;
        minimumObservations = builder.minimumObservations;
        strictMinimumSamples = builder.strictMinimumSamples;
    }

    /**
     * fits the scaling on the training partition and produces the train,
     * validation and test windows
     *
     * @param series the raw series
     * @return the prepared data
     */
    public PreparedData fitTransform(TimeSeries series) {
        checkArgument(series != null, "series cannot be null");
        if (targetFeature >= series.getDimensions()) {
            throw new ShapeMismatchException("target feature " + targetFeature + " does not exist in a series of "
                    + series.getDimensions() + " features");
        }
        checkMinimumObservations(series.size(), minimumObservations, strictMinimumSamples, "sequence models");

        StationarityTransformer transformer = new StationarityTransformer(stationarityTransform);
        int length = transformer.transformedLength(series.size());
        if (length < windowLength + horizon) {
            throw new ShapeMismatchException("series of length " + length + " is shorter than window length "
                    + windowLength + " plus horizon " + horizon);
        }
        int windows = length - windowLength - horizon + 1;
        int[] counts = split(windows, trainRatio, validationRatio);
        if (counts[0] == 0) {
            throw new ValidationException("no training windows in " + windows + " windows with train ratio "
                    + trainRatio);
        }
        int trainingRows = counts[0] + windowLength + horizon - 1;
        // a trend is estimated on the training rows only
        double[][] values = transformer.apply(series.getValues(), trainingRows);
        double[][] trainingValues = new double[trainingRows][];
        System.arraycopy(values, 0, trainingValues, 0, trainingRows);
        IScalingTransform fitted = fitScaling(scalingMethod, trainingValues);
        double[][] scaled = fitted.transform(values);

        WindowedData all = createWindows(scaled, windowLength, horizon, targetFeature);
        WindowedData train = all.slice(0, counts[0]);
        WindowedData validation = all.slice(counts[0], counts[0] + counts[1]);
        WindowedData test = all.slice(counts[0] + counts[1], windows);

        boolean stationary = isStationary(ArrayUtils.column(values, targetFeature));
        if (!stationary) {
            logger.info("series does not look stationary, consider a stationarity transform");
        }
        logger.debug("prepared {} windows: train {}, validation {}, test {}", windows, counts[0], counts[1],
                counts[2]);
        this.scalingTransform = fitted;
        this.stationarityTransformer = transformer;
        return new PreparedData(train, validation, test, fitted, stationarityTransform, scaled, trainingRows,
                stationary);
    }

    public boolean isFitted() {
        return scalingTransform != null;
    }

    /**
     * scales rows that are already in the stationarity transformed units
     */
    public double[][] transform(double[][] values) {
        checkFitted(isFitted(), "preprocessor");
        return scalingTransform.transform(values);
    }

    public double[][] inverseTransform(double[][] values) {
        checkFitted(isFitted(), "preprocessor");
        return scalingTransform.inverseTransform(values);
    }

    /**
     * maps scaled target values to the stationarity transformed units
     */
    public double[] inverseTarget(double[] values) {
        checkFitted(isFitted(), "preprocessor");
        return scalingTransform.inverseTransform(values, targetFeature);
    }

    /**
     * maps a scaled forecast that continues the series to the raw units
     *
     * @param values consecutive scaled target values after the last observation
     * @return the forecast in raw units
     */
    public double[] inverseForecast(double[] values) {
        return stationarityTransformer.invertForecast(inverseTarget(values), targetFeature);
    }

    public static IScalingTransform fitScaling(ScalingMethod method, double[][] values) {
        switch (method) {
        case MINMAX:
            return MinMaxScalingTransform.fit(values);
        case STANDARD:
            return StandardScalingTransform.fit(values);
        default:
            throw new IllegalStateException("unknown scaling " + method);
        }
    }

    /**
     * stride 1 windows; there are exactly {@code N - windowLength - horizon + 1}
     * of them
     *
     * @param values        rows of the series
     * @param windowLength  number of input rows
     * @param horizon       number of target values
     * @param targetFeature feature read for the targets
     * @return the windows
     */
    public static WindowedData createWindows(double[][] values, int windowLength, int horizon, int targetFeature) {
        checkArgument(windowLength > 0 && horizon > 0, "window length and horizon must be positive");
        int dimensions = ArrayUtils.checkRectangular(values);
        if (values.length < windowLength + horizon) {
            throw new ShapeMismatchException("series of length " + values.length
                    + " is shorter than window length " + windowLength + " plus horizon " + horizon);
        }
        int count = values.length - windowLength - horizon + 1;
        double[][][] inputs = new double[count][windowLength][];
        double[][] targets = new double[count][horizon];
        for (int i = 0; i < count; i++) {
            for (int j = 0; j < windowLength; j++) {
                inputs[i][j] = values[i + j].clone();
            }
            for (int k = 0; k < horizon; k++) {
                targets[i][k] = values[i + windowLength + k][targetFeature];
            }
        }
        return new WindowedData(inputs, targets, windowLength, horizon, dimensions);
    }

    /**
     * chronological split sizes, the test partition receives the remainder
     *
     * @param count           number of windows
     * @param trainRatio      fraction for training
     * @param validationRatio fraction for validation
     * @return {train, validation, test}
     */
    public static int[] split(int count, double trainRatio, double validationRatio) {
        checkArgument(count >= 0, "count cannot be negative");
        checkArgument(trainRatio >= 0 && validationRatio >= 0 && trainRatio + validationRatio <= 1,
                "incorrect ratios");
        int train = (int) Math.floor(count * trainRatio);
        if (train == 0 && count > 0 && trainRatio > 0) {
            train = 1;
        }
        int validation = Math.min((int) Math.floor(count * validationRatio), count - train);
        return new int[] { train, validation, count - train - validation };
    }

    /**
     * a rough check that the rolling mean and rolling standard deviation do not
     * drift; the answer is advisory
     *
     * @param values the series
     * @return true if the series looks stationary, or is too short to tell
     */
    public static boolean isStationary(double[] values) {
        int window = Math.min(MAX_STATIONARITY_WINDOW, values.length / 4);
        if (window < 2 || values.length < 2 * window) {
            return true;
        }
        int count = values.length - window + 1;
        double[] rollingMean = new double[count];
        double[] rollingDeviation = new double[count];
        double[] buffer = new double[window];
        for (int i = 0; i < count; i++) {
            System.arraycopy(values, i, buffer, 0, window);
            rollingMean[i] = ArrayUtils.mean(buffer);
            rollingDeviation[i] = ArrayUtils.sampleStandardDeviation(buffer);
        }
        return ArrayUtils.sampleStandardDeviation(rollingMean) < STATIONARITY_TOLERANCE
                && ArrayUtils.sampleStandardDeviation(rollingDeviation) < STATIONARITY_TOLERANCE;
    }

    /**
     * warns, or fails in strict mode, when fewer observations than recommended
     * are available
     *
     * @param observations the number of observations
     * @param minimum      the recommended minimum
     * @param strict       whether to fail
     * @param family       the model family, used in messages
     */
    public static void checkMinimumObservations(int observations, int minimum, boolean strict, String family) {
        if (observations < minimum) {
            String message = family + " need at least " + minimum + " observations, got " + observations;
            if (strict) {
                throw new ValidationException(message);
            }
            logger.warn(message);
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected int windowLength;
        protected int horizon = 1;
        protected double trainRatio = DEFAULT_TRAIN_RATIO;
        protected double validationRatio = DEFAULT_VALIDATION_RATIO;
        protected ScalingMethod scalingMethod = DEFAULT_SCALING_METHOD;
        protected int targetFeature = 0;
        protected StationarityTransform stationarityTransform = StationarityTransform.NONE;
        protected int minimumObservations = DEFAULT_MINIMUM_OBSERVATIONS;
        protected boolean strictMinimumSamples = false;

        public Preprocessor build() {
            return new Preprocessor(this);
        }

        public T windowLength(int windowLength) {
            this.windowLength = windowLength;
            return (T) this;
        }

        public T horizon(int horizon) {
            this.horizon = horizon;
            return (T) this;
        }

        public T trainRatio(double trainRatio) {
            this.trainRatio = trainRatio;
            return (T) this;
        }

        public T validationRatio(double validationRatio) {
            this.validationRatio = validationRatio;
            return (T) this;
        }

        public T scalingMethod(ScalingMethod scalingMethod) {
            this.scalingMethod = scalingMethod;
            return (T) this;
        }

        public T targetFeature(int targetFeature) {
            this.targetFeature = targetFeature;
            return (T) this;
        }

        public T stationarityTransform(StationarityTransform stationarityTransform) {
            this.stationarityTransform = stationarityTransform;
            return (T) this;
        }

        public T minimumObservations(int minimumObservations) {
            this.minimumObservations = minimumObservations;
            return (T) this;
        }

        public T strictMinimumSamples(boolean strictMinimumSamples) {
            this.strictMinimumSamples = strictMinimumSamples;
            return (T) this;
        }
    }
}
