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

package com.amazon.tsensemble.parkservices;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.config.ForecastModelType;
import com.amazon.tsensemble.config.ScalingMethod;
import com.amazon.tsensemble.config.StationarityTransform;
import com.amazon.tsensemble.forecast.AbstractForecastModel;
import com.amazon.tsensemble.forecast.ConvolutionalForecastModel;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.forecast.RecurrentForecastModel;
import com.amazon.tsensemble.parkservices.config.ForecastRequest;
import com.amazon.tsensemble.parkservices.ensemble.EnsembleCombiner;
import com.amazon.tsensemble.parkservices.ensemble.ModelOutcome;
import com.amazon.tsensemble.parkservices.returntypes.ForecastResult;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.returntypes.PreparedData;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.returntypes.WindowedData;
import com.amazon.tsensemble.util.ArrayUtils;

/**
 * Trains every requested member on the same prepared data and fuses their
 * forecasts. Members are independent; a member that fails is logged, recorded
 * in the result and left out of the fusion. Problems with the request or the
 * series itself are thrown to the caller.
 * <p>
 * Each member is weighted by its root mean square error on the validation
 * windows (the training windows when the split leaves no validation data),
 * measured after undoing the scaling.
 */
@Getter
public class EnsembleForecaster {

    private static final Logger logger = LogManager.getLogger(EnsembleForecaster.class);

    public static final int DEFAULT_THREAD_POOL_SIZE = Runtime.getRuntime().availableProcessors();

    private final EngineCapabilities capabilities;

    private final ForecastModelFactory modelFactory;

    private final EnsembleCombiner combiner;

    private final ScalingMethod scalingMethod;

    private final StationarityTransform stationarityTransform;

    private final int targetFeature;

    private final boolean strictMinimumSamples;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final long randomSeed;

    private ForkJoinPool forkJoinPool;

    public EnsembleForecaster(Builder<?> builder) {
        checkArgument(builder.capabilities != null, "capabilities cannot be null");
        checkArgument(!builder.parallelExecutionEnabled || builder.threadPoolSize > 0,
                "thread pool size must be positive when parallel execution is enabled");
        checkArgument(builder.epochs > 0, "epochs must be positive");
        capabilities = builder.capabilities;
        scalingMethod = builder.scalingMethod;
        stationarityTransform = builder.stationarityTransform;
        targetFeature = builder.targetFeature;
        strictMinimumSamples = builder.strictMinimumSamples;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize;
        randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());
        combiner = new EnsembleCombiner();
        int epochs = builder.epochs;
        long seed = randomSeed;
        modelFactory = builder.modelFactory.orElseGet(() -> (type, windowLength, inputDimensions,
                horizon) -> defaultModel(type, windowLength, inputDimensions, horizon, epochs, seed));
    }

    static AbstractForecastModel defaultModel(ForecastModelType type, int windowLength, int inputDimensions,
            int horizon, int epochs, long seed) {
        switch (type) {
        case RECURRENT:
            return RecurrentForecastModel.builder().windowLength(windowLength).inputDimensions(inputDimensions)
                    .horizon(horizon).epochs(epochs).randomSeed(seed).build();
        case CONVOLUTIONAL:
            return ConvolutionalForecastModel.builder().windowLength(windowLength).inputDimensions(inputDimensions)
                    .horizon(horizon).epochs(epochs).randomSeed(seed).build();
        default:
            throw new IllegalStateException("unknown model type " + type);
        }
    }

    /**
     * @param series  the history
     * @param request members, window, horizon and number of rolled horizons
     * @return {@code steps * horizon} fused values following the last observation
     */
    public ForecastResult forecast(TimeSeries series, ForecastRequest request) {
        checkArgument(series != null, "series cannot be null");
        checkArgument(request != null, "request cannot be null");
        request.getModelTypes().forEach(capabilities::require);
        checkArgument(request.getSteps() == 1 || series.getDimensions() == 1,
                "rolling more than one horizon forward needs a univariate series");

        Preprocessor preprocessor = Preprocessor.builder().windowLength(request.getWindowLength())
                .horizon(request.getHorizon()).scalingMethod(scalingMethod)
                .stationarityTransform(stationarityTransform).targetFeature(targetFeature)
                .strictMinimumSamples(strictMinimumSamples).build();
        PreparedData data = preprocessor.fitTransform(series);
        logger.info("training {} ensemble members on {} windows", request.getModelTypes().size(),
                data.getTrain().size());

        List<ModelOutcome> outcomes = run(request.getModelTypes(),
                type -> runMember(type, data, preprocessor, request, series.getDimensions()));
        return combiner.combine(outcomes, request.getExplicitWeights()).withPreprocessor(preprocessor);
    }

    ModelOutcome runMember(ForecastModelType type, PreparedData data, Preprocessor preprocessor,
            ForecastRequest request, int inputDimensions) {
        String id = ForecastRequest.modelId(type);
        try {
            IForecastModel model = modelFactory.create(type, request.getWindowLength(), inputDimensions,
                    request.getHorizon());
            model.fit(data.getTrain(), data.getValidation());
            WindowedData holdout = data.getValidation().isEmpty() ? data.getTrain() : data.getValidation();
            double error = rootMeanSquareError(preprocessor, model.predict(holdout.getInputs()),
                    holdout.getTargets());
            double[][] window = data.lastWindow(request.getWindowLength());
            double[] scaled = (request.getSteps() == 1) ? model.predict(new double[][][] { window })[0]
                    : ArrayUtils.flatten(model.predictFuture(window, request.getSteps()));
            double[] forecast = preprocessor.inverseForecast(scaled);
            logger.debug("member {} validation error {}", id, error);
            return ModelOutcome.success(id, forecast, error, model);
        } catch (RuntimeException e) {
            logger.warn("ensemble member {} failed, continuing without it", id, e);
            return ModelOutcome.failure(id, e);
        }
    }

    static double rootMeanSquareError(Preprocessor preprocessor, double[][] predictions, double[][] targets) {
        double[] predicted = preprocessor.inverseTarget(ArrayUtils.flatten(predictions));
        double[] actual = preprocessor.inverseTarget(ArrayUtils.flatten(targets));
        return ModelEvaluator.rootMeanSquaredError(actual, predicted);
    }

    <T, R> List<R> run(List<T> members, Function<T, R> task) {
        if (!parallelExecutionEnabled) {
            return members.stream().map(task).collect(Collectors.toList());
        }
        return submitAndJoin(() -> members.parallelStream().map(task).collect(Collectors.toList()));
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        protected EngineCapabilities capabilities = EngineCapabilities.all();
        protected Optional<ForecastModelFactory> modelFactory = Optional.empty();
        protected ScalingMethod scalingMethod = Preprocessor.DEFAULT_SCALING_METHOD;
        protected StationarityTransform stationarityTransform = StationarityTransform.NONE;
        protected int targetFeature = 0;
        protected boolean strictMinimumSamples = false;
        protected boolean parallelExecutionEnabled = false;
        protected int threadPoolSize = DEFAULT_THREAD_POOL_SIZE;
        protected int epochs = AbstractForecastModel.DEFAULT_EPOCHS;
        protected Optional<Long> randomSeed = Optional.empty();

        public EnsembleForecaster build() {
            return new EnsembleForecaster(this);
        }

        public T capabilities(EngineCapabilities capabilities) {
            this.capabilities = capabilities;
            return (T) this;
        }

        public T modelFactory(ForecastModelFactory modelFactory) {
            this.modelFactory = Optional.ofNullable(modelFactory);
            return (T) this;
        }

        public T scalingMethod(ScalingMethod scalingMethod) {
            this.scalingMethod = scalingMethod;
            return (T) this;
        }

        public T stationarityTransform(StationarityTransform stationarityTransform) {
            this.stationarityTransform = stationarityTransform;
            return (T) this;
        }

        public T targetFeature(int targetFeature) {
            this.targetFeature = targetFeature;
            return (T) this;
        }

        public T strictMinimumSamples(boolean strictMinimumSamples) {
            this.strictMinimumSamples = strictMinimumSamples;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return (T) this;
        }

        public T epochs(int epochs) {
            this.epochs = epochs;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }
    }
}
