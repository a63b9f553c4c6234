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

package com.amazon.tsensemble.registry;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkNotNull;
import static com.amazon.tsensemble.CommonUtils.checkState;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.anomalydetection.StateTransitionDetector;
import com.amazon.tsensemble.anomalydetection.TrendDecompositionDetector;
import com.amazon.tsensemble.forecast.AbstractForecastModel;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.registry.state.ModelMetadata;
import com.amazon.tsensemble.registry.state.ModelRecordState;
import com.amazon.tsensemble.returntypes.TrainingResult;
import com.amazon.tsensemble.state.anomalydetection.StateTransitionDetectorMapper;
import com.amazon.tsensemble.state.anomalydetection.TrendDecompositionDetectorMapper;
import com.amazon.tsensemble.state.forecast.ForecastModelMapper;
import com.amazon.tsensemble.state.preprocessor.PreprocessorMapper;
import com.amazon.tsensemble.state.returntypes.TrainingResultMapper;

/**
 * An immutable snapshot of a model together with its metadata. The snapshot
 * is taken when the record is created; later changes to the model, such as
 * refitting it, are not reflected. Every accessor that returns a model builds a
 * new instance from the snapshot.
 * <p>
 * The data shape depends on the kind: {@code [windowLength, inputDimensions,
 * horizon]} for forecast models and preprocessors, {@code [observations,
 * features]} for detectors. Unknown parts are 0.
 */
public class ModelRecord {

    private final ModelKind kind;

    private final ModelMetadata metadata;

    private final ModelRecordState state;

    /**
     * Joins the two halves of a stored record. Both are owned by the record
     * afterwards.
     */
    public ModelRecord(ModelMetadata metadata, ModelRecordState state) {
        checkNotNull(metadata, "metadata cannot be null");
        checkNotNull(state, "state cannot be null");
        checkArgument(metadata.getKind() != null && metadata.getKind().equals(state.getKind()),
                "metadata and state describe different kinds of model");
        this.kind = ModelKind.valueOf(state.getKind());
        this.metadata = metadata;
        this.state = state;
    }

    public static ModelRecord of(IForecastModel model) {
        return of(model, null);
    }

    /**
     * @param model        a recurrent or convolutional model
     * @param preprocessor the preprocessor that prepared the training data, can
     *                     be null
     */
    public static ModelRecord of(IForecastModel model, Preprocessor preprocessor) {
        checkNotNull(model, "model cannot be null");
        checkArgument(model instanceof AbstractForecastModel,
                "unsupported forecast model " + model.getClass().getName());
        AbstractForecastModel forecastModel = (AbstractForecastModel) model;
        ModelRecordState state = newState(ModelKind.FORECAST_MODEL);
        state.setForecastModelState(new ForecastModelMapper().toState(forecastModel));
        if (preprocessor != null) {
            state.setPreprocessorState(new PreprocessorMapper().toState(preprocessor));
        }
        ModelMetadata metadata = newMetadata(ModelKind.FORECAST_MODEL, model.getModelType().name(),
                new int[] { model.getWindowLength(), model.getInputDimensions(), model.getHorizon() },
                model.getHyperparameters());
        if (model.getTrainingResult() != null) {
            metadata.setTrainingResult(new TrainingResultMapper().toState(model.getTrainingResult()));
        }
        return new ModelRecord(metadata, state);
    }

    public static ModelRecord of(IAnomalyDetector detector) {
        checkNotNull(detector, "detector cannot be null");
        ModelRecordState state;
        int[] shape;
        if (detector instanceof StateTransitionDetector) {
            StateTransitionDetector stateTransition = (StateTransitionDetector) detector;
            state = newState(ModelKind.STATE_TRANSITION_DETECTOR);
            state.setStateTransitionDetectorState(new StateTransitionDetectorMapper().toState(stateTransition));
            shape = stateTransition.isFitted()
                    ? new int[] { stateTransition.getFittedObservations().length + 1,
                            stateTransition.getInputDimensions() }
                    : new int[2];
        } else if (detector instanceof TrendDecompositionDetector) {
            TrendDecompositionDetector trend = (TrendDecompositionDetector) detector;
            state = newState(ModelKind.TREND_DECOMPOSITION_DETECTOR);
            state.setTrendDecompositionDetectorState(new TrendDecompositionDetectorMapper().toState(trend));
            shape = trend.isFitted() ? new int[] { trend.getFittedLength(), 1 } : new int[2];
        } else {
            throw new IllegalArgumentException("unsupported anomaly detector " + detector.getClass().getName());
        }
        ModelMetadata metadata = newMetadata(ModelKind.valueOf(state.getKind()), detector.getMethod().name(), shape,
                detector.getDiagnostics());
        return new ModelRecord(metadata, state);
    }

    public static ModelRecord of(Preprocessor preprocessor) {
        checkNotNull(preprocessor, "preprocessor cannot be null");
        ModelRecordState state = newState(ModelKind.PREPROCESSOR);
        state.setPreprocessorState(new PreprocessorMapper().toState(preprocessor));
        int dimensions = preprocessor.isFitted() ? preprocessor.getScalingTransform().getDimensions() : 0;
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("trainRatio", preprocessor.getTrainRatio());
        parameters.put("validationRatio", preprocessor.getValidationRatio());
        parameters.put("targetFeature", preprocessor.getTargetFeature());
        parameters.put("stationarityTransform", preprocessor.getStationarityTransform());
        ModelMetadata metadata = newMetadata(ModelKind.PREPROCESSOR, preprocessor.getScalingMethod().name(),
                new int[] { preprocessor.getWindowLength(), dimensions, preprocessor.getHorizon() }, parameters);
        return new ModelRecord(metadata, state);
    }

    /**
     * @return a copy of this record with the given description
     */
    public ModelRecord withDescription(String description) {
        ModelMetadata copy = copyMetadata();
        copy.setDescription(description);
        return new ModelRecord(copy, state);
    }

    static ModelRecordState newState(ModelKind kind) {
        ModelRecordState state = new ModelRecordState();
        state.setKind(kind.name());
        return state;
    }

    static ModelMetadata newMetadata(ModelKind kind, String modelType, int[] shape, Map<String, Object> parameters) {
        ModelMetadata metadata = new ModelMetadata();
        metadata.setKind(kind.name());
        metadata.setModelType(modelType);
        metadata.setDataShape(shape);
        Map<String, String> values = new LinkedHashMap<>();
        parameters.forEach((key, value) -> values.put(key, asString(value)));
        metadata.setHyperparameters(values);
        metadata.setCreatedAt(System.currentTimeMillis());
        return metadata;
    }

    static String asString(Object value) {
        if (value instanceof int[]) {
            return Arrays.toString((int[]) value);
        } else if (value instanceof double[]) {
            return Arrays.toString((double[]) value);
        }
        return String.valueOf(value);
    }

    public ModelKind getKind() {
        return kind;
    }

    /**
     * @return the forecast variant, the detector method or the scaling method
     */
    public String getModelType() {
        return metadata.getModelType();
    }

    public int[] getDataShape() {
        return (metadata.getDataShape() == null) ? new int[0]
                : Arrays.copyOf(metadata.getDataShape(), metadata.getDataShape().length);
    }

    public Optional<TrainingResult> getTrainingResult() {
        return Optional.ofNullable(metadata.getTrainingResult()).map(new TrainingResultMapper()::toModel);
    }

    public Map<String, String> getHyperparameters() {
        return (metadata.getHyperparameters() == null) ? Collections.emptyMap()
                : Collections.unmodifiableMap(metadata.getHyperparameters());
    }

    public Instant getCreatedAt() {
        return Instant.ofEpochMilli(metadata.getCreatedAt());
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(metadata.getDescription());
    }

    public IForecastModel getForecastModel() {
        checkState(kind == ModelKind.FORECAST_MODEL, "record holds a " + kind + ", not a forecast model");
        return new ForecastModelMapper().toModel(state.getForecastModelState());
    }

    public IAnomalyDetector getAnomalyDetector() {
        if (kind == ModelKind.STATE_TRANSITION_DETECTOR) {
            return new StateTransitionDetectorMapper().toModel(state.getStateTransitionDetectorState());
        } else if (kind == ModelKind.TREND_DECOMPOSITION_DETECTOR) {
            return new TrendDecompositionDetectorMapper().toModel(state.getTrendDecompositionDetectorState());
        }
        throw new IllegalStateException("record holds a " + kind + ", not an anomaly detector");
    }

    /**
     * @return the preprocessor of a preprocessor record, or the one stored with a
     *         forecast model
     */
    public Optional<Preprocessor> getPreprocessor() {
        return Optional.ofNullable(state.getPreprocessorState()).map(new PreprocessorMapper()::toModel);
    }

    ModelMetadata getMetadata() {
        return copyMetadata();
    }

    ModelMetadata copyMetadata() {
        ModelMetadata copy = new ModelMetadata();
        copy.setVersion(metadata.getVersion());
        copy.setKind(metadata.getKind());
        copy.setModelType(metadata.getModelType());
        copy.setDataShape(getDataShape());
        copy.setTrainingResult(metadata.getTrainingResult());
        copy.setHyperparameters(new LinkedHashMap<>(getHyperparameters()));
        copy.setCreatedAt(metadata.getCreatedAt());
        copy.setDescription(metadata.getDescription());
        return copy;
    }

    ModelRecordState getState() {
        return state;
    }
}
