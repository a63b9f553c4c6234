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

package com.amazon.tsensemble.examples.registry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import com.amazon.tsensemble.anomalydetection.StateTransitionDetector;
import com.amazon.tsensemble.examples.Example;
import com.amazon.tsensemble.forecast.ConvolutionalForecastModel;
import com.amazon.tsensemble.forecast.IForecastModel;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.registry.FileModelRegistry;
import com.amazon.tsensemble.registry.ModelRecord;
import com.amazon.tsensemble.registry.ModelRegistry;
import com.amazon.tsensemble.returntypes.PreparedData;
import com.amazon.tsensemble.returntypes.TimeSeries;
import com.amazon.tsensemble.testutils.SyntheticSeries;

/**
 * Saves a forecast model with its preprocessor and a detector to a directory,
 * loads them back and checks that they behave exactly as before.
 */
public class ModelRegistryExample implements Example {

    public static void main(String[] args) throws Exception {
        new ModelRegistryExample().run();
    }

    @Override
    public String command() {
        return "model_registry";
    }

    @Override
    public String description() {
        return "save fitted models to files and restore them";
    }

    @Override
    public void run() throws Exception {
        Path directory = Files.createTempDirectory("tsensemble-models");
        ModelRegistry registry = new FileModelRegistry(directory);

        double[] values = SyntheticSeries.sineWithSpikes(240, 24, 10, 3, 0.1, 17L, 4, 200);
        TimeSeries series = TimeSeries.univariate(values);
        Preprocessor preprocessor = Preprocessor.builder().windowLength(24).build();
        PreparedData data = preprocessor.fitTransform(series);
        IForecastModel model = ConvolutionalForecastModel.builder().windowLength(24).epochs(20).randomSeed(17L)
                .build();
        model.fit(data.getTrain(), data.getValidation());
        System.out.println(model.getModelSummary());

        StateTransitionDetector detector = StateTransitionDetector.builder().states(4).build();
        detector.fit(series);

        System.out.println("saved to " + registry.save("hourly-forecast",
                ModelRecord.of(model, preprocessor).withDescription("daily cycle, next hour")));
        System.out.println("saved to " + registry.save("hourly-detector", ModelRecord.of(detector)));
        System.out.println("registry holds " + registry.list());

        ModelRecord record = registry.load("hourly-forecast");
        System.out.printf("%s %s, shape %s, created %s, %d epochs%n", record.getKind(), record.getModelType(),
                Arrays.toString(record.getDataShape()), record.getCreatedAt(),
                record.getTrainingResult().get().getEpochsRun());
        double[][][] window = { data.lastWindow(24) };
        double before = preprocessor.inverseForecast(model.predict(window)[0])[0];
        double after = record.getPreprocessor().get().inverseForecast(record.getForecastModel().predict(window)[0])[0];
        System.out.printf("forecast before saving %.6f, after loading %.6f%n", before, after);
        if (before != after) {
            throw new IllegalStateException("restored model does not agree with the original");
        }

        StateTransitionDetector restored = (StateTransitionDetector) registry.load("hourly-detector")
                .getAnomalyDetector();
        if (!restored.detect().getFlaggedIndices().equals(detector.detect().getFlaggedIndices())) {
            throw new IllegalStateException("restored detector does not agree with the original");
        }

        for (String name : registry.list()) {
            registry.delete(name);
        }
        Files.delete(directory);
        System.out.println("Looks good!");
    }
}
