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

package com.amazon.tsensemble.forecast.nn;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A stack of layers evaluated in order. Not thread safe; the layers cache the
 * activations of the sample being processed.
 */
public class SequentialNetwork {

    private final List<ILayer> layers;

    private final int[] inputShape;

    public SequentialNetwork(List<ILayer> layers, int[] inputShape) {
        checkArgument(!layers.isEmpty(), "network needs at least one layer");
        this.layers = new ArrayList<>(layers);
        this.inputShape = inputShape.clone();
    }

    public double[][] forward(double[][] input, boolean training) {
        double[][] current = input;
        for (ILayer layer : layers) {
            current = layer.forward(current, training);
        }
        return current;
    }

    public void backward(double[][] gradient) {
        double[][] current = gradient;
        for (int i = layers.size() - 1; i >= 0; i--) {
            current = layers.get(i).backward(current);
        }
    }

    public List<ILayer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    public List<Parameter> getParameters() {
        List<Parameter> answer = new ArrayList<>();
        for (ILayer layer : layers) {
            answer.addAll(layer.getParameters());
        }
        return answer;
    }

    public int getParameterCount() {
        int count = 0;
        for (Parameter parameter : getParameters()) {
            count += parameter.size();
        }
        return count;
    }

    /**
     * @return all parameter values concatenated in layer order
     */
    public double[] getParameterValues() {
        double[] answer = new double[getParameterCount()];
        int position = 0;
        for (Parameter parameter : getParameters()) {
            System.arraycopy(parameter.getValues(), 0, answer, position, parameter.size());
            position += parameter.size();
        }
        return answer;
    }

    public void setParameterValues(double[] values) {
        checkArgument(values.length == getParameterCount(), "incorrect number of parameter values");
        int position = 0;
        for (Parameter parameter : getParameters()) {
            parameter.copyFrom(values, position);
            position += parameter.size();
        }
    }

    /**
     * a one line per layer description with output shapes and parameter counts
     */
    public String summary() {
        StringBuilder builder = new StringBuilder();
        int[] shape = inputShape;
        for (ILayer layer : layers) {
            shape = layer.outputShape(shape);
            int count = 0;
            for (Parameter parameter : layer.getParameters()) {
                count += parameter.size();
            }
            builder.append(String.format("%-32s (%d, %d) %10d%n", layer.getName(), shape[0], shape[1], count));
        }
        builder.append("total parameters: ").append(getParameterCount());
        return builder.toString();
    }
}
