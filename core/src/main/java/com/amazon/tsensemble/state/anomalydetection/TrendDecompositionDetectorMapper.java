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

package com.amazon.tsensemble.state.anomalydetection;

import java.util.List;

import com.amazon.tsensemble.anomalydetection.TrendDecompositionDetector;
import com.amazon.tsensemble.anomalydetection.decomposition.Seasonality;
import com.amazon.tsensemble.anomalydetection.decomposition.TrendSeasonalModel;
import com.amazon.tsensemble.config.SeasonalityMode;
import com.amazon.tsensemble.state.IStateMapper;

public class TrendDecompositionDetectorMapper
        implements IStateMapper<TrendDecompositionDetector, TrendDecompositionDetectorState> {

    @Override
    public TrendDecompositionDetector toModel(TrendDecompositionDetectorState state, long seed) {
        TrendDecompositionDetector.Builder<?> builder = TrendDecompositionDetector.builder()
                .threshold(state.getThreshold()).strictMinimumSamples(state.isStrictMinimumSamples())
                .seasonalityMode(SeasonalityMode.valueOf(state.getSeasonalityMode()))
                .maxChangepoints(state.getMaxChangepoints()).changepointRange(state.getChangepointRange())
                .changepointPriorScale(state.getChangepointPriorScale())
                .seasonalityPriorScale(state.getSeasonalityPriorScale()).intervalWidth(state.getIntervalWidth());
        String[] names = state.getSeasonalityNames();
        if (names != null) {
            for (int i = 0; i < names.length; i++) {
                if (Seasonality.DAILY.getName().equals(names[i])) {
                    builder.dailySeasonality(true);
                } else if (Seasonality.WEEKLY.getName().equals(names[i])) {
                    builder.weeklySeasonality(true);
                } else if (Seasonality.YEARLY.getName().equals(names[i])) {
                    builder.yearlySeasonality(true);
                } else {
                    builder.customSeasonality(state.getSeasonalityPeriods()[i], state.getSeasonalityOrders()[i]);
                }
            }
        }
        TrendDecompositionDetector detector = builder.build();
        if (!state.isFitted()) {
            return detector;
        }
        TrendSeasonalModel model = detector.getModel();
        model.restore(state.getOrigin(), state.getSpan(), state.getValueScale(), orEmpty(state.getChangepoints()),
                state.getTrendCoefficients(), orEmpty(state.getSeasonalCoefficients()), state.getSigma());
        return new TrendDecompositionDetector(state.getThreshold(), state.isStrictMinimumSamples(), model,
                state.isTimestamped(), state.getOriginTimestamp(), state.getFittingRange(), state.getFittedTimes(),
                state.getFittedValues());
    }

    private static double[] orEmpty(double[] values) {
        return (values == null) ? new double[0] : values;
    }

    @Override
    public TrendDecompositionDetectorState toState(TrendDecompositionDetector detector) {
        TrendDecompositionDetectorState state = new TrendDecompositionDetectorState();
        TrendSeasonalModel model = detector.getModel();
        state.setThreshold(detector.getThreshold());
        state.setStrictMinimumSamples(detector.isStrictMinimumSamples());
        state.setSeasonalityMode(model.getMode().name());
        state.setMaxChangepoints(model.getMaxChangepoints());
        state.setChangepointRange(model.getChangepointRange());
        state.setChangepointPriorScale(model.getChangepointPriorScale());
        state.setSeasonalityPriorScale(model.getSeasonalityPriorScale());
        state.setIntervalWidth(model.getIntervalWidth());
        List<Seasonality> seasonalities = model.getSeasonalities();
        String[] names = new String[seasonalities.size()];
        double[] periods = new double[seasonalities.size()];
        int[] orders = new int[seasonalities.size()];
        for (int i = 0; i < names.length; i++) {
            names[i] = seasonalities.get(i).getName();
            periods[i] = seasonalities.get(i).getPeriod();
            orders[i] = seasonalities.get(i).getOrder();
        }
        state.setSeasonalityNames(names);
        state.setSeasonalityPeriods(periods);
        state.setSeasonalityOrders(orders);
        state.setFitted(detector.isFitted());
        if (detector.isFitted()) {
            state.setTimestamped(detector.isTimestamped());
            state.setOriginTimestamp(detector.getOriginTimestamp());
            state.setFittingRange(detector.getFittingRange());
            state.setOrigin(model.getOrigin());
            state.setSpan(model.getSpan());
            state.setValueScale(model.getValueScale());
            state.setChangepoints(model.getChangepoints());
            state.setTrendCoefficients(model.getTrendCoefficients());
            state.setSeasonalCoefficients(model.getSeasonalCoefficients());
            state.setSigma(model.getSigma());
            state.setFittedTimes(detector.getFittedTimes());
            state.setFittedValues(detector.getFittedValues());
        }
        return state;
    }
}
