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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.anomalydetection.decomposition.Seasonality;
import com.amazon.tsensemble.anomalydetection.decomposition.TrendSeasonalModel;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.config.SeasonalityMode;
import com.amazon.tsensemble.exception.ValidationException;
import com.amazon.tsensemble.preprocessor.Preprocessor;
import com.amazon.tsensemble.returntypes.AnomalyScoreSeries;
import com.amazon.tsensemble.returntypes.DecompositionComponents;
import com.amazon.tsensemble.returntypes.TimeSeries;

/**
 * Flags observations that fall outside the prediction interval of a trend and
 * seasonality model by a relative margin. Above the interval the importance is
 * {@code (y - upper) / y}, below it {@code (lower - y) / y}; a zero observation
 * uses the plain deviation. A point is flagged when it is outside the interval
 * and {@code |importance|} exceeds {@code threshold} times the range of the
 * fitting values. The score is {@code |importance|}, and 0 inside the interval.
 * <p>
 * With timestamps (epoch milliseconds) the time unit is the day, so the built
 * in seasonalities have their usual meaning; without timestamps the time unit
 * is one observation and new data is assumed to directly follow the fitting
 * data.
 */
@Getter
public class TrendDecompositionDetector implements IAnomalyDetector {

    private static final Logger logger = LogManager.getLogger(TrendDecompositionDetector.class);

    public static final double DEFAULT_THRESHOLD = 0.1;

    public static final SeasonalityMode DEFAULT_SEASONALITY_MODE = SeasonalityMode.MULTIPLICATIVE;

    public static final int DEFAULT_CUSTOM_ORDER = 3;

    public static final int MINIMUM_OBSERVATIONS = 10;

    public static final double MILLISECONDS_PER_DAY = 86_400_000.0;

    /**
     * fraction of the range of the fitting values
     */
    private final double threshold;

    private final boolean strictMinimumSamples;

    private final TrendSeasonalModel model;

    private boolean fitted;

    private boolean timestamped;

    private long originTimestamp;

    private int fittedLength;

    private double fittingRange;

    private double[] fittedTimes;

    private double[] fittedValues;

    private AnomalyScoreSeries fittedScores;

    private DecompositionComponents components;

    public TrendDecompositionDetector(Builder<?> builder) {
        if (!(builder.threshold >= 0)) {
            throw new ValidationException("threshold fraction cannot be negative, got " + builder.threshold);
        }
        threshold = builder.threshold;
        strictMinimumSamples = builder.strictMinimumSamples;
        List<Seasonality> seasonalities = new ArrayList<>();
        if (builder.dailySeasonality) {
            seasonalities.add(Seasonality.DAILY);
        }
        if (builder.weeklySeasonality) {
            seasonalities.add(Seasonality.WEEKLY);
        }
        if (builder.yearlySeasonality) {
            seasonalities.add(Seasonality.YEARLY);
        }
        builder.customPeriod
                .ifPresent(period -> seasonalities.add(Seasonality.custom(period, builder.customOrder)));
        model = new TrendSeasonalModel(seasonalities, builder.seasonalityMode, builder.maxChangepoints,
                builder.changepointRange, builder.changepointPriorScale, builder.seasonalityPriorScale,
                builder.intervalWidth);
    }

    /**
     * restores a fitted detector, the model must already carry its fitted
     * parameters
     */
    public TrendDecompositionDetector(double threshold, boolean strictMinimumSamples, TrendSeasonalModel model,
            boolean timestamped, long originTimestamp, double fittingRange, double[] fittedTimes,
            double[] fittedValues) {
        checkArgument(model.isFitted(), "model must be fitted");
        checkArgument(fittedTimes.length == fittedValues.length, "times and values must align");
        this.threshold = threshold;
        this.strictMinimumSamples = strictMinimumSamples;
        this.model = model;
        this.timestamped = timestamped;
        this.originTimestamp = originTimestamp;
        this.fittingRange = fittingRange;
        this.fittedTimes = fittedTimes;
        this.fittedValues = fittedValues;
        this.fittedLength = fittedValues.length;
        this.fitted = true;
        this.components = model.predict(fittedTimes);
        this.fittedScores = evaluate(fittedValues, components);
    }

    @Override
    public void fit(TimeSeries series) {
        checkArgument(series != null, "series cannot be null");
        if (series.size() < 2) {
            throw new ValidationException("trend decomposition needs at least 2 observations, got " + series.size());
        }
        Preprocessor.checkMinimumObservations(series.size(), MINIMUM_OBSERVATIONS, strictMinimumSamples,
                "trend decomposition models");
        if (series.getDimensions() > 1) {
            logger.info("trend decomposition uses the first of {} features", series.getDimensions());
        }
        double[] values = series.getFeature(0);
        timestamped = series.hasTimestamps();
        originTimestamp = timestamped ? series.getTimestamps()[0] : 0L;
        fittedLength = values.length;
        double[] times = times(series, 0);
        model.fit(times, values);
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        fittingRange = max - min;
        fittedTimes = times;
        fittedValues = values;
        fitted = true;
        components = model.predict(times);
        fittedScores = evaluate(values, components);
        logger.debug("trend decomposition flags {} of {} points", fittedScores.getFlaggedCount(), values.length);
    }

    double[] times(TimeSeries series, int indexOffset) {
        double[] answer = new double[series.size()];
        if (timestamped) {
            checkArgument(series.hasTimestamps(), "the detector was fitted with timestamps");
            long[] stamps = series.getTimestamps();
            for (int i = 0; i < answer.length; i++) {
                answer[i] = (stamps[i] - originTimestamp) / MILLISECONDS_PER_DAY;
            }
        } else {
            for (int i = 0; i < answer.length; i++) {
                answer[i] = indexOffset + i;
            }
        }
        return answer;
    }

    AnomalyScoreSeries evaluate(double[] values, DecompositionComponents band) {
        double limit = getThresholdValue();
        double[] lower = band.getLower();
        double[] upper = band.getUpper();
        double[] scores = new double[values.length];
        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            double y = values[i];
            double importance = 0;
            if (y > upper[i]) {
                importance = (y == 0) ? y - upper[i] : (y - upper[i]) / y;
            } else if (y < lower[i]) {
                importance = (y == 0) ? lower[i] - y : (lower[i] - y) / y;
            }
            scores[i] = Math.abs(importance);
            flags[i] = importance != 0 && scores[i] > limit;
        }
        return new AnomalyScoreSeries(getMethod(), scores, flags, limit);
    }

    @Override
    public AnomalyScoreSeries detect() {
        checkFitted(fitted, "trend decomposition detector");
        return fittedScores;
    }

    @Override
    public AnomalyScoreSeries score(TimeSeries series) {
        checkFitted(fitted, "trend decomposition detector");
        checkArgument(series != null, "series cannot be null");
        DecompositionComponents band = model.predict(times(series, fittedLength));
        return evaluate(series.getFeature(0), band);
    }

    /**
     * @param series data whose time points are to be decomposed
     * @return trend, seasonal part and interval at the time points of
     *         {@code series}
     */
    public DecompositionComponents decompose(TimeSeries series) {
        checkFitted(fitted, "trend decomposition detector");
        return model.predict(times(series, fittedLength));
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.TREND_DECOMPOSITION;
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    @Override
    public double getThresholdValue() {
        return fitted ? threshold * fittingRange : Double.NaN;
    }

    @Override
    public Map<String, Object> getDiagnostics() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("method", getMethod().name());
        map.put("threshold", threshold);
        map.put("seasonalityMode", model.getMode().name());
        map.put("intervalWidth", model.getIntervalWidth());
        if (fitted) {
            map.put("thresholdValue", getThresholdValue());
            map.put("fittingRange", fittingRange);
            map.put("changepoints", model.getChangepoints().length);
            map.put("residualScale", model.getSigma() * model.getValueScale());
            map.put("finalSlope", model.getFinalSlope());
            map.put("flagged", fittedScores.getFlaggedCount());
        }
        return map;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected double threshold = DEFAULT_THRESHOLD;
        protected double intervalWidth = TrendSeasonalModel.DEFAULT_INTERVAL_WIDTH;
        protected double changepointRange = TrendSeasonalModel.DEFAULT_CHANGEPOINT_RANGE;
        protected double changepointPriorScale = TrendSeasonalModel.DEFAULT_CHANGEPOINT_PRIOR_SCALE;
        protected double seasonalityPriorScale = TrendSeasonalModel.DEFAULT_SEASONALITY_PRIOR_SCALE;
        protected int maxChangepoints = TrendSeasonalModel.DEFAULT_MAX_CHANGEPOINTS;
        protected SeasonalityMode seasonalityMode = DEFAULT_SEASONALITY_MODE;
        protected boolean dailySeasonality = false;
        protected boolean weeklySeasonality = false;
        protected boolean yearlySeasonality = false;
        protected Optional<Double> customPeriod = Optional.empty();
        protected int customOrder = DEFAULT_CUSTOM_ORDER;
        protected boolean strictMinimumSamples = false;

        public TrendDecompositionDetector build() {
            return new TrendDecompositionDetector(this);
        }

        public T threshold(double threshold) {
            this.threshold = threshold;
            return (T) this;
        }

        public T intervalWidth(double intervalWidth) {
            this.intervalWidth = intervalWidth;
            return (T) this;
        }

        public T changepointRange(double changepointRange) {
            this.changepointRange = changepointRange;
            return (T) this;
        }

        public T changepointPriorScale(double changepointPriorScale) {
            this.changepointPriorScale = changepointPriorScale;
            return (T) this;
        }

        public T seasonalityPriorScale(double seasonalityPriorScale) {
            this.seasonalityPriorScale = seasonalityPriorScale;
            return (T) this;
        }

        public T maxChangepoints(int maxChangepoints) {
            this.maxChangepoints = maxChangepoints;
            return (T) this;
        }

        public T seasonalityMode(SeasonalityMode seasonalityMode) {
            this.seasonalityMode = seasonalityMode;
            return (T) this;
        }

        public T dailySeasonality(boolean dailySeasonality) {
            this.dailySeasonality = dailySeasonality;
            return (T) this;
        }

        public T weeklySeasonality(boolean weeklySeasonality) {
            this.weeklySeasonality = weeklySeasonality;
            return (T) this;
        }

        public T yearlySeasonality(boolean yearlySeasonality) {
            this.yearlySeasonality = yearlySeasonality;
            return (T) this;
        }

        public T customSeasonality(double period, int order) {
            this.customPeriod = Optional.of(period);
            this.customOrder = order;
            return (T) this;
        }

        public T strictMinimumSamples(boolean strictMinimumSamples) {
            this.strictMinimumSamples = strictMinimumSamples;
            return (T) this;
        }
    }
}
