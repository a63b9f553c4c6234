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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.anomalydetection.IAnomalyDetector;
import com.amazon.tsensemble.anomalydetection.StateTransitionDetector;
import com.amazon.tsensemble.anomalydetection.TrendDecompositionDetector;
import com.amazon.tsensemble.config.AnomalyMethod;
import com.amazon.tsensemble.parkservices.config.AnomalyRequest;
import com.amazon.tsensemble.parkservices.consensus.AnomalyConsensusMerger;
import com.amazon.tsensemble.parkservices.consensus.DetectorOutcome;
import com.amazon.tsensemble.parkservices.returntypes.AnomalyReport;
import com.amazon.tsensemble.returntypes.TimeSeries;

/**
 * Runs every requested detector on the same series and merges the verdicts.
 * Detectors are created up front, so an unusable threshold is reported to the
 * caller; a detector that fails while fitting is logged, recorded in the
 * report and left out of the consensus.
 */
@Getter
public class ConsensusAnomalyDetector {

    private static final Logger logger = LogManager.getLogger(ConsensusAnomalyDetector.class);

    private final EngineCapabilities capabilities;

    private final AnomalyDetectorFactory detectorFactory;

    private final AnomalyConsensusMerger merger;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private ForkJoinPool forkJoinPool;

    public ConsensusAnomalyDetector(Builder<?> builder) {
        checkArgument(builder.capabilities != null, "capabilities cannot be null");
        checkArgument(!builder.parallelExecutionEnabled || builder.threadPoolSize > 0,
                "thread pool size must be positive when parallel execution is enabled");
        capabilities = builder.capabilities;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize;
        merger = new AnomalyConsensusMerger();
        boolean strict = builder.strictMinimumSamples;
        boolean daily = builder.dailySeasonality;
        boolean weekly = builder.weeklySeasonality;
        detectorFactory = builder.detectorFactory
                .orElseGet(() -> (method, threshold) -> defaultDetector(method, threshold, strict, daily, weekly));
    }

    static IAnomalyDetector defaultDetector(AnomalyMethod method, double threshold, boolean strict,
            boolean dailySeasonality, boolean weeklySeasonality) {
        switch (method) {
        case STATE_TRANSITION:
            return StateTransitionDetector.builder().threshold(threshold).strictMinimumSamples(strict).build();
        case TREND_DECOMPOSITION:
            return TrendDecompositionDetector.builder().threshold(threshold).strictMinimumSamples(strict)
                    .dailySeasonality(dailySeasonality).weeklySeasonality(weeklySeasonality).build();
        default:
            throw new IllegalStateException("unknown method " + method);
        }
    }

    public AnomalyReport detect(TimeSeries series, AnomalyRequest request) {
        checkArgument(series != null, "series cannot be null");
        checkArgument(request != null, "request cannot be null");
        request.getMethods().forEach(capabilities::require);
        List<IAnomalyDetector> detectors = new ArrayList<>();
        for (AnomalyMethod method : request.getMethods()) {
            detectors.add(detectorFactory.create(method, request.thresholdFor(method)));
        }
        logger.info("running {} anomaly detectors on {} points", detectors.size(), series.size());
        List<DetectorOutcome> outcomes = run(detectors, detector -> runDetector(detector, series));
        return merger.merge(outcomes);
    }

    DetectorOutcome runDetector(IAnomalyDetector detector, TimeSeries series) {
        try {
            return DetectorOutcome.success(detector.fitDetect(series), detector);
        } catch (RuntimeException e) {
            logger.warn("{} detector failed, continuing without it", detector.getMethod(), e);
            return DetectorOutcome.failure(detector.getMethod(), e);
        }
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

        protected EngineCapabilities capabilities = EngineCapabilities.all();
        protected Optional<AnomalyDetectorFactory> detectorFactory = Optional.empty();
        protected boolean strictMinimumSamples = false;
        protected boolean dailySeasonality = false;
        protected boolean weeklySeasonality = false;
        protected boolean parallelExecutionEnabled = false;
        protected int threadPoolSize = EnsembleForecaster.DEFAULT_THREAD_POOL_SIZE;

        public ConsensusAnomalyDetector build() {
            return new ConsensusAnomalyDetector(this);
        }

        public T capabilities(EngineCapabilities capabilities) {
            this.capabilities = capabilities;
            return (T) this;
        }

        public T detectorFactory(AnomalyDetectorFactory detectorFactory) {
            this.detectorFactory = Optional.ofNullable(detectorFactory);
            return (T) this;
        }

        public T strictMinimumSamples(boolean strictMinimumSamples) {
            this.strictMinimumSamples = strictMinimumSamples;
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

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return (T) this;
        }
    }
}
