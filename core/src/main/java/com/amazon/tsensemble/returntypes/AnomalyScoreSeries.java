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

package com.amazon.tsensemble.returntypes;

import static com.amazon.tsensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.tsensemble.config.AnomalyMethod;

/**
 * One score and one flag per time index of the series that was scored, as
 * produced by a single detector, together with the threshold value applied.
 */
public class AnomalyScoreSeries {

    @Getter
    private final AnomalyMethod method;

    private final double[] scores;

    private final boolean[] flags;

    @Getter
    private final double threshold;

    public AnomalyScoreSeries(AnomalyMethod method, double[] scores, boolean[] flags, double threshold) {
        checkArgument(scores.length == flags.length, "scores and flags must align");
        this.method = method;
        this.scores = Arrays.copyOf(scores, scores.length);
        this.flags = Arrays.copyOf(flags, flags.length);
        this.threshold = threshold;
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public boolean[] getFlags() {
        return Arrays.copyOf(flags, flags.length);
    }

    public int size() {
        return scores.length;
    }

    public List<Integer> getFlaggedIndices() {
        List<Integer> answer = new ArrayList<>();
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) {
                answer.add(i);
            }
        }
        return Collections.unmodifiableList(answer);
    }

    public int getFlaggedCount() {
        int count = 0;
        for (boolean flag : flags) {
            count += flag ? 1 : 0;
        }
        return count;
    }
}
