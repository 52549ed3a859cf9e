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

package com.amazon.anomalyensemble.returntypes;

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * One anomaly score per test row; higher means more anomalous.
 */
public final class ScoreVector {

    private final double[] scores;

    public ScoreVector(double[] scores) {
        checkNotNull(scores, "scores must not be null");
        this.scores = Arrays.copyOf(scores, scores.length);
    }

    public static ScoreVector of(double... scores) {
        return new ScoreVector(scores);
    }

    public int size() {
        return scores.length;
    }

    public double get(int index) {
        return scores[index];
    }

    public double[] toArray() {
        return Arrays.copyOf(scores, scores.length);
    }

    /**
     * @param threshold the cut
     * @return a decision flagging every row whose score is strictly above
     *         {@code threshold}
     */
    public DecisionVector above(double threshold) {
        boolean[] flags = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            flags[i] = scores[i] > threshold;
        }
        return new DecisionVector(flags);
    }

    @Override
    public String toString() {
        return Arrays.toString(scores);
    }
}
