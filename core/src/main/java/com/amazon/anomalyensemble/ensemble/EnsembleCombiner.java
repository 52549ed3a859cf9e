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

package com.amazon.anomalyensemble.ensemble;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.List;

import com.amazon.anomalyensemble.config.CombinationRule;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;

/**
 * Merges decision vectors of the same length into one decision per row.
 *
 * <ul>
 * <li>union flags a row flagged by any input; adding inputs only adds
 * flags</li>
 * <li>intersection flags a row flagged by every input; adding inputs only
 * removes flags</li>
 * <li>a weighted vote flags a row when {@code sum(w_k * d_k) >= 0.5}, with
 * {@code d_k} the 0/1 decision of input k</li>
 * </ul>
 *
 * Mismatched lengths, a weight count that differs from the input count, or
 * fewer than two inputs are programming errors and fail immediately.
 */
public class EnsembleCombiner {

    private EnsembleCombiner() {
    }

    public static DecisionVector combine(CombinationRule rule, DecisionVector... inputs) {
        checkNotNull(inputs, "inputs must not be null");
        return combine(rule, Arrays.asList(inputs));
    }

    public static DecisionVector combine(CombinationRule rule, List<DecisionVector> inputs) {
        checkNotNull(rule, "rule must not be null");
        int size = checkInputs(inputs);
        switch (rule.getType()) {
        case UNION:
            return union(inputs, size);
        case INTERSECTION:
            return intersection(inputs, size);
        case WEIGHTED_VOTE:
            return weightedVote(rule.getWeights(), inputs, size);
        default:
            throw new IllegalStateException("unknown combination rule " + rule.getType());
        }
    }

    private static int checkInputs(List<DecisionVector> inputs) {
        checkNotNull(inputs, "inputs must not be null");
        checkArgument(inputs.size() >= 2, "at least two decision vectors are required");
        int size = checkNotNull(inputs.get(0), "inputs must not contain null").size();
        for (DecisionVector input : inputs) {
            checkNotNull(input, "inputs must not contain null");
            checkArgument(input.size() == size,
                    String.format("decision vectors differ in length: %d and %d", size, input.size()));
        }
        return size;
    }

    private static DecisionVector union(List<DecisionVector> inputs, int size) {
        boolean[] result = new boolean[size];
        for (DecisionVector input : inputs) {
            for (int i = 0; i < size; i++) {
                result[i] |= input.isFlagged(i);
            }
        }
        return new DecisionVector(result);
    }

    private static DecisionVector intersection(List<DecisionVector> inputs, int size) {
        boolean[] result = new boolean[size];
        Arrays.fill(result, true);
        for (DecisionVector input : inputs) {
            for (int i = 0; i < size; i++) {
                result[i] &= input.isFlagged(i);
            }
        }
        return new DecisionVector(result);
    }

    private static DecisionVector weightedVote(double[] weights, List<DecisionVector> inputs, int size) {
        checkArgument(weights.length == inputs.size(),
                String.format("%d weights for %d decision vectors", weights.length, inputs.size()));
        boolean[] result = new boolean[size];
        for (int i = 0; i < size; i++) {
            double sum = 0;
            for (int k = 0; k < weights.length; k++) {
                if (inputs.get(k).isFlagged(i)) {
                    sum += weights[k];
                }
            }
            result[i] = sum >= CombinationRule.VOTE_THRESHOLD;
        }
        return new DecisionVector(result);
    }

    /**
     * Weighted sum of continuous scores, row by row. Callers are responsible for
     * putting the inputs on a common scale, see {@link #minMaxNormalize}.
     *
     * @param weights one weight per input
     * @param inputs  score vectors of equal length
     * @return the combined scores
     */
    public static ScoreVector combineScores(double[] weights, List<ScoreVector> inputs) {
        checkNotNull(weights, "weights must not be null");
        checkNotNull(inputs, "inputs must not be null");
        checkArgument(inputs.size() >= 2, "at least two score vectors are required");
        checkArgument(weights.length == inputs.size(),
                String.format("%d weights for %d score vectors", weights.length, inputs.size()));
        int size = inputs.get(0).size();
        double[] result = new double[size];
        for (int k = 0; k < inputs.size(); k++) {
            ScoreVector input = inputs.get(k);
            checkArgument(input.size() == size,
                    String.format("score vectors differ in length: %d and %d", size, input.size()));
            for (int i = 0; i < size; i++) {
                result[i] += weights[k] * input.get(i);
            }
        }
        return new ScoreVector(result);
    }

    /**
     * @param scores raw scores
     * @return scores mapped linearly onto [0, 1]; a constant vector maps to zeros
     */
    public static ScoreVector minMaxNormalize(ScoreVector scores) {
        double[] values = scores.toArray();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            values[i] = range > 0 ? (values[i] - min) / range : 0.0;
        }
        return new ScoreVector(values);
    }
}
