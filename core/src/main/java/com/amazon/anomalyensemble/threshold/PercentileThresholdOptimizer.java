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

package com.amazon.anomalyensemble.threshold;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.config.PercentileSweep;
import com.amazon.anomalyensemble.evaluation.Evaluator;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;
import com.amazon.anomalyensemble.returntypes.ThresholdCandidate;
import com.amazon.anomalyensemble.util.Percentiles;

/**
 * Turns continuous anomaly scores into decisions by scanning a
 * {@link PercentileSweep}. For each percentile p the threshold is the p-th
 * percentile of the scores and a row is flagged iff its score is strictly above
 * the threshold. The candidate with the highest F1 against the labels wins; on
 * ties the lowest percentile wins.
 */
public class PercentileThresholdOptimizer {

    private static final Logger LOG = LogManager.getLogger(PercentileThresholdOptimizer.class);

    private final PercentileSweep sweep;

    public PercentileThresholdOptimizer() {
        this(PercentileSweep.defaultSweep());
    }

    public PercentileThresholdOptimizer(PercentileSweep sweep) {
        this.sweep = checkNotNull(sweep, "sweep must not be null");
    }

    public PercentileSweep getSweep() {
        return sweep;
    }

    /**
     * Evaluates every percentile of the sweep, in ascending order.
     *
     * @param scores one score per row
     * @param truth  one label per row
     * @return one candidate per percentile
     */
    public List<ThresholdCandidate> sweep(ScoreVector scores, DecisionVector truth) {
        checkNotNull(scores, "scores must not be null");
        checkNotNull(truth, "truth must not be null");
        checkArgument(scores.size() > 0, "scores must not be empty");
        checkArgument(scores.size() == truth.size(),
                String.format("%d scores for %d labels", scores.size(), truth.size()));

        double[] sorted = scores.toArray();
        Arrays.sort(sorted);
        List<ThresholdCandidate> candidates = new ArrayList<>(sweep.size());
        for (double percentile : sweep.getPercentiles()) {
            double threshold = Percentiles.percentileOfSorted(sorted, percentile);
            DecisionVector decisions = scores.above(threshold);
            ThresholdCandidate candidate = new ThresholdCandidate(percentile, threshold,
                    Evaluator.evaluate(decisions, truth), decisions);
            LOG.debug("candidate {}", candidate);
            candidates.add(candidate);
        }
        return candidates;
    }

    /**
     * @param scores one score per row
     * @param truth  one label per row
     * @return the candidate with maximum F1, the earliest one on ties
     */
    public ThresholdCandidate optimize(ScoreVector scores, DecisionVector truth) {
        return best(sweep(scores, truth));
    }

    /**
     * Max-by-F1 fold over candidates in the given order. A later candidate only
     * replaces the current best when its F1 is strictly greater.
     *
     * @param candidates non-empty, in sweep order
     * @return the winning candidate
     */
    static ThresholdCandidate best(List<ThresholdCandidate> candidates) {
        checkArgument(!candidates.isEmpty(), "no candidates");
        ThresholdCandidate best = candidates.get(0);
        for (ThresholdCandidate candidate : candidates.subList(1, candidates.size())) {
            if (candidate.getF1() > best.getF1()) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Binarizes scores at a fixed percentile, without labels. This is how a
     * percentile selected offline is applied when no ground truth is available.
     *
     * @param scores     one score per row
     * @param percentile in [0, 100)
     * @return rows whose score is strictly above the percentile value
     */
    public static DecisionVector decide(ScoreVector scores, double percentile) {
        checkNotNull(scores, "scores must not be null");
        checkArgument(percentile >= 0 && percentile < 100, "percentile must be in [0, 100)");
        return scores.above(Percentiles.percentile(scores.toArray(), percentile));
    }
}
