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

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import lombok.Getter;

/**
 * One point of a percentile sweep: the percentile, the score value it maps to,
 * the decision obtained by flagging scores strictly above that value, and how
 * that decision scores against ground truth.
 */
@Getter
public final class ThresholdCandidate {

    private final double percentile;
    private final double threshold;
    private final ClassificationMetrics metrics;
    private final DecisionVector decisions;

    public ThresholdCandidate(double percentile, double threshold, ClassificationMetrics metrics,
            DecisionVector decisions) {
        checkArgument(percentile >= 0 && percentile < 100, "percentile must be in [0, 100)");
        this.percentile = percentile;
        this.threshold = threshold;
        this.metrics = checkNotNull(metrics, "metrics must not be null");
        this.decisions = checkNotNull(decisions, "decisions must not be null");
    }

    public double getF1() {
        return metrics.getF1();
    }

    @Override
    public String toString() {
        return String.format("p=%.1f threshold=%.6f %s", percentile, threshold, metrics);
    }
}
