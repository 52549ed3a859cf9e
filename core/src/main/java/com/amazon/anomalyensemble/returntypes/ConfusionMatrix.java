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

import lombok.Getter;

/**
 * Counts of a binary decision against ground truth.
 */
@Getter
public final class ConfusionMatrix {

    private final int truePositives;
    private final int falsePositives;
    private final int falseNegatives;
    private final int trueNegatives;

    public ConfusionMatrix(int truePositives, int falsePositives, int falseNegatives, int trueNegatives) {
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.falseNegatives = falseNegatives;
        this.trueNegatives = trueNegatives;
    }

    public int getTotal() {
        return truePositives + falsePositives + falseNegatives + trueNegatives;
    }

    @Override
    public String toString() {
        return String.format("tp=%d fp=%d fn=%d tn=%d", truePositives, falsePositives, falseNegatives,
                trueNegatives);
    }
}
