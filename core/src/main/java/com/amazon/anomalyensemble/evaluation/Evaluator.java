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

package com.amazon.anomalyensemble.evaluation;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import com.amazon.anomalyensemble.returntypes.ClassificationMetrics;
import com.amazon.anomalyensemble.returntypes.ConfusionMatrix;
import com.amazon.anomalyensemble.returntypes.DecisionVector;

/**
 * Scores a decision vector against ground truth.
 *
 * precision = TP / (TP + FP), recall = TP / (TP + FN) and F1 is their harmonic
 * mean. Any of the three whose denominator is zero is 0.0; in particular a
 * truth vector without positives yields 0.0 for all three. Nothing is thrown
 * or logged for these cases.
 */
public class Evaluator {

    private Evaluator() {
    }

    public static ConfusionMatrix confusion(DecisionVector predicted, DecisionVector truth) {
        checkNotNull(predicted, "predicted must not be null");
        checkNotNull(truth, "truth must not be null");
        checkArgument(predicted.size() == truth.size(), String.format(
                "prediction has %d rows but ground truth has %d", predicted.size(), truth.size()));
        int tp = 0;
        int fp = 0;
        int fn = 0;
        int tn = 0;
        for (int i = 0; i < truth.size(); i++) {
            boolean flagged = predicted.isFlagged(i);
            if (truth.isFlagged(i)) {
                if (flagged) {
                    ++tp;
                } else {
                    ++fn;
                }
            } else if (flagged) {
                ++fp;
            } else {
                ++tn;
            }
        }
        return new ConfusionMatrix(tp, fp, fn, tn);
    }

    public static ClassificationMetrics evaluate(DecisionVector predicted, DecisionVector truth) {
        return ClassificationMetrics.from(confusion(predicted, truth));
    }
}
