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

import lombok.Getter;

import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;

/**
 * Outcome of a suspect validation pass over a set of rows.
 */
@Getter
public final class SuspectValidationResult {

    /** rows the isolation detector flagged */
    private final DecisionVector suspects;

    /** suspects whose reconstruction error exceeds the validation threshold */
    private final DecisionVector confirmed;

    /** reconstruction error of every row */
    private final ScoreVector errors;

    /** reconstruction error cut derived from the rows judged normal */
    private final double threshold;

    /** number of training rows the auto-encoder was trained on */
    private final int normalTrainingRows;

    public SuspectValidationResult(DecisionVector suspects, DecisionVector confirmed, ScoreVector errors,
            double threshold, int normalTrainingRows) {
        this.suspects = suspects;
        this.confirmed = confirmed;
        this.errors = errors;
        this.threshold = threshold;
        this.normalTrainingRows = normalTrainingRows;
    }
}
