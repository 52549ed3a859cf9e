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

package com.amazon.anomalyensemble.detector;

import com.amazon.anomalyensemble.returntypes.ScoreVector;

/**
 * A detector that emits one real valued anomaly score per row, higher meaning
 * more anomalous.
 */
public interface IScoringDetector {

    /**
     * @param train training rows
     * @throws com.amazon.anomalyensemble.exception.DetectorFitException if the
     *                                                                   detector
     *                                                                   cannot be
     *                                                                   fitted
     */
    void fit(double[][] train);

    /**
     * Scores rows without changing the fitted state.
     *
     * @param rows rows with the training column count
     * @return one score per row
     * @throws IllegalStateException if called before {@link #fit}
     */
    ScoreVector score(double[][] rows);
}
