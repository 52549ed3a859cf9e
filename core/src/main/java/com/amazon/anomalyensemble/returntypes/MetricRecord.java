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

import lombok.Getter;

/**
 * Precision, recall and F1 of one strategy on one dataset.
 */
@Getter
public final class MetricRecord {

    private final String datasetId;
    private final String strategy;
    private final double precision;
    private final double recall;
    private final double f1;

    public MetricRecord(String datasetId, String strategy, double precision, double recall, double f1) {
        this.datasetId = checkNotNull(datasetId, "datasetId must not be null");
        this.strategy = checkNotNull(strategy, "strategy must not be null");
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
    }

    public MetricRecord(String datasetId, String strategy, ClassificationMetrics metrics) {
        this(datasetId, strategy, metrics.getPrecision(), metrics.getRecall(), metrics.getF1());
    }

    @Override
    public String toString() {
        return String.format("%s %s precision=%.3f recall=%.3f f1=%.3f", datasetId, strategy, precision, recall,
                f1);
    }
}
