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

package com.amazon.anomalyensemble.runner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.anomalyensemble.returntypes.MetricsTable;
import com.amazon.anomalyensemble.returntypes.ThresholdCandidate;

/**
 * Result of a multi dataset run: the metrics table, the reconstruction
 * threshold chosen per dataset, and the datasets that were skipped together
 * with the reason.
 */
@Getter
public class EvaluationReport {

    @Getter(AccessLevel.NONE)
    private final MetricsTable table;
    private final Map<String, ThresholdCandidate> thresholds;
    private final Map<String, String> failures;

    public EvaluationReport(MetricsTable table, Map<String, ThresholdCandidate> thresholds,
            Map<String, String> failures) {
        this.table = table.copy();
        this.thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * @return a copy of the metrics table; changes to it do not affect this
     *         report
     */
    public MetricsTable getTable() {
        return table.copy();
    }

    public Map<String, Double> meanF1() {
        return table.meanF1();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
