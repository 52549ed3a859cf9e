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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.returntypes.MetricRecord;
import com.amazon.anomalyensemble.returntypes.MetricsTable;

public class EvaluationReportTest {

    @Test
    public void testReportIsNotChangedByItsInputsOrGetters() {
        MetricsTable table = new MetricsTable();
        table.add(new MetricRecord("m1", "union", 1.0, 0.5, 2.0 / 3));
        Map<String, String> failures = new HashMap<>();
        EvaluationReport report = new EvaluationReport(table, Collections.emptyMap(), failures);

        table.add(new MetricRecord("m2", "union", 0.0, 0.0, 0.0));
        failures.put("m3", "IOException: missing");
        report.getTable().add(new MetricRecord("m4", "union", 1.0, 1.0, 1.0));

        assertEquals(1, report.getTable().size());
        assertEquals(Map.of("union", 2.0 / 3), report.meanF1());
        assertFalse(report.hasFailures());
        assertThrows(UnsupportedOperationException.class, () -> report.getFailures().put("m5", "x"));
    }
}
