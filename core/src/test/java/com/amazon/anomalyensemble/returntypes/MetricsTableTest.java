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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class MetricsTableTest {

    private MetricsTable table;

    @BeforeEach
    public void setUp() {
        table = new MetricsTable();
        table.addAll(Arrays.asList(new MetricRecord("m1", "union", 0.5, 1.0, 0.6),
                new MetricRecord("m1", "isolation", 1.0, 0.5, 0.8),
                new MetricRecord("m2", "union", 0.25, 0.5, 0.2),
                new MetricRecord("m2", "isolation", 0.0, 0.0, 0.0)));
    }

    @Test
    public void testInsertionOrder() {
        assertEquals(4, table.size());
        assertThat(table.getDatasetIds(), contains("m1", "m2"));
        assertThat(table.getStrategies(), contains("union", "isolation"));
        assertThat(table.getRecords("m2"), hasSize(2));
        assertEquals("isolation", table.getRecords().get(1).getStrategy());
    }

    @Test
    public void testLookup() {
        assertEquals(0.8, table.get("m1", "isolation").get().getF1());
        assertFalse(table.get("m3", "isolation").isPresent());
        assertFalse(table.get("m1", "intersection").isPresent());
    }

    @Test
    public void testMeans() {
        Map<String, Double> f1 = table.meanF1();
        assertThat(f1.keySet(), contains("union", "isolation"));
        assertEquals(0.4, f1.get("union"), 1e-12);
        assertEquals(0.4, f1.get("isolation"), 1e-12);
        assertEquals(0.375, table.meanPrecision().get("union"), 1e-12);
        assertEquals(0.25, table.meanRecall().get("isolation"), 1e-12);
    }

    @Test
    public void testBestStrategyKeepsFirstOnTie() {
        assertEquals("union", table.bestStrategy().get());
        table.add(new MetricRecord("m1", "intersection", new ClassificationMetrics(1.0, 1.0, 1.0)));
        assertEquals("intersection", table.bestStrategy().get());
        assertFalse(new MetricsTable().bestStrategy().isPresent());
    }

    @Test
    public void testDuplicateRowRejected() {
        assertThrows(IllegalStateException.class, () -> table.add(new MetricRecord("m1", "union", 0, 0, 0)));
        assertEquals(4, table.size());
    }

    @Test
    public void testRecordsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> table.getRecords().clear());
        assertTrue(new MetricsTable().isEmpty());
    }
}
