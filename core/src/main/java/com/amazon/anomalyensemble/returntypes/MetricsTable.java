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
import static com.amazon.anomalyensemble.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Append-only table of {@link MetricRecord}s keyed by (dataset id, strategy).
 * Rows keep insertion order. The table is not thread safe; concurrent producers
 * must hand their rows to a single writer.
 */
public class MetricsTable {

    private final Map<Key, MetricRecord> records = new LinkedHashMap<>();

    /**
     * Appends a row.
     *
     * @param record the row to add
     * @throws IllegalStateException if a row for the same dataset and strategy
     *                               already exists
     */
    public void add(MetricRecord record) {
        checkNotNull(record, "record must not be null");
        Key key = new Key(record.getDatasetId(), record.getStrategy());
        checkState(!records.containsKey(key),
                String.format("duplicate row for dataset %s and strategy %s", key.datasetId, key.strategy));
        records.put(key, record);
    }

    public void addAll(Iterable<MetricRecord> rows) {
        for (MetricRecord row : rows) {
            add(row);
        }
    }

    /**
     * @return an independent table holding the same rows in the same order
     */
    public MetricsTable copy() {
        MetricsTable copy = new MetricsTable();
        copy.records.putAll(records);
        return copy;
    }

    public Optional<MetricRecord> get(String datasetId, String strategy) {
        return Optional.ofNullable(records.get(new Key(datasetId, strategy)));
    }

    public List<MetricRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    public List<MetricRecord> getRecords(String datasetId) {
        List<MetricRecord> result = new ArrayList<>();
        for (MetricRecord record : records.values()) {
            if (record.getDatasetId().equals(datasetId)) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * @return dataset ids in the order their first row was added
     */
    public List<String> getDatasetIds() {
        Set<String> ids = new LinkedHashSet<>();
        records.keySet().forEach(k -> ids.add(k.datasetId));
        return new ArrayList<>(ids);
    }

    /**
     * @return strategy names in the order their first row was added
     */
    public List<String> getStrategies() {
        Set<String> names = new LinkedHashSet<>();
        records.keySet().forEach(k -> names.add(k.strategy));
        return new ArrayList<>(names);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Mean F1 per strategy over the datasets that have a row for it. This is the
     * headline number used to compare strategies.
     *
     * @return strategy name to mean F1, in strategy order
     */
    public Map<String, Double> meanF1() {
        return mean(MetricRecord::getF1);
    }

    public Map<String, Double> meanPrecision() {
        return mean(MetricRecord::getPrecision);
    }

    public Map<String, Double> meanRecall() {
        return mean(MetricRecord::getRecall);
    }

    /**
     * @return the strategy with the highest mean F1; the first one listed wins
     *         ties
     */
    public Optional<String> bestStrategy() {
        String best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : meanF1().entrySet()) {
            if (entry.getValue() > bestValue) {
                best = entry.getKey();
                bestValue = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private Map<String, Double> mean(ToDoubleFunction<MetricRecord> column) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (MetricRecord record : records.values()) {
            double[] sum = sums.computeIfAbsent(record.getStrategy(), s -> new double[2]);
            sum[0] += column.applyAsDouble(record);
            sum[1] += 1;
        }
        Map<String, Double> result = new LinkedHashMap<>();
        sums.forEach((strategy, sum) -> result.put(strategy, sum[0] / sum[1]));
        return result;
    }

    private static final class Key {
        private final String datasetId;
        private final String strategy;

        Key(String datasetId, String strategy) {
            this.datasetId = datasetId;
            this.strategy = strategy;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Key)) {
                return false;
            }
            Key key = (Key) other;
            return datasetId.equals(key.datasetId) && strategy.equals(key.strategy);
        }

        @Override
        public int hashCode() {
            return Objects.hash(datasetId, strategy);
        }
    }
}
