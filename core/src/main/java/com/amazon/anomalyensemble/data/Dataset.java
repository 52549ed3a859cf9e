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

package com.amazon.anomalyensemble.data;

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import com.amazon.anomalyensemble.CommonUtils;
import com.amazon.anomalyensemble.exception.InvalidDatasetException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;

/**
 * The training matrix, test matrix and test labels of one machine. Instances
 * are immutable; matrices are copied on the way in and on the way out.
 */
public final class Dataset {

    private final String id;
    private final double[][] train;
    private final double[][] test;
    private final DecisionVector labels;
    private final int dimensions;

    /**
     * @param id     machine name
     * @param train  training rows
     * @param test   test rows, same column count as {@code train}
     * @param labels one label per test row, true means anomalous
     * @throws InvalidDatasetException if the shapes are inconsistent
     */
    public Dataset(String id, double[][] train, double[][] test, DecisionVector labels) {
        this.id = checkNotNull(id, "id must not be null");
        checkNotNull(train, "train must not be null");
        checkNotNull(test, "test must not be null");
        checkNotNull(labels, "labels must not be null");

        int trainColumns = columns(id, "training", train);
        int testColumns = columns(id, "test", test);
        if (trainColumns != testColumns) {
            throw new InvalidDatasetException(id, String.format(
                    "training matrix has %d columns but test matrix has %d", trainColumns, testColumns));
        }
        if (labels.size() != test.length) {
            throw new InvalidDatasetException(id,
                    String.format("%d labels for %d test rows", labels.size(), test.length));
        }

        this.train = CommonUtils.copyOf(train);
        this.test = CommonUtils.copyOf(test);
        this.labels = labels;
        this.dimensions = trainColumns;
    }

    private static int columns(String id, String name, double[][] matrix) {
        try {
            int columns = CommonUtils.columnCount(matrix);
            CommonUtils.checkFinite(matrix, "values must be finite");
            return columns;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidDatasetException(id, name + " matrix is malformed: " + e.getMessage(), e);
        }
    }

    public String getId() {
        return id;
    }

    public double[][] getTrain() {
        return CommonUtils.copyOf(train);
    }

    public double[][] getTest() {
        return CommonUtils.copyOf(test);
    }

    public DecisionVector getLabels() {
        return labels;
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getTrainSize() {
        return train.length;
    }

    public int getTestSize() {
        return test.length;
    }

    /**
     * @param trainRows replacement training rows
     * @param testRows  replacement test rows
     * @return a dataset with the same id and labels but different features, as
     *         produced by a scaler
     */
    public Dataset withFeatures(double[][] trainRows, double[][] testRows) {
        return new Dataset(id, trainRows, testRows, labels);
    }

    @Override
    public String toString() {
        return String.format("Dataset(%s, train=%dx%d, test=%dx%d, anomalies=%d)", id, train.length, dimensions,
                test.length, dimensions, labels.count());
    }
}
