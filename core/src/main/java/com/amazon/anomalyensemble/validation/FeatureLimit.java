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

package com.amazon.anomalyensemble.validation;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import lombok.Getter;

/**
 * An operational limit on one feature column, e.g. cpu above 90.
 */
@Getter
public final class FeatureLimit {

    private final String name;
    private final int column;
    private final double limit;

    public FeatureLimit(String name, int column, double limit) {
        this.name = checkNotNull(name, "name must not be null");
        checkArgument(column >= 0, "column must be non-negative");
        checkArgument(!Double.isNaN(limit), "limit must be a number");
        this.column = column;
        this.limit = limit;
    }

    /**
     * @param row a feature row
     * @return true if the value of this column is strictly above the limit
     */
    public boolean isExceededBy(double[] row) {
        checkArgument(column < row.length, String.format("row has no column %d", column));
        return row[column] > limit;
    }

    @Override
    public String toString() {
        return name + " > " + limit;
    }
}
