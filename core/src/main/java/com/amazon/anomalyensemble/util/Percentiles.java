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

package com.amazon.anomalyensemble.util;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Percentiles with linear interpolation between order statistics.
 */
public class Percentiles {

    private Percentiles() {
    }

    /**
     * @param values     the sample, not modified
     * @param percentile in [0, 100]
     * @return the {@code percentile}-th percentile of {@code values}
     */
    public static double percentile(double[] values, double percentile) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "values must not be empty");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, percentile);
    }

    /**
     * Same as {@link #percentile(double[], double)} for an already sorted sample,
     * which lets a sweep sort only once.
     *
     * @param sorted     ascending sample
     * @param percentile in [0, 100]
     * @return the interpolated order statistic
     */
    public static double percentileOfSorted(double[] sorted, double percentile) {
        checkArgument(sorted.length > 0, "values must not be empty");
        checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in [0, 100]");
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
