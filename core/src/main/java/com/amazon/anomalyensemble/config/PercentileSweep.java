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

package com.amazon.anomalyensemble.config;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * The ordered list of percentiles scanned when calibrating a threshold. The
 * default is 80 (inclusive) to 100 (exclusive) in steps of 2.
 */
public final class PercentileSweep {

    public static final double DEFAULT_LOWER = 80;
    public static final double DEFAULT_UPPER = 100;
    public static final double DEFAULT_STEP = 2;

    private final double[] percentiles;

    private PercentileSweep(double[] percentiles) {
        checkArgument(percentiles.length > 0, "a sweep needs at least one percentile");
        for (int i = 0; i < percentiles.length; i++) {
            checkArgument(percentiles[i] >= 0 && percentiles[i] < 100, "percentiles must be in [0, 100)");
            checkArgument(i == 0 || percentiles[i] > percentiles[i - 1], "percentiles must be strictly ascending");
        }
        this.percentiles = percentiles;
    }

    public static PercentileSweep defaultSweep() {
        return range(DEFAULT_LOWER, DEFAULT_UPPER, DEFAULT_STEP);
    }

    /**
     * @param lower          first percentile, inclusive
     * @param upperExclusive end of the range, exclusive, at most 100
     * @param step           positive increment
     * @return the sweep {lower, lower + step, ...} below {@code upperExclusive}
     */
    public static PercentileSweep range(double lower, double upperExclusive, double step) {
        checkArgument(step > 0, "step must be positive");
        checkArgument(lower >= 0 && lower < upperExclusive, "lower must be in [0, upper)");
        checkArgument(upperExclusive <= 100, "upper must be at most 100");
        int count = (int) Math.ceil((upperExclusive - lower) / step);
        double[] values = new double[count];
        int size = 0;
        for (int i = 0; i < count; i++) {
            double value = lower + i * step;
            if (value < upperExclusive) {
                values[size++] = value;
            }
        }
        return new PercentileSweep(Arrays.copyOf(values, size));
    }

    /**
     * @param percentiles explicit strictly ascending percentiles in [0, 100)
     * @return the sweep over exactly these values
     */
    public static PercentileSweep of(double... percentiles) {
        checkNotNull(percentiles, "percentiles must not be null");
        return new PercentileSweep(Arrays.copyOf(percentiles, percentiles.length));
    }

    public double[] getPercentiles() {
        return Arrays.copyOf(percentiles, percentiles.length);
    }

    public int size() {
        return percentiles.length;
    }

    @Override
    public String toString() {
        return Arrays.toString(percentiles);
    }
}
