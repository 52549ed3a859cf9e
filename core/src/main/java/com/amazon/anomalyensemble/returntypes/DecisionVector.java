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

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * An immutable flagged / not flagged decision per test row. Used both for
 * detector output and for ground truth labels.
 */
public final class DecisionVector {

    private final boolean[] flags;

    public DecisionVector(boolean[] flags) {
        checkNotNull(flags, "flags must not be null");
        this.flags = Arrays.copyOf(flags, flags.length);
    }

    /**
     * Builds a decision vector from 0/1 values. Any value other than 0 or 1 is
     * rejected.
     *
     * @param values 0/1 per row
     * @return the corresponding decision vector
     */
    public static DecisionVector of(int... values) {
        checkNotNull(values, "values must not be null");
        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            checkArgument(values[i] == 0 || values[i] == 1, "decision values must be 0 or 1");
            flags[i] = values[i] == 1;
        }
        return new DecisionVector(flags);
    }

    public static DecisionVector none(int size) {
        return new DecisionVector(new boolean[size]);
    }

    public int size() {
        return flags.length;
    }

    public boolean isFlagged(int index) {
        return flags[index];
    }

    /**
     * @return number of flagged rows
     */
    public int count() {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                ++count;
            }
        }
        return count;
    }

    /**
     * @return the indices of the flagged rows in ascending order
     */
    public int[] flaggedIndices() {
        int[] result = new int[count()];
        int position = 0;
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) {
                result[position++] = i;
            }
        }
        return result;
    }

    public boolean[] toArray() {
        return Arrays.copyOf(flags, flags.length);
    }

    public int[] toIntArray() {
        int[] result = new int[flags.length];
        for (int i = 0; i < flags.length; i++) {
            result[i] = flags[i] ? 1 : 0;
        }
        return result;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DecisionVector)) {
            return false;
        }
        return Arrays.equals(flags, ((DecisionVector) other).flags);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(flags);
    }

    @Override
    public String toString() {
        return Arrays.toString(toIntArray());
    }
}
