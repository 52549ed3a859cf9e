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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class PercentilesTest {

    private static final double[] SCORES = { 5.0, 0.1, 0.95, 0.2, 0.9 };

    @ParameterizedTest
    @CsvSource({ "0,0.1", "25,0.2", "50,0.9", "75,0.95", "80,1.76", "90,3.38", "100,5.0" })
    public void testLinearInterpolation(double percentile, double expected) {
        assertEquals(expected, Percentiles.percentile(SCORES, percentile), 1e-9);
    }

    @Test
    public void testInputIsNotModified() {
        double[] copy = SCORES.clone();
        Percentiles.percentile(copy, 50);
        assertArrayEquals(SCORES, copy);
    }

    @Test
    public void testSingleValue() {
        assertEquals(3.0, Percentiles.percentile(new double[] { 3.0 }, 95), 0.0);
    }

    @Test
    public void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Percentiles.percentile(new double[0], 50));
        assertThrows(IllegalArgumentException.class, () -> Percentiles.percentile(SCORES, -1));
        assertThrows(IllegalArgumentException.class, () -> Percentiles.percentile(SCORES, 101));
        assertThrows(NullPointerException.class, () -> Percentiles.percentile(null, 50));
    }
}
