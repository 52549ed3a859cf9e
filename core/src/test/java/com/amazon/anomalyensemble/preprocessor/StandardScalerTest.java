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

package com.amazon.anomalyensemble.preprocessor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class StandardScalerTest {

    @Test
    public void testFitAndTransform() {
        StandardScaler scaler = new StandardScaler();
        scaler.fit(new double[][] { { 1, 10 }, { 3, 10 } });
        assertArrayEquals(new double[] { 2, 10 }, scaler.getMean(), 1e-12);
        // a constant column keeps unit scale
        assertArrayEquals(new double[] { 1, 1 }, scaler.getScale(), 1e-12);

        double[][] transformed = scaler.transform(new double[][] { { 1, 10 }, { 5, 12 } });
        assertArrayEquals(new double[] { -1, 0 }, transformed[0], 1e-12);
        assertArrayEquals(new double[] { 3, 2 }, transformed[1], 1e-12);
    }

    @Test
    public void testTrainingRowsHaveZeroMeanUnitVariance() {
        double[][] train = { { 1 }, { 2 }, { 3 }, { 4 }, { 10 } };
        StandardScaler scaler = new StandardScaler();
        scaler.fit(train);
        double[][] transformed = scaler.transform(train);
        double sum = 0;
        double squares = 0;
        for (double[] row : transformed) {
            sum += row[0];
            squares += row[0] * row[0];
        }
        assertEquals(0, sum / train.length, 1e-12);
        assertEquals(1, squares / train.length, 1e-12);
    }

    @Test
    public void testInvalidUse() {
        StandardScaler scaler = new StandardScaler();
        assertThrows(IllegalStateException.class, () -> scaler.transform(new double[][] { { 1 } }));
        scaler.fit(new double[][] { { 1, 2 } });
        assertThrows(IllegalArgumentException.class, () -> scaler.transform(new double[][] { { 1 } }));
    }
}
