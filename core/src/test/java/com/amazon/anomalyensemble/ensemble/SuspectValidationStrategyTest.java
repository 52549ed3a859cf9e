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

package com.amazon.anomalyensemble.ensemble;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.detector.ColumnLimitDetector;
import com.amazon.anomalyensemble.detector.ColumnScoringDetector;
import com.amazon.anomalyensemble.exception.DetectorFitException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;

public class SuspectValidationStrategyTest {

    private ColumnLimitDetector isolation;
    private ColumnScoringDetector reconstruction;
    private double[][] train;

    @BeforeEach
    public void setUp() {
        isolation = new ColumnLimitDetector(0, 5);
        reconstruction = new ColumnScoringDetector(1);
        train = new double[10][];
        for (int i = 0; i < train.length; i++) {
            train[i] = new double[] { i, i };
        }
    }

    @Test
    public void testConfirmsOnlyHighErrorSuspects() {
        SuspectValidationStrategy strategy = new SuspectValidationStrategy(() -> isolation, () -> reconstruction);
        double[][] test = { { 9, 10 }, { 9, 1 }, { 0, 10 }, { 0, 0 } };

        SuspectValidationResult result = strategy.validate(train, test);

        assertEquals(DecisionVector.of(1, 1, 0, 0), result.getSuspects());
        assertEquals(DecisionVector.of(1, 0, 0, 0), result.getConfirmed());
        // errors of the normal rows are 0..5, the 95th percentile interpolates to 4.75
        assertEquals(4.75, result.getThreshold(), 1e-12);
        assertEquals(6, result.getNormalTrainingRows());
        assertArrayEquals(new double[] { 10, 1, 10, 0 }, result.getErrors().toArray());
    }

    @Test
    public void testReconstructionFittedOnNormalTrainingRowsOnly() {
        new SuspectValidationStrategy(() -> isolation, () -> reconstruction).validate(train, train);

        assertEquals(1, isolation.getFitted().size());
        assertEquals(10, isolation.getFitted().get(0).length);
        assertEquals(1, reconstruction.getFitted().size());
        double[][] normal = reconstruction.getFitted().get(0);
        assertEquals(6, normal.length);
        for (double[] row : normal) {
            assertTrue(row[0] <= 5);
        }
    }

    @Test
    public void testConfirmedIsSubsetOfSuspects() {
        SuspectValidationStrategy strategy = new SuspectValidationStrategy(() -> isolation, () -> reconstruction, 0);
        double[][] test = { { 9, 10 }, { 9, 1 }, { 0, 10 }, { 6, 0 }, { 3, 3 } };

        SuspectValidationResult result = strategy.validate(train, test);

        assertEquals(0.0, result.getThreshold());
        for (int i = 0; i < test.length; i++) {
            if (result.getConfirmed().isFlagged(i)) {
                assertTrue(result.getSuspects().isFlagged(i));
            }
        }
        assertEquals(DecisionVector.of(1, 1, 0, 0, 0), result.getConfirmed());
    }

    @Test
    public void testLowerPercentileConfirmsMore() {
        double[][] test = { { 9, 3 }, { 9, 5 } };
        DecisionVector strict = new SuspectValidationStrategy(() -> isolation, () -> reconstruction).decide(train,
                test);
        DecisionVector loose = new SuspectValidationStrategy(() -> new ColumnLimitDetector(0, 5),
                () -> new ColumnScoringDetector(1), 50).decide(train, test);
        assertEquals(DecisionVector.of(0, 1), strict);
        assertEquals(DecisionVector.of(1, 1), loose);
    }

    @Test
    public void testEveryTrainingRowSuspect() {
        SuspectValidationStrategy strategy = new SuspectValidationStrategy(() -> new ColumnLimitDetector(0, -1),
                () -> reconstruction);
        assertThrows(DetectorFitException.class, () -> strategy.validate(train, train));
    }

    @Test
    public void testInvalidPercentile() {
        assertThrows(IllegalArgumentException.class,
                () -> new SuspectValidationStrategy(() -> isolation, () -> reconstruction, 100));
        assertThrows(NullPointerException.class, () -> new SuspectValidationStrategy(null, () -> reconstruction));
    }
}
