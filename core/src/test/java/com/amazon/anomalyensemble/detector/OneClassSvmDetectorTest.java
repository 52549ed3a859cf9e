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

package com.amazon.anomalyensemble.detector;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.exception.DetectorFitException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;
import com.amazon.anomalyensemble.testutils.SyntheticMachineData;

public class OneClassSvmDetectorTest {

    private static double[][] train;

    @BeforeAll
    public static void generateTrainingRows() {
        train = new SyntheticMachineData().generateNormalRows(400, 2, 23L);
    }

    @Test
    public void testDefaults() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().build();
        assertEquals(0.05, detector.getNu());
        assertEquals(1e-3, detector.getTolerance());
        assertEquals(256, detector.getCachedColumns());
    }

    @Test
    public void testTwoPointSolution() {
        // the optimum splits the weight evenly and rho is the common gradient 0.5 + 0.5 * K(0, 1)
        OneClassSvmDetector detector = OneClassSvmDetector.builder().nu(0.5).gamma(1.0).build();
        detector.fit(new double[][] { { 0 }, { 1 } });

        assertEquals(2, detector.getSupportVectorCount());
        double k = Math.exp(-1);
        ScoreVector scores = detector.score(new double[][] { { 0.5 }, { 0 }, { 3 } });
        assertEquals(-(Math.exp(-0.25) - 0.5 - 0.5 * k), scores.get(0), 1e-9);
        assertEquals(0.0, scores.get(1), 1e-9);
        assertEquals(0.5 + 0.5 * k - 0.5 * Math.exp(-9) - 0.5 * Math.exp(-4), scores.get(2), 1e-9);
        assertEquals(DecisionVector.of(0, 0, 1), detector.decide(new double[][] { { 0.5 }, { 0.25 }, { 3 } }));
    }

    @Test
    public void testNuBoundsTrainingOutliers() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().build();
        detector.fit(train);

        // the weights sum to nu * l with each weight at most 1
        assertTrue(detector.getSupportVectorCount() >= 20, "support vectors " + detector.getSupportVectorCount());
        int flagged = detector.decide(train).count();
        assertTrue(flagged <= 24, "flagged " + flagged);
    }

    @Test
    public void testFarPointIsFlagged() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().build();
        detector.fit(train);
        DecisionVector decisions = detector.decide(new double[][] { { 10, 10 }, { 0, 0 } });
        assertTrue(decisions.isFlagged(0));
        assertFalse(decisions.isFlagged(1));
    }

    @Test
    public void testScaleGamma() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().build();
        detector.fit(new double[][] { { 1, 3 }, { 1, 3 }, { 3, 1 } });
        // six values with mean 2 and variance 1 over two columns
        assertEquals(0.5, detector.getFittedGamma(), 1e-12);

        OneClassSvmDetector constant = OneClassSvmDetector.builder().build();
        constant.fit(new double[][] { { 4, 4 }, { 4, 4 } });
        assertEquals(1.0, constant.getFittedGamma());
    }

    @Test
    public void testScoringDoesNotChangeModel() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().cachedColumns(8).build();
        detector.fit(train);
        double[][] rows = { { 1, 1 }, { -3, 2 }, { 6, 6 } };
        assertArrayEquals(detector.score(rows).toArray(), detector.score(rows).toArray());
    }

    @Test
    public void testInvalidUse() {
        assertThrows(IllegalArgumentException.class, () -> OneClassSvmDetector.builder().nu(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> OneClassSvmDetector.builder().nu(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> OneClassSvmDetector.builder().gamma(-1.0).build());
        assertThrows(IllegalStateException.class, () -> OneClassSvmDetector.builder().build().decide(train));
        assertThrows(DetectorFitException.class, () -> OneClassSvmDetector.builder().build().fit(new double[0][]));

        OneClassSvmDetector detector = OneClassSvmDetector.builder().build();
        detector.fit(train);
        assertThrows(IllegalArgumentException.class, () -> detector.score(new double[][] { { 1, 2, 3 } }));
    }
}
