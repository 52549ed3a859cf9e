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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.anomalyensemble.exception.DetectorFitException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.testutils.SyntheticMachineData;

public class RandomCutForestDetectorTest {

    private static double[][] train;

    @BeforeAll
    public static void generateTrainingRows() {
        train = new SyntheticMachineData().generateNormalRows(500, 3, 17L);
    }

    private static RandomCutForestDetector newDetector() {
        return RandomCutForestDetector.builder().numberOfTrees(50).sampleSize(128).randomSeed(42L).build();
    }

    @Test
    public void testDefaults() {
        RandomCutForestDetector detector = RandomCutForestDetector.builder().build();
        assertEquals(0.05, detector.getContamination());
        assertEquals(100, detector.getNumberOfTrees());
        assertEquals(256, detector.getSampleSize());
        assertEquals(42L, detector.getRandomSeed());
    }

    @ParameterizedTest
    @ValueSource(ints = { 200, 1000 })
    public void testContaminationBoundsHeldOutFlagRate(int trainingRows) {
        SyntheticMachineData data = new SyntheticMachineData();
        RandomCutForestDetector detector = RandomCutForestDetector.builder().build();
        detector.fit(data.generateNormalRows(trainingRows, 3, 5L));

        double[][] heldOut = data.generateNormalRows(3000, 3, 6L);
        double rate = detector.decide(heldOut).count() / (double) heldOut.length;
        // rows from the training distribution are flagged at about the contamination rate
        assertTrue(rate >= 0.02 && rate <= 0.09, "held out flag rate " + rate);
    }

    @Test
    public void testFarPointIsFlagged() {
        RandomCutForestDetector detector = newDetector();
        detector.fit(train);
        DecisionVector decisions = detector.decide(new double[][] { { 20, 20, 20 }, { 0, 0, 0 } });
        assertTrue(decisions.isFlagged(0));
        assertFalse(decisions.isFlagged(1));
        assertTrue(detector.score(new double[][] { { 20, 20, 20 } }).get(0) > detector.getCut());
    }

    @Test
    public void testScoringDoesNotChangeModel() {
        RandomCutForestDetector detector = newDetector();
        detector.fit(train);
        double[][] rows = { { 1, 1, 1 }, { -3, 0, 2 }, { 8, 8, 8 } };
        assertArrayEquals(detector.score(rows).toArray(), detector.score(rows).toArray());
    }

    @Test
    public void testFittedForestIsNotExposed() {
        assertThrows(NoSuchMethodException.class, () -> RandomCutForestDetector.class.getMethod("getForest"));
    }

    @Test
    public void testSameSeedSameDecisions() {
        RandomCutForestDetector first = newDetector();
        RandomCutForestDetector second = newDetector();
        first.fit(train);
        second.fit(train);
        assertEquals(first.getCut(), second.getCut());
        assertEquals(first.decide(train), second.decide(train));
    }

    @Test
    public void testTooFewTrainingRows() {
        assertThrows(DetectorFitException.class,
                () -> newDetector().fit(new double[][] { { 1, 2, 3 }, { 1, 2, 3 }, { 2, 3, 4 } }));
        assertThrows(DetectorFitException.class, () -> newDetector().fit(new double[0][]));
    }

    @Test
    public void testInvalidUse() {
        assertThrows(IllegalStateException.class, () -> newDetector().decide(train));
        assertThrows(IllegalArgumentException.class,
                () -> RandomCutForestDetector.builder().contamination(0.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RandomCutForestDetector.builder().contamination(0.6).build());

        RandomCutForestDetector detector = newDetector();
        detector.fit(train);
        assertThrows(IllegalArgumentException.class, () -> detector.score(new double[][] { { 1, 2 } }));
    }
}
