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

import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.anomalyensemble.config.CombinationRule;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;

public class EnsembleCombinerTest {

    private static final DecisionVector A = DecisionVector.of(1, 0, 1, 0);
    private static final DecisionVector B = DecisionVector.of(0, 0, 1, 1);

    @Test
    public void testUnion() {
        assertEquals(DecisionVector.of(1, 0, 1, 1), EnsembleCombiner.combine(CombinationRule.union(), A, B));
    }

    @Test
    public void testIntersection() {
        assertEquals(DecisionVector.of(0, 0, 1, 0), EnsembleCombiner.combine(CombinationRule.intersection(), A, B));
    }

    @Test
    public void testEqualWeightVoteMatchesUnionForTwoInputs() {
        assertEquals(DecisionVector.of(1, 0, 1, 1),
                EnsembleCombiner.combine(CombinationRule.weightedVote(0.5, 0.5), A, B));
    }

    @Test
    public void testWeightsFollowInputOrder() {
        assertEquals(A, EnsembleCombiner.combine(CombinationRule.weightedVote(0.7, 0.3), A, B));
        assertEquals(B, EnsembleCombiner.combine(CombinationRule.weightedVote(0.3, 0.7), A, B));
        assertEquals(A, EnsembleCombiner.combine(CombinationRule.weightedVote(1, 0), A, B));
        assertEquals(B, EnsembleCombiner.combine(CombinationRule.weightedVote(0, 1), A, B));
    }

    @Test
    public void testVoteThresholdIsInclusive() {
        DecisionVector single = DecisionVector.of(1);
        DecisionVector empty = DecisionVector.of(0);
        assertEquals(single, EnsembleCombiner.combine(CombinationRule.weightedVote(0.5, 0.5), single, empty));
        assertEquals(empty, EnsembleCombiner.combine(CombinationRule.weightedVote(0.49, 0.51), single, empty));
    }

    @Test
    public void testThreeInputMajority() {
        DecisionVector c = DecisionVector.of(0, 1, 0, 1);
        CombinationRule majority = CombinationRule.weightedVote(1.0 / 3, 1.0 / 3, 1.0 / 3);
        assertEquals(DecisionVector.of(0, 0, 1, 1), EnsembleCombiner.combine(majority, A, B, c));
        assertEquals(DecisionVector.of(1, 1, 1, 1), EnsembleCombiner.combine(CombinationRule.union(), A, B, c));
        assertEquals(DecisionVector.of(0, 0, 0, 0),
                EnsembleCombiner.combine(CombinationRule.intersection(), A, B, c));
    }

    @ParameterizedTest
    @ValueSource(longs = { 1L, 7L, 42L, 1234L })
    public void testIntersectionWithinInputsWithinUnion(long seed) {
        Random random = new Random(seed);
        int size = 200;
        boolean[] first = new boolean[size];
        boolean[] second = new boolean[size];
        for (int i = 0; i < size; i++) {
            first[i] = random.nextBoolean();
            second[i] = random.nextDouble() < 0.2;
        }
        DecisionVector a = new DecisionVector(first);
        DecisionVector b = new DecisionVector(second);
        DecisionVector union = EnsembleCombiner.combine(CombinationRule.union(), a, b);
        DecisionVector intersection = EnsembleCombiner.combine(CombinationRule.intersection(), a, b);
        for (int i = 0; i < size; i++) {
            if (intersection.isFlagged(i)) {
                assertTrue(a.isFlagged(i) && b.isFlagged(i));
            }
            if (a.isFlagged(i) || b.isFlagged(i)) {
                assertTrue(union.isFlagged(i));
            }
        }
        assertTrue(intersection.count() <= Math.min(a.count(), b.count()));
        assertTrue(union.count() >= Math.max(a.count(), b.count()));
    }

    @Test
    public void testInvalidInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> EnsembleCombiner.combine(CombinationRule.union(), A, DecisionVector.of(1, 0)));
        assertThrows(IllegalArgumentException.class, () -> EnsembleCombiner.combine(CombinationRule.union(), A));
        assertThrows(IllegalArgumentException.class,
                () -> EnsembleCombiner.combine(CombinationRule.weightedVote(0.2, 0.3, 0.5), A, B));
        assertThrows(NullPointerException.class, () -> EnsembleCombiner.combine(null, A, B));
        assertThrows(IllegalArgumentException.class,
                () -> EnsembleCombiner.combine(CombinationRule.union(), Collections.emptyList()));
    }

    @Test
    public void testCombineScores() {
        ScoreVector first = ScoreVector.of(0, 1, 2);
        ScoreVector second = ScoreVector.of(4, 2, 0);
        ScoreVector combined = EnsembleCombiner.combineScores(new double[] { 0.25, 0.75 },
                Arrays.asList(first, second));
        assertArrayEquals(new double[] { 3.0, 1.75, 0.5 }, combined.toArray(), 1e-12);
        assertThrows(IllegalArgumentException.class,
                () -> EnsembleCombiner.combineScores(new double[] { 1.0 }, Arrays.asList(first, second)));
    }

    @Test
    public void testMinMaxNormalize() {
        assertArrayEquals(new double[] { 0.0, 0.25, 1.0 },
                EnsembleCombiner.minMaxNormalize(ScoreVector.of(2, 3, 6)).toArray(), 1e-12);
        assertArrayEquals(new double[] { 0.0, 0.0 },
                EnsembleCombiner.minMaxNormalize(ScoreVector.of(5, 5)).toArray());
    }
}
