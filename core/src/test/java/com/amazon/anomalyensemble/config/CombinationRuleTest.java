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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CombinationRuleTest {

    @Test
    public void testNames() {
        assertEquals("union", CombinationRule.union().getName());
        assertEquals("intersection", CombinationRule.intersection().getName());
        assertEquals("vote(0.3:0.7)", CombinationRule.weightedVote(0.3, 0.7).getName());
        assertEquals("vote(1.0,0.0)", CombinationRule.weightedVote(1, 0).getName());
        assertEquals("ae_heavy", CombinationRule.weightedVote(0.6, 0.4).named("ae_heavy").getName());
    }

    @Test
    public void testWeights() {
        CombinationRule rule = CombinationRule.weightedVote(0.3, 0.7);
        assertEquals(CombinationRule.Type.WEIGHTED_VOTE, rule.getType());
        assertArrayEquals(new double[] { 0.3, 0.7 }, rule.getWeights());
        assertThrows(IllegalStateException.class, () -> CombinationRule.union().getWeights());
    }

    @Test
    public void testInvalidWeights() {
        assertThrows(IllegalArgumentException.class, () -> CombinationRule.weightedVote(1.0));
        assertThrows(IllegalArgumentException.class, () -> CombinationRule.weightedVote(-0.1, 1.1));
        assertThrows(IllegalArgumentException.class, () -> CombinationRule.weightedVote(Double.NaN, 0.5));
    }

    @Test
    public void testEquality() {
        assertEquals(CombinationRule.weightedVote(0.5, 0.5), CombinationRule.weightedVote(0.5, 0.5));
        assertNotEquals(CombinationRule.weightedVote(0.3, 0.7), CombinationRule.weightedVote(0.7, 0.3));
        assertNotEquals(CombinationRule.union(), CombinationRule.intersection());
    }
}
