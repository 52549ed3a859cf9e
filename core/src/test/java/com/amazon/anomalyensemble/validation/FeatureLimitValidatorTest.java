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

package com.amazon.anomalyensemble.validation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.returntypes.DecisionVector;

public class FeatureLimitValidatorTest {

    private final FeatureLimitValidator validator = new FeatureLimitValidator(Arrays.asList(
            new FeatureLimit("cpu", 0, 90), new FeatureLimit("ram", 1, 80), new FeatureLimit("disk", 2, 85),
            new FeatureLimit("network", 3, 70)));

    @Test
    public void testOnlyConfirmedRowsAreValidated() {
        double[][] rows = { { 95, 50, 50, 50 }, { 99, 99, 99, 99 }, { 40, 85, 90, 10 }, { 10, 10, 10, 10 } };
        List<RowValidation> validations = validator.validate(rows, DecisionVector.of(1, 0, 1, 1));

        assertEquals(3, validations.size());
        assertEquals(0, validations.get(0).getRow());
        assertThat(validations.get(0).getViolations(), contains("cpu=95.0 > 90.0"));
        assertThat(validations.get(1).getViolations(), contains("ram=85.0 > 80.0", "disk=90.0 > 85.0"));
        assertTrue(validations.get(1).isCritical());
        assertEquals(3, validations.get(2).getRow());
        assertThat(validations.get(2).getViolations(), empty());
        assertFalse(validations.get(2).isCritical());
    }

    @Test
    public void testLimitIsExclusive() {
        assertFalse(validator.validate(0, new double[] { 90, 80, 85, 70 }).isCritical());
        assertTrue(validator.validate(0, new double[] { 90, 80, 85, 70.5 }).isCritical());
    }

    @Test
    public void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureLimitValidator(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class,
                () -> validator.validate(new double[][] { { 1, 2, 3, 4 } }, DecisionVector.of(1, 0)));
        assertThrows(IllegalArgumentException.class, () -> validator.validate(0, new double[] { 1, 2 }));
    }
}
