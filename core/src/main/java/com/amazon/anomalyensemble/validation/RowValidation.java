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

import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * The limits one anomalous row exceeds.
 */
@Getter
public final class RowValidation {

    private final int row;
    private final List<String> violations;

    public RowValidation(int row, List<String> violations) {
        this.row = row;
        this.violations = Collections.unmodifiableList(violations);
    }

    /**
     * @return true when at least one limit is exceeded
     */
    public boolean isCritical() {
        return !violations.isEmpty();
    }

    @Override
    public String toString() {
        return isCritical() ? String.format("row %d exceeds %s", row, String.join(", ", violations))
                : String.format("row %d is anomalous but within every limit", row);
    }
}
