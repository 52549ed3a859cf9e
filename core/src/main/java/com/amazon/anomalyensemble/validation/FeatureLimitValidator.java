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

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.amazon.anomalyensemble.returntypes.DecisionVector;

/**
 * Checks model-confirmed anomalies against fixed operational limits. A
 * confirmed row that exceeds at least one limit is critical; one that exceeds
 * none is reported as anomalous but non-critical.
 */
public class FeatureLimitValidator {

    private final List<FeatureLimit> limits;

    public FeatureLimitValidator(List<FeatureLimit> limits) {
        checkNotNull(limits, "limits must not be null");
        checkArgument(!limits.isEmpty(), "at least one limit is required");
        this.limits = new ArrayList<>(limits);
    }

    /**
     * @param rows      feature rows, in the original (unscaled) units
     * @param confirmed which rows were confirmed anomalous
     * @return one entry per confirmed row, in row order
     */
    public List<RowValidation> validate(double[][] rows, DecisionVector confirmed) {
        checkNotNull(rows, "rows must not be null");
        checkNotNull(confirmed, "confirmed must not be null");
        checkArgument(rows.length == confirmed.size(),
                String.format("%d rows for %d decisions", rows.length, confirmed.size()));
        List<RowValidation> result = new ArrayList<>();
        for (int index : confirmed.flaggedIndices()) {
            result.add(validate(index, rows[index]));
        }
        return result;
    }

    public RowValidation validate(int index, double[] row) {
        List<String> violations = new ArrayList<>();
        for (FeatureLimit limit : limits) {
            if (limit.isExceededBy(row)) {
                violations.add(String.format(Locale.ROOT, "%s=%s > %s", limit.getName(), row[limit.getColumn()],
                        limit.getLimit()));
            }
        }
        return new RowValidation(index, violations);
    }

    public List<FeatureLimit> getLimits() {
        return new ArrayList<>(limits);
    }
}
