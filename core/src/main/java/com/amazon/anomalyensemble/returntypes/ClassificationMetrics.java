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

package com.amazon.anomalyensemble.returntypes;

import lombok.Getter;

/**
 * Precision, recall and F1 of a decision vector. A ratio whose denominator is
 * zero is reported as 0.0.
 */
@Getter
public final class ClassificationMetrics {

    public static final ClassificationMetrics ZERO = new ClassificationMetrics(0.0, 0.0, 0.0);

    private final double precision;
    private final double recall;
    private final double f1;

    public ClassificationMetrics(double precision, double recall, double f1) {
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
    }

    /**
     * Derives the metrics from confusion counts using the zero convention.
     *
     * @param confusion the confusion counts
     * @return the metrics
     */
    public static ClassificationMetrics from(ConfusionMatrix confusion) {
        int tp = confusion.getTruePositives();
        double precision = ratio(tp, tp + confusion.getFalsePositives());
        double recall = ratio(tp, tp + confusion.getFalseNegatives());
        double f1 = (precision + recall == 0.0) ? 0.0 : 2.0 * precision * recall / (precision + recall);
        return new ClassificationMetrics(precision, recall, f1);
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    @Override
    public String toString() {
        return String.format("precision=%.3f recall=%.3f f1=%.3f", precision, recall, f1);
    }
}
