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

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How several decision vectors are merged into one. A rule is one of
 * {@link Type#UNION}, {@link Type#INTERSECTION} or {@link Type#WEIGHTED_VOTE};
 * only weighted votes carry weights.
 *
 * The weights of a vote are applied to the inputs in the order the inputs are
 * passed to the combiner. A row is flagged when the weighted sum of its 0/1
 * decisions reaches {@link #VOTE_THRESHOLD}. Weights are expected to sum to 1,
 * but this is not enforced; a single weight of 0.5 or more makes that detector
 * sufficient on its own.
 */
public final class CombinationRule {

    public static final double VOTE_THRESHOLD = 0.5;

    public enum Type {
        UNION, INTERSECTION, WEIGHTED_VOTE
    }

    private final Type type;
    private final double[] weights;
    private final String name;

    private CombinationRule(Type type, double[] weights, String name) {
        this.type = checkNotNull(type, "type must not be null");
        this.weights = weights;
        this.name = checkNotNull(name, "name must not be null");
    }

    public static CombinationRule union() {
        return new CombinationRule(Type.UNION, null, "union");
    }

    public static CombinationRule intersection() {
        return new CombinationRule(Type.INTERSECTION, null, "intersection");
    }

    /**
     * @param weights one non-negative weight per combined input
     * @return a weighted vote named after its weights, e.g. {@code vote(0.3:0.7)}
     */
    public static CombinationRule weightedVote(double... weights) {
        checkNotNull(weights, "weights must not be null");
        checkArgument(weights.length >= 2, "a weighted vote needs at least two weights");
        for (double weight : weights) {
            checkArgument(weight >= 0 && Double.isFinite(weight), "weights must be finite and non-negative");
        }
        String label = Arrays.stream(weights).mapToObj(CombinationRule::format).collect(Collectors.joining(":"));
        return new CombinationRule(Type.WEIGHTED_VOTE, Arrays.copyOf(weights, weights.length),
                "vote(" + label + ")");
    }

    private static String format(double weight) {
        String text = String.format(Locale.ROOT, "%.4f", weight);
        text = text.replaceAll("0+$", "");
        return text.endsWith(".") ? text + "0" : text;
    }

    /**
     * @param newName the strategy name to report this rule under
     * @return a copy of this rule with a different name
     */
    public CombinationRule named(String newName) {
        return new CombinationRule(type, weights, newName);
    }

    public Type getType() {
        return type;
    }

    /**
     * @return a copy of the vote weights
     * @throws IllegalStateException if this rule is not a weighted vote
     */
    public double[] getWeights() {
        if (weights == null) {
            throw new IllegalStateException(type + " has no weights");
        }
        return Arrays.copyOf(weights, weights.length);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CombinationRule)) {
            return false;
        }
        CombinationRule rule = (CombinationRule) other;
        return type == rule.type && Arrays.equals(weights, rule.weights) && name.equals(rule.name);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * type.hashCode() + Arrays.hashCode(weights)) + name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
