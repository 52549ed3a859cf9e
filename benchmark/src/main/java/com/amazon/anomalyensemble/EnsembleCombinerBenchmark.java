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

package com.amazon.anomalyensemble;

import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.anomalyensemble.config.CombinationRule;
import com.amazon.anomalyensemble.ensemble.EnsembleCombiner;
import com.amazon.anomalyensemble.returntypes.DecisionVector;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class EnsembleCombinerBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1000", "500000" })
        int size;

        @Param({ "union", "intersection", "vote" })
        String rule;

        DecisionVector first;
        DecisionVector second;
        CombinationRule combinationRule;

        @Setup(Level.Trial)
        public void setUpData() {
            Random random = new Random(99);
            boolean[] a = new boolean[size];
            boolean[] b = new boolean[size];
            for (int i = 0; i < size; i++) {
                a[i] = random.nextDouble() < 0.1;
                b[i] = random.nextDouble() < 0.05;
            }
            first = new DecisionVector(a);
            second = new DecisionVector(b);
            switch (rule) {
            case "union":
                combinationRule = CombinationRule.union();
                break;
            case "intersection":
                combinationRule = CombinationRule.intersection();
                break;
            default:
                combinationRule = CombinationRule.weightedVote(0.3, 0.7);
            }
        }
    }

    @Benchmark
    public DecisionVector combine(BenchmarkState state) {
        return EnsembleCombiner.combine(state.combinationRule, state.first, state.second);
    }
}
