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

import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;
import com.amazon.anomalyensemble.returntypes.ThresholdCandidate;
import com.amazon.anomalyensemble.threshold.PercentileThresholdOptimizer;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class ThresholdOptimizerBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1000", "28000", "500000" })
        int size;

        ScoreVector scores;
        DecisionVector labels;
        PercentileThresholdOptimizer optimizer;

        @Setup(Level.Trial)
        public void setUpData() {
            Random random = new Random(99);
            double[] values = new double[size];
            boolean[] flags = new boolean[size];
            for (int i = 0; i < size; i++) {
                flags[i] = random.nextDouble() < 0.05;
                values[i] = Math.abs(random.nextGaussian()) + (flags[i] ? 2 * random.nextDouble() : 0);
            }
            scores = new ScoreVector(values);
            labels = new DecisionVector(flags);
            optimizer = new PercentileThresholdOptimizer();
        }
    }

    @Benchmark
    public ThresholdCandidate optimize(BenchmarkState state) {
        return state.optimizer.optimize(state.scores, state.labels);
    }

    @Benchmark
    public DecisionVector decideAtPercentile(BenchmarkState state) {
        return PercentileThresholdOptimizer.decide(state.scores, 95);
    }
}
