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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.anomalyensemble.detector.AutoencoderDetector;
import com.amazon.anomalyensemble.detector.RandomCutForestDetector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;
import com.amazon.anomalyensemble.testutils.SyntheticMachineData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class DetectorBenchmark {

    public final static int TRAIN_SIZE = 5_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "4", "38" })
        int dimensions;

        double[][] train;

        @Setup(Level.Trial)
        public void setUpData() {
            train = new SyntheticMachineData().generateNormalRows(TRAIN_SIZE, dimensions, 99L);
        }
    }

    @Benchmark
    public ScoreVector fitAndScoreForest(BenchmarkState state) {
        RandomCutForestDetector detector = RandomCutForestDetector.builder().randomSeed(99L).build();
        detector.fit(state.train);
        return detector.score(state.train);
    }

    @Benchmark
    public ScoreVector fitAndScoreAutoencoder(BenchmarkState state) {
        AutoencoderDetector detector = AutoencoderDetector.builder().epochs(5).randomSeed(99L).build();
        detector.fit(state.train);
        return detector.score(state.train);
    }
}
