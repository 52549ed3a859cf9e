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
import java.util.List;
import java.util.function.Supplier;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import com.amazon.anomalyensemble.detector.AutoencoderDetector;
import com.amazon.anomalyensemble.detector.OneClassSvmDetector;
import com.amazon.anomalyensemble.detector.RandomCutForestDetector;
import com.amazon.anomalyensemble.detector.autoencoder.Autoencoder;
import com.amazon.anomalyensemble.ensemble.SuspectValidationStrategy;
import com.amazon.anomalyensemble.preprocessor.IScaler;
import com.amazon.anomalyensemble.preprocessor.StandardScaler;

/**
 * Everything a comparison run can be configured with. Unset fields take the
 * server machine experiment defaults.
 */
@Getter
@Builder(toBuilder = true)
public class EnsembleConfig {

    public static final List<CombinationRule> DEFAULT_RULES = Arrays.asList(CombinationRule.union(),
            CombinationRule.intersection(), CombinationRule.weightedVote(0.3, 0.7),
            CombinationRule.weightedVote(0.5, 0.5), CombinationRule.weightedVote(0.7, 0.3));

    @Builder.Default
    private final double contamination = RandomCutForestDetector.DEFAULT_CONTAMINATION;

    @Builder.Default
    private final PercentileSweep percentileSweep = PercentileSweep.defaultSweep();

    /**
     * Rules applied to (auto-encoder, isolation) decisions, in that order.
     */
    @Builder.Default
    private final List<CombinationRule> combinationRules = DEFAULT_RULES;

    @Builder.Default
    private final boolean suspectValidationEnabled = true;

    @Builder.Default
    private final double validationPercentile = SuspectValidationStrategy.DEFAULT_VALIDATION_PERCENTILE;

    @Builder.Default
    private final int numberOfTrees = RandomCutForestDetector.DEFAULT_NUMBER_OF_TREES;

    @Builder.Default
    private final int sampleSize = RandomCutForestDetector.DEFAULT_SAMPLE_SIZE;

    @Builder.Default
    private final long randomSeed = RandomCutForestDetector.DEFAULT_RANDOM_SEED;

    @Builder.Default
    @Getter(AccessLevel.NONE)
    private final int[] hiddenLayers = Autoencoder.defaultHiddenLayers();

    @Builder.Default
    private final int epochs = Autoencoder.DEFAULT_EPOCHS;

    @Builder.Default
    private final int batchSize = Autoencoder.DEFAULT_BATCH_SIZE;

    @Builder.Default
    private final double learningRate = Autoencoder.DEFAULT_LEARNING_RATE;

    /**
     * Adds a one-class svm baseline column to every dataset.
     */
    @Builder.Default
    private final boolean oneClassSvmEnabled = false;

    @Builder.Default
    private final double nu = OneClassSvmDetector.DEFAULT_NU;

    @Builder.Default
    private final boolean standardize = true;

    @Builder.Default
    private final int threads = 1;

    public static EnsembleConfig defaults() {
        return builder().build();
    }

    /**
     * Checks the configuration as a whole.
     *
     * @return this configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public EnsembleConfig validate() {
        checkArgument(contamination > 0 && contamination <= 0.5, "contamination must be in (0, 0.5]");
        checkNotNull(percentileSweep, "percentileSweep must not be null");
        checkNotNull(combinationRules, "combinationRules must not be null");
        checkArgument(validationPercentile >= 0 && validationPercentile < 100,
                "validation percentile must be in [0, 100)");
        checkArgument(numberOfTrees > 0, "number of trees should be greater than 0");
        checkArgument(sampleSize > 0, "sample size should be greater than 0");
        checkNotNull(hiddenLayers, "hiddenLayers must not be null");
        checkArgument(epochs > 0, "epochs must be greater than 0");
        checkArgument(batchSize > 0, "batch size must be greater than 0");
        checkArgument(learningRate > 0, "learning rate must be greater than 0");
        checkArgument(nu > 0 && nu <= 1, "nu must be in (0, 1]");
        checkArgument(threads > 0, "threads must be greater than 0");
        return this;
    }

    public int[] getHiddenLayers() {
        return hiddenLayers == null ? null : Arrays.copyOf(hiddenLayers, hiddenLayers.length);
    }

    /**
     * @return a factory producing a new, unfitted isolation detector per call
     */
    public Supplier<RandomCutForestDetector> isolationFactory() {
        return () -> RandomCutForestDetector.builder().contamination(contamination).numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize).randomSeed(randomSeed).build();
    }

    /**
     * @return a factory producing a new, untrained reconstruction detector per
     *         call
     */
    public Supplier<AutoencoderDetector> reconstructionFactory() {
        return () -> AutoencoderDetector.builder().hiddenLayers(hiddenLayers).epochs(epochs).batchSize(batchSize)
                .learningRate(learningRate).randomSeed(randomSeed).build();
    }

    /**
     * @return a factory producing a new one-class svm per call, or null when the
     *         baseline is off
     */
    public Supplier<OneClassSvmDetector> oneClassSvmFactory() {
        return oneClassSvmEnabled ? () -> OneClassSvmDetector.builder().nu(nu).build() : null;
    }

    /**
     * @return a scaler factory, or null when standardization is off
     */
    public Supplier<IScaler> scalerFactory() {
        return standardize ? StandardScaler::new : null;
    }
}
