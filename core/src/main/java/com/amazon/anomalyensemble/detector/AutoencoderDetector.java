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

package com.amazon.anomalyensemble.detector;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;
import static com.amazon.anomalyensemble.CommonUtils.checkState;

import java.util.Arrays;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.CommonUtils;
import com.amazon.anomalyensemble.detector.autoencoder.Autoencoder;
import com.amazon.anomalyensemble.exception.DetectorFitException;
import com.amazon.anomalyensemble.returntypes.ScoreVector;

/**
 * Reconstruction error detector. The auto-encoder is trained on the training
 * rows only; the score of a row is its mean squared reconstruction error.
 * Scoring never changes the trained parameters.
 */
@Getter
public class AutoencoderDetector implements IScoringDetector {

    private static final Logger LOG = LogManager.getLogger(AutoencoderDetector.class);

    private final int[] hiddenLayers;
    private final int epochs;
    private final int batchSize;
    private final double learningRate;
    private final long randomSeed;
    @Getter(AccessLevel.NONE)
    private Autoencoder model;

    @Builder
    public AutoencoderDetector(int[] hiddenLayers, Integer epochs, Integer batchSize, Double learningRate,
            Long randomSeed) {
        this.hiddenLayers = hiddenLayers == null ? Autoencoder.defaultHiddenLayers()
                : Arrays.copyOf(hiddenLayers, hiddenLayers.length);
        this.epochs = epochs == null ? Autoencoder.DEFAULT_EPOCHS : epochs;
        this.batchSize = batchSize == null ? Autoencoder.DEFAULT_BATCH_SIZE : batchSize;
        this.learningRate = learningRate == null ? Autoencoder.DEFAULT_LEARNING_RATE : learningRate;
        this.randomSeed = randomSeed == null ? 42L : randomSeed;
        checkArgument(this.epochs > 0, "epochs must be greater than 0");
        checkArgument(this.batchSize > 0, "batch size must be greater than 0");
        checkArgument(this.learningRate > 0, "learning rate must be greater than 0");
    }

    @Override
    public void fit(double[][] train) {
        checkNotNull(train, "train must not be null");
        try {
            int dimensions = CommonUtils.columnCount(train);
            Autoencoder candidate = Autoencoder.builder().inputDimensions(dimensions).hiddenLayers(hiddenLayers)
                    .epochs(epochs).batchSize(batchSize).learningRate(learningRate).randomSeed(randomSeed).build();
            double loss = candidate.fit(train);
            LOG.debug("auto-encoder trained on {} rows, mean reconstruction error {}", train.length, loss);
            model = candidate;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new DetectorFitException("cannot fit auto-encoder: " + e.getMessage(), e);
        }
    }

    @Override
    public ScoreVector score(double[][] rows) {
        checkState(model != null, "detector must be fitted before scoring");
        checkNotNull(rows, "rows must not be null");
        double[] errors = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            errors[i] = model.reconstructionError(rows[i]);
        }
        return new ScoreVector(errors);
    }

    public int[] getHiddenLayers() {
        return Arrays.copyOf(hiddenLayers, hiddenLayers.length);
    }
}
