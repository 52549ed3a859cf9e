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

package com.amazon.anomalyensemble.detector.autoencoder;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;
import static com.amazon.anomalyensemble.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.CommonUtils;

/**
 * A dense auto-encoder trained to reproduce its input under mean squared error.
 * Hidden layers use ReLU, the output layer is linear, and the weights are
 * trained with Adam on shuffled mini batches.
 *
 * Only {@link #fit} changes the parameters. {@link #reconstruct} and
 * {@link #reconstructionError} are read only and safe to call concurrently once
 * training has finished.
 */
public class Autoencoder {

    private static final Logger LOG = LogManager.getLogger(Autoencoder.class);

    private static final int[] DEFAULT_HIDDEN_LAYERS = { 32, 16, 8, 16, 32 };
    public static final int DEFAULT_EPOCHS = 20;
    public static final int DEFAULT_BATCH_SIZE = 64;
    public static final double DEFAULT_LEARNING_RATE = 0.001;

    /**
     * @return a fresh copy of the default hidden layer sizes
     */
    public static int[] defaultHiddenLayers() {
        return Arrays.copyOf(DEFAULT_HIDDEN_LAYERS, DEFAULT_HIDDEN_LAYERS.length);
    }

    private final int inputDimensions;
    private final int epochs;
    private final int batchSize;
    private final double learningRate;
    private final Random random;
    private final List<DenseLayer> layers;
    private long iterations;
    private boolean fitted;

    public Autoencoder(Builder builder) {
        checkArgument(builder.inputDimensions > 0, "input dimensions must be greater than 0");
        checkNotNull(builder.hiddenLayers, "hidden layers must not be null");
        checkArgument(builder.epochs > 0, "epochs must be greater than 0");
        checkArgument(builder.batchSize > 0, "batch size must be greater than 0");
        checkArgument(builder.learningRate > 0, "learning rate must be greater than 0");
        for (int size : builder.hiddenLayers) {
            checkArgument(size > 0, "hidden layer sizes must be greater than 0");
        }
        inputDimensions = builder.inputDimensions;
        epochs = builder.epochs;
        batchSize = builder.batchSize;
        learningRate = builder.learningRate;
        random = builder.randomSeed.map(Random::new).orElseGet(Random::new);

        layers = new ArrayList<>();
        int previous = inputDimensions;
        for (int size : builder.hiddenLayers) {
            layers.add(new DenseLayer(previous, size, true, random));
            previous = size;
        }
        layers.add(new DenseLayer(previous, inputDimensions, false, random));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Trains on {@code rows}, using the rows both as input and as target.
     *
     * @param rows training rows with {@link #getInputDimensions()} columns
     * @return the mean reconstruction error over {@code rows} after training
     * @throws IllegalStateException if training diverges
     */
    public double fit(double[][] rows) {
        int columns = CommonUtils.columnCount(rows);
        checkArgument(columns == inputDimensions,
                String.format("expected %d columns, found %d", inputDimensions, columns));

        List<Integer> order = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) {
            order.add(i);
        }
        for (int epoch = 0; epoch < epochs; epoch++) {
            Collections.shuffle(order, random);
            double loss = 0;
            for (int start = 0; start < rows.length; start += batchSize) {
                int end = Math.min(start + batchSize, rows.length);
                for (int k = start; k < end; k++) {
                    loss += accumulate(rows[order.get(k)]);
                }
                ++iterations;
                for (DenseLayer layer : layers) {
                    layer.step(learningRate, end - start, iterations);
                }
            }
            loss /= rows.length;
            checkState(Double.isFinite(loss), "training diverged in epoch " + epoch);
            LOG.trace("epoch {} loss {}", epoch, loss);
        }
        fitted = true;
        return meanError(rows);
    }

    private double accumulate(double[] row) {
        double[][] activations = activations(row);
        double[] output = activations[layers.size()];
        double[] delta = new double[inputDimensions];
        double loss = 0;
        for (int j = 0; j < inputDimensions; j++) {
            double difference = output[j] - row[j];
            loss += difference * difference;
            delta[j] = 2 * difference / inputDimensions;
        }
        for (int l = layers.size() - 1; l >= 0; l--) {
            delta = layers.get(l).backward(activations[l], activations[l + 1], delta);
        }
        return loss / inputDimensions;
    }

    private double[][] activations(double[] row) {
        double[][] activations = new double[layers.size() + 1][];
        activations[0] = row;
        for (int l = 0; l < layers.size(); l++) {
            activations[l + 1] = layers.get(l).forward(activations[l]);
        }
        return activations;
    }

    public double[] reconstruct(double[] row) {
        checkNotNull(row, "row must not be null");
        checkArgument(row.length == inputDimensions,
                String.format("expected %d columns, found %d", inputDimensions, row.length));
        double[] output = activations(row)[layers.size()];
        return Arrays.copyOf(output, output.length);
    }

    /**
     * @param row an input row
     * @return the mean over columns of the squared difference between the row and
     *         its reconstruction
     */
    public double reconstructionError(double[] row) {
        double[] output = reconstruct(row);
        double sum = 0;
        for (int j = 0; j < inputDimensions; j++) {
            double difference = output[j] - row[j];
            sum += difference * difference;
        }
        return sum / inputDimensions;
    }

    public double meanError(double[][] rows) {
        double sum = 0;
        for (double[] row : rows) {
            sum += reconstructionError(row);
        }
        return sum / rows.length;
    }

    public int getInputDimensions() {
        return inputDimensions;
    }

    public boolean isFitted() {
        return fitted;
    }

    public static class Builder {

        private int inputDimensions;
        private int[] hiddenLayers = defaultHiddenLayers();
        private int epochs = DEFAULT_EPOCHS;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private double learningRate = DEFAULT_LEARNING_RATE;
        private Optional<Long> randomSeed = Optional.empty();

        public Builder inputDimensions(int inputDimensions) {
            this.inputDimensions = inputDimensions;
            return this;
        }

        public Builder hiddenLayers(int... hiddenLayers) {
            this.hiddenLayers = Arrays.copyOf(hiddenLayers, hiddenLayers.length);
            return this;
        }

        public Builder epochs(int epochs) {
            this.epochs = epochs;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder learningRate(double learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return this;
        }

        public Autoencoder build() {
            return new Autoencoder(this);
        }
    }
}
