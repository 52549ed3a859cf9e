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

import java.util.Random;

/**
 * A fully connected layer with optional ReLU activation and its Adam optimizer
 * state. Gradients are accumulated over a mini batch and applied by
 * {@link #step}.
 */
class DenseLayer {

    static final double BETA_1 = 0.9;
    static final double BETA_2 = 0.999;
    static final double EPSILON = 1e-7;

    final int inputSize;
    final int outputSize;
    final boolean relu;

    final double[][] weights;
    final double[] bias;

    private final double[][] weightGradient;
    private final double[] biasGradient;
    private final double[][] weightMoment;
    private final double[][] weightVelocity;
    private final double[] biasMoment;
    private final double[] biasVelocity;

    DenseLayer(int inputSize, int outputSize, boolean relu, Random random) {
        this.inputSize = inputSize;
        this.outputSize = outputSize;
        this.relu = relu;
        weights = new double[outputSize][inputSize];
        bias = new double[outputSize];
        weightGradient = new double[outputSize][inputSize];
        biasGradient = new double[outputSize];
        weightMoment = new double[outputSize][inputSize];
        weightVelocity = new double[outputSize][inputSize];
        biasMoment = new double[outputSize];
        biasVelocity = new double[outputSize];

        // Glorot uniform
        double limit = Math.sqrt(6.0 / (inputSize + outputSize));
        for (int o = 0; o < outputSize; o++) {
            for (int i = 0; i < inputSize; i++) {
                weights[o][i] = (2 * random.nextDouble() - 1) * limit;
            }
        }
    }

    double[] forward(double[] input) {
        double[] output = new double[outputSize];
        for (int o = 0; o < outputSize; o++) {
            double sum = bias[o];
            double[] row = weights[o];
            for (int i = 0; i < inputSize; i++) {
                sum += row[i] * input[i];
            }
            output[o] = (relu && sum < 0) ? 0.0 : sum;
        }
        return output;
    }

    /**
     * Accumulates the gradient for one sample and returns the gradient with
     * respect to the layer input.
     *
     * @param input  the input this layer saw in the forward pass
     * @param output the output this layer produced in the forward pass
     * @param delta  gradient of the loss with respect to {@code output}
     * @return gradient of the loss with respect to {@code input}
     */
    double[] backward(double[] input, double[] output, double[] delta) {
        double[] inputDelta = new double[inputSize];
        for (int o = 0; o < outputSize; o++) {
            double d = (relu && output[o] <= 0) ? 0.0 : delta[o];
            if (d == 0.0) {
                continue;
            }
            biasGradient[o] += d;
            double[] row = weights[o];
            double[] gradientRow = weightGradient[o];
            for (int i = 0; i < inputSize; i++) {
                gradientRow[i] += d * input[i];
                inputDelta[i] += d * row[i];
            }
        }
        return inputDelta;
    }

    /**
     * Applies one Adam update with the averaged accumulated gradient and clears
     * the accumulator.
     */
    void step(double learningRate, int batchSize, long iteration) {
        double correction1 = 1 - Math.pow(BETA_1, iteration);
        double correction2 = 1 - Math.pow(BETA_2, iteration);
        for (int o = 0; o < outputSize; o++) {
            for (int i = 0; i < inputSize; i++) {
                double g = weightGradient[o][i] / batchSize;
                weightMoment[o][i] = BETA_1 * weightMoment[o][i] + (1 - BETA_1) * g;
                weightVelocity[o][i] = BETA_2 * weightVelocity[o][i] + (1 - BETA_2) * g * g;
                weights[o][i] -= learningRate * (weightMoment[o][i] / correction1)
                        / (Math.sqrt(weightVelocity[o][i] / correction2) + EPSILON);
                weightGradient[o][i] = 0;
            }
            double g = biasGradient[o] / batchSize;
            biasMoment[o] = BETA_1 * biasMoment[o] + (1 - BETA_1) * g;
            biasVelocity[o] = BETA_2 * biasVelocity[o] + (1 - BETA_2) * g * g;
            bias[o] -= learningRate * (biasMoment[o] / correction1) / (Math.sqrt(biasVelocity[o] / correction2) + EPSILON);
            biasGradient[o] = 0;
        }
    }
}
