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

package com.amazon.anomalyensemble.testutils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Samples machine telemetry from a mixture of 2 multi-variate normal
 * distributions with covariance matrices of the form sigma * I. The base
 * distribution models normal operation, the anomaly distribution models
 * incidents, and test rows switch between the two with fixed transition
 * probabilities so that anomalies arrive in episodes. Training rows are drawn
 * from the base distribution only.
 */
public class SyntheticMachineData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;
    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public SyntheticMachineData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public SyntheticMachineData() {
        this(0.0, 1.0, 6.0, 1.0, 0.02, 0.2);
    }

    /**
     * @param name          machine name
     * @param trainRows     number of training rows
     * @param testRows      number of test rows
     * @param columns       number of features
     * @param seed          random seed, every call with the same arguments
     *                      returns the same data
     * @return the generated machine
     */
    public LabeledMachineData generate(String name, int trainRows, int testRows, int columns, long seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);

        double[][] train = new double[trainRows][columns];
        for (int i = 0; i < trainRows; i++) {
            fillRow(train[i], dist, baseMu, baseSigma);
        }

        double[][] test = new double[testRows][columns];
        boolean[] labels = new boolean[testRows];
        boolean anomaly = false;
        for (int i = 0; i < testRows; i++) {
            if (!anomaly) {
                fillRow(test[i], dist, baseMu, baseSigma);
                if (rng.nextDouble() < transitionToAnomalyProbability) {
                    anomaly = true;
                }
            } else {
                fillRow(test[i], dist, anomalyMu, anomalySigma);
                labels[i] = true;
                if (rng.nextDouble() < transitionToBaseProbability) {
                    anomaly = false;
                }
            }
        }
        return new LabeledMachineData(name, train, test, labels);
    }

    /**
     * Generates {@code count} machines named {@code machine-1} ... with
     * consecutive seeds.
     */
    public List<LabeledMachineData> generateMachines(int count, int trainRows, int testRows, int columns,
            long seed) {
        List<LabeledMachineData> machines = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            machines.add(generate("machine-" + (i + 1), trainRows, testRows, columns, seed + i));
        }
        return machines;
    }

    /**
     * @param rows    number of rows
     * @param columns number of columns
     * @param seed    random seed
     * @return rows drawn from the base distribution only
     */
    public double[][] generateNormalRows(int rows, int columns, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] result = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            fillRow(result[i], dist, baseMu, baseSigma);
        }
        return result;
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
