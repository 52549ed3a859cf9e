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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.CommonUtils;
import com.amazon.anomalyensemble.exception.DetectorFitException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;

/**
 * One-class support vector machine with a Gaussian (RBF) kernel, used as a
 * baseline next to the isolation and reconstruction detectors.
 *
 * The dual problem {@code min 1/2 a'Qa} subject to {@code 0 <= a_i <= 1} and
 * {@code sum a_i = nu * l} is solved by sequential minimal optimization with
 * second order working set selection. The decision value of a row is
 * {@code sum a_i K(x_i, x) - rho}; the score is its negation, and a row is
 * flagged iff its score is strictly above 0. At most a {@code nu} fraction of
 * the training rows ends up outside the learned region.
 *
 * When no gamma is given it is {@code 1 / (columns * variance)} with the
 * variance taken over every value of the training matrix, or 1 if that
 * variance is 0.
 */
@Getter
public class OneClassSvmDetector implements IDecisionDetector, IScoringDetector {

    private static final Logger LOG = LogManager.getLogger(OneClassSvmDetector.class);

    public static final double DEFAULT_NU = 0.05;
    public static final double DEFAULT_TOLERANCE = 1e-3;
    public static final int DEFAULT_CACHED_COLUMNS = 256;

    private static final double TAU = 1e-12;

    private final double nu;
    @Getter(AccessLevel.NONE)
    private final Double gamma;
    private final double tolerance;
    private final int cachedColumns;

    @Getter(AccessLevel.NONE)
    private double[][] supportVectors;
    @Getter(AccessLevel.NONE)
    private double[] coefficients;
    @Getter(AccessLevel.NONE)
    private double rho;
    @Getter(AccessLevel.NONE)
    private double fittedGamma;
    @Getter(AccessLevel.NONE)
    private int dimensions;

    /**
     * @param nu            upper bound on the fraction of training outliers, in
     *                      (0, 1]
     * @param gamma         RBF kernel coefficient, or null to derive it from the
     *                      training data
     * @param tolerance     stopping tolerance on the optimality gap
     * @param cachedColumns number of kernel matrix columns kept in memory
     */
    @Builder
    public OneClassSvmDetector(Double nu, Double gamma, Double tolerance, Integer cachedColumns) {
        this.nu = nu == null ? DEFAULT_NU : nu;
        this.gamma = gamma;
        this.tolerance = tolerance == null ? DEFAULT_TOLERANCE : tolerance;
        this.cachedColumns = cachedColumns == null ? DEFAULT_CACHED_COLUMNS : cachedColumns;
        checkArgument(this.nu > 0 && this.nu <= 1, "nu must be in (0, 1]");
        checkArgument(gamma == null || (gamma > 0 && Double.isFinite(gamma)), "gamma must be greater than 0");
        checkArgument(this.tolerance > 0, "tolerance must be greater than 0");
        checkArgument(this.cachedColumns >= 2, "at least two kernel columns must be cached");
    }

    @Override
    public void fit(double[][] train) {
        checkNotNull(train, "train must not be null");
        int columns;
        double kernelGamma;
        Solver solver;
        try {
            columns = CommonUtils.columnCount(train);
            kernelGamma = gamma != null ? gamma : scaleGamma(train, columns);
            solver = new Solver(CommonUtils.copyOf(train), kernelGamma, nu, tolerance, cachedColumns);
            solver.solve();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new DetectorFitException("cannot fit one-class svm: " + e.getMessage(), e);
        }

        List<double[]> vectors = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int i = 0; i < train.length; i++) {
            if (solver.alpha[i] > 0) {
                vectors.add(solver.rows[i]);
                weights.add(solver.alpha[i]);
            }
        }
        supportVectors = vectors.toArray(new double[0][]);
        coefficients = weights.stream().mapToDouble(Double::doubleValue).toArray();
        rho = solver.rho();
        fittedGamma = kernelGamma;
        dimensions = columns;
        LOG.debug("one-class svm trained on {} rows, {} support vectors, rho {}, gamma {}", train.length,
                supportVectors.length, rho, fittedGamma);
    }

    static double scaleGamma(double[][] train, int columns) {
        double sum = 0;
        double count = 0;
        for (double[] row : train) {
            for (double value : row) {
                sum += value;
                count++;
            }
        }
        double mean = sum / count;
        double squares = 0;
        for (double[] row : train) {
            for (double value : row) {
                squares += (value - mean) * (value - mean);
            }
        }
        double variance = squares / count;
        return variance > 0 ? 1.0 / (columns * variance) : 1.0;
    }

    @Override
    public ScoreVector score(double[][] rows) {
        checkState(supportVectors != null, "detector must be fitted before scoring");
        checkNotNull(rows, "rows must not be null");
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            checkArgument(rows[i].length == dimensions,
                    String.format("expected %d columns, found %d", dimensions, rows[i].length));
            double decision = -rho;
            for (int k = 0; k < supportVectors.length; k++) {
                decision += coefficients[k] * kernel(supportVectors[k], rows[i], fittedGamma);
            }
            scores[i] = -decision;
        }
        return new ScoreVector(scores);
    }

    @Override
    public DecisionVector decide(double[][] rows) {
        return score(rows).above(0.0);
    }

    public int getSupportVectorCount() {
        checkState(supportVectors != null, "detector must be fitted first");
        return supportVectors.length;
    }

    /**
     * @return the kernel coefficient used by the fitted model
     */
    public double getFittedGamma() {
        checkState(supportVectors != null, "detector must be fitted first");
        return fittedGamma;
    }

    static double kernel(double[] a, double[] b, double gamma) {
        double distance = 0;
        for (int i = 0; i < a.length; i++) {
            double difference = a[i] - b[i];
            distance += difference * difference;
        }
        return Math.exp(-gamma * distance);
    }

    /**
     * SMO over the one-class dual with box constraint 1. Kernel columns are
     * computed on demand and kept in a least recently used cache.
     */
    private static final class Solver {

        private final double[][] rows;
        private final double gamma;
        private final double tolerance;
        private final double[] alpha;
        private final double[] gradient;
        private final Map<Integer, double[]> cache;

        Solver(double[][] rows, double gamma, double nu, double tolerance, int cachedColumns) {
            this.rows = rows;
            this.gamma = gamma;
            this.tolerance = tolerance;
            int l = rows.length;
            alpha = new double[l];
            gradient = new double[l];
            cache = new LinkedHashMap<Integer, double[]>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Integer, double[]> eldest) {
                    return size() > cachedColumns;
                }
            };

            double total = nu * l;
            int full = (int) total;
            for (int i = 0; i < full; i++) {
                alpha[i] = 1;
            }
            if (full < l) {
                alpha[full] = total - full;
            }
            for (int i = 0; i < l; i++) {
                if (alpha[i] > 0) {
                    double[] column = column(i);
                    for (int t = 0; t < l; t++) {
                        gradient[t] += alpha[i] * column[t];
                    }
                }
            }
        }

        private double[] column(int i) {
            double[] column = cache.get(i);
            if (column == null) {
                column = new double[rows.length];
                for (int t = 0; t < rows.length; t++) {
                    column[t] = kernel(rows[i], rows[t], gamma);
                }
                cache.put(i, column);
            }
            return column;
        }

        void solve() {
            int l = rows.length;
            long maxIterations = Math.max(10_000_000L, 100L * l);
            long iteration = 0;
            for (; iteration < maxIterations; iteration++) {
                int i = -1;
                double gmax = Double.NEGATIVE_INFINITY;
                for (int t = 0; t < l; t++) {
                    if (alpha[t] < 1 && -gradient[t] >= gmax) {
                        gmax = -gradient[t];
                        i = t;
                    }
                }
                if (i == -1) {
                    break;
                }

                double[] columnI = column(i);
                int j = -1;
                double gmax2 = Double.NEGATIVE_INFINITY;
                double bestDecrease = Double.POSITIVE_INFINITY;
                for (int t = 0; t < l; t++) {
                    if (alpha[t] > 0) {
                        gmax2 = Math.max(gmax2, gradient[t]);
                        double difference = gmax + gradient[t];
                        if (difference > 0) {
                            double curvature = 2 - 2 * columnI[t];
                            double decrease = -difference * difference / (curvature > 0 ? curvature : TAU);
                            if (decrease <= bestDecrease) {
                                bestDecrease = decrease;
                                j = t;
                            }
                        }
                    }
                }
                if (gmax + gmax2 < tolerance || j == -1) {
                    break;
                }

                double[] columnJ = column(j);
                double curvature = 2 - 2 * columnI[j];
                double delta = (gradient[i] - gradient[j]) / (curvature > 0 ? curvature : TAU);
                double oldI = alpha[i];
                double oldJ = alpha[j];
                double sum = oldI + oldJ;
                alpha[i] -= delta;
                alpha[j] += delta;
                if (sum > 1) {
                    if (alpha[i] > 1) {
                        alpha[i] = 1;
                        alpha[j] = sum - 1;
                    }
                } else if (alpha[j] < 0) {
                    alpha[j] = 0;
                    alpha[i] = sum;
                }
                if (sum > 1) {
                    if (alpha[j] > 1) {
                        alpha[j] = 1;
                        alpha[i] = sum - 1;
                    }
                } else if (alpha[i] < 0) {
                    alpha[i] = 0;
                    alpha[j] = sum;
                }

                double changeI = alpha[i] - oldI;
                double changeJ = alpha[j] - oldJ;
                for (int t = 0; t < l; t++) {
                    gradient[t] += columnI[t] * changeI + columnJ[t] * changeJ;
                }
            }
            if (iteration == maxIterations) {
                LOG.warn("one-class svm stopped after {} iterations without reaching tolerance {}", iteration,
                        tolerance);
            }
        }

        double rho() {
            double upper = Double.POSITIVE_INFINITY;
            double lower = Double.NEGATIVE_INFINITY;
            double freeSum = 0;
            int free = 0;
            for (int t = 0; t < rows.length; t++) {
                if (alpha[t] >= 1) {
                    lower = Math.max(lower, gradient[t]);
                } else if (alpha[t] <= 0) {
                    upper = Math.min(upper, gradient[t]);
                } else {
                    free++;
                    freeSum += gradient[t];
                }
            }
            if (free > 0) {
                return freeSum / free;
            }
            if (Double.isInfinite(upper)) {
                return lower;
            }
            return Double.isInfinite(lower) ? upper : (upper + lower) / 2;
        }
    }
}
