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

package com.amazon.anomalyensemble.examples.validation;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.detector.AutoencoderDetector;
import com.amazon.anomalyensemble.detector.RandomCutForestDetector;
import com.amazon.anomalyensemble.ensemble.SuspectValidationResult;
import com.amazon.anomalyensemble.ensemble.SuspectValidationStrategy;
import com.amazon.anomalyensemble.examples.Example;
import com.amazon.anomalyensemble.preprocessor.StandardScaler;
import com.amazon.anomalyensemble.validation.FeatureLimit;
import com.amazon.anomalyensemble.validation.FeatureLimitValidator;
import com.amazon.anomalyensemble.validation.RowValidation;

/**
 * Confirms isolation suspects in one matrix of server telemetry with an
 * auto-encoder trained on the unsuspected rows, then checks every confirmed row
 * against operational limits on the raw values.
 *
 * The optional argument is a CSV file with a header naming the columns
 * {@code cpu}, {@code ram}, {@code disk} and {@code network}. Without it the
 * example generates telemetry with a few injected spikes.
 */
public class SuspectValidationExample implements Example {

    private static final Logger LOG = LogManager.getLogger(SuspectValidationExample.class);

    public static final String[] COLUMNS = { "cpu", "ram", "disk", "network" };

    public static final List<FeatureLimit> LIMITS = Arrays.asList(new FeatureLimit("cpu", 0, 90),
            new FeatureLimit("ram", 1, 80), new FeatureLimit("disk", 2, 85), new FeatureLimit("network", 3, 70));

    public static void main(String[] args) throws Exception {
        new SuspectValidationExample().run(args);
    }

    @Override
    public String command() {
        return "suspect_validation";
    }

    @Override
    public String description() {
        return "confirm isolation suspects with an auto-encoder and check them against resource limits";
    }

    @Override
    public void run(String... args) throws Exception {
        double[][] raw = args.length > 0 ? readTelemetry(Paths.get(args[0])) : generateTelemetry(2000, 42L);
        LOG.info("validating {} telemetry rows", raw.length);

        StandardScaler scaler = new StandardScaler();
        scaler.fit(raw);
        double[][] scaled = scaler.transform(raw);

        SuspectValidationResult result = createStrategy(42L).validate(scaled, scaled);
        System.out.printf("%d suspects, %d confirmed (reconstruction threshold %.4f over %d normal rows)%n",
                result.getSuspects().count(), result.getConfirmed().count(), result.getThreshold(),
                result.getNormalTrainingRows());

        List<RowValidation> validations = new FeatureLimitValidator(LIMITS).validate(raw, result.getConfirmed());
        int critical = 0;
        for (RowValidation validation : validations) {
            System.out.println(validation);
            if (validation.isCritical()) {
                critical++;
            }
        }
        System.out.printf("%d of %d confirmed anomalies exceed a resource limit%n", critical, validations.size());
    }

    public static SuspectValidationStrategy createStrategy(long seed) {
        return new SuspectValidationStrategy(
                () -> RandomCutForestDetector.builder().contamination(0.05).numberOfTrees(50).randomSeed(seed)
                        .build(),
                () -> AutoencoderDetector.builder().hiddenLayers(new int[] { 8, 4, 8 }).epochs(50).batchSize(16)
                        .learningRate(0.001).randomSeed(seed).build(),
                SuspectValidationStrategy.DEFAULT_VALIDATION_PERCENTILE);
    }

    /**
     * Reads the telemetry columns by header name, ignoring any other column.
     */
    public static double[][] readTelemetry(Path file) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = in.readLine();
            if (header == null) {
                throw new IOException(file + " is empty");
            }
            List<String> names = Arrays.asList(header.trim().split(","));
            int[] positions = new int[COLUMNS.length];
            for (int j = 0; j < COLUMNS.length; j++) {
                positions[j] = names.indexOf(COLUMNS[j]);
                if (positions[j] < 0) {
                    throw new IOException(String.format("%s has no %s column", file, COLUMNS[j]));
                }
            }

            List<double[]> rows = new ArrayList<>();
            String line;
            int lineNumber = 1;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                String[] values = line.split(",");
                double[] row = new double[COLUMNS.length];
                for (int j = 0; j < COLUMNS.length; j++) {
                    if (positions[j] >= values.length) {
                        throw new IllegalArgumentException(
                                String.format("%s line %d has %d values", file, lineNumber, values.length));
                    }
                    row[j] = Double.parseDouble(values[positions[j]].trim());
                }
                rows.add(row);
            }
            return rows.toArray(new double[0][]);
        }
    }

    /**
     * @return usage percentages around typical levels, with about 3% of rows
     *         pushed toward saturation in one or more resources
     */
    public static double[][] generateTelemetry(int rows, long seed) {
        double[] level = { 45, 55, 60, 30 };
        double[] spread = { 10, 8, 5, 10 };
        Random random = new Random(seed);
        double[][] result = new double[rows][COLUMNS.length];
        for (int i = 0; i < rows; i++) {
            boolean spike = random.nextDouble() < 0.03;
            for (int j = 0; j < COLUMNS.length; j++) {
                double value = level[j] + spread[j] * random.nextGaussian();
                if (spike && random.nextBoolean()) {
                    value = 88 + 10 * random.nextDouble();
                }
                result[i][j] = Math.max(0, Math.min(100, value));
            }
        }
        return result;
    }
}
