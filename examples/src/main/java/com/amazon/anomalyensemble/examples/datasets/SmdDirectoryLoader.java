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

package com.amazon.anomalyensemble.examples.datasets;

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.data.Dataset;
import com.amazon.anomalyensemble.data.DatasetLoader;
import com.amazon.anomalyensemble.exception.InvalidDatasetException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;

/**
 * Reads the Server Machine Dataset layout: {@code train/<machine>.txt},
 * {@code test/<machine>.txt} and {@code test_label/<machine>.txt} under one
 * root directory. Feature files are comma separated without a header; label
 * files hold one 0 or 1 per line.
 */
public class SmdDirectoryLoader implements DatasetLoader {

    private static final Logger LOG = LogManager.getLogger(SmdDirectoryLoader.class);

    public static final String TRAIN_DIRECTORY = "train";
    public static final String TEST_DIRECTORY = "test";
    public static final String LABEL_DIRECTORY = "test_label";
    public static final String SUFFIX = ".txt";
    public static final String DELIMITER = ",";

    private final Path root;

    public SmdDirectoryLoader(Path root) {
        this.root = checkNotNull(root, "root must not be null");
    }

    /**
     * @return the machine names found in the training directory, sorted
     * @throws IOException if the training directory cannot be listed
     */
    @Override
    public List<String> listDatasetIds() throws IOException {
        try (Stream<Path> files = Files.list(root.resolve(TRAIN_DIRECTORY))) {
            List<String> ids = files.filter(Files::isRegularFile).map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length())).sorted()
                    .collect(Collectors.toList());
            LOG.info("found {} machines under {}", ids.size(), root);
            return ids;
        }
    }

    @Override
    public Dataset load(String datasetId) throws IOException {
        String fileName = datasetId + SUFFIX;
        double[][] train = readMatrix(datasetId, root.resolve(TRAIN_DIRECTORY).resolve(fileName));
        double[][] test = readMatrix(datasetId, root.resolve(TEST_DIRECTORY).resolve(fileName));
        DecisionVector labels = readLabels(datasetId, root.resolve(LABEL_DIRECTORY).resolve(fileName));
        LOG.debug("loaded {}: {} training rows, {} test rows", datasetId, train.length, test.length);
        return new Dataset(datasetId, train, test, labels);
    }

    static double[][] readMatrix(String datasetId, Path file) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                String[] values = line.split(DELIMITER);
                double[] row = new double[values.length];
                for (int i = 0; i < values.length; i++) {
                    row[i] = parse(datasetId, file, lineNumber, values[i]);
                }
                rows.add(row);
            }
        }
        return rows.toArray(new double[0][]);
    }

    static DecisionVector readLabels(String datasetId, Path file) throws IOException {
        List<Boolean> labels = new ArrayList<>();
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                double value = parse(datasetId, file, lineNumber, line);
                if (value != 0.0 && value != 1.0) {
                    throw new InvalidDatasetException(datasetId,
                            String.format("%s line %d: label must be 0 or 1, found %s", file, lineNumber, line));
                }
                labels.add(value == 1.0);
            }
        }
        boolean[] flags = new boolean[labels.size()];
        for (int i = 0; i < flags.length; i++) {
            flags[i] = labels.get(i);
        }
        return new DecisionVector(flags);
    }

    private static double parse(String datasetId, Path file, int lineNumber, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidDatasetException(datasetId,
                    String.format("%s line %d: not a number: %s", file, lineNumber, value), e);
        }
    }

    public Path getRoot() {
        return root;
    }
}
