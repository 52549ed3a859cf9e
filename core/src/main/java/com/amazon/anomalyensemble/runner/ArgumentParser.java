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

package com.amazon.anomalyensemble.runner;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.anomalyensemble.config.CombinationRule;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.config.PercentileSweep;

/**
 * A utility class for parsing command-line arguments into an
 * {@link EnsembleConfig}.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/anomaly-ensemble-examples-1.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final DoubleArgument contamination;
    private final DoubleArgument percentileLower;
    private final DoubleArgument percentileUpper;
    private final DoubleArgument percentileStep;
    private final StringArgument voteWeights;
    private final BooleanArgument union;
    private final BooleanArgument intersection;
    private final IntegerArgument numberOfTrees;
    private final IntegerArgument sampleSize;
    private final IntegerArgument randomSeed;
    private final StringArgument hiddenLayers;
    private final IntegerArgument epochs;
    private final IntegerArgument batchSize;
    private final DoubleArgument learningRate;
    private final BooleanArgument suspectValidation;
    private final DoubleArgument validationPercentile;
    private final BooleanArgument oneClassSvm;
    private final DoubleArgument nu;
    private final BooleanArgument standardize;
    private final IntegerArgument threads;
    private final StringArgument dataDirectory;
    private final StringArgument outputPrefix;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        contamination = new DoubleArgument("-c", "--contamination",
                "Expected fraction of anomalous rows for the isolation detector.", 0.05,
                n -> checkArgument(n > 0.0 && n <= 0.5, "contamination must be in (0, 0.5]"));
        addArgument(contamination);

        percentileLower = new DoubleArgument(null, "--percentile-lower",
                "First percentile scanned when calibrating the reconstruction threshold (inclusive).", 80.0,
                n -> checkArgument(n >= 0.0 && n < 100.0, "percentile lower bound must be in [0, 100)"));
        addArgument(percentileLower);

        percentileUpper = new DoubleArgument(null, "--percentile-upper",
                "End of the percentile scan (exclusive).", 100.0,
                n -> checkArgument(n > 0.0 && n <= 100.0, "percentile upper bound must be in (0, 100]"));
        addArgument(percentileUpper);

        percentileStep = new DoubleArgument(null, "--percentile-step", "Step of the percentile scan.", 2.0,
                n -> checkArgument(n > 0.0, "percentile step must be greater than 0"));
        addArgument(percentileStep);

        voteWeights = new StringArgument("-v", "--vote-weights",
                "Weighted votes to evaluate as (auto-encoder:isolation) pairs separated by commas, or 'none'.",
                "0.3:0.7,0.5:0.5,0.7:0.3", ArgumentParser::parseVoteWeights);
        addArgument(voteWeights);

        union = new BooleanArgument(null, "--union", "Set to 'false' to skip the union strategy.", true);
        addArgument(union);

        intersection = new BooleanArgument(null, "--intersection",
                "Set to 'false' to skip the intersection strategy.", true);
        addArgument(intersection);

        numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees to use in the forest.", 100,
                n -> checkArgument(n > 0, "number of trees should be greater than 0"));
        addArgument(numberOfTrees);

        sampleSize = new IntegerArgument("-s", "--sample-size", "Number of points to keep in sample for each tree.",
                256, n -> checkArgument(n > 0, "sample size should be greater than 0"));
        addArgument(sampleSize);

        randomSeed = new IntegerArgument(null, "--random-seed", "Random seed used by both detectors.", 42);
        addArgument(randomSeed);

        hiddenLayers = new StringArgument(null, "--hidden-layers",
                "Comma separated sizes of the auto-encoder hidden layers.", "32,16,8,16,32",
                ArgumentParser::parseLayers);
        addArgument(hiddenLayers);

        epochs = new IntegerArgument("-e", "--epochs", "Number of auto-encoder training epochs.", 20,
                n -> checkArgument(n > 0, "epochs must be greater than 0"));
        addArgument(epochs);

        batchSize = new IntegerArgument("-b", "--batch-size", "Auto-encoder mini batch size.", 64,
                n -> checkArgument(n > 0, "batch size must be greater than 0"));
        addArgument(batchSize);

        learningRate = new DoubleArgument(null, "--learning-rate", "Auto-encoder Adam learning rate.", 0.001,
                n -> checkArgument(n > 0.0, "learning rate must be greater than 0"));
        addArgument(learningRate);

        suspectValidation = new BooleanArgument(null, "--suspect-validation",
                "Set to 'false' to skip the two stage suspect validation strategy.", true);
        addArgument(suspectValidation);

        validationPercentile = new DoubleArgument(null, "--validation-percentile",
                "Percentile of normal reconstruction error that confirms a suspect.", 95.0,
                n -> checkArgument(n >= 0.0 && n < 100.0, "validation percentile must be in [0, 100)"));
        addArgument(validationPercentile);

        oneClassSvm = new BooleanArgument(null, "--one-class-svm",
                "Set to 'true' to add a one-class svm baseline column.", false);
        addArgument(oneClassSvm);

        nu = new DoubleArgument(null, "--nu", "Upper bound on the one-class svm training outlier fraction.", 0.05,
                n -> checkArgument(n > 0.0 && n <= 1.0, "nu must be in (0, 1]"));
        addArgument(nu);

        standardize = new BooleanArgument(null, "--standardize",
                "Set to 'false' to skip standardizing features with training statistics.", true);
        addArgument(standardize);

        threads = new IntegerArgument("-t", "--threads", "Number of datasets evaluated concurrently.", 1,
                n -> checkArgument(n > 0, "threads must be greater than 0"));
        addArgument(threads);

        dataDirectory = new StringArgument("-d", "--data-directory",
                "Directory with train, test and test_label subdirectories.", "ServerMachineDataset");
        addArgument(dataDirectory);

        outputPrefix = new StringArgument("-o", "--output-prefix",
                "Prefix of the CSV and JSON report files, or empty to skip writing them.", "comparison");
        addArgument(outputPrefix);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     * @throws IllegalArgumentException if a flag is unknown, a value is missing or
     *                                  a value fails validation
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                printUsage();
                Runtime.getRuntime().exit(0);
            }
            Argument<?> argument = shortFlags.containsKey(flag) ? shortFlags.get(flag) : longFlags.get(flag);
            checkArgument(argument != null, "Unknown argument: " + flag);
            checkArgument(i + 1 < arguments.length, "Missing value for " + flag);
            argument.parse(arguments[++i]);
            i++;
        }
        checkArgument(getPercentileLower() < getPercentileUpper(),
                "percentile lower bound must be below the upper bound");
    }

    /**
     * Parse the arguments, printing usage and exiting on error.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parseOrExit(String... arguments) {
        try {
            parse(arguments);
        } catch (IllegalArgumentException e) {
            printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options]", ARCHIVE_NAME, runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the parsed values as a validated configuration
     */
    public EnsembleConfig toConfig() {
        List<CombinationRule> rules = new ArrayList<>();
        if (getUnion()) {
            rules.add(CombinationRule.union());
        }
        if (getIntersection()) {
            rules.add(CombinationRule.intersection());
        }
        for (double[] weights : parseVoteWeights(voteWeights.getValue())) {
            rules.add(CombinationRule.weightedVote(weights));
        }
        return EnsembleConfig.builder().contamination(getContamination())
                .percentileSweep(PercentileSweep.range(getPercentileLower(), getPercentileUpper(),
                        getPercentileStep()))
                .combinationRules(rules).numberOfTrees(getNumberOfTrees()).sampleSize(getSampleSize())
                .randomSeed(getRandomSeed()).hiddenLayers(getHiddenLayers()).epochs(getEpochs())
                .batchSize(getBatchSize()).learningRate(getLearningRate())
                .suspectValidationEnabled(getSuspectValidation()).validationPercentile(getValidationPercentile())
                .oneClassSvmEnabled(getOneClassSvm()).nu(getNu())
                .standardize(getStandardize()).threads(getThreads()).build().validate();
    }

    static List<double[]> parseVoteWeights(String value) {
        List<double[]> result = new ArrayList<>();
        if (value == null || value.trim().isEmpty() || "none".equalsIgnoreCase(value.trim())) {
            return result;
        }
        for (String pair : value.split(",")) {
            String[] parts = pair.trim().split(":");
            checkArgument(parts.length == 2, "vote weights must look like 0.3:0.7, found " + pair);
            double[] weights = new double[] { Double.parseDouble(parts[0]), Double.parseDouble(parts[1]) };
            checkArgument(weights[0] >= 0.0 && weights[1] >= 0.0, "vote weights must be non-negative");
            result.add(weights);
        }
        return result;
    }

    static int[] parseLayers(String value) {
        checkArgument(value != null && !value.trim().isEmpty(), "hidden layers must not be empty");
        int[] layers = Arrays.stream(value.split(",")).map(String::trim).mapToInt(Integer::parseInt).toArray();
        for (int layer : layers) {
            checkArgument(layer > 0, "hidden layer sizes must be greater than 0");
        }
        return layers;
    }

    public double getContamination() {
        return contamination.getValue();
    }

    public double getPercentileLower() {
        return percentileLower.getValue();
    }

    public double getPercentileUpper() {
        return percentileUpper.getValue();
    }

    public double getPercentileStep() {
        return percentileStep.getValue();
    }

    public List<double[]> getVoteWeights() {
        return parseVoteWeights(voteWeights.getValue());
    }

    public boolean getUnion() {
        return union.getValue();
    }

    public boolean getIntersection() {
        return intersection.getValue();
    }

    public int getNumberOfTrees() {
        return numberOfTrees.getValue();
    }

    public int getSampleSize() {
        return sampleSize.getValue();
    }

    public int getRandomSeed() {
        return randomSeed.getValue();
    }

    public int[] getHiddenLayers() {
        return parseLayers(hiddenLayers.getValue());
    }

    public int getEpochs() {
        return epochs.getValue();
    }

    public int getBatchSize() {
        return batchSize.getValue();
    }

    public double getLearningRate() {
        return learningRate.getValue();
    }

    public boolean getSuspectValidation() {
        return suspectValidation.getValue();
    }

    public double getValidationPercentile() {
        return validationPercentile.getValue();
    }

    public boolean getOneClassSvm() {
        return oneClassSvm.getValue();
    }

    public double getNu() {
        return nu.getValue();
    }

    public boolean getStandardize() {
        return standardize.getValue();
    }

    public int getThreads() {
        return threads.getValue();
    }

    public String getDataDirectory() {
        return dataDirectory.getValue();
    }

    public String getOutputPrefix() {
        return outputPrefix.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
