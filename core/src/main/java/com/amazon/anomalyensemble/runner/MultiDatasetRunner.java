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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import lombok.Builder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.config.CombinationRule;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.data.Dataset;
import com.amazon.anomalyensemble.data.DatasetLoader;
import com.amazon.anomalyensemble.detector.IDecisionDetector;
import com.amazon.anomalyensemble.detector.IScoringDetector;
import com.amazon.anomalyensemble.ensemble.EnsembleCombiner;
import com.amazon.anomalyensemble.ensemble.SuspectValidationStrategy;
import com.amazon.anomalyensemble.evaluation.Evaluator;
import com.amazon.anomalyensemble.exception.EvaluationException;
import com.amazon.anomalyensemble.preprocessor.IScaler;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.MetricRecord;
import com.amazon.anomalyensemble.returntypes.MetricsTable;
import com.amazon.anomalyensemble.returntypes.ScoreVector;
import com.amazon.anomalyensemble.returntypes.ThresholdCandidate;
import com.amazon.anomalyensemble.threshold.PercentileThresholdOptimizer;

/**
 * Runs every strategy over a collection of independent datasets and collects
 * one {@link MetricRecord} per dataset and strategy.
 *
 * For each dataset: load, optionally standardize, fit a fresh isolation
 * detector and a fresh reconstruction detector on the training rows, pick the
 * reconstruction threshold with {@link PercentileThresholdOptimizer}, optionally
 * evaluate a one-class svm baseline, combine
 * the two decisions with every configured {@link CombinationRule}, optionally
 * run {@link SuspectValidationStrategy}, and evaluate each decision against the
 * labels.
 *
 * A dataset whose loading fails with an {@link IOException} or whose evaluation
 * fails with an {@link EvaluationException} is logged and skipped; its rows are
 * absent from the table. Any other exception is a defect and ends the run.
 */
public class MultiDatasetRunner {

    private static final Logger LOG = LogManager.getLogger(MultiDatasetRunner.class);

    public static final String ISOLATION = "isolation";
    public static final String AUTOENCODER = "autoencoder";
    public static final String ONE_CLASS_SVM = "one_class_svm";

    private final DatasetLoader loader;
    private final Supplier<? extends IDecisionDetector> isolationFactory;
    private final Supplier<? extends IScoringDetector> reconstructionFactory;
    private final Supplier<? extends IDecisionDetector> oneClassSvmFactory;
    private final Supplier<? extends IScaler> scalerFactory;
    private final PercentileThresholdOptimizer optimizer;
    private final List<CombinationRule> rules;
    private final SuspectValidationStrategy suspectValidation;
    private final int threads;

    /**
     * @param loader                supplies datasets by id
     * @param isolationFactory      new isolation detector per call
     * @param reconstructionFactory new reconstruction detector per call
     * @param oneClassSvmFactory    new baseline detector per call, or null to
     *                              skip the baseline
     * @param scalerFactory         new scaler per call, or null for no scaling
     * @param optimizer             threshold optimizer for reconstruction scores
     * @param rules                 combination rules, applied to (reconstruction,
     *                              isolation)
     * @param suspectValidation     two stage strategy, or null to skip it
     * @param threads               number of datasets evaluated concurrently
     */
    @Builder
    public MultiDatasetRunner(DatasetLoader loader, Supplier<? extends IDecisionDetector> isolationFactory,
            Supplier<? extends IScoringDetector> reconstructionFactory,
            Supplier<? extends IDecisionDetector> oneClassSvmFactory, Supplier<? extends IScaler> scalerFactory,
            PercentileThresholdOptimizer optimizer, List<CombinationRule> rules,
            SuspectValidationStrategy suspectValidation, Integer threads) {
        this.loader = checkNotNull(loader, "loader must not be null");
        this.isolationFactory = checkNotNull(isolationFactory, "isolationFactory must not be null");
        this.reconstructionFactory = checkNotNull(reconstructionFactory, "reconstructionFactory must not be null");
        this.oneClassSvmFactory = oneClassSvmFactory;
        this.scalerFactory = scalerFactory;
        this.optimizer = optimizer == null ? new PercentileThresholdOptimizer() : optimizer;
        this.rules = rules == null ? EnsembleConfig.DEFAULT_RULES : new ArrayList<>(rules);
        this.suspectValidation = suspectValidation;
        this.threads = threads == null ? 1 : threads;
        checkArgument(this.threads > 0, "threads must be greater than 0");
        checkUniqueNames();
    }

    /**
     * @param loader supplies datasets by id
     * @param config detector, threshold and combination settings
     * @return a runner wired from {@code config}
     */
    public static MultiDatasetRunner fromConfig(DatasetLoader loader, EnsembleConfig config) {
        config.validate();
        SuspectValidationStrategy suspectValidation = config.isSuspectValidationEnabled()
                ? new SuspectValidationStrategy(config.isolationFactory(), config.reconstructionFactory(),
                        config.getValidationPercentile())
                : null;
        return builder().loader(loader).isolationFactory(config.isolationFactory())
                .reconstructionFactory(config.reconstructionFactory())
                .oneClassSvmFactory(config.oneClassSvmFactory()).scalerFactory(config.scalerFactory())
                .optimizer(new PercentileThresholdOptimizer(config.getPercentileSweep()))
                .rules(config.getCombinationRules()).suspectValidation(suspectValidation)
                .threads(config.getThreads()).build();
    }

    private void checkUniqueNames() {
        LinkedHashSet<String> names = new LinkedHashSet<>(getStrategies());
        checkArgument(names.size() == getStrategies().size(), "strategy names must be unique: " + getStrategies());
    }

    /**
     * @return the strategy names every successful dataset reports, in row order
     */
    public List<String> getStrategies() {
        List<String> names = new ArrayList<>();
        names.add(ISOLATION);
        names.add(AUTOENCODER);
        if (oneClassSvmFactory != null) {
            names.add(ONE_CLASS_SVM);
        }
        rules.forEach(rule -> names.add(rule.getName()));
        if (suspectValidation != null) {
            names.add(SuspectValidationStrategy.NAME);
        }
        return names;
    }

    /**
     * Evaluates every dataset the loader lists, in the loader's order.
     *
     * @return the report
     * @throws IOException if the loader cannot list its datasets
     */
    public EvaluationReport run() throws IOException {
        return run(loader.listDatasetIds());
    }

    /**
     * Evaluates the given datasets. Duplicate ids are evaluated once, at their
     * first position.
     *
     * @param datasetIds ids to evaluate
     * @return the report
     */
    public EvaluationReport run(Collection<String> datasetIds) {
        checkNotNull(datasetIds, "datasetIds must not be null");
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(datasetIds));
        LOG.info("evaluating {} datasets with strategies {}", ids.size(), getStrategies());

        MetricsTable table = new MetricsTable();
        Map<String, ThresholdCandidate> thresholds = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();

        if (threads == 1 || ids.size() <= 1) {
            for (String id : ids) {
                try {
                    collect(evaluate(id), table, thresholds);
                } catch (IOException | EvaluationException e) {
                    recordFailure(id, e, failures);
                }
            }
        } else {
            runParallel(ids, table, thresholds, failures);
        }

        LOG.info("evaluated {} datasets, skipped {}", ids.size() - failures.size(), failures.size());
        return new EvaluationReport(table, thresholds, failures);
    }

    private void runParallel(List<String> ids, MetricsTable table, Map<String, ThresholdCandidate> thresholds,
            Map<String, String> failures) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, ids.size()));
        try {
            List<Future<DatasetResult>> futures = new ArrayList<>(ids.size());
            for (String id : ids) {
                futures.add(executor.submit(() -> evaluate(id)));
            }
            // results are appended here, in dataset order, by a single thread
            for (int i = 0; i < ids.size(); i++) {
                try {
                    collect(futures.get(i).get(), table, thresholds);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof IOException || cause instanceof EvaluationException) {
                        recordFailure(ids.get(i), (Exception) cause, failures);
                    } else if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    } else if (cause instanceof Error) {
                        throw (Error) cause;
                    } else {
                        throw new IllegalStateException("unexpected failure evaluating " + ids.get(i), cause);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while evaluating datasets", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void collect(DatasetResult result, MetricsTable table, Map<String, ThresholdCandidate> thresholds) {
        table.addAll(result.records);
        thresholds.put(result.datasetId, result.threshold);
    }

    private static void recordFailure(String id, Exception e, Map<String, String> failures) {
        LOG.warn("skipping dataset " + id + ": " + e.getMessage(), e);
        failures.put(id, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    /**
     * Loads and evaluates a single dataset.
     *
     * @param datasetId id to load
     * @return the rows for this dataset and the selected threshold
     * @throws IOException if loading fails
     */
    DatasetResult evaluate(String datasetId) throws IOException {
        LOG.info("evaluating dataset {}", datasetId);
        Dataset dataset = loader.load(datasetId);
        checkNotNull(dataset, "loader returned null for " + datasetId);
        return evaluate(dataset);
    }

    DatasetResult evaluate(Dataset raw) {
        Dataset dataset = scale(raw);
        double[][] train = dataset.getTrain();
        double[][] test = dataset.getTest();
        DecisionVector truth = dataset.getLabels();

        IDecisionDetector isolation = isolationFactory.get();
        isolation.fit(train);
        DecisionVector isolationDecisions = isolation.decide(test);

        IScoringDetector reconstruction = reconstructionFactory.get();
        reconstruction.fit(train);
        ScoreVector errors = reconstruction.score(test);
        ThresholdCandidate best = optimizer.optimize(errors, truth);
        DecisionVector reconstructionDecisions = best.getDecisions();
        LOG.debug("dataset {} reconstruction threshold {}", dataset.getId(), best);

        List<MetricRecord> records = new ArrayList<>();
        records.add(new MetricRecord(dataset.getId(), ISOLATION, Evaluator.evaluate(isolationDecisions, truth)));
        records.add(new MetricRecord(dataset.getId(), AUTOENCODER, best.getMetrics()));
        if (oneClassSvmFactory != null) {
            IDecisionDetector baseline = oneClassSvmFactory.get();
            baseline.fit(train);
            records.add(new MetricRecord(dataset.getId(), ONE_CLASS_SVM,
                    Evaluator.evaluate(baseline.decide(test), truth)));
        }
        for (CombinationRule rule : rules) {
            DecisionVector combined = EnsembleCombiner.combine(rule, reconstructionDecisions, isolationDecisions);
            records.add(new MetricRecord(dataset.getId(), rule.getName(), Evaluator.evaluate(combined, truth)));
        }
        if (suspectValidation != null) {
            DecisionVector confirmed = suspectValidation.decide(train, test);
            records.add(new MetricRecord(dataset.getId(), SuspectValidationStrategy.NAME,
                    Evaluator.evaluate(confirmed, truth)));
        }
        return new DatasetResult(dataset.getId(), records, best);
    }

    private Dataset scale(Dataset dataset) {
        if (scalerFactory == null) {
            return dataset;
        }
        IScaler scaler = scalerFactory.get();
        scaler.fit(dataset.getTrain());
        return dataset.withFeatures(scaler.transform(dataset.getTrain()), scaler.transform(dataset.getTest()));
    }

    static final class DatasetResult {
        final String datasetId;
        final List<MetricRecord> records;
        final ThresholdCandidate threshold;

        DatasetResult(String datasetId, List<MetricRecord> records, ThresholdCandidate threshold) {
            this.datasetId = datasetId;
            this.records = records;
            this.threshold = threshold;
        }
    }
}
