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

package com.amazon.anomalyensemble.ensemble;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.detector.IDecisionDetector;
import com.amazon.anomalyensemble.detector.IScoringDetector;
import com.amazon.anomalyensemble.exception.DetectorFitException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;
import com.amazon.anomalyensemble.util.Percentiles;

/**
 * Two stage confirmation: the isolation detector proposes suspects and the
 * reconstruction detector confirms them.
 *
 * <ol>
 * <li>fit the isolation detector on the training rows</li>
 * <li>fit the reconstruction detector only on the training rows the isolation
 * detector judges normal</li>
 * <li>the validation threshold is the {@code validationPercentile} (95 by
 * default) of the reconstruction error on those normal rows</li>
 * <li>a row is flagged iff the isolation detector flags it and its
 * reconstruction error is strictly above the threshold</li>
 * </ol>
 *
 * Unlike the combination rules of {@link EnsembleCombiner}, the second detector
 * here depends on the first, so this is reported as its own strategy.
 */
public class SuspectValidationStrategy {

    private static final Logger LOG = LogManager.getLogger(SuspectValidationStrategy.class);

    public static final String NAME = "suspect_validation";
    public static final double DEFAULT_VALIDATION_PERCENTILE = 95;

    private final Supplier<? extends IDecisionDetector> isolationFactory;
    private final Supplier<? extends IScoringDetector> reconstructionFactory;
    private final double validationPercentile;

    public SuspectValidationStrategy(Supplier<? extends IDecisionDetector> isolationFactory,
            Supplier<? extends IScoringDetector> reconstructionFactory) {
        this(isolationFactory, reconstructionFactory, DEFAULT_VALIDATION_PERCENTILE);
    }

    public SuspectValidationStrategy(Supplier<? extends IDecisionDetector> isolationFactory,
            Supplier<? extends IScoringDetector> reconstructionFactory, double validationPercentile) {
        this.isolationFactory = checkNotNull(isolationFactory, "isolationFactory must not be null");
        this.reconstructionFactory = checkNotNull(reconstructionFactory, "reconstructionFactory must not be null");
        checkArgument(validationPercentile >= 0 && validationPercentile < 100,
                "validation percentile must be in [0, 100)");
        this.validationPercentile = validationPercentile;
    }

    /**
     * Trains both stages on {@code train} and validates the rows of
     * {@code rows}. Passing the training matrix as {@code rows} reproduces the
     * single matrix workflow.
     *
     * @param train rows used for fitting
     * @param rows  rows to decide
     * @return suspects, confirmed rows and the reconstruction errors of
     *         {@code rows}
     */
    public SuspectValidationResult validate(double[][] train, double[][] rows) {
        checkNotNull(train, "train must not be null");
        checkNotNull(rows, "rows must not be null");

        IDecisionDetector isolation = isolationFactory.get();
        isolation.fit(train);
        DecisionVector trainingSuspects = isolation.decide(train);

        List<double[]> normal = new ArrayList<>(train.length);
        for (int i = 0; i < train.length; i++) {
            if (!trainingSuspects.isFlagged(i)) {
                normal.add(train[i]);
            }
        }
        if (normal.isEmpty()) {
            throw new DetectorFitException("isolation detector judged every training row anomalous");
        }
        double[][] normalRows = normal.toArray(new double[0][]);

        IScoringDetector reconstruction = reconstructionFactory.get();
        reconstruction.fit(normalRows);
        double threshold = Percentiles.percentile(reconstruction.score(normalRows).toArray(), validationPercentile);

        DecisionVector suspects = isolation.decide(rows);
        ScoreVector errors = reconstruction.score(rows);
        boolean[] confirmed = new boolean[rows.length];
        for (int i = 0; i < rows.length; i++) {
            confirmed[i] = suspects.isFlagged(i) && errors.get(i) > threshold;
        }
        DecisionVector result = new DecisionVector(confirmed);
        LOG.debug("{} of {} suspects confirmed, threshold {} from {} normal training rows", result.count(),
                suspects.count(), threshold, normalRows.length);
        return new SuspectValidationResult(suspects, result, errors, threshold, normalRows.length);
    }

    /**
     * @param train rows used for fitting
     * @param test  rows to decide
     * @return the confirmed decision per test row
     */
    public DecisionVector decide(double[][] train, double[][] test) {
        return validate(train, test).getConfirmed();
    }

    public double getValidationPercentile() {
        return validationPercentile;
    }
}
