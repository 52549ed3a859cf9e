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
import com.amazon.anomalyensemble.exception.DetectorFitException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.returntypes.ScoreVector;
import com.amazon.anomalyensemble.util.Percentiles;
import com.amazon.randomcutforest.RandomCutForest;

/**
 * Density isolation detector backed by a Random Cut Forest.
 *
 * Training rows are streamed into the forest. Once the forest is ready, each
 * row is scored before it is inserted, so the scores behave like scores of
 * unseen rows. The outlier cut is the {@code (1 - contamination)} percentile of
 * those scores, so that roughly a {@code contamination} fraction of rows drawn
 * from the training distribution lies above it. A row is flagged iff its score is strictly above
 * the cut. Neither {@link #score} nor {@link #decide} updates the forest.
 */
@Getter
public class RandomCutForestDetector implements IDecisionDetector, IScoringDetector {

    private static final Logger LOG = LogManager.getLogger(RandomCutForestDetector.class);

    public static final double DEFAULT_CONTAMINATION = 0.05;
    public static final int DEFAULT_NUMBER_OF_TREES = 100;
    public static final int DEFAULT_SAMPLE_SIZE = 256;
    public static final long DEFAULT_RANDOM_SEED = 42L;

    private final double contamination;
    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;
    @Getter(AccessLevel.NONE)
    private RandomCutForest forest;
    private int dimensions;
    private double cut;

    @Builder
    public RandomCutForestDetector(Double contamination, Integer numberOfTrees, Integer sampleSize,
            Long randomSeed) {
        this.contamination = contamination == null ? DEFAULT_CONTAMINATION : contamination;
        this.numberOfTrees = numberOfTrees == null ? DEFAULT_NUMBER_OF_TREES : numberOfTrees;
        this.sampleSize = sampleSize == null ? DEFAULT_SAMPLE_SIZE : sampleSize;
        this.randomSeed = randomSeed == null ? DEFAULT_RANDOM_SEED : randomSeed;
        checkArgument(this.contamination > 0 && this.contamination <= 0.5, "contamination must be in (0, 0.5]");
        checkArgument(this.numberOfTrees > 0, "number of trees should be greater than 0");
        checkArgument(this.sampleSize > 0, "sample size should be greater than 0");
    }

    @Override
    public void fit(double[][] train) {
        checkNotNull(train, "train must not be null");
        RandomCutForest candidate;
        int columns;
        double[] streamingScores = new double[train.length];
        int scored = 0;
        try {
            columns = CommonUtils.columnCount(train);
            candidate = RandomCutForest.builder().dimensions(columns).numberOfTrees(numberOfTrees)
                    .sampleSize(sampleSize).timeDecay(0.0).parallelExecutionEnabled(false).randomSeed(randomSeed)
                    .build();
            for (double[] row : train) {
                if (candidate.isOutputReady()) {
                    streamingScores[scored++] = candidate.getAnomalyScore(row);
                }
                candidate.update(row);
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new DetectorFitException("cannot fit random cut forest: " + e.getMessage(), e);
        }
        if (scored == 0) {
            throw new DetectorFitException(
                    String.format("random cut forest is not ready after %d training rows", train.length));
        }

        forest = candidate;
        dimensions = columns;
        cut = Percentiles.percentile(Arrays.copyOf(streamingScores, scored), 100 * (1 - contamination));
        LOG.debug("forest trained on {} rows, outlier cut {} from {} streaming scores at contamination {}",
                train.length, cut, scored, contamination);
    }

    @Override
    public ScoreVector score(double[][] rows) {
        checkState(forest != null, "detector must be fitted before scoring");
        checkNotNull(rows, "rows must not be null");
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            checkArgument(rows[i].length == dimensions,
                    String.format("expected %d columns, found %d", dimensions, rows[i].length));
            scores[i] = forest.getAnomalyScore(rows[i]);
        }
        return new ScoreVector(scores);
    }

    @Override
    public DecisionVector decide(double[][] rows) {
        return score(rows).above(getCut());
    }

    /**
     * @return the score above which rows are flagged
     * @throws IllegalStateException if the detector is not fitted
     */
    public double getCut() {
        checkState(forest != null, "detector must be fitted first");
        return cut;
    }
}
