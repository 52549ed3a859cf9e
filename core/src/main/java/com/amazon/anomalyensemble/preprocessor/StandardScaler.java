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

package com.amazon.anomalyensemble.preprocessor;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkState;

import java.util.Arrays;

import com.amazon.anomalyensemble.CommonUtils;

/**
 * Centers every column on its training mean and divides by its training
 * (population) standard deviation. Columns that are constant on the training
 * rows are only centered.
 */
public class StandardScaler implements IScaler {

    private double[] mean;
    private double[] scale;

    @Override
    public void fit(double[][] train) {
        int columns = CommonUtils.columnCount(train);
        double[] sum = new double[columns];
        for (double[] row : train) {
            for (int j = 0; j < columns; j++) {
                sum[j] += row[j];
            }
        }
        double[] newMean = new double[columns];
        for (int j = 0; j < columns; j++) {
            newMean[j] = sum[j] / train.length;
        }
        double[] squares = new double[columns];
        for (double[] row : train) {
            for (int j = 0; j < columns; j++) {
                double delta = row[j] - newMean[j];
                squares[j] += delta * delta;
            }
        }
        double[] newScale = new double[columns];
        for (int j = 0; j < columns; j++) {
            double deviation = Math.sqrt(squares[j] / train.length);
            newScale[j] = deviation > 0 ? deviation : 1.0;
        }
        mean = newMean;
        scale = newScale;
    }

    @Override
    public double[][] transform(double[][] rows) {
        checkState(mean != null, "scaler must be fitted before transform");
        int columns = CommonUtils.columnCount(rows);
        checkArgument(columns == mean.length,
                String.format("expected %d columns, found %d", mean.length, columns));
        double[][] result = new double[rows.length][columns];
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < columns; j++) {
                result[i][j] = (rows[i][j] - mean[j]) / scale[j];
            }
        }
        return result;
    }

    public double[] getMean() {
        checkState(mean != null, "scaler is not fitted");
        return Arrays.copyOf(mean, mean.length);
    }

    public double[] getScale() {
        checkState(scale != null, "scaler is not fitted");
        return Arrays.copyOf(scale, scale.length);
    }
}
