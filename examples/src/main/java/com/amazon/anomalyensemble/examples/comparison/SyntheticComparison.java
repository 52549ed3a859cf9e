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

package com.amazon.anomalyensemble.examples.comparison;

import com.amazon.anomalyensemble.data.DatasetLoader;
import com.amazon.anomalyensemble.examples.datasets.SyntheticMachineLoader;
import com.amazon.anomalyensemble.runner.ArgumentParser;
import com.amazon.anomalyensemble.testutils.SyntheticMachineData;

/**
 * Compares the strategies on generated machines whose anomalies come from a
 * shifted normal mixture, so the run needs no downloaded data.
 */
public class SyntheticComparison extends ComparisonExample {

    public static final int MACHINES = 5;
    public static final int TRAIN_ROWS = 1000;
    public static final int TEST_ROWS = 600;
    public static final int COLUMNS = 8;

    public static void main(String[] args) throws Exception {
        new SyntheticComparison().run(args);
    }

    @Override
    public String command() {
        return "synthetic";
    }

    @Override
    public String description() {
        return "compare detector ensembles on generated machines";
    }

    @Override
    protected DatasetLoader createLoader(ArgumentParser parser) {
        return new SyntheticMachineLoader(new SyntheticMachineData().generateMachines(MACHINES, TRAIN_ROWS,
                TEST_ROWS, COLUMNS, parser.getRandomSeed()));
    }
}
