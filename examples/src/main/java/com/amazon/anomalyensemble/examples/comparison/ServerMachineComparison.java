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

import java.nio.file.Paths;

import com.amazon.anomalyensemble.data.DatasetLoader;
import com.amazon.anomalyensemble.examples.datasets.SmdDirectoryLoader;
import com.amazon.anomalyensemble.runner.ArgumentParser;

/**
 * Compares isolation, reconstruction and their combinations on every machine
 * of a Server Machine Dataset directory.
 */
public class ServerMachineComparison extends ComparisonExample {

    public static void main(String[] args) throws Exception {
        new ServerMachineComparison().run(args);
    }

    @Override
    public String command() {
        return "smd";
    }

    @Override
    public String description() {
        return "compare detector ensembles on the Server Machine Dataset (see --data-directory)";
    }

    @Override
    protected DatasetLoader createLoader(ArgumentParser parser) {
        return new SmdDirectoryLoader(Paths.get(parser.getDataDirectory()));
    }
}
