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

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.anomalyensemble.data.Dataset;
import com.amazon.anomalyensemble.data.DatasetLoader;
import com.amazon.anomalyensemble.returntypes.DecisionVector;
import com.amazon.anomalyensemble.testutils.LabeledMachineData;

/**
 * Serves generated machines from memory, in generation order.
 */
public class SyntheticMachineLoader implements DatasetLoader {

    private final Map<String, LabeledMachineData> machines = new LinkedHashMap<>();

    public SyntheticMachineLoader(List<LabeledMachineData> machines) {
        checkNotNull(machines, "machines must not be null");
        for (LabeledMachineData machine : machines) {
            this.machines.put(machine.name, machine);
        }
    }

    @Override
    public List<String> listDatasetIds() {
        return new ArrayList<>(machines.keySet());
    }

    @Override
    public Dataset load(String datasetId) throws IOException {
        LabeledMachineData machine = machines.get(datasetId);
        if (machine == null) {
            throw new IOException("no synthetic machine named " + datasetId);
        }
        return new Dataset(machine.name, machine.train, machine.test, new DecisionVector(machine.labels));
    }
}
