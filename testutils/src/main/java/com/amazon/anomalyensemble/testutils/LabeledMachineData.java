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

package com.amazon.anomalyensemble.testutils;

/**
 * Training rows, test rows and test labels of one synthetic machine.
 */
public class LabeledMachineData {

    public final String name;
    public final double[][] train;
    public final double[][] test;
    public final boolean[] labels;

    public LabeledMachineData(String name, double[][] train, double[][] test, boolean[] labels) {
        this.name = name;
        this.train = train;
        this.test = test;
        this.labels = labels;
    }

    public int anomalyCount() {
        int count = 0;
        for (boolean label : labels) {
            if (label) {
                ++count;
            }
        }
        return count;
    }
}
