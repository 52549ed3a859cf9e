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

package com.amazon.anomalyensemble.examples.report;

import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * JSON summary of a comparison run.
 */
@Data
public class ComparisonSummary {

    private int datasetCount;
    private List<String> strategies;
    private Map<String, Double> meanPrecision;
    private Map<String, Double> meanRecall;
    private Map<String, Double> meanF1;
    private String bestStrategy;
    private Map<String, Double> reconstructionPercentiles;
    private Map<String, Double> reconstructionThresholds;
    private Map<String, String> failures;
}
