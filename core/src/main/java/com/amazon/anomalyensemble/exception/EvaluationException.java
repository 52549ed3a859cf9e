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

package com.amazon.anomalyensemble.exception;

/**
 * Base class for conditions that make a single dataset impossible to evaluate.
 * The multi-dataset runner isolates these per dataset; everything else is
 * treated as a defect and propagates.
 */
public class EvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String datasetId;

    public EvaluationException(String datasetId, String message) {
        super(message);
        this.datasetId = datasetId;
    }

    public EvaluationException(String datasetId, String message, Throwable cause) {
        super(message, cause);
        this.datasetId = datasetId;
    }

    /**
     * @return the dataset the failure belongs to, or null when it was raised
     *         before the dataset was known
     */
    public String getDatasetId() {
        return datasetId;
    }
}
