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

package com.amazon.anomalyensemble.data;

import java.io.IOException;
import java.util.List;

/**
 * Supplies datasets by identifier. File formats are up to the implementation.
 */
public interface DatasetLoader {

    /**
     * @return the identifiers this loader can serve; order is not significant
     * @throws IOException if the identifiers cannot be listed
     */
    List<String> listDatasetIds() throws IOException;

    /**
     * Loads one dataset.
     *
     * @param datasetId identifier returned by {@link #listDatasetIds()}
     * @return the dataset
     * @throws IOException if the underlying data cannot be read
     */
    Dataset load(String datasetId) throws IOException;
}
