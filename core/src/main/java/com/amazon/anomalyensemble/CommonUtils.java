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

package com.amazon.anomalyensemble;

import java.util.Arrays;
import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Deep copy of a matrix.
     *
     * @param matrix the rows to copy
     * @return a copy that shares no row arrays with the input
     */
    public static double[][] copyOf(double[][] matrix) {
        checkNotNull(matrix, "matrix must not be null");
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            checkNotNull(matrix[i], "matrix rows must not be null");
            result[i] = Arrays.copyOf(matrix[i], matrix[i].length);
        }
        return result;
    }

    /**
     * Returns the common row width of a matrix.
     *
     * @param matrix a non-empty matrix
     * @return the number of columns
     * @throws IllegalArgumentException if the matrix is empty, has empty rows or
     *                                  rows of different widths
     */
    public static int columnCount(double[][] matrix) {
        checkNotNull(matrix, "matrix must not be null");
        checkArgument(matrix.length > 0, "matrix must have at least one row");
        int columns = matrix[0].length;
        checkArgument(columns > 0, "matrix must have at least one column");
        for (int i = 1; i < matrix.length; i++) {
            checkArgument(matrix[i].length == columns,
                    String.format("row %d has %d columns, expected %d", i, matrix[i].length, columns));
        }
        return columns;
    }

    public static void checkFinite(double[][] matrix, String message) {
        for (double[] row : matrix) {
            for (double value : row) {
                checkArgument(Double.isFinite(value), message);
            }
        }
    }
}
