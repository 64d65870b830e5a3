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

package com.amazon.balanceddistribution;

import java.util.List;
import java.util.Objects;

import com.amazon.balanceddistribution.exceptions.ShapeMismatchException;

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
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
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
     * Throws a {@link ShapeMismatchException} if the point does not have the
     * expected number of dimensions.
     *
     * @param point      the feature vector to test
     * @param dimensions the dimension the model was built with
     * @throws ShapeMismatchException if {@code point.length != dimensions}
     */
    public static void checkDimensions(double[] point, int dimensions) {
        checkNotNull(point, "point must not be null");
        if (point.length != dimensions) {
            throw new ShapeMismatchException(dimensions, point.length);
        }
    }

    /**
     * Throws an {@link IllegalArgumentException} if the point contains a NaN or an
     * infinite value.
     *
     * @param point the feature vector to test
     */
    public static void checkFinite(double[] point) {
        for (int i = 0; i < point.length; i++) {
            checkArgument(Double.isFinite(point[i]),
                    String.format("feature vectors must be finite, found %f at index %d", point[i], i));
        }
    }

    /**
     * Copies a list of rows into a fresh two dimensional array.
     *
     * @param rows the rows to copy
     * @return a deep copy of the rows
     */
    public static double[][] toMatrix(List<double[]> rows) {
        double[][] result = new double[rows.size()][];
        for (int i = 0; i < result.length; i++) {
            result[i] = rows.get(i).clone();
        }
        return result;
    }
}
