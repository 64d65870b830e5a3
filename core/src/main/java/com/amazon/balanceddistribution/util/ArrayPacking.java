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

package com.amazon.balanceddistribution.util;

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

public class ArrayPacking {

    private ArrayPacking() {
    }

    /**
     * Pack the rows of a matrix into a single array in row-major order.
     *
     * @param rows    The rows of the matrix.
     * @param columns The number of columns every row must have.
     * @return An array of length rows.length * columns.
     */
    public static double[] pack(double[][] rows, int columns) {
        checkNotNull(rows, "rows must not be null");
        checkArgument(columns > 0, "columns must be greater than 0");
        double[] packed = new double[Math.toIntExact((long) rows.length * columns)];
        for (int i = 0; i < rows.length; i++) {
            checkArgument(rows[i] != null && rows[i].length == columns,
                    String.format("row %d must have length %d", i, columns));
            System.arraycopy(rows[i], 0, packed, i * columns, columns);
        }
        return packed;
    }

    /**
     * Unpack a row-major array into a list of rows.
     *
     * @param packed  An array produced by {@link #pack(double[][], int)}.
     * @param rows    The number of rows.
     * @param columns The number of columns.
     * @return The list of rows, each a fresh array.
     */
    public static List<double[]> unpackRows(double[] packed, int rows, int columns) {
        checkNotNull(packed, "packed must not be null");
        checkArgument(rows >= 0, "rows must be non-negative");
        checkArgument(columns > 0, "columns must be greater than 0");
        long expected = (long) rows * columns;
        checkArgument(packed.length == expected, String.format(
                "incorrect length of packed data, expected %d x %d = %d but found %d", rows, columns, expected,
                packed.length));
        List<double[]> result = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            double[] row = new double[columns];
            System.arraycopy(packed, i * columns, row, 0, columns);
            result.add(row);
        }
        return result;
    }
}
