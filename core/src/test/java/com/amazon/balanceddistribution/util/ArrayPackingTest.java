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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ArrayPackingTest {

    @Test
    public void testPackIsRowMajor() {
        double[][] rows = new double[][] { { 1.0, 2.0 }, { 3.0, 4.0 }, { 5.0, 6.0 } };
        assertArrayEquals(new double[] { 1.0, 2.0, 3.0, 4.0, 5.0, 6.0 }, ArrayPacking.pack(rows, 2));
    }

    @Test
    public void testUnpackRows() {
        List<double[]> rows = ArrayPacking.unpackRows(new double[] { 1.0, 2.0, 3.0, 4.0, 5.0, 6.0 }, 2, 3);
        assertEquals(2, rows.size());
        assertArrayEquals(new double[] { 1.0, 2.0, 3.0 }, rows.get(0));
        assertArrayEquals(new double[] { 4.0, 5.0, 6.0 }, rows.get(1));
    }

    @Test
    public void testInvalidShapes() {
        assertThrows(IllegalArgumentException.class,
                () -> ArrayPacking.pack(new double[][] { { 1.0, 2.0 }, { 3.0 } }, 2));
        assertThrows(IllegalArgumentException.class, () -> ArrayPacking.unpackRows(new double[5], 2, 3));
        assertThrows(IllegalArgumentException.class, () -> ArrayPacking.unpackRows(new double[0], 0, 0));
        assertThrows(NullPointerException.class, () -> ArrayPacking.unpackRows(null, 1, 1));
    }

    @Test
    public void testUnpackRowsRejectsOverflowingShape() {
        // 65536 * 65536 wraps to 0 in int arithmetic
        assertThrows(IllegalArgumentException.class, () -> ArrayPacking.unpackRows(new double[0], 65536, 65536));
    }
}
