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

package com.amazon.balanceddistribution.statistics;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.balanceddistribution.exceptions.ShapeMismatchException;

public class FittedStatisticsTest {

    private FittedStatistics statistics;

    @BeforeEach
    public void setUp() {
        statistics = new FittedStatistics(new double[] { 0.0, 0.0 }, MatrixUtils.createRealIdentityMatrix(2));
    }

    @Test
    public void testDistanceWithIdentityIsEuclidean() {
        assertEquals(5.0, statistics.getMahalanobisDistance(new double[] { 3.0, 4.0 }), 1e-12);
        assertEquals(0.0, statistics.getMahalanobisDistance(new double[] { 0.0, 0.0 }));
    }

    @Test
    public void testScaledDistance() {
        FittedStatistics scaled = new FittedStatistics(new double[] { 1.0, -1.0 },
                new Array2DRowRealMatrix(new double[][] { { 0.25, 0 }, { 0, 1 } }));
        // (4^2 * 0.25 + 0) = 4
        assertEquals(2.0, scaled.getMahalanobisDistance(new double[] { 5.0, -1.0 }), 1e-12);
    }

    @Test
    public void testNegativeQuadraticFormIsClamped() {
        FittedStatistics negative = new FittedStatistics(new double[] { 0.0 },
                new Array2DRowRealMatrix(new double[][] { { -1e-18 } }));
        assertEquals(0.0, negative.getMahalanobisDistance(new double[] { 1.0 }));
    }

    @Test
    public void testShapeMismatch() {
        ShapeMismatchException exception = assertThrows(ShapeMismatchException.class,
                () -> statistics.getMahalanobisDistance(new double[] { 1.0, 2.0, 3.0 }));
        assertEquals(2, exception.getExpectedDimensions());
        assertEquals(3, exception.getActualDimensions());
        assertThrows(IllegalArgumentException.class,
                () -> new FittedStatistics(new double[] { 0.0 }, MatrixUtils.createRealIdentityMatrix(2)));
    }

    @Test
    public void testCopiesAreReturned() {
        double[] mean = statistics.getMean();
        mean[0] = 100.0;
        assertArrayEquals(new double[] { 0.0, 0.0 }, statistics.getMean());
        assertEquals(2, statistics.getDimensions());
    }
}
