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

import org.junit.jupiter.api.Test;

public class IncrementalCovarianceTest {

    @Test
    public void testMeanAndCovariance() {
        IncrementalCovariance accumulator = new IncrementalCovariance(2);
        accumulator.update(new double[] { 0, 1 });
        accumulator.update(new double[] { 2, 3 });
        accumulator.update(new double[] { 4, 2 });

        assertEquals(3, accumulator.getCount());
        assertArrayEquals(new double[] { 2, 2 }, accumulator.getMean(), 1e-12);
        double[][] covariance = accumulator.getCovariance().getData();
        assertArrayEquals(new double[] { 4, 1 }, covariance[0], 1e-12);
        assertArrayEquals(new double[] { 1, 1 }, covariance[1], 1e-12);
    }

    @Test
    public void testReset() {
        IncrementalCovariance accumulator = new IncrementalCovariance(1);
        accumulator.update(new double[] { 7 });
        accumulator.update(new double[] { 9 });
        accumulator.reset();
        assertEquals(0, accumulator.getCount());
        assertThrows(IllegalStateException.class, accumulator::getMean);

        accumulator.update(new double[] { 1 });
        assertArrayEquals(new double[] { 1 }, accumulator.getMean());
        assertThrows(IllegalStateException.class, accumulator::getCovariance);
    }

    @Test
    public void testInvalidDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new IncrementalCovariance(0));
        IncrementalCovariance accumulator = new IncrementalCovariance(2);
        assertThrows(IllegalArgumentException.class, () -> accumulator.update(new double[] { 1 }));
    }
}
