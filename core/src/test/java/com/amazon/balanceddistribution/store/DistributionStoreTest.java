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

package com.amazon.balanceddistribution.store;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.balanceddistribution.config.FitMode;
import com.amazon.balanceddistribution.exceptions.DegenerateModelException;
import com.amazon.balanceddistribution.exceptions.NotFittedException;
import com.amazon.balanceddistribution.exceptions.ShapeMismatchException;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;

public class DistributionStoreTest {

    private DistributionStore store;

    @BeforeEach
    public void setUp() {
        store = new DistributionStore(1);
        store.addAll(Arrays.asList(new double[] { 0 }, new double[] { 2 }, new double[] { 4 }));
    }

    @Test
    public void testDistanceRequiresFit() {
        assertFalse(store.isFitted());
        assertThrows(NotFittedException.class, () -> store.getMahalanobisDistance(new double[] { 1 }));

        store.fit();
        assertTrue(store.isFitted());
        assertEquals(4.0, store.getMahalanobisDistance(new double[] { 10 }), 1e-12);
    }

    @Test
    public void testMutationInvalidatesStatistics() {
        store.fit();
        store.add(new double[] { 10 });
        assertFalse(store.isFitted());
        assertThrows(NotFittedException.class, store::getStatistics);

        store.fit();
        assertArrayEquals(new double[] { 4.0 }, store.getStatistics().getMean(), 1e-12);

        store.removeMarked(new boolean[] { true, false, false, false });
        assertFalse(store.isFitted());

        store.fit();
        store.clear();
        assertFalse(store.isFitted());
        assertTrue(store.isEmpty());
    }

    @Test
    public void testRemoveMarkedKeepsOrder() {
        store.add(new double[] { 10 });
        store.add(new double[] { 20 });
        assertEquals(2, store.removeMarked(new boolean[] { false, true, false, true, false }));
        List<Double> remaining = store.getPoints().stream().map(p -> p[0]).collect(Collectors.toList());
        assertThat(remaining, contains(0.0, 4.0, 20.0));
    }

    @Test
    public void testRemoveNothingKeepsStatistics() {
        store.fit();
        assertEquals(0, store.removeMarked(new boolean[3]));
        assertTrue(store.isFitted());
        assertThrows(IllegalArgumentException.class, () -> store.removeMarked(new boolean[2]));
    }

    @Test
    public void testAddRejectsInvalidPoints() {
        assertThrows(ShapeMismatchException.class, () -> store.add(new double[] { 1, 2 }));
        assertThrows(IllegalArgumentException.class, () -> store.add(new double[] { Double.NaN }));
        assertThrows(IllegalArgumentException.class, () -> store.add(new double[] { Double.NEGATIVE_INFINITY }));
        assertThrows(NullPointerException.class, () -> store.add(null));
        assertEquals(3, store.size());
    }

    @Test
    public void testStoredPointsAreCopies() {
        double[] point = new double[] { 6 };
        store.add(point);
        point[0] = 100;
        assertArrayEquals(new double[] { 6 }, store.get(3));
        store.get(3)[0] = 100;
        assertArrayEquals(new double[] { 6 }, store.toArray()[3]);
        assertThrows(UnsupportedOperationException.class, () -> store.getPoints().remove(0));
    }

    @Test
    public void testFitWithSinglePoint() {
        DistributionStore single = new DistributionStore(2);
        single.add(new double[] { 1, 1 });
        assertThrows(DegenerateModelException.class, single::fit);
    }

    @ParameterizedTest
    @EnumSource(FitMode.class)
    public void testFitModesAgree(FitMode fitMode) {
        List<double[]> points = new NormalMixtureTestData().generateNormalData(100, 2, 7);
        DistributionStore reference = new DistributionStore(2, FitMode.FULL_REFIT);
        DistributionStore candidate = new DistributionStore(2, fitMode);
        reference.addAll(points);
        candidate.addAll(points);

        boolean[] marked = new boolean[points.size()];
        for (int i = 0; i < marked.length; i += 3) {
            marked[i] = true;
        }
        reference.removeMarked(marked);
        candidate.removeMarked(marked);
        reference.fit();
        candidate.fit();

        assertEquals(fitMode, candidate.getFitMode());
        double[] query = new double[] { 1.5, -2.0 };
        assertEquals(reference.getMahalanobisDistance(query), candidate.getMahalanobisDistance(query), 1e-9);
    }
}
