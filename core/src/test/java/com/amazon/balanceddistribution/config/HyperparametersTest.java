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

package com.amazon.balanceddistribution.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.balanceddistribution.exceptions.InvalidParameterException;

public class HyperparametersTest {

    @Test
    public void testDefaults() {
        Hyperparameters hyperparameters = Hyperparameters.builder().build();
        assertEquals(1000, hyperparameters.getInitialNormalFeatures());
        assertEquals(20.0, hyperparameters.getThresholdLearning());
        assertEquals(5.0, hyperparameters.getThresholdClassification());
        assertEquals(0.5, hyperparameters.getPruningParameter());
        assertEquals(10.0, hyperparameters.getPruningThreshold());
    }

    @Test
    public void testPruningThresholdIsScaledLearningThreshold() {
        Hyperparameters hyperparameters = Hyperparameters.builder().thresholdLearning(4.0)
                .thresholdClassification(100.0).pruningParameter(0.25).build();
        assertEquals(1.0, hyperparameters.getPruningThreshold());
    }

    @Test
    public void testToBuilder() {
        Hyperparameters hyperparameters = new Hyperparameters(3, 2.0, 1.5, 0.5);
        assertEquals(hyperparameters, hyperparameters.toBuilder().build());
        assertNotEquals(hyperparameters, hyperparameters.toBuilder().pruningParameter(0.75).build());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 1.0, -0.5, 1.5, Double.NaN })
    public void testPruningParameterOutOfRange(double pruningParameter) {
        assertThrows(InvalidParameterException.class,
                () -> Hyperparameters.builder().pruningParameter(pruningParameter).build());
    }

    @Test
    public void testInvalidThresholds() {
        assertThrows(InvalidParameterException.class, () -> Hyperparameters.builder().thresholdLearning(0).build());
        assertThrows(InvalidParameterException.class,
                () -> Hyperparameters.builder().thresholdLearning(Double.POSITIVE_INFINITY).build());
        assertThrows(InvalidParameterException.class,
                () -> Hyperparameters.builder().thresholdClassification(-1).build());
        assertThrows(InvalidParameterException.class,
                () -> Hyperparameters.builder().thresholdClassification(Double.NaN).build());
        assertThrows(InvalidParameterException.class,
                () -> Hyperparameters.builder().initialNormalFeatures(0).build());
    }

    @Test
    public void testInvalidParameterIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new Hyperparameters(10, 2.0, 1.0, 1.0));
    }
}
