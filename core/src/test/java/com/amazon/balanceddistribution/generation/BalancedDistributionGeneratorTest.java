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

package com.amazon.balanceddistribution.generation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.FitMode;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.exceptions.DegenerateModelException;
import com.amazon.balanceddistribution.exceptions.InsufficientDataException;
import com.amazon.balanceddistribution.exceptions.ShapeMismatchException;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;

public class BalancedDistributionGeneratorTest {

    private Hyperparameters hyperparameters;
    private List<double[]> features;

    @BeforeEach
    public void setUp() {
        hyperparameters = Hyperparameters.builder().initialNormalFeatures(200).thresholdLearning(3.0)
                .thresholdClassification(3.0).pruningParameter(0.5).build();
        features = new NormalMixtureTestData().generateNormalData(600, 2, 17);
    }

    @Test
    public void testGenerate() {
        GenerationResult result = new BalancedDistributionGenerator(hyperparameters).generate(features);

        assertTrue(result.isCompleted());
        assertEquals(GenerationStatus.COMPLETED, result.getStatus());
        assertEquals(600, result.getNumberOfFeatures());
        assertTrue(result.getDurationMillis() >= 0);

        BalancedDistribution model = result.getModel().get();
        assertEquals(2, model.getDimensions());
        assertEquals(200 + result.getAccepted() - result.getPruned(), model.size());
        assertEquals(hyperparameters, model.getHyperparameters());

        assertTrue(model.classify(new double[] { 10.0, 10.0 }));
        assertFalse(model.classify(model.getMean()));
    }

    @Test
    public void testGenerationIsDeterministic() {
        BalancedDistribution first = new BalancedDistributionGenerator(hyperparameters).generate(features).getModel()
                .get();
        BalancedDistribution second = new BalancedDistributionGenerator(hyperparameters).generate(features)
                .getModel().get();

        assertArrayEquals(first.getBalancedDistribution(), second.getBalancedDistribution());
        assertArrayEquals(first.getMean(), second.getMean());
    }

    @Test
    public void testIncrementalFitModeProducesUsableModel() {
        GenerationResult result = new BalancedDistributionGenerator(hyperparameters, FitMode.INCREMENTAL,
                IGenerationListener.NONE).generate(features);
        BalancedDistribution model = result.getModel().get();
        assertTrue(model.size() > 1);
        assertTrue(model.classify(new double[] { 10.0, 10.0 }));
    }

    @Test
    public void testScenarioPrunesToDegenerateModel() {
        Hyperparameters scenario = new Hyperparameters(3, 2.0, 1.0, 0.5);
        BalancedDistributionGenerator generator = new BalancedDistributionGenerator(scenario);
        assertThrows(DegenerateModelException.class, () -> generator.generate(GrowthEngineTest.scenario()));
    }

    @Test
    public void testInsufficientData() {
        BalancedDistributionGenerator generator = new BalancedDistributionGenerator(hyperparameters);
        assertThrows(InsufficientDataException.class, () -> generator.generate(features.subList(0, 200)));
        assertThrows(InsufficientDataException.class, () -> generator.generate(new ArrayList<>()));
    }

    @Test
    public void testShapeMismatch() {
        List<double[]> mixed = new ArrayList<>(features);
        mixed.set(450, new double[] { 1.0, 2.0, 3.0 });
        IGenerationListener listener = mock(IGenerationListener.class);
        BalancedDistributionGenerator generator = new BalancedDistributionGenerator(hyperparameters,
                FitMode.FULL_REFIT, listener);

        assertThrows(ShapeMismatchException.class, () -> generator.generate(mixed));
        verify(listener, never()).phaseStarted(eq(GenerationPhase.GROWTH), anyInt());
    }

    @Test
    public void testCancelledBeforeGrowth() {
        CancellationFlag flag = new CancellationFlag();
        flag.cancel();

        GenerationResult result = new BalancedDistributionGenerator(hyperparameters).generate(features, flag);

        assertFalse(result.isCompleted());
        assertEquals(GenerationStatus.CANCELLED, result.getStatus());
        assertFalse(result.getModel().isPresent());
    }

    @Test
    public void testThreadInterruptCancels() {
        Thread.currentThread().interrupt();
        try {
            GenerationResult result = new BalancedDistributionGenerator(hyperparameters).generate(features,
                    ICancellationToken.threadInterrupted());
            assertEquals(GenerationStatus.CANCELLED, result.getStatus());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testCancelledDuringPruning() {
        int[] polls = new int[1];
        // growth polls once per vector after the seed
        ICancellationToken token = () -> ++polls[0] > 400;
        IGenerationListener listener = mock(IGenerationListener.class);

        GenerationResult result = new BalancedDistributionGenerator(hyperparameters, FitMode.FULL_REFIT, listener)
                .generate(features, token);

        assertEquals(GenerationStatus.CANCELLED, result.getStatus());
        assertFalse(result.getModel().isPresent());
        verify(listener).phaseCompleted(eq(GenerationPhase.GROWTH), anyInt());
        verify(listener).phaseStarted(eq(GenerationPhase.PRUNING), anyInt());
        verify(listener, never()).phaseCompleted(eq(GenerationPhase.PRUNING), anyInt());
    }

    @Test
    public void testListenerIsNotifiedInOrder() {
        IGenerationListener listener = mock(IGenerationListener.class);
        GenerationResult result = new BalancedDistributionGenerator(hyperparameters, FitMode.FULL_REFIT, listener)
                .generate(features);
        int grown = 200 + result.getAccepted();

        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).phaseStarted(GenerationPhase.GROWTH, 600);
        inOrder.verify(listener).phaseCompleted(GenerationPhase.GROWTH, grown);
        inOrder.verify(listener).phaseStarted(GenerationPhase.PRUNING, grown);
        inOrder.verify(listener).phaseCompleted(GenerationPhase.PRUNING, grown - result.getPruned());
    }
}
