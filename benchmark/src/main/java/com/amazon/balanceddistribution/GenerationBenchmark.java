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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.balanceddistribution.config.FitMode;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.generation.GenerationResult;
import com.amazon.balanceddistribution.generation.IGenerationListener;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;

/**
 * Compares refitting the statistics from scratch with updating running moments
 * after every accepted vector.
 */
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class GenerationBenchmark {
    public static final int NUM_TRAIN_SAMPLES = 10_000;
    public static final int NUM_TEST_SAMPLES = 1000;
    public static final int INITIAL_NORMAL_FEATURES = 1000;

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "5", "20" })
        int dimensions;

        @Param({ "3.0", "5.0" })
        double thresholdLearning;

        @Param({ "FULL_REFIT", "INCREMENTAL" })
        FitMode fitMode;

        List<double[]> trainingData;
        List<double[]> testData;
        BalancedDistribution model;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData gen = new NormalMixtureTestData();
            trainingData = gen.generateTestData(NUM_TRAIN_SAMPLES, dimensions, INITIAL_NORMAL_FEATURES, 0).data;
            testData = gen.generateTestData(NUM_TEST_SAMPLES, dimensions, 1).data;
            model = newGenerator(this).generate(trainingData).getModel().get();
        }
    }

    static BalancedDistributionGenerator newGenerator(BenchmarkState state) {
        Hyperparameters hyperparameters = Hyperparameters.builder().initialNormalFeatures(INITIAL_NORMAL_FEATURES)
                .thresholdLearning(state.thresholdLearning).build();
        return new BalancedDistributionGenerator(hyperparameters, state.fitMode, IGenerationListener.NONE);
    }

    @Benchmark
    public GenerationResult generate(BenchmarkState state) {
        return newGenerator(state).generate(state.trainingData);
    }

    @Benchmark
    @OperationsPerInvocation(NUM_TEST_SAMPLES)
    public void classify(BenchmarkState state, Blackhole blackhole) {
        for (double[] point : state.testData) {
            blackhole.consume(state.model.classify(point));
        }
    }
}
