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

package com.amazon.balanceddistribution.testutils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * This class samples points from a mixture of 2 multi-variate normal
 * distributions with covariance matrices of the form sigma * I. One of the
 * normal distributions is considered the base distribution, the second is
 * considered the anomaly distribution, and there are random transitions between
 * the two. All randomness comes from a single seeded generator so the output is
 * reproducible.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;
    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 10.0, 2.0, 0.01, 0.3);
    }

    public NormalMixtureTestData(double baseMu, double anomalyMu) {
        this(baseMu, 1.0, anomalyMu, 2.0, 0.01, 0.3);
    }

    /**
     * @param numberOfRows    number of vectors
     * @param numberOfColumns dimension of each vector
     * @param seed            seed of the random generator
     * @return vectors drawn from the base distribution only
     */
    public List<double[]> generateNormalData(int numberOfRows, int numberOfColumns, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        List<double[]> result = new ArrayList<>(numberOfRows);
        for (int i = 0; i < numberOfRows; i++) {
            double[] row = new double[numberOfColumns];
            fillRow(row, dist, baseMu, baseSigma);
            result.add(row);
        }
        return result;
    }

    public LabeledData generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateTestData(numberOfRows, numberOfColumns, 0, seed);
    }

    /**
     * Generates vectors switching between the base and the anomaly distribution.
     *
     * @param numberOfRows    number of vectors
     * @param numberOfColumns dimension of each vector
     * @param normalPrefix    number of leading vectors drawn from the base
     *                        distribution regardless of the transitions
     * @param seed            seed of the random generator
     * @return the vectors together with a flag per vector that is set when the
     *         vector came from the anomaly distribution
     */
    public LabeledData generateTestData(int numberOfRows, int numberOfColumns, int normalPrefix, long seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);
        List<double[]> data = new ArrayList<>(numberOfRows);
        boolean[] labels = new boolean[numberOfRows];
        boolean anomaly = false;

        for (int i = 0; i < numberOfRows; i++) {
            double[] row = new double[numberOfColumns];
            if (!anomaly || i < normalPrefix) {
                fillRow(row, dist, baseMu, baseSigma);
                if (i >= normalPrefix - 1 && rng.nextDouble() < transitionToAnomalyProbability) {
                    anomaly = true;
                }
            } else {
                fillRow(row, dist, anomalyMu, anomalySigma);
                labels[i] = true;
                if (rng.nextDouble() < transitionToBaseProbability) {
                    anomaly = false;
                }
            }
            data.add(row);
        }
        return new LabeledData(data, labels);
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
