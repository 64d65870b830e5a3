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

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkDimensions;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.util.List;

import lombok.Getter;

import com.amazon.balanceddistribution.config.FitMode;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.evaluation.DistanceEvaluation;
import com.amazon.balanceddistribution.evaluation.DistanceLabel;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.statistics.FittedStatistics;
import com.amazon.balanceddistribution.store.DistributionStore;

/**
 * An anomaly model formed by a Balanced Distribution of feature vectors. The
 * anomaly measure of a query is its Mahalanobis distance to the distribution;
 * a query is anomalous when that distance is strictly greater than the
 * classification threshold.
 *
 * <p>
 * Models are produced by {@link BalancedDistributionGenerator} or restored from
 * a persisted state, and are not modified afterwards. The statistics are fit
 * lazily on first use when the model was restored.
 *
 * @see <a href="https://www.mdpi.com/2076-3417/9/4/757">Balanced Distribution
 *      reference</a>
 */
public class BalancedDistribution {

    /**
     * Name under which models of this type are stored.
     */
    public static final String MODEL_NAME = "BalancedDistribution";

    @Getter
    private final Hyperparameters hyperparameters;

    private final DistributionStore store;

    /**
     * Wraps a finished store. The caller hands over ownership and must not modify
     * the store afterwards.
     *
     * @param hyperparameters the configuration the store was generated with
     * @param store           the pruned store
     */
    public BalancedDistribution(Hyperparameters hyperparameters, DistributionStore store) {
        this.hyperparameters = checkNotNull(hyperparameters, "hyperparameters must not be null");
        this.store = checkNotNull(store, "store must not be null");
        checkArgument(!store.isEmpty(), "a Balanced Distribution must not be empty");
    }

    /**
     * Creates a model from previously generated vectors, for example when
     * restoring a persisted model.
     *
     * @param hyperparameters      the configuration the vectors were generated
     *                             with
     * @param balancedDistribution the retained vectors, all of the same dimension
     */
    public BalancedDistribution(Hyperparameters hyperparameters, List<double[]> balancedDistribution) {
        this(hyperparameters, toStore(balancedDistribution));
    }

    private static DistributionStore toStore(List<double[]> balancedDistribution) {
        checkNotNull(balancedDistribution, "balancedDistribution must not be null");
        checkArgument(!balancedDistribution.isEmpty(), "a Balanced Distribution must not be empty");
        checkNotNull(balancedDistribution.get(0), "balancedDistribution must not contain null vectors");
        DistributionStore store = new DistributionStore(balancedDistribution.get(0).length, FitMode.FULL_REFIT);
        store.addAll(balancedDistribution);
        return store;
    }

    /**
     * @return the mean and inverse covariance of the distribution, fitting them
     *         if this has not happened yet
     * @throws com.amazon.balanceddistribution.exceptions.DegenerateModelException
     *         if the distribution holds fewer than two vectors or their
     *         covariance is zero
     */
    public synchronized FittedStatistics getStatistics() {
        if (!store.isFitted()) {
            store.fit();
        }
        return store.getStatistics();
    }

    /**
     * @param point a feature vector of length {@link #getDimensions()}
     * @return the Mahalanobis distance between the point and the distribution
     */
    public double getMahalanobisDistance(double[] point) {
        checkDimensions(point, store.getDimensions());
        return getStatistics().getMahalanobisDistance(point);
    }

    /**
     * Computes the distances of a labeled set of points in one pass.
     *
     * @param points feature vectors of length {@link #getDimensions()}
     * @param labels one label per point
     * @return the distances and the largest distance for each known label
     */
    public DistanceEvaluation getMahalanobisDistances(List<double[]> points, List<DistanceLabel> labels) {
        return DistanceEvaluation.evaluate(this, points, labels);
    }

    /**
     * Classifies the point against the configured classification threshold.
     *
     * @param point a feature vector of length {@link #getDimensions()}
     * @return true if the point is anomalous
     */
    public boolean classify(double[] point) {
        return classify(point, hyperparameters.getThresholdClassification());
    }

    /**
     * @param point     a feature vector of length {@link #getDimensions()}
     * @param threshold overrides the configured classification threshold
     * @return true if the distance of the point is strictly greater than the
     *         threshold
     */
    public boolean classify(double[] point, double threshold) {
        return getMahalanobisDistance(point) > threshold;
    }

    public int getDimensions() {
        return store.getDimensions();
    }

    /**
     * @return the number of vectors in the distribution
     */
    public int size() {
        return store.size();
    }

    /**
     * @return a copy of the retained vectors, in order
     */
    public double[][] getBalancedDistribution() {
        return store.toArray();
    }

    public double[] getMean() {
        return getStatistics().getMean();
    }

    public double[][] getInverseCovariance() {
        return getStatistics().getInverseCovariance();
    }
}
