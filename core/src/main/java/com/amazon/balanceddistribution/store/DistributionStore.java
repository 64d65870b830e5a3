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

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkDimensions;
import static com.amazon.balanceddistribution.CommonUtils.checkFinite;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;
import static com.amazon.balanceddistribution.CommonUtils.toMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.balanceddistribution.config.FitMode;
import com.amazon.balanceddistribution.exceptions.NotFittedException;
import com.amazon.balanceddistribution.statistics.CovarianceEstimator;
import com.amazon.balanceddistribution.statistics.FittedStatistics;
import com.amazon.balanceddistribution.statistics.IncrementalCovariance;

/**
 * The ordered set of retained ("normal") feature vectors together with the
 * statistics fitted on them. The statistics are a cache: every mutation clears
 * them and {@link #fit()} must be called before the next distance query.
 */
public class DistributionStore {

    @Getter
    private final int dimensions;

    @Getter
    private final FitMode fitMode;

    private final List<double[]> points;

    // null until fit() and after every mutation
    private FittedStatistics statistics;

    // running moments, only used with FitMode.INCREMENTAL
    private final IncrementalCovariance accumulator;

    public DistributionStore(int dimensions) {
        this(dimensions, FitMode.FULL_REFIT);
    }

    public DistributionStore(int dimensions, FitMode fitMode) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        this.dimensions = dimensions;
        this.fitMode = checkNotNull(fitMode, "fitMode must not be null");
        this.points = new ArrayList<>();
        this.accumulator = (fitMode == FitMode.INCREMENTAL) ? new IncrementalCovariance(dimensions) : null;
    }

    /**
     * Appends a copy of the point and invalidates the statistics.
     *
     * @param point a finite feature vector of length {@link #getDimensions()}
     */
    public void add(double[] point) {
        checkDimensions(point, dimensions);
        checkFinite(point);
        double[] copy = point.clone();
        points.add(copy);
        if (accumulator != null) {
            accumulator.update(copy);
        }
        statistics = null;
    }

    public void addAll(List<double[]> newPoints) {
        checkNotNull(newPoints, "points must not be null");
        for (double[] point : newPoints) {
            add(point);
        }
    }

    /**
     * Removes, in one batch, every point whose flag is set. Surviving points keep
     * their relative order.
     *
     * @param marked one flag per retained point
     * @return the number of points removed
     */
    public int removeMarked(boolean[] marked) {
        checkNotNull(marked, "marked must not be null");
        checkArgument(marked.length == points.size(),
                String.format("expected %d flags, found %d", points.size(), marked.length));
        List<double[]> survivors = new ArrayList<>(points.size());
        for (int i = 0; i < marked.length; i++) {
            if (!marked[i]) {
                survivors.add(points.get(i));
            }
        }
        int removed = points.size() - survivors.size();
        if (removed > 0) {
            points.clear();
            points.addAll(survivors);
            rebuildAccumulator();
            statistics = null;
        }
        return removed;
    }

    /**
     * Discards all points and statistics.
     */
    public void clear() {
        points.clear();
        rebuildAccumulator();
        statistics = null;
    }

    /**
     * Fits the mean and pseudo-inverse covariance of the retained points and
     * caches them until the next mutation.
     *
     * @return the fitted statistics
     * @throws com.amazon.balanceddistribution.exceptions.DegenerateModelException
     *         if fewer than two points are retained or their covariance is zero
     */
    public FittedStatistics fit() {
        if (accumulator != null) {
            statistics = CovarianceEstimator.fit(accumulator);
        } else {
            statistics = CovarianceEstimator.fit(points, dimensions);
        }
        return statistics;
    }

    public boolean isFitted() {
        return statistics != null;
    }

    /**
     * @return the cached statistics
     * @throws NotFittedException if the statistics are missing or stale
     */
    public FittedStatistics getStatistics() {
        if (statistics == null) {
            throw new NotFittedException(
                    "statistics are missing or stale, fit the distribution before computing a Mahalanobis distance");
        }
        return statistics;
    }

    public double getMahalanobisDistance(double[] point) {
        checkDimensions(point, dimensions);
        return getStatistics().getMahalanobisDistance(point);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @param index position in the retained order
     * @return a copy of the point
     */
    public double[] get(int index) {
        return points.get(index).clone();
    }

    /**
     * @return an unmodifiable view of the retained points; the arrays must not be
     *         modified
     */
    public List<double[]> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public double[][] toArray() {
        return toMatrix(points);
    }

    private void rebuildAccumulator() {
        if (accumulator != null) {
            accumulator.reset();
            for (double[] point : points) {
                accumulator.update(point);
            }
        }
    }
}
