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

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkDimensions;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * The mean and the pseudo-inverse of the covariance of a set of feature
 * vectors. Instances are immutable; accessors return copies.
 */
public class FittedStatistics {

    private final double[] mean;

    private final RealMatrix inverseCovariance;

    public FittedStatistics(double[] mean, RealMatrix inverseCovariance) {
        checkNotNull(mean, "mean must not be null");
        checkNotNull(inverseCovariance, "inverseCovariance must not be null");
        checkArgument(inverseCovariance.getRowDimension() == mean.length
                && inverseCovariance.getColumnDimension() == mean.length,
                String.format("shapes do not match (mean: %d, inverse covariance: %dx%d)", mean.length,
                        inverseCovariance.getRowDimension(), inverseCovariance.getColumnDimension()));
        this.mean = mean.clone();
        this.inverseCovariance = inverseCovariance.copy();
    }

    /**
     * Computes sqrt((x - mean)^T * inverseCovariance * (x - mean)). Rounding can
     * make the quadratic form of a pseudo-inverse slightly negative; such values
     * are treated as 0.
     *
     * @param point the feature vector
     * @return the Mahalanobis distance between the point and the fitted
     *         distribution
     */
    public double getMahalanobisDistance(double[] point) {
        checkDimensions(point, mean.length);
        double[] delta = new double[mean.length];
        for (int i = 0; i < mean.length; i++) {
            delta[i] = point[i] - mean[i];
        }
        double[] product = inverseCovariance.preMultiply(delta);
        double sum = 0;
        for (int i = 0; i < mean.length; i++) {
            sum += product[i] * delta[i];
        }
        return Math.sqrt(Math.max(sum, 0.0));
    }

    public int getDimensions() {
        return mean.length;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[][] getInverseCovariance() {
        return inverseCovariance.getData();
    }
}
