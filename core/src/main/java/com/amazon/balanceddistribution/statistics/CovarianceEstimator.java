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
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;
import static com.amazon.balanceddistribution.CommonUtils.toMatrix;

import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.correlation.Covariance;

import com.amazon.balanceddistribution.exceptions.DegenerateModelException;

/**
 * Fits the mean and the Moore-Penrose pseudo-inverse of the unbiased sample
 * covariance of a set of feature vectors. The pseudo-inverse is used because
 * the covariance is singular whenever the number of vectors is close to or
 * below the dimension.
 */
public class CovarianceEstimator {

    private CovarianceEstimator() {
    }

    /**
     * Fits statistics from scratch. Cost is O(n * d^2) for the covariance plus
     * O(d^3) for the decomposition.
     *
     * @param points     the retained vectors, all of length {@code dimensions}
     * @param dimensions the dimension of the vectors
     * @return the fitted statistics
     * @throws DegenerateModelException if there are fewer than two points or the
     *                                  covariance is the zero matrix
     */
    public static FittedStatistics fit(List<double[]> points, int dimensions) {
        checkNotNull(points, "points must not be null");
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        if (points.size() < 2) {
            throw new DegenerateModelException(String.format(
                    "covariance is undefined for %d vector(s), at least 2 are required", points.size()));
        }
        double[] mean = new double[dimensions];
        for (double[] point : points) {
            for (int i = 0; i < dimensions; i++) {
                mean[i] += point[i];
            }
        }
        for (int i = 0; i < dimensions; i++) {
            mean[i] /= points.size();
        }
        RealMatrix covariance = new Covariance(toMatrix(points), true).getCovarianceMatrix();
        return new FittedStatistics(mean, pseudoInverse(covariance));
    }

    /**
     * Fits statistics from moments that were accumulated elsewhere.
     *
     * @param accumulator running moments of at least two vectors
     * @return the fitted statistics
     */
    public static FittedStatistics fit(IncrementalCovariance accumulator) {
        checkNotNull(accumulator, "accumulator must not be null");
        if (accumulator.getCount() < 2) {
            throw new DegenerateModelException(String.format(
                    "covariance is undefined for %d vector(s), at least 2 are required", accumulator.getCount()));
        }
        return new FittedStatistics(accumulator.getMean(), pseudoInverse(accumulator.getCovariance()));
    }

    /**
     * Computes the pseudo-inverse through a singular value decomposition; singular
     * values below the decomposition tolerance are treated as zero.
     *
     * @param covariance a square covariance matrix
     * @return the pseudo-inverse
     * @throws DegenerateModelException if the covariance has rank 0, since the
     *                                  pseudo-inverse would be the zero matrix and
     *                                  every distance 0
     */
    public static RealMatrix pseudoInverse(RealMatrix covariance) {
        checkArgument(covariance.isSquare(), "covariance must be a square matrix");
        checkFinite(covariance, "covariance");
        SingularValueDecomposition decomposition = new SingularValueDecomposition(covariance);
        if (decomposition.getRank() == 0) {
            throw new DegenerateModelException(
                    "covariance of the retained vectors is the zero matrix, all Mahalanobis distances would be 0");
        }
        RealMatrix inverse = decomposition.getSolver().getInverse();
        checkFinite(inverse, "pseudo-inverse of the covariance");
        return inverse;
    }

    private static void checkFinite(RealMatrix matrix, String name) {
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            for (int j = 0; j < matrix.getColumnDimension(); j++) {
                if (!Double.isFinite(matrix.getEntry(i, j))) {
                    throw new DegenerateModelException(name + " contains non-finite values");
                }
            }
        }
    }
}
