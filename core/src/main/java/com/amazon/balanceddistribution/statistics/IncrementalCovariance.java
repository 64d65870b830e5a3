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
import static com.amazon.balanceddistribution.CommonUtils.checkState;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Running mean and scatter matrix of a growing set of vectors (Welford's
 * update). Appending a vector costs O(d^2) instead of the O(n * d^2) of a full
 * covariance pass. Vectors cannot be removed; callers rebuild after a removal.
 */
public class IncrementalCovariance {

    private final int dimensions;

    private long count;

    private final double[] mean;

    // only the upper triangle (j >= i) is maintained
    private final double[][] scatter;

    public IncrementalCovariance(int dimensions) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        this.dimensions = dimensions;
        this.mean = new double[dimensions];
        this.scatter = new double[dimensions][dimensions];
    }

    public void update(double[] point) {
        checkDimensions(point, dimensions);
        count++;
        double[] delta = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            delta[i] = point[i] - mean[i];
            mean[i] += delta[i] / count;
        }
        for (int i = 0; i < dimensions; i++) {
            for (int j = i; j < dimensions; j++) {
                scatter[i][j] += delta[i] * (point[j] - mean[j]);
            }
        }
    }

    public void reset() {
        count = 0;
        for (int i = 0; i < dimensions; i++) {
            mean[i] = 0;
            for (int j = 0; j < dimensions; j++) {
                scatter[i][j] = 0;
            }
        }
    }

    public long getCount() {
        return count;
    }

    public int getDimensions() {
        return dimensions;
    }

    public double[] getMean() {
        checkState(count > 0, "incorrect invocation for mean");
        return mean.clone();
    }

    /**
     * @return the unbiased (n - 1) sample covariance
     */
    public RealMatrix getCovariance() {
        checkState(count > 1, "incorrect invocation for covariance");
        double[][] covariance = new double[dimensions][dimensions];
        for (int i = 0; i < dimensions; i++) {
            for (int j = i; j < dimensions; j++) {
                covariance[i][j] = scatter[i][j] / (count - 1);
                covariance[j][i] = covariance[i][j];
            }
        }
        return new Array2DRowRealMatrix(covariance, false);
    }
}
