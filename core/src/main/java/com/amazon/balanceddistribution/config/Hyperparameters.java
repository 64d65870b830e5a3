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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.balanceddistribution.exceptions.InvalidParameterException;

/**
 * The immutable configuration of a Balanced Distribution. The names in
 * parentheses are the variables used in the description of the algorithm.
 * <ul>
 * <li>initialNormalFeatures (N): the number of leading vectors accepted
 * unconditionally as the seed set</li>
 * <li>thresholdLearning (&alpha;): a candidate whose Mahalanobis distance
 * exceeds this value is added to the distribution during growth</li>
 * <li>thresholdClassification (&beta;): a query whose distance exceeds this
 * value is anomalous</li>
 * <li>pruningParameter (&eta;): the fraction of &alpha; below which a retained
 * vector is pruned, 0 &lt; &eta; &lt; 1</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@ToString
public class Hyperparameters {

    public static final int DEFAULT_INITIAL_NORMAL_FEATURES = 1000;

    public static final double DEFAULT_THRESHOLD_LEARNING = 20;

    public static final double DEFAULT_THRESHOLD_CLASSIFICATION = 5;

    public static final double DEFAULT_PRUNING_PARAMETER = 0.5;

    private final int initialNormalFeatures;

    private final double thresholdLearning;

    private final double thresholdClassification;

    private final double pruningParameter;

    public Hyperparameters(int initialNormalFeatures, double thresholdLearning, double thresholdClassification,
            double pruningParameter) {
        check(initialNormalFeatures > 0, "initialNormalFeatures must be greater than 0");
        check(thresholdLearning > 0 && Double.isFinite(thresholdLearning),
                "thresholdLearning must be a finite value greater than 0");
        check(thresholdClassification > 0 && Double.isFinite(thresholdClassification),
                "thresholdClassification must be a finite value greater than 0");
        check(0 < pruningParameter && pruningParameter < 1,
                String.format("pruningParameter out of range (0 < pruningParameter < 1), found %s", pruningParameter));
        this.initialNormalFeatures = initialNormalFeatures;
        this.thresholdLearning = thresholdLearning;
        this.thresholdClassification = thresholdClassification;
        this.pruningParameter = pruningParameter;
    }

    /**
     * @return the distance below which a retained vector is pruned, that is
     *         thresholdLearning * pruningParameter
     */
    public double getPruningThreshold() {
        return thresholdLearning * pruningParameter;
    }

    /**
     * @return a builder initialized to the default hyperparameters
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a builder initialized to the values of this object
     */
    public Builder<?> toBuilder() {
        return new Builder<>().initialNormalFeatures(initialNormalFeatures).thresholdLearning(thresholdLearning)
                .thresholdClassification(thresholdClassification).pruningParameter(pruningParameter);
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new InvalidParameterException(message);
        }
    }

    public static class Builder<T extends Builder<T>> {

        private int initialNormalFeatures = DEFAULT_INITIAL_NORMAL_FEATURES;
        private double thresholdLearning = DEFAULT_THRESHOLD_LEARNING;
        private double thresholdClassification = DEFAULT_THRESHOLD_CLASSIFICATION;
        private double pruningParameter = DEFAULT_PRUNING_PARAMETER;

        public T initialNormalFeatures(int initialNormalFeatures) {
            this.initialNormalFeatures = initialNormalFeatures;
            return (T) this;
        }

        public T thresholdLearning(double thresholdLearning) {
            this.thresholdLearning = thresholdLearning;
            return (T) this;
        }

        public T thresholdClassification(double thresholdClassification) {
            this.thresholdClassification = thresholdClassification;
            return (T) this;
        }

        public T pruningParameter(double pruningParameter) {
            this.pruningParameter = pruningParameter;
            return (T) this;
        }

        public Hyperparameters build() {
            return new Hyperparameters(initialNormalFeatures, thresholdLearning, thresholdClassification,
                    pruningParameter);
        }
    }
}
