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

package com.amazon.balanceddistribution.evaluation;

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.List;

import lombok.Getter;

import com.amazon.balanceddistribution.BalancedDistribution;

/**
 * The Mahalanobis distances of a set of feature vectors to a Balanced
 * Distribution, together with the largest distance seen for each known label.
 *
 * <p>
 * A maximum is {@link Double#NaN} when no vector carries that label. NaN
 * distances are ignored when the maxima are taken.
 */
public class DistanceEvaluation {

    private final double[] distances;

    private final DistanceLabel[] labels;

    @Getter
    private final double maxNoAnomaly;

    @Getter
    private final double maxAnomaly;

    public DistanceEvaluation(double[] distances, DistanceLabel[] labels) {
        checkNotNull(distances, "distances must not be null");
        checkNotNull(labels, "labels must not be null");
        checkArgument(distances.length == labels.length, String.format(
                "expected one label per distance but found %d distances and %d labels", distances.length,
                labels.length));
        this.distances = Arrays.copyOf(distances, distances.length);
        this.labels = Arrays.copyOf(labels, labels.length);
        this.maxNoAnomaly = max(DistanceLabel.NO_ANOMALY);
        this.maxAnomaly = max(DistanceLabel.ANOMALY);
    }

    /**
     * Scores every point against the model.
     *
     * @param model  a fitted or fittable model
     * @param points feature vectors of the model's dimension
     * @param labels one label per point
     * @return the evaluation
     * @throws com.amazon.balanceddistribution.exceptions.ShapeMismatchException
     *         if a point has the wrong dimension
     */
    public static DistanceEvaluation evaluate(BalancedDistribution model, List<double[]> points,
            List<DistanceLabel> labels) {
        checkNotNull(model, "model must not be null");
        checkNotNull(points, "points must not be null");
        checkNotNull(labels, "labels must not be null");
        checkArgument(points.size() == labels.size(), String.format(
                "expected one label per point but found %d points and %d labels", points.size(), labels.size()));

        double[] distances = new double[points.size()];
        DistanceLabel[] labelArray = new DistanceLabel[labels.size()];
        for (int i = 0; i < distances.length; i++) {
            distances[i] = model.getMahalanobisDistance(points.get(i));
            labelArray[i] = checkNotNull(labels.get(i), "labels must not contain null");
        }
        return new DistanceEvaluation(distances, labelArray);
    }

    private double max(DistanceLabel label) {
        double max = Double.NaN;
        for (int i = 0; i < distances.length; i++) {
            if (labels[i] == label && !Double.isNaN(distances[i]) && (Double.isNaN(max) || distances[i] > max)) {
                max = distances[i];
            }
        }
        return max;
    }

    public int size() {
        return distances.length;
    }

    /**
     * @return a copy of the distances, in input order
     */
    public double[] getDistances() {
        return Arrays.copyOf(distances, distances.length);
    }

    /**
     * @return a copy of the labels, in input order
     */
    public DistanceLabel[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }
}
