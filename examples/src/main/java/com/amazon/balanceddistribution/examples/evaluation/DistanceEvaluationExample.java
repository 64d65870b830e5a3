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

package com.amazon.balanceddistribution.examples.evaluation;

import java.util.ArrayList;
import java.util.List;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.evaluation.DistanceEvaluation;
import com.amazon.balanceddistribution.evaluation.DistanceLabel;
import com.amazon.balanceddistribution.examples.Example;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.testutils.LabeledData;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;

/**
 * Score labeled training data against the model generated from it and compare
 * the largest distances of normal and anomalous vectors with the
 * classification threshold.
 */
public class DistanceEvaluationExample implements Example {
    public static void main(String[] args) throws Exception {
        new DistanceEvaluationExample().run();
    }

    @Override
    public String command() {
        return "evaluation";
    }

    @Override
    public String description() {
        return "compare the Mahalanobis distances of labeled normal and anomalous training vectors";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 3;
        int initialNormalFeatures = 500;
        Hyperparameters hyperparameters = Hyperparameters.builder().initialNormalFeatures(initialNormalFeatures)
                .thresholdLearning(3.0).thresholdClassification(4.0).pruningParameter(0.5).build();

        LabeledData data = new NormalMixtureTestData().generateTestData(3000, dimensions, initialNormalFeatures, 5);
        BalancedDistribution model = new BalancedDistributionGenerator(hyperparameters).generate(data.data)
                .getModel().get();

        List<DistanceLabel> labels = new ArrayList<>();
        for (boolean anomalous : data.anomalous) {
            labels.add(anomalous ? DistanceLabel.ANOMALY : DistanceLabel.NO_ANOMALY);
        }
        DistanceEvaluation evaluation = model.getMahalanobisDistances(data.data, labels);

        int flagged = 0;
        for (double distance : evaluation.getDistances()) {
            if (distance > hyperparameters.getThresholdClassification()) {
                flagged++;
            }
        }

        System.out.printf("training vectors = %d, labeled anomalies = %d, retained vectors = %d%n",
                data.data.size(), data.countAnomalies(), model.size());
        System.out.printf("max distance without anomaly = %.4f, with anomaly = %.4f%n", evaluation.getMaxNoAnomaly(),
                evaluation.getMaxAnomaly());
        System.out.printf("%d vectors above the classification threshold %.1f%n", flagged,
                hyperparameters.getThresholdClassification());
    }
}
