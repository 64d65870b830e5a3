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

package com.amazon.balanceddistribution.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import com.amazon.balanceddistribution.BalancedDistribution;

/**
 * Classifies the input rows against a saved Balanced Distribution and appends
 * the Mahalanobis distance and the anomaly flag to each row.
 */
public class ClassifyRunner extends SimpleRunner {

    public ClassifyRunner() {
        super(ClassifyRunner.class.getName(),
                "Compute the Mahalanobis distance of each input row to a saved Balanced Distribution and append it to "
                        + "the output row together with the anomaly flag.",
                ClassifyTransformer::new);
        // the saved model carries the hyperparameters it was generated with
        argumentParser.removeArgument("--initial-normal-features");
        argumentParser.removeArgument("--threshold-learning");
        argumentParser.removeArgument("--threshold-classification");
        argumentParser.removeArgument("--pruning-parameter");
        argumentParser.removeArgument("--fit-mode");
    }

    public static void main(String... args) throws IOException {
        ClassifyRunner runner = new ClassifyRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    public static class ClassifyTransformer implements LineTransformer {
        private final BalancedDistribution model;

        public ClassifyTransformer(BalancedDistribution model) {
            this.model = model;
        }

        @Override
        public List<String> getResultValues(double... point) {
            double distance = model.getMahalanobisDistance(point);
            boolean anomalous = distance > model.getHyperparameters().getThresholdClassification();
            return Arrays.asList(Double.toString(distance), Boolean.toString(anomalous));
        }

        @Override
        public List<String> getEmptyResultValue() {
            return Arrays.asList("NA", "NA");
        }

        @Override
        public List<String> getResultColumnNames() {
            return Arrays.asList("mahalanobis_distance", "anomalous");
        }

        @Override
        public BalancedDistribution getModel() {
            return model;
        }
    }
}
