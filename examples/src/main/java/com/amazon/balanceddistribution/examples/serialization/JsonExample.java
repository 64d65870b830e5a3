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

package com.amazon.balanceddistribution.examples.serialization;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.examples.Example;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.serialize.JsonModelSerDe;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;

/**
 * Serialize a Balanced Distribution to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a Balanced Distribution as a JSON string";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 3;
        Hyperparameters hyperparameters = Hyperparameters.builder().initialNormalFeatures(300).thresholdLearning(3.0)
                .thresholdClassification(4.0).pruningParameter(0.5).build();

        NormalMixtureTestData testData = new NormalMixtureTestData();
        List<double[]> training = testData.generateTestData(1500, dimensions, 300, 7).data;
        BalancedDistribution model = new BalancedDistributionGenerator(hyperparameters).generate(training).getModel()
                .get();

        JsonModelSerDe serDe = new JsonModelSerDe();
        String json = serDe.toJson(model);

        System.out.printf("dimensions = %d, retained vectors = %d%n", dimensions, model.size());
        System.out.printf("JSON size = %d bytes%n", json.getBytes(StandardCharsets.UTF_8).length);

        BalancedDistribution model2 = serDe.fromJson(json);

        for (double[] point : testData.generateNormalData(100, dimensions, 3)) {
            if (model.getMahalanobisDistance(point) != model2.getMahalanobisDistance(point)) {
                throw new IllegalStateException("restored model does not agree with original model");
            }
        }

        System.out.println("Looks good!");
    }
}
