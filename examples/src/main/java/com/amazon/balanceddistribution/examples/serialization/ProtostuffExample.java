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

import java.util.List;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.examples.Example;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.state.BalancedDistributionMapper;
import com.amazon.balanceddistribution.state.BalancedDistributionState;
import com.amazon.balanceddistribution.testutils.LabeledData;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Serialize a Balanced Distribution using the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> library.
 */
public class ProtostuffExample implements Example {
    public static void main(String[] args) throws Exception {
        new ProtostuffExample().run();
    }

    @Override
    public String command() {
        return "protostuff";
    }

    @Override
    public String description() {
        return "serialize a Balanced Distribution with the protostuff library";
    }

    @Override
    public void run() throws Exception {
        // Generate a model from training data whose first rows are normal

        int dimensions = 5;
        int initialNormalFeatures = 1000;
        Hyperparameters hyperparameters = Hyperparameters.builder().initialNormalFeatures(initialNormalFeatures)
                .thresholdLearning(4.0).thresholdClassification(5.0).pruningParameter(0.5).build();

        NormalMixtureTestData testData = new NormalMixtureTestData();
        List<double[]> training = testData.generateTestData(5000, dimensions, initialNormalFeatures, 17).data;
        BalancedDistribution model = new BalancedDistributionGenerator(hyperparameters).generate(training).getModel()
                .get();

        // Convert to an array of bytes and print the size

        BalancedDistributionMapper mapper = new BalancedDistributionMapper();
        Schema<BalancedDistributionState> schema = RuntimeSchema.getSchema(BalancedDistributionState.class);
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            bytes = ProtostuffIOUtil.toByteArray(mapper.toState(model), schema, buffer);
        } finally {
            buffer.clear();
        }

        System.out.printf("dimensions = %d, training vectors = %d, retained vectors = %d%n", dimensions,
                training.size(), model.size());
        System.out.printf("protostuff size = %d bytes%n", bytes.length);

        // Restore from protostuff and compare the classifications of the two models

        BalancedDistributionState state = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state, schema);
        BalancedDistribution model2 = mapper.toModel(state);

        LabeledData queries = testData.generateTestData(200, dimensions, 0, 99);
        int differences = 0;
        int anomalies = 0;
        for (double[] point : queries.data) {
            boolean anomalous = model.classify(point);
            if (anomalous != model2.classify(point)
                    || model.getMahalanobisDistance(point) != model2.getMahalanobisDistance(point)) {
                differences++;
            }
            if (anomalous) {
                anomalies++;
            }
        }

        System.out.printf("%d of %d queries classified as anomalous%n", anomalies, queries.data.size());

        // the restored model must give bit for bit the same distances
        if (differences > 0) {
            throw new IllegalStateException("restored model does not agree with original model");
        }

        System.out.println("Looks good!");
    }
}
