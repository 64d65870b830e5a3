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

package com.amazon.balanceddistribution.serialize;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;
import com.fasterxml.jackson.core.JsonProcessingException;

public class JsonModelSerDeTest {

    private JsonModelSerDe serDe;
    private BalancedDistribution model;

    @BeforeEach
    public void setUp() {
        serDe = new JsonModelSerDe();
        Hyperparameters hyperparameters = Hyperparameters.builder().initialNormalFeatures(100).thresholdLearning(2.0)
                .thresholdClassification(3.0).pruningParameter(0.5).build();
        model = new BalancedDistributionGenerator(hyperparameters)
                .generate(new NormalMixtureTestData().generateNormalData(300, 4, 5)).getModel().get();
    }

    @Test
    public void testJsonRoundTrip() throws JsonProcessingException {
        String json = serDe.toJson(model);
        assertTrue(json.contains("\"thresholdLearning\":2.0"));

        BalancedDistribution restored = serDe.fromJson(json);
        assertArrayEquals(model.getBalancedDistribution(), restored.getBalancedDistribution());
        assertArrayEquals(model.getMean(), restored.getMean());
    }

    @Test
    public void testFileRoundTrip(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("model.json");
        serDe.write(model, file);
        BalancedDistribution restored = serDe.read(file);

        double[] query = new double[] { 1.0, 2.0, 3.0, 4.0 };
        assertEquals(model.getMahalanobisDistance(query), restored.getMahalanobisDistance(query));
    }

    @Test
    public void testMalformedJson() {
        assertThrows(JsonProcessingException.class, () -> serDe.fromJson("{\"dimensions\": "));
    }
}
