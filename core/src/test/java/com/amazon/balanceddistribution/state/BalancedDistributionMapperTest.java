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

package com.amazon.balanceddistribution.state;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.exceptions.DegenerateModelException;
import com.amazon.balanceddistribution.exceptions.InvalidParameterException;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.testutils.NormalMixtureTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

public class BalancedDistributionMapperTest {

    private BalancedDistributionMapper mapper;
    private BalancedDistribution model;

    @BeforeEach
    public void setUp() {
        mapper = new BalancedDistributionMapper();
        Hyperparameters hyperparameters = Hyperparameters.builder().initialNormalFeatures(100).thresholdLearning(2.5)
                .thresholdClassification(4.0).pruningParameter(0.4).build();
        List<double[]> features = new NormalMixtureTestData().generateTestData(400, 3, 100, 23).data;
        model = new BalancedDistributionGenerator(hyperparameters).generate(features).getModel().get();
    }

    @Test
    public void testToState() {
        BalancedDistributionState state = mapper.toState(model);
        assertEquals(Version.V1_0, state.getVersion());
        assertEquals(100, state.getInitialNormalFeatures());
        assertEquals(2.5, state.getThresholdLearning());
        assertEquals(4.0, state.getThresholdClassification());
        assertEquals(0.4, state.getPruningParameter());
        assertEquals(3, state.getDimensions());
        assertEquals(model.size(), state.getNumberOfVectors());
        assertEquals(model.size() * 3, state.getBalancedDistribution().length);
    }

    @Test
    public void testRoundTripIsExact() {
        BalancedDistribution restored = mapper.toModel(mapper.toState(model));

        assertEquals(model.getHyperparameters(), restored.getHyperparameters());
        assertArrayEquals(model.getBalancedDistribution(), restored.getBalancedDistribution());
        assertArrayEquals(model.getMean(), restored.getMean());
        assertArrayEquals(model.getInverseCovariance(), restored.getInverseCovariance());

        double[] query = new double[] { 3.0, -1.0, 0.5 };
        assertEquals(model.getMahalanobisDistance(query), restored.getMahalanobisDistance(query));
    }

    @Test
    public void testRoundTripThroughJson() throws Exception {
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(model));
        BalancedDistributionState state = jsonMapper.readValue(json, BalancedDistributionState.class);
        BalancedDistribution restored = mapper.toModel(state);

        assertArrayEquals(model.getBalancedDistribution(), restored.getBalancedDistribution());
        double[] query = new double[] { -2.0, 1.0, 1.0 };
        assertEquals(model.getMahalanobisDistance(query), restored.getMahalanobisDistance(query));
    }

    @Test
    public void testInvalidHyperparametersAreRejected() {
        BalancedDistributionState state = mapper.toState(model);
        state.setPruningParameter(1.0);
        assertThrows(InvalidParameterException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testInconsistentShapeIsRejected() {
        BalancedDistributionState state = mapper.toState(model);
        state.setNumberOfVectors(state.getNumberOfVectors() + 1);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));

        BalancedDistributionState otherVersion = mapper.toState(model);
        otherVersion.setVersion("0.1");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(otherVersion));
    }

    @Test
    public void testDegenerateStateFailsOnLoad() {
        BalancedDistribution single = new BalancedDistribution(model.getHyperparameters(),
                Collections.singletonList(new double[] { 1.0, 2.0, 3.0 }));
        BalancedDistributionState state = mapper.toState(single);

        assertThrows(DegenerateModelException.class, () -> mapper.toModel(state));

        mapper.setFitOnLoad(false);
        BalancedDistribution restored = mapper.toModel(state);
        assertEquals(1, restored.size());
        assertThrows(DegenerateModelException.class, () -> restored.getMahalanobisDistance(new double[3]));
    }
}
