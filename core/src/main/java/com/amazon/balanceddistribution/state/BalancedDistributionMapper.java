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

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.util.ArrayPacking;

/**
 * Converts a {@link BalancedDistribution} to and from a
 * {@link BalancedDistributionState}.
 */
@Getter
@Setter
public class BalancedDistributionMapper implements IStateMapper<BalancedDistribution, BalancedDistributionState> {

    /**
     * When true (the default) the restored model fits its mean and inverse
     * covariance before it is returned, so that a degenerate persisted
     * distribution is reported at load time rather than on the first query.
     */
    private boolean fitOnLoad = true;

    @Override
    public BalancedDistributionState toState(BalancedDistribution model) {
        checkNotNull(model, "model must not be null");
        Hyperparameters hyperparameters = model.getHyperparameters();

        BalancedDistributionState state = new BalancedDistributionState();
        state.setVersion(Version.V1_0);
        state.setInitialNormalFeatures(hyperparameters.getInitialNormalFeatures());
        state.setThresholdLearning(hyperparameters.getThresholdLearning());
        state.setThresholdClassification(hyperparameters.getThresholdClassification());
        state.setPruningParameter(hyperparameters.getPruningParameter());
        state.setDimensions(model.getDimensions());
        state.setNumberOfVectors(model.size());
        state.setBalancedDistribution(ArrayPacking.pack(model.getBalancedDistribution(), model.getDimensions()));
        return state;
    }

    /**
     * @throws com.amazon.balanceddistribution.exceptions.InvalidParameterException
     *         if the stored hyperparameters are out of range
     * @throws IllegalArgumentException if the stored vectors do not match the
     *                                  stored shape
     * @throws com.amazon.balanceddistribution.exceptions.DegenerateModelException
     *         if fitOnLoad is set and the stored vectors cannot be fit
     */
    @Override
    public BalancedDistribution toModel(BalancedDistributionState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()),
                String.format("unsupported state version %s", state.getVersion()));
        checkNotNull(state.getBalancedDistribution(), "balancedDistribution must not be null");
        checkArgument(state.getNumberOfVectors() > 0, "a persisted Balanced Distribution must not be empty");
        checkArgument(state.getDimensions() > 0, "dimensions must be greater than 0");

        Hyperparameters hyperparameters = new Hyperparameters(state.getInitialNormalFeatures(),
                state.getThresholdLearning(), state.getThresholdClassification(), state.getPruningParameter());
        List<double[]> rows = ArrayPacking.unpackRows(state.getBalancedDistribution(), state.getNumberOfVectors(),
                state.getDimensions());

        BalancedDistribution model = new BalancedDistribution(hyperparameters, rows);
        if (fitOnLoad) {
            model.getStatistics();
        }
        return model;
    }
}
