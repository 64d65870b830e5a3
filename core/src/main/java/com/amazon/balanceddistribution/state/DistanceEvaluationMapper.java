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

import com.amazon.balanceddistribution.evaluation.DistanceEvaluation;
import com.amazon.balanceddistribution.evaluation.DistanceLabel;

public class DistanceEvaluationMapper implements IStateMapper<DistanceEvaluation, DistanceEvaluationState> {

    @Override
    public DistanceEvaluationState toState(DistanceEvaluation evaluation) {
        checkNotNull(evaluation, "evaluation must not be null");
        DistanceLabel[] labels = evaluation.getLabels();
        int[] codes = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            codes[i] = labels[i].getCode();
        }

        DistanceEvaluationState state = new DistanceEvaluationState();
        state.setVersion(Version.V1_0);
        state.setMahalanobisDistances(evaluation.getDistances());
        state.setLabels(codes);
        state.setMaxNoAnomaly(evaluation.getMaxNoAnomaly());
        state.setMaxAnomaly(evaluation.getMaxAnomaly());
        return state;
    }

    @Override
    public DistanceEvaluation toModel(DistanceEvaluationState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()),
                String.format("unsupported state version %s", state.getVersion()));
        // the arrays may be absent when an empty evaluation was written
        double[] distances = state.getMahalanobisDistances() == null ? new double[0]
                : state.getMahalanobisDistances();
        int[] codes = state.getLabels() == null ? new int[0] : state.getLabels();
        checkArgument(distances.length == codes.length, String.format(
                "expected one label per distance but found %d distances and %d labels", distances.length,
                codes.length));

        DistanceLabel[] labels = new DistanceLabel[codes.length];
        for (int i = 0; i < codes.length; i++) {
            labels[i] = DistanceLabel.fromCode(codes[i]);
        }
        return new DistanceEvaluation(distances, labels);
    }
}
