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

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;

import com.amazon.balanceddistribution.state.BalancedDistributionState;
import com.amazon.balanceddistribution.state.DistanceEvaluationState;

/**
 * A named entry of a model archive: the model state, free-form string
 * attributes describing how it was generated and, once computed, the
 * Mahalanobis distances of the generation input.
 */
@Data
public class ModelGroupState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String name;

    private Map<String, String> attributes = new LinkedHashMap<>();

    private BalancedDistributionState model;

    private DistanceEvaluationState mahalanobisDistances;
}
