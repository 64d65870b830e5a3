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

package com.amazon.balanceddistribution.generation;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import com.amazon.balanceddistribution.BalancedDistribution;

/**
 * The outcome of a generation. A cancelled generation is an expected outcome,
 * not an error: it carries no model and nothing derived from it may be
 * persisted.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationResult {

    private final GenerationStatus status;

    @Getter(AccessLevel.NONE)
    private final BalancedDistribution model;

    /**
     * Number of training vectors supplied.
     */
    private final int numberOfFeatures;

    /**
     * Number of vectors added after the seed during growth.
     */
    private final int accepted;

    /**
     * Number of vectors removed during pruning.
     */
    private final int pruned;

    /**
     * Wall clock start and end of the generation, in milliseconds since the
     * epoch.
     */
    private final long startTime;

    private final long endTime;

    public static GenerationResult completed(BalancedDistribution model, int numberOfFeatures, int accepted,
            int pruned, long startTime, long endTime) {
        return new GenerationResult(GenerationStatus.COMPLETED, model, numberOfFeatures, accepted, pruned, startTime,
                endTime);
    }

    public static GenerationResult cancelled(int numberOfFeatures, long startTime, long endTime) {
        return new GenerationResult(GenerationStatus.CANCELLED, null, numberOfFeatures, 0, 0, startTime, endTime);
    }

    public boolean isCompleted() {
        return status == GenerationStatus.COMPLETED;
    }

    public Optional<BalancedDistribution> getModel() {
        return Optional.ofNullable(model);
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }
}
