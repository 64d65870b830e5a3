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

package com.amazon.balanceddistribution.exceptions;

import lombok.Getter;

/**
 * Thrown before any work is done when the training sequence does not contain
 * more vectors than the seed set needs.
 */
@Getter
public class InsufficientDataException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int initialNormalFeatures;

    private final int numberOfFeatures;

    public InsufficientDataException(int initialNormalFeatures, int numberOfFeatures) {
        super(String.format(
                "not enough features provided, %d features cannot exceed initialNormalFeatures = %d; "
                        + "decrease initialNormalFeatures",
                numberOfFeatures, initialNormalFeatures));
        this.initialNormalFeatures = initialNormalFeatures;
        this.numberOfFeatures = numberOfFeatures;
    }
}
