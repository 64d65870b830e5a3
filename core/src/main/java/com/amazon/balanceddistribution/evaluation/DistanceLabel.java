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

package com.amazon.balanceddistribution.evaluation;

import lombok.Getter;

/**
 * The known class of a scored feature vector. The codes are the ones used in
 * labeled input files and in the persisted evaluation.
 */
public enum DistanceLabel {
    UNKNOWN(0),
    NO_ANOMALY(1),
    ANOMALY(2);

    @Getter
    private final int code;

    DistanceLabel(int code) {
        this.code = code;
    }

    /**
     * @param code a label code
     * @return the label with that code
     * @throws IllegalArgumentException if no label has that code
     */
    public static DistanceLabel fromCode(int code) {
        for (DistanceLabel label : values()) {
            if (label.code == code) {
                return label;
            }
        }
        throw new IllegalArgumentException(String.format("unknown label code %d", code));
    }
}
