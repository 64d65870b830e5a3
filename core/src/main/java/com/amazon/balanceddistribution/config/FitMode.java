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

package com.amazon.balanceddistribution.config;

/**
 * Controls how the mean and covariance of the retained vectors are recomputed
 * after the retained set changes. The pseudo-inverse is recomputed in both
 * modes.
 */
public enum FitMode {
    /**
     * Recompute mean and covariance from all retained vectors on every fit.
     */
    FULL_REFIT,
    /**
     * Maintain a running mean and scatter matrix through rank-one updates as
     * vectors are appended; any removal rebuilds the accumulator. Results agree
     * with {@link #FULL_REFIT} up to the order of floating-point operations.
     */
    INCREMENTAL;
}
