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

/**
 * A cooperative cancellation signal. The generation loops poll it once per
 * processed vector and abort, discarding every partial result, as soon as it
 * reports a request.
 */
@FunctionalInterface
public interface ICancellationToken {

    /**
     * A token that never requests cancellation.
     */
    ICancellationToken NONE = () -> false;

    /**
     * @return true if the running generation should stop
     */
    boolean isCancellationRequested();

    /**
     * @return a token that follows the interrupt status of the thread polling it
     */
    static ICancellationToken threadInterrupted() {
        return () -> Thread.currentThread().isInterrupted();
    }
}
