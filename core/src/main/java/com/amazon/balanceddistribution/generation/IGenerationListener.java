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
 * Receives progress notifications from a generation. Calls are made
 * synchronously on the generating thread, at phase boundaries only.
 */
public interface IGenerationListener {

    IGenerationListener NONE = new IGenerationListener() {
    };

    /**
     * @param phase the phase that is starting
     * @param size  the number of vectors the phase will visit
     */
    default void phaseStarted(GenerationPhase phase, int size) {
    }

    /**
     * @param phase    the phase that finished
     * @param retained the number of vectors in the distribution afterwards
     */
    default void phaseCompleted(GenerationPhase phase, int retained) {
    }
}
