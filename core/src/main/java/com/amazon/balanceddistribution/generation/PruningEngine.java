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

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.util.List;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.balanceddistribution.statistics.FittedStatistics;
import com.amazon.balanceddistribution.store.DistributionStore;

/**
 * The pruning phase of a Balanced Distribution. Statistics are fit once on the
 * grown store and held fixed for the whole pass; every member closer than the
 * pruning threshold (thresholdLearning * pruningParameter) is removed in one
 * batch, and the statistics are fit again on the survivors.
 */
@Getter
public class PruningEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PruningEngine.class);

    private final double pruningThreshold;

    private int pruned;

    public PruningEngine(double pruningThreshold) {
        checkArgument(pruningThreshold > 0, "pruningThreshold must be greater than 0");
        this.pruningThreshold = pruningThreshold;
    }

    /**
     * @param store the grown store
     * @param token polled once per member
     * @return true if pruning finished, false if the token was tripped; in that
     *         case the store is cleared
     * @throws com.amazon.balanceddistribution.exceptions.DegenerateModelException
     *         if fewer than two members survive
     */
    public boolean prune(DistributionStore store, ICancellationToken token) {
        checkNotNull(store, "store must not be null");
        checkNotNull(token, "token must not be null");
        pruned = 0;

        FittedStatistics statistics = store.fit();
        List<double[]> points = store.getPoints();
        boolean[] marked = new boolean[points.size()];
        for (int i = 0; i < marked.length; i++) {
            if (token.isCancellationRequested()) {
                LOG.warn("Pruning interrupted after {} of {} members", i, marked.length);
                store.clear();
                return false;
            }
            marked[i] = statistics.getMahalanobisDistance(points.get(i)) < pruningThreshold;
        }
        pruned = store.removeMarked(marked);
        LOG.debug("Pruned {} of {} members", pruned, marked.length);

        store.fit();
        return true;
    }
}
