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

import com.amazon.balanceddistribution.exceptions.InsufficientDataException;
import com.amazon.balanceddistribution.store.DistributionStore;

/**
 * The growth phase of a Balanced Distribution. The first N vectors seed the
 * store unconditionally. Every later vector, in input order, is added when its
 * Mahalanobis distance to the current store exceeds the learning threshold, and
 * the statistics are refit right after each addition. The decision is greedy,
 * so the result depends on the order of the input.
 *
 * <p>
 * The seed vectors are assumed to be free of anomalies. This is the caller's
 * responsibility and is not checked here.
 */
@Getter
public class GrowthEngine {

    private static final Logger LOG = LoggerFactory.getLogger(GrowthEngine.class);

    private final double thresholdLearning;

    /**
     * Number of vectors after the seed that were examined.
     */
    private int processed;

    /**
     * Number of vectors after the seed that were added to the store.
     */
    private int accepted;

    public GrowthEngine(double thresholdLearning) {
        checkArgument(thresholdLearning > 0, "thresholdLearning must be greater than 0");
        this.thresholdLearning = thresholdLearning;
    }

    /**
     * Seeds and grows the store.
     *
     * @param store                 an empty store
     * @param features              the ordered training vectors
     * @param initialNormalFeatures size of the seed set
     * @param token                 polled once per candidate
     * @return true if the whole input was processed, false if the token was
     *         tripped; in that case the store is cleared
     * @throws InsufficientDataException if there are not more features than
     *                                   initialNormalFeatures
     */
    public boolean grow(DistributionStore store, List<double[]> features, int initialNormalFeatures,
            ICancellationToken token) {
        checkNotNull(store, "store must not be null");
        checkNotNull(features, "features must not be null");
        checkNotNull(token, "token must not be null");
        checkArgument(initialNormalFeatures > 0, "initialNormalFeatures must be greater than 0");
        checkArgument(store.isEmpty(), "growth must start from an empty store");
        if (features.size() <= initialNormalFeatures) {
            throw new InsufficientDataException(initialNormalFeatures, features.size());
        }
        processed = 0;
        accepted = 0;

        store.addAll(features.subList(0, initialNormalFeatures));
        store.fit();

        for (int i = initialNormalFeatures; i < features.size(); i++) {
            if (token.isCancellationRequested()) {
                LOG.warn("Growth interrupted after {} of {} feature vectors", i, features.size());
                store.clear();
                return false;
            }
            double[] feature = features.get(i);
            if (store.getMahalanobisDistance(feature) > thresholdLearning) {
                store.add(feature);
                store.fit();
                accepted++;
            }
            processed++;
        }
        LOG.debug("Growth accepted {} of {} candidates, {} vectors in Balanced Distribution", accepted, processed,
                store.size());
        return true;
    }
}
