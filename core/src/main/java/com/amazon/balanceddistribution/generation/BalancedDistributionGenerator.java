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
import static com.amazon.balanceddistribution.CommonUtils.checkDimensions;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.util.List;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.FitMode;
import com.amazon.balanceddistribution.config.Hyperparameters;
import com.amazon.balanceddistribution.exceptions.InsufficientDataException;
import com.amazon.balanceddistribution.store.DistributionStore;

/**
 * Builds a {@link BalancedDistribution} from an ordered sequence of training
 * vectors: seed and growth, pruning, final fit. The store being built is owned
 * by a single call to {@link #generate} and is only handed out once all phases
 * succeeded; a cancelled or failed generation leaves nothing behind.
 */
@Getter
public class BalancedDistributionGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(BalancedDistributionGenerator.class);

    private final Hyperparameters hyperparameters;

    private final FitMode fitMode;

    private final IGenerationListener listener;

    public BalancedDistributionGenerator(Hyperparameters hyperparameters) {
        this(hyperparameters, FitMode.FULL_REFIT, IGenerationListener.NONE);
    }

    public BalancedDistributionGenerator(Hyperparameters hyperparameters, FitMode fitMode,
            IGenerationListener listener) {
        this.hyperparameters = checkNotNull(hyperparameters, "hyperparameters must not be null");
        this.fitMode = checkNotNull(fitMode, "fitMode must not be null");
        this.listener = checkNotNull(listener, "listener must not be null");
    }

    public GenerationResult generate(List<double[]> features) {
        return generate(features, ICancellationToken.NONE);
    }

    /**
     * @param features the ordered training vectors, all of the same dimension;
     *                 the first initialNormalFeatures of them must be free of
     *                 anomalies
     * @param token    polled once per vector during growth and pruning
     * @return a completed result holding the model, or a cancelled result
     * @throws InsufficientDataException if there are not more features than
     *                                   initialNormalFeatures
     * @throws com.amazon.balanceddistribution.exceptions.ShapeMismatchException
     *         if the features do not all have the same dimension
     * @throws com.amazon.balanceddistribution.exceptions.DegenerateModelException
     *         if the covariance cannot be estimated at some point, for example
     *         because pruning left fewer than two vectors
     */
    public GenerationResult generate(List<double[]> features, ICancellationToken token) {
        checkNotNull(features, "features must not be null");
        checkNotNull(token, "token must not be null");
        int initialNormalFeatures = hyperparameters.getInitialNormalFeatures();
        if (features.size() <= initialNormalFeatures) {
            throw new InsufficientDataException(initialNormalFeatures, features.size());
        }
        checkNotNull(features.get(0), "features must not contain null vectors");
        int dimensions = features.get(0).length;
        checkArgument(dimensions > 0, "feature vectors must not be empty");
        for (double[] feature : features) {
            checkDimensions(feature, dimensions);
        }

        LOG.info("Generating a Balanced Distribution from {} feature vectors of length {}", features.size(),
                dimensions);
        long startTime = System.currentTimeMillis();
        DistributionStore store = new DistributionStore(dimensions, fitMode);

        GrowthEngine growthEngine = new GrowthEngine(hyperparameters.getThresholdLearning());
        listener.phaseStarted(GenerationPhase.GROWTH, features.size());
        if (!growthEngine.grow(store, features, initialNormalFeatures, token)) {
            LOG.warn("Generation cancelled during growth, no model produced");
            return GenerationResult.cancelled(features.size(), startTime, System.currentTimeMillis());
        }
        listener.phaseCompleted(GenerationPhase.GROWTH, store.size());

        LOG.info("Pruning Balanced Distribution of {} entries", store.size());
        PruningEngine pruningEngine = new PruningEngine(hyperparameters.getPruningThreshold());
        listener.phaseStarted(GenerationPhase.PRUNING, store.size());
        if (!pruningEngine.prune(store, token)) {
            LOG.warn("Generation cancelled during pruning, no model produced");
            return GenerationResult.cancelled(features.size(), startTime, System.currentTimeMillis());
        }
        listener.phaseCompleted(GenerationPhase.PRUNING, store.size());

        LOG.info("Generated Balanced Distribution with {} entries", store.size());
        BalancedDistribution model = new BalancedDistribution(hyperparameters, store);
        return GenerationResult.completed(model, features.size(), growthEngine.getAccepted(),
                pruningEngine.getPruned(), startTime, System.currentTimeMillis());
    }
}
