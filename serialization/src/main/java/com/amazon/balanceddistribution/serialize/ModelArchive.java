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

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.evaluation.DistanceEvaluation;
import com.amazon.balanceddistribution.generation.GenerationResult;
import com.amazon.balanceddistribution.state.BalancedDistributionMapper;
import com.amazon.balanceddistribution.state.DistanceEvaluationMapper;
import com.amazon.balanceddistribution.state.Version;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * A file holding any number of named Balanced Distribution models. Each model
 * is stored as a {@link ModelGroupState} and the whole archive is encoded with
 * protostuff.
 *
 * <p>
 * Saving a model replaces any group of the same name and keeps the others.
 * Distances stored with a replaced group are dropped and have to be saved
 * again with {@link #saveDistances}. The archive is first written to a
 * temporary file in the same directory and then moved over the target, so a
 * failed save leaves the previous archive intact.
 */
public class ModelArchive {

    private static final Logger LOG = LoggerFactory.getLogger(ModelArchive.class);

    public static final String NUMBER_OF_FEATURES_USED = "Number of features used";
    public static final String START = "Start";
    public static final String END = "End";
    public static final String DURATION = "Duration";

    private static final Schema<ModelArchiveState> SCHEMA = RuntimeSchema.getSchema(ModelArchiveState.class);

    @Getter
    private final Path path;

    @Getter
    private final BalancedDistributionMapper mapper;

    private final DistanceEvaluationMapper evaluationMapper = new DistanceEvaluationMapper();

    public ModelArchive(Path path) {
        this(path, new BalancedDistributionMapper());
    }

    public ModelArchive(Path path, BalancedDistributionMapper mapper) {
        this.path = checkNotNull(path, "path must not be null");
        this.mapper = checkNotNull(mapper, "mapper must not be null");
    }

    /**
     * Builds the group attributes recorded for a completed generation.
     *
     * @param result a completed generation
     * @return the number of features used, the start and end times in
     *         milliseconds since the epoch and the duration in milliseconds
     */
    public static Map<String, String> attributesOf(GenerationResult result) {
        checkNotNull(result, "result must not be null");
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(NUMBER_OF_FEATURES_USED, Integer.toString(result.getNumberOfFeatures()));
        attributes.put(START, Long.toString(result.getStartTime()));
        attributes.put(END, Long.toString(result.getEndTime()));
        attributes.put(DURATION, Long.toString(result.getDurationMillis()));
        return attributes;
    }

    /**
     * Saves the model of a completed generation under
     * {@link BalancedDistribution#MODEL_NAME} along with its generation
     * attributes.
     */
    public void save(GenerationResult result) throws IOException {
        checkNotNull(result, "result must not be null");
        checkArgument(result.isCompleted(), "a cancelled generation has no model to save");
        save(BalancedDistribution.MODEL_NAME, result.getModel().get(), attributesOf(result));
    }

    public void save(BalancedDistribution model) throws IOException {
        save(BalancedDistribution.MODEL_NAME, model, Collections.emptyMap());
    }

    /**
     * @param name       the group name, replacing any existing group of that name
     * @param model      the model to store
     * @param attributes string attributes stored next to the model
     * @throws IOException if the archive cannot be read or written
     */
    public synchronized void save(String name, BalancedDistribution model, Map<String, String> attributes)
            throws IOException {
        checkNotNull(name, "name must not be null");
        checkNotNull(model, "model must not be null");
        checkNotNull(attributes, "attributes must not be null");

        ModelArchiveState archive = Files.exists(path) ? read() : new ModelArchiveState();
        ModelGroupState group = new ModelGroupState();
        group.setName(name);
        group.setAttributes(new LinkedHashMap<>(attributes));
        group.setModel(mapper.toState(model));

        List<ModelGroupState> groups = new ArrayList<>();
        for (ModelGroupState existing : archive.getGroups()) {
            if (!name.equals(existing.getName())) {
                groups.add(existing);
            }
        }
        groups.add(group);
        archive.setGroups(groups);
        write(archive);
        LOG.info("Saved Balanced Distribution '{}' with {} entries to {}", name, model.size(), path);
    }

    public BalancedDistribution load() throws IOException {
        return load(BalancedDistribution.MODEL_NAME);
    }

    /**
     * @param name the group name
     * @return the restored model, with its statistics fitted
     * @throws IOException              if the archive cannot be read
     * @throws IllegalArgumentException if the archive has no group of that name
     */
    public synchronized BalancedDistribution load(String name) throws IOException {
        ModelGroupState group = findGroup(name)
                .orElseThrow(() -> new IllegalArgumentException(String.format("no model named '%s' in %s", name, path)));
        checkArgument(group.getModel() != null, String.format("model '%s' in %s has no state", name, path));
        BalancedDistribution model = mapper.toModel(group.getModel());
        LOG.info("Loaded Balanced Distribution '{}' with {} entries from {}", name, model.size(), path);
        return model;
    }

    /**
     * @param name the group name
     * @return the attributes stored with the group
     * @throws IllegalArgumentException if the archive has no group of that name
     */
    public synchronized Map<String, String> getAttributes(String name) throws IOException {
        ModelGroupState group = findGroup(name)
                .orElseThrow(() -> new IllegalArgumentException(String.format("no model named '%s' in %s", name, path)));
        return group.getAttributes() == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(group.getAttributes());
    }

    /**
     * Stores the distances next to an already saved model, replacing earlier
     * distances of that group.
     *
     * @param name       the group name
     * @param evaluation the distances of the generation input
     * @throws IOException              if the archive cannot be read or written
     * @throws IllegalArgumentException if the archive has no group of that name
     */
    public synchronized void saveDistances(String name, DistanceEvaluation evaluation) throws IOException {
        checkNotNull(name, "name must not be null");
        checkNotNull(evaluation, "evaluation must not be null");
        ModelArchiveState archive = read();
        ModelGroupState group = archive.getGroups().stream().filter(g -> name.equals(g.getName())).findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format("model '%s' must be saved to %s before its distances", name, path)));
        group.setMahalanobisDistances(evaluationMapper.toState(evaluation));
        write(archive);
        LOG.info("Saved {} Mahalanobis distances of '{}' to {}", evaluation.size(), name, path);
    }

    /**
     * @param name the group name
     * @return the stored distances, or empty if none were saved for the group
     * @throws IllegalArgumentException if the archive has no group of that name
     */
    public synchronized Optional<DistanceEvaluation> loadDistances(String name) throws IOException {
        ModelGroupState group = findGroup(name)
                .orElseThrow(() -> new IllegalArgumentException(String.format("no model named '%s' in %s", name, path)));
        return Optional.ofNullable(group.getMahalanobisDistances()).map(evaluationMapper::toModel);
    }

    /**
     * @return the group names in the order they were first written
     */
    public synchronized List<String> getNames() throws IOException {
        List<String> names = new ArrayList<>();
        if (Files.exists(path)) {
            for (ModelGroupState group : read().getGroups()) {
                names.add(group.getName());
            }
        }
        return names;
    }

    private Optional<ModelGroupState> findGroup(String name) throws IOException {
        checkNotNull(name, "name must not be null");
        return read().getGroups().stream().filter(group -> name.equals(group.getName())).findFirst();
    }

    private ModelArchiveState read() throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        ModelArchiveState archive = SCHEMA.newMessage();
        try {
            ProtostuffIOUtil.mergeFrom(bytes, archive, SCHEMA);
        } catch (RuntimeException e) {
            throw new IOException(String.format("%s is not a model archive", path), e);
        }
        if (!Version.V1_0.equals(archive.getVersion())) {
            throw new IOException(String.format("unsupported archive version %s in %s", archive.getVersion(), path));
        }
        return archive;
    }

    private void write(ModelArchiveState archive) throws IOException {
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            bytes = ProtostuffIOUtil.toByteArray(archive, SCHEMA, buffer);
        } finally {
            buffer.clear();
        }

        Path absolute = path.toAbsolutePath();
        Path directory = absolute.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temporary = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
        try {
            Files.write(temporary, bytes);
            try {
                Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.warn("Atomic move not supported for {}, replacing the file non-atomically", absolute);
                Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temporary);
        }
    }
}
