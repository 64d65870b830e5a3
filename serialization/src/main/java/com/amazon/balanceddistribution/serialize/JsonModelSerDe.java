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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Getter;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.state.BalancedDistributionMapper;
import com.amazon.balanceddistribution.state.BalancedDistributionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link BalancedDistribution} serialization to JSON. Internally we use the
 * {@link BalancedDistributionMapper} class to convert a model into a
 * corresponding state object, and we use Jackson to write the state object as
 * a JSON string. The ObjectMapper is exposed so users can customize the output
 * (e.g., by enabling pretty printing).
 */
@Getter
public class JsonModelSerDe {

    private final BalancedDistributionMapper mapper;
    private final ObjectMapper objectMapper;

    public JsonModelSerDe() {
        this(new BalancedDistributionMapper(), new ObjectMapper());
    }

    /**
     * @param mapper       converts a model to a state object
     * @param objectMapper writes and reads {@link BalancedDistributionState}
     *                     objects
     */
    public JsonModelSerDe(BalancedDistributionMapper mapper, ObjectMapper objectMapper) {
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    public String toJson(BalancedDistribution model) throws JsonProcessingException {
        return objectMapper.writeValueAsString(mapper.toState(model));
    }

    public BalancedDistribution fromJson(String json) throws JsonProcessingException {
        return mapper.toModel(objectMapper.readValue(json, BalancedDistributionState.class));
    }

    public void write(BalancedDistribution model, Path path) throws IOException {
        objectMapper.writeValue(path.toFile(), mapper.toState(model));
    }

    public BalancedDistribution read(Path path) throws IOException {
        return mapper.toModel(objectMapper.readValue(Files.readAllBytes(path), BalancedDistributionState.class));
    }
}
