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

package com.amazon.insights.networks.state;

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.io.IOException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of model states, the blob format handed to a
 * {@link com.amazon.insights.networks.store.ModelStore}.
 */
public class ModelStateCodec {

    private final ObjectMapper mapper;

    public ModelStateCodec() {
        mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(NetworkModelState state) throws IOException {
        checkNotNull(state, "state must not be null");
        return mapper.writeValueAsBytes(state);
    }

    /**
     * @param blob       bytes produced by {@link #encode}
     * @param stateClass the expected state type
     * @param <S>        the state type
     * @return the decoded state
     * @throws IOException              if the blob is not a valid encoding
     * @throws IllegalArgumentException if the blob was written by an
     *                                  incompatible version
     */
    public <S extends NetworkModelState> S decode(byte[] blob, Class<S> stateClass) throws IOException {
        checkNotNull(blob, "blob must not be null");
        S state = mapper.readValue(blob, stateClass);
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported state version " + state.getVersion());
        return state;
    }
}
