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

package com.amazon.insights.networks.store;

import java.io.IOException;
import java.util.Optional;

/**
 * Opaque blob storage for serialized models. Keys are chosen by the caller and
 * never interpreted beyond identifying an entry.
 */
public interface ModelStore {

    /**
     * stores a blob, replacing any previous entry under the same key
     */
    void put(String key, byte[] blob) throws IOException;

    Optional<byte[]> get(String key) throws IOException;

    boolean contains(String key) throws IOException;

    /**
     * @return true if an entry was removed
     */
    boolean remove(String key) throws IOException;
}
