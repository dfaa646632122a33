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

import static com.amazon.insights.CommonUtils.checkNotNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A process-local store, mostly useful for tests and for handing models between
 * components. Blobs are copied on the way in and out.
 */
public class InMemoryModelStore implements ModelStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public void put(String key, byte[] blob) {
        checkNotNull(key, "key must not be null");
        checkNotNull(blob, "blob must not be null");
        blobs.put(key, blob.clone());
    }

    @Override
    public Optional<byte[]> get(String key) {
        checkNotNull(key, "key must not be null");
        return Optional.ofNullable(blobs.get(key)).map(byte[]::clone);
    }

    @Override
    public boolean contains(String key) {
        checkNotNull(key, "key must not be null");
        return blobs.containsKey(key);
    }

    @Override
    public boolean remove(String key) {
        checkNotNull(key, "key must not be null");
        return blobs.remove(key) != null;
    }

    public int size() {
        return blobs.size();
    }
}
