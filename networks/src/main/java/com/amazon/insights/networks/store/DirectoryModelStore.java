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

import static com.amazon.insights.CommonUtils.checkArgument;
import static com.amazon.insights.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps one file per key under a directory. The key is hex-encoded into the
 * file name, so any string is a valid key as long as its encoding fits in a
 * file name. Writes go to a temporary file that is then moved into place.
 */
@Slf4j
public class DirectoryModelStore implements ModelStore {

    public static final String SUFFIX = ".model";

    // two hex characters per byte must stay under the usual 255 character limit
    public static final int MAX_KEY_BYTES = 120;

    @Getter
    private final Path directory;

    public DirectoryModelStore(Path directory) throws IOException {
        this.directory = checkNotNull(directory, "directory must not be null");
        Files.createDirectories(directory);
    }

    @Override
    public void put(String key, byte[] blob) throws IOException {
        checkNotNull(blob, "blob must not be null");
        Path target = pathOf(key);
        Path temporary = Files.createTempFile(directory, "store", ".tmp");
        try {
            Files.write(temporary, blob);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temporary);
        }
        log.debug("stored {} bytes in {}", blob.length, target);
    }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        Path path = pathOf(key);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(path));
    }

    @Override
    public boolean contains(String key) {
        return Files.exists(pathOf(key));
    }

    @Override
    public boolean remove(String key) throws IOException {
        return Files.deleteIfExists(pathOf(key));
    }

    Path pathOf(String key) {
        checkNotNull(key, "key must not be null");
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        checkArgument(bytes.length <= MAX_KEY_BYTES, "key is too long");
        StringBuilder name = new StringBuilder(2 * bytes.length + SUFFIX.length());
        for (byte b : bytes) {
            name.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
        }
        return directory.resolve(name.append(SUFFIX).toString());
    }
}
