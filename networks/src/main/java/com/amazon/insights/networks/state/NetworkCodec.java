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

import static com.amazon.insights.CommonUtils.checkNotNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.util.ModelSerializer;

/**
 * Converts networks to and from the DeepLearning4J model format. The updater
 * state is saved along with the weights so that a restored model continues
 * training where the saved one stopped.
 */
public class NetworkCodec {

    private NetworkCodec() {
    }

    public static byte[] toBytes(MultiLayerNetwork network) throws IOException {
        checkNotNull(network, "network must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ModelSerializer.writeModel(network, out, true);
        return out.toByteArray();
    }

    public static MultiLayerNetwork fromBytes(byte[] bytes) throws IOException {
        checkNotNull(bytes, "network bytes must not be null");
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            return ModelSerializer.restoreMultiLayerNetwork(in, true);
        }
    }
}
