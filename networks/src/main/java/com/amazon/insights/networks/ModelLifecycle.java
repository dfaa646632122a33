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

package com.amazon.insights.networks;

/**
 * The stages a trainable model passes through. Transitions only move forward,
 * except that a failed training run leaves the model where it was.
 */
public enum ModelLifecycle {
    /**
     * No architecture yet; the first {@code initialize} or {@code train} call
     * fixes the input width.
     */
    UNINITIALIZED,
    /**
     * The network exists with random weights; predictions are refused.
     */
    INITIALIZED,
    /**
     * At least one training run completed; retraining overwrites the weights in
     * place.
     */
    TRAINED,
    /**
     * Native buffers have been freed and every further call fails.
     */
    RELEASED
}
