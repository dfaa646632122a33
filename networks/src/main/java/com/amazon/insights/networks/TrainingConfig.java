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

import static com.amazon.insights.CommonUtils.checkArgument;

import java.util.Optional;

import lombok.Getter;

/**
 * Per-call hyperparameters of a training run. Instances are immutable; use
 * {@link #builder()} to override any of the defaults.
 */
@Getter
public class TrainingConfig {

    /**
     * Default number of passes over the training rows.
     */
    public static final int DEFAULT_EPOCHS = 100;

    /**
     * Default step size of the Adam optimizer.
     */
    public static final double DEFAULT_LEARNING_RATE = 0.001;

    /**
     * Default fraction of rows, taken from the end, held out for validation.
     */
    public static final double DEFAULT_VALIDATION_SPLIT = 0.2;

    /**
     * Mini-batch size used when none is configured.
     */
    public static final int DEFAULT_BATCH_SIZE = 32;

    /**
     * Default seed for mini-batch shuffling and dropout masks.
     */
    public static final long DEFAULT_RANDOM_SEED = 42L;

    private final int epochs;

    private final double learningRate;

    private final double validationSplit;

    private final Optional<Integer> batchSize;

    private final long randomSeed;

    protected TrainingConfig(Builder<?> builder) {
        checkArgument(builder.epochs > 0, "epochs must be positive");
        checkArgument(builder.learningRate > 0 && Double.isFinite(builder.learningRate),
                "learning rate must be positive");
        checkArgument(0 <= builder.validationSplit && builder.validationSplit < 1,
                "validation split must be in [0,1)");
        builder.batchSize.ifPresent(size -> checkArgument(size > 0, "batch size must be positive"));
        epochs = builder.epochs;
        learningRate = builder.learningRate;
        validationSplit = builder.validationSplit;
        batchSize = builder.batchSize;
        randomSeed = builder.randomSeed;
    }

    /**
     * @return a new TrainingConfig builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with every field at its default
     */
    public static TrainingConfig defaults() {
        return builder().build();
    }

    /**
     * the number of trailing rows held out from weight updates; since the split
     * is below 1 at least one row is always left for training
     *
     * @param rows the number of rows supplied to a training call
     * @return {@code floor(rows * validationSplit)}
     */
    public int validationRows(int rows) {
        return (int) Math.floor(rows * validationSplit);
    }

    public int effectiveBatchSize() {
        return batchSize.orElse(DEFAULT_BATCH_SIZE);
    }

    public static class Builder<T extends Builder<T>> {

        private int epochs = DEFAULT_EPOCHS;
        private double learningRate = DEFAULT_LEARNING_RATE;
        private double validationSplit = DEFAULT_VALIDATION_SPLIT;
        private Optional<Integer> batchSize = Optional.empty();
        private long randomSeed = DEFAULT_RANDOM_SEED;

        public T epochs(int epochs) {
            this.epochs = epochs;
            return (T) this;
        }

        public T learningRate(double learningRate) {
            this.learningRate = learningRate;
            return (T) this;
        }

        public T validationSplit(double validationSplit) {
            this.validationSplit = validationSplit;
            return (T) this;
        }

        public T batchSize(int batchSize) {
            this.batchSize = Optional.of(batchSize);
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        public TrainingConfig build() {
            return new TrainingConfig(this);
        }
    }
}
