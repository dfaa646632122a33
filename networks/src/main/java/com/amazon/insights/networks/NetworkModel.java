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
import static com.amazon.insights.CommonUtils.checkDimension;
import static com.amazon.insights.CommonUtils.checkNotNull;
import static com.amazon.insights.CommonUtils.checkState;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;

import com.amazon.insights.errors.InsightsException;
import com.amazon.insights.errors.ModelNotTrainedException;
import com.amazon.insights.errors.TrainingFailedException;
import com.amazon.insights.networks.state.ModelStateCodec;
import com.amazon.insights.networks.state.NetworkCodec;
import com.amazon.insights.networks.state.NetworkModelState;
import com.amazon.insights.networks.store.ModelStore;
import com.amazon.insights.returntypes.FeatureMatrix;

/**
 * Common machinery of the feed-forward models: lifecycle, per-model locking,
 * asynchronous execution, the mini-batch training loop and persistence.
 *
 * Every public operation runs on the model's executor while holding the
 * model's lock, so calls on one model are serialized while distinct models
 * proceed independently. Failures complete the returned future exceptionally
 * with the typed error as the cause.
 *
 * All native arrays created by a call are released before the call returns,
 * on success and on failure.
 *
 * @param <S> the persisted state type
 */
@Slf4j
public abstract class NetworkModel<S extends NetworkModelState> implements AutoCloseable {

    /**
     * Default seed for weight initialization.
     */
    public static final long DEFAULT_RANDOM_SEED = 42L;

    private final ReentrantLock lock = new ReentrantLock();

    private final Executor executor;

    private final Class<S> stateClass;

    private final ModelStateCodec codec = new ModelStateCodec();

    protected final long randomSeed;

    protected final String modelName;

    protected MultiLayerNetwork network;

    protected int featureDimension;

    protected ModelLifecycle lifecycle = ModelLifecycle.UNINITIALIZED;

    protected NetworkModel(Builder<?> builder, String modelName, Class<S> stateClass) {
        this.executor = builder.executor.orElse(ForkJoinPool.commonPool());
        this.randomSeed = builder.randomSeed;
        this.modelName = modelName;
        this.stateClass = stateClass;
    }

    /**
     * the network for a given input width, with weights seeded from
     * {@link #randomSeed}
     */
    protected abstract MultiLayerConfiguration configuration(int featureDimension);

    /**
     * Hook for models that accept only some input widths.
     *
     * @param featureDimension the proposed input width
     */
    protected void checkSupportedDimension(int featureDimension) {
        checkArgument(featureDimension > 0, "feature dimension must be positive");
    }

    protected abstract S newState();

    /**
     * copies model specific fields into a state being saved
     */
    protected void writeState(S state) {
    }

    /**
     * Hook that rejects a decoded state before any field of this model changes.
     *
     * @param state the decoded state
     */
    protected void checkRestorable(S state) {
    }

    /**
     * copies model specific fields out of a state that passed
     * {@link #checkRestorable}
     */
    protected void readState(S state) {
    }

    /**
     * Fixes the architecture. Initializing again with the same width does
     * nothing.
     *
     * @param featureDimension the input width
     * @return a future completing once the network exists
     */
    public CompletableFuture<Void> initialize(int featureDimension) {
        return submit(() -> {
            initializeLocked(featureDimension);
            return null;
        });
    }

    /**
     * Writes the trained model to a store.
     *
     * @param store the destination
     * @param key   the caller's name for the entry
     * @return a future completing once the blob is stored
     */
    public CompletableFuture<Void> save(ModelStore store, String key) {
        checkNotNull(store, "store must not be null");
        checkNotNull(key, "key must not be null");
        return submit(() -> {
            checkTrained();
            try {
                S state = newState();
                state.setModelType(getClass().getSimpleName());
                state.setFeatureDimension(featureDimension);
                state.setRandomSeed(randomSeed);
                state.setNetwork(NetworkCodec.toBytes(network));
                writeState(state);
                store.put(key, codec.encode(state));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            log.debug("saved {} under key {}", modelName, key);
            return null;
        });
    }

    /**
     * Replaces this model's network and learned values with those stored under a
     * key. The restored model is trained. An uninitialized model takes the stored
     * width; any other model must already have it. A rejected state leaves the
     * model as it was.
     *
     * @param store the source
     * @param key   the caller's name for the entry
     * @return a future completing once the model is restored
     */
    public CompletableFuture<Void> restore(ModelStore store, String key) {
        checkNotNull(store, "store must not be null");
        checkNotNull(key, "key must not be null");
        return submit(() -> {
            S state;
            try {
                Optional<byte[]> blob = store.get(key);
                if (!blob.isPresent()) {
                    throw new InsightsException("no model stored under key " + key);
                }
                state = codec.decode(blob.get(), stateClass);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            checkArgument(getClass().getSimpleName().equals(state.getModelType()),
                    "stored model is a " + state.getModelType());
            checkArgument(state.getNetwork() != null, "stored network is missing");
            checkSupportedDimension(state.getFeatureDimension());
            if (lifecycle != ModelLifecycle.UNINITIALIZED) {
                checkDimension(featureDimension, state.getFeatureDimension(), modelName + " feature width");
            }
            checkRestorable(state);
            MultiLayerNetwork restored;
            try {
                restored = NetworkCodec.fromBytes(state.getNetwork());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (network != null) {
                network.close();
            }
            network = restored;
            featureDimension = state.getFeatureDimension();
            readState(state);
            lifecycle = ModelLifecycle.TRAINED;
            log.debug("restored {} from key {}", modelName, key);
            return null;
        });
    }

    /**
     * Frees the native buffers. Waits for a running call to finish; calls made
     * afterwards fail with {@link IllegalStateException}. Closing twice is
     * allowed.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (network != null) {
                network.close();
                network = null;
            }
            lifecycle = ModelLifecycle.RELEASED;
        } finally {
            lock.unlock();
        }
    }

    public ModelLifecycle getLifecycle() {
        return locked(() -> lifecycle);
    }

    /**
     * @return the input width, 0 before initialization
     */
    public int getFeatureDimension() {
        return locked(() -> featureDimension);
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    protected <R> CompletableFuture<R> submit(Supplier<R> task) {
        return CompletableFuture.supplyAsync(() -> locked(() -> {
            checkState(lifecycle != ModelLifecycle.RELEASED, modelName + " has been released");
            return task.get();
        }), executor);
    }

    protected <R> R locked(Supplier<R> task) {
        lock.lock();
        try {
            return task.get();
        } finally {
            lock.unlock();
        }
    }

    protected void initializeLocked(int dimension) {
        if (lifecycle != ModelLifecycle.UNINITIALIZED) {
            checkDimension(featureDimension, dimension, modelName + " feature width");
            return;
        }
        checkSupportedDimension(dimension);
        MultiLayerNetwork fresh = new MultiLayerNetwork(configuration(dimension));
        fresh.init();
        network = fresh;
        featureDimension = dimension;
        lifecycle = ModelLifecycle.INITIALIZED;
        log.debug("initialized {} with {} inputs and {} parameters", modelName, dimension, fresh.numParams());
    }

    protected void checkTrained() {
        if (lifecycle != ModelLifecycle.TRAINED) {
            throw new ModelNotTrainedException(modelName);
        }
    }

    /**
     * Trains on the leading rows and validates on the trailing
     * {@link TrainingConfig#validationRows(int)} rows, which never reach the
     * optimizer. Must be called with the lock held.
     *
     * A failure leaves the lifecycle unchanged: a model that was already trained
     * gets back the parameters it had before the call, and a network created by
     * the call is discarded again. Errors raised by the numeric backend are
     * reported as {@link TrainingFailedException}.
     *
     * @param features     the inputs; an uninitialized model adopts their width
     * @param targets      the expected outputs, one row per input row
     * @param config       the hyperparameters
     * @param withAccuracy whether to report accuracy at the 0.5 cut-off
     * @return the final-epoch metrics
     */
    protected ModelMetrics fit(FeatureMatrix features, double[][] targets, TrainingConfig config,
            boolean withAccuracy) {
        checkNotNull(config, "config must not be null");
        ModelLifecycle previous = lifecycle;
        initializeLocked(features.width());
        INDArray backup = (previous == ModelLifecycle.TRAINED) ? network.params().dup() : null;
        try {
            ModelMetrics metrics = runEpochs(features.toArray(), targets, config, withAccuracy);
            lifecycle = ModelLifecycle.TRAINED;
            log.info("trained {} on {} rows for {} epochs: {}", modelName, features.rows(), config.getEpochs(),
                    metrics);
            return metrics;
        } catch (InsightsException e) {
            rollback(previous, backup);
            throw e;
        } catch (RuntimeException e) {
            rollback(previous, backup);
            throw new TrainingFailedException(modelName + " training failed", e);
        } finally {
            release(backup);
        }
    }

    private void rollback(ModelLifecycle previous, INDArray backup) {
        if (backup != null) {
            network.setParams(backup);
        } else if (previous == ModelLifecycle.UNINITIALIZED) {
            // the failed call created the network
            network.close();
            network = null;
            featureDimension = 0;
            lifecycle = ModelLifecycle.UNINITIALIZED;
        }
    }

    private ModelMetrics runEpochs(double[][] inputs, double[][] targets, TrainingConfig config,
            boolean withAccuracy) {
        int rows = inputs.length;
        int held = config.validationRows(rows);
        int trainRows = rows - held;
        int batchSize = config.effectiveBatchSize();
        network.setLearningRate(config.getLearningRate());
        Nd4j.getRandom().setSeed(config.getRandomSeed());
        Random shuffler = new Random(config.getRandomSeed());
        int[] order = new int[trainRows];
        for (int i = 0; i < trainRows; i++) {
            order[i] = i;
        }

        try (INDArray trainInputs = Nd4j.create(Arrays.copyOfRange(inputs, 0, trainRows));
                INDArray trainTargets = Nd4j.create(Arrays.copyOfRange(targets, 0, trainRows));
                INDArray validationInputs = (held > 0) ? Nd4j.create(Arrays.copyOfRange(inputs, trainRows, rows))
                        : null;
                INDArray validationTargets = (held > 0)
                        ? Nd4j.create(Arrays.copyOfRange(targets, trainRows, rows))
                        : null) {
            double loss = Double.NaN;
            for (int epoch = 1; epoch <= config.getEpochs(); epoch++) {
                shuffle(order, shuffler);
                for (int start = 0; start < trainRows; start += batchSize) {
                    int end = Math.min(trainRows, start + batchSize);
                    double[][] batchInputs = new double[end - start][];
                    double[][] batchTargets = new double[end - start][];
                    for (int i = start; i < end; i++) {
                        batchInputs[i - start] = inputs[order[i]];
                        batchTargets[i - start] = targets[order[i]];
                    }
                    try (INDArray x = Nd4j.create(batchInputs); INDArray y = Nd4j.create(batchTargets)) {
                        network.fit(x, y);
                    }
                }
                loss = network.score(new DataSet(trainInputs, trainTargets));
                if (!Double.isFinite(loss)) {
                    throw new TrainingFailedException(modelName + " reached a non-finite loss at epoch " + epoch);
                }
                log.debug("{} epoch {}/{} loss {}", modelName, epoch, config.getEpochs(), loss);
            }

            Double validationLoss = null;
            Double accuracy = null;
            Double validationAccuracy = null;
            if (held > 0) {
                validationLoss = network.score(new DataSet(validationInputs, validationTargets));
                if (!Double.isFinite(validationLoss)) {
                    throw new TrainingFailedException(modelName + " reached a non-finite validation loss");
                }
            }
            if (withAccuracy) {
                accuracy = accuracy(trainInputs, targets, 0);
                if (held > 0) {
                    validationAccuracy = accuracy(validationInputs, targets, trainRows);
                }
            }
            return new ModelMetrics(loss, validationLoss, accuracy, validationAccuracy);
        }
    }

    private double accuracy(INDArray inputs, double[][] targets, int offset) {
        INDArray output = null;
        try {
            output = network.output(inputs, false);
            int rows = (int) output.size(0);
            int correct = 0;
            for (int i = 0; i < rows; i++) {
                double predicted = (output.getDouble(i, 0) >= 0.5) ? 1 : 0;
                if (predicted == targets[offset + i][0]) {
                    ++correct;
                }
            }
            return correct / (double) rows;
        } finally {
            release(output);
        }
    }

    /**
     * runs the network forward in inference mode; must be called with the lock
     * held
     *
     * @param features rows whose width matches the model
     * @return one output row per input row
     */
    protected double[][] outputLocked(FeatureMatrix features) {
        checkNotNull(features, "features must not be null");
        checkTrained();
        checkDimension(featureDimension, features.width(), modelName + " feature width");
        return outputLocked(features.toArray());
    }

    protected double[][] outputLocked(double[][] rows) {
        INDArray input = Nd4j.create(rows);
        INDArray output = null;
        try {
            output = network.output(input, false);
            return output.toDoubleMatrix();
        } finally {
            release(output, input);
        }
    }

    /**
     * Frees arrays that own their buffers. Views, workspace-attached arrays and
     * arrays already closed are left alone, so passing the same array twice is
     * harmless.
     *
     * @param arrays arrays to release, nulls are skipped
     */
    protected static void release(INDArray... arrays) {
        for (INDArray array : arrays) {
            if (array != null && array.closeable()) {
                array.close();
            }
        }
    }

    static double[][] column(double[] values) {
        double[][] answer = new double[values.length][1];
        for (int i = 0; i < values.length; i++) {
            answer[i][0] = values[i];
        }
        return answer;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int swap = order[i];
            order[i] = order[j];
            order[j] = swap;
        }
    }

    public abstract static class Builder<T extends Builder<T>> {

        private Optional<Executor> executor = Optional.empty();
        private long randomSeed = DEFAULT_RANDOM_SEED;

        /**
         * @param executor runs the model's asynchronous calls; the common
         *                 fork-join pool when not set
         */
        public T executor(Executor executor) {
            this.executor = Optional.of(checkNotNull(executor, "executor must not be null"));
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }
    }
}
