/*
 * Copyright 2026 The Flowloop Project
 *
 * The Flowloop Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.flowloop.util.concurrent;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The result of an asynchronous operation.
 * <p>
 * A {@link Future} is either <em>uncompleted</em> or <em>completed</em>. It is created uncompleted and becomes
 * completed exactly once, either successfully or with a failure cause:
 * <pre>
 *                                      +---------------------------+
 *                                      | Completed successfully    |
 *                                      +---------------------------+
 *                                 +---->      isDone() = true      |
 * +--------------------------+    |    |   isSuccess() = true      |
 * |        Uncompleted       |    |    +===========================+
 * +--------------------------+    |    | Completed with failure    |
 * |      isDone() = false    |    |    +---------------------------+
 * |   isSuccess() = false    |----+---->      isDone() = true      |
 * |       cause() = throws   |         |       cause() = non-null  |
 * |      getNow() = throws   |         +---------------------------+
 * +--------------------------+
 * </pre>
 * <p>
 * Prefer {@link #addListener(FutureListener)} to {@link #await()}: listeners never block and are always notified
 * on the {@linkplain #executor() executor} the future belongs to. Calling {@link #await()} from that executor's own
 * thread would dead-lock and is rejected with a {@link BlockingOperationException}.
 */
public interface Future<V> {

    /**
     * Return {@code true} if this operation has been completed either successfully or with a failure.
     */
    boolean isDone();

    /**
     * Returns {@code true} if and only if the operation was completed successfully.
     */
    boolean isSuccess();

    /**
     * Returns {@code true} if and only if the operation was completed and failed.
     */
    boolean isFailed();

    /**
     * Returns the cause of the failed operation if the operation has failed, or {@code null} if it succeeded.
     *
     * @throws IllegalStateException if the operation has not completed yet.
     */
    Throwable cause();

    /**
     * Return the successful result of this operation, or {@code null} if it failed.
     *
     * @throws IllegalStateException if the operation has not completed yet.
     */
    V getNow();

    /**
     * Return the {@link EventExecutor} listeners of this future are notified on.
     */
    EventExecutor executor();

    /**
     * Adds the specified listener to this future. The specified listener is notified when this future is
     * {@linkplain #isDone() done}. If this future is already completed, the specified listener is notified
     * as well.
     *
     * @return this future object.
     */
    Future<V> addListener(FutureListener<? super V> listener);

    /**
     * Waits for this future to be completed.
     *
     * @throws InterruptedException if the current thread was interrupted
     */
    Future<V> await() throws InterruptedException;

    /**
     * Waits for this future to be completed within the specified time limit.
     *
     * @return {@code true} if and only if the future was completed within the specified time limit
     * @throws InterruptedException if the current thread was interrupted
     */
    boolean await(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Waits for this future until it is done, and rethrows the cause of the failure if this future failed.
     *
     * @throws CompletionException  if the computation threw an exception.
     * @throws InterruptedException if the current thread was interrupted while waiting
     */
    Future<V> sync() throws InterruptedException;

    /**
     * Get the result of this future, waiting for it to complete if necessary.
     *
     * @throws InterruptedException If the thread was {@linkplain Thread#interrupt() interrupted} while waiting.
     * @throws ExecutionException If the operation failed.
     */
    default V get() throws InterruptedException, ExecutionException {
        await();

        Throwable cause = cause();
        if (cause == null) {
            return getNow();
        }
        throw new ExecutionException(cause);
    }
}
