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

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * An {@link Executor} that is bound to exactly one {@link Thread} for its whole life. All state it owns is only
 * touched from that thread, which is why {@link #execute(Runnable)} and friends must be called from it as well.
 * Work coming from any other thread goes through {@link #submitExternal(Runnable)}.
 */
public interface EventExecutor extends Executor {

    /**
     * Return {@code true} if the calling {@link Thread} is the thread this executor is bound to.
     */
    boolean inEventLoop();

    /**
     * Queue the given task for execution once the current batch of work is done. Tasks run in the order they were
     * queued.
     *
     * @throws ThreadAffinityError if not called from the thread this executor is bound to.
     */
    @Override
    void execute(Runnable task);

    /**
     * Queue the given task from any thread. The executor is woken up if it is currently blocked waiting for work.
     *
     * @throws RejectedExecutionException if this executor was closed already.
     */
    void submitExternal(Runnable task);

    /**
     * Queue the given task like {@link #execute(Runnable)} and return a {@link Future} which is completed with
     * the value the task returns, or failed with the exception it throws. The returned future is never completed
     * before the task ran.
     *
     * @throws ThreadAffinityError if not called from the thread this executor is bound to.
     */
    <V> Future<V> schedule(Callable<V> task);

    /**
     * Return a new {@link Promise} which notifies its listeners on this executor.
     */
    default <V> Promise<V> newPromise() {
        return new DefaultPromise<>(this);
    }

    /**
     * Create a new {@link Future} which is marked as succeeded already. So {@link Future#isSuccess()}
     * will return {@code true}. All {@link FutureListener} added to it will be notified directly. Also
     * every call of blocking methods will just return without blocking.
     */
    default <V> Future<V> newSucceededFuture(V result) {
        Promise<V> promise = newPromise();
        promise.setSuccess(result);
        return promise.asFuture();
    }

    /**
     * Create a new {@link Future} which is marked as failed already. So {@link Future#isSuccess()}
     * will return {@code false}. All {@link FutureListener} added to it will be notified directly. Also
     * every call of blocking methods will just return without blocking.
     */
    default <V> Future<V> newFailedFuture(Throwable cause) {
        Promise<V> promise = newPromise();
        promise.setFailure(cause);
        return promise.asFuture();
    }
}
