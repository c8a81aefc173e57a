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

import io.flowloop.util.internal.StringUtil;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import static java.util.Objects.requireNonNull;

/**
 * Default {@link Promise} which is also its own {@link Future}.
 * <p>
 * The result is published with a CAS, so a promise may be completed from any thread. Listeners are always notified
 * on the thread of the {@link EventExecutor} the promise belongs to: directly when it completes on that thread,
 * through {@link EventExecutor#submitExternal(Runnable)} otherwise.
 */
public class DefaultPromise<V> implements Promise<V>, Future<V> {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DefaultPromise.class);
    private static final InternalLogger rejectedExecutionLogger =
            InternalLoggerFactory.getInstance(DefaultPromise.class.getName() + ".rejectedExecution");
    @SuppressWarnings("rawtypes")
    private static final AtomicReferenceFieldUpdater<DefaultPromise, Object> RESULT_UPDATER =
            AtomicReferenceFieldUpdater.newUpdater(DefaultPromise.class, Object.class, "result");
    // Stands in for a null result.
    private static final Object NULL_RESULT = new Object();

    private final EventExecutor executor;
    private volatile Object result;

    // Guarded by this. Listeners not notified yet.
    private List<FutureListener<? super V>> listeners;

    /**
     * Creates a new unfulfilled promise.
     *
     * @param executor the {@link EventExecutor} whose thread notifies the listeners.
     */
    public DefaultPromise(EventExecutor executor) {
        this.executor = requireNonNull(executor, "executor");
    }

    @Override
    public Promise<V> setSuccess(V result) {
        if (!complete(result == null ? NULL_RESULT : result)) {
            throw new IllegalStateException("complete already: " + this);
        }
        return this;
    }

    @Override
    public boolean trySuccess(V result) {
        return complete(result == null ? NULL_RESULT : result);
    }

    @Override
    public Promise<V> setFailure(Throwable cause) {
        if (!complete(new Failure(requireNonNull(cause, "cause")))) {
            throw new IllegalStateException("complete already: " + this, cause);
        }
        return this;
    }

    @Override
    public boolean tryFailure(Throwable cause) {
        return complete(new Failure(requireNonNull(cause, "cause")));
    }

    @Override
    public Future<V> asFuture() {
        return this;
    }

    @Override
    public boolean isDone() {
        return result != null;
    }

    @Override
    public boolean isSuccess() {
        Object result = this.result;
        return result != null && !(result instanceof Failure);
    }

    @Override
    public boolean isFailed() {
        return result instanceof Failure;
    }

    @Override
    public Throwable cause() {
        Object result = completedResult("cause()");
        return result instanceof Failure ? ((Failure) result).cause : null;
    }

    @SuppressWarnings("unchecked")
    @Override
    public V getNow() {
        Object result = completedResult("getNow()");
        return result instanceof Failure || result == NULL_RESULT ? null : (V) result;
    }

    private Object completedResult(String operation) {
        Object result = this.result;
        if (result == null) {
            throw new IllegalStateException(operation + " called on an incomplete future: " + this);
        }
        return result;
    }

    @Override
    public final EventExecutor executor() {
        return executor;
    }

    @Override
    public Future<V> addListener(FutureListener<? super V> listener) {
        requireNonNull(listener, "listener");
        synchronized (this) {
            if (listeners == null) {
                listeners = new ArrayList<>(2);
            }
            listeners.add(listener);
        }
        if (isDone()) {
            notifyListeners();
        }
        return this;
    }

    @Override
    public Future<V> await() throws InterruptedException {
        if (isDone()) {
            return this;
        }
        checkCanBlock();
        synchronized (this) {
            while (!isDone()) {
                wait();
            }
        }
        return this;
    }

    @Override
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        if (isDone()) {
            return true;
        }
        checkCanBlock();
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (this) {
            for (;;) {
                if (isDone()) {
                    return true;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(this, remaining);
            }
        }
    }

    @Override
    public Future<V> sync() throws InterruptedException {
        Throwable cause = await().cause();
        if (cause != null) {
            throw new CompletionException(cause);
        }
        return this;
    }

    /**
     * Throws {@link BlockingOperationException} when called from the thread of {@link #executor()}, which would
     * otherwise wait for itself.
     */
    protected void checkCanBlock() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException(toString());
        }
        if (executor.inEventLoop()) {
            throw new BlockingOperationException(toString());
        }
    }

    private boolean complete(Object value) {
        if (!RESULT_UPDATER.compareAndSet(this, null, value)) {
            return false;
        }
        boolean hasListeners;
        synchronized (this) {
            notifyAll();
            hasListeners = listeners != null;
        }
        if (hasListeners) {
            notifyListeners();
        }
        return true;
    }

    private void notifyListeners() {
        if (executor.inEventLoop()) {
            notifyListenersNow();
            return;
        }
        try {
            executor.submitExternal(this::notifyListenersNow);
        } catch (RejectedExecutionException e) {
            rejectedExecutionLogger.error("Could not submit the listener notification of {}.", this, e);
        }
    }

    private void notifyListenersNow() {
        for (;;) {
            List<FutureListener<? super V>> toNotify;
            synchronized (this) {
                toNotify = listeners;
                listeners = null;
            }
            // A listener may add further listeners while it runs.
            if (toNotify == null) {
                return;
            }
            for (FutureListener<? super V> listener : toNotify) {
                notifyListener(listener);
            }
        }
    }

    private void notifyListener(FutureListener<? super V> listener) {
        try {
            listener.operationComplete(this);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            logger.warn("{}.operationComplete() threw an exception.", listener.getClass().getName(), t);
        }
    }

    @Override
    public String toString() {
        Object result = this.result;
        String state;
        if (result == null) {
            state = "(incomplete)";
        } else if (result instanceof Failure) {
            state = "(failure: " + ((Failure) result).cause + ')';
        } else if (result == NULL_RESULT) {
            state = "(success)";
        } else {
            state = "(success: " + result + ')';
        }
        return StringUtil.simpleClassName(this) + '@' + Integer.toHexString(hashCode()) + state;
    }

    private static final class Failure {
        final Throwable cause;

        Failure(Throwable cause) {
            this.cause = cause;
        }
    }
}
