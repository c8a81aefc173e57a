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
package io.flowloop.channel;

import io.flowloop.util.concurrent.EventLoopInvariantError;
import io.flowloop.util.concurrent.Future;
import io.flowloop.util.concurrent.Promise;
import io.flowloop.util.concurrent.ThreadAffinityError;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;
import org.jctools.queues.MpscUnboundedArrayQueue;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * {@link EventLoop} which runs on the thread that created it and waits for readiness through a {@link Multiplexer}.
 * <p>
 * Each turn of {@link #run()} waits for a batch of {@link ReadinessEvent}s, lets every ready {@link Channel} flush
 * before it reads, and then runs all queued tasks, including the ones queued while draining.
 */
public class DefaultEventLoop implements EventLoop {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DefaultEventLoop.class);

    private static final int EXTERNAL_TASK_QUEUE_CHUNK_SIZE = 64;

    private final Multiplexer multiplexer;
    private final Thread thread;
    private final DeregistrationFailureHandler deregistrationFailureHandler;
    private final Queue<Runnable> taskQueue = new ArrayDeque<>();
    private final Queue<Runnable> externalTaskQueue =
            new MpscUnboundedArrayQueue<>(EXTERNAL_TASK_QUEUE_CHUNK_SIZE);

    // Makes the closed check and the offer in submitExternal atomic with the drain in close(). The JCTools queue
    // can't remove a task again once it was offered.
    private final Object closeLock = new Object();
    private volatile boolean closed;

    /**
     * Create a new instance bound to the calling thread, using
     * {@link DeregistrationFailureHandlers#defaultHandler()}.
     */
    public DefaultEventLoop(Multiplexer multiplexer) {
        this(multiplexer, DeregistrationFailureHandlers.defaultHandler());
    }

    /**
     * Create a new instance bound to the calling thread.
     *
     * @param multiplexer                   the {@link Multiplexer} this loop owns from now on.
     * @param deregistrationFailureHandler  notified when a closed {@link Channel} could not be deregistered.
     */
    public DefaultEventLoop(Multiplexer multiplexer, DeregistrationFailureHandler deregistrationFailureHandler) {
        this.multiplexer = requireNonNull(multiplexer, "multiplexer");
        this.deregistrationFailureHandler =
                requireNonNull(deregistrationFailureHandler, "deregistrationFailureHandler");
        thread = Thread.currentThread();
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    @Override
    public void execute(Runnable task) {
        requireNonNull(task, "task");
        checkInEventLoop("execute");
        taskQueue.add(task);
    }

    @Override
    public void submitExternal(Runnable task) {
        requireNonNull(task, "task");
        synchronized (closeLock) {
            if (closed) {
                throw new RejectedExecutionException("event loop closed");
            }
            externalTaskQueue.offer(task);
        }
        if (!inEventLoop()) {
            multiplexer.wakeup();
        }
    }

    @Override
    public <V> Future<V> schedule(Callable<V> task) {
        requireNonNull(task, "task");
        checkInEventLoop("schedule");
        Promise<V> promise = newPromise();
        taskQueue.add(() -> {
            V result;
            try {
                result = task.call();
            } catch (Throwable cause) {
                promise.setFailure(cause);
                return;
            }
            promise.setSuccess(result);
        });
        return promise.asFuture();
    }

    @Override
    public void register(Channel channel) throws IOException {
        requireNonNull(channel, "channel");
        checkInEventLoop("register");
        checkNotClosed();
        multiplexer.register(channel.socket(), channel.interestedEvent(), channel);
    }

    @Override
    public void deregister(Channel channel) throws IOException {
        requireNonNull(channel, "channel");
        checkInEventLoop("deregister");
        checkNotClosed();
        multiplexer.deregister(channel.socket());
    }

    @Override
    public void reregister(Channel channel) throws IOException {
        requireNonNull(channel, "channel");
        checkInEventLoop("reregister");
        checkNotClosed();
        multiplexer.reregister(channel.socket(), channel.interestedEvent());
    }

    @Override
    public boolean isRegistered(Channel channel) {
        requireNonNull(channel, "channel");
        checkInEventLoop("isRegistered");
        return !closed && multiplexer.isRegistered(channel.socket());
    }

    @Override
    public void run() throws IOException {
        checkInEventLoop("run");
        checkNotClosed();
        if (hasTasks()) {
            // Tasks queued before the loop started must not wait for the first readiness event.
            multiplexer.wakeup();
        }
        while (!closed) {
            List<ReadinessEvent> events = multiplexer.awaitReady();
            for (ReadinessEvent event : events) {
                if (closed) {
                    break;
                }
                processReadyEvent(event);
            }
            runAllTasks();
        }
    }

    @Override
    public void close() {
        checkInEventLoop("close");
        int discarded;
        synchronized (closeLock) {
            if (closed) {
                return;
            }
            closed = true;
            discarded = externalTaskQueue.size();
            externalTaskQueue.clear();
        }
        discarded += taskQueue.size();
        taskQueue.clear();
        if (discarded > 0) {
            logger.debug("Discarded {} pending task(s) of a closed event loop.", discarded);
        }

        try {
            multiplexer.close();
        } catch (IOException e) {
            logger.warn("Failed to close a multiplexer.", e);
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private void processReadyEvent(ReadinessEvent event) {
        Object attachment = event.attachment();
        if (!(attachment instanceof Channel)) {
            throw new EventLoopInvariantError("readiness event does not belong to a channel: " + event);
        }
        Channel channel = (Channel) attachment;

        boolean open = channel.isOpen();
        if (open && event.isWritable()) {
            channel.flushFromEventLoop();
            open = channel.isOpen();
        }
        if (open && event.isReadable()) {
            channel.readFromEventLoop();
            open = channel.isOpen();
        }

        if (closed) {
            // A handler closed the loop, the multiplexer is gone.
            return;
        }
        if (open) {
            if (!multiplexer.isRegistered(channel.socket())) {
                throw new EventLoopInvariantError("open channel is not registered: " + channel);
            }
        } else if (deregisterClosed(channel) && multiplexer.isRegistered(channel.socket())) {
            throw new EventLoopInvariantError("closed channel is still registered: " + channel);
        }
    }

    private boolean deregisterClosed(Channel channel) {
        try {
            multiplexer.deregister(channel.socket());
            return true;
        } catch (IOException e) {
            deregistrationFailureHandler.deregistrationFailed(channel, e);
            return false;
        }
    }

    private void runAllTasks() {
        for (;;) {
            Runnable task = taskQueue.poll();
            if (task == null) {
                if (!fetchFromExternalTaskQueue()) {
                    return;
                }
                continue;
            }
            safeExecute(task);
        }
    }

    private boolean fetchFromExternalTaskQueue() {
        boolean fetched = false;
        for (;;) {
            Runnable task = externalTaskQueue.poll();
            if (task == null) {
                return fetched;
            }
            taskQueue.add(task);
            fetched = true;
        }
    }

    private static void safeExecute(Runnable task) {
        try {
            task.run();
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            logger.warn("A task raised an exception. Task: {}", task, t);
        }
    }

    private boolean hasTasks() {
        return !taskQueue.isEmpty() || !externalTaskQueue.isEmpty();
    }

    private void checkInEventLoop(String operation) {
        if (!inEventLoop()) {
            throw new ThreadAffinityError(operation, thread);
        }
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("event loop closed");
        }
    }

    @Override
    public String toString() {
        return "DefaultEventLoop(" + thread.getName() + ')';
    }
}
