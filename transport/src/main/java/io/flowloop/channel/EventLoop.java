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

import io.flowloop.util.concurrent.EventExecutor;
import io.flowloop.util.concurrent.ThreadAffinityError;

import java.io.IOException;

/**
 * Will handle all the I/O operations for the {@link Channel}s registered with it. One {@link EventLoop} is bound to
 * a single {@link Thread} and all of its methods except {@link #submitExternal(Runnable)} and {@link #isClosed()}
 * must be called from that thread. Calling them from another thread throws a {@link ThreadAffinityError}.
 */
public interface EventLoop extends EventExecutor {

    /**
     * Start watching the {@link Channel#socket()} for its {@link Channel#interestedEvent()}.
     */
    void register(Channel channel) throws IOException;

    /**
     * Stop watching the {@link Channel#socket()}.
     */
    void deregister(Channel channel) throws IOException;

    /**
     * Push the current {@link Channel#interestedEvent()} of an already registered {@link Channel}.
     */
    void reregister(Channel channel) throws IOException;

    /**
     * Returns {@code true} if the {@link Channel} is currently watched by this loop.
     */
    boolean isRegistered(Channel channel);

    /**
     * Run the loop on the calling thread until {@link #close()} is called.
     *
     * @throws IllegalStateException if the loop was closed already.
     * @throws IOException if waiting for readiness failed.
     */
    void run() throws IOException;

    /**
     * Stop the loop and release its resources. Tasks which did not run yet are discarded. Calling this method
     * more than once has no effect.
     */
    void close();

    /**
     * Returns {@code true} once {@link #close()} was called. Safe to call from any thread.
     */
    boolean isClosed();
}
