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

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.SelectableChannel;
import java.util.List;

/**
 * Waits for readiness of many registered {@link SelectableChannel}s at once.
 * <p>
 * A {@link Multiplexer} is owned by exactly one {@link EventLoop} and, except for {@link #wakeup()}, is only
 * ever called from that loop's thread. Implementations need not be thread-safe.
 */
public interface Multiplexer extends Closeable {

    /**
     * Start watching {@code selectable} for the given ops. Every {@link ReadinessEvent} reported for it carries
     * {@code attachment}.
     */
    void register(SelectableChannel selectable, IoOps interest, Object attachment) throws IOException;

    /**
     * Stop watching {@code selectable}.
     */
    void deregister(SelectableChannel selectable) throws IOException;

    /**
     * Replace the ops {@code selectable} is watched for.
     */
    void reregister(SelectableChannel selectable, IoOps interest) throws IOException;

    /**
     * Returns {@code true} if {@code selectable} is currently watched.
     */
    boolean isRegistered(SelectableChannel selectable);

    /**
     * Block until at least one registered selectable is ready or {@link #wakeup()} is called, and return the
     * batch of ready events. The batch is empty if the wait ended because of a wakeup.
     */
    List<ReadinessEvent> awaitReady() throws IOException;

    /**
     * Make a blocked or the next {@link #awaitReady()} call return immediately. Safe to call from any thread.
     */
    void wakeup();

    /**
     * Returns {@code true} once {@link #close()} was called.
     */
    boolean isClosed();

    /**
     * Release the underlying resources. Registered selectables are not closed.
     */
    @Override
    void close() throws IOException;
}
