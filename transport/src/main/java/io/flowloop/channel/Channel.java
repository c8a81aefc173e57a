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

import java.nio.channels.SelectableChannel;

/**
 * A nexus to a network socket or a component which is capable of I/O operations such as read and write, driven by
 * exactly one {@link EventLoop}.
 * <p>
 * A channel is registered with its {@link EventLoop} for its whole life. The loop watches {@link #socket()} for
 * the ops in {@link #interestedEvent()} and calls {@link #flushFromEventLoop()} and {@link #readFromEventLoop()}
 * when the socket is ready. Everything that happens to the channel is reported through its
 * {@link ChannelPipeline}.
 */
public interface Channel {

    /**
     * Return the {@link EventLoop} this {@link Channel} is bound to.
     */
    EventLoop eventLoop();

    /**
     * Return the assigned {@link ChannelPipeline}.
     */
    ChannelPipeline pipeline();

    /**
     * Return the selectable the {@link EventLoop} watches for this {@link Channel}.
     */
    SelectableChannel socket();

    /**
     * Return the ops the {@link EventLoop} should watch {@link #socket()} for.
     */
    IoOps interestedEvent();

    /**
     * Returns {@code true} if the {@link Channel} is open and may get active later
     */
    boolean isOpen();

    /**
     * Returns {@code true} if and only if the I/O thread will perform the requested flush operation immediately.
     * Any write requests made when this method returns {@code false} are queued until the I/O thread is ready to
     * process the queued write requests.
     */
    boolean isWritable();

    /**
     * Write as much of the buffered outbound data as the socket accepts. Only called by the {@link EventLoop} when
     * {@link #socket()} is writable. May close the channel.
     */
    void flushFromEventLoop();

    /**
     * Read what the socket has to offer and push it through the {@link #pipeline()}. Only called by the
     * {@link EventLoop} when {@link #socket()} is readable. May close the channel.
     */
    void readFromEventLoop();
}
