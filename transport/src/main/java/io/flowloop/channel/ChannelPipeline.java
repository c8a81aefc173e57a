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

import io.flowloop.util.concurrent.Future;

import java.util.List;

/**
 * A list of {@link ChannelHandler}s which handles or intercepts inbound events and outbound operations of a
 * {@link Channel}.
 * <pre>
 *                                                 I/O Request
 *                                            via {@link Channel} or
 *                                        {@link ChannelHandlerContext}
 *                                                      |
 *  +---------------------------------------------------+---------------+
 *  |                           ChannelPipeline         |               |
 *  |                                                  \|/              |
 *  |    +----------------------------------------------+----------+    |
 *  |    |                   ChannelHandler  N                     |    |
 *  |    +----------+-----------------------------------+----------+    |
 *  |              /|\                                  |               |
 *  |               |                                  \|/              |
 *  |    +----------+-----------------------------------+----------+    |
 *  |    |                   ChannelHandler  1                     |    |
 *  |    +----------+-----------------------------------+----------+    |
 *  |              /|\                                  |               |
 *  +---------------+-----------------------------------+---------------+
 *                  |                                  \|/
 *  +---------------+-----------------------------------+---------------+
 *  |               |                                   |               |
 *  |       [ Channel.readFromEventLoop() ]   [ Channel.flushFromEventLoop() ] |
 *  +-------------------------------------------------------------------+
 * </pre>
 * Inbound events travel from the first handler to the last one; outbound operations travel from the last handler
 * to the first one and end up in the {@link Channel}.
 * <p>
 * A pipeline is modified only from the {@link EventLoop} of its {@link Channel}.
 */
public interface ChannelPipeline {

    /**
     * Inserts a {@link ChannelHandler} at the first position of this pipeline.
     *
     * @throws IllegalArgumentException if there's an entry with the same name already in the pipeline
     */
    ChannelPipeline addFirst(String name, ChannelHandler handler);

    /**
     * Appends a {@link ChannelHandler} at the last position of this pipeline.
     *
     * @throws IllegalArgumentException if there's an entry with the same name already in the pipeline
     */
    ChannelPipeline addLast(String name, ChannelHandler handler);

    /**
     * Appends a {@link ChannelHandler} at the last position of this pipeline with a generated name.
     */
    default ChannelPipeline addLast(ChannelHandler handler) {
        return addLast(null, handler);
    }

    /**
     * Removes the specified {@link ChannelHandler} from this pipeline.
     *
     * @throws java.util.NoSuchElementException if there's no such handler in this pipeline
     */
    ChannelPipeline remove(ChannelHandler handler);

    /**
     * Removes the {@link ChannelHandler} with the specified name from this pipeline.
     *
     * @return the removed handler
     * @throws java.util.NoSuchElementException if there's no such handler with the specified name in this pipeline
     */
    ChannelHandler remove(String name);

    /**
     * Returns the {@link ChannelHandler} with the specified name in this pipeline, or {@code null} if there's no
     * such handler.
     */
    ChannelHandler get(String name);

    /**
     * Returns the context object of the specified {@link ChannelHandler} in this pipeline, or {@code null} if
     * there's no such handler.
     */
    ChannelHandlerContext context(ChannelHandler handler);

    /**
     * Returns the context object of the {@link ChannelHandler} with the specified name in this pipeline, or
     * {@code null} if there's no such handler.
     */
    ChannelHandlerContext context(String name);

    /**
     * Returns the {@link List} of the handler names, from the first to the last one.
     */
    List<String> names();

    /**
     * Returns the {@link Channel} that this pipeline is attached to.
     */
    Channel channel();

    /**
     * A {@link Channel} was registered to its {@link EventLoop}.
     *
     * @throws ChannelPipelineException if a handler failed to handle the event. The cause is what the handler threw.
     */
    ChannelPipeline fireChannelRegistered();

    /**
     * A {@link Channel} received a message.
     */
    ChannelPipeline fireChannelRead(Object msg);

    /**
     * Triggers a {@code channelReadComplete} event to the first handler.
     */
    ChannelPipeline fireChannelReadComplete();

    /**
     * Triggers a {@code channelWritabilityChanged} event to the first handler.
     */
    ChannelPipeline fireChannelWritabilityChanged(boolean writable);

    /**
     * A {@link Channel} received an {@link Throwable} in one of its inbound operations.
     */
    ChannelPipeline fireChannelExceptionCaught(Throwable cause);

    /**
     * Request to read data from the {@link Channel}, starting at the last handler.
     */
    ChannelPipeline read();

    /**
     * Request to write a message through the pipeline, starting at the last handler.
     */
    Future<Void> write(Object msg);

    /**
     * Request to flush all pending messages, starting at the last handler.
     */
    ChannelPipeline flush();
}
