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

/**
 * Enables a {@link ChannelHandler} to interact with its {@link ChannelPipeline}
 * and other handlers. Among other things a handler can notify the next {@link ChannelHandler} in the
 * {@link ChannelPipeline} as well as modify the {@link ChannelPipeline} it belongs to dynamically.
 * <p>
 * The {@code fire*} methods pass an inbound event to the next handler towards the tail; {@link #read()},
 * {@link #write(Object)} and {@link #flush()} pass an outbound operation to the next handler towards the head,
 * where it reaches the {@link Channel}.
 */
public interface ChannelHandlerContext {

    /**
     * Return the {@link Channel} which is bound to the {@link ChannelHandlerContext}.
     */
    Channel channel();

    /**
     * Returns the {@link EventLoop} which is used to execute the handler.
     */
    EventLoop executor();

    /**
     * The unique name of the {@link ChannelHandlerContext}. The name was used when then {@link ChannelHandler}
     * was added to the {@link ChannelPipeline}.
     */
    String name();

    /**
     * The {@link ChannelHandler} that is bound this {@link ChannelHandlerContext}.
     */
    ChannelHandler handler();

    /**
     * Return {@code true} if the {@link ChannelHandler} which belongs to this context was removed
     * from the {@link ChannelPipeline}.
     */
    boolean isRemoved();

    /**
     * Return the assigned {@link ChannelPipeline}.
     */
    ChannelPipeline pipeline();

    /**
     * A {@link Channel} was registered to its {@link EventLoop}. Exceptions thrown by the next handlers are
     * rethrown wrapped in a {@link ChannelPipelineException}.
     */
    ChannelHandlerContext fireChannelRegistered();

    /**
     * A {@link Channel} received a message.
     */
    ChannelHandlerContext fireChannelRead(Object msg);

    /**
     * Triggers a {@link ChannelHandler#channelReadComplete(ChannelHandlerContext)}
     * event to the next {@link ChannelHandler} in the {@link ChannelPipeline}.
     */
    ChannelHandlerContext fireChannelReadComplete();

    /**
     * Triggers a {@link ChannelHandler#channelWritabilityChanged(ChannelHandlerContext, boolean)}
     * event to the next {@link ChannelHandler} in the {@link ChannelPipeline}.
     */
    ChannelHandlerContext fireChannelWritabilityChanged(boolean writable);

    /**
     * A {@link Channel} received an {@link Throwable} in one of its inbound operations.
     */
    ChannelHandlerContext fireChannelExceptionCaught(Throwable cause);

    /**
     * Request to read data from the {@link Channel}. If data was read, a {@code channelRead} event is triggered and
     * a {@code channelReadComplete} event so the handler can decide to continue reading.
     */
    ChannelHandlerContext read();

    /**
     * Request to write a message via this {@link ChannelHandlerContext} through the {@link ChannelPipeline}.
     * This method will not request to actual flush, so be sure to call {@link #flush()}
     * once you want to request to flush all pending data to the actual transport.
     */
    Future<Void> write(Object msg);

    /**
     * Request to flush all pending messages via this {@link ChannelHandlerContext}.
     */
    ChannelHandlerContext flush();
}
