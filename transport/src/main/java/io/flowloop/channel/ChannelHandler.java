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
 * Handles an I/O event or intercepts an I/O operation, and forwards it to its next handler in
 * its {@link ChannelPipeline}.
 * <p>
 * Every method has a default implementation which just forwards to the next handler, so an implementation only
 * overrides the events it cares about.
 *
 * <h3>The context object</h3>
 * <p>
 * A {@link ChannelHandler} is provided with a {@link ChannelHandlerContext} object. A {@link ChannelHandler} is
 * supposed to interact with the {@link ChannelPipeline} it belongs to via a context object. Using the context
 * object, the {@link ChannelHandler} can pass events upstream or downstream or modify the pipeline dynamically.
 *
 * <h3>Threading</h3>
 * <p>
 * All methods are called on the {@link EventLoop} of the {@link Channel}. A handler must never block.
 */
public interface ChannelHandler {

    /**
     * Gets called after the {@link ChannelHandler} was added to the actual context and it's ready to handle events.
     */
    default void handlerAdded(ChannelHandlerContext ctx) throws Exception {
        // NOOP
    }

    /**
     * Gets called after the {@link ChannelHandler} was removed from the actual context and it doesn't handle events
     * anymore.
     */
    default void handlerRemoved(ChannelHandlerContext ctx) throws Exception {
        // NOOP
    }

    /**
     * Returns {@code true} if this handler may be added to more than one {@link ChannelPipeline}, or more than once
     * to the same one.
     */
    default boolean isSharable() {
        return false;
    }

    /**
     * The {@link Channel} of the {@link ChannelHandlerContext} was registered with its {@link EventLoop}.
     * <p>
     * Unlike the other inbound events, an exception thrown here is not routed to
     * {@link #channelExceptionCaught(ChannelHandlerContext, Throwable)} but propagated to whoever fired the event.
     */
    default void channelRegistered(ChannelHandlerContext ctx) throws Exception {
        ctx.fireChannelRegistered();
    }

    /**
     * Invoked when the current {@link Channel} has read a message from the peer.
     */
    default void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        ctx.fireChannelRead(msg);
    }

    /**
     * Invoked when the last message read by the current read operation has been consumed by
     * {@link #channelRead(ChannelHandlerContext, Object)}.
     */
    default void channelReadComplete(ChannelHandlerContext ctx) throws Exception {
        ctx.fireChannelReadComplete();
    }

    /**
     * Gets called once the writable state of a {@link Channel} changed. You can check the state with
     * {@link Channel#isWritable()}.
     */
    default void channelWritabilityChanged(ChannelHandlerContext ctx, boolean writable) throws Exception {
        ctx.fireChannelWritabilityChanged(writable);
    }

    /**
     * Gets called if a {@link Throwable} was thrown when handling inbound events.
     */
    default void channelExceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        ctx.fireChannelExceptionCaught(cause);
    }

    /**
     * Intercepts {@link ChannelHandlerContext#read()}.
     */
    default void read(ChannelHandlerContext ctx) {
        ctx.read();
    }

    /**
     * Called once a write operation is made. The write operation will write the messages through the
     * {@link ChannelPipeline}. Those are then ready to be flushed to the actual {@link Channel} once
     * {@link Channel#flushFromEventLoop()} or {@link ChannelPipeline#flush()} is called.
     *
     * @return the {@link Future} which is notified once the message was written or the write failed.
     */
    default Future<Void> write(ChannelHandlerContext ctx, Object msg) {
        return ctx.write(msg);
    }

    /**
     * Called once a flush operation is made. The flush operation will try to flush out all previous written
     * messages that are pending.
     */
    default void flush(ChannelHandlerContext ctx) {
        ctx.flush();
    }
}
