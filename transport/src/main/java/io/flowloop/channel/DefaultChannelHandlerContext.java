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
import io.flowloop.util.internal.StringUtil;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;

import java.util.concurrent.RejectedExecutionException;

import static java.util.Objects.requireNonNull;

final class DefaultChannelHandlerContext implements ChannelHandlerContext {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DefaultChannelHandlerContext.class);

    private final DefaultChannelPipeline pipeline;
    private final ChannelHandler handler;
    private final String name;

    // Only touched from the event loop. A removed context keeps its links so events fired from it while it is
    // being removed still reach its former neighbours.
    DefaultChannelHandlerContext next;
    DefaultChannelHandlerContext prev;

    private boolean added;
    private volatile boolean removed;

    DefaultChannelHandlerContext(DefaultChannelPipeline pipeline, String name, ChannelHandler handler) {
        this.pipeline = pipeline;
        this.name = requireNonNull(name, "name");
        this.handler = requireNonNull(handler, "handler");
    }

    @Override
    public Channel channel() {
        return pipeline.channel();
    }

    @Override
    public ChannelPipeline pipeline() {
        return pipeline;
    }

    @Override
    public EventLoop executor() {
        return channel().eventLoop();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ChannelHandler handler() {
        return handler;
    }

    @Override
    public boolean isRemoved() {
        return removed;
    }

    @Override
    public ChannelHandlerContext fireChannelRegistered() {
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            next.invokeChannelRegistered();
        } else {
            executor.submitExternal(this::fireChannelRegistered);
        }
        return this;
    }

    void invokeChannelRegistered() {
        try {
            handler.channelRegistered(this);
        } catch (ChannelPipelineException | EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            throw new ChannelPipelineException(
                    handler.getClass().getName() + ".channelRegistered() has thrown an exception.", t);
        }
    }

    @Override
    public ChannelHandlerContext fireChannelRead(Object msg) {
        requireNonNull(msg, "msg");
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            next.invokeChannelRead(msg);
        } else {
            executor.submitExternal(() -> fireChannelRead(msg));
        }
        return this;
    }

    void invokeChannelRead(Object msg) {
        try {
            handler.channelRead(this, msg);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            invokeChannelExceptionCaught(t);
        }
    }

    @Override
    public ChannelHandlerContext fireChannelReadComplete() {
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            next.invokeChannelReadComplete();
        } else {
            executor.submitExternal(this::fireChannelReadComplete);
        }
        return this;
    }

    void invokeChannelReadComplete() {
        try {
            handler.channelReadComplete(this);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            invokeChannelExceptionCaught(t);
        }
    }

    @Override
    public ChannelHandlerContext fireChannelWritabilityChanged(boolean writable) {
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            next.invokeChannelWritabilityChanged(writable);
        } else {
            executor.submitExternal(() -> fireChannelWritabilityChanged(writable));
        }
        return this;
    }

    void invokeChannelWritabilityChanged(boolean writable) {
        try {
            handler.channelWritabilityChanged(this, writable);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            invokeChannelExceptionCaught(t);
        }
    }

    @Override
    public ChannelHandlerContext fireChannelExceptionCaught(Throwable cause) {
        requireNonNull(cause, "cause");
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            next.invokeChannelExceptionCaught(cause);
        } else {
            try {
                executor.submitExternal(() -> fireChannelExceptionCaught(cause));
            } catch (RejectedExecutionException e) {
                if (logger.isWarnEnabled()) {
                    logger.warn("Failed to submit an exceptionCaught() event.", e);
                    logger.warn("The exceptionCaught() event that was failed to submit was:", cause);
                }
            }
        }
        return this;
    }

    void invokeChannelExceptionCaught(Throwable cause) {
        try {
            handler.channelExceptionCaught(this, cause);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable error) {
            if (logger.isWarnEnabled()) {
                logger.warn(
                        "An exception '{}' was thrown by a user handler's exceptionCaught() " +
                                "method while handling the following exception:", error, cause);
            }
        }
    }

    @Override
    public ChannelHandlerContext read() {
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            prev.invokeRead();
        } else {
            executor.submitExternal(this::read);
        }
        return this;
    }

    void invokeRead() {
        try {
            handler.read(this);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            handleOutboundHandlerException(t);
        }
    }

    @Override
    public Future<Void> write(Object msg) {
        requireNonNull(msg, "msg");
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            return prev.invokeWrite(msg);
        }
        Promise<Void> promise = executor.newPromise();
        try {
            executor.submitExternal(() -> prev.invokeWrite(msg).addListener(f -> {
                if (f.isSuccess()) {
                    promise.trySuccess(null);
                } else {
                    promise.tryFailure(f.cause());
                }
            }));
        } catch (RejectedExecutionException e) {
            promise.setFailure(e);
        }
        return promise.asFuture();
    }

    Future<Void> invokeWrite(Object msg) {
        try {
            return handler.write(this, msg);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            return handleOutboundHandlerException(t);
        }
    }

    @Override
    public ChannelHandlerContext flush() {
        EventLoop executor = executor();
        if (executor.inEventLoop()) {
            prev.invokeFlush();
        } else {
            executor.submitExternal(this::flush);
        }
        return this;
    }

    void invokeFlush() {
        try {
            handler.flush(this);
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            handleOutboundHandlerException(t);
        }
    }

    private Future<Void> handleOutboundHandlerException(Throwable cause) {
        String msg = handler + " threw an exception while handling an outbound operation. This is most likely a bug";
        logger.warn("{}.", msg, cause);
        pipeline.fireChannelExceptionCaught(cause);
        return executor().newFailedFuture(new IllegalStateException(msg, cause));
    }

    void callHandlerAdded() throws Exception {
        added = true;
        handler.handlerAdded(this);
    }

    void callHandlerRemoved() throws Exception {
        try {
            // Only call handlerRemoved(...) if we called handlerAdded(...) before.
            if (added) {
                handler.handlerRemoved(this);
            }
        } finally {
            removed = true;
        }
    }

    void unlink() {
        if (prev != null) {
            prev.next = next;
        }
        if (next != null) {
            next.prev = prev;
        }
    }

    @Override
    public String toString() {
        return StringUtil.simpleClassName(ChannelHandlerContext.class) + '(' + name + ", " + channel() + ')';
    }
}
