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

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * The default {@link ChannelPipeline}. A {@link Channel} implementation creates it and supplies the transport
 * operations that {@code read()}, {@code write(Object)} and {@code flush()} end up in once they passed every
 * handler.
 * <p>
 * The handler list may be changed from any thread. Linking a handler into the chain and the
 * {@code handlerAdded}/{@code handlerRemoved} callbacks always happen on the {@link EventLoop}.
 */
public abstract class DefaultChannelPipeline implements ChannelPipeline {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DefaultChannelPipeline.class);

    private final Channel channel;
    private final DefaultChannelHandlerContext head;
    private final DefaultChannelHandlerContext tail;

    // Guarded by itself. Holds the user handlers in pipeline order, head and tail excluded.
    private final List<DefaultChannelHandlerContext> handlers = new ArrayList<>(4);

    protected DefaultChannelPipeline(Channel channel) {
        this.channel = requireNonNull(channel, "channel");
        head = new DefaultChannelHandlerContext(this, "head", new HeadHandler());
        tail = new DefaultChannelHandlerContext(this, "tail", new TailHandler());
        head.next = tail;
        tail.prev = head;
    }

    @Override
    public final Channel channel() {
        return channel;
    }

    private EventLoop executor() {
        return channel.eventLoop();
    }

    @Override
    public final ChannelPipeline addFirst(String name, ChannelHandler handler) {
        add(name, handler, true);
        return this;
    }

    @Override
    public final ChannelPipeline addLast(String name, ChannelHandler handler) {
        add(name, handler, false);
        return this;
    }

    private void add(String name, ChannelHandler handler, boolean first) {
        requireNonNull(handler, "handler");
        DefaultChannelHandlerContext ctx;
        int idx;
        synchronized (handlers) {
            if (!handler.isSharable() && indexOf(c -> c.handler() == handler) != -1) {
                throw new ChannelPipelineException(
                        handler.getClass().getName() + " is not sharable and already part of this pipeline.");
            }
            if (name == null) {
                name = generateName(handler);
            } else if (indexOf(nameEquals(name)) != -1) {
                throw new IllegalArgumentException("Duplicate handler name: " + name);
            }
            ctx = new DefaultChannelHandlerContext(this, name, handler);
            idx = first ? 0 : handlers.size();
            handlers.add(idx, ctx);
        }

        if (executor().inEventLoop()) {
            link(ctx, first);
            return;
        }
        try {
            executor().submitExternal(() -> link(ctx, first));
        } catch (RuntimeException e) {
            synchronized (handlers) {
                handlers.remove(ctx);
            }
            throw e;
        }
    }

    private void link(DefaultChannelHandlerContext ctx, boolean first) {
        DefaultChannelHandlerContext prev = first ? head : tail.prev;
        DefaultChannelHandlerContext next = prev.next;
        ctx.prev = prev;
        ctx.next = next;
        prev.next = ctx;
        next.prev = ctx;

        try {
            ctx.callHandlerAdded();
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            synchronized (handlers) {
                handlers.remove(ctx);
            }
            unlinkAndNotify(ctx);
            fireChannelExceptionCaught(new ChannelPipelineException(
                    ctx.name() + ": handlerAdded() failed, the handler was removed.", t));
        }
    }

    private String generateName(ChannelHandler handler) {
        String prefix = StringUtil.simpleClassName(handler.getClass()) + '#';
        for (int i = 0;; i++) {
            String candidate = prefix + i;
            if (indexOf(nameEquals(candidate)) == -1) {
                return candidate;
            }
        }
    }

    private static Predicate<DefaultChannelHandlerContext> nameEquals(String name) {
        return ctx -> ctx.name().equals(name);
    }

    // Caller holds the handlers lock.
    private int indexOf(Predicate<DefaultChannelHandlerContext> predicate) {
        for (int i = 0; i < handlers.size(); i++) {
            if (predicate.test(handlers.get(i))) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public final ChannelPipeline remove(ChannelHandler handler) {
        requireNonNull(handler, "handler");
        remove0(ctx -> ctx.handler() == handler, handler.getClass().getName());
        return this;
    }

    @Override
    public final ChannelHandler remove(String name) {
        requireNonNull(name, "name");
        return remove0(nameEquals(name), name).handler();
    }

    private DefaultChannelHandlerContext remove0(Predicate<DefaultChannelHandlerContext> predicate, String what) {
        DefaultChannelHandlerContext ctx;
        synchronized (handlers) {
            int idx = indexOf(predicate);
            if (idx == -1) {
                throw new NoSuchElementException(what);
            }
            ctx = handlers.remove(idx);
        }

        if (executor().inEventLoop()) {
            unlinkAndNotify(ctx);
        } else {
            executor().submitExternal(() -> unlinkAndNotify(ctx));
        }
        return ctx;
    }

    private void unlinkAndNotify(DefaultChannelHandlerContext ctx) {
        ctx.unlink();
        try {
            ctx.callHandlerRemoved();
        } catch (EventLoopInvariantError e) {
            throw e;
        } catch (Throwable t) {
            fireChannelExceptionCaught(new ChannelPipelineException(
                    ctx.name() + ": handlerRemoved() failed.", t));
        }
    }

    @Override
    public final ChannelHandler get(String name) {
        ChannelHandlerContext ctx = context(name);
        return ctx == null ? null : ctx.handler();
    }

    @Override
    public final ChannelHandlerContext context(String name) {
        requireNonNull(name, "name");
        return find(nameEquals(name));
    }

    @Override
    public final ChannelHandlerContext context(ChannelHandler handler) {
        requireNonNull(handler, "handler");
        return find(ctx -> ctx.handler() == handler);
    }

    private ChannelHandlerContext find(Predicate<DefaultChannelHandlerContext> predicate) {
        synchronized (handlers) {
            int idx = indexOf(predicate);
            return idx == -1 ? null : handlers.get(idx);
        }
    }

    @Override
    public final List<String> names() {
        List<String> names = new ArrayList<>();
        synchronized (handlers) {
            for (DefaultChannelHandlerContext ctx : handlers) {
                names.add(ctx.name());
            }
        }
        return names;
    }

    @Override
    public final String toString() {
        return StringUtil.simpleClassName(this) + names();
    }

    @Override
    public final ChannelPipeline fireChannelRegistered() {
        // Off the loop nobody is left to rethrow to, a failure ends up in the loop's task log.
        onEventLoop(head::invokeChannelRegistered);
        return this;
    }

    @Override
    public final ChannelPipeline fireChannelRead(Object msg) {
        requireNonNull(msg, "msg");
        onEventLoop(() -> head.invokeChannelRead(msg));
        return this;
    }

    @Override
    public final ChannelPipeline fireChannelReadComplete() {
        onEventLoop(head::invokeChannelReadComplete);
        return this;
    }

    @Override
    public final ChannelPipeline fireChannelWritabilityChanged(boolean writable) {
        onEventLoop(() -> head.invokeChannelWritabilityChanged(writable));
        return this;
    }

    @Override
    public final ChannelPipeline fireChannelExceptionCaught(Throwable cause) {
        requireNonNull(cause, "cause");
        onEventLoop(() -> head.invokeChannelExceptionCaught(cause));
        return this;
    }

    private void onEventLoop(Runnable event) {
        if (executor().inEventLoop()) {
            event.run();
        } else {
            executor().submitExternal(event);
        }
    }

    @Override
    public final ChannelPipeline read() {
        tail.read();
        return this;
    }

    @Override
    public final Future<Void> write(Object msg) {
        return tail.write(msg);
    }

    @Override
    public final ChannelPipeline flush() {
        tail.flush();
        return this;
    }

    /**
     * Called when an exception passed every handler without being handled. Logs it at WARN.
     */
    protected void onUnhandledInboundException(Throwable cause) {
        logger.warn("{} Unhandled exception reached the end of the pipeline {}.", channel, names(), cause);
    }

    /**
     * Called when a message passed every handler without being consumed. Logs it at DEBUG.
     */
    protected void onUnhandledInboundMessage(Object msg) {
        logger.debug("{} Dropped message {} at the end of the pipeline {}.", channel, msg, names());
    }

    /**
     * Start watching the transport for inbound data. Called on the {@link EventLoop}; a read that is already
     * pending is left alone.
     */
    protected abstract void readTransport();

    /**
     * Queue {@code msg} on the transport and complete {@code promise} once it was written or failed. Called on the
     * {@link EventLoop}.
     */
    protected abstract void writeTransport(Object msg, Promise<Void> promise);

    /**
     * Write out what {@link #writeTransport(Object, Promise)} queued. Called on the {@link EventLoop}.
     */
    protected abstract void flushTransport();

    private static DefaultChannelPipeline pipeline(ChannelHandlerContext ctx) {
        return (DefaultChannelPipeline) ctx.pipeline();
    }

    // Ends every inbound event.
    private static final class TailHandler implements ChannelHandler {

        @Override
        public void channelRegistered(ChannelHandlerContext ctx) {
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            pipeline(ctx).onUnhandledInboundMessage(msg);
        }

        @Override
        public void channelReadComplete(ChannelHandlerContext ctx) {
        }

        @Override
        public void channelWritabilityChanged(ChannelHandlerContext ctx, boolean writable) {
        }

        @Override
        public void channelExceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            pipeline(ctx).onUnhandledInboundException(cause);
        }
    }

    // Hands every outbound operation to the transport.
    private static final class HeadHandler implements ChannelHandler {

        @Override
        public void read(ChannelHandlerContext ctx) {
            pipeline(ctx).readTransport();
        }

        @Override
        public Future<Void> write(ChannelHandlerContext ctx, Object msg) {
            Promise<Void> promise = ctx.executor().newPromise();
            pipeline(ctx).writeTransport(msg, promise);
            return promise.asFuture();
        }

        @Override
        public void flush(ChannelHandlerContext ctx) {
            pipeline(ctx).flushTransport();
        }
    }
}
