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
import io.flowloop.util.concurrent.Promise;
import io.flowloop.util.internal.StringUtil;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectableChannel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

import static java.util.Objects.requireNonNull;

/**
 * A skeletal {@link Channel} implementation over a {@link SelectableChannel}.
 * <p>
 * Sub-classes only move messages in and out of the socket through {@link #doReadMessages(List)} and
 * {@link #doWrite(Object)}. This class keeps the outbound buffer, maps {@code read()} and {@code flush()} requests
 * of the {@link ChannelPipeline} onto the ops the {@link EventLoop} watches, and tracks writability against the
 * {@link WriteBufferWaterMark}. I/O failures are reported through the pipeline and close the channel.
 */
public abstract class AbstractChannel implements Channel {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(AbstractChannel.class);

    private final EventLoop eventLoop;
    private final SelectableChannel socket;
    private final DefaultChannelPipeline pipeline;
    private final Queue<PendingWrite> outboundBuffer = new ArrayDeque<>();

    private IoOps interest = IoOps.NONE;
    private long totalPending;
    private volatile boolean writable = true;
    private boolean notifiedWritable = true;
    private boolean firingWritabilityChanged;
    private volatile WriteBufferWaterMark writeBufferWaterMark = WriteBufferWaterMark.DEFAULT;
    private volatile boolean autoRead = true;
    private boolean registered;
    private volatile boolean closed;

    /**
     * Create a new instance.
     *
     * @param eventLoop the {@link EventLoop} this channel is bound to.
     * @param socket    the underlying {@link SelectableChannel}. It is switched to non-blocking mode.
     */
    protected AbstractChannel(EventLoop eventLoop, SelectableChannel socket) {
        this.eventLoop = requireNonNull(eventLoop, "eventLoop");
        this.socket = requireNonNull(socket, "socket");
        try {
            socket.configureBlocking(false);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException e2) {
                logger.warn("Failed to close a partially initialized socket.", e2);
            }

            throw new ChannelException("Failed to enter non-blocking mode.", e);
        }
        pipeline = newChannelPipeline();
    }

    /**
     * Returns a new {@link DefaultChannelPipeline} instance.
     */
    protected DefaultChannelPipeline newChannelPipeline() {
        return new DefaultAbstractChannelPipeline(this);
    }

    @Override
    public final EventLoop eventLoop() {
        return eventLoop;
    }

    @Override
    public final ChannelPipeline pipeline() {
        return pipeline;
    }

    @Override
    public final SelectableChannel socket() {
        return socket;
    }

    @Override
    public final IoOps interestedEvent() {
        return interest;
    }

    @Override
    public boolean isOpen() {
        return !closed && socket.isOpen();
    }

    @Override
    public final boolean isWritable() {
        return writable;
    }

    /**
     * Returns {@code true} if {@link ChannelPipeline#read()} is issued automatically after every read and once the
     * channel is registered. Default is {@code true}.
     */
    public final boolean isAutoRead() {
        return autoRead;
    }

    /**
     * Sets if {@link ChannelPipeline#read()} will be invoked automatically so that a user application doesn't
     * need to call it at all.
     */
    public final void setAutoRead(boolean autoRead) {
        boolean oldAutoRead = this.autoRead;
        this.autoRead = autoRead;
        if (autoRead && !oldAutoRead && registered) {
            pipeline.read();
        }
    }

    public final WriteBufferWaterMark getWriteBufferWaterMark() {
        return writeBufferWaterMark;
    }

    /**
     * Set the {@link WriteBufferWaterMark} which is used for setting the high and low
     * water mark of the write buffer.
     */
    public final void setWriteBufferWaterMark(WriteBufferWaterMark writeBufferWaterMark) {
        this.writeBufferWaterMark = requireNonNull(writeBufferWaterMark, "writeBufferWaterMark");
    }

    /**
     * Returns the number of bytes buffered for writing, as reported by {@link #messageSize(Object)}.
     */
    public final long totalPending() {
        return totalPending;
    }

    /**
     * Register this channel with its {@link EventLoop} and fire {@code channelRegistered} through the pipeline.
     * Must be called from the {@link EventLoop}.
     *
     * @return a {@link Future} which fails with the cause thrown by a handler, typically a
     *         {@link ChannelInitializer}, while handling {@code channelRegistered}.
     */
    public final Future<Void> register() {
        try {
            eventLoop.register(this);
        } catch (IOException e) {
            return eventLoop.newFailedFuture(e);
        }
        registered = true;

        try {
            pipeline.fireChannelRegistered();
        } catch (ChannelPipelineException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.debug("Failed to handle channelRegistered for {}", this, cause);
            return eventLoop.newFailedFuture(cause);
        }

        if (autoRead) {
            pipeline.read();
        }
        return eventLoop.newSucceededFuture(null);
    }

    @Override
    public final void flushFromEventLoop() {
        assert eventLoop.inEventLoop();
        flush0();
    }

    @Override
    public final void readFromEventLoop() {
        assert eventLoop.inEventLoop();
        if (!isOpen()) {
            return;
        }
        // Every read is requested through the pipeline, so a handler can hold the next one back.
        setInterest(interest.without(IoOps.READ));

        List<Object> readBuf = new ArrayList<>();
        IOException exception = null;
        int read;
        try {
            read = doReadMessages(readBuf);
        } catch (IOException e) {
            exception = e;
            read = 0;
        }

        for (int i = 0; i < readBuf.size(); i++) {
            pipeline.fireChannelRead(readBuf.get(i));
        }
        pipeline.fireChannelReadComplete();

        if (exception != null) {
            handleIoException(exception);
        } else if (read < 0) {
            close();
        } else {
            readIfIsAutoRead();
        }
    }

    private void readIfIsAutoRead() {
        if (autoRead && isOpen()) {
            pipeline.read();
        }
    }

    /**
     * Close the channel. Pending writes are failed with a {@link ClosedChannelException} and the socket is closed,
     * which stops the {@link EventLoop} from watching it. Calling this method more than once has no effect.
     */
    public final void close() {
        if (!eventLoop.inEventLoop()) {
            eventLoop.submitExternal(this::close);
            return;
        }
        if (closed) {
            return;
        }
        closed = true;

        try {
            socket.close();
        } catch (IOException e) {
            logger.warn("Failed to close a channel: {}", this, e);
        }

        ClosedChannelException cause = new ClosedChannelException();
        for (;;) {
            PendingWrite write = outboundBuffer.poll();
            if (write == null) {
                break;
            }
            write.promise.tryFailure(cause);
        }
        totalPending = 0;
    }

    /**
     * Read what is available from the socket into {@code buf}.
     *
     * @return the number of messages added, or {@code -1} if the peer closed the stream.
     */
    protected abstract int doReadMessages(List<Object> buf) throws IOException;

    /**
     * Write as much of {@code msg} as the socket accepts now.
     *
     * @return {@code true} if {@code msg} was written completely, {@code false} if the rest has to wait until the
     *         socket is writable again. {@code msg} is handed in again then.
     */
    protected abstract boolean doWrite(Object msg) throws IOException;

    /**
     * Return the number of bytes {@code msg} accounts for in the outbound buffer.
     */
    protected abstract int messageSize(Object msg);

    private void readTransport() {
        if (!isOpen()) {
            return;
        }
        setInterest(interest.with(IoOps.READ));
    }

    private void writeTransport(Object msg, Promise<Void> promise) {
        if (!isOpen()) {
            promise.setFailure(new ClosedChannelException());
            return;
        }
        int size = messageSize(msg);
        outboundBuffer.add(new PendingWrite(msg, size, promise));
        totalPending += size;
        updateWritability();
    }

    private void flushTransport() {
        if (interest.contains(IoOps.WRITE)) {
            // Already waiting for the socket to become writable.
            return;
        }
        flush0();
    }

    private void flush0() {
        if (!isOpen()) {
            return;
        }
        for (;;) {
            PendingWrite write = outboundBuffer.peek();
            if (write == null) {
                break;
            }
            boolean done;
            try {
                done = doWrite(write.msg);
            } catch (IOException e) {
                handleIoException(e);
                return;
            }
            if (!done) {
                break;
            }
            outboundBuffer.remove();
            totalPending -= write.size;
            write.promise.trySuccess(null);
        }
        updateWritability();
        if (isOpen()) {
            setInterest(outboundBuffer.isEmpty() ? interest.without(IoOps.WRITE) : interest.with(IoOps.WRITE));
        }
    }

    private void updateWritability() {
        WriteBufferWaterMark waterMark = writeBufferWaterMark;
        if (writable && totalPending > waterMark.high()) {
            writable = false;
        } else if (!writable && totalPending < waterMark.low()) {
            writable = true;
        }
        if (firingWritabilityChanged) {
            // A handler flushed while the previous change was still travelling through the pipeline. The loop
            // below delivers the new state once that event is done.
            return;
        }
        firingWritabilityChanged = true;
        try {
            while (notifiedWritable != writable) {
                notifiedWritable = writable;
                pipeline.fireChannelWritabilityChanged(notifiedWritable);
            }
        } finally {
            firingWritabilityChanged = false;
        }
    }

    private void setInterest(IoOps ops) {
        if (ops.equals(interest)) {
            return;
        }
        interest = ops;
        if (registered && isOpen()) {
            try {
                eventLoop.reregister(this);
            } catch (IOException e) {
                handleIoException(e);
            }
        }
    }

    private void handleIoException(IOException cause) {
        pipeline.fireChannelExceptionCaught(cause);
        close();
    }

    @Override
    public String toString() {
        return StringUtil.simpleClassName(this) + '(' + socket + ')';
    }

    private static final class PendingWrite {
        final Object msg;
        final int size;
        final Promise<Void> promise;

        PendingWrite(Object msg, int size, Promise<Void> promise) {
            this.msg = msg;
            this.size = size;
            this.promise = promise;
        }
    }

    protected static class DefaultAbstractChannelPipeline extends DefaultChannelPipeline {
        protected DefaultAbstractChannelPipeline(AbstractChannel channel) {
            super(channel);
        }

        protected final AbstractChannel abstractChannel() {
            return (AbstractChannel) channel();
        }

        @Override
        protected final void readTransport() {
            abstractChannel().readTransport();
        }

        @Override
        protected final void writeTransport(Object msg, Promise<Void> promise) {
            abstractChannel().writeTransport(msg, promise);
        }

        @Override
        protected final void flushTransport() {
            abstractChannel().flushTransport();
        }
    }
}
