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
package io.flowloop.handler.flow;

import io.flowloop.channel.ChannelHandler;
import io.flowloop.channel.ChannelHandlerContext;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;

/**
 * The {@link BackPressureHandler} stops reading from the {@link io.flowloop.channel.Channel} while it cannot take
 * more outbound data.
 * <p>
 * While the channel is unwritable, every {@code read()} request is held back. Any number of held back requests
 * collapse into a single pending read which is issued once the channel becomes writable again, or when this
 * handler is removed from the pipeline. Losing writability also triggers a {@code flush()} so the buffered data
 * can drain.
 *
 * <pre>{@code
 * ChannelPipeline pipeline = ...;
 *
 * pipeline.addLast(new BackPressureHandler());
 * pipeline.addLast(new MyEchoHandler());
 * }</pre>
 *
 * A {@link BackPressureHandler} keeps per-channel state and so must not be shared.
 */
public class BackPressureHandler implements ChannelHandler {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(BackPressureHandler.class);

    private boolean readPending;
    private boolean writable = true;

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) throws Exception {
        writable = ctx.channel().isWritable();
    }

    @Override
    public void read(ChannelHandlerContext ctx) {
        if (writable) {
            ctx.read();
        } else {
            if (!readPending && logger.isTraceEnabled()) {
                logger.trace("{} Holding back read() until the channel is writable again.", ctx.channel());
            }
            readPending = true;
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx, boolean writable) throws Exception {
        this.writable = writable;
        if (writable) {
            if (readPending) {
                readPending = false;
                ctx.read();
            }
        } else {
            ctx.flush();
        }
        ctx.fireChannelWritabilityChanged(writable);
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) throws Exception {
        if (readPending) {
            readPending = false;
            ctx.read();
        }
    }

    boolean isReadPending() {
        return readPending;
    }

    boolean isWritable() {
        return writable;
    }
}
