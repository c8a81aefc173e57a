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

import io.flowloop.channel.AbstractChannel;
import io.flowloop.channel.ChannelHandler;
import io.flowloop.channel.ChannelHandlerContext;
import io.flowloop.channel.DefaultEventLoop;
import io.flowloop.channel.EventLoop;
import io.flowloop.channel.IoOps;
import io.flowloop.channel.WriteBufferWaterMark;
import io.flowloop.channel.nio.NioMultiplexer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * {@link BackPressureHandler} in the pipeline of a registered {@link AbstractChannel} with auto read on.
 */
public class BackPressureChannelTest {

    private DefaultEventLoop loop;
    private ScriptedChannel channel;
    private BackPressureHandler handler;
    private final List<Object> received = new ArrayList<>();
    private final List<Boolean> writabilityChanges = new ArrayList<>();

    @BeforeEach
    public void setUp() throws IOException {
        loop = new DefaultEventLoop(new NioMultiplexer());
        channel = new ScriptedChannel(loop, SocketChannel.open());
        channel.setWriteBufferWaterMark(new WriteBufferWaterMark(4, 8));
        handler = new BackPressureHandler();
        channel.pipeline().addLast("backPressure", handler);
        channel.pipeline().addLast("app", new ChannelHandler() {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) {
                received.add(msg);
            }

            @Override
            public void channelWritabilityChanged(ChannelHandlerContext ctx, boolean writable) {
                writabilityChanges.add(writable);
            }
        });
        assertTrue(channel.register().isSuccess());
    }

    @AfterEach
    public void tearDown() {
        channel.close();
        loop.close();
    }

    @Test
    public void testReadsStopWhileUnwritable() {
        assertEquals(IoOps.READ, channel.interestedEvent());
        channel.acceptWrites = false;

        channel.pipeline().write("123456789");

        assertFalse(channel.isWritable());
        assertEquals(IoOps.READ_AND_WRITE, channel.interestedEvent());

        channel.inbound.add("a");
        channel.readFromEventLoop();

        assertEquals(List.of("a"), received);
        assertTrue(handler.isReadPending());
        assertEquals(IoOps.WRITE, channel.interestedEvent());
    }

    @Test
    public void testReadsResumeOnceDrained() {
        channel.acceptWrites = false;
        channel.pipeline().write("123456789");
        channel.inbound.add("a");
        channel.readFromEventLoop();
        assertEquals(IoOps.WRITE, channel.interestedEvent());

        channel.acceptWrites = true;
        channel.flushFromEventLoop();

        assertTrue(channel.isWritable());
        assertFalse(handler.isReadPending());
        assertEquals(IoOps.READ, channel.interestedEvent());
        assertEquals(List.of(false, true), writabilityChanges);
    }

    @Test
    public void testFlushOnUnwritableKeepsEventsInStep() {
        channel.pipeline().write("123456789");

        assertTrue(channel.isWritable());
        assertEquals(List.of("123456789"), channel.written);
        assertEquals(List.of(false, true), writabilityChanges);
        assertThat(channel.interestedEvent()).isEqualTo(IoOps.READ);
    }

    @Test
    public void testRemovingHandlerReleasesHeldBackRead() {
        channel.acceptWrites = false;
        channel.pipeline().write("123456789");
        channel.inbound.add("a");
        channel.readFromEventLoop();
        assertEquals(IoOps.WRITE, channel.interestedEvent());

        channel.pipeline().remove("backPressure");

        assertEquals(IoOps.READ_AND_WRITE, channel.interestedEvent());
    }

    /**
     * Reads and writes are scripted by the test. The unconnected socket only serves as the registration.
     */
    private static final class ScriptedChannel extends AbstractChannel {
        final Deque<Object> inbound = new ArrayDeque<>();
        final List<Object> written = new ArrayList<>();
        boolean acceptWrites = true;

        ScriptedChannel(EventLoop eventLoop, SocketChannel socket) {
            super(eventLoop, socket);
        }

        @Override
        protected int doReadMessages(List<Object> buf) {
            int count = 0;
            while (!inbound.isEmpty()) {
                buf.add(inbound.poll());
                count++;
            }
            return count;
        }

        @Override
        protected boolean doWrite(Object msg) {
            if (!acceptWrites) {
                return false;
            }
            written.add(msg);
            return true;
        }

        @Override
        protected int messageSize(Object msg) {
            return ((String) msg).length();
        }
    }
}
