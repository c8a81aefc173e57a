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

import io.flowloop.channel.Channel;
import io.flowloop.channel.ChannelHandlerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class BackPressureHandlerTest {

    private Channel channel;
    private ChannelHandlerContext ctx;
    private BackPressureHandler handler;

    @BeforeEach
    public void setUp() throws Exception {
        channel = mock(Channel.class);
        when(channel.isWritable()).thenReturn(true);
        ctx = mock(ChannelHandlerContext.class);
        when(ctx.channel()).thenReturn(channel);

        handler = new BackPressureHandler();
        handler.handlerAdded(ctx);
    }

    @Test
    public void testReadPassesThroughWhileWritable() {
        handler.read(ctx);
        handler.read(ctx);

        verify(ctx, times(2)).read();
        assertFalse(handler.isReadPending());
    }

    @Test
    public void testReadHeldBackWhileUnwritable() throws Exception {
        handler.channelWritabilityChanged(ctx, false);

        handler.read(ctx);
        handler.read(ctx);
        handler.read(ctx);

        verify(ctx, never()).read();
        assertTrue(handler.isReadPending());
    }

    @Test
    public void testHeldBackReadsCollapseIntoOne() throws Exception {
        handler.channelWritabilityChanged(ctx, false);
        handler.read(ctx);
        handler.read(ctx);

        handler.channelWritabilityChanged(ctx, true);

        verify(ctx, times(1)).read();
        assertFalse(handler.isReadPending());
    }

    @Test
    public void testNoReadWhenWritableAgainWithoutRequest() throws Exception {
        handler.channelWritabilityChanged(ctx, false);
        handler.channelWritabilityChanged(ctx, true);

        verify(ctx, never()).read();
    }

    @Test
    public void testUnwritableTriggersFlush() throws Exception {
        handler.channelWritabilityChanged(ctx, false);

        InOrder inOrder = inOrder(ctx);
        inOrder.verify(ctx).flush();
        inOrder.verify(ctx).fireChannelWritabilityChanged(false);
    }

    @Test
    public void testWritabilityChangeIsForwarded() throws Exception {
        handler.channelWritabilityChanged(ctx, false);
        handler.read(ctx);
        handler.channelWritabilityChanged(ctx, true);

        InOrder inOrder = inOrder(ctx);
        inOrder.verify(ctx).fireChannelWritabilityChanged(false);
        inOrder.verify(ctx).read();
        inOrder.verify(ctx).fireChannelWritabilityChanged(true);
        verify(ctx, times(1)).flush();
    }

    @Test
    public void testRemovalReleasesPendingRead() throws Exception {
        handler.channelWritabilityChanged(ctx, false);
        handler.read(ctx);

        handler.handlerRemoved(ctx);

        verify(ctx, times(1)).read();
        assertFalse(handler.isReadPending());
    }

    @Test
    public void testRemovalWithoutPendingRead() throws Exception {
        handler.handlerRemoved(ctx);

        verify(ctx, never()).read();
    }

    @Test
    public void testStartsUnwritableWhenChannelIs() throws Exception {
        when(channel.isWritable()).thenReturn(false);
        BackPressureHandler late = new BackPressureHandler();
        late.handlerAdded(ctx);

        late.read(ctx);

        assertFalse(late.isWritable());
        assertTrue(late.isReadPending());
        verify(ctx, never()).read();
    }
}
