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
package io.flowloop.channel.nio;

import io.flowloop.channel.IoOps;
import io.flowloop.channel.Multiplexer;
import io.flowloop.channel.ReadinessEvent;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;

import java.io.IOException;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.spi.SelectorProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * {@link Multiplexer} implementation which uses a JDK {@link Selector}.
 */
public final class NioMultiplexer implements Multiplexer {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(NioMultiplexer.class);

    private final Selector selector;

    /**
     * Opens a new {@link Selector} with the default {@link SelectorProvider}.
     */
    public NioMultiplexer() throws IOException {
        this(SelectorProvider.provider());
    }

    public NioMultiplexer(SelectorProvider provider) throws IOException {
        selector = requireNonNull(provider, "provider").openSelector();
    }

    @Override
    public void register(SelectableChannel selectable, IoOps interest, Object attachment) throws IOException {
        selectable.register(selector, interest.value(), attachment);
    }

    @Override
    public void deregister(SelectableChannel selectable) throws IOException {
        SelectionKey key = selectable.keyFor(selector);
        if (key == null) {
            if (!selectable.isOpen()) {
                // Closing the channel cancelled the key and a select() already dropped it.
                return;
            }
            throw new IOException("not registered: " + selectable);
        }
        key.cancel();
    }

    @Override
    public void reregister(SelectableChannel selectable, IoOps interest) throws IOException {
        SelectionKey key = selectable.keyFor(selector);
        if (key == null || !key.isValid()) {
            throw new ClosedChannelException();
        }
        try {
            key.interestOps(interest.value());
        } catch (CancelledKeyException e) {
            throw new IOException("registration cancelled: " + selectable, e);
        }
    }

    @Override
    public boolean isRegistered(SelectableChannel selectable) {
        SelectionKey key = selectable.keyFor(selector);
        return key != null && key.isValid();
    }

    @Override
    public List<ReadinessEvent> awaitReady() throws IOException {
        int selected = selector.select();
        if (selected == 0) {
            return Collections.emptyList();
        }
        Set<SelectionKey> selectedKeys = selector.selectedKeys();
        List<ReadinessEvent> events = new ArrayList<>(selectedKeys.size());
        Iterator<SelectionKey> i = selectedKeys.iterator();
        while (i.hasNext()) {
            SelectionKey key = i.next();
            i.remove();
            try {
                events.add(new ReadinessEvent(key.attachment(), IoOps.valueOf(key.readyOps())));
            } catch (CancelledKeyException e) {
                // The key was cancelled after select() returned, report it with no ready ops so the event loop
                // notices the closed channel.
                logger.debug("Selection key cancelled while collecting events: {}", key, e);
                events.add(new ReadinessEvent(key.attachment(), IoOps.NONE));
            }
        }
        return events;
    }

    @Override
    public void wakeup() {
        selector.wakeup();
    }

    @Override
    public boolean isClosed() {
        return !selector.isOpen();
    }

    @Override
    public void close() throws IOException {
        selector.close();
    }

    @Override
    public String toString() {
        return "NioMultiplexer(" + selector + ')';
    }
}
