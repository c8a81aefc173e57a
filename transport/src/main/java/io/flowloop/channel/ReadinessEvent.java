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

import static java.util.Objects.requireNonNull;

/**
 * One readiness notification returned by {@link Multiplexer#awaitReady()}: the attachment a selectable was
 * registered with, and the ops it is ready for.
 */
public final class ReadinessEvent {

    private final Object attachment;
    private final IoOps readyOps;

    public ReadinessEvent(Object attachment, IoOps readyOps) {
        this.attachment = attachment;
        this.readyOps = requireNonNull(readyOps, "readyOps");
    }

    /**
     * The attachment passed to {@link Multiplexer#register}.
     */
    public Object attachment() {
        return attachment;
    }

    public IoOps readyOps() {
        return readyOps;
    }

    public boolean isReadable() {
        return readyOps.contains(IoOps.READ);
    }

    public boolean isWritable() {
        return readyOps.contains(IoOps.WRITE);
    }

    @Override
    public String toString() {
        return "ReadinessEvent(" + attachment + ", " + readyOps + ')';
    }
}
