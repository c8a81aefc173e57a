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

import java.nio.channels.SelectionKey;

/**
 * The set of readiness kinds a {@link Channel} is interested in, expressed with the same bits as
 * {@link SelectionKey} so it can be handed to a {@link java.nio.channels.Selector} as is.
 * <p>
 * Instances are immutable; {@link #with(IoOps)} and {@link #without(IoOps)} return new sets.
 */
public final class IoOps {

    public static final IoOps NONE = new IoOps(0);

    public static final IoOps READ = new IoOps(SelectionKey.OP_READ);

    public static final IoOps WRITE = new IoOps(SelectionKey.OP_WRITE);

    public static final IoOps CONNECT = new IoOps(SelectionKey.OP_CONNECT);

    public static final IoOps ACCEPT = new IoOps(SelectionKey.OP_ACCEPT);

    public static final IoOps READ_AND_WRITE = READ.with(WRITE);

    private static final int ALL = SelectionKey.OP_READ | SelectionKey.OP_WRITE |
            SelectionKey.OP_CONNECT | SelectionKey.OP_ACCEPT;

    private final int value;

    private IoOps(int value) {
        this.value = value;
    }

    /**
     * Returns the {@link IoOps} for the given {@link SelectionKey} ops.
     */
    public static IoOps valueOf(int value) {
        if ((value & ~ALL) != 0) {
            throw new IllegalArgumentException("unknown ops: " + value);
        }
        switch (value) {
            case 0:
                return NONE;
            case SelectionKey.OP_READ:
                return READ;
            case SelectionKey.OP_WRITE:
                return WRITE;
            case SelectionKey.OP_CONNECT:
                return CONNECT;
            case SelectionKey.OP_ACCEPT:
                return ACCEPT;
            default:
                return new IoOps(value);
        }
    }

    /**
     * Returns {@code true} if all ops of the given set are part of this set.
     */
    public boolean contains(IoOps ops) {
        return (value & ops.value) == ops.value;
    }

    /**
     * Returns a new set which contains the ops of this set and the given set.
     */
    public IoOps with(IoOps ops) {
        return valueOf(value | ops.value);
    }

    /**
     * Returns a new set which contains the ops of this set minus the ops of the given set.
     */
    public IoOps without(IoOps ops) {
        return valueOf(value & ~ops.value);
    }

    /**
     * Returns the {@link SelectionKey} ops.
     */
    public int value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof IoOps && ((IoOps) o).value == value;
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public String toString() {
        if (value == 0) {
            return "IoOps(NONE)";
        }
        StringBuilder sb = new StringBuilder("IoOps(");
        if (contains(READ)) {
            sb.append("READ|");
        }
        if (contains(WRITE)) {
            sb.append("WRITE|");
        }
        if (contains(CONNECT)) {
            sb.append("CONNECT|");
        }
        if (contains(ACCEPT)) {
            sb.append("ACCEPT|");
        }
        sb.setCharAt(sb.length() - 1, ')');
        return sb.toString();
    }
}
