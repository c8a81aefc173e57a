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

import io.flowloop.util.internal.SystemPropertyUtil;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;

import static io.flowloop.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * WriteBufferWaterMark is used to set low water mark and high water mark for the write buffer.
 * <p>
 * If the number of bytes queued in the write buffer exceeds the
 * {@linkplain #high high water mark}, {@link Channel#isWritable()}
 * will start to return {@code false}.
 * <p>
 * If the number of bytes queued in the write buffer exceeds the
 * {@linkplain #high high water mark} and then
 * dropped down below the {@linkplain #low low water mark},
 * {@link Channel#isWritable()} will start to return
 * {@code true} again.
 */
public final class WriteBufferWaterMark {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(WriteBufferWaterMark.class);

    private static final int DEFAULT_LOW_WATER_MARK = 32 * 1024;
    private static final int DEFAULT_HIGH_WATER_MARK = 64 * 1024;

    /**
     * The water marks a channel starts with. Configured through {@code -Dio.flowloop.channel.writeBufferLowWaterMark}
     * and {@code -Dio.flowloop.channel.writeBufferHighWaterMark}.
     */
    public static final WriteBufferWaterMark DEFAULT;

    static {
        int low = SystemPropertyUtil.getInt("io.flowloop.channel.writeBufferLowWaterMark", DEFAULT_LOW_WATER_MARK);
        int high = SystemPropertyUtil.getInt("io.flowloop.channel.writeBufferHighWaterMark", DEFAULT_HIGH_WATER_MARK);
        if (low < 0 || high < low) {
            logger.warn("Invalid write buffer water marks (low: {}, high: {}) - using the defaults: ({}, {})",
                    low, high, DEFAULT_LOW_WATER_MARK, DEFAULT_HIGH_WATER_MARK);
            low = DEFAULT_LOW_WATER_MARK;
            high = DEFAULT_HIGH_WATER_MARK;
        }
        DEFAULT = new WriteBufferWaterMark(low, high);

        if (logger.isDebugEnabled()) {
            logger.debug("-Dio.flowloop.channel.writeBufferLowWaterMark: {}", low);
            logger.debug("-Dio.flowloop.channel.writeBufferHighWaterMark: {}", high);
        }
    }

    private final int low;
    private final int high;

    /**
     * Create a new instance.
     *
     * @param low low water mark for write buffer.
     * @param high high water mark for write buffer
     */
    public WriteBufferWaterMark(int low, int high) {
        checkPositiveOrZero(low, "low");
        if (high < low) {
            throw new IllegalArgumentException(
                    "write buffer's high water mark cannot be less than " +
                            " low water mark (" + low + "): " +
                            high);
        }
        this.low = low;
        this.high = high;
    }

    /**
     * Returns the low water mark for the write buffer.
     */
    public int low() {
        return low;
    }

    /**
     * Returns the high water mark for the write buffer.
     */
    public int high() {
        return high;
    }

    @Override
    public String toString() {
        return "WriteBufferWaterMark(low: " + low + ", high: " + high + ')';
    }
}
