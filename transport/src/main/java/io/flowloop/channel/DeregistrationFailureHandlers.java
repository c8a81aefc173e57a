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
import io.flowloop.util.internal.SystemPropertyUtil;
import io.flowloop.util.internal.logging.InternalLogger;
import io.flowloop.util.internal.logging.InternalLoggerFactory;

/**
 * Expose helper methods which create different {@link DeregistrationFailureHandler}s.
 */
public final class DeregistrationFailureHandlers {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DeregistrationFailureHandlers.class);

    private static final boolean STRICT_DEREGISTRATION =
            SystemPropertyUtil.getBoolean("io.flowloop.eventLoop.strictDeregistration", false);

    private static final DeregistrationFailureHandler LOG = (channel, cause) ->
            logger.warn("Failed to deregister a closed channel: {}", channel, cause);

    private static final DeregistrationFailureHandler FAIL_FAST = (channel, cause) -> {
        throw new EventLoopInvariantError("Failed to deregister a closed channel: " + channel, cause);
    };

    static {
        if (logger.isDebugEnabled()) {
            logger.debug("-Dio.flowloop.eventLoop.strictDeregistration: {}", STRICT_DEREGISTRATION);
        }
    }

    private DeregistrationFailureHandlers() { }

    /**
     * Returns a {@link DeregistrationFailureHandler} that logs the failure at WARN level and lets the loop go on.
     */
    public static DeregistrationFailureHandler log() {
        return LOG;
    }

    /**
     * Returns a {@link DeregistrationFailureHandler} that throws an {@link EventLoopInvariantError}.
     */
    public static DeregistrationFailureHandler failFast() {
        return FAIL_FAST;
    }

    /**
     * Returns {@link #failFast()} if {@code -Dio.flowloop.eventLoop.strictDeregistration=true}, {@link #log()}
     * otherwise.
     */
    public static DeregistrationFailureHandler defaultHandler() {
        return STRICT_DEREGISTRATION ? FAIL_FAST : LOG;
    }
}
