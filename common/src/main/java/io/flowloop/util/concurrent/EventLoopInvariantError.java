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
package io.flowloop.util.concurrent;

/**
 * Thrown when an invariant the event loop relies on does not hold anymore: a readiness event whose attachment is not
 * a channel, a channel whose registration state contradicts its open state, or a call from the wrong thread.
 * <p>
 * This is an {@link Error} on purpose. The state it guards is only safe because nothing else touches it, so there
 * is nothing sensible to recover to and it must not be caught.
 */
public class EventLoopInvariantError extends Error {

    private static final long serialVersionUID = -4613294011872683460L;

    public EventLoopInvariantError(String message) {
        super(message);
    }

    public EventLoopInvariantError(String message, Throwable cause) {
        super(message, cause);
    }
}
