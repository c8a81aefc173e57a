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
 * Thrown when an operation that must run on the {@link Thread} an {@link EventExecutor} is bound to is called from
 * another thread.
 */
public final class ThreadAffinityError extends EventLoopInvariantError {

    private static final long serialVersionUID = 7240581379123658417L;

    public ThreadAffinityError(String operation, Thread expected) {
        super(operation + " must be called from " + expected.getName() +
                " but was called from " + Thread.currentThread().getName());
    }
}
