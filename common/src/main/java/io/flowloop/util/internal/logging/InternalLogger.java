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
package io.flowloop.util.internal.logging;

/**
 * An <em>internal use only</em> logger used by Flowloop.
 * <strong>DO NOT</strong> use this class outside of Flowloop!
 * <p>
 * Messages may contain {@code {}} placeholders which are substituted with the given arguments. If the last argument
 * is a {@link Throwable} it is logged as the cause.
 */
public interface InternalLogger {

    /**
     * Return the name of this {@link InternalLogger} instance.
     */
    String name();

    /**
     * Is the logger instance enabled for the TRACE level?
     */
    boolean isTraceEnabled();

    void trace(String msg);

    void trace(String format, Object arg);

    void trace(String format, Object argA, Object argB);

    void trace(String format, Object... arguments);

    void trace(String msg, Throwable t);

    /**
     * Is the logger instance enabled for the DEBUG level?
     */
    boolean isDebugEnabled();

    void debug(String msg);

    void debug(String format, Object arg);

    void debug(String format, Object argA, Object argB);

    void debug(String format, Object... arguments);

    void debug(String msg, Throwable t);

    /**
     * Is the logger instance enabled for the INFO level?
     */
    boolean isInfoEnabled();

    void info(String msg);

    void info(String format, Object arg);

    void info(String format, Object argA, Object argB);

    void info(String format, Object... arguments);

    void info(String msg, Throwable t);

    /**
     * Is the logger instance enabled for the WARN level?
     */
    boolean isWarnEnabled();

    void warn(String msg);

    void warn(String format, Object arg);

    void warn(String format, Object argA, Object argB);

    void warn(String format, Object... arguments);

    void warn(String msg, Throwable t);

    /**
     * Is the logger instance enabled for the ERROR level?
     */
    boolean isErrorEnabled();

    void error(String msg);

    void error(String format, Object arg);

    void error(String format, Object argA, Object argB);

    void error(String format, Object... arguments);

    void error(String msg, Throwable t);

    /**
     * Is the logger instance enabled for the specified {@code level}?
     *
     * @return True if this Logger is enabled for the specified {@code level}, false otherwise.
     */
    boolean isEnabled(InternalLogLevel level);

    /**
     * Log a message at the specified {@code level}.
     *
     * @param level the {@link InternalLogLevel} to use
     * @param msg   the message string to be logged
     */
    void log(InternalLogLevel level, String msg);

    /**
     * Log a message with an attached cause at the specified {@code level}.
     *
     * @param level the {@link InternalLogLevel} to use
     * @param msg   the message accompanying the exception
     * @param t     the exception to log
     */
    void log(InternalLogLevel level, String msg, Throwable t);
}
