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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class InternalLoggerFactoryTest {
    private static final Exception e = new Exception();
    private InternalLoggerFactory oldLoggerFactory;
    private InternalLogger mockLogger;

    @BeforeEach
    public void init() {
        oldLoggerFactory = InternalLoggerFactory.getDefaultFactory();

        final InternalLoggerFactory mockFactory = mock(InternalLoggerFactory.class);
        mockLogger = mock(InternalLogger.class);
        when(mockFactory.newInstance("mock")).thenReturn(mockLogger);
        InternalLoggerFactory.setDefaultFactory(mockFactory);
    }

    @AfterEach
    public void destroy() {
        InternalLoggerFactory.setDefaultFactory(oldLoggerFactory);
    }

    @Test
    public void shouldNotAllowNullDefaultFactory() {
        assertThrows(NullPointerException.class, () -> InternalLoggerFactory.setDefaultFactory(null));
    }

    @Test
    public void shouldPickSlf4JWhenAProviderIsBound() {
        assertSame(Slf4JLoggerFactory.INSTANCE, oldLoggerFactory);
    }

    @Test
    public void shouldGetInstance() {
        InternalLoggerFactory.setDefaultFactory(oldLoggerFactory);

        String helloWorld = "Hello, world!";

        InternalLogger one = InternalLoggerFactory.getInstance("helloWorld");
        InternalLogger two = InternalLoggerFactory.getInstance(helloWorld.getClass());

        assertEquals("helloWorld", one.name());
        assertEquals(String.class.getName(), two.name());
    }

    @Test
    public void testWarnWithException() {
        final InternalLogger logger = InternalLoggerFactory.getInstance("mock");
        logger.warn("a", e);
        verify(mockLogger).warn("a", e);
    }

    @Test
    public void testDebugWithPlaceholders() {
        final InternalLogger logger = InternalLoggerFactory.getInstance("mock");
        logger.debug("{} and {}", "a", "b");
        verify(mockLogger).debug("{} and {}", "a", "b");
    }

    @Test
    public void testJdkLoggerLevels() {
        InternalLogger logger = JdkLoggerFactory.INSTANCE.newInstance(InternalLoggerFactoryTest.class.getName());
        java.util.logging.Logger jdkLogger = java.util.logging.Logger.getLogger(logger.name());
        java.util.logging.Level oldLevel = jdkLogger.getLevel();
        try {
            jdkLogger.setLevel(java.util.logging.Level.WARNING);
            assertThat(logger.isWarnEnabled()).isTrue();
            assertThat(logger.isInfoEnabled()).isFalse();
            assertThat(logger.isEnabled(InternalLogLevel.ERROR)).isTrue();
            assertThat(logger.isEnabled(InternalLogLevel.DEBUG)).isFalse();
        } finally {
            jdkLogger.setLevel(oldLevel);
        }
    }

    @Test
    public void testGetInstanceDelegatesToDefaultFactory() {
        InternalLoggerFactory mockFactory = mock(InternalLoggerFactory.class);
        when(mockFactory.newInstance(anyString())).thenReturn(mockLogger);
        InternalLoggerFactory.setDefaultFactory(mockFactory);

        assertSame(mockLogger, InternalLoggerFactory.getInstance("any"));
        verify(mockFactory).newInstance("any");
    }
}
