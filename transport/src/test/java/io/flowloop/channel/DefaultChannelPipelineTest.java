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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.flowloop.util.concurrent.EventLoopInvariantError;
import io.flowloop.util.concurrent.Future;
import io.flowloop.util.concurrent.ThreadAffinityError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;

import org.assertj.core.api.InstanceOfAssertFactories;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DefaultChannelPipelineTest {

    private DefaultEventLoop loop;
    private TestChannel channel;
    private ChannelPipeline pipeline;

    private ListAppender<ILoggingEvent> appender;
    private Logger pipelineLogger;

    @BeforeEach
    public void setUp() throws IOException {
        loop = new DefaultEventLoop(new ScriptedMultiplexer());
        channel = new TestChannel("c", loop);
        pipeline = channel.pipeline();

        pipelineLogger = (Logger) LoggerFactory.getLogger(DefaultChannelPipeline.class);
        appender = new ListAppender<>();
        appender.start();
        pipelineLogger.addAppender(appender);
    }

    @AfterEach
    public void tearDown() {
        pipelineLogger.detachAppender(appender);
        appender.stop();
        channel.close();
        loop.close();
    }

    @Test
    public void testAddAndRemove() {
        ChannelHandler a = new ChannelHandler() { };
        ChannelHandler b = new ChannelHandler() { };
        ChannelHandler c = new ChannelHandler() { };

        pipeline.addLast("b", b).addFirst("a", a).addLast("c", c);
        assertEquals(List.of("a", "b", "c"), pipeline.names());
        assertSame(b, pipeline.get("b"));
        assertSame(a, pipeline.context(a).handler());
        assertEquals("c", pipeline.context("c").name());

        ChannelHandlerContext ctxB = pipeline.context(b);
        assertSame(b, pipeline.remove("b"));
        assertTrue(ctxB.isRemoved());
        pipeline.remove(a);

        assertEquals(List.of("c"), pipeline.names());
        assertNull(pipeline.get("a"));
        assertNull(pipeline.context(b));
    }

    @Test
    public void testGeneratedNames() {
        pipeline.addLast(new RecordingHandler());
        pipeline.addLast(new RecordingHandler());

        assertEquals(List.of("DefaultChannelPipelineTest$RecordingHandler#0",
                "DefaultChannelPipelineTest$RecordingHandler#1"), pipeline.names());
    }

    @Test
    public void testDuplicateNameRejected() {
        pipeline.addLast("x", new ChannelHandler() { });
        assertThrows(IllegalArgumentException.class, () -> pipeline.addLast("x", new ChannelHandler() { }));
        assertEquals(List.of("x"), pipeline.names());
    }

    @Test
    public void testNonSharableHandlerAddedTwice() {
        ChannelHandler handler = new ChannelHandler() { };
        pipeline.addLast(handler);
        assertThrows(ChannelPipelineException.class, () -> pipeline.addLast(handler));
    }

    @Test
    public void testSharableHandlerAddedTwice() {
        ChannelHandler handler = new ChannelHandler() {
            @Override
            public boolean isSharable() {
                return true;
            }
        };
        pipeline.addLast("one", handler).addLast("two", handler);
        assertEquals(List.of("one", "two"), pipeline.names());
    }

    @Test
    public void testRemoveMissingHandler() {
        assertThrows(NoSuchElementException.class, () -> pipeline.remove("missing"));
        assertThrows(NoSuchElementException.class, () -> pipeline.remove(new ChannelHandler() { }));
    }

    @Test
    public void testHandlerAddedAndRemovedCallbacks() {
        RecordingHandler handler = new RecordingHandler();
        pipeline.addLast("h", handler);
        pipeline.remove("h");

        assertEquals(List.of("added", "removed"), handler.events);
    }

    @Test
    public void testFailingHandlerAddedIsRemoved() {
        RecordingHandler catcher = new RecordingHandler();
        pipeline.addLast("catcher", catcher);
        pipeline.addFirst("bad", new ChannelHandler() {
            @Override
            public void handlerAdded(ChannelHandlerContext ctx) {
                throw new IllegalStateException("bad");
            }
        });

        assertEquals(List.of("catcher"), pipeline.names());
        assertThat(catcher.causes).singleElement(InstanceOfAssertFactories.THROWABLE)
                .isInstanceOf(ChannelPipelineException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testInboundEventsFlowInOrder() {
        List<String> order = new ArrayList<>();
        pipeline.addLast("first", new ChannelHandler() {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) {
                order.add("first:" + msg);
                ctx.fireChannelRead(msg + "!");
            }
        });
        pipeline.addLast("second", new ChannelHandler() {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) {
                order.add("second:" + msg);
            }

            @Override
            public void channelReadComplete(ChannelHandlerContext ctx) {
                order.add("complete");
            }
        });

        pipeline.fireChannelRead("m").fireChannelReadComplete();
        assertEquals(List.of("first:m", "second:m!", "complete"), order);
    }

    @Test
    public void testInboundExceptionRoutedToExceptionCaught() {
        RecordingHandler catcher = new RecordingHandler();
        IllegalStateException cause = new IllegalStateException("read failed");
        pipeline.addLast("thrower", new ChannelHandler() {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) {
                throw cause;
            }
        });
        pipeline.addLast("catcher", catcher);

        pipeline.fireChannelRead("m");

        assertThat(catcher.causes).containsExactly(cause);
        assertThat(catcher.messages).isEmpty();
    }

    @Test
    public void testUnhandledExceptionLoggedAtTail() {
        pipeline.fireChannelExceptionCaught(new IllegalStateException("nobody cares"));

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getThrowableProxy().getMessage()).isEqualTo("nobody cares");
        });
    }

    @Test
    public void testChannelRegisteredFailureIsRethrown() {
        IllegalStateException cause = new IllegalStateException("init failed");
        pipeline.addLast(new ChannelHandler() {
            @Override
            public void channelRegistered(ChannelHandlerContext ctx) {
                throw cause;
            }
        });

        ChannelPipelineException e = assertThrows(ChannelPipelineException.class, pipeline::fireChannelRegistered);
        assertSame(cause, e.getCause());
    }

    @Test
    public void testChannelRegisteredReachesAllHandlers() {
        RecordingHandler first = new RecordingHandler();
        RecordingHandler second = new RecordingHandler();
        pipeline.addLast(first).addLast(second);

        pipeline.fireChannelRegistered();

        assertThat(first.events).contains("registered");
        assertThat(second.events).contains("registered");
    }

    @Test
    public void testOutboundOperationsReachTransport() {
        List<String> order = new ArrayList<>();
        pipeline.addLast("outer", new ChannelHandler() {
            @Override
            public Future<Void> write(ChannelHandlerContext ctx, Object msg) {
                order.add("outer");
                return ctx.write(msg);
            }
        });
        pipeline.addLast("inner", new ChannelHandler() {
            @Override
            public Future<Void> write(ChannelHandlerContext ctx, Object msg) {
                order.add("inner");
                return ctx.write("<" + msg + ">");
            }
        });

        Future<Void> future = pipeline.write("m");
        pipeline.flush().read();

        assertEquals(List.of("inner", "outer"), order);
        assertTrue(future.isSuccess());
        assertEquals(List.of("<m>"), channel.written);
        assertEquals(1, channel.transportFlushes);
        assertEquals(1, channel.transportReads);
    }

    @Test
    public void testOutboundHandlerFailure() {
        RecordingHandler catcher = new RecordingHandler();
        IllegalStateException cause = new IllegalStateException("write failed");
        pipeline.addLast("catcher", catcher);
        pipeline.addLast("thrower", new ChannelHandler() {
            @Override
            public Future<Void> write(ChannelHandlerContext ctx, Object msg) {
                throw cause;
            }
        });

        Future<Void> future = pipeline.write("m");

        assertTrue(future.isFailed());
        assertSame(cause, future.cause().getCause());
        assertThat(catcher.causes).containsExactly(cause);
        assertThat(channel.written).isEmpty();
    }

    @Test
    public void testRemovedContextStillForwards() {
        List<String> order = new ArrayList<>();
        pipeline.addLast("self-removing", new ChannelHandler() {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) {
                ctx.pipeline().remove(this);
                ctx.fireChannelRead(msg);
            }
        });
        pipeline.addLast("sink", new ChannelHandler() {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) {
                order.add("sink:" + msg);
            }
        });

        pipeline.fireChannelRead("m");
        pipeline.fireChannelRead("n");

        assertEquals(List.of("sink:m", "sink:n"), order);
        assertEquals(List.of("sink"), pipeline.names());
    }

    @Test
    public void testOffLoopAddIsDeferredToLoop() throws Exception {
        RecordingHandler handler = new RecordingHandler();
        Thread other = new Thread(() -> {
            pipeline.addLast("h", handler);
            loop.submitExternal(loop::close);
        });
        other.start();
        other.join();

        assertEquals(List.of("h"), pipeline.names());
        assertFalse(handler.events.contains("added"));

        loop.run();
        assertThat(handler.events).containsExactly("added");
    }

    @Test
    public void testWrongThreadCallFromInboundHandlerIsNotSwallowed() throws Exception {
        DefaultEventLoop foreignLoop = newLoopOnOtherThread();
        RecordingHandler catcher = new RecordingHandler();
        pipeline.addLast("foreign", new ChannelHandler() {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) {
                foreignLoop.execute(() -> { });
            }
        });
        pipeline.addLast("catcher", catcher);

        assertThrows(ThreadAffinityError.class, () -> pipeline.fireChannelRead("m"));
        assertThat(catcher.causes).isEmpty();
        assertThat(appender.list).isEmpty();
    }

    @Test
    public void testWrongThreadCallFromOutboundHandlerIsNotSwallowed() throws Exception {
        DefaultEventLoop foreignLoop = newLoopOnOtherThread();
        pipeline.addLast("foreign", new ChannelHandler() {
            @Override
            public Future<Void> write(ChannelHandlerContext ctx, Object msg) {
                foreignLoop.execute(() -> { });
                return ctx.write(msg);
            }

            @Override
            public void flush(ChannelHandlerContext ctx) {
                foreignLoop.execute(() -> { });
            }
        });

        assertThrows(ThreadAffinityError.class, () -> pipeline.write("m"));
        assertThrows(ThreadAffinityError.class, pipeline::flush);
        assertThat(channel.written).isEmpty();
    }

    @Test
    public void testInvariantErrorFromChannelRegisteredIsNotWrapped() {
        EventLoopInvariantError error = new EventLoopInvariantError("broken");
        pipeline.addLast(new ChannelHandler() {
            @Override
            public void channelRegistered(ChannelHandlerContext ctx) {
                throw error;
            }
        });

        EventLoopInvariantError thrown = assertThrows(EventLoopInvariantError.class, pipeline::fireChannelRegistered);
        assertSame(error, thrown);
    }

    private static DefaultEventLoop newLoopOnOtherThread() throws InterruptedException {
        AtomicReference<DefaultEventLoop> ref = new AtomicReference<>();
        Thread owner = new Thread(() -> ref.set(new DefaultEventLoop(new ScriptedMultiplexer())), "foreign-loop");
        owner.start();
        owner.join();
        return ref.get();
    }

    static final class RecordingHandler implements ChannelHandler {
        final List<String> events = new ArrayList<>();
        final List<Object> messages = new ArrayList<>();
        final List<Throwable> causes = new ArrayList<>();

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            events.add("added");
        }

        @Override
        public void handlerRemoved(ChannelHandlerContext ctx) {
            events.add("removed");
        }

        @Override
        public void channelRegistered(ChannelHandlerContext ctx) {
            events.add("registered");
            ctx.fireChannelRegistered();
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            messages.add(msg);
        }

        @Override
        public void channelExceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            causes.add(cause);
        }
    }
}
