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

/**
 * A special {@link ChannelHandler} which offers an easy way to initialize a {@link Channel} once it was
 * registered to its {@link EventLoop}.
 *
 * <pre>
 *
 * public class MyChannelInitializer extends {@link ChannelInitializer} {
 *     public void initChannel({@link Channel} channel) {
 *         channel.pipeline().addLast("myHandler", new MyHandler());
 *     }
 * }
 *
 * channel.pipeline().addLast(new MyChannelInitializer());
 * channel.register();
 * </pre>
 * The initializer removes itself from the {@link ChannelPipeline} whether {@link #initChannel(Channel)} succeeded or
 * not, so it sees exactly one {@code channelRegistered} event. A failure of {@link #initChannel(Channel)} is
 * rethrown to whoever fired the event.
 * <p>
 * Be aware that this class is marked as {@link #isSharable()} and so the implementation must be safe to be re-used.
 *
 * @param <C>   A sub-type of {@link Channel}
 */
public abstract class ChannelInitializer<C extends Channel> implements ChannelHandler {

    @Override
    public boolean isSharable() {
        return true;
    }

    /**
     * This method will be called once the {@link Channel} was registered. After the method returns this instance
     * will be removed from the {@link ChannelPipeline} of the {@link Channel}.
     *
     * @param ch            the {@link Channel} which was registered.
     * @throws Exception    is thrown if an error occurs. It is propagated to the caller of
     *                      {@link ChannelPipeline#fireChannelRegistered()} wrapped in a
     *                      {@link ChannelPipelineException}.
     */
    protected abstract void initChannel(C ch) throws Exception;

    @SuppressWarnings("unchecked")
    @Override
    public final void channelRegistered(ChannelHandlerContext ctx) throws Exception {
        try {
            initChannel((C) ctx.channel());
        } finally {
            if (!ctx.isRemoved()) {
                ctx.pipeline().remove(ctx.name());
            }
        }
        ctx.fireChannelRegistered();
    }
}
