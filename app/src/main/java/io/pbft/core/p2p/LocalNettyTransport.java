package io.pbft.core.p2p;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.local.LocalAddress;
import io.netty.channel.local.LocalChannel;
import io.netty.channel.local.LocalServerChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.pbft.core.protocol.PbftMessage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-VM Netty transport: every node listens on a {@link LocalAddress} and peers reach it through
 * a {@link LocalChannel}. Frames are length-prefixed UTF-8 JSON produced by {@link PbftMessageCodec}.
 * Delivery is best effort; a failed write is logged and reported, never retried.
 */
public final class LocalNettyTransport implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LocalNettyTransport.class.getName());
    private static final int MAX_FRAME_BYTES = 1 << 16;

    private final String networkId = UUID.randomUUID().toString();
    private final DefaultEventLoopGroup group = new DefaultEventLoopGroup();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Map<Integer, Channel> listeners = new ConcurrentHashMap<>();

    /** Start accepting messages for {@code nodeId}; each decoded message is passed to {@code inbound}. */
    public void listen(int nodeId, Consumer<PbftMessage> inbound) {
        Objects.requireNonNull(inbound, "inbound");
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(group)
                .channel(LocalServerChannel.class)
                .childHandler(new ChannelInitializer<LocalChannel>() {
                    @Override
                    protected void initChannel(LocalChannel ch) {
                        configurePipeline(ch.pipeline());
                        ch.pipeline().addLast(new InboundHandler(nodeId, inbound));
                        channels.add(ch);
                    }
                });
        try {
            Channel server = bootstrap.bind(addressOf(nodeId)).sync().channel();
            channels.add(server);
            listeners.put(nodeId, server);
            LOG.fine(() -> "Node " + nodeId + " listening on " + addressOf(nodeId));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while binding node " + nodeId, e);
        }
    }

    /**
     * Open a channel to a listening peer and wrap it as a {@link PeerHandle}.
     * {@code onFailure} runs when a write does not complete.
     */
    public PeerHandle connect(int fromId, int peerId, Consumer<PbftMessage> onFailure) {
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(LocalChannel.class)
                .handler(new ChannelInitializer<LocalChannel>() {
                    @Override
                    protected void initChannel(LocalChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                });
        Channel channel;
        try {
            channel = bootstrap.connect(addressOf(peerId)).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while connecting " + fromId + " -> " + peerId, e);
        }
        channels.add(channel);
        LOG.fine(() -> "Connected node " + fromId + " -> " + peerId);
        return message -> channel.writeAndFlush(message).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                LOG.log(Level.WARNING, "Write " + fromId + " -> " + peerId + " failed for " + message, future.cause());
                if (onFailure != null) {
                    onFailure.accept(message);
                }
            }
        });
    }

    public boolean isListening(int nodeId) {
        return listeners.containsKey(nodeId);
    }

    @Override
    public void close() {
        channels.close().awaitUninterruptibly();
        listeners.clear();
        group.shutdownGracefully().awaitUninterruptibly();
    }

    private LocalAddress addressOf(int nodeId) {
        return new LocalAddress("pbft-" + networkId + "-node-" + nodeId);
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(MAX_FRAME_BYTES, 0, 4, 0, 4));
        pipeline.addLast(new LengthFieldPrepender(4));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new JsonCodec());
    }

    static final class JsonCodec extends MessageToMessageCodec<String, PbftMessage> {
        @Override
        protected void encode(ChannelHandlerContext ctx, PbftMessage msg, List<Object> out) {
            out.add(PbftMessageCodec.encode(msg));
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) {
            out.add(PbftMessageCodec.decode(msg));
        }
    }

    private static final class InboundHandler extends SimpleChannelInboundHandler<PbftMessage> {
        private final int nodeId;
        private final Consumer<PbftMessage> inbound;

        InboundHandler(int nodeId, Consumer<PbftMessage> inbound) {
            this.nodeId = nodeId;
            this.inbound = inbound;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, PbftMessage msg) {
            inbound.accept(msg);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Channel error on node " + nodeId, cause);
            ctx.close();
        }
    }
}
