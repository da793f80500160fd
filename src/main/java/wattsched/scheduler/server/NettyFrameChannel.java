package wattsched.scheduler.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.exception.ProtocolException;
import wattsched.scheduler.protocol.FrameChannel;

import java.net.InetSocketAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Listens for the simulation backend and exchanges 4-byte length-prefixed frames with it.
 *
 * Only one backend connection is served; further connections are closed on accept.
 * Netty's event loop only queues inbound frames, the scheduler thread consumes them
 * through {@link #readFrame()}.
 */
public final class NettyFrameChannel implements FrameChannel {

    private static final Logger log = LoggerFactory.getLogger(NettyFrameChannel.class);

    /** Queued when the backend connection goes away */
    private static final Object DISCONNECTED = new Object();

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final AtomicReference<Channel> backend = new AtomicReference<>();

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Channel serverChannel;
    private volatile boolean closed = false;

    private NettyFrameChannel(String host, int port, int maxFrameBytes) {
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);

        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new LengthFieldBasedFrameDecoder(maxFrameBytes, 0, 4, 0, 4));
                            p.addLast(new LengthFieldPrepender(4));
                            p.addLast(new BackendHandler());
                        }
                    });

            this.serverChannel = b.bind(host, port).syncUninterruptibly().channel();
        } catch (RuntimeException e) {
            workerGroup.shutdownGracefully();
            bossGroup.shutdownGracefully();
            throw e;
        }
        log.info("Waiting for backend on {}", serverChannel.localAddress());
    }

    /**
     * Bind the listening socket.
     *
     * @param host          interface to bind
     * @param port          port, 0 for an ephemeral one (see {@link #port()})
     * @param maxFrameBytes largest accepted frame
     */
    public static NettyFrameChannel bind(String host, int port, int maxFrameBytes) {
        return new NettyFrameChannel(host, port, maxFrameBytes);
    }

    /** Actual bound port */
    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isConnected() {
        Channel ch = backend.get();
        return ch != null && ch.isActive();
    }

    @Override
    public byte[] readFrame() {
        Object next;
        try {
            next = inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolException("interrupted while waiting for the backend", e);
        }
        if (next == DISCONNECTED) {
            inbound.add(DISCONNECTED); // later reads fail the same way
            throw new ProtocolException("backend disconnected");
        }
        return (byte[]) next;
    }

    @Override
    public void writeFrame(byte[] frame) {
        Channel ch = backend.get();
        if (ch == null || !ch.isActive()) {
            throw new ProtocolException("no backend connection to write to");
        }
        ChannelFuture f = ch.writeAndFlush(Unpooled.wrappedBuffer(frame)).syncUninterruptibly();
        if (!f.isSuccess()) {
            throw new ProtocolException("write to backend failed", f.cause());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            Channel ch = backend.get();
            if (ch != null) {
                ch.close().syncUninterruptibly();
            }
            serverChannel.close().syncUninterruptibly();
        } finally {
            workerGroup.shutdownGracefully();
            bossGroup.shutdownGracefully();
            log.info("Backend channel closed");
        }
    }

    private final class BackendHandler extends SimpleChannelInboundHandler<ByteBuf> {

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            if (!backend.compareAndSet(null, ctx.channel())) {
                log.warn("Refusing second backend connection from {}", ctx.channel().remoteAddress());
                ctx.close();
                return;
            }
            log.info("Backend connected from {}", ctx.channel().remoteAddress());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
            inbound.add(ByteBufUtil.getBytes(msg));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (backend.get() == ctx.channel()) {
                log.info("Backend disconnected");
                inbound.add(DISCONNECTED);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Backend channel error", cause);
            ctx.close();
        }
    }
}
