package lark.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lark.core.common.NamedThreadFactory;
import lark.core.storage.InMemoryStore;
import lark.core.storage.KeyValueStore;
import lark.server.config.Options;
import lark.server.resp.codec.RespDecoder;
import lark.server.resp.codec.RespEncoder;
import lark.server.resp.command.CommandRegistry;
import lark.server.resp.config.ServerConfig;
import lark.server.resp.handler.ConnectionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Server implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    private final ServerConfig config;
    private final KeyValueStore store;
    private final CommandRegistry registry;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public Server() {
        this(Options.defaults.server);
    }

    public Server(ServerConfig config) {
        this(config, new InMemoryStore(), CommandRegistry.defaults());
    }

    public Server(ServerConfig config, KeyValueStore store, CommandRegistry registry) {
        this.config = config;
        this.store = store;
        this.registry = registry;
    }

    /**
     * Binds the listener and returns its channel without waiting for it to close.
     */
    public synchronized Channel bind() throws InterruptedException {
        if (bossGroup != null) {
            throw new IllegalStateException("Server is already bound");
        }
        bossGroup = new NioEventLoopGroup(1, new NamedThreadFactory("lark-boss"));
        workerGroup = new NioEventLoopGroup(config.effectiveWorkerThreads(), new NamedThreadFactory("lark-worker"));

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ServerInitializer(store, registry, config.maxFrameBytes))
                .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true);

        try {
            Channel channel = bootstrap.bind(config.host, config.port).sync().channel();
            logger.info("Listening at {}", channel.localAddress());
            return channel;
        } catch (InterruptedException | RuntimeException e) {
            close();
            throw e;
        }
    }

    /**
     * Binds the listener and blocks until it is closed.
     */
    public void start() throws InterruptedException {
        Channel channel = bind();
        try {
            // Wait until the server socket is closed.
            channel.closeFuture().sync();
        } finally {
            close();
        }
    }

    @Override
    public synchronized void close() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            bossGroup = null;
            workerGroup = null;
            logger.info("Server stopped");
        }
    }

    static class ServerInitializer extends ChannelInitializer<SocketChannel> {
        private final KeyValueStore store;
        private final CommandRegistry registry;
        private final int maxFrameBytes;

        ServerInitializer(KeyValueStore store, CommandRegistry registry, int maxFrameBytes) {
            this.store = store;
            this.registry = registry;
            this.maxFrameBytes = maxFrameBytes;
        }

        @Override
        protected void initChannel(SocketChannel ch) {
            // Inbound
            ch.pipeline().addLast("decoder", new RespDecoder(maxFrameBytes));

            // Outbound
            ch.pipeline().addLast("encoder", new RespEncoder());
            ch.pipeline().addLast("command", new ConnectionHandler(store, registry));
        }
    }

    public static void main(String[] args) throws InterruptedException {
        Server server = new Server();
        server.start();
    }
}
