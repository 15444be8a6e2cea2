package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.muma.mini.kv.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;
    private final RedisServerContext context;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MiniKvServer(MiniKvConfig config) {
        this.config = config;
        this.context = new RedisServerContext(config);
    }

    public RedisServerContext getContext() {
        return context;
    }

    /**
     * 绑定端口并开始接受连接，立即返回
     *
     * @return 实际监听的端口 (配置 0 时由系统分配)
     */
    public int start() throws InterruptedException {
        context.init();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            // 解码器有状态，每个连接一份
                            ch.pipeline()
                                    .addLast(new RespDecoder(config.getMaxBulkLength(), RespDecoder.DEFAULT_MAX_MULTIBULK_LENGTH))
                                    .addLast(new RespEncoder())
                                    .addLast(new RedisCommandHandler(context.getDispatcher(), context.getConnectedClients()));
                        }
                    });

            serverChannel = bootstrap.bind(config.getBind(), config.getPort()).sync().channel();
        } catch (Exception e) {
            log.error("Failed to start server on {}:{}", config.getBind(), config.getPort(), e);
            stop();
            throw e;
        }

        int boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Mini-KV started successfully on {}:{}", config.getBind(), boundPort);
        return boundPort;
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        context.shutdown();
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. 初始化配置并解析参数
        MiniKvConfig config = MiniKvConfig.getInstance();
        config.load(args);

        MiniKvServer server = new MiniKvServer(config);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "mini-kv-shutdown"));
        server.awaitTermination();
    }
}
