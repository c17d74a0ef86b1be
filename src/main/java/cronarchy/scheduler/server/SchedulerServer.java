package cronarchy.scheduler.server;

import cronarchy.scheduler.config.Dependencies;
import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.hook.HookDispatcher;
import cronarchy.scheduler.hook.HookRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server hosting one scheduler instance: the job API, the health
 * check and the daemon entry point the runner triggers.
 */
public final class SchedulerServer {

    private static final Logger log = LoggerFactory.getLogger(SchedulerServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private SchedulerServer() {
    }

    public static synchronized boolean start(SchedulerConfig config) {
        return start(config, HookRegistry.fromProviders());
    }

    public static synchronized boolean start(SchedulerConfig config, HookDispatcher hooks) {
        if (running) {
            return true;
        }
        try {
            dependencies = Dependencies.create(config, hooks);
            RouterHandler router = dependencies.routerHandler();

            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(1024 * 1024));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Scheduler server for {} started on {}:{}", config.instanceId(),
                    config.serverHost(), config.serverPort());
            return true;
        } catch (Exception e) {
            // bind failures arrive as undeclared checked exceptions
            log.error("Start error: {}", e.getMessage(), e);
            release();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        release();
        log.info("Scheduler server stopped");
    }

    private static void release() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            running = false;
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /**
     * Wiring of the running server, or null when stopped.
     */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
