package com.tlsearch.server;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tlsearch.api.SearchApi;
import com.tlsearch.runtime.AppConfig;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * Thin HTTP front end over {@link SearchApi}. Manual refreshes run on a dedicated single thread owned by
 * the server.
 */
public class SearchHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SearchHttpServer.class);

    private final AppConfig.ServerConfig config;
    private final SearchRequestHandler handler;
    private final ExecutorService refreshExecutor;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup blockingGroup;
    private Channel serverChannel;

    public SearchHttpServer(AppConfig.ServerConfig config, SearchApi api, ObjectMapper mapper) {
        this.config = config;
        this.refreshExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "http-refresh");
            thread.setDaemon(true);
            return thread;
        });
        this.handler = new SearchRequestHandler(api, mapper, refreshExecutor);
    }

    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(config.getBossThreads());
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());
        blockingGroup = new DefaultEventExecutorGroup(config.getWorkerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new SearchChannelInitializer(handler, blockingGroup, config.getMaxContentLength()))
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true);
        try {
            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            log.error("http.bind.failed port={}", config.getPort(), e);
            close();
            throw e;
        }
        log.info("http.listening url=http://localhost:{} endpoints=[POST /search, POST /refresh, GET /health]", port());
    }

    /**
     * The bound port, which differs from the configured one when that is 0.
     */
    public int port() {
        if (serverChannel == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void awaitClose() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close();
        }
        refreshExecutor.shutdownNow();
        shutdown(bossGroup);
        shutdown(workerGroup);
        if (blockingGroup != null && !blockingGroup.isShuttingDown()) {
            blockingGroup.shutdownGracefully();
        }
        log.info("http.stopped");
    }

    private static void shutdown(EventLoopGroup group) {
        if (group != null && !group.isShuttingDown() && !group.isShutdown()) {
            group.shutdownGracefully();
        }
    }
}
