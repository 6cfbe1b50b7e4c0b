package com.tlsearch.server;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.EventExecutorGroup;

public class SearchChannelInitializer extends ChannelInitializer<SocketChannel> {
    private final SearchRequestHandler handler;
    private final EventExecutorGroup blockingGroup;
    private final int maxContentLength;

    /**
     * @param blockingGroup runs the handler, whose provider calls and builds block
     */
    public SearchChannelInitializer(SearchRequestHandler handler, EventExecutorGroup blockingGroup, int maxContentLength) {
        this.handler = handler;
        this.blockingGroup = blockingGroup;
        this.maxContentLength = maxContentLength;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(maxContentLength))
                .addLast(blockingGroup, handler);
    }
}
