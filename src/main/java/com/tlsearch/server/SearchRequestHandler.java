package com.tlsearch.server;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tlsearch.api.QueryException;
import com.tlsearch.api.SearchApi;
import com.tlsearch.build.BuildException;
import com.tlsearch.refresh.RefreshRejectedException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * Maps {@code POST /search}, {@code POST /refresh} and {@code GET /health} onto {@link SearchApi}.
 * Blocking calls must not run on an I/O thread; see {@link SearchChannelInitializer}.
 * <p>
 * A refresh runs on {@code refreshExecutor}, never on the connection's executor, so searches on
 * connections pinned to that executor keep being answered while a build is in flight.
 */
@ChannelHandler.Sharable
public class SearchRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(SearchRequestHandler.class);

    private final SearchApi api;
    private final ObjectMapper mapper;
    private final Executor refreshExecutor;

    public SearchRequestHandler(SearchApi api, ObjectMapper mapper, Executor refreshExecutor) {
        this.api = api;
        this.mapper = mapper;
        this.refreshExecutor = refreshExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        HttpMethod method = request.method();
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if ("/refresh".equals(path) && HttpMethod.POST.equals(method)) {
            refreshAsync(ctx, keepAlive);
            return;
        }
        FullHttpResponse response;
        if (HttpMethod.OPTIONS.equals(method)) {
            response = respond(HttpResponseStatus.NO_CONTENT, null);
        } else if ("/search".equals(path)) {
            response = HttpMethod.POST.equals(method) ? search(request) : methodNotAllowed();
        } else if ("/refresh".equals(path)) {
            response = methodNotAllowed();
        } else if ("/health".equals(path)) {
            response = HttpMethod.GET.equals(method) ? respond(HttpResponseStatus.OK, api.health()) : methodNotAllowed();
        } else {
            response = error(HttpResponseStatus.NOT_FOUND, "Not found");
        }
        write(ctx, keepAlive, response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("http.channel.error remote={}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    private FullHttpResponse search(FullHttpRequest request) {
        String query;
        try {
            query = readQuery(request.content());
        } catch (IOException e) {
            log.debug("http.search.bad-body reason={}", e.getMessage());
            return error(HttpResponseStatus.BAD_REQUEST, "Invalid JSON body");
        }
        try {
            return respond(HttpResponseStatus.OK, api.search(query));
        } catch (QueryException e) {
            return error(statusFor(e.kind()), e.getMessage());
        }
    }

    private void refreshAsync(ChannelHandlerContext ctx, boolean keepAlive) {
        try {
            refreshExecutor.execute(() -> {
                FullHttpResponse response = refresh();
                if (ctx.executor().inEventLoop()) {
                    write(ctx, keepAlive, response);
                } else {
                    ctx.executor().execute(() -> write(ctx, keepAlive, response));
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("http.refresh.rejected reason=executor-unavailable");
            write(ctx, keepAlive, error(HttpResponseStatus.SERVICE_UNAVAILABLE, "Refresh unavailable"));
        }
    }

    private FullHttpResponse refresh() {
        try {
            return respond(HttpResponseStatus.OK, api.refresh());
        } catch (RefreshRejectedException e) {
            return error(HttpResponseStatus.CONFLICT, "Refresh already in progress");
        } catch (BuildException e) {
            log.error("http.refresh.failed reason={}", e.getMessage(), e);
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Refresh failed");
        } catch (RuntimeException e) {
            log.error("http.refresh.failed reason={}", e.getMessage(), e);
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Refresh failed");
        }
    }

    private String readQuery(ByteBuf content) throws IOException {
        if (!content.isReadable()) {
            return null;
        }
        JsonNode body = mapper.readTree(content.toString(StandardCharsets.UTF_8));
        JsonNode query = body == null ? null : body.get("query");
        return query == null || !query.isTextual() ? null : query.asText();
    }

    static HttpResponseStatus statusFor(QueryException.Kind kind) {
        return switch (kind) {
            case BAD_REQUEST -> HttpResponseStatus.BAD_REQUEST;
            case UNAVAILABLE -> HttpResponseStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpResponseStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private FullHttpResponse methodNotAllowed() {
        return error(HttpResponseStatus.METHOD_NOT_ALLOWED, "Method not allowed");
    }

    private FullHttpResponse error(HttpResponseStatus status, String message) {
        return respond(status, Map.of("error", message));
    }

    private FullHttpResponse respond(HttpResponseStatus status, Object body) {
        ByteBuf content = Unpooled.EMPTY_BUFFER;
        if (body != null) {
            try {
                content = Unpooled.wrappedBuffer(mapper.writeValueAsBytes(body));
            } catch (IOException e) {
                log.error("http.response.serialize.failed type={}", body.getClass().getSimpleName(), e);
                status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            }
        }
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        return response;
    }

    private void write(ChannelHandlerContext ctx, boolean keepAlive, FullHttpResponse response) {
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
