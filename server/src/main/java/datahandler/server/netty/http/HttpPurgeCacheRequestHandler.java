package datahandler.server.netty.http;

import java.util.Collections;

import datahandler.api.request.PurgeCacheRequest;
import datahandler.netty.http.DataHandlerHttpHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@Sharable
public class HttpPurgeCacheRequestHandler extends SimpleChannelInboundHandler<PurgeCacheRequest> implements DataHandlerHttpHandler {

    private final DataRetrievalService service;

    public HttpPurgeCacheRequestHandler(DataRetrievalService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, PurgeCacheRequest msg) throws Exception {
        service.purgeCache();
        sendJsonResponse(ctx, Collections.singletonMap("message", "Cache purged"));
    }
}
