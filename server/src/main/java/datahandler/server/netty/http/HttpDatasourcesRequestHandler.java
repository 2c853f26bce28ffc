package datahandler.server.netty.http;

import java.util.Collections;

import datahandler.api.request.DatasourcesRequest;
import datahandler.netty.http.DataHandlerHttpHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@Sharable
public class HttpDatasourcesRequestHandler extends SimpleChannelInboundHandler<DatasourcesRequest> implements DataHandlerHttpHandler {

    private final DataRetrievalService service;

    public HttpDatasourcesRequestHandler(DataRetrievalService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatasourcesRequest msg) throws Exception {
        sendJsonResponse(ctx, Collections.singletonMap("sources", service.getDatasources()));
    }
}
