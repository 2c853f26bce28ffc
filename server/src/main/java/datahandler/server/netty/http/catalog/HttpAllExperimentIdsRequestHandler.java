package datahandler.server.netty.http.catalog;

import java.util.Collections;
import java.util.SortedSet;

import datahandler.api.request.catalog.AllExperimentIdsRequest;
import datahandler.api.response.DataHandlerException;
import datahandler.netty.http.DataHandlerHttpHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@Sharable
public class HttpAllExperimentIdsRequestHandler extends SimpleChannelInboundHandler<AllExperimentIdsRequest> implements DataHandlerHttpHandler {

    private final DataRetrievalService service;

    public HttpAllExperimentIdsRequestHandler(DataRetrievalService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, AllExperimentIdsRequest msg) throws Exception {
        SortedSet<String> ids;
        try {
            ids = service.listAllExperimentIds(msg.getDatasource());
        } catch (DataHandlerException e) {
            this.sendHttpError(ctx, e);
            return;
        }
        sendJsonResponse(ctx, Collections.singletonMap("ExperimentIds on " + msg.getDatasource(), ids));
    }
}
