package datahandler.server.netty.http.catalog;

import java.util.Collections;
import java.util.SortedSet;

import datahandler.api.request.catalog.ExperimentIdsForMeasurementRequest;
import datahandler.api.response.DataHandlerException;
import datahandler.netty.http.DataHandlerHttpHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@Sharable
public class HttpExperimentIdsForMeasurementRequestHandler extends SimpleChannelInboundHandler<ExperimentIdsForMeasurementRequest>
                implements DataHandlerHttpHandler {

    private final DataRetrievalService service;

    public HttpExperimentIdsForMeasurementRequestHandler(DataRetrievalService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ExperimentIdsForMeasurementRequest msg) throws Exception {
        SortedSet<String> ids;
        try {
            ids = service.listExperimentIdsForMeasurement(msg.getDatasource(), msg.getMeasurement());
        } catch (DataHandlerException e) {
            this.sendHttpError(ctx, e);
            return;
        }
        String key = "ExperimentIds for measurement " + msg.getMeasurement() + " on " + msg.getDatasource();
        sendJsonResponse(ctx, Collections.singletonMap(key, ids));
    }
}
