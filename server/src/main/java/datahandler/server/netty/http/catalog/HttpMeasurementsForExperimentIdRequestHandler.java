package datahandler.server.netty.http.catalog;

import java.util.Collections;
import java.util.SortedSet;

import datahandler.api.request.catalog.MeasurementsForExperimentIdRequest;
import datahandler.api.response.DataHandlerException;
import datahandler.netty.http.DataHandlerHttpHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@Sharable
public class HttpMeasurementsForExperimentIdRequestHandler extends SimpleChannelInboundHandler<MeasurementsForExperimentIdRequest>
                implements DataHandlerHttpHandler {

    private final DataRetrievalService service;

    public HttpMeasurementsForExperimentIdRequestHandler(DataRetrievalService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, MeasurementsForExperimentIdRequest msg) throws Exception {
        SortedSet<String> measurements;
        try {
            measurements = service.listMeasurementsForExperimentId(msg.getDatasource(), msg.getExperimentId());
        } catch (DataHandlerException e) {
            this.sendHttpError(ctx, e);
            return;
        }
        String key = "Measurements for experimentId " + msg.getExperimentId() + " on " + msg.getDatasource();
        sendJsonResponse(ctx, Collections.singletonMap(key, measurements));
    }
}
