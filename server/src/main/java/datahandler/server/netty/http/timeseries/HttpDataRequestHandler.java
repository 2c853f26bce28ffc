package datahandler.server.netty.http.timeseries;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.request.timeseries.DataRequest;
import datahandler.api.response.DataHandlerException;
import datahandler.model.TimeSeriesTable;
import datahandler.netty.http.DataHandlerHttpHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@Sharable
public class HttpDataRequestHandler extends SimpleChannelInboundHandler<DataRequest> implements DataHandlerHttpHandler {

    private static final Logger log = LoggerFactory.getLogger(HttpDataRequestHandler.class);
    private final DataRetrievalService service;

    public HttpDataRequestHandler(DataRetrievalService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DataRequest msg) throws Exception {
        Map<String,TimeSeriesTable> data;
        try {
            data = service.getData(msg);
        } catch (DataHandlerException e) {
            if (e.getCode() == 404) {
                log.trace(e.getMessage());
            } else {
                log.error(e.getMessage(), e);
            }
            this.sendHttpError(ctx, e);
            return;
        }
        sendJsonResponse(ctx, data);
    }
}
