package datahandler.server.netty.http;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import datahandler.api.request.HelpRequest;
import datahandler.api.request.timeseries.DataRequest;
import datahandler.netty.http.DataHandlerHttpHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

/**
 * Describes the routes and the parameters of {@code /get_data}.
 */
@Sharable
public class HttpHelpRequestHandler extends SimpleChannelInboundHandler<HelpRequest> implements DataHandlerHttpHandler {

    private static final String NO_PARAMETERS = "no parameters";

    private final DataRetrievalService service;
    private final String defaultMaxLag;

    public HttpHelpRequestHandler(DataRetrievalService service, String defaultMaxLag) {
        this.service = service;
        this.defaultMaxLag = defaultMaxLag;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, HelpRequest msg) throws Exception {
        sendJsonResponse(ctx, help());
    }

    Map<String,Object> help() {
        Map<String,String> parameters = new LinkedHashMap<>();
        parameters.put("measurement", "None (individual measurement name, e.g. Throughput_Measures)");
        parameters.put("field", "None (field filter, e.g. Throughput (Mbps))");
        parameters.put("additional_clause", "None (accepted for compatibility, ignored)");
        parameters.put("chunked", "False (or True)");
        parameters.put("chunk_size", DataRequest.DEFAULT_CHUNK_SIZE + " (any integer)");
        parameters.put("match_series", "False (or True)");
        parameters.put("remove_outliers", "None (zscore or mad)");
        parameters.put("limit", "None (any integer)");
        parameters.put("offset", "None (any integer, used together with limit)");
        parameters.put("max_lag", defaultMaxLag + " (time lag for synchronisation, ms, s or m)");

        Map<String,Object> data = new LinkedHashMap<>();
        data.put("default parameters", parameters);
        data.put("datasource", StringUtils.join(service.getDatasources(), ", "));

        Map<String,Object> help = new LinkedHashMap<>();
        help.put("/get_datasources", NO_PARAMETERS);
        help.put("/get_all_experimentIds/datasource", NO_PARAMETERS);
        help.put("/get_experimentIds_for_measurement/datasource/measurement", NO_PARAMETERS);
        help.put("/get_measurements_for_experimentId/datasource/experimentId", NO_PARAMETERS);
        help.put("/get_data/datasource/experimentId1(/experimentId2)", data);
        help.put("/purge_cache", NO_PARAMETERS);
        return help;
    }
}
