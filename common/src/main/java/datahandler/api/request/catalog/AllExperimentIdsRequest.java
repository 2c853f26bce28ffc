package datahandler.api.request.catalog;

import java.util.List;

import org.apache.commons.lang3.builder.ToStringBuilder;

import datahandler.api.annotation.Http;
import datahandler.api.request.DatasourceRequest;
import datahandler.api.request.HttpGetRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

@Http(path = "/get_all_experimentIds")
public class AllExperimentIdsRequest extends DatasourceRequest {

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        AllExperimentIdsRequest request = new AllExperimentIdsRequest();
        List<String> segments = getPathParameters(decoder);
        if (!segments.isEmpty()) {
            request.setDatasource(segments.get(0));
        }
        return request;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("datasource", getDatasource());
        return tsb.toString();
    }
}
