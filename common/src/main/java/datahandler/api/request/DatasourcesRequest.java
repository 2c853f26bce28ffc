package datahandler.api.request;

import io.netty.handler.codec.http.QueryStringDecoder;
import datahandler.api.annotation.Http;

@Http(path = {"/get_datasources"})
public class DatasourcesRequest extends AbstractHttpGetRequest {

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        return new DatasourcesRequest();
    }
}
