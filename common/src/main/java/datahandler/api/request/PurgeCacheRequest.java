package datahandler.api.request;

import io.netty.handler.codec.http.QueryStringDecoder;
import datahandler.api.annotation.Http;

@Http(path = {"/purge_cache"})
public class PurgeCacheRequest extends AbstractHttpGetRequest {

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        return new PurgeCacheRequest();
    }
}
