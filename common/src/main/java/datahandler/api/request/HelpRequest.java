package datahandler.api.request;

import io.netty.handler.codec.http.QueryStringDecoder;
import datahandler.api.annotation.Http;

@Http(path = {"/help", "/api", "/API"})
public class HelpRequest extends AbstractHttpGetRequest {

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        return new HelpRequest();
    }
}
