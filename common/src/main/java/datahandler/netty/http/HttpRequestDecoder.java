package datahandler.netty.http;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.annotation.AnnotationResolver;
import datahandler.api.request.HttpGetRequest;
import datahandler.api.request.HttpRequest;
import datahandler.api.response.DataHandlerException;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * Turns a full HTTP request into the typed request bound to its path. Requests without a route are passed on unchanged,
 * invalid requests are passed on as a {@link DataHandlerException}.
 */
@Sharable
public class HttpRequestDecoder extends MessageToMessageDecoder<FullHttpRequest> implements DataHandlerHttpHandler {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestDecoder.class);
    private static final String LOG_RECEIVED_REQUEST = "Received HTTP request {}";
    private static final String LOG_PARSED_REQUEST = "Parsed request {}";

    @Override
    public void decode(ChannelHandlerContext ctx, FullHttpRequest msg, List<Object> out) throws Exception {

        log.trace(LOG_RECEIVED_REQUEST, msg);

        final String uri = msg.uri();
        final QueryStringDecoder decoder = new QueryStringDecoder(uri);

        if (!msg.method().equals(HttpMethod.GET)) {
            DataHandlerException e = new DataHandlerException(HttpResponseStatus.METHOD_NOT_ALLOWED.code(), "unhandled method type", "");
            e.addResponseHeader(HttpHeaderNames.ALLOW.toString(), HttpMethod.GET.name());
            log.warn("Unhandled HTTP request type {}", msg.method());
            out.add(e);
            return;
        }

        HttpGetRequest get = AnnotationResolver.getClassForHttpGet(decoder.path());
        if (get == null) {
            // no route, let the not found handler answer it
            out.add(msg.retain());
            return;
        }
        HttpRequest request;
        try {
            request = get.parseQueryParameters(decoder);
            request.setHttpRequest(msg);
            log.trace(LOG_PARSED_REQUEST, request);
            request.validate();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid request {}: {}", uri, e.getMessage());
            out.add(new DataHandlerException(HttpResponseStatus.BAD_REQUEST.code(), e.getMessage(), uri, e));
            return;
        }
        out.add(request);
    }

}
