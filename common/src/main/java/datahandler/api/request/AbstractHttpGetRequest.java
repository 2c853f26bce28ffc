package datahandler.api.request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;

import datahandler.api.annotation.Http;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * Base for GET requests routed by {@link Http}. Route arguments are the path segments that follow the matched route.
 */
public abstract class AbstractHttpGetRequest implements HttpGetRequest {

    private FullHttpRequest httpRequest = null;

    @Override
    public void setHttpRequest(FullHttpRequest httpRequest) {
        this.httpRequest = httpRequest;
    }

    @JsonIgnore
    @Override
    public FullHttpRequest getHttpRequest() {
        return httpRequest;
    }

    protected List<String> getPathParameters(QueryStringDecoder decoder) {
        String path = decoder.path();
        String matched = null;
        for (String route : getClass().getAnnotation(Http.class).path()) {
            if ((path.equals(route) || path.startsWith(route + "/")) && (matched == null || route.length() > matched.length())) {
                matched = route;
            }
        }
        if (matched == null) {
            return Collections.emptyList();
        }
        List<String> segments = new ArrayList<>();
        for (String s : StringUtils.split(path.substring(matched.length()), '/')) {
            segments.add(s);
        }
        return segments;
    }

    protected static String getParameter(QueryStringDecoder decoder, String name) {
        List<String> values = decoder.parameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    protected static List<String> getParameters(QueryStringDecoder decoder, String name) {
        List<String> values = decoder.parameters().get(name);
        if (values == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(values);
    }

    protected static boolean getBooleanParameter(QueryStringDecoder decoder, String name) {
        String value = getParameter(decoder, name);
        return value != null && value.equalsIgnoreCase("true");
    }

    protected static Integer getIntegerParameter(QueryStringDecoder decoder, String name) {
        String value = getParameter(decoder, name);
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got " + value);
        }
    }
}
