package datahandler.netty.http;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import datahandler.api.request.AboutRequest;
import datahandler.api.request.PurgeCacheRequest;
import datahandler.api.request.catalog.MeasurementsForExperimentIdRequest;
import datahandler.api.request.timeseries.DataRequest;
import datahandler.api.response.DataHandlerException;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;

public class HttpRequestDecoderTest {

    private HttpRequestDecoder decoder = null;
    private List<Object> results = new ArrayList<>();

    @Before
    public void setup() {
        decoder = new HttpRequestDecoder();
        results.clear();
    }

    @Test
    public void testAbout() throws Exception {
        decoder.decode(null, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/"), results);
        Assert.assertEquals(1, results.size());
        Assert.assertEquals(AboutRequest.class, results.iterator().next().getClass());
    }

    @Test
    public void testPurgeCache() throws Exception {
        decoder.decode(null, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/purge_cache"), results);
        Assert.assertEquals(1, results.size());
        Assert.assertEquals(PurgeCacheRequest.class, results.iterator().next().getClass());
    }

    @Test
    public void testMeasurementsForExperiment() throws Exception {
        decoder.decode(null, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/get_measurements_for_experimentId/uma/42"),
                        results);
        Assert.assertEquals(1, results.size());
        MeasurementsForExperimentIdRequest request = (MeasurementsForExperimentIdRequest) results.iterator().next();
        Assert.assertEquals("uma", request.getDatasource());
        Assert.assertEquals("42", request.getExperimentId());
    }

    @Test
    public void testDataRequestKeepsHttpRequest() throws Exception {
        FullHttpRequest msg = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/get_data/uma/42?measurement=Throughput_Measures");
        decoder.decode(null, msg, results);
        Assert.assertEquals(1, results.size());
        DataRequest request = (DataRequest) results.iterator().next();
        Assert.assertSame(msg, request.getHttpRequest());
        Assert.assertEquals("Throughput_Measures", request.getMeasurements().get(0));
    }

    @Test
    public void testInvalidRequestIsBadRequest() throws Exception {
        decoder.decode(null, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/get_data/uma/42?remove_outliers=bogus"), results);
        Assert.assertEquals(1, results.size());
        DataHandlerException e = (DataHandlerException) results.iterator().next();
        Assert.assertEquals(400, e.getCode());
    }

    @Test
    public void testMissingDatasourceIsBadRequest() throws Exception {
        decoder.decode(null, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/get_all_experimentIds"), results);
        Assert.assertEquals(1, results.size());
        Assert.assertEquals(400, ((DataHandlerException) results.iterator().next()).getCode());
    }

    @Test
    public void testUnknownPathPassesThrough() throws Exception {
        FullHttpRequest msg = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/nothing/here");
        decoder.decode(null, msg, results);
        Assert.assertEquals(1, results.size());
        Assert.assertSame(msg, results.iterator().next());
        Assert.assertEquals(2, msg.refCnt());
    }

    @Test
    public void testPostNotAllowed() throws Exception {
        decoder.decode(null, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/get_datasources"), results);
        Assert.assertEquals(1, results.size());
        DataHandlerException e = (DataHandlerException) results.iterator().next();
        Assert.assertEquals(405, e.getCode());
        Assert.assertEquals("GET", e.getResponseHeaders().get("allow"));
    }
}
