package datahandler.server.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import datahandler.api.response.DataHandlerException;
import datahandler.server.store.influx.FakeFluxClient;
import datahandler.server.store.influx.InfluxDatasource;

public class DatasourceRegistryTest {

    private static InfluxDatasource datasource(String name, FakeFluxClient client) {
        return new InfluxDatasource(new ConnectionDetails(name, "http://influx:8086", "o", name, "t"), client, Duration.ofDays(30), Duration.ofDays(90));
    }

    @Test
    public void testAvailability() throws Exception {
        FakeFluxClient client = new FakeFluxClient(flux -> new ArrayList<>());
        DatasourceRegistry registry = new DatasourceRegistry(Arrays.asList(datasource("uma", client), datasource("down", null)));
        Assert.assertEquals(Arrays.asList("down", "uma"), registry.getNames());
        Assert.assertEquals("uma", registry.getAvailable("uma").getName());
        try {
            registry.getAvailable("down");
            Assert.fail("expected not found");
        } catch (DataHandlerException e) {
            Assert.assertEquals(404, e.getCode());
            Assert.assertEquals("Data source down is not available.", e.getMessage());
        }
        try {
            registry.getAvailable("unknown");
            Assert.fail("expected not found");
        } catch (DataHandlerException e) {
            Assert.assertEquals(404, e.getCode());
        }
        registry.shutdown();
        Assert.assertTrue(client.isClosed());
    }

    @Test
    public void testDuplicateKeepsFirst() throws Exception {
        FakeFluxClient first = new FakeFluxClient(flux -> new ArrayList<>());
        FakeFluxClient second = new FakeFluxClient(flux -> new ArrayList<>());
        DatasourceRegistry registry = new DatasourceRegistry(Arrays.asList(datasource("uma", first), datasource("uma", second)));
        Assert.assertEquals(1, registry.getNames().size());
        Assert.assertTrue(second.isClosed());
        Assert.assertFalse(first.isClosed());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testInfluxQlIsUnsupported() throws Exception {
        datasource("uma", new FakeFluxClient(flux -> new ArrayList<>())).query("SELECT * FROM cpu");
    }
}
