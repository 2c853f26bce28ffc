package datahandler.server.store;

import static datahandler.server.store.ExperimentFixture.DATASOURCE;
import static datahandler.server.store.ExperimentFixture.FIELD;
import static datahandler.server.store.ExperimentFixture.MEASUREMENT;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import org.junit.Assert;
import org.junit.Test;

import datahandler.api.request.timeseries.DataRequest;
import datahandler.api.response.DataHandlerException;
import datahandler.model.OutlierMode;
import datahandler.model.TimeSeriesTable;
import datahandler.server.outlier.StatisticalOutlierFilter;
import datahandler.server.store.cache.RetrievalCache;
import datahandler.server.store.influx.FakeFluxClient;
import datahandler.server.sync.SeriesSynchronizer;
import datahandler.util.JsonUtil;
import datahandler.common.configuration.DataHandlerProperties;

public class DataRetrievalServiceTest {

    private static DataRequest request(String experimentId) {
        DataRequest request = new DataRequest();
        request.setDatasource(DATASOURCE);
        request.setExperimentId(experimentId);
        request.setMeasurements(new ArrayList<>(Arrays.asList(MEASUREMENT)));
        request.setFields(new ArrayList<>(Arrays.asList(FIELD)));
        return request;
    }

    @Test
    public void testSingleExperiment() throws Exception {
        DataRetrievalService service = ExperimentFixture.service(ExperimentFixture.client(0), false);
        Map<String,TimeSeriesTable> data = service.getData(request("42"));
        Assert.assertEquals(Arrays.asList("42"), new ArrayList<>(data.keySet()));
        TimeSeriesTable table = data.get("42");
        Assert.assertEquals(Arrays.asList(FIELD), table.getColumns());
        Assert.assertEquals(Arrays.asList(0L, 1000L, 2000L), new ArrayList<>(table.getTimestamps()));
        Assert.assertEquals(10.0, table.get(0L, FIELD));
        Assert.assertEquals(12.0, table.get(1000L, FIELD));
        Assert.assertEquals(11.0, table.get(2000L, FIELD));
    }

    @Test
    public void testZScoreKeepsRegularSeries() throws Exception {
        DataRetrievalService service = ExperimentFixture.service(ExperimentFixture.client(0), false);
        DataRequest request = request("42");
        request.setOutlierMode(OutlierMode.ZSCORE);
        Assert.assertEquals(3, service.getData(request).get("42").size());
    }

    @Test
    public void testMeasurementsResolvedWhenMissing() throws Exception {
        FakeFluxClient client = ExperimentFixture.client(0);
        DataRetrievalService service = ExperimentFixture.service(client, false);
        DataRequest request = request("42");
        request.setMeasurements(new ArrayList<>());
        Assert.assertEquals(3, service.getData(request).get("42").size());
        Assert.assertEquals(2, client.getQueries().size());
    }

    @Test
    public void testComparison() throws Exception {
        DataRetrievalService service = ExperimentFixture.service(ExperimentFixture.client(1_000_000L), false);
        DataRequest request = request("42");
        request.setComparedExperimentId(Optional.of("43"));
        Map<String,TimeSeriesTable> data = service.getData(request);
        Assert.assertEquals(Arrays.asList(DataRetrievalService.SERIES_1, DataRetrievalService.SERIES_2), new ArrayList<>(data.keySet()));
        Assert.assertEquals(Arrays.asList(0L, 1000L, 2000L), new ArrayList<>(data.get(DataRetrievalService.SERIES_1).getTimestamps()));
        Assert.assertEquals(Arrays.asList(0L, 1000L, 2000L), new ArrayList<>(data.get(DataRetrievalService.SERIES_2).getTimestamps()));
    }

    @Test
    public void testEmptyResultIsNotAnError() throws Exception {
        DataRetrievalService service = ExperimentFixture.service(ExperimentFixture.client(0), false);
        Map<String,TimeSeriesTable> data = service.getData(request("99"));
        Assert.assertTrue(data.get("99").isEmpty());
    }

    @Test
    public void testUnavailableDatasource() throws Exception {
        DataRetrievalService service = ExperimentFixture.service(ExperimentFixture.client(0), false);
        DataRequest request = request("42");
        request.setDatasource("down");
        try {
            service.getData(request);
            Assert.fail("expected not found");
        } catch (DataHandlerException e) {
            Assert.assertEquals(404, e.getCode());
        }
    }

    @Test
    public void testCacheHitAndPurge() throws Exception {
        FakeFluxClient client = ExperimentFixture.client(0);
        DataRetrievalService service = ExperimentFixture.service(client, true);
        byte[] first = JsonUtil.getObjectMapper().writeValueAsBytes(service.getData(request("42")));
        int queries = client.getQueries().size();

        byte[] second = JsonUtil.getObjectMapper().writeValueAsBytes(service.getData(request("42")));
        Assert.assertEquals(queries, client.getQueries().size());
        Assert.assertArrayEquals(first, second);

        service.purgeCache();
        byte[] third = JsonUtil.getObjectMapper().writeValueAsBytes(service.getData(request("42")));
        Assert.assertEquals(2 * queries, client.getQueries().size());
        Assert.assertArrayEquals(first, third);
    }

    @Test
    public void testCacheTransparency() throws Exception {
        byte[] cached = JsonUtil.getObjectMapper().writeValueAsBytes(ExperimentFixture.service(ExperimentFixture.client(0), true).getData(request("42")));
        byte[] uncached = JsonUtil.getObjectMapper().writeValueAsBytes(ExperimentFixture.service(ExperimentFixture.client(0), false).getData(request("42")));
        Assert.assertArrayEquals(cached, uncached);
    }

    @Test
    public void testDisabledCacheAlwaysQueries() throws Exception {
        FakeFluxClient client = ExperimentFixture.client(0);
        DataRetrievalService service = ExperimentFixture.service(client, false);
        service.getData(request("42"));
        service.getData(request("42"));
        Assert.assertEquals(2, client.getQueries().size());
    }

    @Test
    public void testFailureIsNotCached() throws Exception {
        FakeFluxClient client = new FakeFluxClient(flux -> {
            throw new IllegalStateException("connection refused");
        });
        RetrievalCache cache = new RetrievalCache(true);
        DataRetrievalService service = new DataRetrievalService(ExperimentFixture.registry(client), cache, new StatisticalOutlierFilter(3.0, 3.5),
                        new SeriesSynchronizer(), new DataHandlerProperties());
        try {
            service.getData(request("42"));
            Assert.fail("expected failure");
        } catch (DataHandlerException e) {
            Assert.assertEquals(500, e.getCode());
        }
        Assert.assertEquals(0, cache.size());
    }

    @Test
    public void testMatchSeries() throws Exception {
        FakeFluxClient client = new FakeFluxClient(flux -> {
            java.util.List<Map<String,Object>> records = new ArrayList<>();
            records.add(FakeFluxClient.dataRecord(MEASUREMENT, "42", 0, "a", 1.0));
            records.add(FakeFluxClient.dataRecord(MEASUREMENT, "42", 400, "b", 2.0));
            return records;
        });
        DataRetrievalService service = ExperimentFixture.service(client, false);
        DataRequest request = request("42");
        request.setFields(new ArrayList<>());
        Assert.assertEquals(2, service.getData(request).get("42").size());
        request.setMatchSeries(true);
        TimeSeriesTable matched = service.getData(request).get("42");
        Assert.assertEquals(1, matched.size());
        Assert.assertEquals(1.0, matched.get(0L, "a"));
        Assert.assertEquals(2.0, matched.get(0L, "b"));
    }

    @Test
    public void testCatalog() throws Exception {
        DataRetrievalService service = ExperimentFixture.service(ExperimentFixture.client(0), false);
        Assert.assertEquals(Arrays.asList("down", "uma"), service.getDatasources());
        Assert.assertEquals(Arrays.asList("42", "43"), new ArrayList<>(service.listAllExperimentIds(DATASOURCE)));
        Assert.assertEquals(Arrays.asList(MEASUREMENT), new ArrayList<>(service.listMeasurementsForExperimentId(DATASOURCE, "42")));
        Assert.assertTrue(service.listMeasurementsForExperimentId(DATASOURCE, "99").isEmpty());
    }

    @Test
    public void testDefaultMaxLag() throws Exception {
        DataHandlerProperties properties = new DataHandlerProperties();
        properties.setDefaultMaxLag("500ms");
        FakeFluxClient client = ExperimentFixture.client(0);
        DataRetrievalService service = new DataRetrievalService(ExperimentFixture.registry(client), new RetrievalCache(false),
                        new StatisticalOutlierFilter(3.0, 3.5), new SeriesSynchronizer(), properties);
        service.getData(request("42"));
        Assert.assertTrue(client.getQueries().get(0).contains("every: 500ms"));
        DataRequest request = request("42");
        request.setMaxLag(Optional.of("2m"));
        service.getData(request);
        Assert.assertTrue(client.getQueries().get(1).contains("every: 2m"));
    }
}
