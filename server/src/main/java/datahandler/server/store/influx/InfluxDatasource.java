package datahandler.server.store.influx;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.response.DataHandlerException;
import datahandler.model.TimeSeriesTable;
import datahandler.server.store.ConnectionDetails;
import datahandler.server.store.Datasource;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * A datasource backed by one InfluxDB v2 bucket and queried with Flux. The client is null when it could not be created,
 * which makes the datasource unavailable.
 */
public class InfluxDatasource implements Datasource {

    private static final Logger log = LoggerFactory.getLogger(InfluxDatasource.class);

    private final ConnectionDetails details;
    private final FluxClient client;
    private final CatalogResolver catalog;
    private final SeriesFetcher fetcher;

    public InfluxDatasource(ConnectionDetails details, FluxClient client, Duration dataLookback, Duration catalogLookback) {
        this.details = details;
        this.client = client;
        if (client != null) {
            this.catalog = new CatalogResolver(client, details.getBucket(), catalogLookback);
            this.fetcher = new SeriesFetcher(client, details.getBucket(), dataLookback, catalog);
        } else {
            this.catalog = null;
            this.fetcher = null;
        }
    }

    @Override
    public String getName() {
        return details.getName();
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public TimeSeriesTable fetch(String experimentId, List<String> measurements, List<String> fields, Optional<Integer> limit,
                    Optional<Integer> offset, long bucketWidthMillis) throws DataHandlerException {
        checkAvailable();
        return fetcher.fetch(experimentId, measurements, fields, limit, offset, bucketWidthMillis);
    }

    @Override
    public SortedSet<String> listAllExperimentIds() throws DataHandlerException {
        checkAvailable();
        return catalog.listAllExperimentIds();
    }

    @Override
    public SortedSet<String> listExperimentIdsForMeasurement(String measurement) throws DataHandlerException {
        checkAvailable();
        return catalog.listExperimentIdsForMeasurement(measurement);
    }

    @Override
    public SortedSet<String> listMeasurementsForExperimentId(String experimentId) throws DataHandlerException {
        checkAvailable();
        return catalog.listMeasurementsForExperimentId(experimentId);
    }

    private void checkAvailable() throws DataHandlerException {
        if (!isAvailable()) {
            throw new DataHandlerException(HttpResponseStatus.NOT_FOUND.code(), "Data source " + getName() + " is not available.", getName());
        }
    }

    @Override
    public void close() {
        if (client != null) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.error("Error closing client of " + getName(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "InfluxDatasource " + details;
    }
}
