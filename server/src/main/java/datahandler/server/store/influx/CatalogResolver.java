package datahandler.server.store.influx;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.response.DataHandlerException;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Discovers experiment identifiers and measurements live from the tag index. Nothing is kept between calls.
 */
public class CatalogResolver {

    private static final Logger log = LoggerFactory.getLogger(CatalogResolver.class);
    private static final String VALUE = "_value";
    private static final String MEASUREMENT = "_measurement";

    private final FluxClient client;
    private final String bucket;
    private final Duration lookback;

    public CatalogResolver(FluxClient client, String bucket, Duration lookback) {
        this.client = client;
        this.bucket = bucket;
        this.lookback = lookback;
    }

    public SortedSet<String> listAllExperimentIds() throws DataHandlerException {
        return experimentIds(Optional.empty());
    }

    public SortedSet<String> listExperimentIdsForMeasurement(String measurement) throws DataHandlerException {
        return experimentIds(Optional.of(measurement));
    }

    public SortedSet<String> listMeasurementsForExperimentId(String experimentId) throws DataHandlerException {
        SortedSet<String> measurements = new TreeSet<>();
        for (Map<String,Object> record : run(FluxQueries.measurementsForExperiment(bucket, lookback, experimentId))) {
            Object value = record.containsKey(MEASUREMENT) ? record.get(MEASUREMENT) : record.get(VALUE);
            if (value != null) {
                measurements.add(value.toString());
            }
        }
        return measurements;
    }

    private SortedSet<String> experimentIds(Optional<String> measurement) throws DataHandlerException {
        SortedSet<String> ids = new TreeSet<>();
        for (String tag : FluxQueries.EXPERIMENT_TAGS) {
            for (Map<String,Object> record : run(FluxQueries.tagValues(bucket, lookback, tag, measurement))) {
                Object value = record.get(VALUE);
                if (value != null) {
                    ids.add(value.toString());
                }
            }
        }
        return ids;
    }

    private List<Map<String,Object>> run(String flux) throws DataHandlerException {
        log.trace("Discovery query on {}: {}", bucket, flux);
        try {
            return client.query(flux);
        } catch (RuntimeException e) {
            log.error("Error during discovery on " + bucket, e);
            throw new DataHandlerException(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(), "Error during discovery: " + e.getMessage(),
                            e.getMessage(), e);
        }
    }
}
