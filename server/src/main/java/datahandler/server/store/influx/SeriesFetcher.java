package datahandler.server.store.influx;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;

import datahandler.api.response.DataHandlerException;
import datahandler.model.TimeSeriesTable;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Builds and runs the per-measurement data queries of one experiment and joins their results into one table.
 */
public class SeriesFetcher {

    private static final Logger log = LoggerFactory.getLogger(SeriesFetcher.class);
    private static final String TIME = "_time";
    private static final Set<String> DROPPED_COLUMNS;

    static {
        ImmutableSet.Builder<String> dropped = ImmutableSet.builder();
        dropped.add(TIME, "_start", "_stop", "_measurement", "result", "table");
        // the experiment tags only repeat the requested identifier
        dropped.addAll(FluxQueries.EXPERIMENT_TAGS);
        DROPPED_COLUMNS = dropped.build();
    }

    private final FluxClient client;
    private final String bucket;
    private final Duration lookback;
    private final CatalogResolver catalog;

    public SeriesFetcher(FluxClient client, String bucket, Duration lookback, CatalogResolver catalog) {
        this.client = client;
        this.bucket = bucket;
        this.lookback = lookback;
        this.catalog = catalog;
    }

    public TimeSeriesTable fetch(String experimentId, List<String> measurements, List<String> fields, Optional<Integer> limit, Optional<Integer> offset,
                    long bucketWidthMillis) throws DataHandlerException {
        Collection<String> toRead = measurements;
        if (toRead.isEmpty()) {
            toRead = catalog.listMeasurementsForExperimentId(experimentId);
            log.debug("Resolved measurements {} for experiment {}", toRead, experimentId);
        }
        TimeSeriesTable result = TimeSeriesTable.empty();
        for (String measurement : toRead) {
            String flux = FluxQueries.data(bucket, lookback, measurement, experimentId, fields, bucketWidthMillis, limit, offset);
            TimeSeriesTable table = toTable(run(measurement, flux));
            if (!table.isEmpty()) {
                result = result.join(table, measurement);
            }
        }
        return result;
    }

    private List<Map<String,Object>> run(String measurement, String flux) throws DataHandlerException {
        log.trace("Data query for {} on {}: {}", measurement, bucket, flux);
        try {
            return client.query(flux);
        } catch (RuntimeException e) {
            log.error("Error querying measurement " + measurement + " on " + bucket, e);
            throw new DataHandlerException(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(), "Error during query: " + e.getMessage(),
                            "measurement " + measurement, e);
        }
    }

    static TimeSeriesTable toTable(List<Map<String,Object>> records) throws DataHandlerException {
        TimeSeriesTable.Builder builder = TimeSeriesTable.builder();
        for (Map<String,Object> record : records) {
            long timestamp = timestamp(record.get(TIME));
            record.forEach((column, value) -> {
                if (!DROPPED_COLUMNS.contains(column)) {
                    builder.put(timestamp, column, value);
                }
            });
        }
        return builder.build();
    }

    private static long timestamp(Object time) throws DataHandlerException {
        if (time instanceof Instant) {
            return ((Instant) time).toEpochMilli();
        }
        if (time instanceof Number) {
            return ((Number) time).longValue();
        }
        throw new DataHandlerException(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(), "Error during query: record without a valid _time",
                        String.valueOf(time));
    }
}
