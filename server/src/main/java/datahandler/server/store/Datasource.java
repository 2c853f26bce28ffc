package datahandler.server.store;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

import datahandler.api.response.DataHandlerException;
import datahandler.model.TimeSeriesTable;

/**
 * A named connection to one bucket of the backing store.
 */
public interface Datasource extends AutoCloseable {

    String getName();

    /**
     * A datasource is available when its client could be created.
     */
    boolean isAvailable();

    /**
     * Retrieves one experiment as a single wide table, one column per field, sorted by time.
     *
     * @param measurements
     *            measurements to read, all measurements of the experiment when empty
     * @param fields
     *            field names to keep, all fields when empty
     * @param bucketWidthMillis
     *            width of the mean aggregation windows
     * @return the table, empty when the experiment has no data
     */
    TimeSeriesTable fetch(String experimentId, List<String> measurements, List<String> fields, Optional<Integer> limit, Optional<Integer> offset,
                    long bucketWidthMillis) throws DataHandlerException;

    SortedSet<String> listAllExperimentIds() throws DataHandlerException;

    SortedSet<String> listExperimentIdsForMeasurement(String measurement) throws DataHandlerException;

    SortedSet<String> listMeasurementsForExperimentId(String experimentId) throws DataHandlerException;

    /**
     * Raw InfluxQL is not supported by the backing store.
     *
     * @throws UnsupportedOperationException
     *             always
     */
    default TimeSeriesTable query(String influxQl) {
        throw new UnsupportedOperationException("InfluxQL is not supported on InfluxDB v2, use fetch or the catalog operations");
    }

    @Override
    void close();
}
