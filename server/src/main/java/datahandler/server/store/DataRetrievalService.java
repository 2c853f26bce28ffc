package datahandler.server.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.request.timeseries.DataRequest;
import datahandler.api.response.DataHandlerException;
import datahandler.common.configuration.DataHandlerProperties;
import datahandler.model.OutlierMode;
import datahandler.model.TimeSeriesTable;
import datahandler.server.outlier.OutlierFilter;
import datahandler.server.store.cache.RetrievalCache;
import datahandler.server.store.cache.RetrievalFingerprint;
import datahandler.server.sync.SeriesSynchronizer;
import datahandler.util.DurationParser;

/**
 * Entry point of every read. A retrieval is looked up in the cache by fingerprint; on a miss it is fetched from the
 * datasource, filtered for outliers, synchronized if requested, and cached.
 */
public class DataRetrievalService {

    public static final String SERIES_1 = "series1";
    public static final String SERIES_2 = "series2";

    private static final Logger log = LoggerFactory.getLogger(DataRetrievalService.class);

    private final DatasourceRegistry registry;
    private final RetrievalCache cache;
    private final OutlierFilter outlierFilter;
    private final SeriesSynchronizer synchronizer;
    private final DataHandlerProperties properties;

    public DataRetrievalService(DatasourceRegistry registry, RetrievalCache cache, OutlierFilter outlierFilter, SeriesSynchronizer synchronizer,
                    DataHandlerProperties properties) {
        this.registry = registry;
        this.cache = cache;
        this.outlierFilter = outlierFilter;
        this.synchronizer = synchronizer;
        this.properties = properties;
    }

    /**
     * @return the experiment's table keyed by its identifier, or for a comparison the two rebased and aligned tables
     *         keyed {@value #SERIES_1} and {@value #SERIES_2}
     */
    public Map<String,TimeSeriesTable> getData(DataRequest request) throws DataHandlerException {
        long start = System.currentTimeMillis();
        Map<String,TimeSeriesTable> result = new LinkedHashMap<>();
        if (request.isComparison()) {
            TimeSeriesTable series1 = retrieve(request, request.getExperimentId()).rebase();
            TimeSeriesTable series2 = retrieve(request, request.getComparedExperimentId().get()).rebase();
            result.put(SERIES_1, series1);
            result.put(SERIES_2, series2);
            result = synchronizer.align(result, maxLagMillis(request));
        } else {
            result.put(request.getExperimentId(), retrieve(request, request.getExperimentId()));
        }
        log.debug("Request {} served in {}ms", request, System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Retrieves one experiment with the parameters of the request, through the cache.
     */
    public TimeSeriesTable retrieve(DataRequest request, String experimentId) throws DataHandlerException {
        Datasource datasource = registry.getAvailable(request.getDatasource());
        long maxLag = maxLagMillis(request);
        RetrievalFingerprint fingerprint = RetrievalFingerprint.of(datasource.getName(), experimentId, request.getMeasurements(), request.getFields(),
                        request.getOutlierMode(), request.isMatchSeries(), request.getAdditionalClause(), maxLag, request.getLimit(), request.getOffset());
        TimeSeriesTable cached = cache.get(fingerprint).orElse(null);
        if (cached != null) {
            return cached;
        }
        if (request.getAdditionalClause().filter(StringUtils::isNotBlank).isPresent()) {
            log.warn("Ignoring additional_clause {}, not supported by Flux queries", request.getAdditionalClause().get());
        }
        long start = System.currentTimeMillis();
        TimeSeriesTable table = datasource.fetch(experimentId, request.getMeasurements(), request.getFields(), request.getLimit(), request.getOffset(),
                        maxLag);
        log.debug("Fetched {} rows of experiment {} from {} in {}ms", table.size(), experimentId, datasource.getName(),
                        System.currentTimeMillis() - start);
        if (request.getOutlierMode() != OutlierMode.NONE) {
            table = outlierFilter.remove(table, request.getOutlierMode().getStrategyIndex());
        }
        if (request.isMatchSeries()) {
            table = matchSeries(table, maxLag);
        }
        cache.put(fingerprint, table);
        return table;
    }

    private TimeSeriesTable matchSeries(TimeSeriesTable table, long maxLag) {
        if (table.getColumns().size() < 2) {
            return table;
        }
        Map<String,TimeSeriesTable> series = new LinkedHashMap<>();
        for (String column : table.getColumns()) {
            series.put(column, table.selectColumn(column));
        }
        return synchronizer.merge(series, maxLag, false);
    }

    private long maxLagMillis(DataRequest request) {
        return DurationParser.toMillis(request.getMaxLag().orElse(properties.getDefaultMaxLag()));
    }

    public List<String> getDatasources() {
        return registry.getNames();
    }

    public SortedSet<String> listAllExperimentIds(String datasource) throws DataHandlerException {
        return registry.getAvailable(datasource).listAllExperimentIds();
    }

    public SortedSet<String> listExperimentIdsForMeasurement(String datasource, String measurement) throws DataHandlerException {
        return registry.getAvailable(datasource).listExperimentIdsForMeasurement(measurement);
    }

    public SortedSet<String> listMeasurementsForExperimentId(String datasource, String experimentId) throws DataHandlerException {
        return registry.getAvailable(datasource).listMeasurementsForExperimentId(experimentId);
    }

    public void purgeCache() {
        cache.purge();
    }
}
