package datahandler.server.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.response.DataHandlerException;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * The datasources configured at startup, by name. Immutable after construction.
 */
public class DatasourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DatasourceRegistry.class);

    private final Map<String,Datasource> datasources = new TreeMap<>();

    public DatasourceRegistry(Collection<? extends Datasource> datasources) {
        for (Datasource datasource : datasources) {
            if (this.datasources.containsKey(datasource.getName())) {
                log.warn("Duplicate datasource {}, keeping the first definition", datasource.getName());
                datasource.close();
                continue;
            }
            this.datasources.put(datasource.getName(), datasource);
        }
        log.info("Configured datasources: {}", this.datasources.keySet());
    }

    /**
     * @return the names of all configured datasources, sorted
     */
    public List<String> getNames() {
        return new ArrayList<>(datasources.keySet());
    }

    /**
     * @throws DataHandlerException
     *             with code 404 when the datasource is unknown or its client failed to start
     */
    public Datasource getAvailable(String name) throws DataHandlerException {
        Datasource datasource = datasources.get(name);
        if (datasource == null || !datasource.isAvailable()) {
            throw new DataHandlerException(HttpResponseStatus.NOT_FOUND.code(), "Data source " + name + " is not available.", name);
        }
        return datasource;
    }

    public void shutdown() {
        datasources.values().forEach(d -> {
            try {
                log.info("Closing datasource {}", d.getName());
                d.close();
            } catch (Exception e) {
                log.error(e.getMessage(), e);
            }
        });
    }
}
