package datahandler.server.store.influx;

import java.util.List;
import java.util.Map;

/**
 * Runs Flux scripts against one organization. Each returned record maps column name to value, {@code _time} being an
 * {@link java.time.Instant}. Failures surface as unchecked exceptions of the underlying client.
 */
public interface FluxClient extends AutoCloseable {

    List<Map<String,Object>> query(String flux);

    @Override
    void close();
}
