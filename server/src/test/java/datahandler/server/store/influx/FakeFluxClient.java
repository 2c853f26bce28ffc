package datahandler.server.store.influx;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Answers Flux scripts from a function and records every script it was asked to run.
 */
public class FakeFluxClient implements FluxClient {

    private final List<String> queries = new ArrayList<>();
    private final Function<String,List<Map<String,Object>>> responder;
    private boolean closed = false;

    public FakeFluxClient(Function<String,List<Map<String,Object>>> responder) {
        this.responder = responder;
    }

    @Override
    public synchronized List<Map<String,Object>> query(String flux) {
        queries.add(flux);
        return responder.apply(flux);
    }

    public synchronized List<String> getQueries() {
        return new ArrayList<>(queries);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * A pivoted data record as the query API returns it, helper columns included.
     */
    public static Map<String,Object> dataRecord(String measurement, String experimentId, long epochMillis, String field, Object value) {
        Map<String,Object> record = new LinkedHashMap<>();
        record.put("result", "_result");
        record.put("table", 0L);
        record.put("_start", Instant.ofEpochMilli(0));
        record.put("_stop", Instant.ofEpochMilli(epochMillis + 1));
        record.put("_time", Instant.ofEpochMilli(epochMillis));
        record.put("_measurement", measurement);
        record.put("ExperimentId", experimentId);
        record.put(field, value);
        return record;
    }

    public static Map<String,Object> valueRecord(String value) {
        Map<String,Object> record = new LinkedHashMap<>();
        record.put("result", "_result");
        record.put("table", 0L);
        record.put("_value", value);
        return record;
    }
}
