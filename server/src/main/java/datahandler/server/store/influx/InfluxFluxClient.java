package datahandler.server.store.influx;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import com.influxdb.query.FluxRecord;
import com.influxdb.query.FluxTable;

import datahandler.server.store.ConnectionDetails;

public class InfluxFluxClient implements FluxClient {

    private static final Logger log = LoggerFactory.getLogger(InfluxFluxClient.class);

    private final InfluxDBClient client;
    private final String org;

    public InfluxFluxClient(ConnectionDetails details) {
        this.org = details.getOrg();
        this.client = InfluxDBClientFactory.create(details.getUrl(), details.getToken().toCharArray(), details.getOrg(), details.getBucket());
        log.info("Created InfluxDB client for {} at {}", details.getName(), details.getUrl());
    }

    @Override
    public List<Map<String,Object>> query(String flux) {
        List<Map<String,Object>> records = new ArrayList<>();
        List<FluxTable> tables = client.getQueryApi().query(flux, org);
        for (FluxTable table : tables) {
            for (FluxRecord record : table.getRecords()) {
                records.add(record.getValues());
            }
        }
        return records;
    }

    @Override
    public void close() {
        client.close();
    }
}
