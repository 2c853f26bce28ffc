package datahandler.server.store;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads datasource connections from the YAML secret. Three layouts are accepted:
 *
 * <pre>
 * # a single datasource, named "default"
 * url: http://influx:8086
 * org: analytics
 * bucket: uma
 * token: secret
 *
 * # named datasources
 * uma:
 *   url: http://influx:8086
 *   org: analytics
 *   bucket: uma
 *   token: secret
 *
 * # deprecated, one datasource per bucket named &lt;name&gt;_&lt;bucket&gt;
 * athens:
 *   url: http://influx:8086
 *   org: analytics
 *   token: secret
 *   databases: [iperf, rtt]
 * </pre>
 *
 * Entries that fit none of the layouts are logged and skipped.
 */
public class ConnectionsLoader {

    public static final String DEFAULT_NAME = "default";

    private static final Logger log = LoggerFactory.getLogger(ConnectionsLoader.class);
    private static final String URL = "url";
    private static final String ORG = "org";
    private static final String BUCKET = "bucket";
    private static final String TOKEN = "token";
    private static final String DATABASES = "databases";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    /**
     * @return the connections in the file, empty if the file does not exist
     */
    public List<ConnectionDetails> load(String file) throws IOException {
        File f = new File(file);
        if (!f.exists()) {
            log.warn("Connections file {} not found, no datasources configured", file);
            return new ArrayList<>();
        }
        try (Reader reader = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public List<ConnectionDetails> load(Reader reader) throws IOException {
        List<ConnectionDetails> connections = new ArrayList<>();
        JsonNode root = mapper.readTree(reader);
        if (root == null || !root.isObject()) {
            log.warn("Connections file does not hold a mapping, no datasources configured");
            return connections;
        }
        if (root.has(URL)) {
            ConnectionDetails flat = single(DEFAULT_NAME, root);
            if (flat != null) {
                connections.add(flat);
            }
            return connections;
        }
        Iterator<Map.Entry<String,JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String,JsonNode> entry = entries.next();
            String name = entry.getKey();
            JsonNode node = entry.getValue();
            if (!node.isObject()) {
                log.warn("Skipping datasource {}: entry is not a mapping", name);
            } else if (node.has(DATABASES)) {
                connections.addAll(multiBucket(name, node));
            } else {
                ConnectionDetails details = single(name, node);
                if (details != null) {
                    connections.add(details);
                }
            }
        }
        return connections;
    }

    private ConnectionDetails single(String name, JsonNode node) {
        String url = text(node, URL);
        String org = text(node, ORG);
        String bucket = text(node, BUCKET);
        String token = text(node, TOKEN);
        if (StringUtils.isAnyBlank(url, org, bucket, token)) {
            log.warn("Skipping datasource {}: url, org, bucket and token are required", name);
            return null;
        }
        return new ConnectionDetails(name, url, org, bucket, token);
    }

    private List<ConnectionDetails> multiBucket(String name, JsonNode node) {
        List<ConnectionDetails> connections = new ArrayList<>();
        String url = text(node, URL);
        String org = text(node, ORG);
        String token = text(node, TOKEN);
        if (StringUtils.isAnyBlank(url, org, token)) {
            log.warn("Skipping datasource {}: url, org and token are required", name);
            return connections;
        }
        JsonNode databases = node.get(DATABASES);
        if (!databases.isArray()) {
            log.warn("Skipping datasource {}: databases must be a list", name);
            return connections;
        }
        for (JsonNode database : databases) {
            String bucket = database.asText();
            if (StringUtils.isBlank(bucket)) {
                log.warn("Skipping blank bucket of datasource {}", name);
                continue;
            }
            connections.add(new ConnectionDetails(name + "_" + bucket, url, org, bucket, token));
        }
        return connections;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
