package datahandler.server.store.influx;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

import datahandler.util.DurationParser;

/**
 * Flux scripts issued by the datasource. Every identifier is emitted as an escaped string literal and every duration
 * from a parsed millisecond value, so request text never reaches the script unquoted.
 */
public class FluxQueries {

    /**
     * Tag names an experiment identifier has been stored under.
     */
    public static final List<String> EXPERIMENT_TAGS = ImmutableList.of("ExperimentId", "ExecutionId");

    private FluxQueries() {}

    public static String literal(String value) {
        StringBuilder b = new StringBuilder(value.length() + 2);
        b.append('"');
        for (char c : value.toCharArray()) {
            if (Character.isISOControl(c)) {
                throw new IllegalArgumentException("Control characters are not allowed in identifiers: " + value);
            }
            if (c == '\\' || c == '"') {
                b.append('\\');
            }
            b.append(c);
        }
        return b.append('"').toString();
    }

    static String experimentPredicate(String experimentId) {
        String id = literal(experimentId);
        return EXPERIMENT_TAGS.stream().map(tag -> "r." + tag + " == " + id).collect(Collectors.joining(" or "));
    }

    private static String from(String bucket, Duration lookback) {
        return "from(bucket: " + literal(bucket) + ")\n  |> range(start: -" + DurationParser.toFluxDuration(lookback) + ")\n";
    }

    /**
     * Rows of one measurement for one experiment, averaged over {@code bucketWidthMillis} windows and pivoted to one
     * column per field. The offset is only applied together with a limit.
     */
    public static String data(String bucket, Duration lookback, String measurement, String experimentId, List<String> fields, long bucketWidthMillis,
                    Optional<Integer> limit, Optional<Integer> offset) {
        StringBuilder flux = new StringBuilder(from(bucket, lookback));
        flux.append("  |> filter(fn: (r) => r._measurement == ").append(literal(measurement)).append(")\n");
        flux.append("  |> filter(fn: (r) => ").append(experimentPredicate(experimentId)).append(")\n");
        if (!fields.isEmpty()) {
            String set = fields.stream().map(FluxQueries::literal).collect(Collectors.joining(", "));
            flux.append("  |> filter(fn: (r) => contains(value: r._field, set: [").append(set).append("]))\n");
        }
        flux.append("  |> aggregateWindow(every: ").append(DurationParser.toFluxDuration(bucketWidthMillis)).append(", fn: mean, createEmpty: false)\n");
        flux.append("  |> pivot(rowKey: [\"_time\"], columnKey: [\"_field\"], valueColumn: \"_value\")\n");
        if (limit.isPresent()) {
            flux.append("  |> limit(n: ").append(limit.get());
            offset.ifPresent(o -> flux.append(", offset: ").append(o));
            flux.append(")\n");
        }
        return flux.toString();
    }

    /**
     * Distinct values of a tag from the tag index, optionally restricted to one measurement.
     */
    public static String tagValues(String bucket, Duration lookback, String tag, Optional<String> measurement) {
        StringBuilder flux = new StringBuilder("import \"influxdata/influxdb/schema\"\n");
        flux.append("schema.tagValues(bucket: ").append(literal(bucket)).append(", tag: ").append(literal(tag));
        measurement.ifPresent(m -> flux.append(", predicate: (r) => r._measurement == ").append(literal(m)));
        flux.append(", start: -").append(DurationParser.toFluxDuration(lookback)).append(")\n");
        return flux.toString();
    }

    public static String measurementsForExperiment(String bucket, Duration lookback, String experimentId) {
        StringBuilder flux = new StringBuilder(from(bucket, lookback));
        flux.append("  |> filter(fn: (r) => ").append(experimentPredicate(experimentId)).append(")\n");
        flux.append("  |> keep(columns: [\"_measurement\"])\n");
        flux.append("  |> group()\n");
        flux.append("  |> distinct(column: \"_measurement\")\n");
        return flux.toString();
    }
}
