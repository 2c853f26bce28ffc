package datahandler.server.sync;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

import datahandler.model.TimeSeriesTable;

/**
 * Aligns the sample instants of several tables. Timestamps of all tables are walked in time order and grouped into
 * clusters: a cluster starts at its earliest timestamp, which becomes the instant of every sample in it, and takes in
 * later samples that lie within the max lag of that instant as long as their table is not yet part of the cluster.
 * Tables are expected to be rebased by the caller when they come from runs at different wall clock times.
 */
public class SeriesSynchronizer {

    /**
     * Relabels the instants of every table without joining them. Each table keeps all of its rows.
     */
    public Map<String,TimeSeriesTable> align(Map<String,TimeSeriesTable> tables, long maxLagMillis) {
        Map<String,Map<Long,Long>> instants = cluster(tables, maxLagMillis).instants;
        Map<String,TimeSeriesTable> aligned = new LinkedHashMap<>();
        tables.forEach((name, table) -> {
            Map<Long,Long> mapping = instants.get(name);
            aligned.put(name, table.mapTimestamps(mapping::get));
        });
        return aligned;
    }

    /**
     * Joins the tables on their aligned instants. The columns are the union of all columns, a column name already taken
     * by an earlier table is renamed to {@code name.column}.
     *
     * @param strict
     *            when true only instants every table has a sample for are kept
     */
    public TimeSeriesTable merge(Map<String,TimeSeriesTable> tables, long maxLagMillis, boolean strict) {
        Clusters clusters = cluster(tables, maxLagMillis);
        TimeSeriesTable merged = TimeSeriesTable.empty();
        for (Map.Entry<String,TimeSeriesTable> entry : tables.entrySet()) {
            Map<Long,Long> mapping = clusters.instants.get(entry.getKey());
            TimeSeriesTable aligned = entry.getValue().mapTimestamps(mapping::get);
            merged = merged.join(aligned, entry.getKey());
        }
        if (strict) {
            final int required = tables.size();
            merged = merged.filterTimestamps(ts -> clusters.members.get(ts).size() == required);
        }
        return merged;
    }

    private Clusters cluster(Map<String,TimeSeriesTable> tables, long maxLagMillis) {
        Preconditions.checkArgument(maxLagMillis >= 0, "max lag must not be negative");
        List<Sample> samples = new ArrayList<>();
        int order = 0;
        for (Map.Entry<String,TimeSeriesTable> entry : tables.entrySet()) {
            for (Long ts : entry.getValue().getTimestamps()) {
                samples.add(new Sample(ts, order, entry.getKey()));
            }
            order++;
        }
        samples.sort((a, b) -> a.timestamp != b.timestamp ? Long.compare(a.timestamp, b.timestamp) : Integer.compare(a.order, b.order));

        Clusters clusters = new Clusters();
        tables.keySet().forEach(name -> clusters.instants.put(name, new HashMap<>()));
        Long instant = null;
        Set<String> current = null;
        for (Sample sample : samples) {
            if (instant == null || sample.timestamp - instant > maxLagMillis || current.contains(sample.table)) {
                instant = sample.timestamp;
                current = clusters.members.computeIfAbsent(instant, k -> new HashSet<>());
            }
            current.add(sample.table);
            clusters.instants.get(sample.table).put(sample.timestamp, instant);
        }
        return clusters;
    }

    private static class Sample {

        private final long timestamp;
        private final int order;
        private final String table;

        private Sample(long timestamp, int order, String table) {
            this.timestamp = timestamp;
            this.order = order;
            this.table = table;
        }
    }

    private static class Clusters {

        // table -> original timestamp -> aligned instant
        private final Map<String,Map<Long,Long>> instants = new HashMap<>();
        // aligned instant -> tables with a sample there
        private final Map<Long,Set<String>> members = new HashMap<>();
    }
}
