package datahandler.server.outlier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.model.OutlierMode;
import datahandler.model.TimeSeriesTable;

/**
 * Applies an outlier strategy column by column. Only numeric cells take part, outlying cells are removed and rows left
 * without any value are dropped.
 */
public class StatisticalOutlierFilter implements OutlierFilter {

    private static final Logger log = LoggerFactory.getLogger(StatisticalOutlierFilter.class);

    private final Map<OutlierMode,OutlierStrategy> strategies = new HashMap<>();

    public StatisticalOutlierFilter(double zscoreThreshold, double madThreshold) {
        strategies.put(OutlierMode.ZSCORE, new ZScoreStrategy(zscoreThreshold));
        strategies.put(OutlierMode.MAD, new MadStrategy(madThreshold));
    }

    @Override
    public TimeSeriesTable remove(TimeSeriesTable table, int strategyIndex) {
        OutlierMode mode = OutlierMode.forStrategyIndex(strategyIndex);
        OutlierStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException("No outlier strategy for index " + strategyIndex);
        }
        Map<Long,Set<String>> removed = new HashMap<>();
        int count = 0;
        for (String column : table.getColumns()) {
            List<Long> timestamps = new ArrayList<>();
            List<Double> values = new ArrayList<>();
            for (Long ts : table.getTimestamps()) {
                Object value = table.get(ts, column);
                if (value instanceof Number && !Double.isNaN(((Number) value).doubleValue())) {
                    timestamps.add(ts);
                    values.add(((Number) value).doubleValue());
                }
            }
            boolean[] flags = strategy.outliers(values.stream().mapToDouble(Double::doubleValue).toArray());
            for (int i = 0; i < flags.length; i++) {
                if (flags[i]) {
                    removed.computeIfAbsent(timestamps.get(i), k -> new HashSet<>()).add(column);
                    count++;
                }
            }
        }
        log.debug("{} removed {} outlying values", mode, count);
        if (count == 0) {
            return table;
        }
        TimeSeriesTable.Builder builder = TimeSeriesTable.builder().addColumns(table.getColumns());
        for (Long ts : table.getTimestamps()) {
            Set<String> dropped = removed.get(ts);
            Map<String,Object> row = table.getRow(ts);
            if (dropped == null) {
                builder.addRow(ts, row);
                continue;
            }
            Map<String,Object> kept = new HashMap<>(row);
            kept.keySet().removeAll(dropped);
            if (!kept.isEmpty()) {
                builder.addRow(ts, kept);
            }
        }
        return builder.build();
    }
}
