package datahandler.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.LongPredicate;
import java.util.function.LongUnaryOperator;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Preconditions;

/**
 * Immutable time indexed table. Rows are keyed by epoch milliseconds in ascending order, one row per timestamp. Columns
 * keep the order in which they were first added. A cell is absent when the row has no value for the column.
 */
@JsonSerialize(using = TimeSeriesTableSerializer.class)
public final class TimeSeriesTable implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final TimeSeriesTable EMPTY = new Builder().build();

    private final List<String> columns;
    private final NavigableMap<Long,Map<String,Object>> rows;

    private TimeSeriesTable(List<String> columns, NavigableMap<Long,Map<String,Object>> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableNavigableMap(rows);
    }

    public static TimeSeriesTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getColumns() {
        return columns;
    }

    public NavigableSet<Long> getTimestamps() {
        return rows.navigableKeySet();
    }

    /**
     * @return the row at the timestamp, or an empty map if there is none
     */
    public Map<String,Object> getRow(long timestamp) {
        Map<String,Object> row = rows.get(timestamp);
        return row == null ? Collections.emptyMap() : row;
    }

    public Object get(long timestamp, String column) {
        return getRow(timestamp).get(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public long getFirstTimestamp() {
        Preconditions.checkState(!isEmpty(), "table is empty");
        return rows.firstKey();
    }

    /**
     * Shifts the time index so that the first row is at zero. An empty table is returned unchanged.
     */
    public TimeSeriesTable rebase() {
        if (isEmpty()) {
            return this;
        }
        final long origin = getFirstTimestamp();
        return mapTimestamps(ts -> ts - origin);
    }

    /**
     * Moves every row to a new timestamp. Rows mapped onto the same timestamp are combined, the earlier row's values win
     * where both have a value for a column.
     */
    public TimeSeriesTable mapTimestamps(LongUnaryOperator mapping) {
        Builder builder = builder().addColumns(columns);
        rows.forEach((ts, row) -> {
            long mapped = mapping.applyAsLong(ts);
            builder.addRow(mapped, Collections.emptyMap());
            row.forEach((column, value) -> builder.putIfAbsent(mapped, column, value));
        });
        return builder.build();
    }

    public TimeSeriesTable filterTimestamps(LongPredicate keep) {
        Builder builder = builder().addColumns(columns);
        rows.forEach((ts, row) -> {
            if (keep.test(ts)) {
                builder.addRow(ts, row);
            }
        });
        return builder.build();
    }

    /**
     * @return a table holding only the given column, with the rows that have a value for it
     */
    public TimeSeriesTable selectColumn(String column) {
        Preconditions.checkArgument(columns.contains(column), "unknown column %s", column);
        Builder builder = builder().addColumn(column);
        rows.forEach((ts, row) -> {
            if (row.containsKey(column)) {
                builder.put(ts, column, row.get(column));
            }
        });
        return builder.build();
    }

    /**
     * Concatenates the other table column-wise on the shared time index. Rows at exactly the same timestamp are joined
     * into one row, all other rows are kept as they are. A column of the other table whose name is already taken is
     * renamed to {@code qualifier.column}.
     */
    public TimeSeriesTable join(TimeSeriesTable other, String qualifier) {
        Map<String,String> renamed = new LinkedHashMap<>();
        Set<String> taken = new LinkedHashSet<>(columns);
        for (String column : other.columns) {
            String name = column;
            if (taken.contains(name)) {
                name = qualifier + "." + column;
            }
            taken.add(name);
            renamed.put(column, name);
        }
        Builder builder = builder().addColumns(taken);
        rows.forEach(builder::addRow);
        other.rows.forEach((ts, row) -> row.forEach((column, value) -> builder.put(ts, renamed.get(column), value)));
        return builder.build();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TimeSeriesTable)) {
            return false;
        }
        TimeSeriesTable other = (TimeSeriesTable) obj;
        EqualsBuilder eq = new EqualsBuilder();
        eq.append(columns, other.columns);
        eq.append(rows, other.rows);
        return eq.isEquals();
    }

    @Override
    public int hashCode() {
        HashCodeBuilder hcb = new HashCodeBuilder();
        hcb.append(columns);
        hcb.append(rows);
        return hcb.toHashCode();
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("columns", columns);
        tsb.append("rows", rows);
        return tsb.toString();
    }

    public static class Builder {

        private final Set<String> columns = new LinkedHashSet<>();
        private final NavigableMap<Long,Map<String,Object>> rows = new TreeMap<>();

        public Builder addColumn(String column) {
            Preconditions.checkNotNull(column, "column");
            columns.add(column);
            return this;
        }

        public Builder addColumns(Iterable<String> columns) {
            columns.forEach(this::addColumn);
            return this;
        }

        /**
         * Sets a cell, replacing any value already present. A null value leaves the cell absent but still creates the row.
         */
        public Builder put(long timestamp, String column, Object value) {
            addColumn(column);
            Map<String,Object> row = rows.computeIfAbsent(timestamp, k -> new LinkedHashMap<>());
            if (value != null) {
                row.put(column, value);
            }
            return this;
        }

        public Builder putIfAbsent(long timestamp, String column, Object value) {
            addColumn(column);
            Map<String,Object> row = rows.computeIfAbsent(timestamp, k -> new LinkedHashMap<>());
            if (value != null) {
                row.putIfAbsent(column, value);
            }
            return this;
        }

        public Builder addRow(long timestamp, Map<String,Object> values) {
            rows.computeIfAbsent(timestamp, k -> new LinkedHashMap<>());
            values.forEach((column, value) -> put(timestamp, column, value));
            return this;
        }

        public TimeSeriesTable build() {
            List<String> columnList = new ArrayList<>(columns);
            NavigableMap<Long,Map<String,Object>> copy = new TreeMap<>();
            rows.forEach((ts, row) -> {
                // cells in column order so that equal tables serialize identically
                Map<String,Object> ordered = new LinkedHashMap<>();
                for (String column : columnList) {
                    if (row.containsKey(column)) {
                        ordered.put(column, row.get(column));
                    }
                }
                copy.put(ts, Collections.unmodifiableMap(ordered));
            });
            return new TimeSeriesTable(columnList, copy);
        }
    }
}
