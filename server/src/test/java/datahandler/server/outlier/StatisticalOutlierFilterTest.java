package datahandler.server.outlier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import datahandler.model.OutlierMode;
import datahandler.model.TimeSeriesTable;

public class StatisticalOutlierFilterTest {

    private final OutlierFilter filter = new StatisticalOutlierFilter(3.0, 3.5);

    private static TimeSeriesTable series(double... values) {
        TimeSeriesTable.Builder builder = TimeSeriesTable.builder();
        for (int i = 0; i < values.length; i++) {
            builder.put(i * 1000L, "value", values[i]);
        }
        return builder.build();
    }

    @Test
    public void testNoOutliers() {
        TimeSeriesTable table = series(10, 12, 11);
        assertSame(table, filter.remove(table, OutlierMode.ZSCORE.getStrategyIndex()));
        assertSame(table, filter.remove(table, OutlierMode.MAD.getStrategyIndex()));
    }

    @Test
    public void testZScore() {
        double[] values = new double[20];
        java.util.Arrays.fill(values, 10);
        values[7] = 100;
        TimeSeriesTable filtered = filter.remove(series(values), 0);
        assertEquals(19, filtered.size());
        assertFalse(filtered.getTimestamps().contains(7000L));
    }

    @Test
    public void testMad() {
        TimeSeriesTable filtered = filter.remove(series(10, 11, 12, 10, 11, 100), 1);
        assertEquals(5, filtered.size());
        assertFalse(filtered.getTimestamps().contains(5000L));
    }

    @Test
    public void testOtherColumnsKeepTheirValues() {
        TimeSeriesTable.Builder builder = TimeSeriesTable.builder();
        double[] values = {10, 11, 12, 10, 11, 100};
        for (int i = 0; i < values.length; i++) {
            builder.put(i * 1000L, "value", values[i]);
            builder.put(i * 1000L, "host", "node-" + i);
        }
        TimeSeriesTable filtered = filter.remove(builder.build(), 1);
        assertEquals(6, filtered.size());
        assertNull(filtered.get(5000L, "value"));
        assertEquals("node-5", filtered.get(5000L, "host"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownStrategy() {
        filter.remove(series(1, 2), 7);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoneIsNotAStrategy() {
        filter.remove(series(1, 2), OutlierMode.NONE.getStrategyIndex());
    }
}
