package datahandler.server.outlier;

import datahandler.model.TimeSeriesTable;

/**
 * Removes outlying values from a table. The result has the same columns and a subset of the rows and values, never
 * anything new.
 */
public interface OutlierFilter {

    /**
     * @param strategyIndex
     *            0 for z-score, 1 for median absolute deviation
     * @throws IllegalArgumentException
     *             for an unknown strategy
     */
    TimeSeriesTable remove(TimeSeriesTable table, int strategyIndex);
}
