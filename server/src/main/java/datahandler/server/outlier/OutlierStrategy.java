package datahandler.server.outlier;

/**
 * Decides which values of one column are outliers.
 */
interface OutlierStrategy {

    /**
     * @return one flag per value, true for an outlier
     */
    boolean[] outliers(double[] values);
}
