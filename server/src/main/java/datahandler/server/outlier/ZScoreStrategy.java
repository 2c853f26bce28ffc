package datahandler.server.outlier;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Flags values more than {@code threshold} population standard deviations away from the mean.
 */
class ZScoreStrategy implements OutlierStrategy {

    private final double threshold;

    ZScoreStrategy(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public boolean[] outliers(double[] values) {
        boolean[] flags = new boolean[values.length];
        if (values.length < 2) {
            return flags;
        }
        double mean = new Mean().evaluate(values);
        double sd = new StandardDeviation(false).evaluate(values);
        if (sd == 0.0 || Double.isNaN(sd)) {
            return flags;
        }
        for (int i = 0; i < values.length; i++) {
            flags[i] = Math.abs(values[i] - mean) / sd > threshold;
        }
        return flags;
    }
}
