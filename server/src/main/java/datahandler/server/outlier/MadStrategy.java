package datahandler.server.outlier;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Flags values whose modified z-score, 0.6745 * (x - median) / MAD, exceeds {@code threshold} in absolute value.
 */
class MadStrategy implements OutlierStrategy {

    private static final double CONSISTENCY = 0.6745;

    private final double threshold;

    MadStrategy(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public boolean[] outliers(double[] values) {
        boolean[] flags = new boolean[values.length];
        if (values.length < 2) {
            return flags;
        }
        Median median = new Median();
        double center = median.evaluate(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        double mad = median.evaluate(deviations);
        if (mad == 0.0) {
            return flags;
        }
        for (int i = 0; i < values.length; i++) {
            flags[i] = Math.abs(CONSISTENCY * (values[i] - center) / mad) > threshold;
        }
        return flags;
    }
}
