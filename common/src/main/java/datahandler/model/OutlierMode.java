package datahandler.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Outlier removal applied to a retrieved table. The strategy index is the one the outlier filter is selected by.
 */
public enum OutlierMode {

    NONE(-1), ZSCORE(0), MAD(1);

    private final int strategyIndex;

    OutlierMode(int strategyIndex) {
        this.strategyIndex = strategyIndex;
    }

    public int getStrategyIndex() {
        return strategyIndex;
    }

    /**
     * @param value
     *            "zscore", "mad", "none" in any case, or null / blank for none
     * @throws IllegalArgumentException
     *             for any other value
     */
    public static OutlierMode parse(String value) {
        if (StringUtils.isBlank(value)) {
            return NONE;
        }
        for (OutlierMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported outlier removal mode: " + value + ", expected zscore or mad");
    }

    public static OutlierMode forStrategyIndex(int strategyIndex) {
        for (OutlierMode mode : values()) {
            if (mode.strategyIndex == strategyIndex) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown outlier strategy index: " + strategyIndex);
    }
}
