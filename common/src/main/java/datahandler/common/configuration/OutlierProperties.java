package datahandler.common.configuration;

import javax.validation.constraints.Positive;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "datahandler.outliers")
public class OutlierProperties {

    @Positive
    private double zscoreThreshold = 3.0;
    @Positive
    private double madThreshold = 3.5;

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    /**
     * Limit on the modified z-score, 0.6745 * (x - median) / MAD.
     */
    public double getMadThreshold() {
        return madThreshold;
    }

    public void setMadThreshold(double madThreshold) {
        this.madThreshold = madThreshold;
    }
}
