package datahandler.common.configuration;

import java.time.Duration;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "datahandler")
public class DataHandlerProperties {

    @NotBlank
    private String connectionsFile = "/run/secrets/analytics_connections";
    @NotNull
    private Duration dataLookback = Duration.ofDays(30);
    @NotNull
    private Duration catalogLookback = Duration.ofDays(90);
    @NotBlank
    private String defaultMaxLag = "1s";

    /**
     * YAML file describing the datasources, usually a mounted secret.
     */
    public String getConnectionsFile() {
        return connectionsFile;
    }

    public void setConnectionsFile(String connectionsFile) {
        this.connectionsFile = connectionsFile;
    }

    public Duration getDataLookback() {
        return dataLookback;
    }

    public void setDataLookback(Duration dataLookback) {
        this.dataLookback = dataLookback;
    }

    public Duration getCatalogLookback() {
        return catalogLookback;
    }

    public void setCatalogLookback(Duration catalogLookback) {
        this.catalogLookback = catalogLookback;
    }

    public String getDefaultMaxLag() {
        return defaultMaxLag;
    }

    public void setDefaultMaxLag(String defaultMaxLag) {
        this.defaultMaxLag = defaultMaxLag;
    }
}
