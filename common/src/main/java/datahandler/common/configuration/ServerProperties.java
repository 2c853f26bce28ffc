package datahandler.common.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "datahandler.server")
public class ServerProperties {

    private Integer shutdownQuietPeriod = 5;

    /**
     * Time to wait (in seconds) for connections to finish before shutting down Netty event loop groups.
     */
    public int getShutdownQuietPeriod() {
        return this.shutdownQuietPeriod;
    }

    public void setShutdownQuietPeriod(Integer quietPeriod) {
        this.shutdownQuietPeriod = quietPeriod;
    }
}
