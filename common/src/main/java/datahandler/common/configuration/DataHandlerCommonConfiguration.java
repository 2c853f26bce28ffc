package datahandler.common.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({CacheProperties.class, DataHandlerProperties.class, HttpProperties.class, OutlierProperties.class,
        ServerProperties.class})
public class DataHandlerCommonConfiguration {

}
