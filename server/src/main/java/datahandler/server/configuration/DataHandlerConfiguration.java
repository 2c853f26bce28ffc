package datahandler.server.configuration;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import datahandler.common.configuration.CacheProperties;
import datahandler.common.configuration.DataHandlerProperties;
import datahandler.common.configuration.HttpProperties;
import datahandler.common.configuration.OutlierProperties;
import datahandler.common.configuration.ServerProperties;
import datahandler.server.Server;
import datahandler.server.outlier.OutlierFilter;
import datahandler.server.outlier.StatisticalOutlierFilter;
import datahandler.server.store.ConnectionDetails;
import datahandler.server.store.ConnectionsLoader;
import datahandler.server.store.DataRetrievalService;
import datahandler.server.store.Datasource;
import datahandler.server.store.DatasourceRegistry;
import datahandler.server.store.cache.RetrievalCache;
import datahandler.server.store.influx.FluxClient;
import datahandler.server.store.influx.InfluxDatasource;
import datahandler.server.store.influx.InfluxFluxClient;
import datahandler.server.sync.SeriesSynchronizer;

@Configuration
public class DataHandlerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DataHandlerConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public DatasourceRegistry datasourceRegistry(DataHandlerProperties dataHandlerProperties) throws IOException {
        List<ConnectionDetails> connections = new ConnectionsLoader().load(dataHandlerProperties.getConnectionsFile());
        List<Datasource> datasources = new ArrayList<>();
        for (ConnectionDetails details : connections) {
            FluxClient client = null;
            try {
                client = new InfluxFluxClient(details);
            } catch (RuntimeException e) {
                log.error("Unable to create client for datasource " + details.getName() + ", it will not be available", e);
            }
            datasources.add(new InfluxDatasource(details, client, dataHandlerProperties.getDataLookback(), dataHandlerProperties.getCatalogLookback()));
        }
        return new DatasourceRegistry(datasources);
    }

    @Bean
    public RetrievalCache retrievalCache(CacheProperties cacheProperties) {
        return new RetrievalCache(cacheProperties.isEnabled());
    }

    @Bean
    public OutlierFilter outlierFilter(OutlierProperties outlierProperties) {
        return new StatisticalOutlierFilter(outlierProperties.getZscoreThreshold(), outlierProperties.getMadThreshold());
    }

    @Bean
    public SeriesSynchronizer seriesSynchronizer() {
        return new SeriesSynchronizer();
    }

    @Bean
    public DataRetrievalService dataRetrievalService(DatasourceRegistry datasourceRegistry, RetrievalCache retrievalCache, OutlierFilter outlierFilter,
                    SeriesSynchronizer seriesSynchronizer, DataHandlerProperties dataHandlerProperties) {
        return new DataRetrievalService(datasourceRegistry, retrievalCache, outlierFilter, seriesSynchronizer, dataHandlerProperties);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public Server server(ApplicationContext applicationContext, DataRetrievalService dataRetrievalService, DataHandlerProperties dataHandlerProperties,
                    HttpProperties httpProperties, ServerProperties serverProperties) {
        Server server = new Server(applicationContext, dataRetrievalService, dataHandlerProperties, httpProperties, serverProperties);
        server.start();
        return server;
    }
}
