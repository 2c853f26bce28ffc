package datahandler.common.configuration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

public class ConfigurationTest {

    private AnnotationConfigApplicationContext context;

    @Before
    public void createContext() {
        context = new AnnotationConfigApplicationContext();
    }

    @After
    public void closeContext() {
        context.close();
    }

    @Test
    public void testDefaults() throws Exception {
        context.register(DataHandlerCommonConfiguration.class);
        context.refresh();
        DataHandlerProperties properties = context.getBean(DataHandlerProperties.class);
        assertEquals(Duration.ofDays(30), properties.getDataLookback());
        assertEquals(Duration.ofDays(90), properties.getCatalogLookback());
        assertEquals("1s", properties.getDefaultMaxLag());
        assertFalse(context.getBean(CacheProperties.class).isEnabled());
        assertEquals(Integer.valueOf(5000), context.getBean(HttpProperties.class).getPort());
        assertEquals(3.0, context.getBean(OutlierProperties.class).getZscoreThreshold(), 0.0);
        assertEquals(3.5, context.getBean(OutlierProperties.class).getMadThreshold(), 0.0);
    }

    @Test
    public void testBinding() throws Exception {
        context.register(DataHandlerCommonConfiguration.class);
        // @formatter:off
        TestPropertyValues.of(
                "datahandler.connections-file:/tmp/connections.yml",
                "datahandler.data-lookback:7d",
                "datahandler.catalog-lookback:12h",
                "datahandler.default-max-lag:500ms",
                "datahandler.cache.enabled:true",
                "datahandler.http.ip:127.0.0.1",
                "datahandler.http.port:54322",
                "datahandler.http.worker-threads:2",
                "datahandler.server.shutdown-quiet-period:1",
                "datahandler.outliers.zscore-threshold:2.5").applyTo(this.context);
        // @formatter:on
        context.refresh();
        DataHandlerProperties properties = context.getBean(DataHandlerProperties.class);
        assertEquals("/tmp/connections.yml", properties.getConnectionsFile());
        assertEquals(Duration.ofDays(7), properties.getDataLookback());
        assertEquals(Duration.ofHours(12), properties.getCatalogLookback());
        assertEquals("500ms", properties.getDefaultMaxLag());
        assertTrue(context.getBean(CacheProperties.class).isEnabled());
        assertEquals("127.0.0.1", context.getBean(HttpProperties.class).getIp());
        assertEquals(Integer.valueOf(54322), context.getBean(HttpProperties.class).getPort());
        assertEquals(2, context.getBean(HttpProperties.class).getWorkerThreads());
        assertEquals(1, context.getBean(ServerProperties.class).getShutdownQuietPeriod());
        assertEquals(2.5, context.getBean(OutlierProperties.class).getZscoreThreshold(), 0.0);
    }

    @Test(expected = BeanCreationException.class)
    public void testInvalidWorkerThreads() throws Exception {
        context.register(DataHandlerCommonConfiguration.class);
        TestPropertyValues.of("datahandler.http.worker-threads:0").applyTo(this.context);
        context.refresh();
    }
}
