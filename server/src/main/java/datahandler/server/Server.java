package datahandler.server;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;

import datahandler.common.configuration.DataHandlerProperties;
import datahandler.common.configuration.HttpProperties;
import datahandler.common.configuration.ServerProperties;
import datahandler.netty.http.DataHandlerExceptionHandler;
import datahandler.netty.http.HttpNotFoundHandler;
import datahandler.netty.http.HttpRequestDecoder;
import datahandler.server.netty.http.HttpAboutRequestHandler;
import datahandler.server.netty.http.HttpDatasourcesRequestHandler;
import datahandler.server.netty.http.HttpHelpRequestHandler;
import datahandler.server.netty.http.HttpPurgeCacheRequestHandler;
import datahandler.server.netty.http.catalog.HttpAllExperimentIdsRequestHandler;
import datahandler.server.netty.http.catalog.HttpExperimentIdsForMeasurementRequestHandler;
import datahandler.server.netty.http.catalog.HttpMeasurementsForExperimentIdRequestHandler;
import datahandler.server.netty.http.timeseries.HttpDataRequestHandler;
import datahandler.server.store.DataRetrievalService;
import io.netty.bootstrap.AbstractBootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpContentCompressor;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;

/**
 * The HTTP server. Handlers that wait on a datasource run on their own executor group so the I/O threads stay free.
 */
public class Server {

    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private final ApplicationContext applicationContext;
    private final DataRetrievalService service;
    private final DataHandlerProperties dataHandlerProperties;
    private final HttpProperties httpProperties;
    private final ServerProperties serverProperties;

    private EventLoopGroup httpWorkerGroup = null;
    private EventLoopGroup httpBossGroup = null;
    private EventExecutorGroup blockingGroup = null;
    protected Channel httpChannelHandle = null;

    public Server(ApplicationContext applicationContext, DataRetrievalService service, DataHandlerProperties dataHandlerProperties,
                    HttpProperties httpProperties, ServerProperties serverProperties) {
        this.applicationContext = applicationContext;
        this.service = service;
        this.dataHandlerProperties = dataHandlerProperties;
        this.httpProperties = httpProperties;
        this.serverProperties = serverProperties;
    }

    public void start() {
        log.info("Starting {}", this.getClass().getSimpleName());
        try {
            httpBossGroup = new NioEventLoopGroup();
            httpWorkerGroup = new NioEventLoopGroup();
            blockingGroup = new DefaultEventExecutorGroup(httpProperties.getWorkerThreads());

            final ServerBootstrap httpServer = new ServerBootstrap();
            httpServer.group(httpBossGroup, httpWorkerGroup);
            httpServer.channel(NioServerSocketChannel.class);
            httpServer.handler(new LoggingHandler());
            httpServer.childHandler(setupHttpChannelHandler());
            httpServer.option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);
            httpServer.option(ChannelOption.SO_BACKLOG, 128);
            httpServer.childOption(ChannelOption.SO_KEEPALIVE, true);
            final int httpPort = httpProperties.getPort();
            final String httpIp = httpProperties.getIp();
            httpChannelHandle = bind(httpServer, httpIp, httpPort);
            final String httpAddress = ((InetSocketAddress) httpChannelHandle.localAddress()).getAddress().getHostAddress();
            log.info("DataHandlerServer started. Listening on {}:{} for HTTP traffic", httpAddress, httpPort);
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            SpringApplication.exit(applicationContext, () -> 0);
        }
    }

    public void shutdown() {
        if (httpChannelHandle != null) {
            log.info("Closing httpChannelHandle");
            try {
                httpChannelHandle.close().get();
            } catch (final Exception e) {
                log.error("Channel:" + httpChannelHandle.config() + " -> " + e.getMessage(), e);
            }
        }
        int quietPeriod = serverProperties.getShutdownQuietPeriod();
        List<Future<?>> groupFutures = new ArrayList<>();
        if (httpBossGroup != null) {
            log.info("Shutting down httpBossGroup");
            groupFutures.add(httpBossGroup.shutdownGracefully(quietPeriod, 10, TimeUnit.SECONDS));
        }
        if (httpWorkerGroup != null) {
            log.info("Shutting down httpWorkerGroup");
            groupFutures.add(httpWorkerGroup.shutdownGracefully(quietPeriod, 10, TimeUnit.SECONDS));
        }
        if (blockingGroup != null) {
            log.info("Shutting down blockingGroup");
            groupFutures.add(blockingGroup.shutdownGracefully(quietPeriod, 10, TimeUnit.SECONDS));
        }
        groupFutures.forEach(f -> {
            try {
                f.get();
            } catch (final Exception e) {
                log.error("Group:" + f.toString() + " -> " + e.getMessage(), e);
            }
        });
        log.info("{} shut down.", this.getClass().getSimpleName());
    }

    protected void setupHttpSocketChannel(SocketChannel ch) {
        ch.pipeline().addLast("codec", new HttpServerCodec());
        ch.pipeline().addLast("compressor", new HttpContentCompressor());
        ch.pipeline().addLast("aggregator", new HttpObjectAggregator(65536));
        ch.pipeline().addLast("queryDecoder", new HttpRequestDecoder());
        ch.pipeline().addLast("about", new HttpAboutRequestHandler());
        ch.pipeline().addLast("help", new HttpHelpRequestHandler(service, dataHandlerProperties.getDefaultMaxLag()));
        ch.pipeline().addLast("datasources", new HttpDatasourcesRequestHandler(service));
        ch.pipeline().addLast("purgeCache", new HttpPurgeCacheRequestHandler(service));
        ch.pipeline().addLast(blockingGroup, "allExperimentIds", new HttpAllExperimentIdsRequestHandler(service));
        ch.pipeline().addLast(blockingGroup, "experimentIdsForMeasurement", new HttpExperimentIdsForMeasurementRequestHandler(service));
        ch.pipeline().addLast(blockingGroup, "measurementsForExperimentId", new HttpMeasurementsForExperimentIdRequestHandler(service));
        ch.pipeline().addLast(blockingGroup, "data", new HttpDataRequestHandler(service));
        ch.pipeline().addLast("notFound", new HttpNotFoundHandler());
        ch.pipeline().addLast("error", new DataHandlerExceptionHandler());
    }

    protected ChannelHandler setupHttpChannelHandler() {
        return new ChannelInitializer<SocketChannel>() {

            @Override
            protected void initChannel(SocketChannel ch) {
                setupHttpSocketChannel(ch);
            }
        };
    }

    protected Channel bind(AbstractBootstrap<?,?> server, String ip, int port) {
        Channel channel = null;
        long start = System.currentTimeMillis();
        long now = start;
        int attempts = 0;
        while (channel == null && ((now - start) < 30000) && attempts < 10) {
            try {
                log.trace("Binding to port:" + ip + ":" + port + " attempt " + ++attempts);
                channel = server.bind(ip, port).sync().channel();
            } catch (Exception e) {
                log.error(e.getMessage() + " Binding to port:" + ip + ":" + port);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while binding to port:" + ip + ":" + port, ie);
                }
            }
            now = System.currentTimeMillis();
        }
        if (channel == null) {
            throw new IllegalStateException("Failed to bind to port:" + ip + ":" + port);
        }
        log.trace("Successfully bound to port:" + ip + ":" + port + " in " + attempts + " attempts (" + (now - start) + "ms)");
        return channel;
    }
}
