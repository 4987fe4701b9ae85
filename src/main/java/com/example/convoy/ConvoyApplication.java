package com.example.convoy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.context.ApplicationContext;

import com.example.convoy.config.ConvoyProperties;
import com.example.convoy.feed.FilterDocumentInstaller;
import com.example.convoy.service.AuctionProcessor;

import io.prometheus.client.exporter.HTTPServer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

// Redis and MongoDB clients are built from convoy.* settings, not by Boot
@SpringBootApplication(exclude = { MongoAutoConfiguration.class, RedisAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class })
public class ConvoyApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConvoyApplication.class);

    @Value("${prometheus.server.port:8081}") // Default port for metrics
    private int metricsPort;

    @Autowired
    private AuctionProcessor processor;

    @Autowired
    private FilterDocumentInstaller filterDocumentInstaller;

    @Autowired
    private ConvoyProperties properties;

    @Autowired
    private ApplicationContext context;

    private HTTPServer httpServer;

    public ConvoyApplication() {
    }

    @PostConstruct
    public void init() {
        startHttpServer();
        installFilter();
        if (properties.getFeed().isAutostart()) {
            processor.onFeedFailure(this::exitOnFeedFailure);
            processor.start();
        } else {
            LOGGER.info("Change feed autostart is off");
        }
    }

    public void startHttpServer() {
        try {
            httpServer = new HTTPServer(metricsPort);
            LOGGER.info("Prometheus metrics server started on port {}", metricsPort);
        } catch (Exception e) {
            LOGGER.error("Error starting Prometheus HTTP server: {}", e.getMessage());
        }
    }

    public void installFilter() {
        ConvoyProperties.AuctionTypes types = properties.getAuctionTypes();
        filterDocumentInstaller.install(types.getBasic(), types.getLoki());
    }

    // Closing the context waits for the feed thread, so exit from a thread of its own
    public void exitOnFeedFailure() {
        LOGGER.error("Change feed failed, shutting down");
        Thread exitThread = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)),
                "convoy-exit");
        exitThread.start();
    }

    @PreDestroy
    public void closeConnection() {
        try {
            processor.shutdown();
        } finally {
            if (httpServer != null) {
                httpServer.close();
                LOGGER.info("Prometheus metrics server stopped");
            }
        }
    }

    public static void main(String[] args) {
        SpringApplication.run(ConvoyApplication.class, args);
    }
}
