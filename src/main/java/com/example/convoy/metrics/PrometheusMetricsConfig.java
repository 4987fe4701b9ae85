package com.example.convoy.metrics;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.prometheus.client.CollectorRegistry;

@Configuration
public class PrometheusMetricsConfig {

        @Bean
        public CollectorRegistry collectorRegistry() {
                return CollectorRegistry.defaultRegistry;
        }

        @Bean
        public FeedMetrics feedMetrics(CollectorRegistry collectorRegistry) {
                return new FeedMetrics(collectorRegistry);
        }
}
