package com.example.convoy.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import com.example.convoy.feed.ShutdownSignal;
import com.example.convoy.retry.RetryTemplates;

@Configuration
@EnableConfigurationProperties(ConvoyProperties.class)
public class AppConfig {

        @Bean
        public ShutdownSignal shutdownSignal() {
                return new ShutdownSignal();
        }

        // Classified retries for every upstream call: feed polls and record creation
        @Bean
        public RetryTemplate upstreamRetryTemplate(ConvoyProperties properties) {
                ConvoyProperties.Retry retry = properties.getRetry();
                return RetryTemplates.upstream(retry.getMaxAttempts(), retry.getInitialInterval().toMillis(),
                                retry.getMultiplier(), retry.getMaxInterval().toMillis());
        }
}
