package com.purchasingpower.designflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.designflow.client.BackoffSleeper;
import com.purchasingpower.designflow.client.FigmaClient;
import com.purchasingpower.designflow.client.FigmaResponseCache;
import com.purchasingpower.designflow.configuration.AppProperties;
import com.purchasingpower.designflow.configuration.FigmaProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the Figma API client: WebClient, response cache, clock and backoff sleeper.
 */
@Configuration
public class FigmaClientConfig {

    /**
     * Whole-file responses routinely exceed WebClient's 256KB default buffer.
     */
    private static final int MAX_RESPONSE_BYTES = 64 * 1024 * 1024;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.threadSleep();
    }

    @Bean
    public WebClient figmaWebClient(WebClient.Builder builder) {
        return builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    @Bean
    public FigmaResponseCache figmaResponseCache(AppProperties appProperties, Clock clock, ObjectMapper objectMapper) {
        FigmaProperties figma = appProperties.getFigma();
        return new FigmaResponseCache(Path.of(figma.getCacheDir()), figma.getCacheTtl(), clock, objectMapper);
    }

    @Bean
    public FigmaClient figmaClient(WebClient figmaWebClient,
                                   AppProperties appProperties,
                                   FigmaResponseCache figmaResponseCache,
                                   BackoffSleeper backoffSleeper,
                                   ObjectMapper objectMapper) {
        return new FigmaClient(figmaWebClient, appProperties.getFigma(), figmaResponseCache, backoffSleeper,
                objectMapper);
    }
}
